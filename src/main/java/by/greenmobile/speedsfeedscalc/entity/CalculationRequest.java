package by.greenmobile.speedsfeedscalc.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the operator entered, in the operator's units.
 *
 * Lengths are mm or inch, surface speed m/min or SFM and chip load mm or inch
 * depending on {@link #unitSystem}. kc is always N/mm².
 * Empty kc / surfaceSpeed / feedPerTooth are filled from the selected material.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationRequest {

    @Builder.Default
    private UnitSystem unitSystem = UnitSystem.METRIC;

    // ===== Tool =====

    private Double diameter;

    private Integer fluteNum;

    private Double toolStickout;

    private String coating;

    // ===== Material =====

    private String materialKey;

    // ===== Cut =====

    private Double doc;

    private Double woc;

    private Double surfaceSpeed;

    private Double feedPerTooth;

    private Double kc;

    private boolean hsmEnabled;

    private boolean chipThinningEnabled;

    // ===== Machine =====

    private String rigidityLevel;

    private Double minRpm;

    private Double preferredRpm;

    private Double maxRpm;

    /** Spindle capacity, kW. */
    private Double spindlePowerKw;

    public boolean isMetric() {
        return unitSystem == null || unitSystem == UnitSystem.METRIC;
    }
}
