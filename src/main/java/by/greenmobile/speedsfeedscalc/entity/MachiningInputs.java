package by.greenmobile.speedsfeedscalc.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inputs of one speeds and feeds calculation.
 *
 * Always metric: lengths in mm, surface speed in m/min, kc in N/mm².
 * Conversion from imperial happens before these fields are filled.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MachiningInputs {

    // ===== Tool =====

    /** Tool diameter, mm. */
    private Double diameter;

    /** Number of flutes. */
    private Integer fluteNum;

    /** Unsupported tool length out of the holder, mm. Null means not specified. */
    private Double toolStickout;

    /** Coating key, see {@code machining.coatings}. Optional. */
    private String coating;

    // ===== Cut =====

    /** Axial depth of cut, mm. */
    private Double doc;

    /** Radial width of cut, mm. */
    private Double woc;

    /** Surface speed, m/min. */
    private Double smm;

    /** Nominal feed per tooth, mm. */
    private Double mmpt;

    /** Specific cutting force, N/mm². */
    private Double kc;

    private boolean hsmEnabled;

    private boolean chipThinningEnabled;

    // ===== Machine / material =====

    /** Rigidity level key, see {@code machining.rigidity-levels}. */
    private String rigidityLevel;

    /** Material key, see {@code machining.materials}. Optional. */
    private String materialType;

    /** Spindle capacity, kW. Optional; enables power-vs-capacity warnings. */
    private Double spindlePowerKw;
}
