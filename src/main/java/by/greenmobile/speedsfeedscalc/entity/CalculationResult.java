package by.greenmobile.speedsfeedscalc.entity;

import by.greenmobile.speedsfeedscalc.service.engine.Units;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the result page, the JSON API and the PDF report show for one calculation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationResult {

    /** Request as entered (after material defaults were applied). */
    private CalculationRequest request;

    /** Metric inputs the engine ran on. */
    private MachiningInputs inputs;

    private MachiningOutputs outputs;

    /** Engine warnings followed by validator warnings. Never truncated. */
    private List<String> warnings;

    private RpmClassification rpmStatus;

    private MachineLimits machineLimits;

    /** Selected material, null when none selected or unknown. */
    private MaterialRecord material;

    /** Display name of the rigidity level, the raw key when it is not configured. */
    private String rigidityName;

    /** Spindle power needed as % of capacity, null when capacity is unknown. */
    private Double spindleLoadPercent;

    public double getFeedInchesPerMinute() {
        return outputs == null ? 0.0 : outputs.getFeed() * Units.MM_TO_IN;
    }

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }

    /** First {@code max} warnings, for compact display. */
    public List<String> firstWarnings(int max) {
        if (warnings == null) return List.of();
        return warnings.subList(0, Math.min(Math.max(0, max), warnings.size()));
    }
}
