package by.greenmobile.speedsfeedscalc.service.engine;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Radial chip thinning.
 *
 * With radial engagement r = woc / D below 0.5 the cutting edge leaves the
 * material before reaching full chip thickness. The maximum chip thickness is
 * fz * RCTF with
 *
 *   RCTF = sqrt(1 - (1 - 2r)^2)
 *
 * so the commanded feed per tooth has to be divided by RCTF to keep the same
 * tool load. RCTF goes to 0 with r, the compensation is capped.
 */
@Component
public class ChipThinningModel {

    /** At and above this engagement ratio there is no thinning. */
    public static final double FULL_ENGAGEMENT_RATIO = 0.5;

    private final double maxCompensation;

    public ChipThinningModel(@Value("${machining.chip-thinning.max-compensation:5.0}") double maxCompensation) {
        if (!(maxCompensation > 1.0)) {
            throw new IllegalArgumentException("machining.chip-thinning.max-compensation must be > 1, got " + maxCompensation);
        }
        this.maxCompensation = maxCompensation;
    }

    /**
     * Radial chip thinning factor (actual / nominal chip thickness), in [0, 1].
     */
    public double thinningFactor(double engagementRatio) {
        if (engagementRatio >= FULL_ENGAGEMENT_RATIO) return 1.0;
        if (engagementRatio <= 0.0) return 0.0;
        double k = 1.0 - 2.0 * engagementRatio;
        return Math.sqrt(1.0 - k * k);
    }

    /**
     * Multiplier for the nominal feed per tooth, in [1, maxCompensation].
     */
    public double compensation(double engagementRatio) {
        double rctf = thinningFactor(engagementRatio);
        if (rctf >= 1.0) return 1.0;
        if (rctf <= 0.0) return maxCompensation;
        return Math.min(1.0 / rctf, maxCompensation);
    }

    /** True when the full compensation would exceed the configured cap. */
    public boolean isCapped(double engagementRatio) {
        if (engagementRatio >= FULL_ENGAGEMENT_RATIO) return false;
        double rctf = thinningFactor(engagementRatio);
        return rctf <= 0.0 || 1.0 / rctf > maxCompensation;
    }

    public double getMaxCompensation() {
        return maxCompensation;
    }
}
