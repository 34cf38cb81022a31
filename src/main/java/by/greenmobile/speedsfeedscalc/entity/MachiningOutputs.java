package by.greenmobile.speedsfeedscalc.entity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one engine run. Built fresh on every calculation.
 */
@Value
@Builder
public class MachiningOutputs {

    /** Spindle speed, rev/min. */
    double rpm;

    /** Linear feed, mm/min. */
    double feed;

    /** Commanded feed per tooth after chip thinning compensation, mm. */
    double effectiveChipLoad;

    /** effectiveChipLoad / nominal chip load, 1.0 when no compensation applied. */
    double chipThinningFactor;

    /** Material removal rate, mm³/min. */
    double materialRemovalRate;

    /** Power at the cutting edge, kW. */
    double cuttingPowerKw;

    /** Power the spindle motor has to deliver, kW. */
    double spindlePowerKw;

    /** Torque at the cutter, N·m. */
    double torqueNm;

    List<String> warnings;

    /** MRR in cm³/min, the unit most spindle charts use. */
    public double getMaterialRemovalRateCm3() {
        return materialRemovalRate / 1000.0;
    }
}
