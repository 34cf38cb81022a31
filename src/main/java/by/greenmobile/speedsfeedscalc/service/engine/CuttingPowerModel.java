package by.greenmobile.speedsfeedscalc.service.engine;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cutting power and torque from the specific cutting force.
 *
 *   Pc [kW] = MRR [mm³/min] * kc [N/mm²] / 60e6
 *   P_spindle = Pc / efficiency
 *   M [N·m] = Pc [W] / omega,  omega = 2·pi·n / 60
 */
@Component
public class CuttingPowerModel {

    /** N·mm/min -> kW */
    private static final double MM3_N_PER_MIN_TO_KW = 60_000_000.0;

    private final double spindleEfficiency;
    private final double capacityWarnFraction;

    public CuttingPowerModel(@Value("${machining.power.spindle-efficiency:0.8}") double spindleEfficiency,
                             @Value("${machining.power.capacity-warn-fraction:0.8}") double capacityWarnFraction) {
        if (!(spindleEfficiency > 0 && spindleEfficiency <= 1.0)) {
            throw new IllegalArgumentException("machining.power.spindle-efficiency must be in (0, 1], got " + spindleEfficiency);
        }
        this.spindleEfficiency = spindleEfficiency;
        this.capacityWarnFraction = capacityWarnFraction;
    }

    public double cuttingPowerKw(double materialRemovalRate, double kc) {
        return materialRemovalRate * kc / MM3_N_PER_MIN_TO_KW;
    }

    public double spindlePowerKw(double cuttingPowerKw) {
        return cuttingPowerKw / spindleEfficiency;
    }

    public double torqueNm(double cuttingPowerKw, double rpm) {
        if (rpm <= 0) return 0.0;
        double omega = 2.0 * Math.PI * rpm / 60.0;
        return cuttingPowerKw * 1000.0 / omega;
    }

    /**
     * Warnings for the required spindle power against the machine's rating.
     * Nothing is checked when the capacity is unknown.
     */
    public List<String> capacityWarnings(double requiredKw, Double capacityKw) {
        List<String> warnings = new ArrayList<>();
        if (capacityKw == null || !(capacityKw > 0)) {
            return warnings;
        }
        if (requiredKw > capacityKw) {
            warnings.add(String.format(Locale.US,
                    "Required spindle power %.2f kW exceeds machine capacity %.2f kW; reduce depth or width of cut",
                    requiredKw, capacityKw));
        } else if (requiredKw > capacityKw * capacityWarnFraction) {
            warnings.add(String.format(Locale.US,
                    "Required spindle power %.2f kW is above %.0f%% of machine capacity %.2f kW",
                    requiredKw, capacityWarnFraction * 100.0, capacityKw));
        }
        return warnings;
    }

    public double getSpindleEfficiency() {
        return spindleEfficiency;
    }
}
