package by.greenmobile.speedsfeedscalc.service.engine;

import by.greenmobile.speedsfeedscalc.entity.MachiningInputs;
import by.greenmobile.speedsfeedscalc.entity.MachiningOutputs;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.exception.InvalidConfigException;
import by.greenmobile.speedsfeedscalc.exception.InvalidGeometryException;
import by.greenmobile.speedsfeedscalc.exception.InvalidInputException;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Speeds and feeds calculation for one milling setup.
 *
 * The caller fills {@link #getInputs()} (or replaces it), calls {@link #calculate()}
 * and reads {@link #getOutputs()}. Every call derives everything again from the
 * current inputs; nothing is carried over from the previous call.
 *
 * Not thread-safe. Instances come from {@link FeedsAndSpeedsFactory}, one per calculation context.
 *
 * Units: mm, m/min, mm/min, N/mm², kW, N·m.
 */
@Slf4j
public class FeedsAndSpeeds {

    private final ChipThinningModel chipThinning;
    private final CuttingPowerModel power;
    private final RigidityAdvisor rigidity;
    private final MaterialAdvisor material;

    @Getter
    @Setter
    private MachiningInputs inputs = new MachiningInputs();

    /** Null until calculate() succeeds, reset when it fails. */
    @Getter
    private MachiningOutputs outputs;

    public FeedsAndSpeeds(ChipThinningModel chipThinning,
                          CuttingPowerModel power,
                          RigidityAdvisor rigidity,
                          MaterialAdvisor material) {
        this.chipThinning = chipThinning;
        this.power = power;
        this.rigidity = rigidity;
        this.material = material;
    }

    /**
     * Runs the calculation.
     *
     * @return advisory warnings in the order they were found, possibly empty
     * @throws InvalidInputException    a required value is missing, non-finite or out of range
     * @throws InvalidGeometryException width of cut is larger than the tool
     */
    public List<String> calculate() {
        outputs = null;

        MachiningInputs in = inputs;
        if (in == null) {
            throw InvalidInputException.missing("inputs");
        }

        double diameter = positive("diameter", in.getDiameter());
        int flutes = flutes(in.getFluteNum());
        double doc = nonNegative("doc", in.getDoc());
        double woc = nonNegative("woc", in.getWoc());
        double smm = positive("smm", in.getSmm());
        double mmpt = positive("mmpt", in.getMmpt());
        double kc = positive("kc", in.getKc());
        double stickout = in.getToolStickout() == null ? 0.0 : nonNegative("toolStickout", in.getToolStickout());

        if (woc > diameter) {
            throw new InvalidGeometryException(String.format(Locale.US,
                    "Width of cut %.3f mm is larger than tool diameter %.3f mm", woc, diameter));
        }

        List<String> warnings = new ArrayList<>();

        // 1) spindle speed
        double rpm = (smm * 1000.0) / (Math.PI * diameter);
        if (!Double.isFinite(rpm)) {
            throw new InvalidInputException("diameter",
                    "diameter " + diameter + " mm is too small to give a finite spindle speed");
        }

        // 2) chip thinning
        double engagement = woc / diameter;
        double thinningComp = 1.0;
        boolean thinEngagement = engagement < ChipThinningModel.FULL_ENGAGEMENT_RATIO;

        if (in.isChipThinningEnabled() && thinEngagement) {
            if (in.isHsmEnabled()) {
                thinningComp = chipThinning.compensation(engagement);
                if (chipThinning.isCapped(engagement)) {
                    warnings.add(String.format(Locale.US,
                            "Radial engagement %.1f%% is too low for full chip thinning compensation; feed per tooth capped at %.1fx",
                            engagement * 100.0, chipThinning.getMaxCompensation()));
                }
            } else {
                warnings.add(String.format(Locale.US,
                        "Reduced radial engagement (%.0f%% of diameter) produces thin chips (%.0f%% of nominal); enable HSM to compensate feed per tooth",
                        engagement * 100.0, chipThinning.thinningFactor(engagement) * 100.0));
            }
        }
        if (in.isHsmEnabled() && !thinEngagement) {
            warnings.add(String.format(Locale.US,
                    "HSM toolpaths expect low radial engagement; width of cut is %.0f%% of diameter",
                    engagement * 100.0));
        }

        double effectiveMmpt = mmpt * thinningComp;
        // actual maximum chip thickness at this engagement
        double chipThickness = effectiveMmpt * chipThinning.thinningFactor(engagement);

        // 3) feed
        double feed = rpm * flutes * effectiveMmpt;

        // 4) MRR
        double mrr = doc * woc * feed;

        // 5) power / torque
        double cuttingKw = power.cuttingPowerKw(mrr, kc);
        double spindleKw = power.spindlePowerKw(cuttingKw);
        double torque = power.torqueNm(cuttingKw, rpm);
        warnings.addAll(power.capacityWarnings(spindleKw, in.getSpindlePowerKw()));

        // 6) rigidity
        RigidityLevel level = null;
        try {
            level = rigidity.resolve(in.getRigidityLevel());
            warnings.addAll(rigidity.check(level, diameter, doc, woc, mmpt, in.isHsmEnabled()));
        } catch (InvalidConfigException e) {
            log.warn("Rigidity checks skipped: {}", e.getMessage());
            warnings.add(e.getMessage() + "; rigidity checks skipped");
        }
        warnings.addAll(rigidity.checkStickout(stickout, diameter, in.isHsmEnabled()));

        // 7) material
        Optional<MaterialRecord> mat = material.resolve(in.getMaterialType());
        if (mat.isPresent()) {
            warnings.addAll(material.check(mat.get(), in.getCoating(), smm, chipThickness, kc, level));
        }

        List<String> result = List.copyOf(warnings);
        outputs = MachiningOutputs.builder()
                .rpm(rpm)
                .feed(feed)
                .effectiveChipLoad(effectiveMmpt)
                .chipThinningFactor(thinningComp)
                .materialRemovalRate(mrr)
                .cuttingPowerKw(cuttingKw)
                .spindlePowerKw(spindleKw)
                .torqueNm(torque)
                .warnings(result)
                .build();

        log.debug("Calculated: D={} z={} smm={} fz={} -> rpm={}, fz_eff={} (x{}), feed={}, MRR={}, P={} kW, M={} N·m, warnings={}",
                diameter, flutes, smm, mmpt, rpm, effectiveMmpt, thinningComp, feed, mrr, spindleKw, torque, result.size());

        return result;
    }

    public double getRpm() {
        return requireOutputs().getRpm();
    }

    public double getFeed() {
        return requireOutputs().getFeed();
    }

    private MachiningOutputs requireOutputs() {
        if (outputs == null) {
            throw new IllegalStateException("No outputs: calculate() has not completed successfully");
        }
        return outputs;
    }

    // ===== input checks =====

    private static double positive(String field, Double value) {
        if (value == null) {
            throw InvalidInputException.missing(field);
        }
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidInputException(field, field + " must be a positive number, got " + value);
        }
        return value;
    }

    private static double nonNegative(String field, Double value) {
        if (value == null) {
            throw InvalidInputException.missing(field);
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidInputException(field, field + " must be zero or positive, got " + value);
        }
        return value;
    }

    private static int flutes(Integer value) {
        if (value == null) {
            throw InvalidInputException.missing("fluteNum");
        }
        if (value < 1) {
            throw new InvalidInputException("fluteNum", "fluteNum must be at least 1, got " + value);
        }
        return value;
    }
}
