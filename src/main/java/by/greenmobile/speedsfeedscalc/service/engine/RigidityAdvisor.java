package by.greenmobile.speedsfeedscalc.service.engine;

import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.service.lookup.RigidityLookup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Machine stiffness checks.
 *
 * A rigid mill (factor 1.0) is allowed DOC up to docRatio·D (hsmDocRatio·D with
 * HSM), WOC up to wocRatio·D and a chip load of chipLoadRatio·D. Softer machines
 * get the same limits scaled by their factor. Only warns, never clamps.
 */
@Component
public class RigidityAdvisor {

    private final RigidityLookup rigidityLookup;

    private final double docRatio;
    private final double hsmDocRatio;
    private final double wocRatio;
    private final double chipLoadRatio;

    private final double maxStickoutRatio;
    private final double hsmStickoutRatio;

    public RigidityAdvisor(RigidityLookup rigidityLookup,
                           @Value("${machining.rigidity.doc-ratio:1.0}") double docRatio,
                           @Value("${machining.rigidity.hsm-doc-ratio:2.0}") double hsmDocRatio,
                           @Value("${machining.rigidity.woc-ratio:1.0}") double wocRatio,
                           @Value("${machining.rigidity.chip-load-ratio:0.015}") double chipLoadRatio,
                           @Value("${machining.stickout.max-ratio:4.0}") double maxStickoutRatio,
                           @Value("${machining.stickout.hsm-max-ratio:3.0}") double hsmStickoutRatio) {
        this.rigidityLookup = rigidityLookup;
        this.docRatio = docRatio;
        this.hsmDocRatio = hsmDocRatio;
        this.wocRatio = wocRatio;
        this.chipLoadRatio = chipLoadRatio;
        this.maxStickoutRatio = maxStickoutRatio;
        this.hsmStickoutRatio = hsmStickoutRatio;
    }

    /** Throws InvalidConfigException when the level is not in the table. */
    public RigidityLevel resolve(String key) {
        return rigidityLookup.require(key);
    }

    /**
     * Compares the nominal (not chip-thinning compensated) cut against what the
     * machine permits.
     */
    public List<String> check(RigidityLevel level, double diameter, double doc, double woc,
                              double chipLoad, boolean hsm) {
        List<String> warnings = new ArrayList<>();
        double f = level.factor();

        double maxDoc = (hsm ? hsmDocRatio : docRatio) * diameter * f;
        if (doc > maxDoc) {
            warnings.add(String.format(Locale.US,
                    "%s machine: depth of cut %.2f mm exceeds the recommended %.2f mm",
                    level.name(), doc, maxDoc));
        }

        double maxWoc = wocRatio * diameter * f;
        if (woc > maxWoc) {
            warnings.add(String.format(Locale.US,
                    "%s machine: width of cut %.2f mm exceeds the recommended %.2f mm",
                    level.name(), woc, maxWoc));
        }

        double maxChipLoad = chipLoadRatio * diameter * f;
        if (chipLoad > maxChipLoad) {
            warnings.add(String.format(Locale.US,
                    "%s machine: feed per tooth %.4f mm exceeds the recommended %.4f mm",
                    level.name(), chipLoad, maxChipLoad));
        }
        return warnings;
    }

    public List<String> checkStickout(double stickout, double diameter, boolean hsm) {
        List<String> warnings = new ArrayList<>();
        if (stickout <= 0 || diameter <= 0) {
            return warnings;
        }
        double ratio = stickout / diameter;
        if (ratio > maxStickoutRatio) {
            warnings.add(String.format(Locale.US,
                    "Tool stickout %.1fxD is long; expect deflection and chatter, reduce speed or use a shorter tool",
                    ratio));
        } else if (hsm && ratio > hsmStickoutRatio) {
            warnings.add(String.format(Locale.US,
                    "Tool stickout %.1fxD with HSM: high spindle speed on a long tool may chatter",
                    ratio));
        }
        return warnings;
    }
}
