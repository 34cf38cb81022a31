package by.greenmobile.speedsfeedscalc.service;

import by.greenmobile.speedsfeedscalc.entity.RpmClassification;
import by.greenmobile.speedsfeedscalc.entity.RpmStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Classifies a spindle speed against machine limits for the dashboard.
 *
 * The order of the checks matters: the "good", "approaching maximum" and
 * "near minimum" bands can overlap and the first match wins.
 */
@Component
public class RpmStatusClassifier {

    private static final double PREFERRED_TOLERANCE = 0.10;
    private static final double MAX_WARNING_FRACTION = 0.90;
    private static final double MIN_WARNING_FRACTION = 1.10;

    public RpmClassification classify(double rpm, double minRpm, double preferredRpm, double maxRpm) {
        // outside machine limits
        if (rpm < minRpm) {
            return new RpmClassification(RpmStatus.DANGER, "below minimum (" + rpmText(minRpm) + " RPM)");
        }
        if (rpm > maxRpm) {
            return new RpmClassification(RpmStatus.DANGER, "above maximum (" + rpmText(maxRpm) + " RPM)");
        }

        // close to preferred
        if (Math.abs(rpm - preferredRpm) <= preferredRpm * PREFERRED_TOLERANCE) {
            return new RpmClassification(RpmStatus.GOOD, "near preferred (" + rpmText(preferredRpm) + " RPM)");
        }

        // approaching limits
        if (rpm > maxRpm * MAX_WARNING_FRACTION) {
            return new RpmClassification(RpmStatus.WARNING, "approaching maximum");
        }
        if (rpm < minRpm * MIN_WARNING_FRACTION) {
            return new RpmClassification(RpmStatus.WARNING, "near minimum");
        }
        return new RpmClassification(RpmStatus.INFO, "within safe range");
    }

    private static String rpmText(double rpm) {
        return String.format(Locale.US, "%,.0f", rpm);
    }
}
