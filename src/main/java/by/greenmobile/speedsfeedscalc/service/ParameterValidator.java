package by.greenmobile.speedsfeedscalc.service;

import by.greenmobile.speedsfeedscalc.exception.InvalidInputException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sanity bounds on computed spindle speed and feed and on the cut geometry.
 *
 * Independent of the calculation engine: it only sees the numbers. Any finite
 * value is checkable and produces warnings at worst; only NaN and infinities
 * are rejected.
 */
@Component
public class ParameterValidator {

    private final double minEngagementRatio;
    private final double fullSlotRatio;
    private final double slotDocRatio;
    private final double maxDocRatio;
    private final double maxFeedPerRevRatio;
    private final double maxFeed;
    private final double maxRpm;

    public ParameterValidator(@Value("${machining.validation.min-engagement-ratio:0.02}") double minEngagementRatio,
                              @Value("${machining.validation.full-slot-ratio:0.95}") double fullSlotRatio,
                              @Value("${machining.validation.slot-doc-ratio:1.0}") double slotDocRatio,
                              @Value("${machining.validation.max-doc-ratio:3.0}") double maxDocRatio,
                              @Value("${machining.validation.max-feed-per-rev-ratio:0.2}") double maxFeedPerRevRatio,
                              @Value("${machining.validation.max-feed:25000}") double maxFeed,
                              @Value("${machining.validation.max-rpm:60000}") double maxRpm) {
        this.minEngagementRatio = minEngagementRatio;
        this.fullSlotRatio = fullSlotRatio;
        this.slotDocRatio = slotDocRatio;
        this.maxDocRatio = maxDocRatio;
        this.maxFeedPerRevRatio = maxFeedPerRevRatio;
        this.maxFeed = maxFeed;
        this.maxRpm = maxRpm;
    }

    /**
     * @param rpm      spindle speed, rev/min
     * @param feed     feed, mm/min
     * @param doc      axial depth of cut, mm
     * @param woc      radial width of cut, mm
     * @param diameter tool diameter, mm
     * @return warnings, empty when every check passes
     */
    public List<String> validate(double rpm, double feed, double doc, double woc, double diameter) {
        finite("rpm", rpm);
        finite("feed", feed);
        finite("doc", doc);
        finite("woc", woc);
        finite("diameter", diameter);

        List<String> warnings = new ArrayList<>();

        if (diameter <= 0) {
            warnings.add(String.format(Locale.US, "Tool diameter %.3f mm is not a usable size", diameter));
        }
        if (rpm <= 0) {
            warnings.add(String.format(Locale.US, "Spindle speed %.0f RPM: the spindle is not turning", rpm));
        } else if (rpm > maxRpm) {
            warnings.add(String.format(Locale.US,
                    "Spindle speed %.0f RPM is beyond typical spindle capability (%.0f RPM)", rpm, maxRpm));
        }
        if (feed <= 0) {
            warnings.add(String.format(Locale.US, "Feed %.1f mm/min: the tool is not advancing", feed));
        } else if (feed > maxFeed) {
            warnings.add(String.format(Locale.US,
                    "Feed %.0f mm/min exceeds typical machine capability (%.0f mm/min)", feed, maxFeed));
        }

        if (diameter > 0) {
            double engagement = woc / diameter;
            if (woc <= 0) {
                warnings.add("Width of cut is zero; no material will be removed");
            } else if (engagement < minEngagementRatio) {
                warnings.add(String.format(Locale.US,
                        "Width of cut %.3f mm is near zero (%.1f%% of diameter); the tool will rub instead of cut",
                        woc, engagement * 100.0));
            } else if (engagement >= fullSlotRatio) {
                warnings.add(String.format(Locale.US,
                        "Full slotting (width of cut %.2f mm ~ tool diameter); watch chip evacuation and heat", woc));
                if (doc > slotDocRatio * diameter) {
                    warnings.add(String.format(Locale.US,
                            "Slotting deeper than %.1fxD (%.2f mm); use several axial passes", slotDocRatio, doc));
                }
            }

            if (doc <= 0) {
                warnings.add("Depth of cut is zero; no material will be removed");
            } else if (doc > maxDocRatio * diameter) {
                warnings.add(String.format(Locale.US,
                        "Depth of cut %.2f mm exceeds %.1fxD; high risk of tool deflection", doc, maxDocRatio));
            }

            if (rpm > 0 && feed > 0) {
                double feedPerRev = feed / rpm;
                if (feedPerRev > maxFeedPerRevRatio * diameter) {
                    warnings.add(String.format(Locale.US,
                            "Feed of %.3f mm/rev is implausibly high for a %.2f mm tool", feedPerRev, diameter));
                }
            }
        }

        return warnings;
    }

    private static void finite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(field, field + " must be a finite number, got " + value);
        }
    }
}
