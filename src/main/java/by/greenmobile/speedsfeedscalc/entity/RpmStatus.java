package by.greenmobile.speedsfeedscalc.entity;

import java.util.Locale;

public enum RpmStatus {
    DANGER,
    WARNING,
    GOOD,
    INFO;

    /** CSS class used by the result page. */
    public String cssClass() {
        return name().toLowerCase(Locale.ROOT);
    }
}
