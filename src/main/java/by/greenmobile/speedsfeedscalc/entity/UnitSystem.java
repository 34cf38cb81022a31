package by.greenmobile.speedsfeedscalc.entity;

/**
 * Units the operator enters values in.
 * METRIC: mm, m/min, mm/tooth. IMPERIAL: inch, ft/min (SFM), inch/tooth.
 */
public enum UnitSystem {
    METRIC,
    IMPERIAL
}
