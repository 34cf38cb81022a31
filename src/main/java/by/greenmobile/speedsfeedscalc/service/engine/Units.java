package by.greenmobile.speedsfeedscalc.service.engine;

/**
 * Unit conversion factors. The engine itself is metric only.
 */
public final class Units {

    /** feet -> meters, used for SFM -> SMM. */
    public static final double FT_TO_M = 0.3048;

    public static final double M_TO_FT = 1.0 / FT_TO_M;

    public static final double IN_TO_MM = 25.4;

    /** millimeters -> inches, used for chip load and feed display. */
    public static final double MM_TO_IN = 1.0 / IN_TO_MM;

    private Units() {
    }

    public static double sfmToSmm(double sfm) {
        return sfm * FT_TO_M;
    }

    public static double inchToMm(double inches) {
        return inches * IN_TO_MM;
    }
}
