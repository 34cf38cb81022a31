package by.greenmobile.speedsfeedscalc.entity;

/**
 * Spindle limits of the machine the parameters are meant for.
 *
 * @param minRpm         lowest usable spindle speed
 * @param preferredRpm   sweet spot of the spindle
 * @param maxRpm         highest spindle speed
 * @param spindlePowerKw rated spindle power, kW (0 = unknown)
 */
public record MachineLimits(double minRpm, double preferredRpm, double maxRpm, double spindlePowerKw) {
}
