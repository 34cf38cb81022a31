package by.greenmobile.speedsfeedscalc.entity;

/**
 * One row of the material table.
 *
 * @param key               lookup key
 * @param name              display name
 * @param kc                specific cutting force, N/mm²
 * @param sfm               recommended surface speed, ft/min
 * @param smm               recommended surface speed, m/min
 * @param chipLoadMm        recommended feed per tooth, mm
 * @param minRigidityFactor lowest machine rigidity factor suited to the material, 0 = any
 */
public record MaterialRecord(
        String key,
        String name,
        double kc,
        double sfm,
        double smm,
        double chipLoadMm,
        double minRigidityFactor
) {
}
