package by.greenmobile.speedsfeedscalc.entity;

/**
 * Machine stiffness category.
 *
 * @param key    lookup key
 * @param name   display name
 * @param factor derating factor, 1.0 = rigid industrial mill
 */
public record RigidityLevel(String key, String name, double factor) {
}
