package by.greenmobile.speedsfeedscalc.exception;

/**
 * Base type for conditions that abort a machining calculation.
 * Out-of-envelope but computable parameters are warnings, never exceptions.
 */
public abstract class MachiningException extends RuntimeException {

    protected MachiningException(String message) {
        super(message);
    }

    /**
     * What the failure is about: the offending input field, the missing lookup key,
     * or {@code "geometry"} for an impossible cut.
     */
    public abstract String getSubject();
}
