package by.greenmobile.speedsfeedscalc.exception;

/**
 * Thrown when a numeric input is missing, non-finite, zero or negative
 * where a positive finite value is required.
 */
public class InvalidInputException extends MachiningException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    public static InvalidInputException missing(String field) {
        return new InvalidInputException(field, field + " is required");
    }

    public String getField() {
        return field;
    }

    @Override
    public String getSubject() {
        return field;
    }
}
