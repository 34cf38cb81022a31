package by.greenmobile.speedsfeedscalc.exception;

/**
 * Thrown when a required lookup table entry (rigidity level) is not configured.
 */
public class InvalidConfigException extends MachiningException {

    private final String key;

    public InvalidConfigException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String getSubject() {
        return key;
    }
}
