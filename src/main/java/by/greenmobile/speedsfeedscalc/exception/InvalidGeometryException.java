package by.greenmobile.speedsfeedscalc.exception;

/**
 * Thrown when inputs are individually valid but describe an impossible cut,
 * e.g. a radial engagement wider than the tool.
 */
public class InvalidGeometryException extends MachiningException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    @Override
    public String getSubject() {
        return "geometry";
    }
}
