package astbridge.serialize;

/**
 * A PIR document that does not follow the wire format.
 */
public class PirFormatException extends RuntimeException {

    public PirFormatException(String message) {
        super(message);
    }

    public PirFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
