package FSAConv.Exceptions;

/**
 * Root of all errors raised by the conversion engine.
 */
public class AutomatonException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = -2739419658315574061L;

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
