package FSAConv.Exceptions;

/**
 * Structurally invalid automaton: dangling state, final state outside the state set,
 * multi-valued deterministic transition and so on.
 */
public class ValidationException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = 1902339781545017203L;

    public ValidationException(String message) {
        super(message);
    }
}
