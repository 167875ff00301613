package FSAConv.Exceptions;

/**
 * The two automata cannot be compared, e.g. their alphabets differ under strict comparison.
 */
public class EquivalenceCheckException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = -1474805417963391082L;

    public EquivalenceCheckException(String message) {
        super(message);
    }
}
