package FSAConv.Exceptions;

/**
 * A cache entry does not hold what its fingerprint promises.
 */
public class CacheException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = 3386702190554712788L;

    public CacheException(String message) {
        super(message);
    }
}
