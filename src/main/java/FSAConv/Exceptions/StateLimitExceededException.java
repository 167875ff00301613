package FSAConv.Exceptions;

public class StateLimitExceededException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = -6612430911298004275L;

    private final int limit;

    public StateLimitExceededException(String operation, int limit, int reached) {
        super(operation + " exceeded the state limit of " + limit + " (reached " + reached + ")");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
