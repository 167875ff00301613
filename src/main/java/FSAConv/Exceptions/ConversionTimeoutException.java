package FSAConv.Exceptions;

import java.time.Duration;

public class ConversionTimeoutException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = 7352260181086937514L;

    private final transient Duration timeout;

    public ConversionTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + (timeout == null ? "?" : timeout.toMillis() + "ms"));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
