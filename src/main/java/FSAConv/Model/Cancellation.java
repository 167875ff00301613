package FSAConv.Model;

import java.time.Duration;

import FSAConv.Exceptions.ConversionTimeoutException;
import FSAConv.Exceptions.StateLimitExceededException;

/**
 * Guards a single operation against state blow-up and wall-clock overrun.
 * Algorithms poll it from their main loops; nothing runs in the background.
 */
public class Cancellation {

    private final int stateThreshold;
    private final long deadlineNanos;
    private final Duration timeout;

    private boolean interrupted;

    public Cancellation() {
        this(Integer.MAX_VALUE, null);
    }

    public Cancellation(int stateThreshold, Duration timeout) {
        this.stateThreshold = stateThreshold;
        this.timeout = timeout;
        this.deadlineNanos = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
    }

    public static Cancellation none() {
        return new Cancellation();
    }

    public boolean isInterrupted() {
        if (!interrupted && deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0) {
            interrupted = true;
        }
        return interrupted;
    }

    public boolean isAboveThreshold(int states) {
        return states > stateThreshold;
    }

    /**
     * Throws if the deadline has passed.
     * @param operation - name used in the error message
     */
    public void checkDeadline(String operation) {
        if (isInterrupted()) {
            throw new ConversionTimeoutException(operation, timeout);
        }
    }

    /**
     * Throws if the state count went over the threshold.
     * @param operation - name used in the error message
     * @param states - current number of constructed states
     */
    public void checkStates(String operation, int states) {
        if (isAboveThreshold(states)) {
            throw new StateLimitExceededException(operation, stateThreshold, states);
        }
    }
}
