package FSAConv.Cache;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Timing and size counters per operation. Not thread-safe; see {@link ConversionCache}.
 */
public class ConversionStatistics {

    private final Map<String, Counter> perOperation = new TreeMap<>();

    /**
     * @param operation - operation name
     * @param durationNanos - wall-clock time of the computation
     * @param states - number of states of the result
     * @param transitions - number of transitions of the result
     */
    public void record(String operation, long durationNanos, int states, int transitions) {
        perOperation.computeIfAbsent(operation, k -> new Counter()).add(durationNanos, states, transitions);
    }

    public void clear() {
        perOperation.clear();
    }

    public Summary summary() {
        final Map<String, OperationSummary> operations = new TreeMap<>();
        long count = 0;
        long total = 0;
        for (Map.Entry<String, Counter> e : perOperation.entrySet()) {
            final Counter c = e.getValue();
            operations.put(e.getKey(), c.snapshot(e.getKey()));
            count += c.count;
            total += c.totalNanos;
        }
        return new Summary(count, total, Collections.unmodifiableMap(operations));
    }

    /**
     * @param count recorded operations
     * @param totalNanos sum of their durations
     * @param operations breakdown keyed by operation name, sorted
     */
    public record Summary(long count, long totalNanos, Map<String, OperationSummary> operations) {
        public double averageNanos() {
            return count == 0 ? 0.0 : (double) totalNanos / count;
        }
    }

    public record OperationSummary(String operation, long count, long totalNanos, long minNanos, long maxNanos,
                                   long totalStates, long totalTransitions) {
        public double averageNanos() {
            return count == 0 ? 0.0 : (double) totalNanos / count;
        }
    }

    private static final class Counter {
        long count;
        long totalNanos;
        long minNanos = Long.MAX_VALUE;
        long maxNanos;
        long states;
        long transitions;

        void add(long nanos, int resultStates, int resultTransitions) {
            count++;
            totalNanos += nanos;
            minNanos = Math.min(minNanos, nanos);
            maxNanos = Math.max(maxNanos, nanos);
            states += resultStates;
            transitions += resultTransitions;
        }

        OperationSummary snapshot(String operation) {
            return new OperationSummary(operation, count, totalNanos, minNanos, maxNanos, states, transitions);
        }
    }
}
