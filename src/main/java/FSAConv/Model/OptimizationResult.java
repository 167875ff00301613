package FSAConv.Model;

import java.util.List;

/**
 * Output of a single optimization step.
 *
 * @param automaton the new automaton
 * @param changes transition edits, in terms of the input automaton's states
 * @param stateMapping for each input state, its state in {@code automaton}, or -1 if it was removed
 * @param <A> automaton type
 * @param <I> input symbol type
 */
public record OptimizationResult<A, I>(A automaton, List<TransitionChange<I>> changes, int[] stateMapping) {

    public OptimizationResult {
        changes = List.copyOf(changes);
    }

    public boolean isUnchanged() {
        if (!changes.isEmpty()) {
            return false;
        }
        for (int i = 0; i < stateMapping.length; i++) {
            if (stateMapping[i] != i) {
                return false;
            }
        }
        return true;
    }

    public int removedStates() {
        int removed = 0;
        for (int target : stateMapping) {
            if (target < 0) {
                removed++;
            }
        }
        return removed;
    }
}
