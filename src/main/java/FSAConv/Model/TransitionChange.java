package FSAConv.Model;

/**
 * One edit made to the transition relation by an optimization step.
 * States are indices of the automaton the step was applied to; a {@code null}
 * destination means the transition is absent on that side.
 *
 * @param state source state
 * @param symbol input symbol
 * @param previous destination before the step, or null
 * @param next destination after the step, or null
 * @param <I> input symbol type
 */
public record TransitionChange<I>(int state, I symbol, Integer previous, Integer next) {

    public TransitionChange {
        if (previous == null && next == null) {
            throw new IllegalArgumentException("A transition change needs at least one destination");
        }
    }

    public static <I> TransitionChange<I> removal(int state, I symbol, int previous) {
        return new TransitionChange<>(state, symbol, previous, null);
    }

    public static <I> TransitionChange<I> addition(int state, I symbol, int next) {
        return new TransitionChange<>(state, symbol, null, next);
    }

    public static <I> TransitionChange<I> modification(int state, I symbol, int previous, int next) {
        return new TransitionChange<>(state, symbol, previous, next);
    }

    public boolean isAddition() {
        return previous == null;
    }

    public boolean isRemoval() {
        return next == null;
    }

    public boolean isModification() {
        return !isAddition() && !isRemoval();
    }

    @Override
    public String toString() {
        return "(" + state + ", " + symbol + "): " + (previous == null ? "-" : previous)
                + " -> " + (next == null ? "-" : next);
    }
}
