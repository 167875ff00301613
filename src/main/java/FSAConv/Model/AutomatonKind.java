package FSAConv.Model;

import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * The three automaton representations the engine converts between.
 */
public enum AutomatonKind {
    EPSILON_NFA,
    NFA,
    DFA;

    public static AutomatonKind of(Object automaton) {
        if (automaton instanceof CompactEpsilonNFA) {
            return EPSILON_NFA;
        } else if (automaton instanceof CompactNFA) {
            return NFA;
        } else if (automaton instanceof CompactDFA) {
            return DFA;
        }
        throw new IllegalArgumentException("Unsupported automaton type: "
                + (automaton == null ? "null" : automaton.getClass().getName()));
    }
}
