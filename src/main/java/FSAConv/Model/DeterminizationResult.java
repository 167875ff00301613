package FSAConv.Model;

import java.util.BitSet;
import java.util.List;

import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * A DFA produced by subset construction together with the source-state subset
 * each DFA state stands for. Names are derived from the sorted subset, so two
 * runs over the same input name every state identically.
 *
 * @param dfa the deterministic automaton
 * @param subsets {@code subsets.get(q)} is the set of source states merged into DFA state q
 * @param <I> input symbol type
 */
public record DeterminizationResult<I>(CompactDFA<I> dfa, List<BitSet> subsets) {

    public String stateName(int state) {
        return subsets.get(state).toString();
    }

    public BitSet subset(int state) {
        return (BitSet) subsets.get(state).clone();
    }
}
