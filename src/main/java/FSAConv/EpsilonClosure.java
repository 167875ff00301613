package FSAConv;

import java.util.BitSet;

import FSAConv.Model.CompactEpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Epsilon-closure over a (possibly epsilon-free) NFA.
 * For a plain {@link CompactNFA} the closure of a set is the set itself.
 *
 * @param <I> input symbol type
 */
public class EpsilonClosure<I> {
    private final CompactEpsilonNFA<I> epsilonNFA;
    private final BitSet[] singletons;

    public EpsilonClosure(CompactNFA<I> automaton) {
        this.epsilonNFA = automaton instanceof CompactEpsilonNFA ? (CompactEpsilonNFA<I>) automaton : null;
        this.singletons = new BitSet[automaton.size()];
    }

    public static <I> BitSet closure(CompactNFA<I> automaton, BitSet states) {
        return new EpsilonClosure<>(automaton).closure(states);
    }

    public boolean hasEpsilonTransitions() {
        return epsilonNFA != null && epsilonNFA.numEpsilonTransitions() > 0;
    }

    /**
     * Least fixed point of {@code states ∪ epsilon-successors}.
     * The result set doubles as the visited guard, so epsilon cycles terminate.
     * @param states - start states, not modified
     * @return new set containing the closure
     */
    public BitSet closure(BitSet states) {
        final BitSet result = (BitSet) states.clone();
        if (!hasEpsilonTransitions()) {
            return result;
        }

        final IntArrayList worklist = new IntArrayList();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            worklist.add(s);
        }

        while (!worklist.isEmpty()) {
            int curr = worklist.popInt();
            if (!epsilonNFA.hasEpsilonSuccessors(curr)) {
                continue;
            }
            BitSet succs = epsilonNFA.getEpsilonSuccessors(curr);
            for (int t = succs.nextSetBit(0); t >= 0; t = succs.nextSetBit(t + 1)) {
                if (!result.get(t)) {
                    result.set(t);
                    worklist.add(t);
                }
            }
        }
        return result;
    }

    /**
     * Memoized closure of a single state. The returned set must not be modified.
     */
    public BitSet closure(int state) {
        BitSet cached = singletons[state];
        if (cached == null) {
            BitSet start = new BitSet();
            start.set(state);
            cached = closure(start);
            singletons[state] = cached;
        }
        return cached;
    }
}
