package FSAConv.Model;

import java.util.BitSet;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.AutomatonCreator;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * A {@link CompactNFA} with an additional relation of transitions that consume no input.
 * Epsilon is not a member of the input alphabet; it is only reachable through
 * {@link #addEpsilonTransition(int, int)} and {@link #getEpsilonSuccessors(int)}.
 *
 * @param <I> input symbol type
 */
public class CompactEpsilonNFA<I> extends CompactNFA<I> {

    private final Int2ObjectMap<BitSet> epsilonSuccessors = new Int2ObjectOpenHashMap<>();
    private int epsilonTransitions;

    public CompactEpsilonNFA(Alphabet<I> alphabet, int stateCapacity) {
        super(alphabet, stateCapacity);
    }

    public CompactEpsilonNFA(Alphabet<I> alphabet) {
        super(alphabet);
    }

    public void addEpsilonTransition(int source, int target) {
        if (source < 0 || source >= size() || target < 0 || target >= size()) {
            throw new IllegalArgumentException("Unknown state in epsilon transition " + source + " -> " + target);
        }
        BitSet succs = epsilonSuccessors.get(source);
        if (succs == null) {
            succs = new BitSet();
            epsilonSuccessors.put(source, succs);
        }
        if (!succs.get(target)) {
            succs.set(target);
            epsilonTransitions++;
        }
    }

    /**
     * @return a copy of the epsilon successors of {@code state}; empty if there are none
     */
    public BitSet getEpsilonSuccessors(int state) {
        final BitSet succs = epsilonSuccessors.get(state);
        return succs == null ? new BitSet() : (BitSet) succs.clone();
    }

    public boolean hasEpsilonSuccessors(int state) {
        final BitSet succs = epsilonSuccessors.get(state);
        return succs != null && !succs.isEmpty();
    }

    public int numEpsilonTransitions() {
        return epsilonTransitions;
    }

    @Override
    public void clear() {
        super.clear();
        epsilonSuccessors.clear();
        epsilonTransitions = 0;
    }

    public static final class Creator<I> implements AutomatonCreator<CompactEpsilonNFA<I>, I> {
        public CompactEpsilonNFA<I> createAutomaton(Alphabet<I> alphabet, int numStates) {
            return new CompactEpsilonNFA<>(alphabet, numStates);
        }

        public CompactEpsilonNFA<I> createAutomaton(Alphabet<I> alphabet) {
            return new CompactEpsilonNFA<>(alphabet);
        }
    }
}
