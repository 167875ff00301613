package FSAConv;

import java.util.BitSet;

import FSAConv.Model.Cancellation;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Removes epsilon transitions by propagating closures onto ordinary transitions.
 * <p>
 * The state set and the initial states are kept as they are. For state {@code s} and
 * symbol {@code a}, the new a-successors of {@code s} are the a-successors of every
 * state in closure(s); they are not closed again. A state is accepting iff its
 * closure contains an accepting state.
 */
public class EpsilonEliminator {
    static final String OPERATION = "eliminate-epsilon";

    private final Cancellation cancellation;

    public EpsilonEliminator(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static <I> CompactNFA<I> eliminateEpsilon(CompactNFA<I> nfa) {
        return new EpsilonEliminator(Cancellation.none()).run(nfa);
    }

    public <I> CompactNFA<I> run(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final EpsilonClosure<I> closure = new EpsilonClosure<>(nfa);
        final BitSet finals = PowersetDeterminizer.finalStates(nfa);
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());

        for (int s = 0; s < nfa.size(); s++) {
            out.addState(closure.closure(s).intersects(finals));
        }
        for (Integer init : nfa.getInitialStates()) {
            out.setInitial(init, true);
        }

        for (int s = 0; s < nfa.size(); s++) {
            cancellation.checkDeadline(OPERATION);
            final Integer src = s;
            final BitSet sClosure = closure.closure(s);
            for (I sym : alphabet) {
                for (int c = sClosure.nextSetBit(0); c >= 0; c = sClosure.nextSetBit(c + 1)) {
                    for (Integer t : nfa.getTransitions(c, sym)) {
                        out.addTransition(src, sym, t);
                    }
                }
            }
        }
        return out;
    }
}
