package FSAConv;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import FSAConv.Model.Cancellation;
import FSAConv.Model.DeterminizationResult;
import FSAConv.Registry.Registry;
import FSAConv.Registry.SubsetRegistry;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction over epsilon-closures.
 * <p>
 * Composite states are discovered breadth-first, symbols in alphabet order, so
 * the numbering of the output DFA only depends on the input automaton. Empty
 * successor subsets are not materialized: the result is a partial DFA.
 */
public class PowersetDeterminizer {
    private static final Logger LOG = LoggerFactory.getLogger(PowersetDeterminizer.class);
    static final String OPERATION = "determinize";

    private final Cancellation cancellation;

    public PowersetDeterminizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static <I> CompactDFA<I> determinize(CompactNFA<I> nfa) {
        return new PowersetDeterminizer(Cancellation.none()).run(nfa).dfa();
    }

    /**
     * @param nfa - NFA or epsilon-NFA; not modified
     * @return DFA plus the source subset of every DFA state
     */
    public <I> DeterminizationResult<I> run(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final EpsilonClosure<I> closure = new EpsilonClosure<>(nfa);
        final BitSet finals = finalStates(nfa);
        final CompactDFA<I> out = new CompactDFA<>(alphabet);
        final Registry registry = new SubsetRegistry();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        final BitSet initial = new BitSet();
        for (Integer s : nfa.getInitialStates()) {
            initial.set(s);
        }
        final BitSet init = closure.closure(initial);
        final Integer initOut = out.addInitialState(init.intersects(finals));
        registry.put(init, initOut);
        queue.offer(new DeterminizeRecord(init, initOut));

        while (!queue.isEmpty()) {
            cancellation.checkDeadline(OPERATION);
            final DeterminizeRecord curr = queue.poll();

            for (I sym : alphabet) {
                final BitSet targets = new BitSet();
                for (int s = curr.inputState.nextSetBit(0); s >= 0; s = curr.inputState.nextSetBit(s + 1)) {
                    for (Integer t : nfa.getTransitions(s, sym)) {
                        targets.or(closure.closure(t));
                    }
                }
                if (targets.isEmpty()) {
                    continue;
                }

                Integer outSucc = registry.get(targets);
                if (outSucc == Registry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = out.addState(targets.intersects(finals));
                    registry.put(targets, outSucc);
                    queue.offer(new DeterminizeRecord(targets, outSucc));
                    cancellation.checkStates(OPERATION, out.size());
                }
                out.setTransition(curr.outputState, sym, outSucc);
            }
        }

        LOG.debug("Determinized {} source states into {} composite states", nfa.size(), out.size());

        final List<BitSet> subsets = new ArrayList<>(registry.size());
        for (int q = 0; q < registry.size(); q++) {
            subsets.add(registry.subsetOf(q));
        }
        return new DeterminizationResult<>(out, subsets);
    }

    static <I> BitSet finalStates(CompactNFA<I> nfa) {
        final BitSet finals = new BitSet(nfa.size());
        for (int s = 0; s < nfa.size(); s++) {
            if (nfa.isAccepting(s)) {
                finals.set(s);
            }
        }
        return finals;
    }

    private record DeterminizeRecord(BitSet inputState, Integer outputState) { }
}
