package FSAConv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Model.OptimizationResult;
import FSAConv.Model.TransitionChange;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Reachability and dead-state pruning.
 * <p>
 * Both steps keep the relative order of the surviving states, so the result is
 * numbered densely in ascending order of the source indices. Dropped transitions are
 * reported as removals, in source state indices. Epsilon edges count for reachability
 * but are not listed as changes.
 */
public class AutomatonTrim {

    public static <I> OptimizationResult<CompactDFA<I>, I> removeUnreachable(CompactDFA<I> dfa) {
        final BitSet inits = new BitSet();
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            inits.set(init);
        }
        return restrict(dfa, search(successors(dfa), inits));
    }

    /**
     * Drops every state from which no accepting state can be reached. The initial state is kept.
     */
    public static <I> OptimizationResult<CompactDFA<I>, I> removeDead(CompactDFA<I> dfa) {
        final BitSet alive = search(reverse(successors(dfa)), acceptingStates(dfa));
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            alive.set(init);
        }
        return restrict(dfa, alive);
    }

    public static <I> OptimizationResult<CompactNFA<I>, I> removeUnreachable(CompactNFA<I> nfa) {
        return restrict(nfa, search(successors(nfa), initialStates(nfa)));
    }

    /**
     * Drops every state from which no accepting state can be reached. Initial states are kept.
     */
    public static <I> OptimizationResult<CompactNFA<I>, I> removeDead(CompactNFA<I> nfa) {
        final BitSet alive = search(reverse(successors(nfa)), acceptingStates(nfa));
        alive.or(initialStates(nfa));
        return restrict(nfa, alive);
    }

    static <I> BitSet[] successors(CompactDFA<I> dfa) {
        final int numInputs = dfa.getInputAlphabet().size();
        final BitSet[] succs = new BitSet[dfa.size()];
        for (int s = 0; s < dfa.size(); s++) {
            succs[s] = new BitSet();
            for (int j = 0; j < numInputs; j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t >= 0) {
                    succs[s].set(t);
                }
            }
        }
        return succs;
    }

    static <I> BitSet[] successors(CompactNFA<I> nfa) {
        final CompactEpsilonNFA<I> epsilonNFA = nfa instanceof CompactEpsilonNFA ? (CompactEpsilonNFA<I>) nfa : null;
        final BitSet[] succs = new BitSet[nfa.size()];
        for (int s = 0; s < nfa.size(); s++) {
            succs[s] = epsilonNFA == null ? new BitSet() : epsilonNFA.getEpsilonSuccessors(s);
            for (I sym : nfa.getInputAlphabet()) {
                for (Integer t : nfa.getTransitions(s, sym)) {
                    succs[s].set(t);
                }
            }
        }
        return succs;
    }

    static BitSet[] reverse(BitSet[] succs) {
        final BitSet[] preds = new BitSet[succs.length];
        for (int s = 0; s < succs.length; s++) {
            preds[s] = new BitSet();
        }
        for (int s = 0; s < succs.length; s++) {
            for (int t = succs[s].nextSetBit(0); t >= 0; t = succs[s].nextSetBit(t + 1)) {
                preds[t].set(s);
            }
        }
        return preds;
    }

    /**
     * @return every state reachable from {@code roots} along {@code edges}, roots included
     */
    static BitSet search(BitSet[] edges, BitSet roots) {
        final BitSet visited = (BitSet) roots.clone();
        final IntArrayList worklist = new IntArrayList();
        for (int s = roots.nextSetBit(0); s >= 0; s = roots.nextSetBit(s + 1)) {
            worklist.add(s);
        }
        while (!worklist.isEmpty()) {
            final int s = worklist.popInt();
            for (int t = edges[s].nextSetBit(0); t >= 0; t = edges[s].nextSetBit(t + 1)) {
                if (!visited.get(t)) {
                    visited.set(t);
                    worklist.add(t);
                }
            }
        }
        return visited;
    }

    static <I> BitSet acceptingStates(CompactDFA<I> dfa) {
        final BitSet finals = new BitSet(dfa.size());
        for (int s = 0; s < dfa.size(); s++) {
            if (dfa.isAccepting(s)) {
                finals.set(s);
            }
        }
        return finals;
    }

    static <I> BitSet acceptingStates(CompactNFA<I> nfa) {
        return PowersetDeterminizer.finalStates(nfa);
    }

    static <I> BitSet initialStates(CompactNFA<I> nfa) {
        final BitSet inits = new BitSet();
        for (Integer s : nfa.getInitialStates()) {
            inits.set(s);
        }
        return inits;
    }

    private static int[] renumber(int size, BitSet keep) {
        final int[] mapping = new int[size];
        Arrays.fill(mapping, -1);
        int next = 0;
        for (int s = keep.nextSetBit(0); s >= 0 && s < size; s = keep.nextSetBit(s + 1)) {
            mapping[s] = next++;
        }
        return mapping;
    }

    private static <I> OptimizationResult<CompactDFA<I>, I> restrict(CompactDFA<I> dfa, BitSet keep) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final int[] mapping = renumber(dfa.size(), keep);
        final CompactDFA<I> out = new CompactDFA<>(alphabet, keep.cardinality());
        final List<TransitionChange<I>> changes = new ArrayList<>();

        for (int s = 0; s < dfa.size(); s++) {
            if (mapping[s] >= 0) {
                out.addState(dfa.isAccepting(s));
            }
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0 && mapping[init] >= 0) {
            out.setInitialState(mapping[init]);
        }

        for (int s = 0; s < dfa.size(); s++) {
            for (int j = 0; j < alphabet.size(); j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t < 0) {
                    continue;
                }
                if (mapping[s] >= 0 && mapping[t] >= 0) {
                    out.setTransition(mapping[s], j, mapping[t]);
                } else {
                    changes.add(TransitionChange.removal(s, alphabet.getSymbol(j), t));
                }
            }
        }
        return new OptimizationResult<>(out, changes, mapping);
    }

    private static <I> OptimizationResult<CompactNFA<I>, I> restrict(CompactNFA<I> nfa, BitSet keep) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final int[] mapping = renumber(nfa.size(), keep);
        final CompactEpsilonNFA<I> epsilonNFA = nfa instanceof CompactEpsilonNFA ? (CompactEpsilonNFA<I>) nfa : null;
        final CompactNFA<I> out = epsilonNFA == null
                ? new CompactNFA<>(alphabet, keep.cardinality())
                : new CompactEpsilonNFA<>(alphabet, keep.cardinality());
        final List<TransitionChange<I>> changes = new ArrayList<>();

        for (int s = 0; s < nfa.size(); s++) {
            if (mapping[s] >= 0) {
                out.addState(nfa.isAccepting(s));
            }
        }
        for (Integer init : nfa.getInitialStates()) {
            if (mapping[init] >= 0) {
                out.setInitial(mapping[init], true);
            }
        }

        for (int s = 0; s < nfa.size(); s++) {
            for (I sym : alphabet) {
                for (Integer t : nfa.getTransitions(s, sym)) {
                    if (mapping[s] >= 0 && mapping[t] >= 0) {
                        out.addTransition(mapping[s], sym, mapping[t]);
                    } else {
                        changes.add(TransitionChange.removal(s, sym, t));
                    }
                }
            }
            if (epsilonNFA != null && mapping[s] >= 0) {
                final BitSet eps = epsilonNFA.getEpsilonSuccessors(s);
                for (int t = eps.nextSetBit(0); t >= 0; t = eps.nextSetBit(t + 1)) {
                    if (mapping[t] >= 0) {
                        ((CompactEpsilonNFA<I>) out).addEpsilonTransition(mapping[s], mapping[t]);
                    }
                }
            }
        }
        return new OptimizationResult<>(out, changes, mapping);
    }
}
