package FSAConv;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;

import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Closure operations of regular languages.
 * <p>
 * Boolean operations run a product construction over the union alphabet; a missing
 * transition on one side moves that side into an implicit rejecting sink. Product
 * pairs where both sides are in the sink are never materialized. Concatenation and
 * star are built structurally on epsilon-NFAs.
 */
public class LanguageOperations {
    static final String OPERATION = "product";

    private final Cancellation cancellation;

    public LanguageOperations(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    @FunctionalInterface
    private interface Acceptance {
        boolean accepts(boolean left, boolean right);
    }

    public <I> CompactDFA<I> union(CompactDFA<I> a, CompactDFA<I> b) {
        return product(a, b, (l, r) -> l || r);
    }

    public <I> CompactDFA<I> intersection(CompactDFA<I> a, CompactDFA<I> b) {
        return product(a, b, (l, r) -> l && r);
    }

    public <I> CompactDFA<I> difference(CompactDFA<I> a, CompactDFA<I> b) {
        return product(a, b, (l, r) -> l && !r);
    }

    public <I> CompactDFA<I> symmetricDifference(CompactDFA<I> a, CompactDFA<I> b) {
        return product(a, b, (l, r) -> l != r);
    }

    /**
     * Complement relative to the words over {@code dfa}'s own alphabet. Missing
     * transitions are routed into an added accepting sink.
     */
    public <I> CompactDFA<I> complement(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size() + 1);
        for (int s = 0; s < dfa.size(); s++) {
            out.addState(!dfa.isAccepting(s));
        }
        final int sink = out.addState(true);
        final int init = dfa.getIntInitialState();
        out.setInitialState(init < 0 ? sink : init);

        for (int s = 0; s <= dfa.size(); s++) {
            for (int j = 0; j < alphabet.size(); j++) {
                final int t = s == sink ? -1 : dfa.getSuccessor(s, j);
                out.setTransition(s, j, t < 0 ? sink : t);
            }
        }
        return out;
    }

    /**
     * @return epsilon-NFA for L(a)·L(b); the states of {@code b} follow those of {@code a}
     */
    public <I> CompactEpsilonNFA<I> concatenation(CompactNFA<I> a, CompactNFA<I> b) {
        final Alphabet<I> alphabet = unionAlphabet(a.getInputAlphabet(), b.getInputAlphabet());
        final CompactEpsilonNFA<I> out = new CompactEpsilonNFA<>(alphabet, a.size() + b.size());
        copy(a, out, false);
        final int offset = copy(b, out, false);
        for (int s = 0; s < a.size(); s++) {
            if (a.isAccepting(s)) {
                for (Integer init : b.getInitialStates()) {
                    out.addEpsilonTransition(s, offset + init);
                }
            }
        }
        for (Integer init : a.getInitialStates()) {
            out.setInitial(init.intValue(), true);
        }
        for (int s = 0; s < b.size(); s++) {
            if (b.isAccepting(s)) {
                out.setAccepting(offset + s, true);
            }
        }
        return out;
    }

    /**
     * @return epsilon-NFA for L(a)*, with a fresh accepting initial state
     */
    public <I> CompactEpsilonNFA<I> kleeneStar(CompactNFA<I> a) {
        final CompactEpsilonNFA<I> out = new CompactEpsilonNFA<>(a.getInputAlphabet(), a.size() + 1);
        copy(a, out, true);
        final int start = out.addInitialState(true);
        for (Integer init : a.getInitialStates()) {
            out.addEpsilonTransition(start, init);
        }
        for (int s = 0; s < a.size(); s++) {
            if (a.isAccepting(s)) {
                out.addEpsilonTransition(s, start);
            }
        }
        return out;
    }

    private <I> CompactDFA<I> product(CompactDFA<I> a, CompactDFA<I> b, Acceptance acceptance) {
        final Alphabet<I> alphabet = unionAlphabet(a.getInputAlphabet(), b.getInputAlphabet());
        final CompactDFA<I> left = EquivalenceValidator.reencode(a, alphabet);
        final CompactDFA<I> right = EquivalenceValidator.reencode(b, alphabet);

        // pair index (p + 1) * width + (q + 1); index 0 is the shared sink
        final int width = right.size() + 1;
        final int[] pairToOut = new int[(left.size() + 1) * width];
        Arrays.fill(pairToOut, -1);
        final CompactDFA<I> out = new CompactDFA<>(alphabet);
        final Deque<Integer> queue = new ArrayDeque<>();

        final int start = (left.getIntInitialState() + 1) * width + (right.getIntInitialState() + 1);
        pairToOut[start] = out.addInitialState(accepts(left, right, start, width, acceptance));
        queue.offer(start);

        while (!queue.isEmpty()) {
            cancellation.checkDeadline(OPERATION);
            final int pair = queue.poll();
            final int p = pair / width - 1;
            final int q = pair % width - 1;
            for (int j = 0; j < alphabet.size(); j++) {
                final int pn = p < 0 ? -1 : left.getSuccessor(p, j);
                final int qn = q < 0 ? -1 : right.getSuccessor(q, j);
                final int succ = (pn + 1) * width + (qn + 1);
                if (succ == 0) {
                    continue;
                }
                if (pairToOut[succ] < 0) {
                    pairToOut[succ] = out.addState(accepts(left, right, succ, width, acceptance));
                    queue.offer(succ);
                }
                out.setTransition(pairToOut[pair], j, pairToOut[succ]);
            }
        }
        return out;
    }

    private static <I> boolean accepts(CompactDFA<I> left, CompactDFA<I> right, int pair, int width,
                                       Acceptance acceptance) {
        final int p = pair / width - 1;
        final int q = pair % width - 1;
        return acceptance.accepts(p >= 0 && left.isAccepting(p), q >= 0 && right.isAccepting(q));
    }

    private static <I> Alphabet<I> unionAlphabet(Alphabet<I> a, Alphabet<I> b) {
        return new EquivalenceValidator(Cancellation.none(), false).commonAlphabet(a, b);
    }

    /**
     * Appends the states and transitions of {@code in} to {@code out}.
     * @return index of the first appended state
     */
    private static <I> int copy(CompactNFA<I> in, CompactEpsilonNFA<I> out, boolean keepAccepting) {
        final int offset = out.size();
        for (int s = 0; s < in.size(); s++) {
            out.addState(keepAccepting && in.isAccepting(s));
        }
        final BitSet none = new BitSet();
        for (int s = 0; s < in.size(); s++) {
            for (I sym : in.getInputAlphabet()) {
                for (Integer t : in.getTransitions(s, sym)) {
                    out.addTransition(offset + s, sym, offset + t);
                }
            }
            final BitSet eps = in instanceof CompactEpsilonNFA
                    ? ((CompactEpsilonNFA<I>) in).getEpsilonSuccessors(s) : none;
            for (int t = eps.nextSetBit(0); t >= 0; t = eps.nextSetBit(t + 1)) {
                out.addEpsilonTransition(offset + s, offset + t);
            }
        }
        return offset;
    }
}
