package FSAConv;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSAConv.Exceptions.EquivalenceCheckException;
import FSAConv.Model.Cancellation;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.word.Word;

/**
 * Decides language equality by comparing canonical minimal DFAs.
 * <p>
 * In strict mode, automata over different symbol sets are rejected with an
 * {@link EquivalenceCheckException}. In lenient mode both sides are re-encoded over
 * the union of their alphabets first; a symbol unknown to one side leads to rejection
 * on that side.
 */
public class EquivalenceValidator {
    static final String OPERATION = "equivalent";

    private final Cancellation cancellation;
    private final boolean strict;

    public EquivalenceValidator(Cancellation cancellation, boolean strict) {
        this.cancellation = cancellation;
        this.strict = strict;
    }

    public static <I> boolean equivalent(CompactDFA<I> a, CompactDFA<I> b) {
        return new EquivalenceValidator(Cancellation.none(), true).test(a, b);
    }

    public <I> boolean test(CompactNFA<I> a, CompactNFA<I> b) {
        final PowersetDeterminizer determinizer = new PowersetDeterminizer(cancellation);
        return test(determinizer.run(a).dfa(), determinizer.run(b).dfa());
    }

    public <I> boolean test(CompactDFA<I> a, CompactDFA<I> b) {
        final Alphabet<I> alphabet = commonAlphabet(a.getInputAlphabet(), b.getInputAlphabet());
        final PartitionMinimizer minimizer = new PartitionMinimizer(cancellation);
        final CompactDFA<I> minA = minimizer.run(reencode(a, alphabet)).automaton();
        final CompactDFA<I> minB = minimizer.run(reencode(b, alphabet)).automaton();
        return sameStructure(minA, minB);
    }

    /**
     * @return a shortest word accepted by exactly one of the two automata, or null if they are equivalent
     */
    public <I> Word<I> findCounterexample(CompactDFA<I> a, CompactDFA<I> b) {
        final Alphabet<I> alphabet = commonAlphabet(a.getInputAlphabet(), b.getInputAlphabet());
        final CompactDFA<I> left = reencode(a, alphabet);
        final CompactDFA<I> right = reencode(b, alphabet);

        // pairs are encoded as (p + 1) * width + (q + 1); 0 stands for the missing state
        final int width = right.size() + 1;
        final int[] parent = new int[(left.size() + 1) * width];
        final int[] symbol = new int[parent.length];
        Arrays.fill(parent, -2);

        final int start = (left.getIntInitialState() + 1) * width + (right.getIntInitialState() + 1);
        parent[start] = -1;
        final Deque<Integer> queue = new ArrayDeque<>();
        queue.offer(start);

        while (!queue.isEmpty()) {
            cancellation.checkDeadline(OPERATION);
            final int pair = queue.poll();
            final int p = pair / width - 1;
            final int q = pair % width - 1;
            if (accepts(left, p) != accepts(right, q)) {
                return trace(alphabet, parent, symbol, pair);
            }
            for (int j = 0; j < alphabet.size(); j++) {
                final int pn = p < 0 ? -1 : left.getSuccessor(p, j);
                final int qn = q < 0 ? -1 : right.getSuccessor(q, j);
                final int succ = (pn + 1) * width + (qn + 1);
                if (parent[succ] == -2) {
                    parent[succ] = pair;
                    symbol[succ] = j;
                    queue.offer(succ);
                }
            }
        }
        return null;
    }

    private static <I> boolean accepts(CompactDFA<I> dfa, int state) {
        return state >= 0 && dfa.isAccepting(state);
    }

    private static <I> Word<I> trace(Alphabet<I> alphabet, int[] parent, int[] symbol, int pair) {
        final List<I> symbols = new ArrayList<>();
        for (int curr = pair; parent[curr] >= 0; curr = parent[curr]) {
            symbols.add(alphabet.getSymbol(symbol[curr]));
        }
        Collections.reverse(symbols);
        return Word.fromList(symbols);
    }

    <I> Alphabet<I> commonAlphabet(Alphabet<I> a, Alphabet<I> b) {
        if (sameSymbols(a, b)) {
            return a;
        }
        final Set<I> union = new LinkedHashSet<>(a);
        union.addAll(b);
        if (strict && !new HashSet<>(a).equals(new HashSet<>(b))) {
            throw new EquivalenceCheckException("Alphabets differ: " + a + " vs. " + b);
        }
        return Alphabets.fromCollection(union);
    }

    private static <I> boolean sameSymbols(Alphabet<I> a, Alphabet<I> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int j = 0; j < a.size(); j++) {
            if (!a.getSymbol(j).equals(b.getSymbol(j))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code dfa} itself if it already uses {@code alphabet}, otherwise a copy over it
     */
    static <I> CompactDFA<I> reencode(CompactDFA<I> dfa, Alphabet<I> alphabet) {
        final Alphabet<I> own = dfa.getInputAlphabet();
        if (sameSymbols(own, alphabet)) {
            return dfa;
        }
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        for (int s = 0; s < dfa.size(); s++) {
            out.addState(dfa.isAccepting(s));
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            out.setInitialState(init);
        }
        for (int s = 0; s < dfa.size(); s++) {
            for (int j = 0; j < own.size(); j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t >= 0) {
                    out.setTransition(s, alphabet.getSymbolIndex(own.getSymbol(j)), t);
                }
            }
        }
        return out;
    }

    /**
     * Canonical minimal DFAs for the same language are identical, index by index.
     */
    static <I> boolean sameStructure(CompactDFA<I> a, CompactDFA<I> b) {
        if (a.size() != b.size() || a.getIntInitialState() != b.getIntInitialState()) {
            return false;
        }
        final int numInputs = a.getInputAlphabet().size();
        for (int s = 0; s < a.size(); s++) {
            if (a.isAccepting(s) != b.isAccepting(s)) {
                return false;
            }
            for (int j = 0; j < numInputs; j++) {
                if (a.getSuccessor(s, j) != b.getSuccessor(s, j)) {
                    return false;
                }
            }
        }
        return true;
    }
}
