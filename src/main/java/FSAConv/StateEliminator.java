package FSAConv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Regex.RegexNode;
import FSAConv.Regex.RegexNodes;
import FSAConv.Regex.RegexPrinter;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Recovers a regular expression from an automaton by state elimination.
 * <p>
 * A fresh start state gets an epsilon edge to every initial state and every final state
 * gets an epsilon edge to a fresh end state. Inner states are then removed in ascending
 * index order; removing {@code k} reroutes every (p, s) pair through
 * {@code label(p,k) · label(k,k)* · label(k,s)} and merges parallel edges by union.
 * The label left on start → end is the result. The order only affects the size of the
 * expression, and fixing it makes the output reproducible.
 */
public class StateEliminator {
    static final String OPERATION = "to-regex";

    private final Cancellation cancellation;

    public StateEliminator(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static String toRegex(CompactNFA<Character> nfa) {
        return RegexPrinter.print(new StateEliminator(Cancellation.none()).toRegexNode(nfa));
    }

    public static String toRegex(CompactDFA<Character> dfa) {
        return RegexPrinter.print(new StateEliminator(Cancellation.none()).toRegexNode(dfa));
    }

    public RegexNode toRegexNode(CompactNFA<Character> nfa) {
        final EdgeTable table = new EdgeTable(nfa.size());
        final CompactEpsilonNFA<Character> epsilonNFA =
                nfa instanceof CompactEpsilonNFA ? (CompactEpsilonNFA<Character>) nfa : null;

        for (int s = 0; s < nfa.size(); s++) {
            for (Character sym : nfa.getInputAlphabet()) {
                for (Integer t : nfa.getTransitions(s, sym)) {
                    table.addEdge(s, t, RegexNodes.literal(sym));
                }
            }
            if (epsilonNFA != null) {
                final BitSet succs = epsilonNFA.getEpsilonSuccessors(s);
                for (int t = succs.nextSetBit(0); t >= 0; t = succs.nextSetBit(t + 1)) {
                    table.addEdge(s, t, RegexNodes.EPSILON);
                }
            }
            if (nfa.isAccepting(s)) {
                table.addEdge(s, table.end, RegexNodes.EPSILON);
            }
        }
        for (Integer init : nfa.getInitialStates()) {
            table.addEdge(table.start, init, RegexNodes.EPSILON);
        }
        return eliminateAll(table);
    }

    public RegexNode toRegexNode(CompactDFA<Character> dfa) {
        final EdgeTable table = new EdgeTable(dfa.size());

        final Alphabet<Character> alphabet = dfa.getInputAlphabet();
        for (int s = 0; s < dfa.size(); s++) {
            for (int j = 0; j < alphabet.size(); j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t >= 0) {
                    table.addEdge(s, t, RegexNodes.literal(alphabet.getSymbol(j)));
                }
            }
            if (dfa.isAccepting(s)) {
                table.addEdge(s, table.end, RegexNodes.EPSILON);
            }
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            table.addEdge(table.start, init, RegexNodes.EPSILON);
        }
        return eliminateAll(table);
    }

    private RegexNode eliminateAll(EdgeTable table) {
        for (int k = 0; k < table.start; k++) {
            cancellation.checkDeadline(OPERATION);
            table.remove(k);
        }
        final RegexNode result = table.outgoing.get(table.start).get(table.end);
        return result == null ? RegexNodes.EMPTY_SET : result;
    }

    /**
     * Generalized transition graph: inner states 0..n-1, start = n, end = n+1.
     * Sorted maps keep the union order of merged labels deterministic.
     */
    private static final class EdgeTable {
        final int start;
        final int end;
        final List<Int2ObjectSortedMap<RegexNode>> outgoing;
        final List<IntSortedSet> incoming;

        EdgeTable(int innerStates) {
            this.start = innerStates;
            this.end = innerStates + 1;
            this.outgoing = new ArrayList<>(innerStates + 2);
            this.incoming = new ArrayList<>(innerStates + 2);
            for (int i = 0; i < innerStates + 2; i++) {
                outgoing.add(new Int2ObjectRBTreeMap<>());
                incoming.add(new IntRBTreeSet());
            }
        }

        void addEdge(int from, int to, RegexNode label) {
            final RegexNode existing = outgoing.get(from).get(to);
            outgoing.get(from).put(to, existing == null ? label : RegexNodes.union(existing, label));
            incoming.get(to).add(from);
        }

        void remove(int k) {
            final RegexNode loop = outgoing.get(k).get(k);
            final RegexNode loopStar = loop == null ? RegexNodes.EPSILON : RegexNodes.star(loop);
            final int[] preds = without(incoming.get(k).toIntArray(), k);
            final int[] succs = without(outgoing.get(k).keySet().toIntArray(), k);

            for (int p : preds) {
                final RegexNode prefix = RegexNodes.concat(outgoing.get(p).get(k), loopStar);
                for (int s : succs) {
                    addEdge(p, s, RegexNodes.concat(prefix, outgoing.get(k).get(s)));
                }
            }

            for (int p : preds) {
                outgoing.get(p).remove(k);
            }
            for (int s : succs) {
                incoming.get(s).remove(k);
            }
            outgoing.get(k).clear();
            incoming.get(k).clear();
        }

        private static int[] without(int[] states, int excluded) {
            int n = 0;
            for (int s : states) {
                if (s != excluded) {
                    states[n++] = s;
                }
            }
            return Arrays.copyOf(states, n);
        }
    }
}
