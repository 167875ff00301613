package FSAConv;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import FSAConv.Model.Cancellation;
import FSAConv.Model.OptimizationResult;
import FSAConv.Model.TransitionChange;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimizes a partial DFA by partition refinement.
 * <p>
 * An artificial sink stands in for every missing transition, so the partial DFA is
 * refined as if it were complete. The initial partition is {accepting, rejecting};
 * blocks are split by successor-block signatures until the number of blocks is stable.
 * Unreachable states and states equivalent to the sink are dropped, except for the
 * initial state. The surviving blocks are numbered breadth-first from the initial
 * block, symbols in alphabet order, which makes the output canonical: two DFAs for
 * the same language minimize to identical automata.
 */
public class PartitionMinimizer {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionMinimizer.class);
    static final String OPERATION = "minimize";

    private final Cancellation cancellation;

    public PartitionMinimizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    public static <I> CompactDFA<I> minimize(CompactDFA<I> dfa) {
        return new PartitionMinimizer(Cancellation.none()).run(dfa).automaton();
    }

    /**
     * @param dfa - partial DFA; not modified
     * @return minimal canonical DFA; changes and mapping are expressed in {@code dfa}'s state indices
     */
    public <I> OptimizationResult<CompactDFA<I>, I> run(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final int numInputs = alphabet.size();
        final int n = dfa.size();
        final int sink = n;
        final int init = dfa.getIntInitialState();

        final BitSet reachable = new BitSet();
        if (init >= 0) {
            reachable.set(init);
            reachable.or(AutomatonTrim.search(AutomatonTrim.successors(dfa), reachable));
        }
        reachable.set(sink);

        final int[] blockOf = refine(dfa, reachable, numInputs, sink);
        final int sinkBlock = blockOf[sink];

        // lowest reachable index of each block
        final int[] representative = new int[n + 1];
        Arrays.fill(representative, -1);
        for (int s = reachable.nextSetBit(0); s >= 0 && s < n; s = reachable.nextSetBit(s + 1)) {
            if (representative[blockOf[s]] < 0) {
                representative[blockOf[s]] = s;
            }
        }

        final CompactDFA<I> out = new CompactDFA<>(alphabet);
        final int[] blockToOut = new int[n + 1];
        Arrays.fill(blockToOut, -1);

        if (init < 0) {
            out.addInitialState(false);
        } else {
            final Deque<Integer> queue = new ArrayDeque<>();
            blockToOut[blockOf[init]] = out.addInitialState(dfa.isAccepting(init));
            queue.offer(blockOf[init]);
            while (!queue.isEmpty()) {
                final int block = queue.poll();
                if (block == sinkBlock) {
                    continue; // initial state with an empty language
                }
                final int rep = representative[block];
                for (int j = 0; j < numInputs; j++) {
                    final int t = dfa.getSuccessor(rep, j);
                    if (t < 0 || blockOf[t] == sinkBlock) {
                        continue;
                    }
                    final int targetBlock = blockOf[t];
                    if (blockToOut[targetBlock] < 0) {
                        blockToOut[targetBlock] = out.addState(dfa.isAccepting(t));
                        queue.offer(targetBlock);
                    }
                    out.setTransition(blockToOut[block], j, blockToOut[targetBlock]);
                }
            }
        }

        final int[] mapping = new int[n];
        Arrays.fill(mapping, -1);
        final List<TransitionChange<I>> changes = new ArrayList<>();
        for (int s = 0; s < n; s++) {
            final boolean kept = reachable.get(s) && blockToOut[blockOf[s]] >= 0;
            if (kept) {
                mapping[s] = blockToOut[blockOf[s]];
            }
            for (int j = 0; j < numInputs; j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t < 0) {
                    continue;
                }
                final int next = !kept || blockOf[s] == sinkBlock || blockOf[t] == sinkBlock
                        ? -1 : representative[blockOf[t]];
                if (next < 0) {
                    changes.add(TransitionChange.removal(s, alphabet.getSymbol(j), t));
                } else if (next != t) {
                    changes.add(TransitionChange.modification(s, alphabet.getSymbol(j), t, next));
                }
            }
        }

        LOG.debug("Minimized {} states into {} states", n, out.size());
        return new OptimizationResult<>(out, changes, mapping);
    }

    /**
     * @return block index of every state in {@code states}; index {@code sink} is the artificial sink
     */
    private <I> int[] refine(CompactDFA<I> dfa, BitSet states, int numInputs, int sink) {
        int[] blockOf = new int[sink + 1];
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            blockOf[s] = s != sink && dfa.isAccepting(s) ? 1 : 0;
        }

        int numBlocks = -1;
        int rounds = 0;
        while (true) {
            cancellation.checkDeadline(OPERATION);
            rounds++;
            final Object2IntMap<IntArrayList> signatures = new Object2IntOpenHashMap<>();
            signatures.defaultReturnValue(-1);
            final int[] next = new int[sink + 1];

            for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
                final IntArrayList signature = new IntArrayList(numInputs + 1);
                signature.add(blockOf[s]);
                for (int j = 0; j < numInputs; j++) {
                    final int t = s == sink ? -1 : dfa.getSuccessor(s, j);
                    signature.add(blockOf[t < 0 ? sink : t]);
                }
                int block = signatures.getInt(signature);
                if (block < 0) {
                    block = signatures.size();
                    signatures.put(signature, block);
                }
                next[s] = block;
            }

            blockOf = next;
            if (signatures.size() == numBlocks) {
                break;
            }
            numBlocks = signatures.size();
        }
        LOG.debug("Partition stable after {} rounds with {} blocks", rounds, numBlocks);
        return blockOf;
    }
}
