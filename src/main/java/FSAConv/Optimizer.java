package FSAConv;

import java.util.ArrayList;
import java.util.List;

import FSAConv.Model.Cancellation;
import FSAConv.Model.OptimizationResult;
import FSAConv.Model.TransitionChange;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Chains the optimization steps and reports their combined effect.
 * <p>
 * Every step yields its own {@link OptimizationResult}; when steps are chained the
 * intermediate indices are translated back, so the combined changes and mapping
 * always refer to the automaton that was handed in. Nondeterministic input is
 * determinized first, and then the reference automaton is the determinized one.
 */
public class Optimizer {

    private final Cancellation cancellation;

    public Optimizer(Cancellation cancellation) {
        this.cancellation = cancellation;
    }

    /**
     * Reachability pruning, then dead-state pruning, then minimization.
     */
    public <I> OptimizationResult<CompactDFA<I>, I> optimize(CompactDFA<I> dfa) {
        final OptimizationResult<CompactDFA<I>, I> reachable = AutomatonTrim.removeUnreachable(dfa);
        final OptimizationResult<CompactDFA<I>, I> alive = AutomatonTrim.removeDead(reachable.automaton());
        final OptimizationResult<CompactDFA<I>, I> minimal =
                new PartitionMinimizer(cancellation).run(alive.automaton());
        return chain(chain(reachable, alive), minimal);
    }

    public <I> OptimizationResult<CompactDFA<I>, I> optimize(CompactNFA<I> nfa) {
        return optimize(new PowersetDeterminizer(cancellation).run(nfa).dfa());
    }

    public <I> OptimizationResult<CompactDFA<I>, I> minimize(CompactDFA<I> dfa) {
        return new PartitionMinimizer(cancellation).run(dfa);
    }

    public <I> OptimizationResult<CompactDFA<I>, I> minimize(CompactNFA<I> nfa) {
        return minimize(new PowersetDeterminizer(cancellation).run(nfa).dfa());
    }

    /**
     * Reachability and dead-state pruning without merging states.
     */
    public <I> OptimizationResult<CompactDFA<I>, I> prune(CompactDFA<I> dfa) {
        final OptimizationResult<CompactDFA<I>, I> reachable = AutomatonTrim.removeUnreachable(dfa);
        return chain(reachable, AutomatonTrim.removeDead(reachable.automaton()));
    }

    public <I> OptimizationResult<CompactNFA<I>, I> prune(CompactNFA<I> nfa) {
        final OptimizationResult<CompactNFA<I>, I> reachable = AutomatonTrim.removeUnreachable(nfa);
        return chain(reachable, AutomatonTrim.removeDead(reachable.automaton()));
    }

    /**
     * Composes two consecutive steps into one whose indices refer to the input of {@code first}.
     */
    static <A, B, I> OptimizationResult<B, I> chain(OptimizationResult<A, I> first, OptimizationResult<B, I> second) {
        final int[] firstMapping = first.stateMapping();
        final int[] secondMapping = second.stateMapping();

        final int[] inverse = new int[secondMapping.length];
        final int[] mapping = new int[firstMapping.length];
        for (int s = 0; s < firstMapping.length; s++) {
            final int mid = firstMapping[s];
            mapping[s] = mid < 0 ? -1 : secondMapping[mid];
            if (mid >= 0) {
                inverse[mid] = s;
            }
        }

        final List<TransitionChange<I>> changes = new ArrayList<>(first.changes());
        for (TransitionChange<I> c : second.changes()) {
            changes.add(new TransitionChange<>(inverse[c.state()], c.symbol(),
                    c.previous() == null ? null : inverse[c.previous()],
                    c.next() == null ? null : inverse[c.next()]));
        }
        return new OptimizationResult<>(second.automaton(), changes, mapping);
    }
}
