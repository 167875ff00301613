package FSAConv;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import FSAConv.Exceptions.ValidationException;
import FSAConv.Model.AutomatonDescription;
import FSAConv.Model.CompactEpsilonNFA;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Checks an {@link AutomatonDescription} and builds the corresponding compact automaton.
 * <p>
 * States are numbered in sorted label order, so equal descriptions always produce
 * equal automata. Every failure is reported as a {@link ValidationException}.
 */
public final class AutomatonValidator {

    private AutomatonValidator() {
    }

    /**
     * @return state labels in index order
     */
    public static List<String> stateLabels(AutomatonDescription<?> description) {
        return new ArrayList<>(new TreeSet<>(description.states()));
    }

    public static <I> CompactEpsilonNFA<I> toEpsilonNFA(AutomatonDescription<I> description) {
        final Object2IntMap<String> index = checkCommon(description);
        final CompactEpsilonNFA<I> out = new CompactEpsilonNFA<>(alphabetOf(description), index.size());
        fillNFA(description, index, out);
        for (Map.Entry<String, Set<String>> e : description.epsilonTransitions().entrySet()) {
            final int source = lookup(index, e.getKey(), "epsilon transition source");
            for (String target : e.getValue()) {
                out.addEpsilonTransition(source, lookup(index, target, "epsilon transition target"));
            }
        }
        return out;
    }

    public static <I> CompactNFA<I> toNFA(AutomatonDescription<I> description) {
        final Object2IntMap<String> index = checkCommon(description);
        if (description.hasEpsilonTransitions()) {
            throw new ValidationException("An NFA description cannot contain epsilon transitions");
        }
        final CompactNFA<I> out = new CompactNFA<>(alphabetOf(description), index.size());
        fillNFA(description, index, out);
        return out;
    }

    public static <I> CompactDFA<I> toDFA(AutomatonDescription<I> description) {
        if (description.alphabet().isEmpty()) {
            throw new ValidationException("A DFA needs a non-empty alphabet");
        }
        final Object2IntMap<String> index = checkCommon(description);
        if (description.hasEpsilonTransitions()) {
            throw new ValidationException("A DFA description cannot contain epsilon transitions");
        }
        if (description.initialStates().size() != 1) {
            throw new ValidationException("A DFA needs exactly one initial state, found "
                    + description.initialStates().size());
        }

        final Alphabet<I> alphabet = alphabetOf(description);
        final CompactDFA<I> out = new CompactDFA<>(alphabet, index.size());
        for (String label : stateLabels(description)) {
            out.addState(description.finalStates().contains(label));
        }
        out.setInitialState(index.getInt(description.initialStates().iterator().next()));

        for (Map.Entry<String, Map<I, Set<String>>> e : description.transitions().entrySet()) {
            final int source = lookup(index, e.getKey(), "transition source");
            for (Map.Entry<I, Set<String>> bySymbol : e.getValue().entrySet()) {
                final I symbol = bySymbol.getKey();
                final Set<String> targets = bySymbol.getValue();
                if (targets.size() > 1) {
                    throw new ValidationException("Multi-valued DFA transition from '" + e.getKey()
                            + "' on '" + symbol + "': " + targets);
                }
                for (String target : targets) {
                    out.setTransition(source, symbolIndex(alphabet, symbol), lookup(index, target, "transition target"));
                }
            }
        }
        return out;
    }

    private static <I> Object2IntMap<String> checkCommon(AutomatonDescription<I> description) {
        if (description.states().isEmpty()) {
            throw new ValidationException("The state set is empty");
        }
        final Object2IntMap<String> index = new Object2IntOpenHashMap<>();
        index.defaultReturnValue(-1);
        for (String label : stateLabels(description)) {
            index.put(label, index.size());
        }
        for (String init : description.initialStates()) {
            lookup(index, init, "initial state");
        }
        for (String fin : description.finalStates()) {
            lookup(index, fin, "final state");
        }
        return index;
    }

    private static <I> void fillNFA(AutomatonDescription<I> description, Object2IntMap<String> index,
                                    CompactNFA<I> out) {
        final Alphabet<I> alphabet = out.getInputAlphabet();
        for (String label : stateLabels(description)) {
            out.addState(description.finalStates().contains(label));
        }
        for (String init : description.initialStates()) {
            out.setInitial(index.getInt(init), true);
        }
        for (Map.Entry<String, Map<I, Set<String>>> e : description.transitions().entrySet()) {
            final int source = lookup(index, e.getKey(), "transition source");
            for (Map.Entry<I, Set<String>> bySymbol : e.getValue().entrySet()) {
                symbolIndex(alphabet, bySymbol.getKey());
                for (String target : bySymbol.getValue()) {
                    out.addTransition(source, bySymbol.getKey(), lookup(index, target, "transition target"));
                }
            }
        }
    }

    private static <I> Alphabet<I> alphabetOf(AutomatonDescription<I> description) {
        return Alphabets.fromCollection(description.alphabet());
    }

    private static <I> int symbolIndex(Alphabet<I> alphabet, I symbol) {
        if (!alphabet.containsSymbol(symbol)) {
            throw new ValidationException("Symbol '" + symbol + "' is not in the alphabet " + alphabet);
        }
        return alphabet.getSymbolIndex(symbol);
    }

    private static int lookup(Object2IntMap<String> index, String label, String role) {
        final int state = index.getInt(label);
        if (state < 0) {
            throw new ValidationException("Unknown " + role + " '" + label + "'");
        }
        return state;
    }
}
