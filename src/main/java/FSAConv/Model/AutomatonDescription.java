package FSAConv.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Caller-facing description of an automaton with string state labels.
 * Nothing is checked here; {@code AutomatonValidator} turns a description into a
 * compact automaton and reports every inconsistency.
 *
 * @param states state labels
 * @param alphabet input symbols, in alphabet order
 * @param transitions source label → symbol → target labels
 * @param epsilonTransitions source label → target labels
 * @param initialStates initial state labels
 * @param finalStates accepting state labels
 * @param <I> input symbol type
 */
public record AutomatonDescription<I>(Set<String> states,
                                      Set<I> alphabet,
                                      Map<String, Map<I, Set<String>>> transitions,
                                      Map<String, Set<String>> epsilonTransitions,
                                      Set<String> initialStates,
                                      Set<String> finalStates) {

    public AutomatonDescription {
        states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
        epsilonTransitions = Collections.unmodifiableMap(new LinkedHashMap<>(epsilonTransitions));
        initialStates = Collections.unmodifiableSet(new LinkedHashSet<>(initialStates));
        finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(finalStates));
    }

    public static <I> Builder<I> builder() {
        return new Builder<>();
    }

    public boolean hasEpsilonTransitions() {
        for (Set<String> targets : epsilonTransitions.values()) {
            if (!targets.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    public static final class Builder<I> {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<I> alphabet = new LinkedHashSet<>();
        private final Map<String, Map<I, Set<String>>> transitions = new LinkedHashMap<>();
        private final Map<String, Set<String>> epsilonTransitions = new LinkedHashMap<>();
        private final Set<String> initialStates = new LinkedHashSet<>();
        private final Set<String> finalStates = new LinkedHashSet<>();

        private Builder() {
        }

        @SafeVarargs
        public final Builder<I> symbols(I... symbols) {
            Collections.addAll(alphabet, symbols);
            return this;
        }

        public Builder<I> states(String... labels) {
            Collections.addAll(states, labels);
            return this;
        }

        public Builder<I> initial(String label) {
            initialStates.add(label);
            return this;
        }

        public Builder<I> accepting(String label) {
            finalStates.add(label);
            return this;
        }

        public Builder<I> transition(String source, I symbol, String target) {
            transitions.computeIfAbsent(source, k -> new LinkedHashMap<>())
                    .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                    .add(target);
            return this;
        }

        public Builder<I> epsilon(String source, String target) {
            epsilonTransitions.computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
            return this;
        }

        public AutomatonDescription<I> build() {
            return new AutomatonDescription<>(states, alphabet, transitions, epsilonTransitions,
                    initialStates, finalStates);
        }
    }
}
