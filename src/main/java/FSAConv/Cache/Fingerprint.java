package FSAConv.Cache;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import FSAConv.Model.AutomatonKind;
import FSAConv.Model.CompactEpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Cache key of a conversion request: SHA-256 over the operation, its options and
 * a canonical serialization of the source.
 * <p>
 * The serialization lists states by index, symbols in alphabet order and targets
 * in ascending order, so it only depends on the automaton's structure and never on
 * hash iteration order. Symbols are recorded together with their runtime class. Two automata share a fingerprint only if they are identical
 * index by index.
 *
 * @param operation requested operation, e.g. {@code to-dfa}
 * @param digest lowercase hex SHA-256
 */
public record Fingerprint(String operation, String digest) {

    public static Fingerprint ofPattern(String operation, String options, String pattern) {
        return of(operation, options, "regex:" + pattern);
    }

    public static Fingerprint ofAutomaton(String operation, String options, Object automaton) {
        return of(operation, options, canonicalForm(automaton));
    }

    public static Fingerprint ofPair(String operation, String options, Object first, Object second) {
        return of(operation, options, canonicalForm(first) + "\n&\n" + canonicalForm(second));
    }

    private static Fingerprint of(String operation, String options, String source) {
        final Hasher hasher = Hashing.sha256().newHasher();
        hasher.putString(operation, StandardCharsets.UTF_8).putChar('\0');
        hasher.putString(options, StandardCharsets.UTF_8).putChar('\0');
        hasher.putString(source, StandardCharsets.UTF_8);
        return new Fingerprint(operation, hasher.hash().toString());
    }

    static String canonicalForm(Object automaton) {
        switch (AutomatonKind.of(automaton)) {
            case DFA:
                return canonicalForm((CompactDFA<?>) automaton);
            case NFA:
            case EPSILON_NFA:
                return canonicalForm((CompactNFA<?>) automaton);
            default:
                throw new IllegalArgumentException("Not an automaton: " + automaton);
        }
    }

    private static <I> String canonicalForm(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final StringBuilder sb = header("dfa", alphabet, dfa.size());
        sb.append("init=").append(dfa.getIntInitialState()).append('\n');
        for (int s = 0; s < dfa.size(); s++) {
            sb.append(s).append(dfa.isAccepting(s) ? "+" : "-");
            for (int j = 0; j < alphabet.size(); j++) {
                sb.append(' ').append(dfa.getSuccessor(s, j));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static <I> String canonicalForm(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final CompactEpsilonNFA<I> epsilonNFA = nfa instanceof CompactEpsilonNFA ? (CompactEpsilonNFA<I>) nfa : null;
        final StringBuilder sb = header(epsilonNFA == null ? "nfa" : "enfa", alphabet, nfa.size());

        final BitSet inits = new BitSet();
        for (Integer s : nfa.getInitialStates()) {
            inits.set(s);
        }
        sb.append("init=").append(inits).append('\n');
        for (int s = 0; s < nfa.size(); s++) {
            sb.append(s).append(nfa.isAccepting(s) ? "+" : "-");
            for (I sym : alphabet) {
                final BitSet targets = new BitSet();
                for (Integer t : nfa.getTransitions(s, sym)) {
                    targets.set(t);
                }
                sb.append(' ').append(targets);
            }
            if (epsilonNFA != null) {
                sb.append(" e").append(epsilonNFA.getEpsilonSuccessors(s));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static StringBuilder header(String kind, Alphabet<?> alphabet, int size) {
        final StringBuilder sb = new StringBuilder(kind).append('\n');
        for (Object sym : alphabet) {
            // length prefix keeps symbols containing separators unambiguous;
            // the class keeps 1 and "1" apart
            final String text = String.valueOf(sym);
            sb.append(sym.getClass().getName()).append('/');
            sb.append(text.length()).append(':').append(text);
        }
        return sb.append('\n').append("states=").append(size).append('\n');
    }
}
