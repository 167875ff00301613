package FSAConv;

import java.util.BitSet;

import FSAConv.Model.CompactEpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.AutomatonCreator;
import net.automatalib.automaton.fsa.MutableNFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Index-preserving copies between the automaton representations. Every DFA is an
 * NFA and every NFA is an epsilon-NFA, so these conversions never change the language.
 */
public final class AutomatonCopies {

    private AutomatonCopies() {
    }

    public static <I> CompactNFA<I> toNFA(CompactDFA<I> dfa) {
        return copyWith(dfa, new CompactNFA.Creator<>());
    }

    public static <I> CompactEpsilonNFA<I> toEpsilonNFA(CompactDFA<I> dfa) {
        return copyWith(dfa, new CompactEpsilonNFA.Creator<>());
    }

    public static <I> CompactEpsilonNFA<I> toEpsilonNFA(CompactNFA<I> nfa) {
        if (nfa instanceof CompactEpsilonNFA) {
            return (CompactEpsilonNFA<I>) nfa;
        }
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final CompactEpsilonNFA<I> out = new CompactEpsilonNFA.Creator<I>().createAutomaton(alphabet, nfa.size());
        for (int s = 0; s < nfa.size(); s++) {
            out.addState(nfa.isAccepting(s));
        }
        for (Integer init : nfa.getInitialStates()) {
            out.setInitial(init.intValue(), true);
        }
        for (int s = 0; s < nfa.size(); s++) {
            for (I sym : alphabet) {
                for (Integer t : nfa.getTransitions(s, sym)) {
                    out.addTransition(s, sym, t.intValue());
                }
            }
        }
        return out;
    }

    /**
     * Copies {@code dfa} state by state onto {@code alphabet}. The symbol at index j of
     * {@code alphabet} stands for the source symbol at index j.
     */
    public static <S, I> CompactDFA<I> copy(CompactDFA<S> dfa, Alphabet<I> alphabet) {
        checkAlphabetSize(dfa.getInputAlphabet(), alphabet);
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        for (int s = 0; s < dfa.size(); s++) {
            out.addState(dfa.isAccepting(s));
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            out.setInitialState(init);
        }
        for (int s = 0; s < dfa.size(); s++) {
            for (int j = 0; j < alphabet.size(); j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t >= 0) {
                    out.setTransition(s, j, t);
                }
            }
        }
        return out;
    }

    /**
     * Like {@link #copy(CompactDFA, Alphabet)}; epsilon-NFAs keep their epsilon transitions.
     */
    public static <S, I> CompactNFA<I> copy(CompactNFA<S> nfa, Alphabet<I> alphabet) {
        if (nfa instanceof CompactEpsilonNFA) {
            return copy((CompactEpsilonNFA<S>) nfa, alphabet);
        }
        return copyInto(nfa, new CompactNFA<>(alphabet, nfa.size()));
    }

    public static <S, I> CompactEpsilonNFA<I> copy(CompactEpsilonNFA<S> nfa, Alphabet<I> alphabet) {
        final CompactEpsilonNFA<I> out = copyInto(nfa, new CompactEpsilonNFA<>(alphabet, nfa.size()));
        for (int s = 0; s < nfa.size(); s++) {
            final BitSet succs = nfa.getEpsilonSuccessors(s);
            for (int t = succs.nextSetBit(0); t >= 0; t = succs.nextSetBit(t + 1)) {
                out.addEpsilonTransition(s, t);
            }
        }
        return out;
    }

    private static <S, I, A extends CompactNFA<I>> A copyInto(CompactNFA<S> nfa, A out) {
        final Alphabet<S> source = nfa.getInputAlphabet();
        final Alphabet<I> target = out.getInputAlphabet();
        checkAlphabetSize(source, target);
        for (int s = 0; s < nfa.size(); s++) {
            out.addState(nfa.isAccepting(s));
        }
        for (Integer init : nfa.getInitialStates()) {
            out.setInitial(init.intValue(), true);
        }
        for (int s = 0; s < nfa.size(); s++) {
            for (int j = 0; j < source.size(); j++) {
                final I sym = target.getSymbol(j);
                for (Integer t : nfa.getTransitions(s, source.getSymbol(j))) {
                    out.addTransition(s, sym, t.intValue());
                }
            }
        }
        return out;
    }

    private static void checkAlphabetSize(Alphabet<?> source, Alphabet<?> target) {
        if (source.size() != target.size()) {
            throw new IllegalArgumentException("Alphabet of size " + target.size()
                    + " cannot stand for one of size " + source.size());
        }
    }

    private static <I, A extends MutableNFA<Integer, I>> A copyWith(CompactDFA<I> dfa, AutomatonCreator<A, I> creator) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final A out = creator.createAutomaton(alphabet, dfa.size());
        for (int s = 0; s < dfa.size(); s++) {
            out.addState(dfa.isAccepting(s));
        }
        final int init = dfa.getIntInitialState();
        if (init >= 0) {
            out.setInitial(init, true);
        }
        for (int s = 0; s < dfa.size(); s++) {
            for (int j = 0; j < alphabet.size(); j++) {
                final int t = dfa.getSuccessor(s, j);
                if (t >= 0) {
                    out.addTransition(s, alphabet.getSymbol(j), t);
                }
            }
        }
        return out;
    }
}
