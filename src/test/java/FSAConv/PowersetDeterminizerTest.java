package FSAConv;

import java.time.Duration;
import java.util.List;

import FSAConv.Exceptions.ConversionTimeoutException;
import FSAConv.Exceptions.StateLimitExceededException;
import FSAConv.Model.AutomatonDescription;
import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Model.DeterminizationResult;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PowersetDeterminizerTest {
  @Test
  void testCanonicalNaming() {
    // Thompson "a*b": a = 0->1, star wrapper 2/3, b = 4->5; initial 2, final 5
    CompactEpsilonNFA<Character> nfa = ThompsonCompiler.compile("a*b");
    DeterminizationResult<Character> result = new PowersetDeterminizer(Cancellation.none()).run(nfa);
    CompactDFA<Character> dfa = result.dfa();

    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals(0, dfa.getIntInitialState());
    Assertions.assertEquals("{0, 2, 3, 4}", result.stateName(0));
    Assertions.assertEquals("{0, 1, 3, 4}", result.stateName(1)); // reached by 'a' first
    Assertions.assertEquals("{5}", result.stateName(2));
    Assertions.assertFalse(dfa.isAccepting(0));
    Assertions.assertFalse(dfa.isAccepting(1));
    Assertions.assertTrue(dfa.isAccepting(2));

    Alphabet<Character> alphabet = dfa.getInputAlphabet();
    int a = alphabet.getSymbolIndex('a');
    int b = alphabet.getSymbolIndex('b');
    Assertions.assertEquals(1, dfa.getSuccessor(0, a));
    Assertions.assertEquals(2, dfa.getSuccessor(0, b));
    Assertions.assertEquals(1, dfa.getSuccessor(1, a));
    Assertions.assertEquals(2, dfa.getSuccessor(1, b));
    // empty subsets are not materialized
    Assertions.assertTrue(dfa.getSuccessor(2, a) < 0);
    Assertions.assertTrue(dfa.getSuccessor(2, b) < 0);
  }

  @Test
  void testRepeatable() {
    CompactEpsilonNFA<Character> nfa = ThompsonCompiler.compile("(a|b)*abb");
    DeterminizationResult<Character> first = new PowersetDeterminizer(Cancellation.none()).run(nfa);
    DeterminizationResult<Character> second = new PowersetDeterminizer(Cancellation.none()).run(nfa);
    Assertions.assertEquals(first.subsets(), second.subsets());
    LanguageOracle.assertSameLanguage(nfa, first.dfa(), List.of('a', 'b'), 7);
  }

  @Test
  void testSubsetCopy() {
    DeterminizationResult<Character> result = new PowersetDeterminizer(Cancellation.none())
        .run(ThompsonCompiler.compile("ab"));
    result.subset(0).clear();
    Assertions.assertFalse(result.subset(0).isEmpty());
  }

  @Test
  void testMultipleInitialStates() {
    CompactNFA<Character> nfa = AutomatonValidator.toNFA(AutomatonDescription.<Character>builder()
        .symbols('a', 'b')
        .states("p", "q", "r")
        .initial("p").initial("q")
        .accepting("r")
        .transition("p", 'a', "r")
        .transition("q", 'b', "r")
        .build());
    DeterminizationResult<Character> result = new PowersetDeterminizer(Cancellation.none()).run(nfa);
    Assertions.assertEquals("{0, 1}", result.stateName(0));
    Assertions.assertEquals(2, result.dfa().size()); // both letters lead to {2}
    Assertions.assertTrue(LanguageOracle.accepts(result.dfa(), "a"));
    Assertions.assertTrue(LanguageOracle.accepts(result.dfa(), "b"));
    Assertions.assertFalse(LanguageOracle.accepts(result.dfa(), "ab"));
  }

  @Test
  void testNoInitialState() {
    CompactNFA<Character> nfa = AutomatonValidator.toNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("p")
        .accepting("p")
        .transition("p", 'a', "p")
        .build());
    CompactDFA<Character> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertEquals(1, dfa.size()); // the empty start subset
    Assertions.assertFalse(LanguageOracle.accepts(dfa, ""));
    Assertions.assertFalse(LanguageOracle.accepts(dfa, "a"));
  }

  @Test
  void testStateLimit() {
    // the 4th letter from the end is an 'a': the start subset is never re-entered,
    // so subset construction yields 17 states for a minimal DFA of 16
    CompactEpsilonNFA<Character> nfa = ThompsonCompiler.compile("(a|b)*a(a|b)(a|b)(a|b)");
    CompactDFA<Character> dfa = PowersetDeterminizer.determinize(nfa);
    Assertions.assertEquals(17, dfa.size());
    Assertions.assertEquals(16, PartitionMinimizer.minimize(dfa).size());

    StateLimitExceededException e = Assertions.assertThrows(StateLimitExceededException.class,
        () -> new PowersetDeterminizer(new Cancellation(5, null)).run(nfa));
    Assertions.assertEquals(5, e.getLimit());

    Assertions.assertEquals(17, new PowersetDeterminizer(new Cancellation(17, null)).run(nfa).dfa().size());
    Assertions.assertThrows(StateLimitExceededException.class,
        () -> new PowersetDeterminizer(new Cancellation(16, null)).run(nfa));
  }

  @Test
  void testTimeout() {
    CompactEpsilonNFA<Character> nfa = ThompsonCompiler.compile("a|b");
    ConversionTimeoutException e = Assertions.assertThrows(ConversionTimeoutException.class,
        () -> new PowersetDeterminizer(new Cancellation(Integer.MAX_VALUE, Duration.ZERO)).run(nfa));
    Assertions.assertEquals(Duration.ZERO, e.getTimeout());
  }
}
