package FSAConv;

import FSAConv.Exceptions.EquivalenceCheckException;
import FSAConv.Model.AutomatonDescription;
import FSAConv.Model.Cancellation;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class EquivalenceValidatorTest {
  private final EquivalenceValidator strict = new EquivalenceValidator(Cancellation.none(), true);
  private final EquivalenceValidator lenient = new EquivalenceValidator(Cancellation.none(), false);

  private static CompactDFA<Character> dfa(String pattern) {
    return PowersetDeterminizer.determinize(ThompsonCompiler.compile(pattern));
  }

  @Test
  void testEquivalentPatterns() {
    Assertions.assertTrue(EquivalenceValidator.equivalent(dfa("(a|b)*"), dfa("(a*b*)*")));
    Assertions.assertTrue(EquivalenceValidator.equivalent(dfa("a|b"), dfa("b|a")));
    Assertions.assertTrue(EquivalenceValidator.equivalent(dfa("(ab)*a"), dfa("a(ba)*")));
    Assertions.assertFalse(EquivalenceValidator.equivalent(dfa("a*"), dfa("a+")));
    Assertions.assertFalse(EquivalenceValidator.equivalent(dfa("(a|b)*abb"), dfa("(a|b)*bb")));
  }

  @Test
  void testNFAs() {
    Assertions.assertTrue(strict.test(ThompsonCompiler.compile("a(b|c)"), ThompsonCompiler.compile("ab|ac")));
    Assertions.assertFalse(strict.test(ThompsonCompiler.compile("a(b|c)*"), ThompsonCompiler.compile("ab|ac")));
  }

  @Test
  void testAlphabetMismatch() {
    Assertions.assertThrows(EquivalenceCheckException.class, () -> strict.test(dfa("a"), dfa("b")));
    Assertions.assertFalse(lenient.test(dfa("a"), dfa("b")));

    // 'b' only occurs on a dead path
    Assertions.assertThrows(EquivalenceCheckException.class, () -> strict.test(dfa("a|∅b"), dfa("a")));
    Assertions.assertTrue(lenient.test(dfa("a|∅b"), dfa("a")));
  }

  @Test
  void testAlphabetOrderIgnored() {
    CompactDFA<Character> ab = AutomatonValidator.toDFA(AutomatonDescription.<Character>builder()
        .symbols('a', 'b')
        .states("q0", "q1")
        .initial("q0")
        .accepting("q1")
        .transition("q0", 'a', "q1")
        .build());
    CompactDFA<Character> ba = AutomatonValidator.toDFA(AutomatonDescription.<Character>builder()
        .symbols('b', 'a')
        .states("q0", "q1")
        .initial("q0")
        .accepting("q1")
        .transition("q0", 'a', "q1")
        .build());
    Assertions.assertTrue(strict.test(ab, ba));
  }

  @Test
  void testCounterexample() {
    Assertions.assertEquals(Word.epsilon(), strict.findCounterexample(dfa("a*"), dfa("a+")));
    Assertions.assertEquals(Word.fromSymbols('b', 'b'), strict.findCounterexample(dfa("(a|b)*abb"), dfa("(a|b)*bb")));
    // symbols are tried in union alphabet order
    Assertions.assertEquals(Word.fromSymbols('a'), lenient.findCounterexample(dfa("a"), dfa("b")));
    Assertions.assertNull(strict.findCounterexample(dfa("(a|b)*"), dfa("(a*b*)*")));
  }
}
