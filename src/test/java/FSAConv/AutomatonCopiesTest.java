package FSAConv;

import java.util.List;
import java.util.Set;

import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AutomatonCopiesTest {
  private static final Alphabet<String> WORDS = Alphabets.fromCollection(List.of("x", "y"));

  @Test
  void testEpsilonNFAOntoOtherSymbols() {
    CompactEpsilonNFA<Character> source = ThompsonCompiler.compile("a*b");
    CompactNFA<String> copy = AutomatonCopies.copy((CompactNFA<Character>) source, WORDS);
    Assertions.assertTrue(copy instanceof CompactEpsilonNFA);

    CompactEpsilonNFA<String> epsilonCopy = (CompactEpsilonNFA<String>) copy;
    Assertions.assertEquals(source.size(), epsilonCopy.size());
    Assertions.assertEquals(source.numEpsilonTransitions(), epsilonCopy.numEpsilonTransitions());
    for (int s = 0; s < source.size(); s++) {
      Assertions.assertEquals(source.getEpsilonSuccessors(s), epsilonCopy.getEpsilonSuccessors(s));
      Assertions.assertEquals(Set.copyOf(source.getTransitions(s, Character.valueOf('a'))),
          Set.copyOf(epsilonCopy.getTransitions(s, "x")));
      Assertions.assertEquals(Set.copyOf(source.getTransitions(s, Character.valueOf('b'))),
          Set.copyOf(epsilonCopy.getTransitions(s, "y")));
    }
    Assertions.assertTrue(LanguageOracle.accepts(epsilonCopy, List.of("x", "x", "y")));
    Assertions.assertFalse(LanguageOracle.accepts(epsilonCopy, List.of("y", "x")));
  }

  @Test
  void testCopyIsDetached() {
    CompactDFA<Character> source = PowersetDeterminizer.determinize(ThompsonCompiler.compile("ab"));
    CompactDFA<Character> copy = AutomatonCopies.copy(source, source.getInputAlphabet());
    Assertions.assertTrue(EquivalenceValidator.sameStructure(source, copy));

    copy.setAccepting(copy.getIntInitialState(), true);
    Assertions.assertFalse(source.isAccepting(source.getIntInitialState()));
  }

  @Test
  void testAlphabetSizeMustMatch() {
    CompactDFA<Character> source = PowersetDeterminizer.determinize(ThompsonCompiler.compile("abc"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> AutomatonCopies.copy(source, WORDS));
  }
}
