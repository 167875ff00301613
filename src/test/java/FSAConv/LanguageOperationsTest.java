package FSAConv;

import java.util.List;

import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LanguageOperationsTest {
  private final LanguageOperations ops = new LanguageOperations(Cancellation.none());

  private static CompactDFA<Character> dfa(String pattern) {
    return PowersetDeterminizer.determinize(ThompsonCompiler.compile(pattern));
  }

  @Test
  void testBooleanOperations() {
    CompactDFA<Character> startsWithA = dfa("a(a|b)*");
    CompactDFA<Character> endsWithB = dfa("(a|b)*b");

    CompactDFA<Character> union = ops.union(startsWithA, endsWithB);
    CompactDFA<Character> intersection = ops.intersection(startsWithA, endsWithB);
    CompactDFA<Character> difference = ops.difference(startsWithA, endsWithB);
    CompactDFA<Character> symmetric = ops.symmetricDifference(startsWithA, endsWithB);

    for (List<Character> word : LanguageOracle.words(List.of('a', 'b'), 5)) {
      boolean l = LanguageOracle.accepts(startsWithA, word);
      boolean r = LanguageOracle.accepts(endsWithB, word);
      Assertions.assertEquals(l || r, LanguageOracle.accepts(union, word), "union " + word);
      Assertions.assertEquals(l && r, LanguageOracle.accepts(intersection, word), "intersection " + word);
      Assertions.assertEquals(l && !r, LanguageOracle.accepts(difference, word), "difference " + word);
      Assertions.assertEquals(l != r, LanguageOracle.accepts(symmetric, word), "symmetric " + word);
    }
  }

  @Test
  void testDifferentAlphabets() {
    CompactDFA<Character> union = ops.union(dfa("a+"), dfa("b"));
    Assertions.assertEquals(2, union.getInputAlphabet().size());
    Assertions.assertTrue(LanguageOracle.accepts(union, "aa"));
    Assertions.assertTrue(LanguageOracle.accepts(union, "b"));
    Assertions.assertFalse(LanguageOracle.accepts(union, "ab"));

    Assertions.assertTrue(EquivalenceValidator.equivalent(ops.intersection(dfa("a+"), dfa("b")),
        ops.intersection(dfa("b"), dfa("a"))));
  }

  @Test
  void testComplement() {
    CompactDFA<Character> evenA = dfa("(b*ab*a)*b*");
    CompactDFA<Character> complement = ops.complement(evenA);
    Assertions.assertEquals(evenA.size() + 1, complement.size());
    for (List<Character> word : LanguageOracle.words(List.of('a', 'b'), 5)) {
      Assertions.assertNotEquals(LanguageOracle.accepts(evenA, word), LanguageOracle.accepts(complement, word));
    }
    // double complement is complete but accepts the same language
    Assertions.assertTrue(EquivalenceValidator.equivalent(evenA, ops.complement(complement)));
  }

  @Test
  void testConcatenationAndStar() {
    CompactEpsilonNFA<Character> concat = ops.concatenation(ThompsonCompiler.compile("ab"), ThompsonCompiler.compile("c*"));
    Assertions.assertEquals(3, concat.getInputAlphabet().size());
    LanguageOracle.assertSameLanguage(ThompsonCompiler.compile("abc*"), concat, List.of('a', 'b', 'c'), 5);

    CompactEpsilonNFA<Character> star = ops.kleeneStar(ThompsonCompiler.compile("ab|b"));
    Assertions.assertTrue(LanguageOracle.accepts(star, ""));
    LanguageOracle.assertSameLanguage(ThompsonCompiler.compile("(ab|b)*"), star, List.of('a', 'b'), 6);
  }
}
