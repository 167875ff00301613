package FSAConv;

import java.util.List;

import FSAConv.Model.AutomatonDescription;
import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Model.OptimizationResult;
import FSAConv.Model.TransitionChange;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class OptimizerTest {
  private final Optimizer optimizer = new Optimizer(Cancellation.none());

  @Test
  void testOptimizeReportsInSourceStates() {
    CompactDFA<Character> source = AutomatonTrimTest.redundantDFA();
    OptimizationResult<CompactDFA<Character>, Character> result = optimizer.optimize(source);

    Assertions.assertEquals(2, result.automaton().size());
    Assertions.assertArrayEquals(new int[] {0, 1, 0, -1, -1}, result.stateMapping());
    Assertions.assertEquals(List.of(
        TransitionChange.removal(3, 'a', 1),
        TransitionChange.removal(0, 'c', 4),
        TransitionChange.removal(4, 'c', 4),
        TransitionChange.modification(0, 'b', 2, 0),
        TransitionChange.modification(1, 'b', 2, 0),
        TransitionChange.modification(2, 'b', 2, 0)), result.changes());
    Assertions.assertEquals(2, result.removedStates());
    Assertions.assertFalse(result.isUnchanged());
  }

  @Test
  void testOptimizeIdempotent() {
    for (String pattern : new String[] {"(a|b)*abb", "a*|b*", "(a|())(b|())", "∅", ""}) {
      OptimizationResult<CompactDFA<Character>, Character> once =
          optimizer.optimize(ThompsonCompiler.compile(pattern));
      OptimizationResult<CompactDFA<Character>, Character> twice = optimizer.optimize(once.automaton());
      Assertions.assertTrue(twice.isUnchanged(), pattern);
      Assertions.assertTrue(EquivalenceValidator.sameStructure(once.automaton(), twice.automaton()), pattern);
    }
  }

  @Test
  void testOptimizeNFA() {
    CompactEpsilonNFA<Character> nfa = ThompsonCompiler.compile("(a|b)*abb");
    CompactDFA<Character> min = optimizer.optimize(nfa).automaton();
    Assertions.assertEquals(4, min.size());
    LanguageOracle.assertSameLanguage(nfa, min, List.of('a', 'b'), 7);

    Assertions.assertEquals(4, optimizer.minimize(nfa).automaton().size());
  }

  @Test
  void testPruneKeepsDistinctStates() {
    OptimizationResult<CompactDFA<Character>, Character> result = optimizer.prune(AutomatonTrimTest.redundantDFA());
    Assertions.assertEquals(3, result.automaton().size()); // q0 and q2 are not merged
    Assertions.assertArrayEquals(new int[] {0, 1, 2, -1, -1}, result.stateMapping());
    Assertions.assertEquals(List.of(
        TransitionChange.removal(3, 'a', 1),
        TransitionChange.removal(0, 'c', 4),
        TransitionChange.removal(4, 'c', 4)), result.changes());
  }

  @Test
  void testPruneNFA() {
    CompactNFA<Character> nfa = AutomatonValidator.toNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("0", "1", "2", "3")
        .initial("0")
        .accepting("1")
        .transition("0", 'a', "1")
        .transition("0", 'a', "2")
        .transition("3", 'a', "1")
        .build());
    OptimizationResult<CompactNFA<Character>, Character> result = optimizer.prune(nfa);
    Assertions.assertEquals(2, result.automaton().size());
    Assertions.assertArrayEquals(new int[] {0, 1, -1, -1}, result.stateMapping());
    Assertions.assertEquals(List.of(
        TransitionChange.removal(3, 'a', 1),
        TransitionChange.removal(0, 'a', 2)), result.changes());
  }

  @Test
  void testChainTranslatesIndices() {
    OptimizationResult<String, Character> first = new OptimizationResult<>("mid",
        List.of(TransitionChange.removal(1, 'x', 0)), new int[] {0, -1, 1});
    OptimizationResult<String, Character> second = new OptimizationResult<>("out",
        List.of(TransitionChange.modification(1, 'y', 1, 0)), new int[] {0, 0});
    OptimizationResult<String, Character> chained = Optimizer.chain(first, second);

    Assertions.assertEquals("out", chained.automaton());
    Assertions.assertArrayEquals(new int[] {0, -1, 0}, chained.stateMapping());
    Assertions.assertEquals(List.of(
        TransitionChange.removal(1, 'x', 0),
        TransitionChange.modification(2, 'y', 2, 0)), chained.changes());
  }
}
