package FSAConv;

import java.util.BitSet;

import FSAConv.Model.AutomatonDescription;
import FSAConv.Model.CompactEpsilonNFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class EpsilonClosureTest {
  @Test
  void testCycleTerminates() {
    // 0 -> 1 -> 2 -> 0 by epsilon, 3 only by 'a'
    CompactEpsilonNFA<Character> nfa = AutomatonValidator.toEpsilonNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("0", "1", "2", "3")
        .initial("0")
        .accepting("3")
        .epsilon("0", "1").epsilon("1", "2").epsilon("2", "0")
        .transition("2", 'a', "3")
        .build());

    EpsilonClosure<Character> closure = new EpsilonClosure<>(nfa);
    Assertions.assertTrue(closure.hasEpsilonTransitions());
    Assertions.assertEquals(BitSetUtils.of(0, 1, 2), closure.closure(0));
    Assertions.assertEquals(BitSetUtils.of(0, 1, 2), closure.closure(2));
    Assertions.assertEquals(BitSetUtils.of(3), closure.closure(3));
    Assertions.assertEquals(BitSetUtils.of(0, 1, 2, 3), closure.closure(BitSetUtils.of(1, 3)));
    Assertions.assertEquals(new BitSet(), closure.closure(new BitSet()));
  }

  @Test
  void testInputNotModified() {
    CompactEpsilonNFA<Character> nfa = AutomatonValidator.toEpsilonNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("0", "1")
        .epsilon("0", "1")
        .build());
    BitSet start = BitSetUtils.of(0);
    Assertions.assertEquals(BitSetUtils.of(0, 1), EpsilonClosure.closure(nfa, start));
    Assertions.assertEquals(BitSetUtils.of(0), start);
  }

  @Test
  void testSelfLoop() {
    CompactEpsilonNFA<Character> nfa = AutomatonValidator.toEpsilonNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("0")
        .epsilon("0", "0")
        .build());
    Assertions.assertEquals(BitSetUtils.of(0), EpsilonClosure.closure(nfa, BitSetUtils.of(0)));
    Assertions.assertEquals(1, nfa.numEpsilonTransitions());
  }

  @Test
  void testPlainNFAIsIdentity() {
    CompactNFA<Character> nfa = AutomatonValidator.toNFA(AutomatonDescription.<Character>builder()
        .symbols('a')
        .states("0", "1")
        .transition("0", 'a', "1")
        .build());
    EpsilonClosure<Character> closure = new EpsilonClosure<>(nfa);
    Assertions.assertFalse(closure.hasEpsilonTransitions());
    Assertions.assertEquals(BitSetUtils.of(0), closure.closure(0));
    Assertions.assertEquals(BitSetUtils.of(0, 1), closure.closure(BitSetUtils.of(0, 1)));
  }
}
