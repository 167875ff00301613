package FSAConv.Model;

import java.util.BitSet;

import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class CompactEpsilonNFATest {
  @Test
  void testEpsilonTransitions() {
    CompactEpsilonNFA<Character> nfa = new CompactEpsilonNFA<>(Alphabets.characters('a', 'b'));
    for (int i = 0; i < 3; i++) {
      nfa.addState(false);
    }
    Assertions.assertFalse(nfa.hasEpsilonSuccessors(0));
    Assertions.assertTrue(nfa.getEpsilonSuccessors(0).isEmpty());

    nfa.addEpsilonTransition(0, 1);
    nfa.addEpsilonTransition(0, 2);
    nfa.addEpsilonTransition(0, 1); // duplicate
    Assertions.assertEquals(2, nfa.numEpsilonTransitions());
    Assertions.assertTrue(nfa.hasEpsilonSuccessors(0));

    BitSet succs = nfa.getEpsilonSuccessors(0);
    succs.clear(); // caller gets a copy
    Assertions.assertEquals(2, nfa.getEpsilonSuccessors(0).cardinality());

    Assertions.assertThrows(IllegalArgumentException.class, () -> nfa.addEpsilonTransition(0, 3));
    Assertions.assertThrows(IllegalArgumentException.class, () -> nfa.addEpsilonTransition(-1, 0));

    nfa.clear();
    Assertions.assertEquals(0, nfa.size());
    Assertions.assertEquals(0, nfa.numEpsilonTransitions());
  }

  @Test
  void testCreator() {
    CompactEpsilonNFA<Integer> nfa = new CompactEpsilonNFA.Creator<Integer>()
        .createAutomaton(Alphabets.integers(0, 1), 4);
    Assertions.assertEquals(0, nfa.size());
    Assertions.assertEquals(2, nfa.getInputAlphabet().size());
  }
}
