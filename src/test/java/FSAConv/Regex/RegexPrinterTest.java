package FSAConv.Regex;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexPrinterTest {
  @Test
  void testMinimalParentheses() {
    Assertions.assertEquals("a|bc*", print("a|bc*"));
    Assertions.assertEquals("(a|b)c", print("(a|b)c"));
    Assertions.assertEquals("(ab)*", print("(ab)*"));
    Assertions.assertEquals("a(b|c)?", print("a(b|c)?"));
    Assertions.assertEquals("abc", print("(ab)c"));
    Assertions.assertEquals("a**", print("a**"));
  }

  @Test
  void testSpecialSymbols() {
    Assertions.assertEquals("()", RegexPrinter.print(RegexNodes.EPSILON));
    Assertions.assertEquals("∅", RegexPrinter.print(RegexNodes.EMPTY_SET));
    Assertions.assertEquals("\\*\\|\\\\", print("\\*\\|\\\\"));
    Assertions.assertEquals("\\∅", RegexPrinter.print(RegexNodes.literal('∅')));
    Assertions.assertEquals("()*", print("()*"));
  }

  @Test
  void testReparse() {
    // printing then parsing gives back the same tree for left-nested input
    for (String pattern : new String[] {"a|b|c", "(a|b)*c+", "a?b?", "((a|())b)*", "x\\(y\\)", "∅|a"}) {
      RegexNode parsed = RegexParser.parse(pattern);
      Assertions.assertEquals(parsed, RegexParser.parse(RegexPrinter.print(parsed)), pattern);
    }
  }

  @Test
  void testSmartConstructors() {
    RegexNode a = RegexNodes.literal('a');
    RegexNode b = RegexNodes.literal('b');

    Assertions.assertEquals(a, RegexNodes.union(RegexNodes.EMPTY_SET, a));
    Assertions.assertEquals(a, RegexNodes.union(a, RegexNodes.EMPTY_SET));
    Assertions.assertEquals(a, RegexNodes.union(a, a));
    Assertions.assertEquals(new RegexNode.Optional(a), RegexNodes.union(RegexNodes.EPSILON, a));
    Assertions.assertEquals(RegexNodes.EMPTY_SET, RegexNodes.concat(a, RegexNodes.EMPTY_SET));
    Assertions.assertEquals(b, RegexNodes.concat(RegexNodes.EPSILON, b));
    Assertions.assertEquals(RegexNodes.EPSILON, RegexNodes.star(RegexNodes.EMPTY_SET));
    Assertions.assertEquals(new RegexNode.Star(a), RegexNodes.star(RegexNodes.star(a)));
    Assertions.assertEquals(new RegexNode.Star(a), RegexNodes.star(new RegexNode.Plus(a)));
    Assertions.assertEquals(new RegexNode.Star(a), RegexNodes.optional(new RegexNode.Plus(a)));
    Assertions.assertEquals(new RegexNode.Star(a), RegexNodes.optional(new RegexNode.Star(a)));
  }

  @Test
  void testNullable() {
    Assertions.assertTrue(RegexParser.parse("a*").isNullable());
    Assertions.assertTrue(RegexParser.parse("a?b*").isNullable());
    Assertions.assertTrue(RegexParser.parse("").isNullable());
    Assertions.assertFalse(RegexParser.parse("a+").isNullable());
    Assertions.assertFalse(RegexParser.parse("a*b").isNullable());
    Assertions.assertFalse(RegexParser.parse("∅").isNullable());
  }

  private static String print(String pattern) {
    return RegexPrinter.print(RegexParser.parse(pattern));
  }
}
