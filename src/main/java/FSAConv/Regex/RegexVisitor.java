package FSAConv.Regex;

/**
 * Bottom-up traversal of the regular expression AST.
 *
 * @param <R> output from traversing a subtree
 */
public interface RegexVisitor<R> {

  /**
   * Matches exactly one character.
   */
  R visitLiteral(char symbol);

  /**
   * Empty expression, matching only the empty string.
   */
  R visitEpsilon();

  /**
   * Matches nothing at all.
   */
  R visitEmptySet();

  /**
   * Matches either side.
   */
  R visitUnion(R lhs, R rhs);

  /**
   * Matches the left pattern followed by the right one.
   */
  R visitConcat(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   */
  R visitStar(R child);

  /**
   * Matches a pattern one or more times.
   */
  R visitPlus(R child);

  /**
   * Matches a pattern zero or one times.
   */
  R visitOptional(R child);
}
