package FSAConv.Regex;

/**
 * @param type token type
 * @param value literal character, class letter or operator character; {@code '\0'} for EOF
 * @param position index of the token's first character in the pattern
 */
public record RegexToken(RegexTokenType type, char value, int position) {

  @Override
  public String toString() {
    return type + (type == RegexTokenType.EOF ? "" : "('" + value + "')") + "@" + position;
  }
}
