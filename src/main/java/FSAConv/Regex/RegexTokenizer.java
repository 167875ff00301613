package FSAConv.Regex;

import java.util.ArrayList;
import java.util.List;

import FSAConv.Exceptions.RegexSyntaxException;

/**
 * Splits a pattern into positioned tokens. The list always ends with an EOF token.
 */
public class RegexTokenizer {
    public static final char EMPTY_SET = '∅';

    private RegexTokenizer() {}

    public static List<RegexToken> tokenize(String pattern) {
        final List<RegexToken> tokens = new ArrayList<>(pattern.length() + 1);
        int i = 0;
        while (i < pattern.length()) {
            final char c = pattern.charAt(i);
            switch (c) {
                case '|' -> tokens.add(new RegexToken(RegexTokenType.UNION, c, i));
                case '*' -> tokens.add(new RegexToken(RegexTokenType.STAR, c, i));
                case '+' -> tokens.add(new RegexToken(RegexTokenType.PLUS, c, i));
                case '?' -> tokens.add(new RegexToken(RegexTokenType.OPTIONAL, c, i));
                case '(' -> tokens.add(new RegexToken(RegexTokenType.LEFT_PAREN, c, i));
                case ')' -> tokens.add(new RegexToken(RegexTokenType.RIGHT_PAREN, c, i));
                case EMPTY_SET -> tokens.add(new RegexToken(RegexTokenType.EMPTY_SET, c, i));
                case '\\' -> {
                    if (i + 1 >= pattern.length()) {
                        throw new RegexSyntaxException("Unterminated escape", pattern, i);
                    }
                    final char next = pattern.charAt(i + 1);
                    if (CharClasses.isClassLetter(next)) {
                        tokens.add(new RegexToken(RegexTokenType.CLASS, next, i));
                    } else {
                        tokens.add(new RegexToken(RegexTokenType.LITERAL, next, i));
                    }
                    i++; // consume escaped character
                }
                default -> tokens.add(new RegexToken(RegexTokenType.LITERAL, c, i));
            }
            i++;
        }
        tokens.add(new RegexToken(RegexTokenType.EOF, '\0', pattern.length()));
        return tokens;
    }
}
