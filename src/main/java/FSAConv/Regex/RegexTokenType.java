package FSAConv.Regex;

public enum RegexTokenType {
    LITERAL,
    /** Escape class such as {@code \d}; the token value holds the class letter. */
    CLASS,
    EMPTY_SET,
    UNION,
    STAR,
    PLUS,
    OPTIONAL,
    LEFT_PAREN,
    RIGHT_PAREN,
    EOF;

    public boolean isPostfix() {
        return this == STAR || this == PLUS || this == OPTIONAL;
    }

    public boolean startsPrimary() {
        return this == LITERAL || this == CLASS || this == EMPTY_SET || this == LEFT_PAREN;
    }
}
