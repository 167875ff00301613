package FSAConv.Regex;

import java.util.List;

import FSAConv.Exceptions.RegexSyntaxException;

/**
 * Recursive descent parser for the pattern language:
 * <pre>
 *   union   := concat ('|' concat)*
 *   concat  := postfix*
 *   postfix := primary ('*' | '+' | '?')*
 *   primary := literal | '\d' | '\w' | '\s' | '∅' | '(' union ')'
 * </pre>
 * The empty pattern and {@code ()} denote the empty word. Concatenation and
 * alternation nest to the left.
 */
public class RegexParser {
    private final String pattern;
    private final List<RegexToken> tokens;
    private int index;

    private RegexParser(String pattern) {
        this.pattern = pattern;
        this.tokens = RegexTokenizer.tokenize(pattern);
    }

    public static RegexNode parse(String pattern) {
        return new RegexParser(pattern).parseAll();
    }

    private RegexNode parseAll() {
        final RegexNode node = parseUnion();
        final RegexToken rest = current();
        if (rest.type() != RegexTokenType.EOF) {
            // only a ')' can stop the union early
            throw new RegexSyntaxException("Unmatched parenthesis", pattern, rest.position());
        }
        return node == null ? new RegexNode.Epsilon() : node;
    }

    /**
     * @return the parsed alternation, or null if no factor was found before ')' or EOF
     */
    private RegexNode parseUnion() {
        RegexNode left = parseConcat();
        if (left == null) {
            if (current().type() == RegexTokenType.UNION) {
                throw dangling(current());
            }
            return null;
        }
        while (current().type() == RegexTokenType.UNION) {
            final RegexToken bar = advance();
            final RegexNode right = parseConcat();
            if (right == null) {
                throw dangling(bar);
            }
            left = new RegexNode.Union(left, right);
        }
        return left;
    }

    private RegexNode parseConcat() {
        RegexNode left = null;
        while (true) {
            final RegexToken token = current();
            if (token.type().isPostfix()) {
                // a postfix operator is only valid right after a primary
                throw dangling(token);
            }
            if (!token.type().startsPrimary()) {
                return left;
            }
            final RegexNode factor = parsePostfix();
            left = left == null ? factor : new RegexNode.Concat(left, factor);
        }
    }

    private RegexNode parsePostfix() {
        RegexNode node = parsePrimary();
        while (current().type().isPostfix()) {
            final RegexToken op = advance();
            node = switch (op.type()) {
                case STAR -> new RegexNode.Star(node);
                case PLUS -> new RegexNode.Plus(node);
                case OPTIONAL -> new RegexNode.Optional(node);
                default -> throw new IllegalStateException("Not a postfix operator: " + op);
            };
        }
        return node;
    }

    private RegexNode parsePrimary() {
        final RegexToken token = advance();
        switch (token.type()) {
            case LITERAL:
                return new RegexNode.Literal(token.value());
            case CLASS:
                return charClass(token.value());
            case EMPTY_SET:
                return new RegexNode.EmptySet();
            case LEFT_PAREN: {
                final RegexNode inner = parseUnion();
                if (current().type() != RegexTokenType.RIGHT_PAREN) {
                    throw new RegexSyntaxException("Unmatched parenthesis", pattern, token.position());
                }
                advance();
                return inner == null ? new RegexNode.Epsilon() : inner;
            }
            default:
                throw new IllegalStateException("Unexpected token " + token);
        }
    }

    private static RegexNode charClass(char classLetter) {
        RegexNode node = null;
        for (char c : CharClasses.members(classLetter)) {
            final RegexNode literal = new RegexNode.Literal(c);
            node = node == null ? literal : new RegexNode.Union(node, literal);
        }
        return node;
    }

    private RegexSyntaxException dangling(RegexToken operator) {
        return new RegexSyntaxException("Dangling operator '" + operator.value() + "'", pattern, operator.position());
    }

    private RegexToken current() {
        return tokens.get(index);
    }

    private RegexToken advance() {
        final RegexToken token = tokens.get(index);
        if (token.type() != RegexTokenType.EOF) {
            index++;
        }
        return token;
    }
}
