package FSAConv.Regex;

/**
 * Renders an AST as a pattern that {@link RegexParser} reads back into an
 * equivalent tree. Parentheses are only emitted where precedence requires them.
 */
public class RegexPrinter implements RegexVisitor<RegexPrinter.Printed> {
    private static final int UNION = 0;
    private static final int CONCAT = 1;
    private static final int POSTFIX = 2;
    private static final int ATOM = 3;

    private static final String SPECIAL = "|*+?()\\" + RegexTokenizer.EMPTY_SET;

    public record Printed(String text, int precedence) { }

    public static String print(RegexNode node) {
        return node.accept(new RegexPrinter()).text();
    }

    static String escape(char symbol) {
        return SPECIAL.indexOf(symbol) >= 0 ? "\\" + symbol : String.valueOf(symbol);
    }

    @Override
    public Printed visitLiteral(char symbol) {
        return new Printed(escape(symbol), ATOM);
    }

    @Override
    public Printed visitEpsilon() {
        return new Printed("()", ATOM);
    }

    @Override
    public Printed visitEmptySet() {
        return new Printed(String.valueOf(RegexTokenizer.EMPTY_SET), ATOM);
    }

    @Override
    public Printed visitUnion(Printed lhs, Printed rhs) {
        return new Printed(lhs.text() + "|" + rhs.text(), UNION);
    }

    @Override
    public Printed visitConcat(Printed lhs, Printed rhs) {
        return new Printed(wrap(lhs, CONCAT) + wrap(rhs, CONCAT), CONCAT);
    }

    @Override
    public Printed visitStar(Printed child) {
        return new Printed(wrap(child, POSTFIX) + "*", POSTFIX);
    }

    @Override
    public Printed visitPlus(Printed child) {
        return new Printed(wrap(child, POSTFIX) + "+", POSTFIX);
    }

    @Override
    public Printed visitOptional(Printed child) {
        return new Printed(wrap(child, POSTFIX) + "?", POSTFIX);
    }

    private static String wrap(Printed printed, int required) {
        return printed.precedence() < required ? "(" + printed.text() + ")" : printed.text();
    }
}
