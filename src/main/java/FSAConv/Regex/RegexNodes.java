package FSAConv.Regex;

/**
 * Simplifying constructors for {@link RegexNode}s. They keep state-elimination
 * output small by applying language-preserving identities at construction time.
 */
public final class RegexNodes {
    public static final RegexNode EPSILON = new RegexNode.Epsilon();
    public static final RegexNode EMPTY_SET = new RegexNode.EmptySet();

    private RegexNodes() {}

    public static RegexNode literal(char symbol) {
        return new RegexNode.Literal(symbol);
    }

    public static RegexNode union(RegexNode left, RegexNode right) {
        if (left instanceof RegexNode.EmptySet) {
            return right;
        }
        if (right instanceof RegexNode.EmptySet || left.equals(right)) {
            return left;
        }
        if (left instanceof RegexNode.Epsilon) {
            return optional(right);
        }
        if (right instanceof RegexNode.Epsilon) {
            return optional(left);
        }
        return new RegexNode.Union(left, right);
    }

    public static RegexNode concat(RegexNode left, RegexNode right) {
        if (left instanceof RegexNode.EmptySet || right instanceof RegexNode.EmptySet) {
            return EMPTY_SET;
        }
        if (left instanceof RegexNode.Epsilon) {
            return right;
        }
        if (right instanceof RegexNode.Epsilon) {
            return left;
        }
        return new RegexNode.Concat(left, right);
    }

    public static RegexNode star(RegexNode child) {
        if (child instanceof RegexNode.EmptySet || child instanceof RegexNode.Epsilon) {
            return EPSILON;
        }
        if (child instanceof RegexNode.Star) {
            return child;
        }
        if (child instanceof RegexNode.Plus) {
            return new RegexNode.Star(((RegexNode.Plus) child).child());
        }
        if (child instanceof RegexNode.Optional) {
            return star(((RegexNode.Optional) child).child());
        }
        return new RegexNode.Star(child);
    }

    public static RegexNode optional(RegexNode child) {
        if (child instanceof RegexNode.EmptySet || child instanceof RegexNode.Epsilon) {
            return EPSILON;
        }
        if (child.isNullable()) {
            return child;
        }
        if (child instanceof RegexNode.Plus) {
            return new RegexNode.Star(((RegexNode.Plus) child).child());
        }
        return new RegexNode.Optional(child);
    }
}
