package FSAConv.Regex;

/**
 * Immutable regular expression syntax tree. Children are owned by their parent;
 * there are no back-pointers and no sharing is assumed.
 */
public interface RegexNode {

    <R> R accept(RegexVisitor<R> visitor);

    /**
     * @return true iff the node's language contains the empty word
     */
    default boolean isNullable() {
        return accept(new RegexVisitor<Boolean>() {
            @Override public Boolean visitLiteral(char symbol) { return false; }
            @Override public Boolean visitEpsilon() { return true; }
            @Override public Boolean visitEmptySet() { return false; }
            @Override public Boolean visitUnion(Boolean lhs, Boolean rhs) { return lhs || rhs; }
            @Override public Boolean visitConcat(Boolean lhs, Boolean rhs) { return lhs && rhs; }
            @Override public Boolean visitStar(Boolean child) { return true; }
            @Override public Boolean visitPlus(Boolean child) { return child; }
            @Override public Boolean visitOptional(Boolean child) { return true; }
        });
    }

    record Literal(char symbol) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitLiteral(symbol);
        }
    }

    record Epsilon() implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitEpsilon();
        }
    }

    record EmptySet() implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitEmptySet();
        }
    }

    record Union(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitUnion(left.accept(visitor), right.accept(visitor));
        }
    }

    record Concat(RegexNode left, RegexNode right) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitConcat(left.accept(visitor), right.accept(visitor));
        }
    }

    record Star(RegexNode child) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitStar(child.accept(visitor));
        }
    }

    record Plus(RegexNode child) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitPlus(child.accept(visitor));
        }
    }

    record Optional(RegexNode child) implements RegexNode {
        @Override
        public <R> R accept(RegexVisitor<R> visitor) {
            return visitor.visitOptional(child.accept(visitor));
        }
    }
}
