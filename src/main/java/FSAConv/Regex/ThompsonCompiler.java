package FSAConv.Regex;

import java.util.SortedSet;
import java.util.TreeSet;

import FSAConv.Model.CompactEpsilonNFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Compiles a regex AST into an epsilon-NFA by composing one (entry, exit) fragment per node.
 * <p>
 * States are allocated in post-order, so identifiers grow monotonically with the
 * traversal. Star and plus add the only back-edges; everything else is acyclic.
 * The alphabet is the sorted set of characters occurring in the tree.
 */
public class ThompsonCompiler implements RegexVisitor<ThompsonCompiler.Fragment> {
    private final CompactEpsilonNFA<Character> out;

    public record Fragment(Integer entry, Integer exit) { }

    private ThompsonCompiler(CompactEpsilonNFA<Character> out) {
        this.out = out;
    }

    public static CompactEpsilonNFA<Character> compile(RegexNode root) {
        final Alphabet<Character> alphabet = Alphabets.fromCollection(collectSymbols(root));
        final CompactEpsilonNFA<Character> out = new CompactEpsilonNFA<>(alphabet);
        final Fragment fragment = root.accept(new ThompsonCompiler(out));
        out.setInitial(fragment.entry(), true);
        out.setAccepting(fragment.exit(), true);
        return out;
    }

    public static CompactEpsilonNFA<Character> compile(String pattern) {
        return compile(RegexParser.parse(pattern));
    }

    static SortedSet<Character> collectSymbols(RegexNode root) {
        final SortedSet<Character> symbols = new TreeSet<>();
        root.accept(new RegexVisitor<Void>() {
            @Override public Void visitLiteral(char symbol) { symbols.add(symbol); return null; }
            @Override public Void visitEpsilon() { return null; }
            @Override public Void visitEmptySet() { return null; }
            @Override public Void visitUnion(Void lhs, Void rhs) { return null; }
            @Override public Void visitConcat(Void lhs, Void rhs) { return null; }
            @Override public Void visitStar(Void child) { return null; }
            @Override public Void visitPlus(Void child) { return null; }
            @Override public Void visitOptional(Void child) { return null; }
        });
        return symbols;
    }

    private Fragment fresh() {
        final Integer entry = out.addState(false);
        final Integer exit = out.addState(false);
        return new Fragment(entry, exit);
    }

    private void epsilon(Integer source, Integer target) {
        out.addEpsilonTransition(source, target);
    }

    @Override
    public Fragment visitLiteral(char symbol) {
        final Fragment f = fresh();
        final Character input = symbol;
        out.addTransition(f.entry(), input, f.exit());
        return f;
    }

    @Override
    public Fragment visitEpsilon() {
        final Fragment f = fresh();
        epsilon(f.entry(), f.exit());
        return f;
    }

    @Override
    public Fragment visitEmptySet() {
        return fresh(); // entry and exit stay disconnected
    }

    @Override
    public Fragment visitConcat(Fragment lhs, Fragment rhs) {
        epsilon(lhs.exit(), rhs.entry());
        return new Fragment(lhs.entry(), rhs.exit());
    }

    @Override
    public Fragment visitUnion(Fragment lhs, Fragment rhs) {
        final Fragment f = fresh();
        epsilon(f.entry(), lhs.entry());
        epsilon(f.entry(), rhs.entry());
        epsilon(lhs.exit(), f.exit());
        epsilon(rhs.exit(), f.exit());
        return f;
    }

    @Override
    public Fragment visitStar(Fragment child) {
        final Fragment f = wrap(child);
        epsilon(child.exit(), child.entry()); // back-edge
        epsilon(f.entry(), f.exit()); // bypass
        return f;
    }

    @Override
    public Fragment visitPlus(Fragment child) {
        final Fragment f = wrap(child);
        epsilon(child.exit(), child.entry());
        return f;
    }

    @Override
    public Fragment visitOptional(Fragment child) {
        final Fragment f = wrap(child);
        epsilon(f.entry(), f.exit());
        return f;
    }

    private Fragment wrap(Fragment child) {
        final Fragment f = fresh();
        epsilon(f.entry(), child.entry());
        epsilon(child.exit(), f.exit());
        return f;
    }
}
