package FSAConv;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.Function;

import FSAConv.Cache.CacheStatistics;
import FSAConv.Cache.ConversionCache;
import FSAConv.Cache.ConversionStatistics;
import FSAConv.Cache.Fingerprint;
import FSAConv.Exceptions.AutomatonException;
import FSAConv.Model.AutomatonKind;
import FSAConv.Model.Cancellation;
import FSAConv.Model.CompactEpsilonNFA;
import FSAConv.Model.DeterminizationResult;
import FSAConv.Model.OptimizationResult;
import FSAConv.Model.TransitionChange;
import FSAConv.Regex.RegexParser;
import FSAConv.Regex.RegexPrinter;
import FSAConv.Regex.ThompsonCompiler;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for conversions between regular expressions and automata.
 * <p>
 * Every request is fingerprinted and looked up in the cache; on a miss the matching
 * algorithm runs under a fresh {@link Cancellation} built from the configured state
 * limit and timeout. Successful results are cached and timed. A failed request leaves
 * cache and statistics untouched. The cache and the statistics share this engine's
 * lock; the algorithms themselves run outside of it.
 * <p>
 * The cache keeps its own instances. Every call returns a fresh copy built over the
 * caller's alphabet, so callers may modify what they get back.
 */
public class ConversionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ConversionEngine.class);

    private final EngineConfig config;
    private final Object lock = new Object();
    private final ConversionCache cache;
    private final ConversionStatistics statistics = new ConversionStatistics();

    public ConversionEngine() {
        this(EngineConfig.defaults());
    }

    public ConversionEngine(EngineConfig config) {
        this.config = config;
        this.cache = new ConversionCache(config.cacheCapacity());
    }

    public EngineConfig getConfig() {
        return config;
    }

    public CompactEpsilonNFA<Character> compile(String pattern) {
        return execute("compile", Fingerprint.ofPattern("compile", "", pattern), CompactEpsilonNFA.class,
                ConversionEngine::detachCompiled, c -> ThompsonCompiler.compile(RegexParser.parse(pattern)));
    }

    public CompactEpsilonNFA<Character> toEpsilonNFA(String pattern) {
        return compile(pattern);
    }

    public <I> CompactEpsilonNFA<I> toEpsilonNFA(CompactNFA<I> nfa) {
        return AutomatonCopies.toEpsilonNFA(nfa);
    }

    public <I> CompactEpsilonNFA<I> toEpsilonNFA(CompactDFA<I> dfa) {
        return AutomatonCopies.toEpsilonNFA(dfa);
    }

    public CompactNFA<Character> toNFA(String pattern) {
        return toNFA(compile(pattern));
    }

    /**
     * Removes epsilon transitions; plain NFAs come back as an equivalent copy.
     */
    public <I> CompactNFA<I> toNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        return execute("to-nfa", Fingerprint.ofAutomaton("to-nfa", options(), nfa), CompactNFA.class,
                cached -> AutomatonCopies.copy((CompactNFA<?>) cached, alphabet), c -> {
            final CompactNFA<I> out = new EpsilonEliminator(c).run(nfa);
            return config.autoOptimize() ? new Optimizer(c).prune(out).automaton() : out;
        });
    }

    public <I> CompactNFA<I> toNFA(CompactDFA<I> dfa) {
        return AutomatonCopies.toNFA(dfa);
    }

    public CompactDFA<Character> toDFA(String pattern) {
        return toDFA(compile(pattern));
    }

    public <I> CompactDFA<I> toDFA(CompactNFA<I> nfa) {
        return determinize(nfa).dfa();
    }

    /**
     * Subset construction, keeping the source subset behind every DFA state.
     */
    public <I> DeterminizationResult<I> determinize(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        return execute("to-dfa", Fingerprint.ofAutomaton("to-dfa", options(), nfa), DeterminizationResult.class,
                cached -> detachDeterminization((DeterminizationResult<?>) cached, alphabet), c -> {
            final DeterminizationResult<I> result = new PowersetDeterminizer(c).run(nfa);
            return config.autoOptimize() ? prune(result, c) : result;
        });
    }

    /**
     * Converts a pattern or an automaton into the requested representation.
     * Automata already of the requested kind are returned as they are.
     */
    public Object convert(Object source, AutomatonKind target) {
        if (source instanceof String) {
            return convert(compile((String) source), target);
        }
        final AutomatonKind kind = AutomatonKind.of(source);
        if (kind == target) {
            return source;
        }
        if (kind == AutomatonKind.DFA) {
            return convertDFA((CompactDFA<?>) source, target);
        }
        return convertNFA((CompactNFA<?>) source, target);
    }

    private <I> Object convertDFA(CompactDFA<I> dfa, AutomatonKind target) {
        switch (target) {
            case EPSILON_NFA:
                return toEpsilonNFA(dfa);
            case NFA:
                return toNFA(dfa);
            default:
                throw new IllegalArgumentException("Unknown target " + target);
        }
    }

    private <I> Object convertNFA(CompactNFA<I> nfa, AutomatonKind target) {
        switch (target) {
            case EPSILON_NFA:
                return toEpsilonNFA(nfa);
            case NFA:
                return toNFA(nfa);
            case DFA:
                return toDFA(nfa);
            default:
                throw new IllegalArgumentException("Unknown target " + target);
        }
    }

    public String toRegex(CompactNFA<Character> nfa) {
        return execute("to-regex", Fingerprint.ofAutomaton("to-regex", "", nfa), String.class, String.class::cast,
                c -> RegexPrinter.print(new StateEliminator(c).toRegexNode(nfa)));
    }

    public String toRegex(CompactDFA<Character> dfa) {
        return execute("to-regex", Fingerprint.ofAutomaton("to-regex", "", dfa), String.class, String.class::cast,
                c -> RegexPrinter.print(new StateEliminator(c).toRegexNode(dfa)));
    }

    public <I> OptimizationResult<CompactDFA<I>, I> optimize(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        return execute("optimize", Fingerprint.ofAutomaton("optimize", "", dfa), OptimizationResult.class,
                cached -> detachOptimization((OptimizationResult<?, ?>) cached, alphabet),
                c -> new Optimizer(c).optimize(dfa));
    }

    public <I> OptimizationResult<CompactDFA<I>, I> optimize(CompactNFA<I> nfa) {
        return optimize(toDFA(nfa));
    }

    public <I> OptimizationResult<CompactDFA<I>, I> minimize(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        return execute("minimize", Fingerprint.ofAutomaton("minimize", "", dfa), OptimizationResult.class,
                cached -> detachOptimization((OptimizationResult<?, ?>) cached, alphabet),
                c -> new Optimizer(c).minimize(dfa));
    }

    public <I> OptimizationResult<CompactDFA<I>, I> minimize(CompactNFA<I> nfa) {
        return minimize(toDFA(nfa));
    }

    /**
     * Strict language equivalence of two patterns or automata.
     */
    public boolean equivalent(Object a, Object b) {
        return equivalent(a, b, true);
    }

    /**
     * @param strict - reject automata over different alphabets instead of comparing over their union
     */
    public boolean equivalent(Object a, Object b, boolean strict) {
        final CompactDFA<Object> left = asDFA(a);
        final CompactDFA<Object> right = asDFA(b);
        return execute("equivalent", Fingerprint.ofPair("equivalent", "strict=" + strict, left, right),
                Boolean.class, Boolean.class::cast, c -> new EquivalenceValidator(c, strict).test(left, right));
    }

    /**
     * @return a shortest word accepted by exactly one side, or null if both accept the same language
     */
    public Word<Object> findCounterexample(Object a, Object b, boolean strict) {
        final CompactDFA<Object> left = asDFA(a);
        final CompactDFA<Object> right = asDFA(b);
        final Cancellation cancellation = newCancellation();
        return new EquivalenceValidator(cancellation, strict).findCounterexample(left, right);
    }

    public CacheStatistics cacheStatistics() {
        synchronized (lock) {
            return cache.statistics();
        }
    }

    public ConversionStatistics.Summary conversionStatistics() {
        synchronized (lock) {
            return statistics.summary();
        }
    }

    /**
     * Drops all cached results and statistics.
     */
    public void reset() {
        synchronized (lock) {
            cache.clear();
            statistics.clear();
        }
        LOG.info("Conversion cache and statistics cleared");
    }

    /**
     * Patterns and automata of any symbol type meet as DFAs over {@code Object}; the
     * symbols themselves are kept, so alphabets still compare by equality.
     */
    private CompactDFA<Object> asDFA(Object source) {
        final CompactDFA<?> dfa;
        if (source instanceof String) {
            dfa = toDFA((String) source);
        } else if (AutomatonKind.of(source) == AutomatonKind.DFA) {
            dfa = (CompactDFA<?>) source;
        } else {
            dfa = toDFA((CompactNFA<?>) source);
        }
        return AutomatonCopies.copy(dfa, Alphabets.fromCollection(new ArrayList<Object>(dfa.getInputAlphabet())));
    }

    private String options() {
        return "autoOptimize=" + config.autoOptimize();
    }

    private Cancellation newCancellation() {
        return new Cancellation(config.maxDeterminizedStates(), config.timeout());
    }

    /**
     * @param type - class every cached value for {@code key} must be an instance of
     * @param detach - builds the caller's private copy of a cached value
     */
    private <T> T execute(String operation, Fingerprint key, Class<?> type, Function<Object, T> detach,
                          Function<Cancellation, T> computation) {
        final Object cached;
        synchronized (lock) {
            cached = cache.lookup(key, type);
        }
        if (cached != null) {
            LOG.debug("{}: cache hit", operation);
            return detach.apply(cached);
        }

        final Cancellation cancellation = newCancellation();
        final long before = System.nanoTime();
        final T result;
        try {
            cancellation.checkDeadline(operation);
            result = computation.apply(cancellation);
        } catch (AutomatonException e) {
            LOG.debug("{} failed after {}ms: {}", operation, (System.nanoTime() - before) / 1_000_000, e.getMessage());
            throw e;
        }
        final long nanos = System.nanoTime() - before;

        synchronized (lock) {
            cache.store(key, result);
            statistics.record(operation, nanos, stateCount(result), transitionCount(result));
        }
        LOG.debug("{} took {}ms", operation, nanos / 1_000_000);
        return detach.apply(result);
    }

    private static CompactEpsilonNFA<Character> detachCompiled(Object cached) {
        final CompactEpsilonNFA<?> nfa = (CompactEpsilonNFA<?>) cached;
        final List<Character> symbols = new ArrayList<>(nfa.getInputAlphabet().size());
        for (Object sym : nfa.getInputAlphabet()) {
            symbols.add((Character) sym);
        }
        return AutomatonCopies.copy(nfa, Alphabets.fromCollection(symbols));
    }

    private static <I> DeterminizationResult<I> detachDeterminization(DeterminizationResult<?> cached,
                                                                      Alphabet<I> alphabet) {
        final List<BitSet> subsets = new ArrayList<>(cached.subsets().size());
        for (BitSet subset : cached.subsets()) {
            subsets.add((BitSet) subset.clone());
        }
        return new DeterminizationResult<>(AutomatonCopies.copy(cached.dfa(), alphabet), subsets);
    }

    private static <I> OptimizationResult<CompactDFA<I>, I> detachOptimization(OptimizationResult<?, ?> cached,
                                                                              Alphabet<I> alphabet) {
        final CompactDFA<I> dfa = AutomatonCopies.copy((CompactDFA<?>) cached.automaton(), alphabet);
        final List<TransitionChange<I>> changes = new ArrayList<>(cached.changes().size());
        for (TransitionChange<?> change : cached.changes()) {
            final I symbol = alphabet.getSymbol(indexOf(alphabet, change.symbol()));
            changes.add(new TransitionChange<>(change.state(), symbol, change.previous(), change.next()));
        }
        return new OptimizationResult<>(dfa, changes, cached.stateMapping().clone());
    }

    private static int indexOf(Alphabet<?> alphabet, Object symbol) {
        for (int j = 0; j < alphabet.size(); j++) {
            if (alphabet.getSymbol(j).equals(symbol)) {
                return j;
            }
        }
        throw new IllegalStateException("Cached symbol " + symbol + " is not in " + alphabet);
    }

    /**
     * Drops dead composite states and keeps the subset list aligned with the pruned DFA.
     */
    private static <I> DeterminizationResult<I> prune(DeterminizationResult<I> result, Cancellation cancellation) {
        final OptimizationResult<CompactDFA<I>, I> pruned = new Optimizer(cancellation).prune(result.dfa());
        if (pruned.removedStates() == 0) {
            return result;
        }
        final int[] mapping = pruned.stateMapping();
        final List<BitSet> subsets = new ArrayList<>(pruned.automaton().size());
        for (int q = 0; q < mapping.length; q++) {
            if (mapping[q] >= 0) {
                subsets.add(result.subsets().get(q));
            }
        }
        return new DeterminizationResult<>(pruned.automaton(), subsets);
    }

    private static int stateCount(Object result) {
        final Object automaton = unwrap(result);
        if (automaton instanceof CompactDFA) {
            return ((CompactDFA<?>) automaton).size();
        } else if (automaton instanceof CompactNFA) {
            return ((CompactNFA<?>) automaton).size();
        }
        return 0;
    }

    private static int transitionCount(Object result) {
        final Object automaton = unwrap(result);
        if (automaton instanceof CompactDFA) {
            final CompactDFA<?> dfa = (CompactDFA<?>) automaton;
            int count = 0;
            for (int s = 0; s < dfa.size(); s++) {
                for (int j = 0; j < dfa.getInputAlphabet().size(); j++) {
                    if (dfa.getSuccessor(s, j) >= 0) {
                        count++;
                    }
                }
            }
            return count;
        } else if (automaton instanceof CompactNFA) {
            return countTransitions((CompactNFA<?>) automaton);
        }
        return 0;
    }

    private static <I> int countTransitions(CompactNFA<I> nfa) {
        int count = nfa instanceof CompactEpsilonNFA ? ((CompactEpsilonNFA<I>) nfa).numEpsilonTransitions() : 0;
        for (int s = 0; s < nfa.size(); s++) {
            for (I sym : nfa.getInputAlphabet()) {
                count += nfa.getTransitions(s, sym).size();
            }
        }
        return count;
    }

    private static Object unwrap(Object result) {
        if (result instanceof DeterminizationResult) {
            return ((DeterminizationResult<?>) result).dfa();
        } else if (result instanceof OptimizationResult) {
            return ((OptimizationResult<?, ?>) result).automaton();
        }
        return result;
    }
}
