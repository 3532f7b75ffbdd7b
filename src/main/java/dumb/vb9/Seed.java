package dumb.vb9;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Staged bootstrap from a seed form. A seed is a list of {@code (key body...)} entries; the
 * {@code self}, {@code *structure} (or {@code *layers}) and {@code **computation} (or
 * {@code **heads}) entries feed a chain of four stages, each hashed over its predecessor's hash:
 * <ol>
 *     <li>{@link Stage0} the seed itself,</li>
 *     <li>{@link Stage1} one action pattern per structure token, at most {@value #MAX_PATTERNS},</li>
 *     <li>{@link Stage2} sequential ids for the sorted patterns,</li>
 *     <li>{@link Stage3} a tiny evaluator understanding {@code seq} and {@code count-symbols}.</li>
 * </ol>
 */
public final class Seed {

    public static final int MAX_PATTERNS = 8;
    public static final String ACTION_PREFIX = "ACTION:";

    private Seed() {
    }

    public static Chain bootstrap(String src) throws SexpParser.ParseException {
        var s0 = parse(src);
        var s1 = s0.next();
        var s2 = s1.next();
        return new Chain(s0, s1, s2, s2.next());
    }

    /**
     * Reads the seed entries. Entries that are not lists of at least two elements are ignored;
     * a two-element entry keeps its single body element, a longer one keeps the body as a list.
     *
     * @throws IllegalArgumentException when the form is an atom
     */
    public static Stage0 parse(String src) throws SexpParser.ParseException {
        var expr = SexpParser.parse(src);
        if (!(expr instanceof Expr.Lst lst))
            throw new IllegalArgumentException("Seed must be a list, got " + expr.text());

        var entries = new HashMap<String, Expr>();
        for (var entry : lst.items) {
            if (!(entry instanceof Expr.Lst e) || e.size() < 2) continue;
            var body = e.size() > 2 ? new Expr.Lst(e.rest()) : e.get(1);
            entries.put(e.get(0).label(), body);
        }
        var self = entries.get("self");
        var structure = either(entries, "*structure", "*layers");
        var computation = either(entries, "**computation", "**heads");
        return new Stage0(self, structure, computation,
                hash(Arrays.asList(valueOf(self), valueOf(structure), valueOf(computation))));
    }

    private static @Nullable Expr either(Map<String, Expr> entries, String key, String alternative) {
        var e = entries.get(key);
        return e != null && !Expr.Lst.EMPTY.equals(e) ? e : entries.get(alternative);
    }

    private static @Nullable Object valueOf(@Nullable Expr e) {
        return e == null ? null : e.value();
    }

    /** BLAKE2b-128 of the compact JSON of {@code parts}. */
    static String hash(List<?> parts) {
        return Canon.digest(Json.compact(parts));
    }

    public record Stage0(@Nullable Expr self, @Nullable Expr structure, @Nullable Expr computation, String hash) {

        public Stage0 {
            requireNonNull(hash);
        }

        /** Structure tokens: each element of a list structure, or the single atom. */
        public List<String> tokens() {
            if (structure == null) return List.of();
            if (structure instanceof Expr.Lst l) return l.items.stream().map(Expr::label).toList();
            return List.of(structure.label());
        }

        public Stage1 next() {
            var patterns = new LinkedHashMap<String, String>();
            tokens().stream().limit(MAX_PATTERNS).forEach(t -> patterns.put(t, ACTION_PREFIX + t));
            var sorted = new ArrayList<List<String>>();
            new TreeMap<>(patterns).forEach((k, v) -> sorted.add(List.of(k, v)));
            return new Stage1(this, Map.copyOf(patterns), Seed.hash(List.of(hash, sorted)));
        }
    }

    public record Stage1(Stage0 seed, Map<String, String> patterns, String hash) {

        public Stage2 next() {
            var symbols = new TreeMap<String, Integer>();
            var id = 0;
            for (var pattern : new TreeMap<>(patterns).keySet())
                symbols.put(pattern, id++);
            return new Stage2(this, symbols, Seed.hash(List.of(hash, symbols)));
        }
    }

    /** Pattern ids, assigned in sorted pattern order. */
    public record Stage2(Stage1 stage1, Map<String, Integer> symbols, String hash) {

        public Stage2 {
            symbols = Collections.unmodifiableSortedMap(new TreeMap<>(symbols));
        }

        public Stage3 next() {
            return new Stage3(this, Seed.hash(List.of(hash, "eval", symbols.size())));
        }
    }

    public record Stage3(Stage2 stage2, String hash) {

        public int countSymbols() {
            return stage2.symbols().size();
        }

        /**
         * {@code (seq e...)} evaluates each element and yields the last (the empty list when
         * there is none); {@code (count-symbols)} yields the stage-2 symbol count; any other list
         * evaluates element-wise; atoms evaluate to themselves.
         */
        public Expr eval(Expr expr) {
            if (!(expr instanceof Expr.Lst lst) || lst.isEmpty()) return expr;
            return switch (lst.op().orElse("")) {
                case "seq" -> {
                    Expr last = Expr.Lst.EMPTY;
                    for (var sub : lst.rest()) last = eval(sub);
                    yield last;
                }
                case "count-symbols" -> new Expr.Int(countSymbols());
                default -> new Expr.Lst(lst.items.stream().map(this::eval).toList());
            };
        }

        public Expr eval(String src) throws SexpParser.ParseException {
            return eval(SexpParser.parse(src));
        }
    }

    public record Chain(Stage0 stage0, Stage1 stage1, Stage2 stage2, Stage3 stage3) {
    }
}
