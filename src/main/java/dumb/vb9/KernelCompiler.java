package dumb.vb9;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static dumb.vb9.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Turns an expression into cached kernels and a proof tree, persisting both as a {@link Manifest}.
 * <p>
 * The kernel cache is instance state touched only by the thread calling {@link #compile(Expr)};
 * it is not safe to share one compiler between threads.
 */
public class KernelCompiler {

    public static final String EMIT = "emit";
    public static final String SKIP = "skip";

    private final Namespace ns;
    private final Goals goals;
    private final Map<String, String> cache = new HashMap<>();

    public KernelCompiler(Namespace ns, Goals goals) {
        this.ns = requireNonNull(ns);
        this.goals = requireNonNull(goals);
    }

    /** Distinct textual leaves in first-occurrence order; numbers are skipped. */
    public static List<String> symbols(Expr expr) {
        var out = new LinkedHashSet<String>();
        collectSymbols(expr, out);
        return List.copyOf(out);
    }

    private static void collectSymbols(Expr expr, LinkedHashSet<String> out) {
        if (expr instanceof Expr.Lst lst) lst.items.forEach(item -> collectSymbols(item, out));
        else if (expr.isTextual()) out.add(expr.label());
    }

    /**
     * One edge per non-empty list, in pre-order, keeping only the first of structurally equal edges.
     */
    public static List<ProofEdge> proofTree(Expr expr) {
        var edges = new LinkedHashSet<ProofEdge>();
        collectEdges(expr, edges);
        return List.copyOf(edges);
    }

    private static void collectEdges(Expr expr, LinkedHashSet<ProofEdge> edges) {
        if (!(expr instanceof Expr.Lst lst) || lst.isEmpty()) return;
        edges.add(ProofEdge.of(lst));
        lst.rest().forEach(child -> collectEdges(child, edges));
    }

    public List<Kernel> compile(Expr expr) {
        var previous = previousHashes();

        var kernels = new ArrayList<Kernel>();
        for (var symbol : symbols(expr)) {
            var kernel = Kernel.of(symbol);
            emit(kernel);
            kernels.add(kernel.changed(!kernel.hash().equals(previous.get(symbol))));
        }

        var proofTree = proofTree(expr);
        for (var edge : proofTree)
            goals.prove("build", edge.node());

        ns.write(Manifest.PATH, Json.str(Manifest.of(kernels, proofTree)));
        return List.copyOf(kernels);
    }

    /**
     * Writes the kernel's bytecode unless the cache holds its hash and the namespace still holds
     * that exact bytecode. A cache entry whose path is missing, or now holds another kernel's
     * bytecode, counts as a miss.
     */
    private void emit(Kernel kernel) {
        var name = kernel.kernel();
        var path = kernel.path();
        if (kernel.hash().equals(cache.get(name)) && holds(path, kernel.bytecode())) {
            ns.log(SKIP, name);
            return;
        }
        ns.write(path, kernel.bytecode());
        ns.log(EMIT, name);
        cache.put(name, kernel.hash());
    }

    private boolean holds(String path, byte[] bytecode) {
        return ns.read(path, byte[].class).filter(stored -> Arrays.equals(stored, bytecode)).isPresent();
    }

    /** Symbol to hash map from the persisted manifest; empty when it is absent or unreadable. */
    Map<String, String> previousHashes() {
        var out = new HashMap<String, String>();
        var text = ns.read(Manifest.PATH, String.class);
        if (text.isEmpty()) return out;
        try {
            var kernels = Json.node(text.get()).path("kernels");
            for (var k : kernels) {
                var symbol = k.path("symbol");
                var hash = k.path("hash");
                if (symbol.isTextual() && hash.isTextual())
                    out.put(symbol.asText(), hash.asText());
            }
        } catch (JsonProcessingException e) {
            warning("Ignoring unreadable manifest at " + Manifest.PATH + ": " + e.getOriginalMessage());
        }
        return out;
    }

    public int cacheSize() {
        return cache.size();
    }
}
