package dumb.vb9;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A node's head paired with the heads of its immediate children; atomic children appear as
 * themselves. Values are plain (String, Long, Double, List) so equality is structural.
 */
public record ProofEdge(Object node, List<Object> deps) {

    public ProofEdge {
        requireNonNull(node);
        deps = List.copyOf(deps);
    }

    static ProofEdge of(Expr.Lst lst) {
        var deps = lst.rest().stream()
                .map(child -> child instanceof Expr.Lst c && !c.isEmpty() ? c.get(0) : child)
                .map(Expr::value)
                .toList();
        return new ProofEdge(lst.get(0).value(), deps);
    }
}
