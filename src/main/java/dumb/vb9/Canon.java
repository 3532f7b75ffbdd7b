package dumb.vb9;

import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Canonical form and content hashing.
 * <p>
 * Hashes are BLAKE2b with a 128-bit digest over the UTF-8 bytes of {@link Expr#text()} of the
 * canonical form, rendered as 32 lowercase hex characters. Hash values are persisted in
 * manifests and compared across runs, so neither the digest nor the text encoding may change.
 */
public final class Canon {

    public static final String COMMUTATIVE = "#:commutative";
    static final int DIGEST_BITS = 128;

    private Canon() {
    }

    /**
     * Sorts the immediate children of every node headed by {@value #COMMUTATIVE} by their
     * canonical text; every other node keeps its shape and order.
     */
    public static Expr canonical(Expr expr) {
        if (!(expr instanceof Expr.Lst lst) || lst.isEmpty()) return expr;

        var head = lst.get(0);
        var children = lst.rest().stream().map(Canon::canonical).collect(Collectors.toCollection(ArrayList::new));
        if (lst.op().filter(COMMUTATIVE::equals).isPresent())
            children.sort(Comparator.comparing(Expr::text));

        var items = new ArrayList<Expr>(lst.size());
        items.add(canonical(head));
        items.addAll(children);
        return new Expr.Lst(items);
    }

    public static String hash(Expr expr) {
        return digest(canonical(expr).text());
    }

    public static String digest(String text) {
        var bytes = text.getBytes(StandardCharsets.UTF_8);
        var blake = new Blake2bDigest(DIGEST_BITS);
        blake.update(bytes, 0, bytes.length);
        var out = new byte[blake.getDigestSize()];
        blake.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /**
     * Namespace path for an expression: an atom maps to {@code /atom}, a list to its top-level
     * elements joined by {@code /}.
     */
    public static String path(Expr expr) {
        if (!(expr instanceof Expr.Lst lst)) return "/" + expr.label();
        return lst.items.stream().map(Expr::label).collect(Collectors.joining("/", "/", ""));
    }
}
