package dumb.vb9;

import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Compiled artifact for one symbol. Everything except {@code changed} is a pure function of the
 * symbol; {@code changed} records whether the previous manifest held a different hash.
 */
public record Kernel(String symbol, String kernel, String hash, boolean changed) {

    public Kernel {
        requireNonNull(symbol);
        requireNonNull(kernel);
        requireNonNull(hash);
    }

    public static Kernel of(String symbol) {
        return new Kernel(symbol, symbol, Canon.hash(Expr.Sym.of(symbol)), true);
    }

    public Kernel changed(boolean changed) {
        return changed == this.changed ? this : new Kernel(symbol, kernel, hash, changed);
    }

    public String path() {
        return "/form/" + kernel + ".kernel";
    }

    public byte[] bytecode() {
        return ("BYTECODE(" + symbol + ":" + hash + ")").getBytes(StandardCharsets.UTF_8);
    }
}
