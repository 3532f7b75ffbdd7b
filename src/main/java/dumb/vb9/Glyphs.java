package dumb.vb9;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Deterministic bitmaps for expressions, and a small convolution over them.
 */
public final class Glyphs {

    static final int MAX_SIDE = 64;
    static final String EMPTY_GLYPH = "∅";
    private static final int[][] BOX = {{1, 1, 1}, {1, 1, 1}, {1, 1, 1}};

    private Glyphs() {
    }

    /**
     * One column per distinct textual leaf; a cell is set when the matching hex digit of the
     * leaf's hash is 8 or above. Both sides are capped at {@value #MAX_SIDE}.
     */
    public static int[][] bitmap(Expr expr) {
        var leaves = KernelCompiler.symbols(expr);
        if (leaves.isEmpty()) leaves = List.of(EMPTY_GLYPH);

        var columns = leaves.stream().map(leaf -> Canon.hash(Expr.Sym.of(leaf))).toList();
        var height = Math.min(MAX_SIDE, columns.stream().mapToInt(String::length).max().orElse(0));
        var width = Math.min(MAX_SIDE, columns.size());

        var rows = new int[height][width];
        for (var r = 0; r < height; r++)
            for (var c = 0; c < width; c++) {
                var hex = columns.get(c);
                rows[r][c] = r < hex.length() && Character.digit(hex.charAt(r), 16) >= 8 ? 1 : 0;
            }
        return rows;
    }

    public static int[][] convolve(int[][] bitmap) {
        return convolve(bitmap, null);
    }

    /**
     * Valid-mode 2D convolution (no padding); defaults to a 3x3 box of ones.
     */
    public static int[][] convolve(int[][] bitmap, @Nullable int[][] kernel) {
        if (bitmap.length == 0) return new int[0][0];
        var k = kernel != null ? kernel : BOX;
        int kh = k.length, kw = k[0].length;
        int h = bitmap.length, w = bitmap[0].length;
        var outH = Math.max(0, h - kh + 1);
        var outW = Math.max(0, w - kw + 1);
        var out = new int[outH][outW];
        for (var i = 0; i < outH; i++)
            for (var j = 0; j < outW; j++) {
                var acc = 0;
                for (var ki = 0; ki < kh; ki++)
                    for (var kj = 0; kj < kw; kj++)
                        acc += bitmap[i + ki][j + kj] * k[ki][kj];
                out[i][j] = acc;
            }
        return out;
    }
}
