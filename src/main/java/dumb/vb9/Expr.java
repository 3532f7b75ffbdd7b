package dumb.vb9;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable symbolic expression: an atom or an ordered list of expressions.
 * <p>
 * {@link #text()} is the deterministic encoding used for ordering and hashing;
 * {@link #label()} is the plain form used when an expression becomes part of a path.
 */
sealed public interface Expr permits Expr.Sym, Expr.Str, Expr.Int, Expr.Real, Expr.Lst {

    Pattern INT = Pattern.compile("[+-]?\\d+");
    Pattern REAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Coerces a bare token: integer, else float when it carries a decimal point, else symbol.
     */
    static Expr atom(String token) {
        if (INT.matcher(token).matches()) {
            try {
                return new Int(Long.parseLong(token));
            } catch (NumberFormatException e) {
                return Sym.of(token);
            }
        }
        if (token.indexOf('.') >= 0 && REAL.matcher(token).matches())
            return new Real(Double.parseDouble(token));
        return Sym.of(token);
    }

    String text();

    String label();

    /** Plain Java value: String, Long, Double, or a List of those. */
    Object value();

    default boolean isTextual() {
        return this instanceof Sym || this instanceof Str;
    }

    record Sym(String name) implements Expr {
        private static final Map<String, Sym> internCache = new ConcurrentHashMap<>(1024);

        public Sym {
            requireNonNull(name);
        }

        public static Sym of(String name) {
            return internCache.computeIfAbsent(name, Sym::new);
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public String label() {
            return name;
        }

        @Override
        public Object value() {
            return name;
        }
    }

    record Str(String value) implements Expr {
        public Str {
            requireNonNull(value);
        }

        @Override
        public String text() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }

        @Override
        public String label() {
            return value;
        }
    }

    record Int(long number) implements Expr {
        @Override
        public String text() {
            return Long.toString(number);
        }

        @Override
        public String label() {
            return text();
        }

        @Override
        public Object value() {
            return number;
        }
    }

    record Real(double number) implements Expr {
        @Override
        public String text() {
            return Double.toString(number);
        }

        @Override
        public String label() {
            return text();
        }

        @Override
        public Object value() {
            return number;
        }
    }

    final class Lst implements Expr {
        public static final Lst EMPTY = new Lst(List.of());

        public final List<Expr> items;
        private volatile String textCache;
        private volatile int hashCodeCache;
        private volatile boolean hashCodeCalculated;

        public Lst(List<Expr> items) {
            this.items = List.copyOf(items);
        }

        public Lst(Expr... items) {
            this(List.of(items));
        }

        public Expr get(int index) {
            return items.get(index);
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public Optional<Expr> head() {
            return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
        }

        /** Head text when the head is a symbol or string. */
        public Optional<String> op() {
            return head().filter(Expr::isTextual).map(Expr::label);
        }

        public List<Expr> rest() {
            return items.isEmpty() ? List.of() : items.subList(1, items.size());
        }

        @Override
        public String text() {
            if (textCache == null)
                textCache = items.stream().map(Expr::text).collect(Collectors.joining(" ", "(", ")"));
            return textCache;
        }

        @Override
        public String label() {
            return text();
        }

        @Override
        public Object value() {
            return items.stream().map(Expr::value).toList();
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lst that && this.hashCode() == that.hashCode() && items.equals(that.items));
        }

        @Override
        public int hashCode() {
            if (!hashCodeCalculated) {
                hashCodeCache = items.hashCode();
                hashCodeCalculated = true;
            }
            return hashCodeCache;
        }

        @Override
        public String toString() {
            return "Lst" + items;
        }
    }
}
