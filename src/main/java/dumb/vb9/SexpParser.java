package dumb.vb9;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parenthesized-notation reader. {@code ;} starts a line comment, double-quoted tokens are
 * strings with backslash escapes, every other run of non-space characters is an atom.
 */
public class SexpParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    /** Deepest list nesting accepted; deeper input is rejected before it can exhaust the stack. */
    public static final int MAX_DEPTH = 1000;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;
    private int depth = 0;

    private SexpParser(Reader reader) {
        this.reader = reader;
    }

    /**
     * Parses source text. A single top-level expression is returned as is; several are
     * wrapped, in order, into one list.
     */
    public static Expr parse(String src) throws ParseException {
        var exprs = parseAll(src);
        if (exprs.isEmpty()) throw new ParseException("Empty input");
        return exprs.size() == 1 ? exprs.get(0) : new Expr.Lst(exprs);
    }

    public static List<Expr> parseAll(String src) throws ParseException {
        try (var reader = new StringReader(src)) {
            var parser = new SexpParser(reader);
            var exprs = new ArrayList<Expr>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                exprs.add(parser.parseExpr());
                parser.skipWhitespaceAndComments();
            }
            return exprs;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    private static boolean isDelimiter(int c) {
        return c == -1 || Character.isWhitespace(c) || c == '(' || c == ')';
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Expr parseExpr() throws IOException, ParseException {
        var c = peek();
        return switch (c) {
            case '(' -> parseList();
            case ')' -> throw createParseException(") without (");
            case '"' -> parseString();
            default -> parseAtom();
        };
    }

    private Expr.Lst parseList() throws IOException, ParseException {
        if (depth >= MAX_DEPTH) throw createParseException("Nesting too deep");
        consumeChar();
        depth++;
        var items = new ArrayList<Expr>();
        skipWhitespaceAndComments();
        while (peek() != ')') {
            if (peek() == -1) throw createParseException("Unclosed (");
            items.add(parseExpr());
            skipWhitespaceAndComments();
        }
        consumeChar();
        depth--;
        return new Expr.Lst(items);
    }

    private Expr.Str parseString() throws IOException, ParseException {
        consumeChar();
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unterminated string literal");
            if (peek() == '\\') {
                consumeChar();
                var escaped = consumeChar();
                switch (escaped) {
                    case -1 -> throw createParseException("Unterminated string literal");
                    case '"' -> sb.append('"');
                    case '\'' -> sb.append('\'');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    case 'u' -> sb.append(parseUnicodeEscape());
                    default -> sb.append('\\').append((char) escaped);
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar();
        return new Expr.Str(sb.toString());
    }

    private char parseUnicodeEscape() throws IOException, ParseException {
        var code = 0;
        for (var i = 0; i < 4; i++) {
            var digit = Character.digit(consumeChar(), 16);
            if (digit < 0) throw createParseException("Invalid \\u escape");
            code = code * 16 + digit;
        }
        return (char) code;
    }

    private Expr parseAtom() throws IOException {
        var sb = new StringBuilder();
        while (!isDelimiter(peek())) {
            sb.append((char) consumeChar());
        }
        return Expr.atom(sb.toString());
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
