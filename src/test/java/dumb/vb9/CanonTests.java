package dumb.vb9;

import dumb.vb9.SexpParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CanonTests {

    @Test
    void hashIsBlake2b128OfCanonicalText() {
        assertEquals("c3fc4b4165fd8bb754adc15660fefcdd", Canon.hash(Expr.Sym.of("ok")));
        assertEquals("b4638352ff674ae194d8019f0209c674", Canon.digest("widget"));
    }

    @Test
    void hashIsStableAcrossParses() throws ParseException {
        var src = "(widget (button ok) (textbox name))";
        var a = Canon.hash(SexpParser.parse(src));
        var b = Canon.hash(SexpParser.parse(src));
        assertEquals(a, b);
        assertEquals("704210aedece1aa2d9d63d3b1bf340e4", a);
        assertTrue(a.matches("[0-9a-f]{32}"));
    }

    @Test
    void commutativeChildrenAreSorted() throws ParseException {
        var canon = Canon.canonical(SexpParser.parse("(#:commutative c (x) a)"));
        assertEquals("(#:commutative (x) a c)", canon.text());
        assertEquals(
                Canon.hash(SexpParser.parse("(#:commutative b a)")),
                Canon.hash(SexpParser.parse("(#:commutative a b)")));
    }

    @Test
    void orderMattersOutsideCommutativeNodes() throws ParseException {
        assertNotEquals(
                Canon.hash(SexpParser.parse("(plus b a)")),
                Canon.hash(SexpParser.parse("(plus a b)")));
    }

    @Test
    void nestedCommutativeNodesAreSorted() throws ParseException {
        var canon = Canon.canonical(SexpParser.parse("(f (#:commutative z y) q)"));
        assertEquals("(f (#:commutative y z) q)", canon.text());
    }

    @Test
    void canonicalDoesNotTouchTheInput() throws ParseException {
        var expr = SexpParser.parse("(#:commutative b a)");
        Canon.canonical(expr);
        assertEquals("(#:commutative b a)", expr.text());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x",
            "42",
            "()",
            "(#:commutative d c b a)",
            "(#:commutative (#:commutative 2 1) \"s\" b)",
            "(root (#:commutative (k 2) (k 1)) leaf)"
    })
    void canonicalizationIsIdempotent(String src) throws ParseException {
        var once = Canon.canonical(SexpParser.parse(src));
        assertEquals(once, Canon.canonical(once));
    }

    @Test
    void symbolsAndStringsHashDifferently() {
        assertNotEquals(Canon.hash(Expr.Sym.of("a")), Canon.hash(new Expr.Str("a")));
    }

    @Test
    void pathsFromExpressions() throws ParseException {
        assertEquals("/button/ok/click", Canon.path(SexpParser.parse("(button ok click)")));
        assertEquals("/ping", Canon.path(SexpParser.parse("ping")));
        assertEquals("/", Canon.path(SexpParser.parse("()")));
        assertEquals("/a/b c/1", Canon.path(SexpParser.parse("(a \"b c\" 1)")));
        assertEquals("/move/(to 3 4)", Canon.path(SexpParser.parse("(move (to 3 4))")));
    }
}
