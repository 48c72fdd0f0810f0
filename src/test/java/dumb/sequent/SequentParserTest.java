package dumb.sequent;

import dumb.sequent.SequentParser.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentParserTest extends AbstractProofTest {

    private static final Term.Var X = new Term.Var("x");
    private static final Term.Var Y = new Term.Var("y");
    private static final Formula P = new Formula.Atomic("p");
    private static final Formula Q = new Formula.Atomic("q");
    private static final Formula R = new Formula.Atomic("r");

    @ParameterizedTest
    @ValueSource(strings = {
            "p and q |- q",
            "p ∧ q ⊢ q",
            "p && q |- q",
            "p /\\ q |- q",
            "p & q entails q",
            "p AND q |- q"
    })
    void connectiveSpellingsAreSynonyms(String text) {
        assertEquals(new Sequent(List.of(new Formula.And(P, Q)), List.of(Q)), seq(text));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '#', value = {
            "p -> q            # p → q",
            "p => q            # p implies q",
            "p <-> q           # p iff q",
            "p <=> q           # p ↔ q",
            "~p                # not p",
            "!p                # ¬p",
            "p || q            # p or q",
            "p \\/ q           # p ∨ q",
            "true              # ⊤",
            "x <= y            # x ≤ y",
            "x != y            # not x = y",
            "forall x. p(x)    # ∀x: p(x)",
            "exists x p(x)     # ∃x.p(x)"
    })
    void asciiAndUnicodeAgree(String ascii, String unicode) {
        assertEquals(formula(unicode), formula(ascii));
    }

    @Test
    void precedence() {
        assertEquals(new Formula.Or(P, new Formula.And(Q, R)), formula("p or q and r"));
        assertEquals(new Formula.Implies(P, new Formula.Implies(Q, R)), formula("p -> q -> r"));
        assertEquals(new Formula.And(new Formula.Not(P), Q), formula("not p and q"));
        assertEquals(new Formula.Iff(P, new Formula.Implies(Q, R)), formula("p <-> q -> r"));
        assertEquals(new Formula.Or(new Formula.Or(P, Q), R), formula("p or q or r"));
    }

    @Test
    void quantifierTakesTheRestOfTheFormula() {
        var px = new Formula.Atomic("p", X);
        var qx = new Formula.Atomic("q", X);
        assertEquals(new Formula.Forall(X, new Formula.And(px, qx)), formula("forall x. p(x) and q(x)"));
        assertEquals(new Formula.And(new Formula.Forall(X, px), qx), formula("(forall x. p(x)) and q(x)"));
    }

    @Test
    void terms() {
        var one = new Term.Const("1");
        assertEquals(new Formula.Equals(Term.infix("+", X, Term.infix("*", one, Y)), new Term.Var("z")),
                formula("x + 1 * y = z"));
        assertEquals(Term.infix("-", Term.infix("-", X, Y), one), term("x - y - 1"));
        assertEquals(new Term.Fn("f", X, new Term.Fn("g", Y)), term("f(x, g(y))"));
        assertEquals(new Term.Fn("-", X), term("-x"));
        assertEquals(new Formula.Atomic("<", X, Y), formula("x < y"));
        assertEquals(Formula.not(new Formula.Equals(X, Y)), formula("x ≠ y"));
    }

    @Test
    void parenthesisedTermOnTheLeftOfAComparison() {
        assertEquals(new Formula.Equals(Term.infix("*", Term.infix("+", X, new Term.Const("1")), new Term.Const("2")), Y),
                formula("(x + 1) * 2 = y"));
    }

    @Test
    void programs() {
        var a = new Program.Action("a");
        var b = new Program.Action("b");
        var c = new Program.Action("c");
        assertEquals(new Program.Choice(a, new Program.Seq(b, c)), program("a ∪ b; c"));
        assertEquals(new Program.Choice(a, b), program("a ++ b"));
        assertEquals(new Program.Star(new Program.Seq(a, b)), program("(a; b)*"));
        assertEquals(new Program.Seq(a, new Program.Star(b)), program("{a; b*}"));
        assertEquals(new Program.Test(P), program("?p"));
        assertEquals(Program.SKIP, program("skip"));
        assertEquals(new Program.Assign(X, Term.infix("+", X, new Term.Const("1"))), program("x := x + 1"));
    }

    @Test
    void ifWithoutElseSkips() {
        var then = new Program.Assign(X, Y);
        assertEquals(new Program.If(P, then, Program.SKIP), program("if p then x := y"));
    }

    @Test
    void whileWithInvariant() {
        var n = new Term.Var("n");
        var loop = new Program.While(new Formula.Atomic("<", X, n),
                new Program.Assign(X, Term.infix("+", X, new Term.Const("1"))),
                new Formula.Atomic("≤", X, n));
        assertEquals(new Formula.Box(loop, new Formula.Equals(X, n)),
                formula("[while x < n do x := x + 1 inv x <= n]x = n"));
    }

    @Test
    void forLoopIsDesugared() {
        var i = new Term.Var("i");
        var body = new Program.Assign(X, Term.infix("+", X, i));
        var expected = Program.desugar(new Program.For(i, new Term.Const("0"), new Term.Var("n"), body));
        assertEquals(expected, program("for 0 <= i < n do x := x + i"));
        assertInstanceOf(Program.While.class, expected.second());
    }

    @Test
    void emptySides() {
        assertEquals(new Sequent(List.of(), List.of(P)), seq("|- p"));
        assertEquals(new Sequent(List.of(P), List.of()), seq("p |-"));
        assertEquals(new Sequent(List.of(), List.of()), seq("|-"));
        assertEquals(List.of(), assertDoesNotThrow(() -> SequentParser.parseFormulaList("")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "forall x. (p(x) -> exists y. q(x, y))",
            "[x := x + 1; ?x > 0]x ≥ 1",
            "[(a ∪ b)*]p",
            "[if x > 0 then y := x else y := -x]y >= 0",
            "not (p or q) <-> (not p and not q)",
            "(x + 1) * 2 = y",
            "[while i < n do (s := s + i; i := i + 1) inv s >= 0]s >= 0",
            "¬¬p",
            "[skip][a]Q",
            "[while c do (while d do a) inv i]p",
            "[if c then (if d then a) else b]p",
            "[while c do (if d then a else (while e do b)) inv i]p"
    })
    void printedFormulasParseBack(String text) {
        var f = formula(text);
        assertEquals(f, formula(f.toString()), f::toString);
    }

    @Test
    void nestedLoopKeepsTheOuterInvariant() {
        var inner = new Program.While(new Formula.Atomic("d"), new Program.Action("a"), null);
        var outer = new Formula.Box(new Program.While(new Formula.Atomic("c"), inner, new Formula.Atomic("i")), P);
        assertEquals("[while c do (while d do a) inv i]p", outer.toString());
        assertEquals(outer, formula(outer.toString()));

        var branch = new Program.If(new Formula.Atomic("d"), new Program.Action("a"), inner);
        var guarded = new Formula.Box(new Program.While(new Formula.Atomic("c"), branch, new Formula.Atomic("i")), P);
        assertEquals(guarded, formula(guarded.toString()), guarded::toString);
    }

    @Test
    void missingRightOperandOfImplication() {
        var e = assertThrows(ParseException.class, () -> SequentParser.parseSequent("p implies |- q"));
        assertEquals(10, e.position());
        assertEquals("formula", e.expected());
        assertTrue(e.getMessage().contains("at position 10"), e::getMessage);
    }

    @Test
    void unknownCharacter() {
        var e = assertThrows(ParseException.class, () -> SequentParser.parseSequent("p # q |- r"));
        assertEquals(2, e.position());
        assertEquals("token", e.expected());
    }

    @Test
    void missingTurnstile() {
        var e = assertThrows(ParseException.class, () -> SequentParser.parseSequent("p, q"));
        assertEquals("'|-'", e.expected());
        assertEquals(4, e.position());
    }

    @ParameterizedTest
    @ValueSource(strings = {"p and", "(p or q", "[x := ]p", "forall . p", "p q", "x +"})
    void malformedFormulas(String text) {
        assertThrows(ParseException.class, () -> SequentParser.parseFormula(text));
    }

    @Test
    void reservedWordsAreNotTerms() {
        assertThrows(ParseException.class, () -> SequentParser.parseTerm("skip"));
        assertThrows(ParseException.class, () -> SequentParser.parseFormula("while"));
    }
}
