package dumb.sequent;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubstTest extends AbstractProofTest {

    private static final Term.Var X = new Term.Var("x");
    private static final Term.Var Y = new Term.Var("y");

    @Test
    void substituteInTerm() {
        assertEquals(term("f(g(y), y)"), Subst.substitute(term("f(x, y)"), X, term("g(y)")));
        assertEquals(term("c + 1"), Subst.substitute(term("x + 1"), X, term("c")));
    }

    @Test
    void boundOccurrencesAreLeftAlone() {
        var f = formula("forall x. p(x)");
        assertSame(f, Subst.substitute(f, X, term("c")));
        assertEquals(formula("q(c) and forall x. p(x)"), Subst.substitute(formula("q(x) and forall x. p(x)"), X, term("c")));
    }

    @Test
    void quantifierIsRenamedToAvoidCapture() {
        var result = Subst.substitute(formula("forall y. p(x, y)"), X, Y);
        assertEquals(formula("forall y'. p(y, y')"), result);
    }

    @Test
    void occurrencesAfterTheVariableIsAssignedAreLeftAlone() {
        assertEquals(formula("[x := 5 + 1]x > 0"), Subst.substitute(formula("[x := x + 1]x > 0"), X, term("5")));
        assertEquals(formula("[x := 1]p(x)"), Subst.substitute(formula("[x := 1]p(x)"), X, term("c")));
        assertEquals(formula("[y := c; x := y]p(x, y)"), Subst.substitute(formula("[y := x; x := y]p(x, y)"), X, term("c")));
    }

    @Test
    void assigningAVariableOfTheReplacementOnlyMattersIfTheVariableIsUsedLater() {
        assertEquals(formula("[x := x]p(x)"), Subst.substitute(formula("[x := y]p(x)"), Y, X));
        assertEquals(formula("[z := y; y := 1]q"), Subst.substitute(formula("[z := x; y := 1]q"), X, Y));
        assertThrows(Subst.InadmissibleException.class, () -> Subst.substitute(formula("[y := 1; z := x]p(z)"), X, Y));
    }

    @Test
    void boxAssigningAVariableOfTheReplacementIsInadmissible() {
        assertThrows(Subst.InadmissibleException.class, () -> Subst.substitute(formula("[y := 1]p(x, y)"), X, Y));
        assertFalse(Subst.admissible(List.of(formula("[y := 1]p(x, y)")), X, Y));
    }

    @Test
    void variableAssignedOnSomePathsOnlyIsInadmissible() {
        assertThrows(Subst.InadmissibleException.class, () -> Subst.substitute(formula("[x := 1 ∪ skip]p(x)"), X, term("c")));
        assertThrows(Subst.InadmissibleException.class, () -> Subst.substitute(formula("[(x := 1)*]p(x)"), X, term("c")));
        assertEquals(formula("[x := 1 ∪ x := 2]p(x)"), Subst.substitute(formula("[x := 1 ∪ x := 2]p(x)"), X, term("c")));
    }

    @Test
    void loopsSeeTheStateOfEarlierIterations() {
        assertEquals(formula("[while c > 0 do y := c inv y >= 0]p(y)"),
                Subst.substitute(formula("[while x > 0 do y := x inv y >= 0]p(y)"), X, term("c")));
        assertThrows(Subst.InadmissibleException.class,
                () -> Subst.substitute(formula("[while x > 0 do y := x - 1]p(y)"), X, Y));
        assertThrows(Subst.InadmissibleException.class,
                () -> Subst.substitute(formula("[while c > 0 do (z := x; x := 0)]q"), X, term("c")));
    }

    @Test
    void admissibleBoxSubstitution() {
        assertEquals(formula("[y := z]p(y)"), Subst.substitute(formula("[y := x]p(y)"), X, term("z")));
        var untouched = formula("[y := 1]p(y)");
        assertSame(untouched, Subst.substitute(untouched, X, term("z")));
        assertTrue(Subst.admissible(List.of(formula("[y := x]p(y)"), formula("q(x)")), X, term("z")));
    }

    @Test
    void renameIncludesAssignmentTargets() {
        var x1 = new Term.Var("x_1");
        assertEquals(formula("[x_1 := x_1 + 1]x_1 > 0"), Subst.rename(formula("[x := x + 1]x > 0"), X, x1));
        assertEquals(formula("p(x_1) and forall x. q(x)"), Subst.rename(formula("p(x) and forall x. q(x)"), X, x1));
    }

    @Test
    void variableSets() {
        var f = formula("forall x. p(x, y)");
        assertEquals(Set.of(Y), Subst.freeVars(f));
        assertEquals(Set.of(X, Y), Subst.occurring(f));
        assertEquals(Set.of(X, Y, new Term.Var("z")), Subst.freeVars(seq("forall x. p(x, y) |- q(x, z)")));

        var loop = program("x := 1; while x < n do {y := y + 1; x := x + 1}");
        assertEquals(Set.of(X, Y), Subst.boundVars(loop));
        assertEquals(Set.of(X, Y, new Term.Var("n")), Subst.vars(loop));
    }
}
