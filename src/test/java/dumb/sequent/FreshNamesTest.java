package dumb.sequent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FreshNamesTest extends AbstractProofTest {

    @Test
    void namesAreNeverReused() {
        var names = new FreshNames();
        var s = seq("p(x) |- q(x)");
        assertEquals("x_1", names.fresh("x", s).name());
        assertEquals("x_2", names.fresh("x", s).name());
        assertEquals("y_3", names.fresh("y", s).name());
        assertEquals(3, names.issuedCount());
    }

    @Test
    void avoidsVariablesOfTheSequent() {
        var names = new FreshNames();
        assertEquals("x_2", names.fresh("x", seq("p(x_1) |- forall x. q(x)")).name());
        assertEquals("x_4", new FreshNames().fresh("x", seq("p(x_1), p(x_2) |- exists x_3. p(x_3)")).name());
    }

    @Test
    void numericSuffixIsStripped() {
        var names = new FreshNames();
        assertEquals("x_1", names.fresh("x_3", seq("p(x_3) |-")).name());
        assertEquals("x_2", names.fresh("x_1_7", seq("p(x_1) |-")).name());
    }

    @Test
    void resetStartsOver() {
        var names = new FreshNames();
        var s = seq("|- p(x)");
        names.fresh("x", s);
        names.reset();
        assertEquals(0, names.issuedCount());
        assertEquals("x_1", names.fresh("x", s).name());
    }

    @Test
    void customSeparator() {
        assertEquals("x'1", new FreshNames("'").fresh("x", seq("|- p(x)")).name());
        assertThrows(IllegalArgumentException.class, () -> new FreshNames("-"));
    }
}
