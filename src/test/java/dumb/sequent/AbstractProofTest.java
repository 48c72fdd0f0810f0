package dumb.sequent;

import dumb.sequent.SequentParser.ParseException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractProofTest {

    static Sequent seq(String text) {
        try {
            return SequentParser.parseSequent(text);
        } catch (ParseException e) {
            return fail("Failed to parse sequent '" + text + "': " + e.getMessage());
        }
    }

    static Formula formula(String text) {
        try {
            return SequentParser.parseFormula(text);
        } catch (ParseException e) {
            return fail("Failed to parse formula '" + text + "': " + e.getMessage());
        }
    }

    static Term term(String text) {
        try {
            return SequentParser.parseTerm(text);
        } catch (ParseException e) {
            return fail("Failed to parse term '" + text + "': " + e.getMessage());
        }
    }

    static Program program(String text) {
        try {
            return SequentParser.parseProgram(text);
        } catch (ParseException e) {
            return fail("Failed to parse program '" + text + "': " + e.getMessage());
        }
    }

    static List<Sequent> apply(String sequent, RuleSpec spec) throws RuleException {
        return Rules.apply(seq(sequent), spec, new FreshNames());
    }

    /** Applies the rule and compares the premises, in order, with the expected sequent texts. */
    static void assertPremises(String sequent, RuleSpec spec, String... expected) {
        try {
            assertEquals(List.of(expected).stream().map(AbstractProofTest::seq).toList(), apply(sequent, spec),
                    () -> spec.label() + " on " + sequent);
        } catch (RuleException e) {
            fail(spec.label() + " failed on " + sequent + ": " + e.getMessage());
        }
    }

    static void assertRejected(RuleException.Reason reason, String sequent, RuleSpec spec) {
        var e = assertThrows(RuleException.class, () -> apply(sequent, spec));
        assertEquals(reason, e.reason(), e::getMessage);
    }
}
