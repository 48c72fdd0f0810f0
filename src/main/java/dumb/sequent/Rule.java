package dumb.sequent;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every inference rule the engine knows, with its display label, an ASCII alias for the command
 * line, the side it works on ({@code null} for either side or none) and the number of premises it
 * produces ({@code -1} when it depends on a template).
 */
public enum Rule {
    ID("id", "id", null, 0, Argument.NONE),
    FALSE_L("⊥L", "falseL", Side.LHS, 0, Argument.NONE),
    TRUE_R("⊤R", "trueR", Side.RHS, 0, Argument.NONE),

    AND_L("∧L", "andL", Side.LHS, 1, Argument.NONE),
    AND_R("∧R", "andR", Side.RHS, 2, Argument.NONE),
    OR_L("∨L", "orL", Side.LHS, 2, Argument.NONE),
    OR_R("∨R", "orR", Side.RHS, 1, Argument.NONE),
    IMP_L("→L", "impL", Side.LHS, 2, Argument.NONE),
    IMP_R("→R", "impR", Side.RHS, 1, Argument.NONE),
    NOT_L("¬L", "notL", Side.LHS, 1, Argument.NONE),
    NOT_R("¬R", "notR", Side.RHS, 1, Argument.NONE),
    IFF_L("↔L", "iffL", Side.LHS, 2, Argument.NONE),
    IFF_R("↔R", "iffR", Side.RHS, 2, Argument.NONE),

    FORALL_L("∀L", "allL", Side.LHS, 1, Argument.TERM),
    FORALL_R("∀R", "allR", Side.RHS, 1, Argument.NONE),
    EXISTS_L("∃L", "exL", Side.LHS, 1, Argument.NONE),
    EXISTS_R("∃R", "exR", Side.RHS, 1, Argument.TERM),

    SKIP_L("[skip]L", "skipL", Side.LHS, 1, Argument.NONE),
    SKIP_R("[skip]R", "skipR", Side.RHS, 1, Argument.NONE),
    SEQ_L("[;]L", "seqL", Side.LHS, 1, Argument.NONE),
    SEQ_R("[;]R", "seqR", Side.RHS, 1, Argument.NONE),
    CHOICE_L("[∪]L", "choiceL", Side.LHS, 1, Argument.NONE),
    CHOICE_R("[∪]R", "choiceR", Side.RHS, 2, Argument.NONE),
    STAR_UNFOLD("[*]unfold", "starUnfold", null, 2, Argument.NONE),
    IF_R("[if]R", "ifR", Side.RHS, 2, Argument.NONE),
    WHILE_UNFOLD("[while]unfold", "whileUnfold", Side.RHS, 2, Argument.NONE),
    WHILE_INV("[while]inv", "whileInv", Side.RHS, 3, Argument.FORMULA),
    FOR_R("[for]R", "forR", Side.RHS, 1, Argument.NONE),
    ASSIGN_L("[:=]L", "assignL", Side.LHS, 1, Argument.NONE),
    ASSIGN_R("[:=]R", "assignR", Side.RHS, 1, Argument.NONE),
    TEST_L("[?]L", "testL", Side.LHS, 2, Argument.NONE),
    TEST_R("[?]R", "testR", Side.RHS, 1, Argument.NONE),

    WEAK_L("WL", "weakL", Side.LHS, 1, Argument.FORMULA),
    WEAK_R("WR", "weakR", Side.RHS, 1, Argument.FORMULA),
    CONTRACT_L("CL", "contractL", Side.LHS, 1, Argument.NONE),
    CONTRACT_R("CR", "contractR", Side.RHS, 1, Argument.NONE),
    CUT("Cut", "cut", null, 2, Argument.FORMULA),

    CUSTOM("custom", "custom", null, -1, Argument.NONE);

    public final String label;
    public final String alias;
    @Nullable
    public final Side side;
    public final int premises;
    public final Argument argument;

    Rule(String label, String alias, @Nullable Side side, int premises, Argument argument) {
        this.label = label;
        this.alias = alias;
        this.side = side;
        this.premises = premises;
        this.argument = argument;
    }

    public boolean accepts(Side s) {
        return side == null || side == s;
    }

    /** Looks a rule up by label ({@code ∧L}), alias ({@code andL}, any case) or constant name ({@code AND_L}). */
    public static Optional<Rule> byName(String name) {
        return Arrays.stream(values())
                .filter(r -> r != CUSTOM)
                .filter(r -> r.label.equals(name) || r.alias.equalsIgnoreCase(name) || r.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /** What the optional argument of a rule application is parsed as. */
    public enum Argument {NONE, TERM, FORMULA}
}
