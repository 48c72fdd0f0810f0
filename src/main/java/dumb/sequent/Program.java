package dumb.sequent;

import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

import static java.util.Objects.requireNonNull;

/**
 * Programs of the box modality. {@code For} loops are desugared by the parser, see {@link #desugar(For)}.
 */
sealed public interface Program permits Program.Assign, Program.Test, Program.Skip, Program.Seq, Program.Choice,
        Program.Star, Program.If, Program.While, Program.For, Program.Action {

    Skip SKIP = new Skip();

    /**
     * {@code for lo ≤ i < hi do body} as {@code i := lo; while i < hi do {body; i := i + 1}}.
     */
    static Seq desugar(For f) {
        var step = new Assign(f.var(), Term.infix("+", f.var(), new Term.Const("1")));
        var loop = new While(new Formula.Atomic("<", f.var(), f.hi()), new Seq(f.body(), step), null);
        return new Seq(new Assign(f.var(), f.lo()), loop);
    }

    /**
     * Parenthesises compound programs in positions that only take a single program. Nested
     * conditionals and loops are grouped too, so a trailing {@code else} or {@code inv} stays
     * with the enclosing construct.
     */
    private static String unary(Program p) {
        return p instanceof Seq || p instanceof Choice || p instanceof If || p instanceof While || p instanceof For
                ? "(" + p + ')' : p.toString();
    }

    JSONObject toJson();

    record Assign(Term.Var var, Term value) implements Program {
        public Assign {
            requireNonNull(var);
            requireNonNull(value);
        }

        @Override
        public String toString() {
            return var + " := " + value;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "assign")
                    .put("var", var.name())
                    .put("value", value.toJson());
        }
    }

    record Test(Formula condition) implements Program {
        public Test {
            requireNonNull(condition);
        }

        @Override
        public String toString() {
            return "?" + condition;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "test")
                    .put("condition", condition.toJson());
        }
    }

    record Skip() implements Program {
        @Override
        public String toString() {
            return "skip";
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "skip");
        }
    }

    record Seq(Program first, Program second) implements Program {
        public Seq {
            requireNonNull(first);
            requireNonNull(second);
        }

        @Override
        public String toString() {
            var l = first instanceof Choice ? "(" + first + ')' : first.toString();
            return l + "; " + unary(second);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "seq")
                    .put("first", first.toJson())
                    .put("second", second.toJson());
        }
    }

    record Choice(Program left, Program right) implements Program {
        public Choice {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String toString() {
            var r = right instanceof Choice ? "(" + right + ')' : right.toString();
            return left + " ∪ " + r;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "choice")
                    .put("left", left.toJson())
                    .put("right", right.toJson());
        }
    }

    record Star(Program body) implements Program {
        public Star {
            requireNonNull(body);
        }

        @Override
        public String toString() {
            return (body instanceof Action || body instanceof Skip || body instanceof Star ? body.toString() : "(" + body + ')') + '*';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "star")
                    .put("body", body.toJson());
        }
    }

    record If(Formula condition, Program then, Program otherwise) implements Program {
        public If {
            requireNonNull(condition);
            requireNonNull(then);
            requireNonNull(otherwise);
        }

        @Override
        public String toString() {
            return "if " + condition + " then " + unary(then) + " else " + unary(otherwise);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "if")
                    .put("condition", condition.toJson())
                    .put("then", then.toJson())
                    .put("else", otherwise.toJson());
        }
    }

    record While(Formula condition, Program body, @Nullable Formula invariant) implements Program {
        public While {
            requireNonNull(condition);
            requireNonNull(body);
        }

        @Override
        public String toString() {
            var s = "while " + condition + " do " + unary(body);
            if (invariant == null) return s;
            return s + " inv " + (invariant instanceof Formula.Quantified ? "(" + invariant + ')' : invariant.toString());
        }

        @Override
        public JSONObject toJson() {
            var json = new JSONObject()
                    .put("type", "while")
                    .put("condition", condition.toJson())
                    .put("body", body.toJson());
            if (invariant != null) json.put("invariant", invariant.toJson());
            return json;
        }
    }

    record For(Term.Var var, Term lo, Term hi, Program body) implements Program {
        public For {
            requireNonNull(var);
            requireNonNull(lo);
            requireNonNull(hi);
            requireNonNull(body);
        }

        @Override
        public String toString() {
            return "for " + lo + " ≤ " + var + " < " + hi + " do " + unary(body);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "for")
                    .put("var", var.name())
                    .put("lo", lo.toJson())
                    .put("hi", hi.toJson())
                    .put("body", body.toJson());
        }
    }

    /** Uninterpreted atomic program. */
    record Action(String name) implements Program {
        public Action {
            requireNonNull(name);
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "action")
                    .put("name", name);
        }
    }
}
