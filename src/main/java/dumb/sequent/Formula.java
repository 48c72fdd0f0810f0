package dumb.sequent;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Formulas of propositional, first-order and dynamic logic. Values are immutable and compared
 * structurally; {@link #toString()} prints text that {@link SequentParser} reads back.
 */
sealed public interface Formula permits Formula.Atomic, Formula.Equals, Formula.Not, Formula.Binary,
        Formula.True, Formula.False, Formula.Quantified, Formula.Box {

    Set<String> COMPARISONS = Set.of("<", ">", "≤", "≥");

    True TRUE = new True();
    False FALSE = new False();

    static Formula not(Formula f) {
        return new Not(f);
    }

    /** Wraps quantifiers, which would otherwise swallow whatever follows them. */
    private static String operand(Formula f) {
        return f instanceof Quantified ? "(" + f + ')' : f.toString();
    }

    JSONObject toJson();

    record Atomic(String predicate, List<Term> args) implements Formula {
        public Atomic {
            requireNonNull(predicate);
            args = List.copyOf(requireNonNull(args));
        }

        public Atomic(String predicate, Term... args) {
            this(predicate, List.of(args));
        }

        public boolean isComparison() {
            return COMPARISONS.contains(predicate) && args.size() == 2;
        }

        @Override
        public String toString() {
            if (isComparison()) return args.get(0) + " " + predicate + ' ' + args.get(1);
            if (args.isEmpty()) return predicate;
            return args.stream().map(Term::toString).collect(Collectors.joining(", ", predicate + '(', ")"));
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject()
                    .put("type", "atomic")
                    .put("predicate", predicate)
                    .put("args", jsonArgs);
        }
    }

    record Equals(Term left, Term right) implements Formula {
        public Equals {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String toString() {
            return left + " = " + right;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "equals")
                    .put("left", left.toJson())
                    .put("right", right.toJson());
        }
    }

    record Not(Formula inner) implements Formula {
        public Not {
            requireNonNull(inner);
        }

        @Override
        public String toString() {
            return "¬" + operand(inner);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "not")
                    .put("inner", inner.toJson());
        }
    }

    /** Binary connectives, so that rules and templates can address both operands uniformly. */
    sealed interface Binary extends Formula permits And, Or, Implies, Iff {
        Formula left();

        Formula right();

        String symbol();

        default String print() {
            return "(" + operand(left()) + ' ' + symbol() + ' ' + operand(right()) + ')';
        }

        default JSONObject binaryJson(String type) {
            return new JSONObject()
                    .put("type", type)
                    .put("left", left().toJson())
                    .put("right", right().toJson());
        }
    }

    record And(Formula left, Formula right) implements Binary {
        public And {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String symbol() {
            return "∧";
        }

        @Override
        public String toString() {
            return print();
        }

        @Override
        public JSONObject toJson() {
            return binaryJson("and");
        }
    }

    record Or(Formula left, Formula right) implements Binary {
        public Or {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String symbol() {
            return "∨";
        }

        @Override
        public String toString() {
            return print();
        }

        @Override
        public JSONObject toJson() {
            return binaryJson("or");
        }
    }

    record Implies(Formula left, Formula right) implements Binary {
        public Implies {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String symbol() {
            return "→";
        }

        @Override
        public String toString() {
            return print();
        }

        @Override
        public JSONObject toJson() {
            return binaryJson("implies");
        }
    }

    record Iff(Formula left, Formula right) implements Binary {
        public Iff {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String symbol() {
            return "↔";
        }

        @Override
        public String toString() {
            return print();
        }

        @Override
        public JSONObject toJson() {
            return binaryJson("iff");
        }
    }

    record True() implements Formula {
        @Override
        public String toString() {
            return "⊤";
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "true");
        }
    }

    record False() implements Formula {
        @Override
        public String toString() {
            return "⊥";
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject().put("type", "false");
        }
    }

    sealed interface Quantified extends Formula permits Forall, Exists {
        Term.Var var();

        Formula body();

        /** Same quantifier over a different variable and body. */
        Quantified with(Term.Var var, Formula body);
    }

    record Forall(Term.Var var, Formula body) implements Quantified {
        public Forall {
            requireNonNull(var);
            requireNonNull(body);
        }

        @Override
        public Quantified with(Term.Var var, Formula body) {
            return new Forall(var, body);
        }

        @Override
        public String toString() {
            return "∀" + var + '.' + body;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "forall")
                    .put("var", var.name())
                    .put("body", body.toJson());
        }
    }

    record Exists(Term.Var var, Formula body) implements Quantified {
        public Exists {
            requireNonNull(var);
            requireNonNull(body);
        }

        @Override
        public Quantified with(Term.Var var, Formula body) {
            return new Exists(var, body);
        }

        @Override
        public String toString() {
            return "∃" + var + '.' + body;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "exists")
                    .put("var", var.name())
                    .put("body", body.toJson());
        }
    }

    /** {@code [α]P}: after every terminating run of α, P holds. */
    record Box(Program program, Formula body) implements Formula {
        public Box {
            requireNonNull(program);
            requireNonNull(body);
        }

        @Override
        public String toString() {
            return "[" + program + ']' + operand(body);
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "box")
                    .put("program", program.toJson())
                    .put("body", body.toJson());
        }
    }
}
