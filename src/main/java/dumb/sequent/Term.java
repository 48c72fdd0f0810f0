package dumb.sequent;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * First-order terms: variables, constants and function applications.
 * Arithmetic operators are ordinary function symbols printed infix.
 */
sealed public interface Term permits Term.Var, Term.Const, Term.Fn {

    Set<String> INFIX = Set.of("+", "-", "*", "/");

    Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}_][\\p{L}\\p{N}_']*$");

    static Fn infix(String op, Term left, Term right) {
        return new Fn(op, List.of(left, right));
    }

    Set<Var> vars();

    JSONObject toJson();

    record Var(String name) implements Term {
        public Var {
            requireNonNull(name);
            if (!NAME_PATTERN.matcher(name).matches())
                throw new IllegalArgumentException("Invalid variable name: " + name);
        }

        @Override
        public Set<Var> vars() {
            return Set.of(this);
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name);
        }
    }

    record Const(String name) implements Term {
        public Const {
            requireNonNull(name);
            if (name.isEmpty()) throw new IllegalArgumentException("Empty constant name");
        }

        @Override
        public Set<Var> vars() {
            return Set.of();
        }

        @Override
        public String toString() {
            return name;
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "const")
                    .put("name", name);
        }
    }

    record Fn(String name, List<Term> args) implements Term {
        public Fn {
            requireNonNull(name);
            args = List.copyOf(requireNonNull(args));
        }

        public Fn(String name, Term... args) {
            this(name, List.of(args));
        }

        public boolean isInfix() {
            return INFIX.contains(name) && args.size() == 2;
        }

        @Override
        public Set<Var> vars() {
            return args.stream().flatMap(a -> a.vars().stream()).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public String toString() {
            if (isInfix())
                return operand(args.get(0)) + ' ' + name + ' ' + operand(args.get(1));
            if (name.equals("-") && args.size() == 1)
                return "-" + operand(args.get(0));
            return args.stream().map(Term::toString).collect(Collectors.joining(", ", name + '(', ")"));
        }

        private static String operand(Term t) {
            return t instanceof Fn f && (f.isInfix() || (f.name.equals("-") && f.args.size() == 1)) ? "(" + t + ')' : t.toString();
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject()
                    .put("type", "fn")
                    .put("name", name)
                    .put("args", jsonArgs);
        }
    }
}
