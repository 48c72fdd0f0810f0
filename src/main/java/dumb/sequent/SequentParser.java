package dumb.sequent;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for sequents, formulas, terms and programs.
 * <p>
 * Precedence, loosest first: {@code ↔ → ∨ ∧ ¬} then atomic formulas. Quantifiers take the rest of
 * the formula. ASCII keywords and Unicode glyphs are synonyms.
 */
public class SequentParser {

    private static final int CONTEXT_RADIUS = 20;

    /** Symbol spellings, longest first within each length class. */
    private static final String[][] SYMBOLS = {
            {"<->", "↔"}, {"<=>", "↔"},
            {"|-", "⊢"}, {"->", "→"}, {"=>", "→"}, {"&&", "∧"}, {"||", "∨"}, {"/\\", "∧"}, {"\\/", "∨"},
            {":=", ":="}, {"<=", "≤"}, {">=", "≥"}, {"!=", "≠"}, {"++", "∪"},
            {"∧", "∧"}, {"∨", "∨"}, {"¬", "¬"}, {"→", "→"}, {"↔", "↔"}, {"∀", "∀"}, {"∃", "∃"},
            {"⊤", "⊤"}, {"⊥", "⊥"}, {"⊢", "⊢"}, {"∪", "∪"}, {"≤", "≤"}, {"≥", "≥"}, {"≠", "≠"},
            {"&", "∧"}, {"~", "¬"}, {"!", "¬"},
            {"(", "("}, {")", ")"}, {"[", "["}, {"]", "]"}, {"{", "{"}, {"}", "}"},
            {",", ","}, {";", ";"}, {".", "."}, {":", ":"}, {"?", "?"},
            {"*", "*"}, {"+", "+"}, {"-", "-"}, {"/", "/"}, {"<", "<"}, {">", ">"}, {"=", "="}
    };

    /** Case-insensitive connective keywords. */
    private static final Map<String, String> CONNECTIVES = Map.of(
            "and", "∧", "or", "∨", "not", "¬", "implies", "→", "iff", "↔");

    private static final Map<String, String> KEYWORDS = Map.of(
            "forall", "∀", "exists", "∃", "true", "⊤", "false", "⊥", "entails", "⊢");

    private static final Set<String> RESERVED = Set.of(
            "skip", "if", "then", "else", "while", "do", "for", "inv", "invariant");

    private static final Set<String> TERM_OPERATORS = Set.of("+", "-", "*", "/", "<", ">", "≤", "≥", "=", "≠");

    private final String text;
    private final List<Token> tokens;
    private int pos;

    private SequentParser(String text) throws ParseException {
        this.text = text;
        this.tokens = tokenize(text);
    }

    public static Sequent parseSequent(String text) throws ParseException {
        var p = new SequentParser(text);
        var lhs = p.formulaList();
        p.expect("⊢", "'|-'");
        var rhs = p.formulaList();
        p.expectEnd();
        return new Sequent(lhs, rhs);
    }

    public static Formula parseFormula(String text) throws ParseException {
        var p = new SequentParser(text);
        var f = p.formula();
        p.expectEnd();
        return f;
    }

    /** Comma-separated formulas; empty text yields an empty list. */
    public static List<Formula> parseFormulaList(String text) throws ParseException {
        var p = new SequentParser(text);
        var list = p.formulaList();
        p.expectEnd();
        return list;
    }

    public static Term parseTerm(String text) throws ParseException {
        var p = new SequentParser(text);
        var t = p.term();
        p.expectEnd();
        return t;
    }

    public static Program parseProgram(String text) throws ParseException {
        var p = new SequentParser(text);
        var prog = p.program();
        p.expectEnd();
        return prog;
    }

    private static List<Token> tokenize(String text) throws ParseException {
        var tokens = new ArrayList<Token>();
        var i = 0;
        var n = text.length();
        outer:
        while (i < n) {
            var c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                var start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_' || text.charAt(i) == '\''))
                    i++;
                var word = text.substring(start, i);
                var connective = CONNECTIVES.get(word.toLowerCase());
                var keyword = KEYWORDS.get(word);
                if (connective != null) tokens.add(new Token(Kind.SYM, connective, start));
                else if (keyword != null) tokens.add(new Token(Kind.SYM, keyword, start));
                else tokens.add(new Token(Kind.IDENT, word, start));
                continue;
            }
            if (Character.isDigit(c)) {
                var start = i;
                while (i < n && Character.isDigit(text.charAt(i))) i++;
                tokens.add(new Token(Kind.NUMBER, text.substring(start, i), start));
                continue;
            }
            for (var sym : SYMBOLS) {
                if (text.startsWith(sym[0], i)) {
                    tokens.add(new Token(Kind.SYM, sym[1], i));
                    i += sym[0].length();
                    continue outer;
                }
            }
            throw new ParseException("Unknown character '" + c + "'", i, "token", context(text, i));
        }
        tokens.add(new Token(Kind.EOF, "", n));
        return tokens;
    }

    private static String context(String text, int at) {
        return text.substring(Math.max(0, at - CONTEXT_RADIUS), Math.min(text.length(), at + CONTEXT_RADIUS));
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token next() {
        var t = tokens.get(pos);
        if (t.kind != Kind.EOF) pos++;
        return t;
    }

    private boolean at(String sym) {
        var t = peek();
        return t.kind == Kind.SYM && t.text.equals(sym);
    }

    private boolean atKeyword(String word) {
        var t = peek();
        return t.kind == Kind.IDENT && t.text.equals(word);
    }

    private boolean accept(String sym) {
        if (!at(sym)) return false;
        pos++;
        return true;
    }

    private boolean acceptKeyword(String word) {
        if (!atKeyword(word)) return false;
        pos++;
        return true;
    }

    private void expect(String sym, String expected) throws ParseException {
        if (!accept(sym)) throw error(expected);
    }

    private void expectKeyword(String word) throws ParseException {
        if (!acceptKeyword(word)) throw error("'" + word + "'");
    }

    private void expectEnd() throws ParseException {
        if (peek().kind != Kind.EOF) throw error("end of input");
    }

    private ParseException error(String expected) {
        var t = peek();
        var found = t.kind == Kind.EOF ? "end of input" : "'" + t.text + "'";
        return new ParseException("Expected " + expected + ", found " + found, t.pos, expected, context(text, t.pos));
    }

    private List<Formula> formulaList() throws ParseException {
        var list = new ArrayList<Formula>();
        if (at("⊢") || peek().kind == Kind.EOF) return list;
        list.add(formula());
        while (accept(",")) list.add(formula());
        return list;
    }

    private Formula formula() throws ParseException {
        return iff();
    }

    private Formula iff() throws ParseException {
        var left = implies();
        return accept("↔") ? new Formula.Iff(left, iff()) : left;
    }

    private Formula implies() throws ParseException {
        var left = or();
        return accept("→") ? new Formula.Implies(left, implies()) : left;
    }

    private Formula or() throws ParseException {
        var left = and();
        while (accept("∨")) left = new Formula.Or(left, and());
        return left;
    }

    private Formula and() throws ParseException {
        var left = unary();
        while (accept("∧")) left = new Formula.And(left, unary());
        return left;
    }

    private Formula unary() throws ParseException {
        if (accept("¬")) return new Formula.Not(unary());
        if (at("∀") || at("∃")) {
            var universal = next().text.equals("∀");
            var v = variable();
            if (!accept(".")) accept(":");
            var body = formula();
            return universal ? new Formula.Forall(v, body) : new Formula.Exists(v, body);
        }
        if (accept("[")) {
            var program = program();
            expect("]", "']'");
            return new Formula.Box(program, unary());
        }
        return atomic();
    }

    private Formula atomic() throws ParseException {
        if (accept("⊤")) return Formula.TRUE;
        if (accept("⊥")) return Formula.FALSE;
        ParseException formulaError = null;
        if (at("(")) {
            var mark = pos;
            try {
                next();
                var f = formula();
                expect(")", "')'");
                if (!isTermOperator(peek())) return f;
            } catch (ParseException e) {
                formulaError = e;
            }
            pos = mark;
        }
        if (!isTermStart(peek())) throw error("formula");
        try {
            return termAtomic();
        } catch (ParseException e) {
            throw formulaError != null && formulaError.position > e.position ? formulaError : e;
        }
    }

    private Formula termAtomic() throws ParseException {
        var left = term();
        var t = peek();
        if (t.kind == Kind.SYM) {
            switch (t.text) {
                case "=" -> {
                    next();
                    return new Formula.Equals(left, term());
                }
                case "≠" -> {
                    next();
                    return Formula.not(new Formula.Equals(left, term()));
                }
                case "<", ">", "≤", "≥" -> {
                    next();
                    return new Formula.Atomic(t.text, left, term());
                }
                default -> {
                }
            }
        }
        if (left instanceof Term.Var v) return new Formula.Atomic(v.name());
        if (left instanceof Term.Fn f && !Term.INFIX.contains(f.name()) && !f.name().equals("-"))
            return new Formula.Atomic(f.name(), f.args());
        throw error("comparison operator");
    }

    private boolean isTermOperator(Token t) {
        return t.kind == Kind.SYM && TERM_OPERATORS.contains(t.text);
    }

    private boolean isTermStart(Token t) {
        return switch (t.kind) {
            case NUMBER -> true;
            case IDENT -> !RESERVED.contains(t.text);
            case SYM -> t.text.equals("(") || t.text.equals("-");
            case EOF -> false;
        };
    }

    private Term term() throws ParseException {
        var left = product();
        while (at("+") || at("-")) {
            var op = next().text;
            left = Term.infix(op, left, product());
        }
        return left;
    }

    private Term product() throws ParseException {
        var left = negation();
        while ((at("*") || at("/")) && isTermStart(peek(1))) {
            var op = next().text;
            left = Term.infix(op, left, negation());
        }
        return left;
    }

    private Term negation() throws ParseException {
        if (accept("-")) return new Term.Fn("-", negation());
        return primary();
    }

    private Term primary() throws ParseException {
        var t = peek();
        if (t.kind == Kind.NUMBER) return new Term.Const(next().text);
        if (accept("(")) {
            var inner = term();
            expect(")", "')'");
            return inner;
        }
        if (t.kind == Kind.IDENT && !RESERVED.contains(t.text)) {
            next();
            if (!accept("(")) return new Term.Var(t.text);
            var args = new ArrayList<Term>();
            if (!accept(")")) {
                args.add(term());
                while (accept(",")) args.add(term());
                expect(")", "')'");
            }
            return new Term.Fn(t.text, args);
        }
        throw error("term");
    }

    private Term.Var variable() throws ParseException {
        var t = peek();
        if (t.kind != Kind.IDENT || RESERVED.contains(t.text)) throw error("variable");
        next();
        return new Term.Var(t.text);
    }

    private Program program() throws ParseException {
        var left = sequence();
        while (accept("∪")) left = new Program.Choice(left, sequence());
        return left;
    }

    private Program sequence() throws ParseException {
        var left = iteration();
        while (accept(";")) left = new Program.Seq(left, iteration());
        return left;
    }

    private Program iteration() throws ParseException {
        var p = simpleProgram();
        while (accept("*")) p = new Program.Star(p);
        return p;
    }

    private Program simpleProgram() throws ParseException {
        if (accept("(")) {
            var p = program();
            expect(")", "')'");
            return p;
        }
        if (accept("{")) {
            var p = program();
            expect("}", "'}'");
            return p;
        }
        if (accept("?")) return new Program.Test(formula());
        if (acceptKeyword("skip")) return Program.SKIP;
        if (acceptKeyword("if")) {
            var condition = formula();
            expectKeyword("then");
            var then = iteration();
            var otherwise = acceptKeyword("else") ? iteration() : Program.SKIP;
            return new Program.If(condition, then, otherwise);
        }
        if (acceptKeyword("while")) {
            var condition = formula();
            expectKeyword("do");
            var body = iteration();
            Formula invariant = acceptKeyword("inv") || acceptKeyword("invariant") ? unary() : null;
            return new Program.While(condition, body, invariant);
        }
        if (acceptKeyword("for")) {
            var lo = term();
            expect("≤", "'<='");
            var v = variable();
            expect("<", "'<'");
            var hi = term();
            expectKeyword("do");
            return Program.desugar(new Program.For(v, lo, hi, iteration()));
        }
        var t = peek();
        if (t.kind == Kind.IDENT && !RESERVED.contains(t.text)) {
            next();
            if (accept(":=")) return new Program.Assign(new Term.Var(t.text), term());
            return new Program.Action(t.text);
        }
        throw error("program");
    }

    private enum Kind {IDENT, NUMBER, SYM, EOF}

    private record Token(Kind kind, String text, int pos) {
    }

    public static class ParseException extends Exception {
        private final int position;
        private final String expected;
        private final String context;

        public ParseException(String message, int position, String expected, @Nullable String context) {
            super(message);
            this.position = position;
            this.expected = expected;
            this.context = context;
        }

        /** 0-based character offset of the offending token. */
        public int position() {
            return position;
        }

        /** The construct the parser was looking for. */
        public String expected() {
            return expected;
        }

        @Override
        public String getMessage() {
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + " at position " + position + contextSnippet;
        }
    }
}
