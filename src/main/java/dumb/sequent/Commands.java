package dumb.sequent;

import dumb.sequent.SequentParser.ParseException;
import dumb.sequent.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static dumb.sequent.util.Log.error;
import static java.util.Objects.requireNonNull;

/**
 * Line-oriented command surface over a {@link ProofSession}. Every command returns the text to
 * show; failures come back as {@code error: ...} lines and never end the session.
 */
public class Commands {

    static final String HELP = """
            start <sequent>                       begin a proof, e.g. start p and q |- q and p
            apply <node> <rule> [lhs|rhs <index>] [argument]
                                                  apply a rule, e.g. apply 0 andL lhs 0
            show [node]                           list the formulas of a node
            tree                                  print the proof tree
            status                                OPEN or CLOSED
            rules                                 list rules and templates
            define <name> <lhs|rhs> <unary|binary|close> [template | template]
                                                  add a rule template
            save                                  write templates to the template file
            export                                proof as JSON
            config                                show the configuration
            help                                  this text
            """;

    private final ProofSession session;
    private final RuleTemplateStore store;
    private final Configuration config;

    public Commands(ProofSession session, RuleTemplateStore store, Configuration config) {
        this.session = requireNonNull(session);
        this.store = requireNonNull(store);
        this.config = requireNonNull(config);
    }

    public String execute(String line) {
        var trimmed = line.trim();
        if (trimmed.isEmpty()) return "";
        var split = trimmed.split("\\s+", 2);
        var command = split[0].toLowerCase();
        var rest = split.length > 1 ? split[1] : "";
        try {
            return switch (command) {
                case "start" -> start(rest);
                case "apply" -> apply(rest);
                case "show" -> show(rest);
                case "tree" -> session.tree().toString();
                case "status" -> session.status().toString();
                case "rules" -> rules();
                case "define" -> define(rest);
                case "save" -> save();
                case "export" -> session.export().toJson().toString(2);
                case "config" -> Json.str(config);
                case "help" -> HELP;
                default -> "error: unknown command '" + command + "', try help";
            };
        } catch (ParseException | RuleException | IllegalArgumentException | IllegalStateException e) {
            return "error: " + e.getMessage();
        } catch (IOException e) {
            error("Command failed: " + trimmed, e);
            return "error: " + e.getMessage();
        }
    }

    private String start(String text) throws ParseException {
        var tree = session.start(text);
        return describe(tree.root);
    }

    private String apply(String args) throws RuleException, ParseException {
        var words = args.trim().split("\\s+");
        if (words.length < 2) throw new IllegalArgumentException("usage: apply <node> <rule> [lhs|rhs <index>] [argument]");
        var nodeId = integer(words[0], "node id");
        var rule = words[1];
        Side side = null;
        var index = -1;
        var consumed = 2;
        if (words.length >= 4 && Side.parse(words[2]) != null && isInteger(words[3])) {
            side = Side.parse(words[2]);
            index = Integer.parseInt(words[3]);
            consumed = 4;
        }
        var argument = String.join(" ", Arrays.asList(words).subList(consumed, words.length));
        var children = session.apply(nodeId, rule, side, index, argument);
        var node = session.node(nodeId);
        if (children.isEmpty()) return "#" + nodeId + " closed by " + node.application().orElseThrow().rule();
        return children.stream().map(this::describe).collect(Collectors.joining("\n"))
                + (session.status() == ProofNode.Status.CLOSED ? "\nproof complete" : "");
    }

    private String show(String args) throws RuleException {
        if (args.isBlank()) {
            var open = session.tree().openLeaves();
            if (open.isEmpty()) return "no open goals";
            return open.stream().map(this::describe).collect(Collectors.joining("\n"));
        }
        return describe(session.node(integer(args.trim(), "node id")));
    }

    private String rules() {
        var builtIn = Arrays.stream(Rule.values())
                .filter(r -> r != Rule.CUSTOM)
                .map(r -> String.format("  %-14s %-12s %s", r.label, r.alias, r.side == null ? "either" : r.side))
                .collect(Collectors.joining("\n"));
        var custom = session.templates().stream()
                .map(t -> String.format("  %-14s %-12s %s %s %s", t.name(), "", t.side(), t.arity(), t.templates()))
                .collect(Collectors.joining("\n"));
        return builtIn + (custom.isEmpty() ? "" : "\n" + custom);
    }

    private String define(String args) {
        var words = args.trim().split("\\s+", 4);
        if (words.length < 3) throw new IllegalArgumentException("usage: define <name> <lhs|rhs> <unary|binary|close> [template | template]");
        var side = Side.parse(words[1]);
        if (side == null) throw new IllegalArgumentException("Unknown side " + words[1]);
        var arity = RuleTemplate.Arity.valueOf(words[2].toUpperCase());
        List<String> templates = words.length < 4 ? List.of()
                : Arrays.stream(words[3].split("\\s\\|\\s")).map(String::trim).toList();
        var template = new RuleTemplate(words[0], side, arity, templates);
        session.register(template);
        return "defined " + template.name();
    }

    private String save() throws IOException {
        store.save(session.templates());
        return "saved " + session.templates().size() + " template(s)";
    }

    private String describe(ProofNode node) {
        var sb = new StringBuilder("#").append(node.id).append(" [").append(node.status()).append("] ").append(node.sequent);
        var lhs = node.sequent.lhs();
        var rhs = node.sequent.rhs();
        for (var i = 0; i < lhs.size(); i++) sb.append("\n  lhs ").append(i).append(": ").append(lhs.get(i));
        for (var i = 0; i < rhs.size(); i++) sb.append("\n  rhs ").append(i).append(": ").append(rhs.get(i));
        return sb.toString();
    }

    private static int integer(String s, String what) {
        if (!isInteger(s)) throw new IllegalArgumentException("Expected " + what + ", got '" + s + "'");
        return Integer.parseInt(s);
    }

    private static boolean isInteger(@Nullable String s) {
        return s != null && s.matches("-?\\d+");
    }
}
