package dumb.sequent;

import dumb.sequent.SequentParser.ParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static dumb.sequent.RuleException.Reason.*;

/**
 * Interprets {@link RuleTemplate}s: binds placeholders to parts of the selected formula, renders
 * each template as text and parses it back.
 */
public enum TemplateRules {
    ;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\b(LEFT|RIGHT|INNER|FORMULA)\\b");

    static List<Sequent> apply(Sequent s, RuleSpec spec) throws RuleException {
        var template = spec.template();
        if (template == null) throw new RuleException(PRECONDITION_FAILED, "No template given");
        if (template.arity() == RuleTemplate.Arity.CLOSE) return List.of();
        if (spec.side() != null && spec.side() != template.side())
            throw new RuleException(NO_MATCHING_FORMULA, template.name() + " applies on the " + template.side());
        var bound = new RuleSpec(Rule.CUSTOM, template.side(), spec.index(), null, null, template);
        var selected = Rules.target(s, bound);
        var bindings = bindings(selected);
        var rest = Rules.rest(s, bound);
        var premises = new ArrayList<Sequent>();
        for (var text : template.templates())
            premises.add(rest.plus(template.side(), render(template.name(), text, bindings)));
        return premises;
    }

    static Map<String, Formula> bindings(Formula f) {
        var map = new HashMap<String, Formula>();
        map.put("FORMULA", f);
        if (f instanceof Formula.Binary b) {
            map.put("LEFT", b.left());
            map.put("RIGHT", b.right());
        } else if (f instanceof Formula.Not n) {
            map.put("INNER", n.inner());
        }
        return map;
    }

    static List<Formula> render(String name, String text, Map<String, Formula> bindings) throws RuleException {
        var m = PLACEHOLDER.matcher(text);
        var out = new StringBuilder();
        while (m.find()) {
            var f = bindings.get(m.group(1));
            if (f == null)
                throw new RuleException(PRECONDITION_FAILED, name + ": " + m.group(1) + " has no match in " + bindings.get("FORMULA"));
            m.appendReplacement(out, Matcher.quoteReplacement("(" + f + ')'));
        }
        m.appendTail(out);
        try {
            return SequentParser.parseFormulaList(out.toString());
        } catch (ParseException e) {
            throw new RuleException(TEMPLATE_PARSE_FAILED, name + " rendered unparsable text '" + out + "': " + e.getMessage(), e);
        }
    }
}
