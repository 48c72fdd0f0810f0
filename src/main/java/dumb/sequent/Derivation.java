package dumb.sequent;

import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Export form of a proof: each sequent with the rule applied to it over its premises. A closed
 * axiom leaf carries its rule and no premises; an unexpanded leaf carries no rule.
 */
public record Derivation(Sequent sequent, @Nullable String rule, boolean closed, List<Derivation> premises) {

    public Derivation {
        requireNonNull(sequent);
        premises = List.copyOf(requireNonNull(premises));
    }

    public static Derivation of(ProofNode node) {
        return new Derivation(node.sequent,
                node.application().map(ProofNode.Application::rule).orElse(null),
                node.isClosed(),
                node.children().stream().map(Derivation::of).toList());
    }

    public JSONObject toJson() {
        var json = new JSONObject()
                .put("sequent", sequent.toJson())
                .put("closed", closed);
        if (rule != null) json.put("rule", rule);
        var jsonPremises = new JSONArray();
        premises.forEach(p -> jsonPremises.put(p.toJson()));
        return json.put("premises", jsonPremises);
    }
}
