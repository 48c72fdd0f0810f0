package dumb.sequent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A user-defined rule as plain data. Each template is a comma-separated formula list in which
 * {@code LEFT}, {@code RIGHT}, {@code INNER} and {@code FORMULA} stand for parts of the selected
 * formula.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleTemplate(@JsonProperty("name") String name,
                           @JsonProperty("side") Side side,
                           @JsonProperty("arity") Arity arity,
                           @JsonProperty("templates") List<String> templates) {

    @JsonCreator
    public RuleTemplate {
        requireNonNull(name);
        requireNonNull(side);
        requireNonNull(arity);
        templates = templates == null ? List.of() : List.copyOf(templates);
        if (name.isBlank()) throw new IllegalArgumentException("Rule template needs a name");
        if (Rule.byName(name).isPresent())
            throw new IllegalArgumentException("Rule template name clashes with built-in rule: " + name);
        if (templates.size() != arity.premises)
            throw new IllegalArgumentException(arity + " rule " + name + " needs " + arity.premises + " template(s), got " + templates.size());
    }

    public static RuleTemplate unary(String name, Side side, String template) {
        return new RuleTemplate(name, side, Arity.UNARY, List.of(template));
    }

    public static RuleTemplate binary(String name, Side side, String first, String second) {
        return new RuleTemplate(name, side, Arity.BINARY, List.of(first, second));
    }

    public static RuleTemplate close(String name, Side side) {
        return new RuleTemplate(name, side, Arity.CLOSE, List.of());
    }

    public enum Arity {
        UNARY(1), BINARY(2), CLOSE(0);

        public final int premises;

        Arity(int premises) {
            this.premises = premises;
        }
    }
}
