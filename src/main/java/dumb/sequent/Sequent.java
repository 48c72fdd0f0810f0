package dumb.sequent;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Antecedents (LHS) and succedents (RHS). Duplicates are kept as separate entries and the order
 * only matters for selecting formulas by index.
 */
public record Sequent(List<Formula> lhs, List<Formula> rhs) {

    public Sequent {
        lhs = List.copyOf(requireNonNull(lhs));
        rhs = List.copyOf(requireNonNull(rhs));
    }

    public List<Formula> side(Side side) {
        return side == Side.LHS ? lhs : rhs;
    }

    /** Copy with the formula at {@code index} on {@code side} removed. */
    public Sequent without(Side side, int index) {
        var list = new ArrayList<>(side(side));
        list.remove(index);
        return with(side, list);
    }

    /** Copy with {@code formulas} appended to {@code side}. */
    public Sequent plus(Side side, Collection<? extends Formula> formulas) {
        var list = new ArrayList<>(side(side));
        list.addAll(formulas);
        return with(side, list);
    }

    public Sequent plus(Side side, Formula... formulas) {
        return plus(side, List.of(formulas));
    }

    private Sequent with(Side side, List<Formula> list) {
        return side == Side.LHS ? new Sequent(list, rhs) : new Sequent(lhs, list);
    }

    public JSONObject toJson() {
        var l = new JSONArray();
        var r = new JSONArray();
        lhs.forEach(f -> l.put(f.toJson()));
        rhs.forEach(f -> r.put(f.toJson()));
        return new JSONObject()
                .put("lhs", l)
                .put("rhs", r)
                .put("text", toString());
    }

    @Override
    public String toString() {
        var l = lhs.stream().map(Formula::toString).collect(Collectors.joining(", "));
        var r = rhs.stream().map(Formula::toString).collect(Collectors.joining(", "));
        return (l.isEmpty() ? "" : l + ' ') + '⊢' + (r.isEmpty() ? "" : " " + r);
    }
}
