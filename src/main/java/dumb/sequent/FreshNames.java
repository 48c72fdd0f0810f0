package dumb.sequent;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Session-scoped fresh variable allocation: {@code base_1}, {@code base_2}, ... from a counter that
 * only moves forward, so no name is handed out twice within one proof.
 */
public class FreshNames {

    private final String separator;
    private final Pattern numericSuffix;
    private final Set<String> issued = new HashSet<>();
    private int counter;

    public FreshNames() {
        this("_");
    }

    public FreshNames(String separator) {
        this.separator = requireNonNull(separator);
        if (!Term.NAME_PATTERN.matcher("x" + separator + '1').matches())
            throw new IllegalArgumentException("Separator does not yield valid variable names: " + separator);
        this.numericSuffix = Pattern.compile("^(.+?)(" + Pattern.quote(separator) + "\\d+)+$");
    }

    /** A variable named after {@code base} that occurs nowhere in {@code sequent} and was never issued before. */
    public Term.Var fresh(String base, Sequent sequent) {
        var stem = stem(base);
        var taken = Subst.occurring(sequent);
        while (true) {
            var candidate = new Term.Var(stem + separator + (++counter));
            if (!taken.contains(candidate) && issued.add(candidate.name())) return candidate;
        }
    }

    public void reset() {
        counter = 0;
        issued.clear();
    }

    public int issuedCount() {
        return issued.size();
    }

    private String stem(String base) {
        var m = numericSuffix.matcher(base);
        return m.matches() ? m.group(1) : base;
    }
}
