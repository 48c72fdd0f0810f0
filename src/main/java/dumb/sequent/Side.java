package dumb.sequent;

import org.jetbrains.annotations.Nullable;

public enum Side {
    LHS, RHS;

    public Side other() {
        return this == LHS ? RHS : LHS;
    }

    @Nullable
    public static Side parse(String s) {
        return switch (s.toLowerCase()) {
            case "lhs", "l", "left", "antecedent" -> LHS;
            case "rhs", "r", "right", "succedent" -> RHS;
            default -> null;
        };
    }
}
