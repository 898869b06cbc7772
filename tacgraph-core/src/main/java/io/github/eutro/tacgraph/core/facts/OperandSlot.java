package io.github.eutro.tacgraph.core.facts;

import java.util.Objects;

/**
 * A variable occupying an operand position of a statement, either as a use or a definition.
 */
public final class OperandSlot {
    public final Stmt stmt;
    public final Var var;
    /**
     * The raw, zero-based operand position.
     */
    public final int position;

    private OperandSlot(Stmt stmt, Var var, int position) {
        this.stmt = Objects.requireNonNull(stmt);
        this.var = Objects.requireNonNull(var);
        this.position = position;
    }

    public static OperandSlot of(Stmt stmt, Var var, int position) {
        return new OperandSlot(stmt, var, position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperandSlot that = (OperandSlot) o;
        return position == that.position && stmt.equals(that.stmt) && var.equals(that.var);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stmt, var, position);
    }

    @Override
    public String toString() {
        return stmt + "[" + position + "] = " + var;
    }
}
