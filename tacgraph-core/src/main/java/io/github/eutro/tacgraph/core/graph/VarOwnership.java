package io.github.eutro.tacgraph.core.graph;

import io.github.eutro.tacgraph.core.facts.Func;
import io.github.eutro.tacgraph.core.facts.Stmt;
import io.github.eutro.tacgraph.core.facts.Var;

import java.util.*;

/**
 * The function every variable, and every statement, belongs to.
 */
public final class VarOwnership {
    private final Set<Var> variables;
    private final Map<Var, Func> owners;
    private final Map<Stmt, Func> statementFunctions;

    /**
     * @param variables          Every variable, including those whose owner was ambiguous.
     * @param owners             The owner of each variable with exactly one.
     * @param statementFunctions The function of each statement.
     */
    public VarOwnership(Set<Var> variables, Map<Var, Func> owners, Map<Stmt, Func> statementFunctions) {
        this.variables = Collections.unmodifiableSet(new TreeSet<>(variables));
        this.owners = Collections.unmodifiableMap(new TreeMap<>(owners));
        this.statementFunctions = Collections.unmodifiableMap(new TreeMap<>(statementFunctions));
    }

    /**
     * Whether {@code var} is used, defined, or a formal parameter anywhere.
     *
     * @param var The variable.
     * @return Whether it is a variable.
     */
    public boolean isVariable(Var var) {
        return variables.contains(var);
    }

    public Optional<Func> owner(Var var) {
        return Optional.ofNullable(owners.get(var));
    }

    public Set<Var> variables() {
        return variables;
    }

    public Map<Var, Func> owners() {
        return owners;
    }

    public Map<Stmt, Func> statementFunctions() {
        return statementFunctions;
    }
}
