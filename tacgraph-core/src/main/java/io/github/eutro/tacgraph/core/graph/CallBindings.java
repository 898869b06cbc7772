package io.github.eutro.tacgraph.core.graph;

import io.github.eutro.tacgraph.core.facts.Binding;
import io.github.eutro.tacgraph.core.facts.Block;
import io.github.eutro.tacgraph.core.facts.Func;
import io.github.eutro.tacgraph.core.facts.Var;

import java.util.*;

/**
 * The zero-based positional bindings at private call and return sites.
 * <p>
 * The actual arguments of a call are bound at the caller block, the formal return values of
 * a function at the function. Formal parameters and actual return receivers come from the
 * lifter, and are only kept if their positions are well-formed.
 * Within each list, bindings are sorted by site, then position.
 */
public final class CallBindings {
    private final List<Binding<Block>> actualArgs;
    private final List<Binding<Func>> formalReturnArgs;
    private final List<Binding<Func>> formalArgs;
    private final List<Binding<Block>> actualReturnArgs;

    public CallBindings(Collection<Binding<Block>> actualArgs,
                        Collection<Binding<Func>> formalReturnArgs,
                        Collection<Binding<Func>> formalArgs,
                        Collection<Binding<Block>> actualReturnArgs) {
        this.actualArgs = sorted(actualArgs);
        this.formalReturnArgs = sorted(formalReturnArgs);
        this.formalArgs = sorted(formalArgs);
        this.actualReturnArgs = sorted(actualReturnArgs);
    }

    private static <T extends Comparable<? super T>> List<T> sorted(Collection<T> c) {
        List<T> list = new ArrayList<>(c);
        Collections.sort(list);
        return Collections.unmodifiableList(list);
    }

    public List<Binding<Block>> actualArgs() {
        return actualArgs;
    }

    public List<Binding<Func>> formalReturnArgs() {
        return formalReturnArgs;
    }

    public List<Binding<Func>> formalArgs() {
        return formalArgs;
    }

    public List<Binding<Block>> actualReturnArgs() {
        return actualReturnArgs;
    }

    /**
     * Get the actual arguments passed by the call ending a block, indexed by position.
     *
     * @param caller The caller block.
     * @return The arguments, empty if the block makes no call.
     */
    public List<Var> actualArgsAt(Block caller) {
        List<Var> vars = new ArrayList<>();
        for (Binding<Block> binding : actualArgs) {
            if (binding.site.equals(caller)) vars.add(binding.var);
        }
        return vars;
    }
}
