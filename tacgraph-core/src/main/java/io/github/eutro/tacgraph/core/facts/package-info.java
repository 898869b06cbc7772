/**
 * The input facts of one contract.
 * <p>
 * A contract is a set of {@link io.github.eutro.tacgraph.core.facts.Stmt statements}, each in one
 * {@link io.github.eutro.tacgraph.core.facts.Block block}, each block in one
 * {@link io.github.eutro.tacgraph.core.facts.Func function}. Statements read and write
 * {@link io.github.eutro.tacgraph.core.facts.Var variables} by operand position.
 * <p>
 * Private calls use two pseudo-instructions. {@code CALLPRIVATE} ends the calling block; its
 * operand 0 is the callee and the rest are arguments. {@code RETURNPRIVATE} ends a returning
 * block; its operand 0 is the return address and the rest are returned values. The lifter also
 * records a local edge from each call site straight to its continuation, which is not a real
 * control transfer.
 */
package io.github.eutro.tacgraph.core.facts;
