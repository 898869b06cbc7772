/**
 * The ext API associates derived data with an {@link io.github.eutro.tacgraph.core.ext.ExtContainer},
 * most importantly a {@link io.github.eutro.tacgraph.core.Program}.
 *
 * <pre>{@code
 * Program program = new Program(facts, config);
 * ComputeBlockBounds.INSTANCE.run(program);
 *
 * BlockBounds bounds = program.getExtOrThrow(ProgramExts.BLOCK_BOUNDS);
 * bounds.head(Block.of("0x0")); // => Optional[s1]
 * }</pre>
 * <p>
 * Each derivation pass attaches its result under one of the exts in
 * {@link io.github.eutro.tacgraph.core.ext.ProgramExts}, and records that
 * result as valid in the program's {@link io.github.eutro.tacgraph.core.ext.MetadataState}.
 * Passes that depend on other results ask the metadata state to compute them first.
 */
package io.github.eutro.tacgraph.core.ext;
