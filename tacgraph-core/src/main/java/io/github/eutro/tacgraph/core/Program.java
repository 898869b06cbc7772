package io.github.eutro.tacgraph.core;

import io.github.eutro.tacgraph.core.conf.AnalysisConfig;
import io.github.eutro.tacgraph.core.ext.Ext;
import io.github.eutro.tacgraph.core.ext.ExtHolder;
import io.github.eutro.tacgraph.core.ext.MetadataState;
import io.github.eutro.tacgraph.core.ext.ProgramExts;
import io.github.eutro.tacgraph.core.facts.FactStore;
import io.github.eutro.tacgraph.core.report.Violations;
import org.jetbrains.annotations.Nullable;

/**
 * One analysis run over the facts of one contract.
 * <p>
 * The facts are read-only; derived results are attached to this as exts
 * (see {@link ProgramExts}) by the passes in {@link io.github.eutro.tacgraph.core.passes.meta}.
 * A program is confined to the thread analysing it.
 */
public final class Program extends ExtHolder {
    /**
     * The input facts.
     */
    public final FactStore facts;
    /**
     * The settings of this run.
     */
    public final AnalysisConfig config;
    /**
     * The inconsistencies found so far.
     */
    public final Violations violations = new Violations();

    public Program(FactStore facts, AnalysisConfig config) {
        this.facts = facts;
        this.config = config;
    }

    public Program(FactStore facts) {
        this(facts, AnalysisConfig.DEFAULT);
    }

    /**
     * Get the metadata state of this program.
     *
     * @return The metadata state.
     */
    public MetadataState metadata() {
        return getExtOrThrow(ProgramExts.METADATA_STATE);
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == ProgramExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == ProgramExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
