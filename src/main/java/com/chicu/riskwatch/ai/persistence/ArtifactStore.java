package com.chicu.riskwatch.ai.persistence;

import com.chicu.riskwatch.ai.ml.model.ModelArtifact;

import java.nio.file.Path;

/**
 * Durable storage of artifact bundles (active, backup and rollback slots are just paths).
 */
public interface ArtifactStore {

    ModelArtifact load(Path path);

    /**
     * Replaces the file at {@code path} atomically: readers see either the old or the new bundle.
     */
    void save(ModelArtifact artifact, Path path);

    boolean exists(Path path);
}
