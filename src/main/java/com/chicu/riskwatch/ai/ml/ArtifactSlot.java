package com.chicu.riskwatch.ai.ml;

import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.common.exception.ArtifactNotLoadedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the one active artifact. Readers take a snapshot reference;
 * only the lifecycle manager swaps it, already serialized by its transition lock.
 */
@Slf4j
@Component
public class ArtifactSlot {

    private final AtomicReference<ModelArtifact> active = new AtomicReference<>();

    public Optional<ModelArtifact> current() {
        return Optional.ofNullable(active.get());
    }

    public ModelArtifact require() {
        ModelArtifact a = active.get();
        if (a == null) {
            throw new ArtifactNotLoadedException("no active model artifact loaded");
        }
        return a;
    }

    public boolean isLoaded() {
        return active.get() != null;
    }

    /**
     * @return the artifact that was active before (may be null)
     */
    public ModelArtifact swap(ModelArtifact next) {
        if (next == null) throw new IllegalArgumentException("next=null");
        ModelArtifact prev = active.getAndSet(next);
        log.info("🔁 Active artifact: {} -> {}", prev != null ? prev.getVersion() : "none", next.getVersion());
        return prev;
    }
}
