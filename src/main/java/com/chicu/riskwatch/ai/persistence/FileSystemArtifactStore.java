package com.chicu.riskwatch.ai.persistence;

import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.common.exception.ArtifactPersistenceException;
import com.chicu.riskwatch.common.exception.SchemaMismatchException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON bundle per artifact. Writes go to a sibling temp file first and are moved over the target.
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private final ObjectMapper mapper;

    public FileSystemArtifactStore() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Override
    public ModelArtifact load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ArtifactPersistenceException("artifact file not found: " + path);
        }
        try {
            ModelArtifact artifact = mapper.readValue(path.toFile(), ModelArtifact.class);
            log.info("📂 Artifact loaded: path={} version={} features={}",
                    path, artifact.getVersion(), artifact.getFeatureNames().size());
            return artifact;
        } catch (IOException e) {
            // Jackson wraps constructor failures
            if (e.getCause() instanceof SchemaMismatchException sm) {
                throw sm;
            }
            throw new ArtifactPersistenceException("cannot read artifact " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(ModelArtifact artifact, Path path) {
        if (artifact == null) throw new IllegalArgumentException("artifact=null");
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);

            mapper.writeValue(tmp.toFile(), artifact);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("atomic move not supported for {}, plain replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("💾 Artifact saved: path={} version={}", path, artifact.getVersion());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new ArtifactPersistenceException("cannot write artifact " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }
}
