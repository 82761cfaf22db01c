package com.chicu.riskwatch.ai.persistence;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@Data
@ConfigurationProperties(prefix = "riskwatch.storage")
public class MlStorageProperties {
    private String modelsDir = "./ml-models";

    /** Active artifact bundle. */
    private String activeFile = "student_dropout_model.json";

    /** Previous active artifact, written before every replacement. */
    private String backupFile = "student_dropout_model.json.backup";

    /** Artifact displaced by a backup restore. */
    private String rollbackFile = "student_dropout_model.json.rollback";

    public Path activePath() {
        return Path.of(modelsDir).resolve(activeFile);
    }

    public Path backupPath() {
        return Path.of(modelsDir).resolve(backupFile);
    }

    public Path rollbackPath() {
        return Path.of(modelsDir).resolve(rollbackFile);
    }
}
