package com.chicu.riskwatch.web.controller.api;

import com.chicu.riskwatch.ai.lifecycle.ModelLifecycleManager;
import com.chicu.riskwatch.ai.ml.ArtifactSlot;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.monitoring.PerformanceTracker;
import com.chicu.riskwatch.web.dto.ModelInfoDto;
import com.chicu.riskwatch.web.dto.PerformanceDto;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the active model and its measured performance.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/model")
public class ModelController {

    private final ArtifactSlot slot;
    private final PerformanceTracker tracker;
    private final ModelLifecycleManager lifecycle;

    @GetMapping
    public ModelInfoDto model() {
        ModelArtifact a = slot.require();
        return new ModelInfoDto(
                a.getVersion(),
                a.getModel().getClass().getSimpleName(),
                a.getFeatureNames(),
                List.copyOf(a.getEncoders().keySet()),
                a.getCreatedAt(),
                a.getRetrainedAt(),
                lifecycle.state()
        );
    }

    @GetMapping("/performance")
    public PerformanceDto performance() {
        return new PerformanceDto(tracker.history(), tracker.isDrifting());
    }
}
