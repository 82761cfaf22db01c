package com.chicu.riskwatch.web.controller.api;

import com.chicu.riskwatch.ai.ml.MlPredictionService;
import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.ScoringOutcome;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.web.dto.PredictRequestDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.http.HttpStatus;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/predictions")
public class PredictionController {

    private final MlPredictionService predictor;

    @PostMapping
    public PredictionResult predict(@RequestBody PredictRequestDto request) {
        if (request == null || request.features() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "features are required");
        }
        return predictor.score(request.toRecord());
    }

    @PostMapping("/batch")
    public List<ScoringOutcome> predictBatch(@RequestBody List<PredictRequestDto> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "batch is empty");
        }
        List<StudentFeatureRecord> records = new ArrayList<>(requests.size());
        for (PredictRequestDto r : requests) {
            records.add(r.toRecord());
        }
        return predictor.scoreBatch(records);
    }
}
