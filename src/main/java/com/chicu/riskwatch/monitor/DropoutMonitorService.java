package com.chicu.riskwatch.monitor;

import com.chicu.riskwatch.ai.lifecycle.LifecycleReport;
import com.chicu.riskwatch.ai.lifecycle.ModelLifecycleManager;
import com.chicu.riskwatch.ai.ml.ArtifactSlot;
import com.chicu.riskwatch.ai.ml.MlLifecycleProperties;
import com.chicu.riskwatch.ai.ml.MlModelProperties;
import com.chicu.riskwatch.ai.ml.MlPredictionService;
import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.ScoringOutcome;
import com.chicu.riskwatch.ai.ml.dataset.StratifiedSplitter;
import com.chicu.riskwatch.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.ml.model.ModelArtifact;
import com.chicu.riskwatch.ai.monitoring.PerformanceSnapshot;
import com.chicu.riskwatch.ai.monitoring.PerformanceTracker;
import com.chicu.riskwatch.common.enums.RiskBand;
import com.chicu.riskwatch.common.exception.InvalidInputException;
import com.chicu.riskwatch.common.exception.PromotionConflictException;
import com.chicu.riskwatch.engine.MonitorProperties;
import com.chicu.riskwatch.notification.AlertService;
import com.chicu.riskwatch.notification.DailySummary;
import com.chicu.riskwatch.storage.DataQualityReport;
import com.chicu.riskwatch.storage.PredictionSink;
import com.chicu.riskwatch.storage.StudentRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The three recurring jobs of the monitor loop.
 * <p>
 * Daily: score updated records → save → queue HIGH alerts → evaluate on labeled records →
 * if drifting, run the model lifecycle → summary alert (always).
 * A failing storage or scoring step is logged and reported; it never cancels the summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DropoutMonitorService {

    private final StudentRecordSource source;
    private final PredictionSink sink;
    private final MlPredictionService predictor;
    private final PerformanceTracker tracker;
    private final ModelLifecycleManager lifecycle;
    private final AlertService alerts;
    private final ArtifactSlot slot;
    private final MlModelProperties modelProps;
    private final MlLifecycleProperties lifecycleProps;
    private final MonitorProperties monitorProps;
    private final Clock clock;

    // =====================================================================
    // DAILY
    // =====================================================================

    public DailyRunSummary runDailyJob() {
        Instant now = clock.instant();
        log.info("🌙 DAILY JOB START at={}", now);

        if (!slot.isLoaded()) {
            LifecycleReport report = LifecycleReport.failed("no active model loaded");
            log.warn("🌙 DAILY JOB: no active model, scoring skipped");
            alerts.sendDailySummary(summary(now, 0, 0, new EnumMap<>(RiskBand.class), 0, report));
            return new DailyRunSummary(0, 0, 0, null, report);
        }

        // ---- 1. score ----
        Instant since = now.minus(monitorProps.getLookback());
        List<StudentFeatureRecord> fresh = List.of();
        List<PredictionResult> results = new ArrayList<>();
        int failed = 0;
        try {
            fresh = source.fetchUpdatedSince(since);
            if (!fresh.isEmpty()) {
                for (ScoringOutcome o : predictor.scoreBatch(fresh)) {
                    if (o.isSuccess()) results.add(o.result());
                    else failed++;
                }
            } else {
                log.info("🌙 No updated records since {}", since);
            }
        } catch (RuntimeException e) {
            log.error("❌ Scoring step failed: {}", e.toString(), e);
        }

        // ---- 2. persist + queue alerts ----
        if (!results.isEmpty()) {
            try {
                sink.savePredictions(results);
            } catch (RuntimeException e) {
                log.error("❌ Saving {} predictions failed: {}", results.size(), e.toString(), e);
            }
        }
        Map<String, StudentFeatureRecord> byId = new HashMap<>();
        for (StudentFeatureRecord r : fresh) {
            if (r != null && r.studentId() != null) byId.put(r.studentId(), r);
        }
        int queued = 0;
        try {
            queued = alerts.enqueueHighRisk(results, byId);
        } catch (RuntimeException e) {
            log.error("❌ Queueing HIGH risk alerts failed: {}", e.toString(), e);
        }

        Map<RiskBand, Integer> bands = new EnumMap<>(RiskBand.class);
        for (PredictionResult r : results) bands.merge(r.riskBand(), 1, Integer::sum);

        // ---- 3. evaluate + lifecycle ----
        PerformanceSnapshot snapshot = null;
        LifecycleReport report;
        String target = modelProps.getTargetColumn();
        List<StudentFeatureRecord> labeled = null;
        String fetchError = null;
        try {
            labeled = source.fetchLabeled(target);
        } catch (RuntimeException e) {
            log.error("❌ Fetching labeled records failed: {}", e.toString(), e);
            fetchError = e.getMessage();
        }

        if (labeled == null) {
            report = LifecycleReport.failed("labeled records unavailable: " + fetchError);
        } else if (labeled.isEmpty()) {
            report = LifecycleReport.skipped("no labeled records");
        } else {
            try {
                snapshot = tracker.evaluate(labeled, target);
                report = tracker.isDrifting()
                        ? runLifecycle(labeled, target)
                        : LifecycleReport.skipped("no drift");
            } catch (InvalidInputException e) {
                log.warn("📉 Evaluation skipped: {}", e.getMessage());
                report = LifecycleReport.skipped("evaluation skipped: " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("❌ Evaluation step failed: {}", e.toString(), e);
                report = LifecycleReport.failed("evaluation error: " + e.getMessage());
            }
        }

        // ---- 4. summary ----
        alerts.sendDailySummary(summary(now, results.size(), failed, bands, queued, report));

        log.info("🌙 DAILY JOB DONE scored={} failed={} alerts={} model={}",
                results.size(), failed, queued, report.summaryLine());
        return new DailyRunSummary(results.size(), failed, queued, snapshot, report);
    }

    private LifecycleReport runLifecycle(List<StudentFeatureRecord> labeled, String target) {
        int[] y = TrainingDatasetBuilder.labels(labeled, target);
        StratifiedSplitter.Split split;
        try {
            split = StratifiedSplitter.split(y, lifecycleProps.getArbitrationFraction(), lifecycleProps.getSeed());
        } catch (IllegalArgumentException e) {
            return LifecycleReport.failed(e.getMessage());
        }

        List<StudentFeatureRecord> train = pick(labeled, split.train());
        List<StudentFeatureRecord> test = pick(labeled, split.test());

        try {
            return lifecycle.runLifecycle(train, test, target);
        } catch (PromotionConflictException e) {
            log.warn("🧠 lifecycle busy: {}", e.getMessage());
            return LifecycleReport.failed(e.getMessage());
        }
    }

    private static List<StudentFeatureRecord> pick(List<StudentFeatureRecord> all, int[] idx) {
        List<StudentFeatureRecord> out = new ArrayList<>(idx.length);
        for (int i : idx) out.add(all.get(i));
        return out;
    }

    private DailySummary summary(Instant now, int scored, int failed, Map<RiskBand, Integer> bands,
                                 int queued, LifecycleReport report) {
        LocalDate date = now.atZone(ZoneId.of(monitorProps.getZone())).toLocalDate();
        return new DailySummary(date, scored, failed, bands, queued, report.summaryLine());
    }

    // =====================================================================
    // HOURLY
    // =====================================================================

    public DataQualityReport checkDataQuality() {
        List<String> features = slot.current()
                .map(ModelArtifact::getFeatureNames)
                .orElse(modelProps.getFeatureNames());

        DataQualityReport report = source.dataQuality(features);
        if (report.missingStudentIds() > 0) {
            log.warn("⚠️ Found {} records with missing student IDs", report.missingStudentIds());
        }
        if (!report.missingByFeature().isEmpty()) {
            log.warn("⚠️ Missing feature values: {}", report.missingByFeature());
        }
        log.info("🔎 Data quality check completed. Total records: {}", report.totalRecords());
        return report;
    }

    // =====================================================================
    // ALERTS
    // =====================================================================

    public int dispatchAlerts() {
        return alerts.dispatchPending();
    }
}
