package com.chicu.riskwatch.monitor;

import com.chicu.riskwatch.ai.lifecycle.LifecycleReport;
import com.chicu.riskwatch.ai.lifecycle.ModelLifecycleManager;
import com.chicu.riskwatch.ai.ml.ArtifactSlot;
import com.chicu.riskwatch.ai.ml.MlLifecycleProperties;
import com.chicu.riskwatch.ai.ml.MlModelProperties;
import com.chicu.riskwatch.ai.ml.MlPredictionService;
import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.ScoringOutcome;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.ai.monitoring.PerformanceSnapshot;
import com.chicu.riskwatch.ai.monitoring.PerformanceTracker;
import com.chicu.riskwatch.common.enums.LifecycleBranch;
import com.chicu.riskwatch.common.enums.RiskBand;
import com.chicu.riskwatch.common.exception.InvalidInputException;
import com.chicu.riskwatch.common.exception.PromotionConflictException;
import com.chicu.riskwatch.engine.MonitorProperties;
import com.chicu.riskwatch.notification.AlertService;
import com.chicu.riskwatch.notification.DailySummary;
import com.chicu.riskwatch.storage.DataQualityReport;
import com.chicu.riskwatch.storage.PredictionSink;
import com.chicu.riskwatch.storage.StudentRecordSource;
import com.chicu.riskwatch.support.StudentFixtures;
import com.chicu.riskwatch.support.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DropoutMonitorServiceTest {

    @Mock private StudentRecordSource source;
    @Mock private PredictionSink sink;
    @Mock private MlPredictionService predictor;
    @Mock private PerformanceTracker tracker;
    @Mock private ModelLifecycleManager lifecycle;
    @Mock private AlertService alerts;

    private ArtifactSlot slot;
    private MlModelProperties modelProps;
    private DropoutMonitorService service;

    @BeforeEach
    void setUp() {
        slot = new ArtifactSlot();
        modelProps = new MlModelProperties();
        service = new DropoutMonitorService(source, sink, predictor, tracker, lifecycle, alerts, slot,
                modelProps, new MlLifecycleProperties(), new MonitorProperties(), TestModels.fixedClock());
    }

    private static PredictionResult result(String id, RiskBand band) {
        return new PredictionResult(id, 0, 0.5, band, TestModels.NOW, "signal-v1");
    }

    private static PerformanceSnapshot snapshot() {
        return new PerformanceSnapshot(TestModels.NOW, 0.9, 0.9, 20);
    }

    private DailySummary capturedSummary() {
        ArgumentCaptor<DailySummary> captor = ArgumentCaptor.forClass(DailySummary.class);
        verify(alerts).sendDailySummary(captor.capture());
        return captor.getValue();
    }

    // =====================================================================
    // DAILY
    // =====================================================================

    @Test
    void withoutActiveModelOnlyTheSummaryIsSent() {
        DailyRunSummary run = service.runDailyJob();

        assertEquals(LifecycleBranch.RETRAIN_FAILED, run.lifecycle().branch());
        assertEquals("retrain failed: no active model loaded", capturedSummary().lifecycle());
        verifyNoInteractions(source, predictor, tracker, lifecycle, sink);
    }

    @Test
    void scoresPersistsAndQueuesThenSkipsWithoutLabels() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> fresh = StudentFixtures.records(3, 1);
        when(source.fetchUpdatedSince(TestModels.NOW.minus(Duration.ofDays(1)))).thenReturn(fresh);
        when(predictor.scoreBatch(fresh)).thenReturn(List.of(
                ScoringOutcome.success(result(fresh.get(0).studentId(), RiskBand.HIGH)),
                ScoringOutcome.failure(fresh.get(1).studentId(), "ERR-SCHEMA", "bad"),
                ScoringOutcome.success(result(fresh.get(2).studentId(), RiskBand.LOW))));
        when(alerts.enqueueHighRisk(anyList(), anyMap())).thenReturn(1);
        when(source.fetchLabeled("is_active")).thenReturn(List.of());

        DailyRunSummary run = service.runDailyJob();

        assertEquals(2, run.scored());
        assertEquals(1, run.failed());
        assertEquals(1, run.alertsQueued());
        assertNull(run.snapshot());
        assertEquals(LifecycleBranch.RETRAIN_SKIPPED, run.lifecycle().branch());

        verify(sink).savePredictions(argThat(l -> l.size() == 2));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, StudentFeatureRecord>> byId = ArgumentCaptor.forClass(Map.class);
        verify(alerts).enqueueHighRisk(anyList(), byId.capture());
        assertEquals(3, byId.getValue().size());

        DailySummary s = capturedSummary();
        assertEquals(2, s.totalScored());
        assertEquals(1, s.failed());
        assertEquals(1, s.count(RiskBand.HIGH));
        assertEquals(1, s.count(RiskBand.LOW));
        assertEquals("retrain skipped", s.lifecycle());
        verifyNoInteractions(tracker, lifecycle);
    }

    @Test
    void noDriftSkipsLifecycle() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(20, 20);
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenReturn(snapshot());
        when(tracker.isDrifting()).thenReturn(false);

        DailyRunSummary run = service.runDailyJob();

        assertEquals(LifecycleBranch.RETRAIN_SKIPPED, run.lifecycle().branch());
        assertEquals("no drift", run.lifecycle().reason());
        assertNotNull(run.snapshot());
        verify(sink, never()).savePredictions(any());
        verifyNoInteractions(lifecycle);
    }

    @Test
    void driftRunsLifecycleOnStratifiedSplit() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(20, 20);
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenReturn(snapshot());
        when(tracker.isDrifting()).thenReturn(true);
        LifecycleReport promoted = LifecycleReport.builder()
                .branch(LifecycleBranch.CANDIDATE_PROMOTED).reason("ok").candidateVersion("retrain-x").build();
        when(lifecycle.runLifecycle(anyList(), anyList(), eq("is_active"))).thenReturn(promoted);

        DailyRunSummary run = service.runDailyJob();

        assertSame(promoted, run.lifecycle());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StudentFeatureRecord>> train = ArgumentCaptor.forClass(List.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StudentFeatureRecord>> test = ArgumentCaptor.forClass(List.class);
        verify(lifecycle).runLifecycle(train.capture(), test.capture(), eq("is_active"));
        assertEquals(16, train.getValue().size());
        assertEquals(4, test.getValue().size());
        assertEquals(2, test.getValue().stream().filter(r -> r.label("is_active").getAsInt() == 1).count());
        assertEquals("candidate promoted", capturedSummary().lifecycle());
    }

    @Test
    void unusableEvaluationBatchIsSkipped() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(4, 4);
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenThrow(new InvalidInputException("no record could be scored"));

        DailyRunSummary run = service.runDailyJob();

        assertEquals(LifecycleBranch.RETRAIN_SKIPPED, run.lifecycle().branch());
        assertTrue(run.lifecycle().reason().startsWith("evaluation skipped"));
        verify(alerts).sendDailySummary(any());
    }

    @Test
    void busyLifecycleIsReportedAsFailure() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(20, 20);
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenReturn(snapshot());
        when(tracker.isDrifting()).thenReturn(true);
        when(lifecycle.runLifecycle(anyList(), anyList(), anyString()))
                .thenThrow(new PromotionConflictException("another model transition is in progress"));

        DailyRunSummary run = service.runDailyJob();

        assertEquals(LifecycleBranch.RETRAIN_FAILED, run.lifecycle().branch());
        assertTrue(capturedSummary().lifecycle().startsWith("retrain failed: "));
    }

    @Test
    void labeledFetchFailureStillSendsSummary() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenThrow(new IllegalStateException("db down"));

        DailyRunSummary run = assertDoesNotThrow(() -> service.runDailyJob());

        assertEquals(LifecycleBranch.RETRAIN_FAILED, run.lifecycle().branch());
        assertNull(run.snapshot());
        assertEquals("retrain failed: labeled records unavailable: db down", capturedSummary().lifecycle());
        verifyNoInteractions(tracker, lifecycle);
    }

    @Test
    void failedSaveDoesNotSkipEvaluation() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> fresh = StudentFixtures.records(1, 1);
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(20, 20);
        when(source.fetchUpdatedSince(any())).thenReturn(fresh);
        when(predictor.scoreBatch(fresh)).thenReturn(List.of(
                ScoringOutcome.success(result(fresh.get(0).studentId(), RiskBand.MEDIUM))));
        doThrow(new IllegalStateException("disk full")).when(sink).savePredictions(anyList());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenReturn(snapshot());
        when(tracker.isDrifting()).thenReturn(false);

        DailyRunSummary run = service.runDailyJob();

        assertEquals(1, run.scored());
        assertNotNull(run.snapshot());
        assertEquals("no drift", run.lifecycle().reason());
        verify(tracker).evaluate(labeled, "is_active");
        assertEquals(1, capturedSummary().count(RiskBand.MEDIUM));
    }

    @Test
    void updatedRecordsFetchFailureStillEvaluates() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        when(source.fetchUpdatedSince(any())).thenThrow(new IllegalStateException("db down"));
        when(source.fetchLabeled("is_active")).thenReturn(List.of());

        DailyRunSummary run = service.runDailyJob();

        assertEquals(0, run.scored());
        assertEquals("no labeled records", run.lifecycle().reason());
        assertEquals(0, capturedSummary().totalScored());
        verifyNoInteractions(predictor, sink);
    }

    @Test
    void unexpectedEvaluationErrorIsReportedAsFailure() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        List<StudentFeatureRecord> labeled = TestModels.signalBatch(20, 20);
        when(source.fetchUpdatedSince(any())).thenReturn(List.of());
        when(source.fetchLabeled("is_active")).thenReturn(labeled);
        when(tracker.evaluate(labeled, "is_active")).thenThrow(new IllegalStateException("boom"));

        DailyRunSummary run = service.runDailyJob();

        assertEquals(LifecycleBranch.RETRAIN_FAILED, run.lifecycle().branch());
        assertEquals("retrain failed: evaluation error: boom", capturedSummary().lifecycle());
    }

    // =====================================================================
    // HOURLY / ALERTS
    // =====================================================================

    @Test
    void dataQualityUsesActiveArtifactFeatures() {
        slot.swap(TestModels.signalArtifact("signal-v1"));
        DataQualityReport report = new DataQualityReport(10, 1, Map.of("signal", 2L));
        when(source.dataQuality(List.of("signal"))).thenReturn(report);

        assertSame(report, service.checkDataQuality());
    }

    @Test
    void dataQualityFallsBackToConfiguredFeatures() {
        DataQualityReport clean = new DataQualityReport(0, 0, Map.of());
        when(source.dataQuality(modelProps.getFeatureNames())).thenReturn(clean);

        assertTrue(service.checkDataQuality().isClean());
    }

    @Test
    void dispatchDelegatesToAlertService() {
        when(alerts.dispatchPending()).thenReturn(3);
        assertEquals(3, service.dispatchAlerts());
    }
}
