package com.chicu.riskwatch.notification;

import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.common.enums.AlertStatus;
import com.chicu.riskwatch.common.enums.RiskBand;
import com.chicu.riskwatch.storage.PredictionSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * High-risk alerts are queued by the daily job and delivered by the dispatch task.
 * Every delivery attempt is recorded with its status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    private final AlertGateway gateway;
    private final AlertMessageFactory messages;
    private final PredictionSink sink;
    private final NotificationProperties props;

    private final Queue<PendingAlert> pending = new ConcurrentLinkedQueue<>();

    private record PendingAlert(PredictionResult result, StudentFeatureRecord record) {}

    /**
     * @return how many HIGH results were queued
     */
    public int enqueueHighRisk(List<PredictionResult> results, Map<String, StudentFeatureRecord> recordsById) {
        int queued = 0;
        for (PredictionResult r : results) {
            if (r.riskBand() != RiskBand.HIGH) continue;
            pending.add(new PendingAlert(r, recordsById.get(r.recordId())));
            queued++;
        }
        if (queued > 0) {
            log.info("🔔 {} high-risk alerts queued", queued);
        }
        return queued;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Drains the queue. Failed deliveries are recorded and not retried.
     *
     * @return delivered count
     */
    public int dispatchPending() {
        int sent = 0;
        int failed = 0;
        PendingAlert a;
        while ((a = pending.poll()) != null) {
            String text = messages.highRisk(a.result(), a.record());
            if (deliver(a.result().recordId(), a.result().riskBand().name(), props.getAlertRecipient(),
                    props.getAlertSubject(), text)) {
                sent++;
            } else {
                failed++;
            }
        }
        if (sent + failed > 0) {
            log.info("🔔 Alerts dispatched: sent={} failed={}", sent, failed);
        }
        return sent;
    }

    public boolean sendDailySummary(DailySummary summary) {
        return deliver(null, null, props.getSummaryRecipient(), props.getSummarySubject(),
                messages.dailySummary(summary));
    }

    private boolean deliver(String studentId, String riskLevel, String recipient, String subject, String text) {
        boolean ok;
        try {
            ok = gateway.send(recipient, subject, text);
        } catch (RuntimeException e) {
            log.error("❌ Alert delivery error to={} student={}: {}", recipient, studentId, e.getMessage(), e);
            ok = false;
        }
        try {
            sink.saveAlert(studentId, riskLevel, recipient, subject, text, ok ? AlertStatus.SENT : AlertStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("❌ Alert record not saved student={}: {}", studentId, e.getMessage(), e);
        }
        return ok;
    }
}
