package com.chicu.riskwatch.notification;

import com.chicu.riskwatch.ai.ml.PredictionResult;
import com.chicu.riskwatch.ai.ml.features.StudentFeatureRecord;
import com.chicu.riskwatch.common.enums.RiskBand;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class AlertMessageFactory {

    public String highRisk(PredictionResult result, StudentFeatureRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔴 HIGH RISK STUDENT ALERT 🔴\n\n");

        sb.append("Student Information:\n");
        sb.append("- ID: ").append(orNa(result.recordId())).append('\n');
        if (record != null) {
            sb.append("- Name: ").append(orNa(record.get("name"))).append('\n');
            sb.append("- Age: ").append(orNa(record.get("age"))).append('\n');
            sb.append("- Gender: ").append(orNa(record.get("gender"))).append('\n');
        }

        sb.append("\nRisk Assessment:\n");
        sb.append("- Dropout Probability: ").append(percent(result.probability())).append('\n');
        sb.append("- Risk Level: ").append(result.riskBand()).append(" (").append(result.riskBand().colour()).append(")\n");
        sb.append("- Timestamp: ").append(result.timestamp()).append('\n');

        if (record != null) {
            sb.append("\nAcademic Performance:\n");
            sb.append("- Attendance Rate: ").append(percentOrNa(record.get("attendance_rate"))).append('\n');
            sb.append("- Average Test Score: ").append(decimalOrNa(record.get("avg_test_score"))).append('\n');
            sb.append("- Fee Default Rate: ").append(percentOrNa(record.get("fee_default_rate"))).append('\n');
        }

        sb.append("\nRecommended Actions:\n");
        sb.append("1. Contact student immediately\n");
        sb.append("2. Schedule counseling session\n");
        sb.append("3. Review academic support options\n");
        sb.append("4. Monitor attendance closely\n");
        sb.append("5. Consider financial assistance if needed\n");
        sb.append("\nPlease take immediate action to prevent potential dropout.");
        return sb.toString();
    }

    public String dailySummary(DailySummary s) {
        StringBuilder sb = new StringBuilder();
        sb.append("📊 DAILY DROPOUT PREDICTION SUMMARY\n\n");
        sb.append("Date: ").append(s.date()).append("\n\n");

        sb.append("Statistics:\n");
        sb.append("- Total Students Analyzed: ").append(s.totalScored()).append('\n');
        sb.append("- Records Failed: ").append(s.failed()).append('\n');
        sb.append("- High Risk Students: ").append(s.count(RiskBand.HIGH)).append('\n');
        sb.append("- New Alerts Generated: ").append(s.alertsQueued()).append('\n');

        sb.append("\nRisk Distribution:\n");
        for (RiskBand band : RiskBand.values()) {
            sb.append("- ").append(band.colour()).append(" (").append(band).append("): ")
                    .append(s.count(band))
                    .append(String.format(Locale.ROOT, " (%.1f%%)", s.percentage(band)))
                    .append('\n');
        }

        sb.append("\nModel: ").append(s.lifecycle());
        return sb.toString();
    }

    private static String orNa(Object v) {
        return v == null ? "N/A" : String.valueOf(v);
    }

    private static String percent(double v) {
        return String.format(Locale.ROOT, "%.2f%%", v * 100.0);
    }

    private static String percentOrNa(Object v) {
        return v instanceof Number n ? percent(n.doubleValue()) : "N/A";
    }

    private static String decimalOrNa(Object v) {
        return v instanceof Number n ? String.format(Locale.ROOT, "%.1f", n.doubleValue()) : "N/A";
    }
}
