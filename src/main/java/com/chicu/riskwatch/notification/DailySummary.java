package com.chicu.riskwatch.notification;

import com.chicu.riskwatch.common.enums.RiskBand;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record DailySummary(
        LocalDate date,
        int totalScored,
        int failed,
        Map<RiskBand, Integer> bandCounts,
        int alertsQueued,
        String lifecycle
) {
    public DailySummary {
        EnumMap<RiskBand, Integer> copy = new EnumMap<>(RiskBand.class);
        for (RiskBand b : RiskBand.values()) {
            copy.put(b, bandCounts != null ? bandCounts.getOrDefault(b, 0) : 0);
        }
        bandCounts = Collections.unmodifiableMap(copy);
    }

    public int count(RiskBand band) {
        return bandCounts.get(band);
    }

    public double percentage(RiskBand band) {
        return totalScored == 0 ? 0.0 : 100.0 * count(band) / totalScored;
    }
}
