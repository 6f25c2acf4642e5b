package com.newsverdict.service.stats;

import com.newsverdict.core.bus.EventBus;
import com.newsverdict.core.events.AggregationCompleted;
import com.newsverdict.core.events.AlertRaised;
import com.newsverdict.core.events.VerdictIssued;
import com.newsverdict.core.model.Label;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class PipelineStats {
    private final LongAdder realVerdicts = new LongAdder();
    private final LongAdder fakeVerdicts = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> verdictsByLanguage = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LongAdder> verdictsByRegime = new ConcurrentHashMap<>();
    private final LongAdder aggregations = new LongAdder();
    private final LongAdder failedAggregations = new LongAdder();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();

    public PipelineStats(EventBus eventBus) {
        eventBus.subscribe(VerdictIssued.class, this::onVerdictIssued);
        eventBus.subscribe(AggregationCompleted.class, this::onAggregationCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalVerdicts", realVerdicts.longValue() + fakeVerdicts.longValue());
        stats.put("realVerdicts", realVerdicts.longValue());
        stats.put("fakeVerdicts", fakeVerdicts.longValue());
        stats.put("verdictsByLanguage", counts(verdictsByLanguage));
        stats.put("verdictsByRegime", counts(verdictsByRegime));
        stats.put("aggregations", aggregations.longValue());
        stats.put("failedAggregations", failedAggregations.longValue());
        stats.put("sources", sourcesSnapshot());
        return stats;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new TreeMap<>();
        for (Map.Entry<String, SourceStatus> entry : sourceStatuses.entrySet()) {
            sources.put(entry.getKey(), entry.getValue().toMap());
        }
        return sources;
    }

    private void onVerdictIssued(VerdictIssued event) {
        if (event.label() == Label.FAKE) {
            fakeVerdicts.increment();
        } else {
            realVerdicts.increment();
        }
        verdictsByLanguage.computeIfAbsent(event.detectedLanguage().code(), ignored -> new LongAdder()).increment();
        verdictsByRegime.computeIfAbsent(event.regime().name(), ignored -> new LongAdder()).increment();
    }

    private void onAggregationCompleted(AggregationCompleted event) {
        aggregations.increment();
        if (!event.success()) {
            failedAggregations.increment();
        }
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"source".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object source = event.details().get("source");
        if (!(source instanceof String sourceName) || sourceName.isBlank()) {
            return;
        }
        Object kind = event.details().get("kind");
        sourceStatuses.compute(sourceName, (name, current) -> {
            long failures = current == null ? 0 : current.failures();
            return new SourceStatus(failures + 1, kind == null ? null : kind.toString(), event.message(), event.timestamp());
        });
    }

    private static Map<String, Long> counts(Map<String, LongAdder> adders) {
        Map<String, Long> counts = new TreeMap<>();
        adders.forEach((key, adder) -> counts.put(key, adder.longValue()));
        return counts;
    }

    private record SourceStatus(long failures, String lastErrorKind, String lastErrorMessage, Instant lastErrorAt) {
        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("failures", failures);
            map.put("lastErrorKind", lastErrorKind);
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("lastErrorAt", lastErrorAt == null ? null : lastErrorAt.toString());
            return map;
        }
    }
}
