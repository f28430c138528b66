package com.textmetrics.analysis;

import java.time.Instant;

public record AnalysisReport(
    String source,
    Instant analyzedAt,
    long elapsedMs,
    MetricsRecord metrics
) {
}
