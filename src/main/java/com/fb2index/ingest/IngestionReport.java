package com.fb2index.ingest;

import java.util.List;

public record IngestionReport(
        int documentsIndexed,
        int archivesRead,
        int entriesSkipped,
        int authorsCreated,
        int seriesCreated,
        long elapsedMs,
        List<IngestionFailure> failures) {

    public IngestionReport {
        failures = List.copyOf(failures);
    }

    public long failureCount(IngestionFailure.Kind kind) {
        return failures.stream().filter(failure -> failure.kind() == kind).count();
    }
}
