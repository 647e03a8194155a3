package org.opensearch.export;

import java.util.List;
import java.util.stream.Stream;

import org.opensearch.export.pipeline.output.ManifestWriter;
import org.opensearch.export.pipeline.output.ResultsReportWriter;
import org.opensearch.export.storage.PutResult;

/**
 * What one export produced. {@code removals} and {@code uploads} are empty when nothing was
 * uploaded; {@code removals} has one entry per object that was already under the target.
 */
public record ExportResult(
    List<ResultsReportWriter.Line> report,
    List<ManifestWriter.Entry> manifest,
    List<PutResult> removals,
    List<PutResult> uploads,
    int reconciliationRounds,
    int workerRestarts
) {
    /** Failed uploads plus objects that could not be removed from the target beforehand. */
    public long failedUploadCount() {
        return Stream.concat(removals.stream(), uploads.stream()).filter(r -> !r.success()).count();
    }

    public long exportedRecordCount() {
        return report.stream()
            .filter(line -> line.finalCount() != null)
            .mapToLong(ResultsReportWriter.Line::finalCount)
            .sum();
    }
}
