package org.opensearch.export.pipeline.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes the reconciliation table as {@code key,expected,final,diff,pct} lines, one per bucket.
 * Values a bucket never received are left empty.
 */
public class ResultsReportWriter {

    public record Line(String key, Long expected, Long finalCount, Long diff, Double pct) {
        String format() {
            return String.join(",", key, text(expected), text(finalCount), text(diff),
                pct == null ? "" : String.format(Locale.ROOT, "%.2f", pct));
        }

        private static String text(Long value) {
            return value == null ? "" : value.toString();
        }
    }

    private final Path path;

    public ResultsReportWriter(Path path) {
        this.path = path;
    }

    public void write(List<Line> lines) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, lines.stream().map(Line::format).collect(Collectors.toList()), StandardCharsets.UTF_8);
    }
}
