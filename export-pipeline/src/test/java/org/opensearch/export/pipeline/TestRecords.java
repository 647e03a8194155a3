package org.opensearch.export.pipeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

import org.opensearch.export.pipeline.ir.OutcomeEvent;
import org.opensearch.export.source.InMemoryRecordSearchClient;

/** Fixture helpers shared by the pipeline tests. */
public final class TestRecords {
    private TestRecords() {}

    /** Adds {@code count} records updated during {@code month} (YYYY-MM) with the given state. */
    public static InMemoryRecordSearchClient addMonth(InMemoryRecordSearchClient client, String month, int count,
                                                      String state) {
        return addMonth(client, month, 0, count, state);
    }

    public static InMemoryRecordSearchClient addMonth(InMemoryRecordSearchClient client, String month, int from,
                                                      int count, String state) {
        for (int i = from; i < from + count; i++) {
            var updated = String.format("%s-%02dT%02d:%02d:00Z", month, 1 + i % 28, i % 24, i % 60);
            client.addRecord(String.format("10.5555/%s-%s-%05d", month, state, i), state, "client.test", updated);
        }
        return client;
    }

    public static List<String> readGzipLines(Path path) throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(
            new GZIPInputStream(Files.newInputStream(path)), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.toList());
        }
    }

    /** Ends the channel and returns everything published to it so far. */
    public static List<OutcomeEvent> drain(OutcomeChannel outcomes) throws InterruptedException {
        outcomes.signalShutdown();
        List<OutcomeEvent> events = new ArrayList<>();
        while (true) {
            var next = outcomes.take();
            if (next.isEmpty()) {
                return events;
            }
            events.add(next.get());
        }
    }
}
