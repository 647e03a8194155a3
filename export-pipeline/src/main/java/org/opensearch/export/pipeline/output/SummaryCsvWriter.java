package org.opensearch.export.pipeline.output;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.Getter;

/**
 * Gzip-compressed CSV of {@link SummaryRow}s with a {@code doi,state,client_id,updated} header.
 * One file per month, kept open across sequence file rotations.
 */
public class SummaryCsvWriter implements Closeable {
    private static final CsvMapper csvMapper = new CsvMapper();
    private static final CsvSchema SCHEMA = csvMapper.schemaFor(SummaryRow.class).withoutHeader();

    @Getter
    private final Path path;
    private final Writer out;
    private final SequenceWriter rows;
    @Getter
    private long rowCount;

    public SummaryCsvWriter(Path path) throws IOException {
        this.path = path;
        this.out = RotatingSequenceWriter.gzipWriter(path);
        try {
            // Written here so that a month without records still gets its header
            out.write(headerLine());
            this.rows = csvMapper.writer(SCHEMA).writeValues(out);
        } catch (IOException e) {
            out.close();
            throw e;
        }
    }

    public static String fileName(String bucketKey) {
        return bucketKey + ".csv.gz";
    }

    static String headerLine() {
        var header = new StringBuilder();
        for (CsvSchema.Column column : SCHEMA) {
            if (header.length() > 0) {
                header.append(SCHEMA.getColumnSeparator());
            }
            header.append(column.getName());
        }
        return header.append(SCHEMA.getLineSeparator()).toString();
    }

    public void write(SummaryRow row) throws IOException {
        rows.write(row);
        rowCount++;
    }

    @Override
    public void close() throws IOException {
        try {
            rows.close();
        } finally {
            out.close();
        }
    }
}
