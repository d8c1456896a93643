package com.webtext.core.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webtext.core.model.BatchSummary;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.ItemResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 배치 요약을 JSON 파일로 남긴다(선택 기능). */
public final class RunReportWriter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public Path write(BatchSummary summary, Path reportFile) throws IOException {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(reportFile, "reportFile");
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), toReport(summary));
        return reportFile;
    }

    static Report toReport(BatchSummary s) {
        List<Entry> entries = s.items().stream().map(RunReportWriter::toEntry).toList();
        return new Report(
                String.valueOf(s.inputFile()),
                String.valueOf(s.outputDir()),
                s.startedAt(),
                s.finishedAt(),
                s.linesRead(),
                s.attempted(),
                s.succeeded(),
                s.failed(),
                s.skipped(),
                entries);
    }

    private static Entry toEntry(ItemResult r) {
        return new Entry(
                r.index(),
                r.url(),
                r.outputFile() == null ? null : String.valueOf(r.outputFile().getFileName()),
                r.isSuccess() ? "OK" : "FAILED",
                r.failure(),
                r.reason(),
                r.httpStatus(),
                r.retries(),
                r.text().length());
    }

    // ----- JSON 스키마 -----
    public record Report(String inputFile,
                         String outputDir,
                         Instant startedAt,
                         Instant finishedAt,
                         int linesRead,
                         int attempted,
                         long succeeded,
                         long failed,
                         int skipped,
                         List<Entry> items) { }

    public record Entry(int index,
                        String url,
                        String file,
                        String status,
                        FailureKind failure,
                        String reason,
                        int httpStatus,
                        int retries,
                        int chars) { }
}
