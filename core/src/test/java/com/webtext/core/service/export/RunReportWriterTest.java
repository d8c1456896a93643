package com.webtext.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webtext.core.model.BatchSummary;
import com.webtext.core.model.FailureKind;
import com.webtext.core.model.ItemResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportWriterTest {

    @Test
    void report_has_counts_and_one_entry_per_attempted_url(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out");
        ItemResult ok = ItemResult.success(0, "https://example.com/a", "Title\nBody", 200, 1)
                .withOutputFile(out.resolve("0-example.com-aaaaaaaa.txt"));
        ItemResult failed = ItemResult.failure(2, "https://example.com/b", FailureKind.HTTP_STATUS, "HTTP 404", 404, 0)
                .withOutputFile(out.resolve("2-example.com-bbbbbbbb.txt"));
        BatchSummary summary = new BatchSummary(tmp.resolve("urls.txt"), out,
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:00:03Z"), 3, List.of(ok, failed));

        Path report = new RunReportWriter().write(summary, tmp.resolve("reports/run.json"));

        JsonNode root = new ObjectMapper().readTree(Files.readString(report));
        assertThat(root.get("linesRead").asInt()).isEqualTo(3);
        assertThat(root.get("attempted").asInt()).isEqualTo(2);
        assertThat(root.get("succeeded").asInt()).isEqualTo(1);
        assertThat(root.get("failed").asInt()).isEqualTo(1);
        assertThat(root.get("skipped").asInt()).isEqualTo(1);
        assertThat(root.get("startedAt").asText()).isEqualTo("2024-05-01T10:00:00Z");

        JsonNode first = root.get("items").get(0);
        assertThat(first.get("status").asText()).isEqualTo("OK");
        assertThat(first.get("file").asText()).isEqualTo("0-example.com-aaaaaaaa.txt");
        assertThat(first.get("chars").asInt()).isEqualTo(10);
        assertThat(first.get("retries").asInt()).isEqualTo(1);
        assertThat(first.has("failure")).isFalse();

        JsonNode second = root.get("items").get(1);
        assertThat(second.get("status").asText()).isEqualTo("FAILED");
        assertThat(second.get("failure").asText()).isEqualTo("HTTP_STATUS");
        assertThat(second.get("reason").asText()).isEqualTo("HTTP 404");
        assertThat(second.get("httpStatus").asInt()).isEqualTo(404);
    }
}
