package com.webtext.core.service;

import com.webtext.core.api.IContentExtractor;
import com.webtext.core.api.IPageFetcher;
import com.webtext.core.extract.ReadabilityExtractor;
import com.webtext.core.http.DefaultRetryPolicy;
import com.webtext.core.http.PageFetcher;
import com.webtext.core.http.RetryPolicy;
import com.webtext.core.model.BatchSummary;
import com.webtext.core.model.ExtractConfig;
import com.webtext.core.model.ItemResult;
import com.webtext.core.model.UrlItem;
import com.webtext.core.service.export.OutputNamer;
import com.webtext.core.util.DefaultSleeper;
import com.webtext.core.util.ProgressListener;
import com.webtext.core.util.StructuredLog;
import com.webtext.core.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 배치 오케스트레이터:
 *  - 입력 파일을 줄 단위로 읽어 줄 위치를 index로 부여(건너뛴 줄도 index를 소비)
 *  - 유효 URL만 fetch → extract → 이름 생성 → outputDir/이름 에 덮어쓰기
 *  - 항목 실패는 ItemResult로 받아 기록만 하고 다음 줄로 진행
 * 순차 실행. HttpClient(연결 풀)는 실행 동안 하나를 재사용한다.
 */
public final class BatchExtractionService {

    private static final Logger LOG = LoggerFactory.getLogger(BatchExtractionService.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchExtractionService.class);

    private final Path outputDir;
    private final PageTextExtractor pipeline;

    /** 기본 구현(java.net.http + ReadabilityExtractor) */
    public BatchExtractionService(ExtractConfig config, Path outputDir) {
        this(config, outputDir, new PageFetcher(config), new ReadabilityExtractor());
    }

    /** DI/테스트용 */
    public BatchExtractionService(ExtractConfig config, Path outputDir,
                                  IPageFetcher fetcher, IContentExtractor extractor) {
        this(outputDir, new PageTextExtractor(fetcher, extractor, retryPolicyOf(config), DefaultSleeper.INSTANCE));
    }

    public BatchExtractionService(Path outputDir, PageTextExtractor pipeline) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    public Path getOutputDir() { return outputDir; }

    public BatchSummary run(Path urlListFile) throws IOException {
        return run(urlListFile, ProgressListener.NONE);
    }

    /** 입력 파일을 읽지 못하면 IOException(치명). 항목 단위 오류는 결과에만 남는다. */
    public BatchSummary run(Path urlListFile, ProgressListener listener) throws IOException {
        Objects.requireNonNull(urlListFile, "urlListFile");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        List<String> lines = Files.readAllLines(urlListFile, StandardCharsets.UTF_8);
        Instant started = Instant.now();
        LOG.info("Batch start: input={}, lines={}, outputDir={}", urlListFile, lines.size(), outputDir);
        SLOG.info("batch-start", "input", urlListFile, "lines", lines.size(), "outputDir", outputDir);

        List<ItemResult> results = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            String raw = lines.get(index).trim();
            if (!UrlValidator.isValid(raw)) {
                if (!raw.isEmpty()) LOG.debug("Skipping line {}: not a URL: {}", index, raw);
                pl.onProgress(index + 1, lines.size(), null);
                continue;
            }

            LOG.info("[{}] {}", index, raw);
            ItemResult result = write(pipeline.extract(new UrlItem(index, raw)));
            results.add(result);

            SLOG.info("item-done",
                    "index", index,
                    "url", raw,
                    "ok", result.isSuccess(),
                    "failure", result.failure(),
                    "status", result.httpStatus(),
                    "retries", result.retries(),
                    "chars", result.text().length());
            pl.onProgress(index + 1, lines.size(), result);
        }

        BatchSummary summary = new BatchSummary(urlListFile, outputDir, started, Instant.now(), lines.size(), results);
        LOG.info("Batch done. attempted={}, succeeded={}, failed={}, skipped={}",
                summary.attempted(), summary.succeeded(), summary.failed(), summary.skipped());
        SLOG.info("batch-done",
                "attempted", summary.attempted(),
                "succeeded", summary.succeeded(),
                "failed", summary.failed(),
                "skipped", summary.skipped());
        return summary;
    }

    /** 실패 항목도 빈 파일로 남긴다. 쓰기 자체가 실패하면 WRITE 실패로 바꾼다. */
    private ItemResult write(ItemResult result) {
        Path out = outputDir.resolve(OutputNamer.name(result.index(), result.url()));
        try {
            Files.writeString(out, result.text(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return result.withOutputFile(out);
        } catch (IOException e) {
            LOG.warn("Failed to write {} for {}: {}", out, result.url(), e.toString());
            return result.withWriteFailure(e.toString());
        }
    }

    /** 항목마다 새 정책(재시도 횟수 집계가 항목 단위라서) */
    private static Supplier<RetryPolicy> retryPolicyOf(ExtractConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return () -> DefaultRetryPolicy.from(config);
    }
}
