package com.webtext.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 배치 1회 실행 요약 */
public record BatchSummary(Path inputFile,
                           Path outputDir,
                           Instant startedAt,
                           Instant finishedAt,
                           int linesRead,
                           List<ItemResult> items) {

    public BatchSummary {
        items = List.copyOf(items);
    }

    /** 유효 URL(= 시도한 항목) 수 */
    public int attempted() { return items.size(); }

    public long succeeded() { return items.stream().filter(ItemResult::isSuccess).count(); }

    public long failed() { return attempted() - succeeded(); }

    public int skipped() { return linesRead - attempted(); }
}
