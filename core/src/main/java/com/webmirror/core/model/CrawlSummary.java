package com.webmirror.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 크롤 한 번의 결과 요약. */
public record CrawlSummary(
        String seed,
        Instant startedAt,
        Instant finishedAt,
        boolean cancelled,
        CrawlStats.Snapshot stats,
        List<PageResult> pages
) {

    public CrawlSummary {
        pages = (pages == null ? List.of() : List.copyOf(pages));
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
