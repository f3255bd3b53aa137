package com.webmirror.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong claimed        = new AtomicLong(0); // 방문 집합에 처음 등록된 URL
    private final AtomicLong duplicates     = new AtomicLong(0); // 이미 등록돼 버려진 호출
    private final AtomicLong cacheHits      = new AtomicLong(0);
    private final AtomicLong fetched        = new AtomicLong(0);
    private final AtomicLong fetchFailures  = new AtomicLong(0);
    private final AtomicLong saved          = new AtomicLong(0);
    private final AtomicLong saveFailures   = new AtomicLong(0);
    private final AtomicLong linksDiscovered = new AtomicLong(0);
    private final AtomicLong taskFailures   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void claimed()          { claimed.incrementAndGet(); }
    public void duplicate()        { duplicates.incrementAndGet(); }
    public void cacheHit()         { cacheHits.incrementAndGet(); }
    public void fetched()          { fetched.incrementAndGet(); }
    public void fetchFailed()      { fetchFailures.incrementAndGet(); }
    public void saved()            { saved.incrementAndGet(); }
    public void saveFailed()       { saveFailures.incrementAndGet(); }
    public void taskFailed()       { taskFailures.incrementAndGet(); }
    public void linksDiscovered(int n) { linksDiscovered.addAndGet(n); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                claimed.get(), duplicates.get(), cacheHits.get(),
                fetched.get(), fetchFailures.get(),
                saved.get(), saveFailures.get(),
                linksDiscovered.get(), taskFailures.get(),
                maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(
            long claimed,
            long duplicates,
            long cacheHits,
            long fetched,
            long fetchFailures,
            long saved,
            long saveFailures,
            long linksDiscovered,
            long taskFailures,
            int maxObservedConcurrency
    ) {}
}
