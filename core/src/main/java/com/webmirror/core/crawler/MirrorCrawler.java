package com.webmirror.core.crawler;

import com.webmirror.core.api.ICrawler;
import com.webmirror.core.api.IFetcher;
import com.webmirror.core.api.IPageStore;
import com.webmirror.core.http.FetchException;
import com.webmirror.core.model.CrawlStats;
import com.webmirror.core.model.CrawlSummary;
import com.webmirror.core.model.CrawlTarget;
import com.webmirror.core.model.NormalizedUrl;
import com.webmirror.core.model.PageOutcome;
import com.webmirror.core.model.PageResult;
import com.webmirror.core.store.StoreException;
import com.webmirror.core.util.StructuredLog;
import com.webmirror.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 재귀 팬아웃 크롤러.
 *
 * <p>URL 하나의 처리 순서:
 * 정규화 → 방문 집합 선점(실패 시 종료) → 캐시 확인 → (미스면) 다운로드 + 저장 → 링크 추출 → 링크마다 새 작업.
 *
 * <p>동시성:
 * <ul>
 *   <li>concurrency ≤ 0 이면 링크마다 작업 하나(상한 없음), 양수면 고정 크기 풀</li>
 *   <li>작업은 자식을 기다리지 않으므로 고정 풀에서도 교착이 없다</li>
 *   <li>crawl()은 {@link CompletionGate}가 0이 될 때까지 블록</li>
 * </ul>
 * 인스턴스 하나당 crawl()은 한 번만 호출할 수 있다.
 */
public class MirrorCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(MirrorCrawler.class);

    private final CrawlTarget target;
    private final IFetcher fetcher;
    private final IPageStore store;
    private final LinkExtractor extractor;
    private final int concurrency;

    private final VisitedSet visited = new VisitedSet();
    private final CompletionGate gate = new CompletionGate();
    private final CrawlStats stats = new CrawlStats();
    private final Queue<PageResult> results = new ConcurrentLinkedQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ExecutorService exec;

    private volatile boolean cancelled = false;

    public MirrorCrawler(CrawlTarget target, IFetcher fetcher, IPageStore store, LinkExtractor extractor) {
        this(target, fetcher, store, extractor, 0);
    }

    public MirrorCrawler(CrawlTarget target, IFetcher fetcher, IPageStore store,
                         LinkExtractor extractor, int concurrency) {
        this.target = Objects.requireNonNull(target, "target");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.store = Objects.requireNonNull(store, "store");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.concurrency = Math.max(0, concurrency);
        this.exec = (this.concurrency == 0)
                ? Executors.newCachedThreadPool(new NamedThreadFactory("mirror-worker"))
                : Executors.newFixedThreadPool(this.concurrency, new NamedThreadFactory("mirror-worker"));
    }

    @Override
    public CrawlSummary crawl() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("crawl() can only be called once per crawler");
        }
        Instant startedAt = Instant.now();
        String seed = target.seed().key();
        LOG.info("Crawl start: seed={}, concurrency={}", seed, concurrency == 0 ? "unbounded" : concurrency);
        SLOG.info("crawl-start", "seed", seed, "concurrency", concurrency);

        try {
            spawn(target.seedLink());
            gate.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancel();
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        CrawlSummary summary = new CrawlSummary(seed, startedAt, Instant.now(), cancelled,
                stats.snapshot(), new ArrayList<>(results));
        var s = summary.stats();
        LOG.info("Crawl done. pages={}, fetched={}, cached={}, fetchFailures={}, saveFailures={}, cancelled={}",
                s.claimed(), s.fetched(), s.cacheHits(), s.fetchFailures(), s.saveFailures(), cancelled);
        SLOG.info("crawl-done",
                "pages", s.claimed(),
                "fetched", s.fetched(),
                "cached", s.cacheHits(),
                "fetchFailures", s.fetchFailures(),
                "saveFailures", s.saveFailures(),
                "maxObservedCC", s.maxObservedConcurrency(),
                "cancelled", cancelled,
                "elapsedMs", summary.elapsed().toMillis());
        return summary;
    }

    @Override
    public void cancel() {
        if (cancelled) return;
        cancelled = true;
        exec.shutdownNow();
        gate.abort();
        LOG.info("Crawl cancelled: seed={}", target.seed());
    }

    boolean isCancelled() {
        return cancelled;
    }

    /* =========================
       작업 스폰 / 처리
       ========================= */

    /** 게이트를 먼저 올리고 작업을 띄운다. 제출 실패 시 즉시 내린다. */
    private void spawn(String rawUrl) {
        if (cancelled) return;
        gate.enter();
        try {
            exec.execute(() -> runTask(rawUrl));
        } catch (RejectedExecutionException e) {
            gate.leave();
            if (!cancelled) {
                LOG.warn("Task rejected: {} ({})", rawUrl, e.toString());
            }
        }
    }

    private void runTask(String rawUrl) {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        try {
            process(rawUrl);
        } catch (RuntimeException e) {
            stats.taskFailed();
            LOG.error("Task failed: {}", rawUrl, e);
            SLOG.error("task-failed", e, "url", rawUrl);
        } finally {
            inFlight.decrementAndGet();
            gate.leave();
        }
    }

    /** URL 하나 처리. 이미 선점된 URL이면 아무 일도 하지 않는다. */
    void process(String rawUrl) {
        Optional<NormalizedUrl> parsed = UrlUtils.parseAbsolute(rawUrl);
        if (parsed.isEmpty()) {
            LOG.warn("Skipping unparseable url: {}", rawUrl);
            return;
        }
        NormalizedUrl url = parsed.get();
        boolean directory = !url.isRoot() && UrlUtils.isDirectoryForm(rawUrl);

        if (!visited.tryClaim(url)) {
            stats.duplicate();
            return;
        }
        stats.claimed();

        byte[] content;
        PageOutcome outcome;
        Path file = null;
        String error = null;

        Optional<byte[]> cached = loadCached(url);
        if (cached.isPresent()) {
            content = cached.get();
            outcome = PageOutcome.CACHED;
            stats.cacheHit();
            file = locateQuietly(url);
            LOG.debug("Cache hit: {}", url);
        } else {
            try {
                LOG.info("Downloading {}", url);
                content = fetcher.fetch(url.toUri());
                stats.fetched();
                SLOG.info("page-fetched", "url", url.key(), "bytes", content.length);
                try {
                    file = store.save(url.path(), content);
                    stats.saved();
                    outcome = PageOutcome.FETCHED;
                } catch (StoreException e) {
                    stats.saveFailed();
                    outcome = PageOutcome.SAVE_FAILED;
                    error = e.getMessage();
                    LOG.warn("Save failed: {} ({})", url, e.getMessage());
                    SLOG.warn("save-failed", "url", url.key(), "message", e.getMessage());
                }
            } catch (FetchException e) {
                // 이 가지는 빈 본문으로 계속(추출 결과 없음)
                content = new byte[0];
                stats.fetchFailed();
                outcome = PageOutcome.FETCH_FAILED;
                error = e.getMessage();
                LOG.warn("Download failed: {} ({})", url, e.getMessage());
                SLOG.warn("fetch-failed", "url", url.key(), "status", e.getStatusCode(),
                        "transport", e.isTransportFailure(), "message", e.getMessage());
            }
        }

        List<String> links = extractLinks(url, directory, content);
        stats.linksDiscovered(links.size());
        results.add(new PageResult(url.key(), outcome, links.size(),
                file == null ? null : file.toString(), error));

        for (String link : links) {
            spawn(link);
        }
    }

    private Optional<byte[]> loadCached(NormalizedUrl url) {
        try {
            return store.load(url.path());
        } catch (StoreException e) {
            // 읽기 실패는 캐시 미스로 본다
            LOG.warn("Cache read failed, refetching: {} ({})", url, e.getMessage());
            return Optional.empty();
        }
    }

    private Path locateQuietly(NormalizedUrl url) {
        try {
            return store.locate(url.path());
        } catch (StoreException e) {
            return null;
        }
    }

    private List<String> extractLinks(NormalizedUrl url, boolean directory, byte[] content) {
        try {
            return extractor.extract(url, directory, content);
        } catch (RuntimeException e) {
            LOG.warn("Link extraction failed: {} ({})", url, e.toString());
            return List.of();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
