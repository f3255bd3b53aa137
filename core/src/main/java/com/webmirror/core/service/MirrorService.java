package com.webmirror.core.service;

import com.webmirror.core.api.ICrawler;
import com.webmirror.core.api.IFetcher;
import com.webmirror.core.api.IPageStore;
import com.webmirror.core.crawler.JsoupLinkExtractor;
import com.webmirror.core.crawler.LinkExtractor;
import com.webmirror.core.crawler.MirrorCrawler;
import com.webmirror.core.http.HttpFetcher;
import com.webmirror.core.model.CrawlSummary;
import com.webmirror.core.model.CrawlTarget;
import com.webmirror.core.model.MirrorConfig;
import com.webmirror.core.store.FilePageStore;
import com.webmirror.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 미러링 오케스트레이터:
 *  - 설정 검증 → 범위(CrawlTarget) 계산 → 크롤러 조립 → 실행
 *  - 기본 구현체(HttpFetcher/FilePageStore/JsoupLinkExtractor)
 *  - DI 생성자는 테스트용
 *
 * run()은 한 번만 호출할 수 있다. cancel()은 다른 스레드(셧다운 훅)에서 호출된다.
 */
public final class MirrorService {

    private static final Logger LOG = LoggerFactory.getLogger(MirrorService.class);
    private static final StructuredLog SLOG = StructuredLog.get(MirrorService.class);

    private final MirrorConfig config;
    private final CrawlTarget target;
    private final ICrawler crawler;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    /** 기본 구현 */
    public MirrorService(MirrorConfig config) {
        this(config, null, null);
    }

    /** DI/테스트용. null이면 기본 구현을 쓴다. */
    public MirrorService(MirrorConfig config, IFetcher fetcher, IPageStore store) {
        this(config, fetcher, store, null);
    }

    /** DI/테스트용(추출기까지 교체) */
    public MirrorService(MirrorConfig config, IFetcher fetcher, IPageStore store, LinkExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.target = CrawlTarget.fromSeed(config.getTarget());
        IPageStore s = (store != null) ? store : new FilePageStore(config.getOutputDir());
        IFetcher f = (fetcher != null) ? fetcher : new HttpFetcher(config);
        LinkExtractor x = (extractor != null) ? extractor : new JsoupLinkExtractor(target);
        this.crawler = new MirrorCrawler(target, f, s, x, config.getConcurrency());
    }

    public CrawlSummary run() {
        LOG.info("Mirror start: target={}, scope={}, dir={}",
                config.getTarget(), scopeLabel(), config.getOutputDir());
        SLOG.info("mirror-start",
                "target", config.getTarget(),
                "host", target.host(),
                "scope", scopeLabel(),
                "dir", String.valueOf(config.getOutputDir()),
                "concurrency", config.getConcurrency());
        try {
            CrawlSummary summary = crawler.crawl();
            LOG.info("Mirror done. pages={}, fetched={}, cached={}, elapsedMs={}",
                    summary.stats().claimed(), summary.stats().fetched(),
                    summary.stats().cacheHits(), summary.elapsed().toMillis());
            SLOG.info("mirror-done",
                    "pages", summary.stats().claimed(),
                    "cancelled", summary.cancelled(),
                    "elapsedMs", summary.elapsed().toMillis());
            return summary;
        } finally {
            finished.set(true);
        }
    }

    /** 진행 중이면 즉시 멈춘다. 끝난 뒤 호출은 무시. */
    public void cancel() {
        if (finished.get()) return;
        crawler.cancel();
    }

    public boolean isFinished() {
        return finished.get();
    }

    public CrawlTarget getTarget() {
        return target;
    }

    private String scopeLabel() {
        return target.scopePath().isEmpty() ? "/" : target.scopePath();
    }
}
