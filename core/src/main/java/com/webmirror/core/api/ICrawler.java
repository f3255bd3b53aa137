package com.webmirror.core.api;

import com.webmirror.core.model.CrawlSummary;

/** 크롤러 최소 계약: 시드부터 범위 내 전체를 처리하고 요약을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlSummary crawl();

    /** 진행 중인 크롤을 즉시 멈춘다. 실행 중 작업은 기다리지 않는다. */
    void cancel();

    @Override default void close() { cancel(); }
}
