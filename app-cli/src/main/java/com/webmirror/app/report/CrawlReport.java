package com.webmirror.app.report;

import com.webmirror.core.model.CrawlSummary;

/** --report 로 쓰는 JSON 루트. v는 포맷 버전. */
public final class CrawlReport {
    public String v = "1";
    public String mirrorRoot;
    public CrawlSummary summary;

    public CrawlReport() {}

    public CrawlReport(String mirrorRoot, CrawlSummary summary) {
        this.mirrorRoot = mirrorRoot;
        this.summary = summary;
    }
}
