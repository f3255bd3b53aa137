package com.webmirror.core.model;

import com.webmirror.core.util.UrlUtils;

import java.util.Objects;

/**
 * 한 번의 크롤 범위: 시드에서 한 번만 만들어지고 크롤 동안 바뀌지 않는다.
 * scopePath 자신과 그 하위 경로만 따라간다.
 * directory는 시드가 "/docs/"처럼 끝 슬래시로 주어졌는지(시드 페이지의 상대 링크 해석 기준).
 */
public record CrawlTarget(String scheme, String host, String scopePath, boolean directory) {

    public CrawlTarget {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        scopePath = (scopePath == null ? "" : scopePath);
    }

    /**
     * 시드 URL로부터 범위를 만든다. http(s)로 시작하지 않거나 파싱할 수 없으면 치명 오류.
     *
     * @throws IllegalArgumentException 잘못된 시드
     */
    public static CrawlTarget fromSeed(String seed) {
        if (seed == null || !seed.trim().startsWith("http")) {
            throw new IllegalArgumentException("invalid url provided. valid ex.: https://github.com (got: " + seed + ")");
        }
        NormalizedUrl n = UrlUtils.parseAbsolute(seed)
                .orElseThrow(() -> new IllegalArgumentException("cannot parse seed url: " + seed));
        return new CrawlTarget(n.scheme(), n.host(), n.path(),
                !n.isRoot() && UrlUtils.isDirectoryForm(seed));
    }

    /** 첫 작업으로 넘기는 시드 링크. 디렉터리 형태면 끝 "/"를 유지한다. */
    public String seedLink() {
        String key = seed().key();
        return directory ? key + "/" : key;
    }

    /** 시드 페이지 자체 */
    public NormalizedUrl seed() {
        return new NormalizedUrl(scheme, host, scopePath);
    }
}
