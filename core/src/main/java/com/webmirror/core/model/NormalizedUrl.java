package com.webmirror.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 비교 가능한 정규화 URL.
 * - host: 소문자 호스트 + (기본 포트가 아니면) ":port"
 * - path: 루트는 "", 끝 슬래시/쿼리/fragment 없음
 * 세 값이 같으면 같은 페이지로 본다.
 */
public record NormalizedUrl(String scheme, String host, String path) {

    public NormalizedUrl {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        path = (path == null ? "" : path);
    }

    /** 방문 집합 키이자 링크 출력 형식: scheme://host/path */
    public String key() {
        return scheme + "://" + host + path;
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    /** 상대 링크 해석용 URI. 루트는 "/"를 붙여야 URI.resolve가 호스트 뒤에 경로를 이어 붙이지 않는다. */
    public URI toUri() {
        return URI.create(scheme + "://" + host + (path.isEmpty() ? "/" : path));
    }

    /** 디렉터리로 요청된 페이지("/docs/")의 상대 링크 해석용 URI */
    public URI toDirectoryUri() {
        return URI.create(scheme + "://" + host + path + "/");
    }

    @Override
    public String toString() {
        return key();
    }
}
