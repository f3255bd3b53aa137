package com.webmirror.core.api;

import com.webmirror.core.http.FetchException;

import java.net.URI;

/** 페이지 다운로드 최소 계약: 2xx 본문 바이트를 돌려준다. */
@FunctionalInterface
public interface IFetcher {
    /**
     * 블로킹 GET.
     *
     * @throws FetchException 전송 오류 또는 2xx가 아닌 응답
     */
    byte[] fetch(URI url) throws FetchException;
}
