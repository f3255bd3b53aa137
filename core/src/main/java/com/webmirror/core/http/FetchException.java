package com.webmirror.core.http;

import java.net.URI;

/** 다운로드 실패: 전송 오류(status -1) 또는 2xx가 아닌 응답. */
public class FetchException extends Exception {

    private final URI url;
    private final int statusCode;

    public FetchException(URI url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public URI getUrl() { return url; }

    /** HTTP 상태 코드. 응답을 받지 못했으면 -1 */
    public int getStatusCode() { return statusCode; }

    public boolean isTransportFailure() { return statusCode < 0; }
}
