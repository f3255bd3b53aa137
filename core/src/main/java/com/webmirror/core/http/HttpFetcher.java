package com.webmirror.core.http;

import com.webmirror.core.api.IFetcher;
import com.webmirror.core.model.MirrorConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 다운로더.
 * 커스텀 헤더 없이 GET만 보내고, 리다이렉트는 HttpClient 설정에 맡긴다.
 * Content-Type은 보지 않는다(HTML이 아니어도 그대로 반환).
 */
public class HttpFetcher implements IFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final Duration requestTimeout; // null = 무제한
    private final HttpSender sender;

    public HttpFetcher(MirrorConfig config) {
        this(config, newClient(config));
    }

    public HttpFetcher(MirrorConfig config, HttpClient client) {
        Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(config, "config").getRequestTimeout();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(MirrorConfig config, HttpSender testSender) {
        this.requestTimeout = Objects.requireNonNull(config, "config").getRequestTimeout();
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    static HttpClient newClient(MirrorConfig config) {
        HttpClient.Builder b = HttpClient.newBuilder()
                // h2c 업그레이드 헤더를 붙이지 않도록 1.1 고정
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER);
        if (config.getRequestTimeout() != null) {
            b.connectTimeout(config.getRequestTimeout());
        }
        return b.build();
    }

    @Override
    public byte[] fetch(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        HttpRequest.Builder rb = HttpRequest.newBuilder(url).GET();
        if (requestTimeout != null) rb.timeout(requestTimeout);

        HttpResponse<byte[]> resp;
        try {
            resp = sender.send(rb.build());
        } catch (IOException e) {
            throw new FetchException(url, -1, "transport failure: " + e, e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, -1, "interrupted while fetching", ie);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchException(url, status, "invalid status code " + status, null);
        }
        byte[] body = resp.body();
        return body == null ? new byte[0] : body;
    }
}
