package com.webmirror.core.util;

import com.webmirror.core.model.NormalizedUrl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * URL 정규화 유틸.
 * 잘못된 입력은 예외 대신 Optional.empty()(= 버림)로 돌려준다.
 */
public final class UrlUtils {
    private UrlUtils() {}

    /** 링크로 취급하지 않는 href 값 */
    private static final Set<String> INVALID_HREFS = Set.of("#", "/");

    /**
     * 절대 URL(http/https) 정규화:
     * - scheme/host 소문자, 기본 포트 제거(http:80, https:443)
     * - 쿼리/fragment 제거
     * - 중복 슬래시 축소, dot-segment 제거, 끝 슬래시 제거(루트는 "")
     */
    public static Optional<NormalizedUrl> parseAbsolute(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        URI u;
        try {
            u = new URI(raw.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        String scheme = u.getScheme();
        if (scheme == null) return Optional.empty();
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return Optional.empty();

        String host = u.getHost();
        if (host == null || host.isEmpty()) return Optional.empty();
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            host = host + ":" + port;
        }

        String path = normalizePath(u.getRawPath());
        if (path == null) return Optional.empty();

        return Optional.of(new NormalizedUrl(scheme, host, path));
    }

    /**
     * 페이지 안의 href를 base 페이지 기준으로 정규화한다. 적용 순서:
     * <ol>
     *   <li>"#"로 시작하거나 무효값("/")이면 버림</li>
     *   <li>http로 시작하면 절대 URL. 호스트가 다르면 버림(크로스 도메인)</li>
     *   <li>"/"로 시작하면 루트 상대 경로. base 호스트에 붙이고 경로만 취함</li>
     *   <li>그 외 상대 경로는 base 페이지 기준으로 해석. 다른 scheme(mailto: 등)은 버림</li>
     *   <li>끝 슬래시 제거</li>
     * </ol>
     * 결과 scheme은 항상 base의 scheme을 따른다.
     */
    public static Optional<NormalizedUrl> normalize(String href, NormalizedUrl base) {
        return normalize(href, base, false);
    }

    /**
     * baseIsDirectory가 true면 base를 디렉터리("/docs/")로 보고 상대 경로를 그 아래로 해석한다.
     * 정규화 키에는 끝 슬래시가 없으므로 호출자가 원래 요청 형태를 넘겨야 한다.
     */
    public static Optional<NormalizedUrl> normalize(String href, NormalizedUrl base, boolean baseIsDirectory) {
        if (href == null || base == null) return Optional.empty();
        String h = href.trim();
        if (h.isEmpty() || h.startsWith("#") || INVALID_HREFS.contains(h)) return Optional.empty();

        // 1) 절대 URL
        if (h.regionMatches(true, 0, "http", 0, 4)) {
            return parseAbsolute(h)
                    .filter(u -> u.host().equals(base.host()))
                    .map(u -> new NormalizedUrl(base.scheme(), u.host(), u.path()));
        }

        // 2) 프로토콜 상대(//host/path)
        if (h.startsWith("//")) {
            return parseAbsolute(base.scheme() + ":" + h)
                    .filter(u -> u.host().equals(base.host()));
        }

        URI rel;
        try {
            rel = new URI(h);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (rel.getScheme() != null) return Optional.empty(); // mailto:, javascript:, tel: ...

        // 3) 루트 상대
        if (h.startsWith("/")) {
            String path = normalizePath(rel.getRawPath());
            if (path == null) return Optional.empty();
            return Optional.of(new NormalizedUrl(base.scheme(), base.host(), path));
        }

        // 4) 상대 경로: base 페이지 기준 해석
        URI resolved = (baseIsDirectory ? base.toDirectoryUri() : base.toUri()).resolve(rel);
        return parseAbsolute(resolved.toString())
                .filter(u -> u.host().equals(base.host()))
                .map(u -> new NormalizedUrl(base.scheme(), u.host(), u.path()));
    }

    /**
     * 요청 URL(또는 href)이 디렉터리 형태("/docs/", "sub/")로 쓰였는지. 쿼리/fragment는 보지 않는다.
     * 루트 여부는 호출자가 정규화 결과로 따로 거른다.
     */
    public static boolean isDirectoryForm(String raw) {
        if (raw == null) return false;
        String s = raw.trim();
        int cut = indexOfAny(s, '?', '#');
        if (cut >= 0) s = s.substring(0, cut);
        return s.endsWith("/");
    }

    /**
     * 경로 정규화. 비예약 문자의 퍼센트 인코딩은 풀고(%7E → ~) 나머지 인코딩은 대문자로 맞춘다.
     * 빈 세그먼트와 "."은 버리고 ".."은 한 단계 올라간다. 루트 위로 올라가면 null.
     */
    static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) return "";
        Deque<String> segments = new ArrayDeque<>();
        for (String rawSeg : rawPath.split("/")) {
            String seg = decodeUnreserved(rawSeg);
            if (seg.isEmpty() || seg.equals(".")) continue;
            if (seg.equals("..")) {
                if (segments.isEmpty()) return null;
                segments.pollLast();
                continue;
            }
            segments.addLast(seg);
        }
        return segments.isEmpty() ? "" : "/" + String.join("/", segments);
    }

    /** RFC 3986 6.2.2: %XX 중 비예약 문자(ALPHA / DIGIT / "-" / "." / "_" / "~")만 디코딩 */
    static String decodeUnreserved(String seg) {
        if (seg.indexOf('%') < 0) return seg;
        StringBuilder sb = new StringBuilder(seg.length());
        int i = 0;
        while (i < seg.length()) {
            char c = seg.charAt(i);
            if (c == '%' && i + 2 < seg.length()
                    && hex(seg.charAt(i + 1)) >= 0 && hex(seg.charAt(i + 2)) >= 0) {
                char decoded = (char) (hex(seg.charAt(i + 1)) * 16 + hex(seg.charAt(i + 2)));
                if (isUnreserved(decoded)) {
                    sb.append(decoded);
                } else {
                    sb.append('%')
                      .append(Character.toUpperCase(seg.charAt(i + 1)))
                      .append(Character.toUpperCase(seg.charAt(i + 2)));
                }
                i += 3;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    private static int hex(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a), j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
