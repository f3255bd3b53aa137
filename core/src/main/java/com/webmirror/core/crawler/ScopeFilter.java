package com.webmirror.core.crawler;

import com.webmirror.core.model.CrawlTarget;
import com.webmirror.core.model.NormalizedUrl;

/**
 * 범위 판정: 같은 호스트이고, 경로가 scopePath 자신이거나 그 하위.
 * 세그먼트 경계에서 끊어 본다("/apidocs"는 "/api" 범위가 아니다).
 */
public final class ScopeFilter {
    private ScopeFilter() {}

    public static boolean inScope(String candidatePath, String scopePath) {
        if (candidatePath == null || scopePath == null) return false;
        if (candidatePath.equals(scopePath)) return true;
        return candidatePath.startsWith(scopePath + "/");
    }

    public static boolean inScope(NormalizedUrl url, CrawlTarget target) {
        if (url == null || target == null) return false;
        return url.host().equals(target.host()) && inScope(url.path(), target.scopePath());
    }
}
