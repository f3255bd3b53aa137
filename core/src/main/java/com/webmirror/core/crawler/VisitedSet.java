package com.webmirror.core.crawler;

import com.webmirror.core.model.NormalizedUrl;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이미 처리 대상으로 선점된 URL 집합.
 * 유일한 중복 제거/동시성 진입 지점: 네트워크·파일 작업 전에 반드시 tryClaim()을 통과해야 한다.
 * 크롤 동안 커지기만 한다.
 */
public final class VisitedSet {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    /** 처음 호출한 쪽만 true. 확인과 등록이 한 번의 원자적 연산이다. */
    public boolean tryClaim(NormalizedUrl url) {
        return tryClaim(url.key());
    }

    public boolean tryClaim(String key) {
        return keys.add(key);
    }

    public boolean contains(NormalizedUrl url) {
        return keys.contains(url.key());
    }

    public int size() {
        return keys.size();
    }
}
