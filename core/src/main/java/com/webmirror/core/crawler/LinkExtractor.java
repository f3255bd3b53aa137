package com.webmirror.core.crawler;

import com.webmirror.core.model.NormalizedUrl;

import java.util.List;

/** 페이지 본문에서 범위 내 링크를 뽑는 전략 인터페이스. */
@FunctionalInterface
public interface LinkExtractor {
    /**
     * page 본문에서 따라갈 전체 URL(scheme://host/path) 목록을 문서 순서대로 반환.
     * 한 페이지 안에서만 중복을 제거한다. 빈 본문이면 빈 목록.
     * href가 디렉터리 형태("sub/")였던 링크는 끝에 "/"를 남겨 다음 페이지의 상대 링크 해석에 쓴다.
     *
     * @param directory page가 디렉터리 형태("/docs/")로 요청됐는지
     */
    List<String> extract(NormalizedUrl page, boolean directory, byte[] body);

    default List<String> extract(NormalizedUrl page, byte[] body) {
        return extract(page, false, body);
    }
}
