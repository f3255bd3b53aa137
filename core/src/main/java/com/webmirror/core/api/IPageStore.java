package com.webmirror.core.api;

import com.webmirror.core.store.StoreException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * URL 경로를 키로 하는 페이지 저장소.
 * 키는 정규화된 URL path ("" = 루트, "/docs/a" ...).
 */
public interface IPageStore {

    /** 이전에 저장된 본문. 없으면 empty (오류 아님). */
    Optional<byte[]> load(String urlPath) throws StoreException;

    /** 부모 디렉터리를 만들고 덮어쓴다. 저장된 파일 위치를 돌려준다. */
    Path save(String urlPath, byte[] content) throws StoreException;

    /** 키에 대응하는 파일 위치 (존재 여부와 무관) */
    Path locate(String urlPath) throws StoreException;
}
