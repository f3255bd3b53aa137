package com.webmirror.core.model;

/**
 * 페이지 하나의 처리 결과.
 *
 * @param url   정규화된 URL 키
 * @param file  저장/로드된 파일 경로 (없으면 null)
 * @param error 실패 메시지 (성공이면 null)
 */
public record PageResult(String url, PageOutcome outcome, int links, String file, String error) {
}
