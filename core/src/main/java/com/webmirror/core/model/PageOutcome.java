package com.webmirror.core.model;

/** 한 페이지 처리의 최종 상태 */
public enum PageOutcome {
    /** 미러에 이미 있어 디스크에서 읽음 */
    CACHED,
    /** 다운로드 후 저장까지 성공 */
    FETCHED,
    /** 다운로드는 됐으나 저장 실패(다음 실행에서 다시 받음) */
    SAVE_FAILED,
    /** 다운로드 실패: 빈 본문으로 진행 */
    FETCH_FAILED
}
