package com.webmirror.core.store;

import java.io.IOException;

/** 미러 디렉터리 생성/읽기/쓰기 실패 */
public class StoreException extends IOException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
