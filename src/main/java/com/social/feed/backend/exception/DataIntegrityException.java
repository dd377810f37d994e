package com.social.feed.backend.exception;

/**
 * 저장된 데이터 자체가 깨진 경우 (예: 파싱 불가능한 created_at).
 * 입력 오류가 아니므로 500으로 응답한다.
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
