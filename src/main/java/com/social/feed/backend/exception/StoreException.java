package com.social.feed.backend.exception;

/**
 * 저장소 쿼리 실패. message는 실패한 작업("Failed to add user" 등),
 * cause의 메시지는 응답의 details로 노출된다.
 */
public class StoreException extends RuntimeException {

    public StoreException(String operation, Throwable cause) {
        super(operation, cause);
    }

    public String getDetails() {
        Throwable root = getCause();
        if (root == null) return null;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
