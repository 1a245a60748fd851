package com.yunhwan.error.advice.common.exception;

/**
 * advice 캐시 저장 실패. 캐시 내부에서 로그만 남기고 전파하지 않는다.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
