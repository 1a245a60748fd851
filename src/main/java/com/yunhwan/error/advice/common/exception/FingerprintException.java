package com.yunhwan.error.advice.common.exception;

/**
 * fingerprint 계산 실패. fingerprinter 안에서 degraded fingerprint로 복구되며 밖으로 나가지 않는다.
 */
public class FingerprintException extends RuntimeException {

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
