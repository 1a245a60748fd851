package com.yunhwan.error.advice.domain.error;

/**
 * 애플리케이션 예외가 자체 에러 코드를 가질 때 구현한다.
 * {@link CapturedError#from(Throwable)}가 fingerprint 입력으로 사용한다.
 */
public interface CodedError {

    String errorCode();
}
