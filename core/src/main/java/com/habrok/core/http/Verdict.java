package com.habrok.core.http;

/** 시도 1회에 대한 분류 결과 */
public enum Verdict {
    SUCCESS,
    RETRYABLE,
    TERMINAL
}
