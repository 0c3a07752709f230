package com.ktb.wordfilter.dictionary;

/**
 * 사전 로드 자체가 실패한 경우. 기존에 게시된 사전은 그대로 유지된다.
 */
public class DictionaryLoadException extends RuntimeException {

    private final String pattern;

    public DictionaryLoadException(String pattern, String message) {
        super(message);
        this.pattern = pattern;
    }

    public DictionaryLoadException(String pattern, String message, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
