package com.ktb.wordfilter.dictionary;

import lombok.Value;

/**
 * 로드를 중단시키지 않는 사전 소스 문제 (읽기 실패한 파일, 거부된 줄 등).
 */
@Value
public class SourceWarning {
    String source;
    int lineNumber;   // 파일 단위 경고는 0
    String reason;

    public static SourceWarning ofSource(String source, String reason) {
        return new SourceWarning(source, 0, reason);
    }

    public static SourceWarning ofLine(String source, int lineNumber, String reason) {
        return new SourceWarning(source, lineNumber, reason);
    }
}
