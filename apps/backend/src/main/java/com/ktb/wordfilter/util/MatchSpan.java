package com.ktb.wordfilter.util;

import lombok.Value;

/**
 * 텍스트 안에서 발견된 금칙어 구간. 오프셋은 코드 포인트 단위, end 는 exclusive.
 */
@Value
public class MatchSpan {
    int start;
    int end;
    String word;

    public int length() {
        return end - start;
    }
}
