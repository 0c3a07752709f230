package com.ktb.wordfilter.service;

import lombok.Value;

/**
 * 마스킹 결과와 매칭된 구간 수.
 */
@Value
public class MaskResult {
    String text;
    int spanCount;

    public boolean isMatched() {
        return spanCount > 0;
    }
}
