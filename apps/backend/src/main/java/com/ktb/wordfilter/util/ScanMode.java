package com.ktb.wordfilter.util;

public enum ScanMode {
    /** 첫 매칭에서 즉시 종료 */
    EXISTENCE,
    /** 전체 텍스트를 스캔하며 모든 매칭 구간 수집 */
    ALL_SPANS
}
