package com.ktb.wordfilter.util;

import lombok.experimental.UtilityClass;

/**
 * 코드 포인트 단위 대소문자 정규화. 문자열 전체 toLowerCase 와 달리 길이가 변하지 않는다.
 */
@UtilityClass
public class CaseFoldingUtil {

    public int fold(int codePoint) {
        return Character.toLowerCase(codePoint);
    }

    public int[] foldedCodePoints(String text) {
        int[] codePoints = text.codePoints().toArray();
        for (int i = 0; i < codePoints.length; i++) {
            codePoints[i] = fold(codePoints[i]);
        }
        return codePoints;
    }

    public String fold(String text) {
        int[] codePoints = foldedCodePoints(text);
        return new String(codePoints, 0, codePoints.length);
    }
}
