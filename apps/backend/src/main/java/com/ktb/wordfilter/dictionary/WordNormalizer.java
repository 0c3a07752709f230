package com.ktb.wordfilter.dictionary;

import com.ktb.wordfilter.util.CaseFoldingUtil;
import java.util.Optional;

/**
 * 사전 파일의 한 줄을 비교 가능한 키로 정규화한다.
 * 빈 줄과 주석 줄은 에러가 아니라 빈 값으로 처리한다.
 */
public class WordNormalizer {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String commentMarker;

    /**
     * @param commentMarker 주석 시작 문자열, null 또는 공백이면 주석 처리 안 함
     */
    public WordNormalizer(String commentMarker) {
        this.commentMarker = (commentMarker == null || commentMarker.isBlank()) ? null : commentMarker.strip();
    }

    public Optional<String> normalize(String rawLine) {
        if (rawLine == null) {
            return Optional.empty();
        }

        String line = rawLine;
        if (!line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            line = line.substring(1);
        }

        line = line.strip();
        if (line.isEmpty()) {
            return Optional.empty();
        }
        if (commentMarker != null && line.startsWith(commentMarker)) {
            return Optional.empty();
        }

        return Optional.of(CaseFoldingUtil.fold(line));
    }

    public String getCommentMarker() {
        return commentMarker;
    }
}
