package com.ktb.wordfilter.service;

import com.ktb.wordfilter.dictionary.DictionarySnapshot;
import com.ktb.wordfilter.util.CaseFoldingUtil;
import com.ktb.wordfilter.util.MatchSpan;
import java.util.BitSet;
import java.util.List;

/**
 * 스냅샷 기준으로 금칙어를 검사하고 마스킹한다.
 *
 * <p>겹치는 구간은 합집합으로 한 번만 마스킹하며, 원본 코드 포인트 하나당
 * placeholder 하나로 치환하므로 결과 길이(코드 포인트 수)는 항상 같다.</p>
 */
public class TextMasker {

    private final int placeholder;

    public TextMasker(int placeholder) {
        if (!Character.isValidCodePoint(placeholder)) {
            throw new IllegalArgumentException("Invalid placeholder code point: " + placeholder);
        }
        this.placeholder = placeholder;
    }

    public int getPlaceholder() {
        return placeholder;
    }

    public boolean exists(DictionarySnapshot snapshot, String text) {
        return snapshot.getMatcher().contains(text);
    }

    public List<MatchSpan> findAll(DictionarySnapshot snapshot, String text) {
        return snapshot.getMatcher().findAll(text);
    }

    public String filter(DictionarySnapshot snapshot, String text) {
        return mask(snapshot, text).getText();
    }

    /**
     * 매칭이 없으면 입력 인스턴스를 그대로 담아 돌려준다.
     */
    public MaskResult mask(DictionarySnapshot snapshot, String text) {
        if (text == null || text.isEmpty() || snapshot.isEmpty()) {
            return new MaskResult(text, 0);
        }

        int[] original = text.codePoints().toArray();
        int[] folded = original.clone();
        for (int i = 0; i < folded.length; i++) {
            folded[i] = CaseFoldingUtil.fold(folded[i]);
        }

        List<MatchSpan> spans = snapshot.getMatcher().findAll(folded);
        if (spans.isEmpty()) {
            return new MaskResult(text, 0);
        }

        BitSet masked = new BitSet(original.length);
        for (MatchSpan span : spans) {
            masked.set(span.getStart(), span.getEnd());
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < original.length; i++) {
            sb.appendCodePoint(masked.get(i) ? placeholder : original[i]);
        }
        return new MaskResult(sb.toString(), spans.size());
    }
}
