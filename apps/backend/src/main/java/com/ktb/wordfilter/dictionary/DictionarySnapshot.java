package com.ktb.wordfilter.dictionary;

import com.ktb.wordfilter.util.AhoCorasickMatcher;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * 한 번 빌드된 사전. 생성 후 절대 변경되지 않으며 리로드 시 새 인스턴스로 교체된다.
 */
@Getter
@Builder
@ToString(exclude = "matcher")
public class DictionarySnapshot {

    @NonNull
    private final AhoCorasickMatcher matcher;

    private final int wordCount;

    @NonNull
    private final Instant builtAt;

    private final long version;

    @Singular
    private final List<String> sources;

    public static DictionarySnapshot empty() {
        return DictionarySnapshot.builder()
                .matcher(AhoCorasickMatcher.empty())
                .wordCount(0)
                .builtAt(Instant.EPOCH)
                .version(0L)
                .build();
    }

    public boolean isEmpty() {
        return wordCount == 0;
    }
}
