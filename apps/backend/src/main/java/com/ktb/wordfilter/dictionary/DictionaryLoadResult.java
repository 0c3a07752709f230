package com.ktb.wordfilter.dictionary;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

@Getter
@Builder
public class DictionaryLoadResult {
    private final DictionarySnapshot snapshot;
    private final String pattern;
    private final int linesRead;
    @Singular
    private final List<SourceWarning> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
