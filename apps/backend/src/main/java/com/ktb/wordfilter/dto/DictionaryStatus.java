package com.ktb.wordfilter.dto;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DictionaryStatus {

    private long version;

    private int wordCount;

    private Instant builtAt;

    private String pattern;

    private List<String> sources;
}
