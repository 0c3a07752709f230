package com.ktb.wordfilter.config;

import com.ktb.wordfilter.dictionary.DictionaryHolder;
import com.ktb.wordfilter.dictionary.DictionaryLoader;
import com.ktb.wordfilter.dictionary.WordNormalizer;
import com.ktb.wordfilter.service.TextMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class WordFilterConfig {

    @Value("${wordfilter.mask.placeholder:*}")
    private String placeholder;

    @Value("${wordfilter.dictionary.comment-marker:#}")
    private String commentMarker;

    @Value("${wordfilter.dictionary.require-match:true}")
    private boolean requireMatch;

    @Bean
    public WordNormalizer wordNormalizer() {
        return new WordNormalizer(commentMarker);
    }

    @Bean
    public TextMasker textMasker() {
        return new TextMasker(placeholderCodePoint());
    }

    @Bean
    public DictionaryLoader dictionaryLoader(WordNormalizer wordNormalizer) {
        log.info("Dictionary loader: placeholder='{}', commentMarker='{}', requireMatch={}",
                placeholder, wordNormalizer.getCommentMarker(), requireMatch);
        return new DictionaryLoader(wordNormalizer, placeholderCodePoint(), requireMatch);
    }

    /**
     * 현재 사전 핸들. 인스턴스별로 독립이므로 테스트에서 여러 엔진을 동시에 띄울 수 있다.
     */
    @Bean
    public DictionaryHolder dictionaryHolder() {
        return new DictionaryHolder();
    }

    private int placeholderCodePoint() {
        if (placeholder == null || placeholder.codePointCount(0, placeholder.length()) != 1) {
            throw new IllegalStateException(
                    "wordfilter.mask.placeholder must be exactly one character: '" + placeholder + "'");
        }
        return placeholder.codePointAt(0);
    }
}
