package com.ktb.wordfilter.service;

import com.ktb.wordfilter.dictionary.DictionaryHolder;
import com.ktb.wordfilter.dictionary.DictionaryLoadException;
import com.ktb.wordfilter.dictionary.DictionaryLoadResult;
import com.ktb.wordfilter.dictionary.DictionaryLoader;
import com.ktb.wordfilter.dictionary.DictionarySnapshot;
import com.ktb.wordfilter.dto.DictionaryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 금칙어 검사/마스킹 진입점.
 *
 * <p>조회는 호출 시점의 스냅샷을 한 번만 읽어 끝까지 사용하므로 리로드와 무관하게
 * 일관된 결과를 낸다. 리로드는 {@link ReentrantLock} 으로 직렬화된다.</p>
 */
@Slf4j
@Service
public class WordFilterService {

    private final DictionaryLoader dictionaryLoader;
    private final DictionaryHolder dictionaryHolder;
    private final TextMasker textMasker;
    private final MeterRegistry meterRegistry;
    private final String dictionaryPattern;
    private final boolean failOnStartup;

    private final ReentrantLock reloadLock = new ReentrantLock();

    // ===== Metrics cache (핫패스에서 builder/register 반복 방지) =====
    private final ConcurrentMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> matchCounters = new ConcurrentHashMap<>();

    public WordFilterService(DictionaryLoader dictionaryLoader,
                             DictionaryHolder dictionaryHolder,
                             TextMasker textMasker,
                             MeterRegistry meterRegistry,
                             @Value("${wordfilter.dictionary.path:*.txt}") String dictionaryPattern,
                             @Value("${wordfilter.dictionary.fail-on-startup:false}") boolean failOnStartup) {
        this.dictionaryLoader = dictionaryLoader;
        this.dictionaryHolder = dictionaryHolder;
        this.textMasker = textMasker;
        this.meterRegistry = meterRegistry;
        this.dictionaryPattern = dictionaryPattern;
        this.failOnStartup = failOnStartup;

        Gauge.builder("wordfilter.dictionary.words", dictionaryHolder, h -> h.current().getWordCount())
                .description("Number of words in the current dictionary")
                .register(meterRegistry);
    }

    @PostConstruct
    public void init() {
        try {
            int wordCount = reload(dictionaryPattern);
            log.info("Initial dictionary loaded: pattern={}, words={}", dictionaryPattern, wordCount);
        } catch (DictionaryLoadException e) {
            if (failOnStartup) {
                throw e;
            }
            log.error("Initial dictionary load failed, starting with empty dictionary: {}", e.getMessage(), e);
        }
    }

    private Timer getRequestTimer(String method) {
        return requestTimers.computeIfAbsent(method, key -> Timer.builder("wordfilter.requests")
                .description("Word filter request processing time")
                .tags(Tags.of("method", method))
                .register(meterRegistry));
    }

    private Counter getMatchCounter(String method) {
        return matchCounters.computeIfAbsent(method, key -> Counter.builder("wordfilter.matches")
                .description("Requests that contained at least one dictionary word")
                .tags(Tags.of("method", method))
                .register(meterRegistry));
    }

    /** 금칙어가 하나라도 있으면 true */
    public boolean exists(String text) {
        long begin = System.nanoTime();
        DictionarySnapshot snapshot = dictionaryHolder.current();

        boolean found = textMasker.exists(snapshot, text);

        record("exists", begin, found, text);
        return found;
    }

    /** 금칙어가 없으면 true */
    public boolean validate(String text) {
        return !exists(text);
    }

    /** 금칙어를 placeholder 로 치환한 텍스트 */
    public String filter(String text) {
        long begin = System.nanoTime();
        DictionarySnapshot snapshot = dictionaryHolder.current();

        MaskResult masked = textMasker.mask(snapshot, text);

        record("filter", begin, masked.isMatched(), text);
        return masked.getText();
    }

    private void record(String method, long begin, boolean matched, String text) {
        long took = System.nanoTime() - begin;
        getRequestTimer(method).record(took, TimeUnit.NANOSECONDS);
        if (matched) {
            getMatchCounter(method).increment();
        }
        if (log.isDebugEnabled()) {
            log.debug("method={}, length={}, matched={}, took={}us",
                    method, text == null ? 0 : text.length(), matched, took / 1_000);
        }
    }

    public int reload() {
        return reload(dictionaryPattern);
    }

    /**
     * @return 새 사전의 단어 수
     * @throws DictionaryLoadException 로드 실패 시 (기존 사전 유지)
     */
    public int reload(String pattern) {
        return reloadWithReport(pattern).getSnapshot().getWordCount();
    }

    public DictionaryLoadResult reloadWithReport(String pattern) {
        String effective = (pattern == null || pattern.isBlank()) ? dictionaryPattern : pattern;

        reloadLock.lock();
        try {
            DictionaryLoadResult result = dictionaryLoader.load(effective);
            if (result.hasWarnings()) {
                log.warn("Dictionary loaded with {} warning(s): pattern={}", result.getWarnings().size(), effective);
            }
            dictionaryHolder.publish(result.getSnapshot());
            return result;
        } catch (DictionaryLoadException e) {
            log.warn("Dictionary reload failed, keeping version {}: {}",
                    dictionaryHolder.current().getVersion(), e.getMessage());
            throw e;
        } finally {
            reloadLock.unlock();
        }
    }

    public DictionaryStatus status() {
        DictionarySnapshot snapshot = dictionaryHolder.current();
        return DictionaryStatus.builder()
                .version(snapshot.getVersion())
                .wordCount(snapshot.getWordCount())
                .builtAt(snapshot.getBuiltAt())
                .pattern(dictionaryPattern)
                .sources(snapshot.getSources())
                .build();
    }

    public DictionarySnapshot currentSnapshot() {
        return dictionaryHolder.current();
    }
}
