package com.ktb.wordfilter.dictionary;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * 현재 사전을 가리키는 유일한 공유 상태.
 *
 * <p>조회는 락 없이 {@link #current()} 로 한 번 읽은 스냅샷을 끝까지 사용하고,
 * 쓰기는 리로드 쪽 단일 writer 만 {@link #publish(DictionarySnapshot)} 한다.</p>
 */
@Slf4j
public class DictionaryHolder {

    private final AtomicReference<DictionarySnapshot> current;

    public DictionaryHolder() {
        this(DictionarySnapshot.empty());
    }

    public DictionaryHolder(DictionarySnapshot initial) {
        this.current = new AtomicReference<>(initial);
    }

    public DictionarySnapshot current() {
        return current.get();
    }

    /**
     * @return 교체되기 전 스냅샷
     */
    public DictionarySnapshot publish(DictionarySnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        DictionarySnapshot previous = current.getAndSet(snapshot);
        log.info("Dictionary published: version {} -> {}, words={}",
                previous.getVersion(), snapshot.getVersion(), snapshot.getWordCount());
        return previous;
    }
}
