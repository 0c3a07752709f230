package com.ktb.wordfilter.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aho-Corasick 트라이 노드. 소유 관계는 children 뿐이고 fail 은 탐색용 참조.
 */
class TrieNode {

    private static final String[] NO_WORDS = new String[0];
    private static final int[] NO_LENGTHS = new int[0];

    final Map<Integer, TrieNode> children = new HashMap<>();
    TrieNode fail;                 // 실패 링크
    boolean terminal;              // 이 노드에서 끝나는 금칙어 존재 여부

    // 빌드 중에만 사용, freeze() 이후 배열로 고정
    private List<String> pending = new ArrayList<>();

    // 이 노드에서 끝나는 금칙어들 (실패 링크 상속분 포함, 긴 단어 우선)
    String[] outputWords = NO_WORDS;
    int[] outputLengths = NO_LENGTHS;

    void addOutput(String word) {
        pending.add(word);
    }

    void inheritOutputs(TrieNode from) {
        pending.addAll(from.pending);
    }

    boolean hasOutputs() {
        return outputWords.length > 0;
    }

    void freeze() {
        if (!pending.isEmpty()) {
            outputWords = pending.toArray(NO_WORDS);
            outputLengths = new int[outputWords.length];
            for (int i = 0; i < outputWords.length; i++) {
                outputLengths[i] = outputWords[i].codePointCount(0, outputWords[i].length());
            }
        }
        pending = null;
    }
}
