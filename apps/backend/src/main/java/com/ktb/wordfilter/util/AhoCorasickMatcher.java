package com.ktb.wordfilter.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * 금칙어 사전으로부터 한 번 빌드되는 Aho-Corasick 오토마톤.
 *
 * <p>생성 이후에는 변경되지 않으므로 여러 스레드에서 동시에 조회해도 안전하다.
 * 단어는 이미 정규화(소문자화)되어 있어야 하며, 입력 텍스트는 스캔 시
 * {@link CaseFoldingUtil#fold(int)} 로 코드 포인트 단위 정규화된다.</p>
 */
public class AhoCorasickMatcher {

    private final TrieNode root;
    private final int size;
    private final int nodeCount;

    public AhoCorasickMatcher(Collection<String> bannedWords) {
        root = new TrieNode();

        // Trie 구성
        int inserted = 0;
        for (String word : bannedWords) {
            if (insert(word)) {
                inserted++;
            }
        }
        this.size = inserted;

        // 실패 링크(fail links) 구축
        this.nodeCount = buildFailureLinks();
    }

    public static AhoCorasickMatcher empty() {
        return new AhoCorasickMatcher(Collections.emptyList());
    }

    /** 사전에 등록된 단어 수 */
    public int size() {
        return size;
    }

    /** root 포함 전체 노드 수 */
    public int nodeCount() {
        return nodeCount;
    }

    /** 금칙어 포함 여부 */
    public boolean contains(String text) {
        if (text == null || text.isEmpty() || size == 0) {
            return false;
        }
        return scan(CaseFoldingUtil.foldedCodePoints(text), ScanMode.EXISTENCE, null);
    }

    /** 모든 매칭 구간 (끝 오프셋 순, 겹치는 구간 포함) */
    public List<MatchSpan> findAll(String text) {
        if (text == null || text.isEmpty() || size == 0) {
            return List.of();
        }
        return findAll(CaseFoldingUtil.foldedCodePoints(text));
    }

    /**
     * 이미 정규화된 코드 포인트 배열을 스캔한다.
     */
    public List<MatchSpan> findAll(int[] foldedCodePoints) {
        if (size == 0) {
            return List.of();
        }
        List<MatchSpan> spans = new ArrayList<>();
        scan(foldedCodePoints, ScanMode.ALL_SPANS, spans);
        return spans;
    }

    /** Trie 삽입 */
    private boolean insert(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        TrieNode node = root;
        int[] codePoints = word.codePoints().toArray();
        for (int cp : codePoints) {
            node = node.children.computeIfAbsent(cp, k -> new TrieNode());
        }
        if (node.terminal) {
            return false; // 중복 단어
        }
        node.terminal = true;
        node.addOutput(word); // 이 노드에서 끝나는 단어
        return true;
    }

    /** 실패 링크 구성 (BFS), 전체 노드 수 반환 */
    private int buildFailureLinks() {
        Queue<TrieNode> queue = new ArrayDeque<>();
        List<TrieNode> visited = new ArrayList<>();

        root.fail = root;
        visited.add(root);

        // root의 모든 자식 처리
        for (TrieNode child : root.children.values()) {
            child.fail = root;
            queue.add(child);
        }

        // BFS로 모든 노드 처리
        while (!queue.isEmpty()) {
            TrieNode current = queue.poll();
            visited.add(current);

            for (Map.Entry<Integer, TrieNode> entry : current.children.entrySet()) {
                int c = entry.getKey();
                TrieNode child = entry.getValue();

                TrieNode failCandidate = current.fail;

                while (failCandidate != root && !failCandidate.children.containsKey(c)) {
                    failCandidate = failCandidate.fail;
                }

                TrieNode next = failCandidate.children.get(c);
                child.fail = next != null ? next : root;

                child.inheritOutputs(child.fail); // 실패 링크의 output 상속

                queue.add(child);
            }
        }

        // 상속이 모두 끝난 뒤 배열로 고정
        for (TrieNode node : visited) {
            node.freeze();
        }
        return visited.size();
    }

    private TrieNode step(TrieNode node, int c) {
        while (node != root && !node.children.containsKey(c)) {
            node = node.fail;
        }
        return node.children.getOrDefault(c, root);
    }

    /**
     * 두 조회 모드가 공유하는 단일 순회.
     *
     * @return 하나 이상 매칭되었으면 true
     */
    private boolean scan(int[] text, ScanMode mode, List<MatchSpan> sink) {
        TrieNode node = root;
        boolean found = false;

        for (int i = 0; i < text.length; i++) {
            node = step(node, text[i]);

            if (!node.hasOutputs()) {
                continue;
            }

            // 금칙어 발견
            found = true;
            if (mode == ScanMode.EXISTENCE) {
                return true;
            }

            int end = i + 1;
            for (int k = 0; k < node.outputWords.length; k++) {
                sink.add(new MatchSpan(end - node.outputLengths[k], end, node.outputWords[k]));
            }
        }

        return found;
    }
}
