package io.exoticst.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trie vertex of the automaton.
 *
 * <p>Children are owned by their parent. {@code fail} only references an existing
 * node and carries no ownership. Mutated during {@link Automaton#build} only.
 */
final class TrieNode {

    private final Map<Character, TrieNode> children = new HashMap<>();
    // pattern -> every (ordinal, score) ending here, own and inherited through fail
    private final Map<String, List<ScoreEntry>> outputs = new LinkedHashMap<>();
    private final int depth;
    private TrieNode fail;

    TrieNode(int depth) {
        this.depth = depth;
    }

    TrieNode child(char c) {
        return children.get(c);
    }

    TrieNode childOrCreate(char c) {
        return children.computeIfAbsent(c, ignored -> new TrieNode(depth + 1));
    }

    Map<Character, TrieNode> children() {
        return children;
    }

    void addOutput(String pattern, ScoreEntry entry) {
        outputs.computeIfAbsent(pattern, ignored -> new ArrayList<>()).add(entry);
    }

    /**
     * Appends every entry of {@code other} to this node's outputs, keeping multiplicity.
     */
    void inheritOutputs(TrieNode other) {
        for (Map.Entry<String, List<ScoreEntry>> entry : other.outputs.entrySet()) {
            outputs.computeIfAbsent(entry.getKey(), ignored -> new ArrayList<>())
                    .addAll(entry.getValue());
        }
    }

    Map<String, List<ScoreEntry>> outputs() {
        return outputs;
    }

    int outputEntryCount() {
        int count = 0;
        for (Collection<ScoreEntry> entries : outputs.values()) {
            count += entries.size();
        }
        return count;
    }

    int depth() {
        return depth;
    }

    TrieNode fail() {
        return fail;
    }

    void fail(TrieNode fail) {
        this.fail = fail;
    }

    boolean isRoot() {
        return depth == 0;
    }
}
