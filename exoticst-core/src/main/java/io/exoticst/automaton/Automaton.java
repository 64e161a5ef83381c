package io.exoticst.automaton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;

/**
 * Aho-Corasick automaton that aggregates weighted pattern scores.
 *
 * <p>Built once from parallel lists of patterns and scores. Each pattern gets the
 * ordinal of its position in the input. {@link #traverse(String, int, int)} scans a
 * text in a single pass and sums, per pattern string, the scores of every occurrence
 * whose ordinal lies in the requested range. The same literal pattern may be supplied
 * several times with different scores; every ordinal contributes.
 *
 * <p>Overlapping occurrences are all counted: the pattern {@code "aa"} occurs twice in
 * {@code "aaa"}.
 *
 * <p>Instances are immutable after {@link #build} returns and safe for concurrent
 * traversals.
 */
public final class Automaton {

    private static final Logger log = LoggerFactory.getLogger(Automaton.class);

    private final TrieNode root;
    private final List<String> patterns;
    private final long[] scores;
    private final int nodeCount;
    private final AutomatonConfiguration configuration;

    private Automaton(TrieNode root, List<String> patterns, long[] scores, int nodeCount,
            AutomatonConfiguration configuration) {
        this.root = root;
        this.patterns = patterns;
        this.scores = scores;
        this.nodeCount = nodeCount;
        this.configuration = configuration;
    }

    public static Automaton build(List<String> patterns, List<Long> scores) {
        return build(patterns, scores, AutomatonConfiguration.defaultConfiguration());
    }

    public static Automaton build(List<String> patterns, long[] scores) {
        return build(patterns, scores, AutomatonConfiguration.defaultConfiguration());
    }

    public static Automaton build(List<String> patterns, List<Long> scores,
            AutomatonConfiguration configuration) {
        if (scores == null) {
            throw new InvalidInputException("scores required");
        }
        long[] values = new long[scores.size()];
        for (int i = 0; i < values.length; i++) {
            Long score = scores.get(i);
            if (score == null) {
                throw new InvalidInputException("score at ordinal " + i + " is null");
            }
            values[i] = score;
        }
        return build(patterns, values, configuration);
    }

    /**
     * Builds the automaton: trie insertion, breadth-first failure links and output
     * propagation along them.
     *
     * @param patterns      non-empty patterns; position in the list is the ordinal
     * @param scores        score for each pattern, same length as {@code patterns}
     * @param configuration matching options
     * @return a fully built automaton
     * @throws InvalidInputException if the lengths differ or a pattern is null or empty
     */
    public static Automaton build(List<String> patterns, long[] scores, AutomatonConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        if (patterns == null) {
            throw new InvalidInputException("patterns required");
        }
        if (scores == null) {
            throw new InvalidInputException("scores required");
        }
        if (patterns.size() != scores.length) {
            throw new InvalidInputException("patterns and scores differ in length: "
                    + patterns.size() + " != " + scores.length);
        }
        for (int i = 0; i < patterns.size(); i++) {
            String pattern = patterns.get(i);
            if (pattern == null || pattern.isEmpty()) {
                throw new InvalidInputException("pattern at ordinal " + i + " is null or empty");
            }
        }

        List<String> ownPatterns = List.copyOf(patterns);
        long[] ownScores = scores.clone();
        boolean ignoreCase = configuration.ignoreCase();

        TrieNode root = new TrieNode(0);
        root.fail(root);
        int nodeCount = 1;
        for (int ordinal = 0; ordinal < ownPatterns.size(); ordinal++) {
            String pattern = ownPatterns.get(ordinal);
            TrieNode node = root;
            for (int i = 0; i < pattern.length(); i++) {
                char c = normalize(pattern.charAt(i), ignoreCase);
                TrieNode next = node.child(c);
                if (next == null) {
                    next = node.childOrCreate(c);
                    nodeCount++;
                }
                node = next;
            }
            node.addOutput(pattern, new ScoreEntry(ordinal, ownScores[ordinal]));
        }

        int outputEntries = linkFailures(root);
        if (log.isDebugEnabled()) {
            log.debug("Built automaton: patterns={}, nodes={}, outputEntries={}, ignoreCase={}",
                    ownPatterns.size(), nodeCount, outputEntries, ignoreCase);
        }
        return new Automaton(root, ownPatterns, ownScores, nodeCount, configuration);
    }

    /**
     * Sets {@code fail} on every node and merges the outputs of each failure target.
     * Nodes are visited level by level so a failure target, which is always shallower,
     * already holds its complete outputs when it is merged.
     *
     * @return total output entries after propagation
     */
    private static int linkFailures(TrieNode root) {
        Queue<TrieNode> queue = new ArrayDeque<>();
        int outputEntries = 0;
        for (TrieNode child : root.children().values()) {
            child.fail(root);
            outputEntries += child.outputEntryCount();
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            TrieNode current = queue.poll();
            for (Map.Entry<Character, TrieNode> edge : current.children().entrySet()) {
                char c = edge.getKey();
                TrieNode child = edge.getValue();

                TrieNode candidate = current.fail();
                while (candidate.child(c) == null && !candidate.isRoot()) {
                    candidate = candidate.fail();
                }
                TrieNode target = candidate.child(c);
                child.fail(target != null ? target : root);
                child.inheritOutputs(child.fail());
                outputEntries += child.outputEntryCount();

                if (log.isTraceEnabled()) {
                    log.trace("fail link: depth {} via '{}' -> depth {}", child.depth(), c, child.fail().depth());
                }
                queue.add(child);
            }
        }
        return outputEntries;
    }

    /**
     * Scans {@code text} and sums the scores of every matched pattern whose ordinal lies
     * in {@code [first, last]}.
     *
     * @return pattern to total score; patterns without an in-range match are absent
     * @throws OrdinalRangeException if {@code first > last} or either bound is outside
     *                               {@code [0, patternCount() - 1]}
     * @throws InvalidInputException if {@code text} is null
     * @throws ScoreOverflowException if a pattern's total does not fit in a {@code long}
     */
    public Map<String, Long> traverse(String text, int first, int last) {
        checkRange(first, last);
        if (text == null) {
            throw new InvalidInputException("text required");
        }

        boolean ignoreCase = configuration.ignoreCase();
        ScoreTally tally = new ScoreTally();
        TrieNode current = root;
        for (int i = 0; i < text.length(); i++) {
            char c = normalize(text.charAt(i), ignoreCase);
            while (current.child(c) == null && !current.isRoot()) {
                current = current.fail();
            }
            TrieNode next = current.child(c);
            if (next != null) {
                current = next;
            }
            // no child at the root: stay there
            emit(current, first, last, tally);
        }
        return tally.toMap();
    }

    /**
     * Scans {@code text} over the whole ordinal range. An automaton built from no
     * patterns yields an empty map.
     */
    public Map<String, Long> traverse(String text) {
        if (patterns.isEmpty()) {
            if (text == null) {
                throw new InvalidInputException("text required");
            }
            return Collections.emptyMap();
        }
        return traverse(text, 0, patterns.size() - 1);
    }

    private static void emit(TrieNode node, int first, int last, ScoreTally tally) {
        for (Map.Entry<String, List<ScoreEntry>> output : node.outputs().entrySet()) {
            for (ScoreEntry entry : output.getValue()) {
                if (entry.within(first, last)) {
                    tally.add(output.getKey(), entry.score());
                }
            }
        }
    }

    private void checkRange(int first, int last) {
        if (first > last || first < 0 || last > patterns.size() - 1) {
            throw new OrdinalRangeException(first, last, patterns.size());
        }
    }

    private static char normalize(char c, boolean ignoreCase) {
        return ignoreCase ? Character.toLowerCase(c) : c;
    }

    public int patternCount() {
        return patterns.size();
    }

    public int nodeCount() {
        return nodeCount;
    }

    public String pattern(int ordinal) {
        checkRange(ordinal, ordinal);
        return patterns.get(ordinal);
    }

    public long score(int ordinal) {
        checkRange(ordinal, ordinal);
        return scores[ordinal];
    }

    public AutomatonConfiguration configuration() {
        return configuration;
    }

    TrieNode root() {
        return root;
    }

    /**
     * Every node reachable from the root, in breadth-first order.
     */
    List<TrieNode> nodes() {
        List<TrieNode> nodes = new ArrayList<>(nodeCount);
        Queue<TrieNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            TrieNode node = queue.poll();
            nodes.add(node);
            queue.addAll(node.children().values());
        }
        return nodes;
    }

    @Override
    public String toString() {
        return "Automaton[patterns=" + patterns.size() + ", nodes=" + nodeCount + ", " + configuration + "]";
    }
}
