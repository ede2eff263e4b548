package com.questrail.gs1.catalog;

import com.questrail.gs1.api.ApplicationIdentifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Digit trie over AI codes. Depth is bounded by the longest AI (4 digits), so
 * every lookup is constant time.
 */
final class AiTrie
{
    static final int MAX_DEPTH = 4;

    private static final class Node
    {
        private final Node[] children = new Node[10];
        private ApplicationIdentifier definition;
    }

    private final Node root = new Node();

    void insert(ApplicationIdentifier definition)
    {
        Node node = root;
        String code = definition.code();
        for (int i = 0; i < code.length(); i++) {
            int digit = code.charAt(i) - '0';
            if (node.children[digit] == null) {
                node.children[digit] = new Node();
            }
            node = node.children[digit];
        }
        node.definition = definition;
    }

    /**
     * Returns the longest registered code starting at {@code pos}. A node
     * that is only a prefix of longer codes never matches.
     */
    Optional<ApplicationIdentifier> longestMatch(CharSequence text, int pos)
    {
        ApplicationIdentifier best = null;
        Node node = root;
        int limit = Math.min(text.length(), pos + MAX_DEPTH);
        for (int i = pos; i < limit; i++) {
            int digit = text.charAt(i) - '0';
            if (digit < 0 || digit > 9 || node.children[digit] == null) {
                break;
            }
            node = node.children[digit];
            if (node.definition != null) {
                best = node.definition;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns every registered code starting at {@code pos}, longest first.
     */
    List<ApplicationIdentifier> allMatches(CharSequence text, int pos)
    {
        List<ApplicationIdentifier> found = new ArrayList<>(2);
        Node node = root;
        int limit = Math.min(text.length(), pos + MAX_DEPTH);
        for (int i = pos; i < limit; i++) {
            int digit = text.charAt(i) - '0';
            if (digit < 0 || digit > 9 || node.children[digit] == null) {
                break;
            }
            node = node.children[digit];
            if (node.definition != null) {
                found.add(0, node.definition);
            }
        }
        return found;
    }
}
