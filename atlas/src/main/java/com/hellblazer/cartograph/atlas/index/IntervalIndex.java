/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cartograph.atlas.index;

import com.hellblazer.cartograph.atlas.RangeRule;
import com.hellblazer.cartograph.common.Interval;
import com.hellblazer.cartograph.common.OverlapPolicy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An augmented binary search tree of {@link RangeRule}s, ordered by the start of each rule's source interval. Every
 * node records the largest source end found in its subtree, which lets queries skip subtrees that end before the
 * query begins.
 * <p>
 * The first rule inserted becomes the root and the shape follows insertion order; the tree is never rebalanced.
 * Tables hold tens of rules, so the worst case chain is short.
 * <p>
 * Rules with an empty source interval cover no values and are not stored.
 *
 * @author hal.hildebrand
 */
public class IntervalIndex {

    static class Node {
        private final RangeRule rule;
        private Node            left;
        private long            maxEnd;
        private Node            right;

        Node(RangeRule rule) {
            this.rule = rule;
            this.maxEnd = rule.source().end();
        }

        long maxEnd() {
            return maxEnd;
        }

        RangeRule rule() {
            return rule;
        }

        long start() {
            return rule.source().start();
        }

        @Override
        public String toString() {
            return rule.source() + " max=" + maxEnd;
        }
    }

    /**
     * Build an index by inserting the rules in iteration order
     */
    public static IntervalIndex of(Collection<RangeRule> rules, OverlapPolicy policy) {
        var index = new IntervalIndex(policy);
        for (var rule : rules) {
            index.insert(rule);
        }
        return index;
    }

    private final OverlapPolicy policy;
    private Node                root;
    private int                 size;

    public IntervalIndex() {
        this(OverlapPolicy.STRICT);
    }

    public IntervalIndex(OverlapPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Overlap policy cannot be null");
    }

    /**
     * Find every stored rule whose source overlaps the query, restricted to the overlapping portion. Each result maps
     * a sub interval of the query onto the corresponding sub interval of that rule's target.
     *
     * @param query - the source space interval
     * @return the restricted rules, in no particular order
     */
    public List<RangeRule> findIntersections(Interval query) {
        Objects.requireNonNull(query, "Query cannot be null");
        var intersections = new ArrayList<RangeRule>();
        if (root == null) {
            return intersections;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            node.rule.source()
                     .intersect(query, policy)
                     .filter(i -> !i.isEmpty())
                     .flatMap(node.rule::subrangeMap)
                     .ifPresent(intersections::add);
            if (node.right != null && policy.reaches(node.right.maxEnd, query)) {
                pending.push(node.right);
            }
            if (node.left != null && policy.reaches(node.left.maxEnd, query)) {
                pending.push(node.left);
            }
        }
        return intersections;
    }

    /**
     * Find some stored rule overlapping the query by a single descent of the tree
     *
     * @return the first overlapping rule encountered, or empty if none overlaps
     */
    public Optional<RangeRule> findOverlapping(Interval query) {
        Objects.requireNonNull(query, "Query cannot be null");
        var node = root;
        while (node != null) {
            if (node.rule.source().overlaps(query, policy)) {
                return Optional.of(node.rule);
            }
            if (node.left != null && policy.reaches(node.left.maxEnd, query)) {
                node = node.left;
            } else {
                node = node.right;
            }
        }
        return Optional.empty();
    }

    public OverlapPolicy getPolicy() {
        return policy;
    }

    /**
     * @return the number of nodes on the longest root to leaf path
     */
    public int height() {
        return height(root);
    }

    /**
     * @return false if the rule's source is empty, and so not stored
     */
    public boolean insert(RangeRule rule) {
        Objects.requireNonNull(rule, "Rule cannot be null");
        if (rule.source().isEmpty()) {
            return false;
        }
        size++;
        if (root == null) {
            root = new Node(rule);
            return true;
        }
        var node = root;
        for (;;) {
            node.maxEnd = Math.max(node.maxEnd, rule.source().end());
            if (rule.source().start() < node.start()) {
                if (node.left == null) {
                    node.left = new Node(rule);
                    return true;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = new Node(rule);
                    return true;
                }
                node = node.right;
            }
        }
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * The largest source end stored in the index, or zero when empty
     */
    public long maxEnd() {
        return root == null ? 0 : root.maxEnd;
    }

    /**
     * @return the stored rules in order of source start
     */
    public List<RangeRule> rules() {
        var rules = new ArrayList<RangeRule>(size);
        inOrder(root, n -> rules.add(n.rule));
        return rules;
    }

    public int size() {
        return size;
    }

    @Override
    public String toString() {
        var buf = new StringBuilder("IntervalIndex[");
        inOrder(root, n -> {
            if (buf.length() > "IntervalIndex[".length()) {
                buf.append(", ");
            }
            buf.append(n);
        });
        return buf.append(']').toString();
    }

    Node root() {
        return root;
    }

    private int height(Node node) {
        if (node == null) {
            return 0;
        }
        return 1 + Math.max(height(node.left), height(node.right));
    }

    private void inOrder(Node node, Consumer<Node> visitor) {
        Deque<Node> stack = new ArrayDeque<>();
        var current = node;
        while (current != null || !stack.isEmpty()) {
            while (current != null) {
                stack.push(current);
                current = current.left;
            }
            current = stack.pop();
            visitor.accept(current);
            current = current.right;
        }
    }
}
