package com.jz.langid.model;

import java.util.List;

/** 有序的树集合；顺序决定平票时谁先出现 */
public final class Forest {
    private final List<DecisionTree> trees;

    public Forest(List<DecisionTree> trees) {
        this.trees = List.copyOf(trees);
    }

    public List<DecisionTree> trees() {
        return trees;
    }

    public int size() {
        return trees.size();
    }

    public int totalNodes() {
        return trees.stream().mapToInt(DecisionTree::nodeCount).sum();
    }

    public int maxDepth() {
        return trees.stream().mapToInt(DecisionTree::depth).max().orElse(0);
    }
}
