package com.jz.langid.model;

import com.jz.langid.classify.FrequencyVector;

public final class DecisionTree {
    private final TreeNode root;
    private final int nodeCount;
    private final int depth;

    public DecisionTree(TreeNode root) {
        if (root == null) throw new IllegalArgumentException("root is null");
        this.root = root;
        this.nodeCount = count(root);
        this.depth = depthOf(root);
    }

    /** 从根走到叶子；未出现的特征取 0 */
    public TreeNode.Leaf evaluate(FrequencyVector vector) {
        TreeNode node = root;
        while (node instanceof TreeNode.Internal in) {
            node = vector.get(in.featureId()) <= in.threshold() ? in.left() : in.right();
        }
        return (TreeNode.Leaf) node;
    }

    public TreeNode root() {
        return root;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int depth() {
        return depth;
    }

    private static int count(TreeNode node) {
        if (node instanceof TreeNode.Internal in) {
            return 1 + count(in.left()) + count(in.right());
        }
        return 1;
    }

    private static int depthOf(TreeNode node) {
        if (node instanceof TreeNode.Internal in) {
            return 1 + Math.max(depthOf(in.left()), depthOf(in.right()));
        }
        return 1;
    }
}
