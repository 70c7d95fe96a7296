package com.jz.langid.model;

/**
 * 决策树节点，两种形态：内部节点按阈值分叉，叶子给出 (label, weight)。
 * 原始文件里靠字段个数区分，加载时就转成这里的显式类型。
 */
public interface TreeNode {

    /** value <= threshold 走 left，否则走 right */
    record Internal(int featureId, double threshold, TreeNode left, TreeNode right) implements TreeNode {
    }

    record Leaf(int labelId, double weight) implements TreeNode {
    }
}
