package com.jz.langid.classify;

import com.jz.langid.model.DecisionTree;
import com.jz.langid.model.Forest;
import com.jz.langid.model.LabelTable;
import com.jz.langid.model.TreeNode;

public final class ForestVoter {
    private ForestVoter() {}

    /** 按森林顺序逐棵求值，叶子权重累加到对应 label */
    public static VoteTally vote(Forest forest, FrequencyVector vector, LabelTable labels) {
        VoteTally tally = new VoteTally(labels.capacity());
        for (DecisionTree tree : forest.trees()) {
            TreeNode.Leaf leaf = tree.evaluate(vector);
            tally.add(leaf.labelId(), leaf.weight());
        }
        return tally;
    }
}
