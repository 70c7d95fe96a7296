package com.jz.langid.model;

import com.jz.langid.classify.FrequencyVector;
import com.jz.langid.classify.FrequencyVectorizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionTreeTest {

    private final Vocabulary vocabulary = Vocabulary.of(Map.of("a", 0, "b", 1));

    // a 占 2/4 -> 500.0，b 未出现 -> 0
    private final FrequencyVector vector = FrequencyVectorizer.vectorize(List.of("a", "a", "z", "z"), vocabulary);

    private static DecisionTree split(int feature, double threshold) {
        return new DecisionTree(new TreeNode.Internal(feature, threshold,
                new TreeNode.Leaf(0, 1.0), new TreeNode.Leaf(1, 2.0)));
    }

    @Test
    void goesLeftWhenValueEqualsThreshold() {
        assertThat(split(0, 500.0).evaluate(vector)).isEqualTo(new TreeNode.Leaf(0, 1.0));
    }

    @Test
    void goesRightWhenValueExceedsThreshold() {
        assertThat(split(0, 499.9).evaluate(vector)).isEqualTo(new TreeNode.Leaf(1, 2.0));
    }

    @Test
    void absentFeatureReadsAsZero() {
        assertThat(split(1, 0.0).evaluate(vector).labelId()).isZero();
    }

    @Test
    void walksNestedNodes() {
        TreeNode root = new TreeNode.Internal(0, 100.0,
                new TreeNode.Leaf(0, 0.1),
                new TreeNode.Internal(1, 0.0, new TreeNode.Leaf(1, 0.7), new TreeNode.Leaf(0, 0.3)));
        DecisionTree tree = new DecisionTree(root);

        assertThat(tree.evaluate(vector)).isEqualTo(new TreeNode.Leaf(1, 0.7));
        assertThat(tree.nodeCount()).isEqualTo(5);
        assertThat(tree.depth()).isEqualTo(3);
    }

    @Test
    void leafOnlyTreeReturnsItsLeaf() {
        DecisionTree tree = new DecisionTree(new TreeNode.Leaf(1, 0.25));
        assertThat(tree.evaluate(vector)).isEqualTo(new TreeNode.Leaf(1, 0.25));
    }
}
