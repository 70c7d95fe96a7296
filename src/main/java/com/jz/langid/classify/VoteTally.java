package com.jz.langid.classify;

import com.jz.langid.model.LabelTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各 label 的累计权重，按 label id 稠密存放，同时记住每个 label 第一次出现的次序。
 * 选胜者时按首次出现顺序扫描，只有严格更大才替换：平票时先出现的赢。
 */
public final class VoteTally {
    private final double[] totals;
    private final boolean[] seen;
    private final int[] order;
    private int seenCount;

    VoteTally(int labelCapacity) {
        this.totals = new double[labelCapacity];
        this.seen = new boolean[labelCapacity];
        this.order = new int[labelCapacity];
    }

    void add(int labelId, double weight) {
        if (!seen[labelId]) {
            seen[labelId] = true;
            order[seenCount++] = labelId;
        }
        totals[labelId] += weight;
    }

    public int winner() {
        if (seenCount == 0) throw new IllegalStateException("no votes");
        int best = order[0];
        for (int i = 1; i < seenCount; i++) {
            int id = order[i];
            if (totals[id] > totals[best]) best = id;
        }
        return best;
    }

    public double total(int labelId) {
        return totals[labelId];
    }

    /** 出现过的 label 个数 */
    public int size() {
        return seenCount;
    }

    /** 语言名 -> 累计权重，按首次出现顺序 */
    public Map<String, Double> toScores(LabelTable labels) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < seenCount; i++) {
            out.put(labels.resolve(order[i]), totals[order[i]]);
        }
        return out;
    }
}
