package com.jz.langid.classify;

/** 单次调用的词频向量，按词表 id 稠密存放，用完即弃 */
public final class FrequencyVector {
    private final double[] values;
    private final int tokenCount;
    private final int recognizedCount;

    FrequencyVector(double[] values, int tokenCount, int recognizedCount) {
        this.values = values;
        this.tokenCount = tokenCount;
        this.recognizedCount = recognizedCount;
    }

    /** 词表外或未出现的 id 取 0 */
    public double get(int featureId) {
        return featureId >= 0 && featureId < values.length ? values[featureId] : 0.0;
    }

    public int dimension() {
        return values.length;
    }

    /** 总质量 = 1000 * 识别比例 */
    public double total() {
        double sum = 0;
        for (double v : values) sum += v;
        return sum;
    }

    /** 参与计数的记号总数 T（含词表外的） */
    public int tokenCount() {
        return tokenCount;
    }

    public int recognizedCount() {
        return recognizedCount;
    }
}
