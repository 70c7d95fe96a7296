package com.jz.langid.classify;

import com.jz.langid.common.EmptyInputException;
import com.jz.langid.model.Vocabulary;

import java.util.List;
import java.util.OptionalInt;

public final class FrequencyVectorizer {
    private FrequencyVectorizer() {}

    /** 每个记号的增量为 MASS / T */
    public static final double MASS = 1000.0;

    /**
     * 词表外的记号不进向量，但计入 T；所以总质量不一定是 1000。
     * T = 0 时抛 {@link EmptyInputException}。
     */
    public static FrequencyVector vectorize(List<String> tokens, Vocabulary vocabulary) {
        int total = tokens == null ? 0 : tokens.size();
        if (total == 0) {
            throw new EmptyInputException("input has no tokens");
        }
        double increment = MASS / total;
        double[] values = new double[vocabulary.size()];
        int recognized = 0;
        for (String token : tokens) {
            OptionalInt id = vocabulary.lookup(token);
            if (id.isPresent()) {
                values[id.getAsInt()] += increment;
                recognized++;
            }
        }
        return new FrequencyVector(values, total, recognized);
    }
}
