package com.jz.langid.classify;

import lombok.*;

import java.util.Map;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ClassificationResult {
    private String language;        // 胜出的语言名
    private int tokenCount;         // T：single + pair 总数
    private int recognizedCount;    // 命中词表的记号数
    /** 语言名 -> 累计投票权重，按森林中首次出现的顺序 */
    private Map<String, Double> scores;
}
