package com.jz.langid.domain.vo;

import com.jz.langid.classify.ClassificationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionVO {
    private String language;
    private int tokens;
    private int recognized;
    private Map<String, Double> scores;

    public static DetectionVO from(ClassificationResult r) {
        return new DetectionVO(r.getLanguage(), r.getTokenCount(), r.getRecognizedCount(), r.getScores());
    }
}
