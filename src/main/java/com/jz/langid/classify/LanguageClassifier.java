package com.jz.langid.classify;

import com.jz.langid.model.LanguageModel;

public interface LanguageClassifier {

    ClassificationResult classifyDetailed(LanguageModel model, String text);

    default String classify(LanguageModel model, String text) {
        return classifyDetailed(model, text).getLanguage();
    }
}
