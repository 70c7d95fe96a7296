package com.jz.langid.classify;


import com.jz.langid.model.LanguageModel;
import com.jz.langid.tokens.Tokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 文本 -> 记号 -> 词频向量 -> 森林投票 -> 语言名。
 * 不持有可变状态，模型由调用方传入，可多线程并发调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForestLanguageClassifier implements LanguageClassifier {
    private final Tokenizer tokenizer;

    @Override
    public ClassificationResult classifyDetailed(LanguageModel model, String text) {
        List<String> tokens = tokenizer.tokenize(text);
        FrequencyVector vector = FrequencyVectorizer.vectorize(tokens, model.vocabulary());
        VoteTally tally = ForestVoter.vote(model.forest(), vector, model.labels());
        String language = model.labels().resolve(tally.winner());
        if (log.isDebugEnabled()) {
            log.debug("classified {} tokens ({} known) as {}", vector.tokenCount(), vector.recognizedCount(), language);
        }
        return ClassificationResult.builder()
                .language(language)
                .tokenCount(vector.tokenCount())
                .recognizedCount(vector.recognizedCount())
                .scores(tally.toScores(model.labels()))
                .build();
    }
}
