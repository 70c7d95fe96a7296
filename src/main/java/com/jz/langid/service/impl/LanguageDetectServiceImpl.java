package com.jz.langid.service.impl;


import com.jz.langid.classify.ClassificationResult;
import com.jz.langid.classify.LanguageClassifier;
import com.jz.langid.common.EmptyInputException;
import com.jz.langid.config.ClassifyProperties;
import com.jz.langid.model.LanguageModelHolder;
import com.jz.langid.service.LanguageDetectService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class LanguageDetectServiceImpl implements LanguageDetectService {
    private final LanguageModelHolder modelHolder;
    private final LanguageClassifier classifier;
    private final ClassifyProperties props;
    private final Executor classifyExecutor;
    private final MeterRegistry meterRegistry;

    private Timer classifyTimer;
    private Counter classifyCounter;
    private Counter rejectedCounter;

    public LanguageDetectServiceImpl(LanguageModelHolder modelHolder,
                                     LanguageClassifier classifier,
                                     ClassifyProperties props,
                                     @Qualifier("classifyExecutor") Executor classifyExecutor,
                                     MeterRegistry meterRegistry) {
        this.modelHolder = modelHolder;
        this.classifier = classifier;
        this.props = props;
        this.classifyExecutor = classifyExecutor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        this.classifyTimer = Timer.builder("langid.classify.latency")
                .description("单次识别耗时")
                .register(meterRegistry);
        this.classifyCounter = Counter.builder("langid.classify.count")
                .description("识别成功次数")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("langid.classify.rejected.count")
                .description("空输入被拒次数")
                .register(meterRegistry);
    }

    @Override
    public String classifyText(String text) {
        return detect(text).getLanguage();
    }

    @Override
    public String classifyBuffer(Reader source) {
        StringWriter sw = new StringWriter();
        try {
            source.transferTo(sw);
        } catch (IOException e) {
            throw new UncheckedIOException("read buffer failed", e);
        }
        return classifyText(sw.toString());
    }

    @Override
    public ClassificationResult detect(String text) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ClassificationResult r = classifier.classifyDetailed(modelHolder.get(), truncate(text));
            classifyCounter.increment();
            return r;
        } catch (EmptyInputException e) {
            rejectedCounter.increment();
            throw e;
        } finally {
            sample.stop(classifyTimer);
        }
    }

    @Override
    public List<ClassificationResult> detectBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) return List.of();
        List<CompletableFuture<ClassificationResult>> futures = texts.stream()
                .map(t -> CompletableFuture.supplyAsync(() -> detect(t), classifyExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            // 把任务里的业务异常原样抛出
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    @Override
    public List<String> labels() {
        return modelHolder.get().labels().symbols();
    }

    private String truncate(String text) {
        int max = props.getMaxChars();
        if (text == null || max <= 0 || text.length() <= max) return text;
        int end = max;
        // 不把代理对切成两半
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        log.debug("input truncated from {} to {} chars", text.length(), end);
        return text.substring(0, end);
    }
}
