package com.jz.langid.model;

import com.jz.langid.common.MalformedModelException;
import com.jz.langid.config.ModelProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * 进程内唯一的模型句柄。
 * - 至多构建一次（双重检查 + volatile），并发的首批调用方会等待构建完成，看不到半成品
 * - 构建失败会被记住，之后的调用一律失败，不会反复重试
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LanguageModelHolder {
    private final ModelProperties props;
    private final LanguageModelLoader loader;
    private final ResourceLoader resourceLoader;

    private final Object lock = new Object();
    private volatile LanguageModel model;
    private volatile MalformedModelException failure;

    @PostConstruct
    public void init() {
        if (props.isEagerLoad()) {
            get();
        }
    }

    public LanguageModel get() {
        LanguageModel m = model;
        if (m != null) return m;
        synchronized (lock) {
            if (model != null) return model;
            if (failure != null) {
                throw new MalformedModelException("language model unavailable: " + failure.getMessage(), failure);
            }
            long t0 = System.currentTimeMillis();
            try {
                m = loader.load(resourceLoader.getResource(props.getLocation()));
            } catch (RuntimeException e) {
                MalformedModelException mme = e instanceof MalformedModelException m1
                        ? m1
                        : new MalformedModelException("load model " + props.getLocation() + " failed: " + e, e);
                failure = mme;
                log.error("load language model failed, location={}, err={}", props.getLocation(), e.toString(), e);
                throw mme;
            }
            log.info("language model loaded from {} in {} ms: vocabulary={}, trees={}, nodes={}, maxDepth={}, labels={}",
                    m.source(), System.currentTimeMillis() - t0, m.vocabulary().size(), m.forest().size(),
                    m.forest().totalNodes(), m.forest().maxDepth(), m.labels().size());
            model = m;
            return m;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }
}
