package com.jz.langid.model;

import com.jz.langid.common.MalformedModelException;
import com.jz.langid.config.ModelProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageModelHolderTest {

    /** 记录加载次数，并故意放慢，放大并发窗口 */
    static class CountingLoader extends LanguageModelLoader {
        final AtomicInteger loads = new AtomicInteger();
        final boolean broken;

        CountingLoader(boolean broken) {
            this.broken = broken;
        }

        @Override
        public LanguageModel load(Resource resource) {
            loads.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (broken) throw new MalformedModelException("leaf references unknown label id 99");
            return parse(TestModels.TINY, resource.getDescription());
        }
    }

    private static LanguageModelHolder holder(CountingLoader loader, boolean eager) {
        ModelProperties props = new ModelProperties();
        props.setLocation("classpath:model/any.json");
        props.setEagerLoad(eager);
        return new LanguageModelHolder(props, loader, new DefaultResourceLoader());
    }

    @Test
    void buildsModelOnceUnderConcurrentFirstAccess() throws Exception {
        CountingLoader loader = new CountingLoader(false);
        LanguageModelHolder holder = holder(loader, false);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LanguageModel>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return holder.get();
                }));
            }
            start.countDown();

            LanguageModel first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<LanguageModel> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loader.loads.get()).isEqualTo(1);
        assertThat(holder.isLoaded()).isTrue();
    }

    @Test
    void remembersLoadFailure() {
        CountingLoader loader = new CountingLoader(true);
        LanguageModelHolder holder = holder(loader, false);

        assertThatThrownBy(holder::get).isInstanceOf(MalformedModelException.class);
        assertThatThrownBy(holder::get)
                .isInstanceOf(MalformedModelException.class)
                .hasMessageContaining("unavailable");
        assertThat(loader.loads.get()).isEqualTo(1);
        assertThat(holder.isLoaded()).isFalse();
    }

    @Test
    void unexpectedLoaderErrorIsWrappedAndRemembered() {
        AtomicInteger loads = new AtomicInteger();
        LanguageModelLoader exploding = new LanguageModelLoader() {
            @Override
            public LanguageModel load(Resource resource) {
                loads.incrementAndGet();
                throw new IllegalStateException("resource backend down");
            }
        };
        ModelProperties props = new ModelProperties();
        props.setEagerLoad(false);
        LanguageModelHolder holder = new LanguageModelHolder(props, exploding, new DefaultResourceLoader());

        assertThatThrownBy(holder::get)
                .isInstanceOf(MalformedModelException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(holder::get)
                .isInstanceOf(MalformedModelException.class)
                .hasMessageContaining("unavailable");
        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void eagerLoadHappensOnInit() {
        CountingLoader loader = new CountingLoader(false);
        LanguageModelHolder holder = holder(loader, true);

        holder.init();

        assertThat(holder.isLoaded()).isTrue();
        assertThat(loader.loads.get()).isEqualTo(1);
    }

    @Test
    void lazyHolderWaitsForFirstCall() {
        CountingLoader loader = new CountingLoader(false);
        LanguageModelHolder holder = holder(loader, false);

        holder.init();

        assertThat(holder.isLoaded()).isFalse();
        assertThat(loader.loads.get()).isZero();
    }

    @Test
    void eagerLoadOfBrokenModelFailsInit() {
        LanguageModelHolder holder = holder(new CountingLoader(true), true);

        assertThatThrownBy(holder::init).isInstanceOf(MalformedModelException.class);
    }
}
