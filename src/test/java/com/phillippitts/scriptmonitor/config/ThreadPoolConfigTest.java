package com.phillippitts.scriptmonitor.config;

import com.phillippitts.scriptmonitor.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).connectionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(8);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("monitor-conn-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRunOnCallerWhenAllWorkersBusy() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getConnection().setCorePoolSize(1);
        properties.getConnection().setMaxPoolSize(1);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(properties).connectionExecutor();

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> overflowThread = new AtomicReference<>();
        try {
            executor.execute(() -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            executor.execute(() -> overflowThread.set(Thread.currentThread().getName()));

            assertThat(overflowThread.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentConnections() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).connectionExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);
        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    completedTasks.incrementAndGet();
                    latch.countDown();
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(completedTasks.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void decoratorPropagatesAndRestoresThreadContext() {
        ThreadContext.put("connectionId", "conn-7");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator()
                .decorate(() -> assertThat(ThreadContext.get("connectionId")).isEqualTo("conn-7"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "outer");

        decorated.run();

        assertThat(ThreadContext.get("connectionId")).isNull();
        assertThat(ThreadContext.get("requestId")).isEqualTo("outer");
    }
}
