package com.phillippitts.sessionrecorder.config;

import com.phillippitts.sessionrecorder.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateTranscriptionExecutorWithDefaults() {
        Executor executor = config.transcriptionExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(2);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("transcription-");
        taskExecutor.shutdown();
    }

    @Test
    void recorderLoopShouldRunTasksOneAtATimeInOrder() throws InterruptedException {
        ThreadPoolTaskExecutor loop = (ThreadPoolTaskExecutor) config.recorderLoopExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();

        for (int i = 0; i < taskCount; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).isSorted().hasSize(taskCount);
        assertThat(threads).allMatch(name -> name.startsWith("recorder-loop-"));
        assertThat(loop.getMaxPoolSize()).isEqualTo(1);
        loop.shutdown();
    }

    @Test
    void shouldCreatePresentationScheduler() {
        TaskScheduler scheduler = config.presentationScheduler();

        assertThat(scheduler).isInstanceOf(ThreadPoolTaskScheduler.class);
        assertThat(((ThreadPoolTaskScheduler) scheduler).getThreadNamePrefix()).isEqualTo("presentation-");
        ((ThreadPoolTaskScheduler) scheduler).shutdown();
    }

    @Test
    void decoratorShouldCopyContextAndRestoreWorkerContext() {
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagating();
        ThreadContext.put("recordingSession", "abc");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable decorated = decorator.decorate(() -> seen.set(ThreadContext.get("recordingSession")));

        // Run on a "worker" whose own context differs
        ThreadContext.clearAll();
        ThreadContext.put("worker", "yes");
        decorated.run();

        assertThat(seen.get()).isEqualTo("abc");
        assertThat(ThreadContext.get("recordingSession")).isNull();
        assertThat(ThreadContext.get("worker")).isEqualTo("yes");
    }
}
