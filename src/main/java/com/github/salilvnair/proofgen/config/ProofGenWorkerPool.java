package com.github.salilvnair.proofgen.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool shared by parallel guard evaluation and per-rule rendering. Sized to the available cores
 * unless {@code proofgen.worker.threads} says otherwise; a saturated queue runs the task on the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProofGenWorkerPool {

    private final ProofGenConfig config;

    private volatile ThreadPoolExecutor executor;

    @PostConstruct
    public void init() {
        ProofGenConfig.Worker worker = config.getWorker();
        int threads = worker.getThreads() > 0 ? worker.getThreads() : Runtime.getRuntime().availableProcessors();
        int queueCapacity = Math.max(1, worker.getQueueCapacity());
        long keepAliveSeconds = Math.max(0, worker.getKeepAliveSeconds());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "proofgen-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        executor = new ThreadPoolExecutor(
                threads,
                threads,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        log.debug("ProofGen worker pool started with {} threads", threads);
    }

    public ExecutorService executor() {
        if (executor == null) {
            init();
        }
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
    }
}
