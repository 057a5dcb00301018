package com.clouddeploy.pipeline;

import com.clouddeploy.config.PlatformProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-memory queue of deployment runs consumed by a fixed set of
 * worker threads.
 *
 * Scheduling never blocks: a full queue rejects the job. A worker runs one
 * lifecycle at a time and survives any error the run raises.
 */
@Slf4j
@Component
public class DeploymentQueue implements DeploymentScheduler {

    private static final long POLL_TIMEOUT_MS = 100;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final DeploymentLifecycle lifecycle;
    private final Clock clock;
    private final int workerCount;
    private final BlockingQueue<DeploymentJob> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();

    public DeploymentQueue(DeploymentLifecycle lifecycle, PlatformProperties properties, Clock clock) {
        PlatformProperties.Deployment config = properties.getDeployment();
        this.lifecycle = lifecycle;
        this.clock = clock;
        this.workerCount = Math.max(1, config.getWorkers());
        this.queue = new ArrayBlockingQueue<>(Math.max(1, config.getQueueCapacity()));
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(this::runWorker, "deployment-worker-" + i);
            worker.start();
            workers.add(worker);
        }
        log.info("Deployment queue started with capacity {} and {} workers",
                queue.remainingCapacity() + queue.size(), workerCount);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Deployment queue shutdown initiated");
        for (Thread worker : workers) {
            try {
                worker.join(SHUTDOWN_GRACE.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {}", worker.getName());
                break;
            }
        }
        workers.clear();

        // Jobs never picked up are ended as failed instead of staying pending
        DeploymentJob job;
        while ((job = queue.poll()) != null) {
            abandon(job, "platform is shutting down");
        }
        log.info("Deployment queue stopped");
    }

    @Override
    public boolean scheduleDeploymentRun(UUID deploymentId, UUID appId) {
        DeploymentJob job = new DeploymentJob(deploymentId, appId, clock.instant());
        if (!queue.offer(job)) {
            rejected.incrementAndGet();
            log.warn("Deployment queue full, rejected deployment {}", deploymentId);
            return false;
        }
        accepted.incrementAndGet();
        log.debug("Queued deployment {} (depth {})", deploymentId, queue.size());
        return true;
    }

    public int getDepth() {
        return queue.size();
    }

    public long getAcceptedCount() {
        return accepted.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    private void runWorker() {
        log.info("Deployment worker {} started", Thread.currentThread().getName());

        while (running.get()) {
            try {
                // Block until a job is available (with timeout to check running flag)
                DeploymentJob job = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (job != null) {
                    process(job);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Deployment worker {} interrupted", Thread.currentThread().getName());
                break;
            }
        }

        log.info("Deployment worker {} stopped", Thread.currentThread().getName());
    }

    private void process(DeploymentJob job) {
        log.debug("Running deployment {} after {} ms in queue", job.deploymentId(),
                Duration.between(job.enqueuedAt(), clock.instant()).toMillis());
        try {
            lifecycle.run(job).block();
        } catch (RuntimeException e) {
            log.error("Deployment run {} raised an uncontained error", job.deploymentId(), e);
        } finally {
            completed.incrementAndGet();
        }
    }

    private void abandon(DeploymentJob job, String reason) {
        try {
            lifecycle.abandon(job, reason).block(SHUTDOWN_GRACE);
        } catch (RuntimeException e) {
            log.error("Could not abandon deployment {}", job.deploymentId(), e);
        }
    }
}
