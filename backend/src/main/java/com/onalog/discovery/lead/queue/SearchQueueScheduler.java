package com.onalog.discovery.lead.queue;

import com.onalog.discovery.config.DiscoveryProperties;
import com.onalog.discovery.lead.model.QueueEntry;
import com.onalog.discovery.lead.model.QueueSnapshot;
import com.onalog.discovery.lead.model.SearchJob;
import com.onalog.discovery.lead.model.SearchJobStatus;
import com.onalog.discovery.lead.persistence.SearchJobRepository;
import com.onalog.discovery.lead.pipeline.BackgroundFillRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dispatches queued search jobs one at a time, round-robin across tenants. While a job's foreground
 * phase runs every background fill is paused; after it finishes the processing flag stays held for
 * the cooldown before the next job is picked.
 */
@Service
public class SearchQueueScheduler {
    private static final Logger log = LoggerFactory.getLogger(SearchQueueScheduler.class);

    private final SchedulerState state = new SchedulerState();
    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final SearchJobRepository searchJobRepository;
    private final SearchJobProcessor searchJobProcessor;
    private final BackgroundFillRegistry backgroundFillRegistry;
    private final ExecutorService schedulerExecutor;
    private final ScheduledExecutorService schedulerTimer;
    private final DiscoveryProperties properties;
    private volatile Long activeSearchJobId;

    public SearchQueueScheduler(
        SearchJobRepository searchJobRepository,
        SearchJobProcessor searchJobProcessor,
        BackgroundFillRegistry backgroundFillRegistry,
        @Qualifier("schedulerExecutor") ExecutorService schedulerExecutor,
        @Qualifier("schedulerTimer") ScheduledExecutorService schedulerTimer,
        DiscoveryProperties properties
    ) {
        this.searchJobRepository = searchJobRepository;
        this.searchJobProcessor = searchJobProcessor;
        this.backgroundFillRegistry = backgroundFillRegistry;
        this.schedulerExecutor = schedulerExecutor;
        this.schedulerTimer = schedulerTimer;
        this.properties = properties;
    }

    /**
     * Adds a job to its tenant's line. Returns null when the job does not exist.
     */
    public QueueEntry enqueue(long searchJobId, String tenantId) {
        SearchJob job = searchJobRepository.findById(searchJobId);
        if (job == null) {
            log.warn("Cannot enqueue search job {}: not found", searchJobId);
            return null;
        }
        QueueEntry entry = new QueueEntry(searchJobId, resolveTenant(tenantId, job), job.priority(), Instant.now());
        state.enqueue(entry);
        if (processing.get() || state.queuePosition(searchJobId) > 1) {
            searchJobRepository.updateStatus(searchJobId, SearchJobStatus.QUEUED);
        }
        log.info(
            "Queued search job {} for tenant {} (priority {}, position {})",
            searchJobId,
            entry.tenantId(),
            entry.priority(),
            state.queuePosition(searchJobId)
        );
        if (properties.getScheduler().isAutoDispatch()) {
            triggerDispatch();
        }
        return entry;
    }

    public boolean cancel(long searchJobId) {
        return state.remove(searchJobId);
    }

    public void triggerDispatch() {
        if (stopping.get() || processing.get()) {
            return;
        }
        try {
            schedulerExecutor.execute(this::dispatch);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler executor rejected dispatch", e);
        }
    }

    /**
     * Runs the next job's foreground phase on the calling thread. Returns false without doing anything
     * when another job holds the processing flag or nothing is queued.
     */
    public boolean dispatch() {
        if (!processing.compareAndSet(false, true)) {
            return false;
        }
        QueueEntry next = state.pollNext();
        if (next == null) {
            processing.set(false);
            return false;
        }
        activeSearchJobId = next.searchJobId();
        backgroundFillRegistry.pauseAll();
        try {
            searchJobProcessor.process(next.searchJobId());
        } catch (Exception e) {
            log.warn("Dispatch of search job {} failed", next.searchJobId(), e);
            markFailedQuietly(next.searchJobId(), e);
        } finally {
            activeSearchJobId = null;
            backgroundFillRegistry.resumeAll();
        }
        startCooldown();
        return true;
    }

    public int queuePosition(long searchJobId) {
        return state.queuePosition(searchJobId);
    }

    public int userQueuePosition(long searchJobId, String tenantId) {
        return state.userQueuePosition(searchJobId, tenantId);
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(
            processing.get(),
            activeSearchJobId,
            state.size(),
            state.tenantQueues(),
            backgroundFillRegistry.pausedJobIds()
        );
    }

    @PreDestroy
    public void stopOnShutdown() {
        stopping.set(true);
        int remaining = state.size();
        if (remaining > 0) {
            log.info("Scheduler stopping with {} queued search jobs left in memory", remaining);
        }
    }

    private void startCooldown() {
        long cooldownMs = properties.getScheduler().getCooldownMs();
        if (cooldownMs <= 0 || stopping.get()) {
            finishCycle();
            return;
        }
        try {
            schedulerTimer.schedule(this::finishCycle, cooldownMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler timer rejected cooldown", e);
            finishCycle();
        }
    }

    private void finishCycle() {
        processing.set(false);
        if (properties.getScheduler().isAutoDispatch() && !state.isEmpty()) {
            triggerDispatch();
        }
    }

    private String resolveTenant(String tenantId, SearchJob job) {
        if (tenantId != null && !tenantId.isBlank()) {
            return tenantId.trim();
        }
        if (job.tenantOwner() != null && !job.tenantOwner().isBlank()) {
            return job.tenantOwner().trim();
        }
        return properties.getScheduler().getAnonymousTenant();
    }

    private void markFailedQuietly(long searchJobId, Exception cause) {
        try {
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            searchJobRepository.markFailed(searchJobId, message);
        } catch (Exception e) {
            log.warn("Could not mark search job {} failed", searchJobId, e);
        }
    }
}
