package com.onalog.discovery.lead.pipeline;

import com.onalog.discovery.config.DiscoveryProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Background fills currently running, each with its own pause gate.
 */
@Component
public class BackgroundFillRegistry {
    private final Map<Long, PauseGate> gates = new ConcurrentHashMap<>();
    private final ScheduledExecutorService schedulerTimer;
    private final DiscoveryProperties properties;

    public BackgroundFillRegistry(
        @Qualifier("schedulerTimer") ScheduledExecutorService schedulerTimer,
        DiscoveryProperties properties
    ) {
        this.schedulerTimer = schedulerTimer;
        this.properties = properties;
    }

    public PauseGate register(long searchJobId) {
        return gates.computeIfAbsent(searchJobId, id -> new PauseGate(
            id,
            schedulerTimer,
            Duration.ofSeconds(properties.getPipeline().getPauseFailsafeSeconds())
        ));
    }

    public void deregister(long searchJobId) {
        PauseGate gate = gates.remove(searchJobId);
        if (gate != null) {
            gate.resume();
        }
    }

    boolean isRegistered(long searchJobId) {
        return gates.containsKey(searchJobId);
    }

    public void pauseAll() {
        gates.values().forEach(PauseGate::pause);
    }

    public void resumeAll() {
        gates.values().forEach(PauseGate::resume);
    }

    public List<Long> pausedJobIds() {
        return gates.entrySet().stream()
            .filter(entry -> entry.getValue().isPaused())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }
}
