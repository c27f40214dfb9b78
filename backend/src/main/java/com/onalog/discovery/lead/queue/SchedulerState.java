package com.onalog.discovery.lead.queue;

import com.onalog.discovery.lead.model.QueueEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory per-tenant queues with a round-robin cursor. Each tenant's line is ordered by priority
 * (highest first) and then by enqueue time. A tenant is dropped from the rotation once its line drains.
 */
public class SchedulerState {
    static final Comparator<QueueEntry> LINE_ORDER = Comparator
        .comparingInt(QueueEntry::priority).reversed()
        .thenComparing(QueueEntry::enqueuedAt);

    private final Map<String, List<QueueEntry>> queues = new HashMap<>();
    private final List<String> rotation = new ArrayList<>();
    private int cursor;

    public synchronized void enqueue(QueueEntry entry) {
        List<QueueEntry> line = queues.get(entry.tenantId());
        if (line == null) {
            line = new ArrayList<>();
            queues.put(entry.tenantId(), line);
            rotation.add(entry.tenantId());
        }
        int index = 0;
        while (index < line.size() && LINE_ORDER.compare(line.get(index), entry) <= 0) {
            index++;
        }
        line.add(index, entry);
    }

    /**
     * Pops the head of the next tenant in rotation. The cursor moves on every call so a tenant that
     * just ran yields to the next one even when it still has work queued.
     */
    public synchronized QueueEntry pollNext() {
        if (rotation.isEmpty()) {
            cursor = 0;
            return null;
        }
        int position = cursor % rotation.size();
        String tenant = rotation.get(position);
        List<QueueEntry> line = queues.get(tenant);
        QueueEntry head = line.remove(0);
        if (line.isEmpty()) {
            queues.remove(tenant);
            rotation.remove(position);
            cursor = rotation.isEmpty() ? 0 : position;
        } else {
            cursor = position + 1;
        }
        return head;
    }

    public synchronized boolean remove(long searchJobId) {
        for (int i = 0; i < rotation.size(); i++) {
            String tenant = rotation.get(i);
            List<QueueEntry> line = queues.get(tenant);
            if (line.removeIf(entry -> entry.searchJobId() == searchJobId)) {
                if (line.isEmpty()) {
                    int position = cursor % rotation.size();
                    queues.remove(tenant);
                    rotation.remove(i);
                    if (i < position) {
                        position--;
                    }
                    cursor = rotation.isEmpty() ? 0 : position % rotation.size();
                }
                return true;
            }
        }
        return false;
    }

    /**
     * 1-based position in the global dispatch order, found by replaying the rotation on a copy of
     * the queues. Returns 0 when the job is not queued.
     */
    public synchronized int queuePosition(long searchJobId) {
        List<String> order = new ArrayList<>(rotation);
        Map<String, Deque<QueueEntry>> copy = new HashMap<>();
        for (Map.Entry<String, List<QueueEntry>> line : queues.entrySet()) {
            copy.put(line.getKey(), new ArrayDeque<>(line.getValue()));
        }
        int simulatedCursor = cursor;
        int position = 0;
        while (!order.isEmpty()) {
            int index = simulatedCursor % order.size();
            String tenant = order.get(index);
            Deque<QueueEntry> line = copy.get(tenant);
            QueueEntry head = line.pollFirst();
            position++;
            if (head != null && head.searchJobId() == searchJobId) {
                return position;
            }
            if (line.isEmpty()) {
                copy.remove(tenant);
                order.remove(index);
                simulatedCursor = order.isEmpty() ? 0 : index;
            } else {
                simulatedCursor = index + 1;
            }
        }
        return 0;
    }

    public synchronized int userQueuePosition(long searchJobId, String tenantId) {
        List<QueueEntry> line = queues.get(tenantId);
        if (line == null) {
            return 0;
        }
        for (int i = 0; i < line.size(); i++) {
            if (line.get(i).searchJobId() == searchJobId) {
                return i + 1;
            }
        }
        return 0;
    }

    public synchronized int size() {
        int total = 0;
        for (List<QueueEntry> line : queues.values()) {
            total += line.size();
        }
        return total;
    }

    public synchronized boolean isEmpty() {
        return rotation.isEmpty();
    }

    /** Tenant lines in rotation order. */
    public synchronized Map<String, List<QueueEntry>> tenantQueues() {
        Map<String, List<QueueEntry>> snapshot = new LinkedHashMap<>();
        for (String tenant : rotation) {
            snapshot.put(tenant, List.copyOf(queues.get(tenant)));
        }
        return snapshot;
    }
}
