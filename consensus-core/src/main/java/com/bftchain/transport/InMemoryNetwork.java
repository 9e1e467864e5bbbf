package com.bftchain.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process message bus connecting {@link InMemoryTransport}s.
 * <p>
 * In immediate mode a broadcast is handed to every receiver right away,
 * which suits engines running on their own event loops. In queued mode
 * messages wait until {@link #deliverAll()} or
 * {@link #deliverShuffled(Random)} pumps them, which lets single threaded
 * tests control ordering and loss.
 */
@Slf4j
public class InMemoryNetwork {
    private final Map<String, InMemoryTransport> transports = new ConcurrentHashMap<>();
    private final Set<String> isolated = ConcurrentHashMap.newKeySet();
    private final List<Envelope> queue = Collections.synchronizedList(new ArrayList<>());
    private final boolean immediate;
    // (to, message) -> true to drop
    private volatile BiPredicate<String, Object> dropFilter = (to, message) -> false;

    public InMemoryNetwork(boolean immediate) {
        this.immediate = immediate;
    }

    public InMemoryTransport join(String nodeId) {
        InMemoryTransport transport = new InMemoryTransport(nodeId, this);
        if (transports.putIfAbsent(nodeId, transport) != null) {
            throw new IllegalArgumentException("Node already joined: " + nodeId);
        }
        return transport;
    }

    public boolean leave(String nodeId) {
        return transports.remove(nodeId) != null;
    }

    /**
     * Cuts a node off: it neither sends nor receives until reconnected
     */
    public void isolate(String nodeId) {
        isolated.add(nodeId);
    }

    public void reconnect(String nodeId) {
        isolated.remove(nodeId);
    }

    public void setDropFilter(BiPredicate<String, Object> dropFilter) {
        this.dropFilter = dropFilter == null ? (to, message) -> false : dropFilter;
    }

    void send(String from, Object message) {
        if (isolated.contains(from)) {
            return;
        }
        for (String to : new ArrayList<>(transports.keySet())) {
            if (to.equals(from)) {
                continue;
            }
            Envelope envelope = new Envelope(from, to, message);
            if (immediate) {
                dispatch(envelope);
            } else {
                queue.add(envelope);
            }
        }
    }

    /**
     * Delivers queued messages, including the ones sent while delivering,
     * until the queue is empty.
     *
     * @return number of messages handed to receivers
     */
    public int deliverAll() {
        int delivered = 0;
        while (true) {
            Envelope next;
            synchronized (queue) {
                if (queue.isEmpty()) {
                    return delivered;
                }
                next = queue.remove(0);
            }
            if (dispatch(next)) {
                delivered++;
            }
        }
    }

    /**
     * Like {@link #deliverAll()} but each pass delivers the currently queued
     * messages in random order.
     */
    public int deliverShuffled(Random random) {
        int delivered = 0;
        while (true) {
            List<Envelope> batch;
            synchronized (queue) {
                if (queue.isEmpty()) {
                    return delivered;
                }
                batch = new ArrayList<>(queue);
                queue.clear();
            }
            Collections.shuffle(batch, random);
            for (Envelope envelope : batch) {
                if (dispatch(envelope)) {
                    delivered++;
                }
            }
        }
    }

    /**
     * Drops everything still queued
     */
    public void clearQueue() {
        queue.clear();
    }

    public int queuedCount() {
        return queue.size();
    }

    private boolean dispatch(Envelope envelope) {
        if (isolated.contains(envelope.getFrom()) || isolated.contains(envelope.getTo())) {
            return false;
        }
        if (dropFilter.test(envelope.getTo(), envelope.getMessage())) {
            log.trace("Dropping {} to {}", envelope.getMessage(), envelope.getTo());
            return false;
        }
        InMemoryTransport target = transports.get(envelope.getTo());
        if (target == null) {
            return false;
        }
        target.deliver(envelope.getMessage());
        return true;
    }

    @Getter
    @AllArgsConstructor
    private static class Envelope {
        private final String from;
        private final String to;
        private final Object message;
    }
}
