package com.cartmate.backend.a2a;

import com.cartmate.backend.domain.model.A2aMessage;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO inbox owned by a single agent.
 *
 * <p>Producers never block: {@link #offer} reports a full channel instead of waiting.
 * The single consumer awaits the next message with {@link #receive()}, which completes
 * immediately when a message is queued and otherwise parks until one is offered.
 */
public class DirectChannel {

    private final String agentId;
    private final int capacity;
    private final Deque<A2aMessage> queue;
    private MonoSink<A2aMessage> waiter;

    public DirectChannel(String agentId, int capacity) {
        this.agentId = agentId;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * Hands a message to the waiting consumer or queues it.
     *
     * @return false when the channel is at capacity
     */
    public boolean offer(A2aMessage message) {
        MonoSink<A2aMessage> consumer;
        synchronized (this) {
            consumer = waiter;
            waiter = null;
            if (consumer == null) {
                if (queue.size() >= capacity) {
                    return false;
                }
                queue.addLast(message);
                return true;
            }
        }
        consumer.success(message);
        return true;
    }

    /**
     * Next message in FIFO order. Only one receive may be outstanding at a time.
     */
    public Mono<A2aMessage> receive() {
        return Mono.create(sink -> {
            A2aMessage next;
            synchronized (this) {
                next = queue.pollFirst();
                if (next == null) {
                    if (waiter != null) {
                        sink.error(new IllegalStateException("Channel " + agentId + " already has a consumer waiting"));
                        return;
                    }
                    waiter = sink;
                    sink.onCancel(() -> releaseWaiter(sink));
                    return;
                }
            }
            sink.success(next);
        });
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isFull() {
        return queue.size() >= capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public String getAgentId() {
        return agentId;
    }

    private synchronized void releaseWaiter(MonoSink<A2aMessage> sink) {
        if (waiter == sink) {
            waiter = null;
        }
    }
}
