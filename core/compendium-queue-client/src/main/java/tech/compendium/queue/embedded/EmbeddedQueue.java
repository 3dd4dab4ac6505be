package tech.compendium.queue.embedded;

import tech.compendium.queue.topology.QueueDeclaration;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue with unacknowledged-delivery tracking.
 */
class EmbeddedQueue {

    private final QueueDeclaration declaration;
    private final AtomicLong deliveryTags;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<EmbeddedDelivery> ready = new ArrayDeque<>();
    private final Map<Long, EmbeddedDelivery> unacked = new HashMap<>();

    EmbeddedQueue(QueueDeclaration declaration, AtomicLong deliveryTags) {
        this.declaration = declaration;
        this.deliveryTags = deliveryTags;
    }

    QueueDeclaration declaration() {
        return declaration;
    }

    void enqueue(EmbeddedDelivery delivery) {
        lock.lock();
        try {
            ready.addLast(delivery);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    Optional<EmbeddedDelivery> receive(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (ready.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            EmbeddedDelivery delivery = ready.pollFirst().withDeliveryTag(deliveryTags.incrementAndGet());
            unacked.put(delivery.deliveryTag(), delivery);
            return Optional.of(delivery);
        } finally {
            lock.unlock();
        }
    }

    Optional<EmbeddedDelivery> ack(long deliveryTag) {
        lock.lock();
        try {
            return Optional.ofNullable(unacked.remove(deliveryTag));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove an unacked delivery; when requeued it goes back to the head of the queue.
     */
    Optional<EmbeddedDelivery> reject(long deliveryTag, boolean requeue) {
        lock.lock();
        try {
            EmbeddedDelivery delivery = unacked.remove(deliveryTag);
            if (delivery != null && requeue) {
                ready.addFirst(delivery.asRedelivered());
                notEmpty.signal();
            }
            return Optional.ofNullable(delivery);
        } finally {
            lock.unlock();
        }
    }

    int readyCount() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    int unackedCount() {
        lock.lock();
        try {
            return unacked.size();
        } finally {
            lock.unlock();
        }
    }

    List<EmbeddedDelivery> readySnapshot() {
        lock.lock();
        try {
            return List.copyOf(ready);
        } finally {
            lock.unlock();
        }
    }
}
