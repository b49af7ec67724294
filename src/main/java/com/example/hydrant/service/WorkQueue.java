package com.example.hydrant.service;

import com.example.hydrant.model.QueueLease;

import java.util.Optional;

/**
 * Shared work queue of file references with at-least-once delivery.
 * <p>
 * A taken item is leased to the taker until it is acked (done), nacked (retry after a delay)
 * or the visibility timeout expires, after which {@link #requeueExpired()} makes it
 * available again. A holder keeps a long job's lease alive with {@link #extendLease}.
 * Concurrent takers never receive the same item.
 */
public interface WorkQueue {

    /**
     * @return the queue item id
     */
    String enqueue(String fileReference);

    /**
     * @return the next pending item leased to {@code leaseHolder}, or empty when nothing is pending
     */
    Optional<QueueLease> takeNext(String leaseHolder);

    void ack(QueueLease lease);

    /**
     * Returns the item to the queue; it is not handed out again until its retry delay has passed.
     */
    void nack(QueueLease lease);

    /**
     * Pushes the lease deadline one visibility timeout past now.
     *
     * @return false when the lease is no longer held by {@code lease.leaseHolder()}
     */
    boolean extendLease(QueueLease lease);

    /**
     * @return how many expired leases were put back
     */
    int requeueExpired();
}
