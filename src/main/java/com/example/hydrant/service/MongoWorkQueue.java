package com.example.hydrant.service;

import com.example.hydrant.model.QueueItem;
import com.example.hydrant.model.QueueLease;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link WorkQueue} on a Mongo collection. Claims go through findAndModify, which is atomic
 * per document, so two workers cannot lease the same item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoWorkQueue implements WorkQueue {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Value("${hydrant.queue.visibility-timeout:PT10M}")
    private Duration visibilityTimeout;

    @Value("${hydrant.queue.retry-delay:PT30S}")
    private Duration retryDelay;

    @Override
    public String enqueue(String fileReference) {
        QueueItem item = QueueItem.builder()
                .id(UUID.randomUUID().toString())
                .fileReference(fileReference)
                .status(QueueItem.PENDING)
                .enqueuedAt(clock.millis())
                .availableAt(clock.millis())
                .build();
        mongoTemplate.insert(item);
        log.info("Enqueued {} as {}", fileReference, item.getId());
        return item.getId();
    }

    @Override
    public Optional<QueueLease> takeNext(String leaseHolder) {
        long now = clock.millis();
        Query query = new Query(Criteria.where("status").is(QueueItem.PENDING)
                .and("availableAt").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "enqueuedAt"));

        Update update = new Update()
                .set("status", QueueItem.IN_FLIGHT)
                .set("leaseHolder", leaseHolder)
                .set("leaseExpiresAt", now + visibilityTimeout.toMillis())
                .inc("deliveryCount", 1);

        QueueItem item = mongoTemplate.findAndModify(
                query,
                update,
                FindAndModifyOptions.options().returnNew(true),
                QueueItem.class);

        if (item == null) {
            return Optional.empty();
        }
        log.debug("Leased {} ({}) to {}, delivery #{}", item.getId(), item.getFileReference(), leaseHolder,
                item.getDeliveryCount());
        return Optional.of(new QueueLease(item.getId(), item.getFileReference(), leaseHolder, item.getDeliveryCount()));
    }

    @Override
    public void ack(QueueLease lease) {
        DeleteResult result = mongoTemplate.remove(leaseQuery(lease), QueueItem.class);
        if (result.getDeletedCount() == 0) {
            log.warn("Ack for {} found no lease held by {}; it expired and may be redelivered",
                    lease.itemId(), lease.leaseHolder());
        }
    }

    @Override
    public void nack(QueueLease lease) {
        // Linear backoff: the n-th failed delivery waits n retry delays
        long availableAt = clock.millis() + retryDelay.toMillis() * Math.max(1, lease.deliveryCount());
        Update update = release().set("availableAt", availableAt);

        UpdateResult result = mongoTemplate.updateFirst(leaseQuery(lease), update, QueueItem.class);
        if (result.getModifiedCount() == 0) {
            log.warn("Nack for {} found no lease held by {}", lease.itemId(), lease.leaseHolder());
        } else {
            log.info("Returned {} to the queue, available again at {}", lease.itemId(), availableAt);
        }
    }

    @Override
    public boolean extendLease(QueueLease lease) {
        Update update = new Update().set("leaseExpiresAt", clock.millis() + visibilityTimeout.toMillis());
        UpdateResult result = mongoTemplate.updateFirst(leaseQuery(lease), update, QueueItem.class);
        if (result.getMatchedCount() == 0) {
            log.warn("Lease on {} is no longer held by {}", lease.itemId(), lease.leaseHolder());
            return false;
        }
        return true;
    }

    @Override
    public int requeueExpired() {
        Query query = new Query(Criteria.where("status").is(QueueItem.IN_FLIGHT)
                .and("leaseExpiresAt").lt(clock.millis()));
        UpdateResult result = mongoTemplate.updateMulti(query, release(), QueueItem.class);
        return (int) result.getModifiedCount();
    }

    private static Query leaseQuery(QueueLease lease) {
        return new Query(Criteria.where("_id").is(lease.itemId())
                .and("status").is(QueueItem.IN_FLIGHT)
                .and("leaseHolder").is(lease.leaseHolder()));
    }

    private static Update release() {
        return new Update()
                .set("status", QueueItem.PENDING)
                .unset("leaseHolder")
                .set("leaseExpiresAt", 0L);
    }
}
