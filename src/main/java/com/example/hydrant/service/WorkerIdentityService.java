package com.example.hydrant.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Claims one worker slot for this instance, kept alive by a heartbeat. The slot names the
 * worker in logs and the job ledger; the lease holder id marks its queue leases.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkerIdentityService {

    private final MongoTemplate mongoTemplate;

    @Value("${hydrant.worker.max-slots:10}")
    private int maxSlots = 10;

    private Integer mySlot;
    private final String leaseHolderId = UUID.randomUUID().toString();
    private static final String COLLECTION_NAME = "worker_registry";
    private static final long HEARTBEAT_TIMEOUT_MS = 30000; // 30 seconds timeout

    @PostConstruct
    public void acquireWorkerIdentity() {
        log.info("Attempting to acquire worker slot...");

        for (int i = 0; i < maxSlots; i++) {
            // Claim slot 'i' if it's free OR its holder stopped heartbeating
            Query query = new Query(Criteria.where("_id").is(i)
                    .orOperator(
                            Criteria.where("leaseHolder").exists(false),
                            Criteria.where("lastHeartbeat").lt(System.currentTimeMillis() - HEARTBEAT_TIMEOUT_MS)));

            Update update = new Update()
                    .set("leaseHolder", leaseHolderId)
                    .set("lastHeartbeat", System.currentTimeMillis());

            try {
                // Upsert creates a missing slot; a live slot makes the upsert hit the duplicate key
                Object result = mongoTemplate.findAndModify(
                        query,
                        update,
                        FindAndModifyOptions.options().upsert(true).returnNew(true),
                        Object.class,
                        COLLECTION_NAME);

                if (result != null) {
                    this.mySlot = i;
                    log.info("Successfully acquired worker slot: {}", mySlot);
                    return;
                }
            } catch (Exception e) {
                log.debug("Worker slot {} is taken: {}", i, e.getMessage());
            }
        }

        throw new IllegalStateException("Failed to acquire a worker slot within range 0-" + (maxSlots - 1)
                + ". All " + maxSlots + " slots are busy.");
    }

    @Scheduled(fixedRate = 10000)
    public void heartbeat() {
        if (mySlot != null) {
            Query query = new Query(Criteria.where("_id").is(mySlot).and("leaseHolder").is(leaseHolderId));
            Update update = new Update().set("lastHeartbeat", System.currentTimeMillis());
            mongoTemplate.updateFirst(query, update, COLLECTION_NAME);
        }
    }

    @PreDestroy
    public void releaseIdentity() {
        if (mySlot != null) {
            Query query = new Query(Criteria.where("_id").is(mySlot).and("leaseHolder").is(leaseHolderId));
            mongoTemplate.remove(query, COLLECTION_NAME);
            log.info("Released worker slot: {}", mySlot);
        }
    }

    public Integer getSlot() {
        return mySlot;
    }

    public String getWorkerId() {
        return mySlot == null ? "worker-unassigned" : "worker-" + mySlot;
    }

    /**
     * Unique per process, so two instances never share queue leases.
     */
    public String getLeaseHolder() {
        return getWorkerId() + "/" + leaseHolderId;
    }
}
