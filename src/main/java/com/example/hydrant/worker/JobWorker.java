package com.example.hydrant.worker;

import com.example.hydrant.model.BundleCreatedEvent;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.JobStatus;
import com.example.hydrant.model.QueueLease;
import com.example.hydrant.service.BundleStorageService;
import com.example.hydrant.service.ClassificationService;
import com.example.hydrant.service.DocumentPipeline;
import com.example.hydrant.service.EntityMappingException;
import com.example.hydrant.service.ExtractionException;
import com.example.hydrant.service.JobLedgerService;
import com.example.hydrant.service.PipelineResult;
import com.example.hydrant.service.WorkQueue;
import com.example.hydrant.service.WorkerIdentityService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

@Component
@RequiredArgsConstructor
@Slf4j
public class JobWorker {

    private final WorkQueue workQueue;
    private final WorkerIdentityService workerIdentity;
    private final ClassificationService classificationService;
    private final DocumentPipeline pipeline;
    private final BundleStorageService bundleStorage;
    private final JobLedgerService ledger;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${hydrant.topics.bundles:hydrant.bundles}")
    private String bundleTopic;

    @Value("${hydrant.queue.max-deliveries:5}")
    private int maxDeliveries;

    @Value("${hydrant.queue.visibility-timeout:PT10M}")
    private Duration visibilityTimeout;

    @Value("${hydrant.queue.lease-renewal-interval:PT1M}")
    private Duration leaseRenewalInterval;

    // Lease of the job in progress; renewed from the scheduler's other thread
    private final AtomicReference<QueueLease> activeLease = new AtomicReference<>();

    @PostConstruct
    public void checkLeaseTiming() {
        // Two renewals must fit in one visibility timeout, or a slow renewal lets the lease lapse
        if (leaseRenewalInterval.multipliedBy(2).compareTo(visibilityTimeout) > 0) {
            throw new IllegalStateException("hydrant.queue.lease-renewal-interval (" + leaseRenewalInterval
                    + ") must be at most half of hydrant.queue.visibility-timeout (" + visibilityTimeout + ")");
        }
    }

    /**
     * Keeps the running job's lease alive so a slow job is not handed to a second worker.
     */
    @Scheduled(fixedDelayString = "${hydrant.queue.lease-renewal-interval:PT1M}")
    public void renewActiveLease() {
        QueueLease lease = activeLease.get();
        if (lease != null && workQueue.extendLease(lease)) {
            log.debug("Renewed lease on {} for {}", lease.itemId(), lease.fileReference());
        }
    }

    /**
     * Recovery task: puts items whose lease expired (crashed or stuck worker) back in the queue.
     */
    @Scheduled(fixedDelayString = "${hydrant.queue.recovery-interval:PT1M}")
    public void recoverExpiredLeases() {
        int requeued = workQueue.requeueExpired();
        if (requeued > 0) {
            log.info("Requeued {} item(s) with expired leases.", requeued);
        }
    }

    /**
     * Drains the queue, one job at a time, until it reports empty. A retryable failure ends
     * the round; the rest waits for the next poll.
     */
    @Scheduled(fixedDelayString = "${hydrant.worker.poll-interval:PT5S}")
    public void poll() {
        int processed = 0;
        Optional<QueueLease> lease;
        while ((lease = workQueue.takeNext(workerIdentity.getLeaseHolder())).isPresent()) {
            processed++;
            if (!processLease(lease.get())) {
                log.info("Stopping this round after a retryable failure ({} file(s) taken).", processed);
                return;
            }
        }
        if (processed > 0) {
            log.info("Processed {} queued file(s); queue is empty.", processed);
        }
    }

    /**
     * @return false when the item went back to the queue for a retry
     */
    public boolean processLease(QueueLease lease) {
        activeLease.set(lease);
        try {
            return runJob(lease);
        } finally {
            activeLease.set(null);
        }
    }

    private boolean runJob(QueueLease lease) {
        String workerId = workerIdentity.getWorkerId();
        Job job = null;
        try {
            log.info("Processing {} (delivery #{})", lease.fileReference(), lease.deliveryCount());

            job = classificationService.classify(lease.fileReference());
            ledger.recordReceived(job, workerId);

            PipelineResult result = pipeline.process(job);
            if (!workQueue.extendLease(lease)) {
                // Requeued and possibly taken by another worker; its run owns the bundle
                log.warn("Dropping result of transaction {}: lease on {} was lost", job.transactionId(),
                        lease.fileReference());
                return true;
            }
            String bundlePath = bundleStorage.store(result.bundle());
            publishBundleEvent(result, bundlePath);
            ledger.recordCompleted(result, workerId, bundlePath);

            workQueue.ack(lease);
            log.info("Completed transaction {} for {}", job.transactionId(), lease.fileReference());
            return true;

        } catch (ExtractionException | EntityMappingException e) {
            // Fatal for the job, not retried
            log.error("Job for {} failed: {}", lease.fileReference(), e.getMessage());
            ledger.recordFailed(job, lease.fileReference(), workerId, JobStatus.FAILED, e.getMessage());
            workQueue.ack(lease);
            return true;

        } catch (Exception e) {
            if (lease.deliveryCount() >= maxDeliveries) {
                log.error("Giving up on {} after {} deliveries", lease.fileReference(), lease.deliveryCount(), e);
                ledger.recordFailed(job, lease.fileReference(), workerId, JobStatus.DEAD_LETTERED, e.toString());
                workQueue.ack(lease);
                return true;
            }
            log.error("Unexpected failure for {}, returning it to the queue", lease.fileReference(), e);
            workQueue.nack(lease);
            return false;
        }
    }

    private void publishBundleEvent(PipelineResult result, String bundlePath) {
        BundleCreatedEvent event = new BundleCreatedEvent(
                result.job().transactionId(),
                result.bundle().id(),
                bundlePath,
                result.bundle().entries().size(),
                result.job().fileReference());
        try {
            kafkaTemplate.send(bundleTopic, result.job().transactionId(), event);
        } catch (Exception e) {
            log.error("Failed to send message to {}", bundleTopic, e);
        }
    }
}
