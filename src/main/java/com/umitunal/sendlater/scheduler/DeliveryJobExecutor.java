package com.umitunal.sendlater.scheduler;

import com.umitunal.sendlater.core.ScheduledJob;
import com.umitunal.sendlater.credential.CredentialStore;
import com.umitunal.sendlater.credential.CredentialUnavailableException;
import com.umitunal.sendlater.delivery.DeliveryClient;
import com.umitunal.sendlater.delivery.DeliveryOutcome;
import com.umitunal.sendlater.model.DeliveryPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.umitunal.sendlater.scheduler.JobExecutor.ExecutionResult.FailureReason;

/**
 * Resolves the owner's credential and sends the message through the delivery client.
 */
public class DeliveryJobExecutor implements JobExecutor {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryJobExecutor.class);

    private final CredentialStore credentials;
    private final DeliveryClient client;

    public DeliveryJobExecutor(CredentialStore credentials, DeliveryClient client) {
        this.credentials = credentials;
        this.client = client;
    }

    @Override
    public ExecutionResult execute(ScheduledJob<DeliveryPayload> job) {
        String token;
        try {
            token = credentials.resolve(job.getOwnerId());
        } catch (CredentialUnavailableException e) {
            logger.error("credential unavailable jobId={} ownerId={} reason={}",
                    job.getId(), job.getOwnerId(), e.getReason());
            return ExecutionResult.failure(FailureReason.CREDENTIAL_UNAVAILABLE,
                    e.getReason() + ": " + e.getMessage());
        }

        DeliveryPayload payload = job.getPayload();
        DeliveryOutcome outcome = client.deliver(token, payload.getRecipientId(), payload.getMessage());
        return switch (outcome.getKind()) {
            case DELIVERED -> ExecutionResult.success(outcome.getExternalId());
            case REJECTED -> ExecutionResult.failure(FailureReason.DELIVERY_REJECTED, outcome.getMessage());
            case TRANSPORT_FAILURE -> ExecutionResult.failure(FailureReason.DELIVERY_TRANSPORT_FAILURE, outcome.getMessage());
        };
    }
}
