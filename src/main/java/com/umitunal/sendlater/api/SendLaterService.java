package com.umitunal.sendlater.api;

import com.umitunal.sendlater.core.JobStoreException;
import com.umitunal.sendlater.credential.CredentialStore;
import com.umitunal.sendlater.credential.CredentialStoreException;
import com.umitunal.sendlater.credential.CredentialUnavailableException;
import com.umitunal.sendlater.delivery.ConversationPage;
import com.umitunal.sendlater.delivery.VkApiClient;
import com.umitunal.sendlater.delivery.VkApiException;
import com.umitunal.sendlater.scheduler.DeliveryScheduler;
import com.umitunal.sendlater.scheduler.JobAccessDeniedException;
import com.umitunal.sendlater.scheduler.JobSummary;
import com.umitunal.sendlater.scheduler.ScheduleValidationException;
import com.umitunal.sendlater.security.ClientSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.umitunal.sendlater.api.ApiException.Status;

/**
 * Request boundary: authenticates callers by client secret and maps
 * domain failures to {@link ApiException} statuses.
 */
public class SendLaterService {
    private static final Logger logger = LoggerFactory.getLogger(SendLaterService.class);

    static final String AUTH_SCHEME = "secret";
    static final int MIN_TOKEN_LENGTH = 10;
    static final int MAX_CONVERSATION_PAGE = 50;

    private final CredentialStore credentials;
    private final VkApiClient vk;
    private final DeliveryScheduler scheduler;

    public SendLaterService(CredentialStore credentials, VkApiClient vk, DeliveryScheduler scheduler) {
        this.credentials = credentials;
        this.vk = vk;
        this.scheduler = scheduler;
    }

    /**
     * Validate an upstream token and link it to a fresh client secret.
     * Linking the same VK user again replaces the previous secret.
     */
    public LinkAccountResponse linkAccount(LinkAccountRequest request) throws ApiException {
        String token = request == null ? null : request.getVkAccessToken();
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            throw new ApiException(Status.BAD_REQUEST,
                    "vk_access_token must be at least " + MIN_TOKEN_LENGTH + " characters");
        }
        Optional<Long> userId = vk.validateToken(token);
        if (userId.isEmpty()) {
            throw new ApiException(Status.BAD_REQUEST, "Invalid or expired VK token");
        }
        try {
            return new LinkAccountResponse(credentials.link(Long.toString(userId.get()), token));
        } catch (CredentialStoreException e) {
            logger.error("account linking failed userId={}", userId.get(), e);
            throw new ApiException(Status.INTERNAL_ERROR, "Database error during account linking", e);
        }
    }

    /**
     * Resolve the account behind an {@code Authorization: Secret <client_secret>} header value.
     */
    public String authenticate(String authorization) throws ApiException {
        if (authorization == null) {
            throw new ApiException(Status.UNAUTHORIZED, "Authorization header missing");
        }
        String[] parts = authorization.trim().split("\\s+");
        if (parts.length != 2 || !parts[0].equalsIgnoreCase(AUTH_SCHEME)) {
            throw new ApiException(Status.UNAUTHORIZED,
                    "Invalid Authorization header format. Expected 'Secret <your_client_secret>'");
        }
        String secret = parts[1];
        Optional<String> owner;
        try {
            owner = credentials.findOwnerBySecret(secret);
        } catch (CredentialStoreException e) {
            logger.error("secret lookup failed", e);
            throw new ApiException(Status.INTERNAL_ERROR, "Failed to check client secret", e);
        }
        if (owner.isEmpty()) {
            logger.warn("authentication failed secret={}", ClientSecrets.tail(secret));
            throw new ApiException(Status.UNAUTHORIZED, "Invalid client secret");
        }
        return owner.get();
    }

    public ScheduleResponse schedule(String authorization, ScheduleRequest request) throws ApiException {
        String ownerId = authenticate(authorization);
        if (request == null) {
            throw new ApiException(Status.BAD_REQUEST, "Request body is required");
        }
        ensureSchedulerRunning();
        try {
            String jobId = scheduler.submit(ownerId, request.getScheduledAt(),
                    request.getRecipientId(), request.getMessage());
            return new ScheduleResponse(jobId);
        } catch (ScheduleValidationException e) {
            throw new ApiException(Status.BAD_REQUEST, e.getMessage(), e);
        } catch (JobStoreException e) {
            logger.error("failed to schedule ownerId={}", ownerId, e);
            throw new ApiException(Status.INTERNAL_ERROR, "Failed to schedule task", e);
        } catch (IllegalStateException e) {
            throw new ApiException(Status.SERVICE_UNAVAILABLE, "Scheduler service is unavailable", e);
        }
    }

    public List<JobSummary> listSchedules(String authorization) throws ApiException {
        String ownerId = authenticate(authorization);
        try {
            return scheduler.list(ownerId);
        } catch (JobStoreException e) {
            logger.error("failed to list schedules ownerId={}", ownerId, e);
            throw new ApiException(Status.INTERNAL_ERROR, "Failed to retrieve scheduled tasks", e);
        }
    }

    /**
     * Cancel a scheduled delivery. Unknown or already finished jobs are treated as deleted.
     */
    public void deleteSchedule(String authorization, String jobId) throws ApiException {
        String ownerId = authenticate(authorization);
        try {
            scheduler.cancel(ownerId, jobId);
        } catch (JobAccessDeniedException e) {
            throw new ApiException(Status.FORBIDDEN, "You do not have permission to delete this task", e);
        } catch (JobStoreException e) {
            logger.error("failed to cancel jobId={} ownerId={}", jobId, ownerId, e);
            throw new ApiException(Status.INTERNAL_ERROR, "Failed to remove scheduled task", e);
        }
    }

    public ConversationPage conversations(String authorization, int offset, int count) throws ApiException {
        String ownerId = authenticate(authorization);
        if (offset < 0) {
            throw new ApiException(Status.BAD_REQUEST, "offset must not be negative");
        }
        if (count < 1 || count > MAX_CONVERSATION_PAGE) {
            throw new ApiException(Status.BAD_REQUEST, "count must be between 1 and " + MAX_CONVERSATION_PAGE);
        }

        String token;
        try {
            token = credentials.resolve(ownerId);
        } catch (CredentialUnavailableException e) {
            logger.error("credential unavailable ownerId={} reason={}", ownerId, e.getReason());
            throw new ApiException(Status.INTERNAL_ERROR, "Stored VK credential is unavailable", e);
        }

        try {
            return vk.fetchConversations(token, offset, count);
        } catch (VkApiException e) {
            throw new ApiException(Status.BAD_REQUEST,
                    "Failed to fetch conversations from VK. Check token validity and permissions.", e);
        }
    }

    private void ensureSchedulerRunning() throws ApiException {
        if (!scheduler.isRunning()) {
            logger.error("scheduler is not running");
            throw new ApiException(Status.SERVICE_UNAVAILABLE, "Scheduler service is unavailable");
        }
    }
}
