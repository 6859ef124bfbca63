package com.umitunal.sendlater.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.sendlater.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Client of the VK HTTP API for sending messages and the calls account linking needs.
 */
public class VkApiClient implements DeliveryClient {
    private static final Logger logger = LoggerFactory.getLogger(VkApiClient.class);

    // Authorization, permission and confirmation errors; the token likely needs attention
    private static final Set<Integer> TOKEN_ERROR_CODES = Set.of(5, 7, 10, 15, 17, 28, 113);
    private static final int BODY_LOG_LIMIT = 500;

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final VkClientConfig config;

    public VkApiClient(VkClientConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getRequestTimeout()).build(), JsonCodec.newMapper());
    }

    public VkApiClient(VkClientConfig config, HttpClient httpClient, ObjectMapper mapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    @Override
    public DeliveryOutcome deliver(String credential, String recipientId, String message) {
        if (isBlank(credential) || isBlank(recipientId) || isBlank(message)) {
            return DeliveryOutcome.rejected(-1, "Invalid parameters for sending message");
        }

        // random_id lets VK drop a duplicate of the same send
        int randomId = ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("peer_id", recipientId);
        params.put("message", message);
        params.put("random_id", Integer.toString(randomId));
        params.put("dont_parse_links", "0");
        logger.info("sending message peerId={} randomId={}", recipientId, randomId);

        JsonNode body;
        try {
            body = call("messages.send", credential, params, config.getSendTimeout());
        } catch (HttpTimeoutException e) {
            logger.warn("timeout sending message peerId={}", recipientId);
            return DeliveryOutcome.transportFailure("Timeout sending message to VK");
        } catch (IOException e) {
            logger.warn("network error sending message peerId={} error={}", recipientId, e.getMessage());
            return DeliveryOutcome.transportFailure("Network/HTTP error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryOutcome.transportFailure("Interrupted while sending message");
        }

        if (body.has("response")) {
            // A number for direct messages, an object for some peers
            String externalId = body.get("response").isNumber()
                    ? body.get("response").asText()
                    : null;
            logger.info("message sent peerId={} vkMessageId={}", recipientId, externalId);
            return DeliveryOutcome.delivered(externalId);
        }
        if (body.has("error")) {
            JsonNode error = body.get("error");
            int code = error.path("error_code").asInt(-1);
            String text = error.path("error_msg").asText("Unknown VK error");
            if (TOKEN_ERROR_CODES.contains(code)) {
                logger.warn("token or permission error sending message peerId={} code={}", recipientId, code);
            } else {
                logger.error("vk rejected message peerId={} code={} msg={}", recipientId, code, text);
            }
            return DeliveryOutcome.rejected(code, "VK Error " + code + ": " + text);
        }
        logger.error("unknown vk response structure peerId={} body={}", recipientId, truncate(body.toString()));
        return DeliveryOutcome.rejected(-1, "Unknown VK API response");
    }

    /**
     * Check a token with users.get.
     *
     * @return the VK user id the token belongs to, or empty when the token is not usable
     */
    public Optional<Long> validateToken(String token) {
        if (isBlank(token)) {
            return Optional.empty();
        }
        try {
            JsonNode body = call("users.get", token, Map.of(), config.getRequestTimeout());
            JsonNode users = body.path("response");
            if (users.isArray() && users.size() > 0 && users.get(0).hasNonNull("id")) {
                long userId = users.get(0).get("id").asLong();
                logger.info("vk token validated userId={}", userId);
                return Optional.of(userId);
            }
            if (body.has("error")) {
                logger.warn("vk token rejected code={} msg={}",
                        body.path("error").path("error_code").asInt(-1),
                        body.path("error").path("error_msg").asText());
            } else {
                logger.error("unknown vk response structure on users.get body={}", truncate(body.toString()));
            }
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("vk token validation failed error={}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /**
     * One page of the user's dialogs from messages.getConversations.
     */
    public ConversationPage fetchConversations(String token, int offset, int count) throws VkApiException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("offset", Integer.toString(offset));
        params.put("count", Integer.toString(count));
        params.put("extended", "0");
        params.put("filter", "all");

        JsonNode body;
        try {
            body = call("messages.getConversations", token, params, config.getRequestTimeout());
        } catch (IOException e) {
            throw new VkApiException("Failed to fetch conversations from VK", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VkApiException("Interrupted while fetching conversations", e);
        }

        if (body.has("error")) {
            int code = body.path("error").path("error_code").asInt(-1);
            String text = body.path("error").path("error_msg").asText("Unknown VK error");
            logger.error("vk error on messages.getConversations code={} msg={}", code, text);
            throw new VkApiException(code, "VK Error " + code + ": " + text);
        }
        if (!body.has("response")) {
            throw new VkApiException(-1, "Unknown VK API response");
        }

        JsonNode response = body.get("response");
        List<Conversation> items = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            JsonNode conversation = item.path("conversation");
            JsonNode peerId = conversation.path("peer").path("id");
            if (!peerId.isNumber()) {
                continue;
            }
            String fallback = "Dialog ID " + peerId.asLong();
            String title = conversation.path("chat_settings").path("title").asText(fallback);
            items.add(new Conversation(peerId.asLong(), title));
        }
        int total = response.path("count").asInt(0);
        logger.info("fetched conversations count={} offset={} total={}", items.size(), offset, total);
        return new ConversationPage(items, total);
    }

    private JsonNode call(String method, String token, Map<String, String> params, Duration timeout)
            throws IOException, InterruptedException {
        Map<String, String> form = new LinkedHashMap<>(params);
        form.put("access_token", token);
        form.put("v", config.getApiVersion());

        HttpRequest request = HttpRequest.newBuilder(config.methodUri(method))
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(UTF_8));
        logger.debug("vk {} status={} body={}", method, response.statusCode(), truncate(response.body()));

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new IOException("HTTP " + response.statusCode() + " with unreadable body", e);
        }
        // VK reports most errors in the body with status 200
        if (body == null || (!body.has("response") && !body.has("error") && response.statusCode() >= 400)) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return body;
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), UTF_8) + "=" + URLEncoder.encode(e.getValue(), UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= BODY_LOG_LIMIT) {
            return text;
        }
        return text.substring(0, BODY_LOG_LIMIT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
