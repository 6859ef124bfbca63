package com.umitunal.sendlater.config;

import com.umitunal.sendlater.delivery.VkClientConfig;
import com.umitunal.sendlater.scheduler.SchedulerConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Everything the application needs to start, read from environment variables.
 */
public class ApplicationConfig {
    public static final String DATA_DIR = "SENDLATER_DATA_DIR";
    public static final String ENCRYPTION_KEY = "ENCRYPTION_KEY";
    public static final String MAX_CONCURRENCY = "SENDLATER_MAX_CONCURRENCY";
    public static final String MISFIRE_GRACE_SECONDS = "SENDLATER_MISFIRE_GRACE_SECONDS";
    public static final String DURABLE_WRITES = "SENDLATER_DURABLE_WRITES";
    public static final String PAYLOAD_CODEC = "SENDLATER_PAYLOAD_CODEC";
    public static final String VK_API_URL = "VK_API_URL";
    public static final String VK_API_VERSION = "VK_API_VERSION";

    private static final String DEFAULT_DATA_DIR = "./sendlater-data";

    private final StorageConfig storageConfig;
    private final SchedulerConfig schedulerConfig;
    private final VkClientConfig vkClientConfig;
    private final String encryptionKey;
    private final String payloadCodec;

    public ApplicationConfig(StorageConfig storageConfig, SchedulerConfig schedulerConfig,
                             VkClientConfig vkClientConfig, String encryptionKey, String payloadCodec) {
        this.storageConfig = storageConfig;
        this.schedulerConfig = schedulerConfig;
        this.vkClientConfig = vkClientConfig;
        this.encryptionKey = encryptionKey;
        this.payloadCodec = payloadCodec;
    }

    /**
     * @throws IllegalArgumentException if a variable is missing or malformed
     */
    public static ApplicationConfig fromEnvironment(Map<String, String> env) {
        String key = env.get(ENCRYPTION_KEY);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(ENCRYPTION_KEY + " is not set");
        }

        StorageConfig storage = StorageConfig.newBuilder(Path.of(env.getOrDefault(DATA_DIR, DEFAULT_DATA_DIR)))
                .withDurableWrites(Boolean.parseBoolean(env.getOrDefault(DURABLE_WRITES, "true")))
                .build();

        SchedulerConfig.Builder scheduler = SchedulerConfig.newBuilder();
        if (env.containsKey(MAX_CONCURRENCY)) {
            scheduler.withMaxConcurrency(parseInt(env, MAX_CONCURRENCY));
        }
        if (env.containsKey(MISFIRE_GRACE_SECONDS)) {
            scheduler.withMisfireGrace(Duration.ofSeconds(parseInt(env, MISFIRE_GRACE_SECONDS)));
        }

        VkClientConfig.Builder vk = VkClientConfig.newBuilder();
        if (env.containsKey(VK_API_URL)) {
            vk.withBaseUrl(env.get(VK_API_URL));
        }
        if (env.containsKey(VK_API_VERSION)) {
            vk.withApiVersion(env.get(VK_API_VERSION));
        }

        return new ApplicationConfig(storage, scheduler.build(), vk.build(), key.trim(),
                env.getOrDefault(PAYLOAD_CODEC, "json"));
    }

    public StorageConfig getStorageConfig() { return storageConfig; }
    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    public VkClientConfig getVkClientConfig() { return vkClientConfig; }
    public String getEncryptionKey() { return encryptionKey; }
    public String getPayloadCodec() { return payloadCodec; }

    private static int parseInt(Map<String, String> env, String name) {
        try {
            return Integer.parseInt(env.get(name).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + env.get(name) + "'", e);
        }
    }
}
