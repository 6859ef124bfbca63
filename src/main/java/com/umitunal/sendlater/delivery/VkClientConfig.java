package com.umitunal.sendlater.delivery;

import java.net.URI;
import java.time.Duration;

/**
 * Settings of the VK API client.
 */
public class VkClientConfig {
    private final URI baseUrl;
    private final String apiVersion;
    private final Duration sendTimeout;
    private final Duration requestTimeout;

    private VkClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiVersion = builder.apiVersion;
        this.sendTimeout = builder.sendTimeout;
        this.requestTimeout = builder.requestTimeout;
    }

    public URI getBaseUrl() { return baseUrl; }
    public String getApiVersion() { return apiVersion; }
    public Duration getSendTimeout() { return sendTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }

    public URI methodUri(String method) {
        return baseUrl.resolve(method);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private URI baseUrl = URI.create("https://api.vk.com/method/");
        private String apiVersion = "5.199";
        private Duration sendTimeout = Duration.ofSeconds(15);
        private Duration requestTimeout = Duration.ofSeconds(10);

        private Builder() {
        }

        /**
         * Default: https://api.vk.com/method/
         */
        public Builder withBaseUrl(String url) {
            this.baseUrl = URI.create(url.endsWith("/") ? url : url + "/");
            return this;
        }

        /**
         * Default: 5.199
         */
        public Builder withApiVersion(String version) {
            this.apiVersion = version;
            return this;
        }

        /**
         * Upper bound of a messages.send call. Default: 15 seconds
         */
        public Builder withSendTimeout(Duration timeout) {
            this.sendTimeout = timeout;
            return this;
        }

        /**
         * Upper bound of other calls. Default: 10 seconds
         */
        public Builder withRequestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public VkClientConfig build() {
            return new VkClientConfig(this);
        }
    }
}
