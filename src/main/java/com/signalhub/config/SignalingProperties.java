package com.signalhub.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the signaling hub
 * Binds to signalhub.* properties in application.yml
 */
@Configuration
@ConfigurationProperties(prefix = "signalhub")
@Validated
public class SignalingProperties {

    @NotBlank
    private String endpoint = "/ws";

    @Valid
    private ConnectionSettings connection = new ConnectionSettings();

    @Valid
    private JanitorSettings janitor = new JanitorSettings();

    @Valid
    private PresenceSettings presence = new PresenceSettings();

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public ConnectionSettings getConnection() {
        return connection;
    }

    public void setConnection(ConnectionSettings connection) {
        this.connection = connection;
    }

    public JanitorSettings getJanitor() {
        return janitor;
    }

    public void setJanitor(JanitorSettings janitor) {
        this.janitor = janitor;
    }

    public PresenceSettings getPresence() {
        return presence;
    }

    public void setPresence(PresenceSettings presence) {
        this.presence = presence;
    }

    public static class ConnectionSettings {
        @Min(1)
        private int outboundQueueCapacity = 256;

        @Min(1024)
        private int maxMessageSize = 1024 * 1024; // 1 MiB

        @NotNull
        private Duration pingInterval = Duration.ofSeconds(54);

        @NotNull
        private Duration pongTimeout = Duration.ofSeconds(60);

        public int getOutboundQueueCapacity() {
            return outboundQueueCapacity;
        }

        public void setOutboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = outboundQueueCapacity;
        }

        public int getMaxMessageSize() {
            return maxMessageSize;
        }

        public void setMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPongTimeout() {
            return pongTimeout;
        }

        public void setPongTimeout(Duration pongTimeout) {
            this.pongTimeout = pongTimeout;
        }
    }

    public static class JanitorSettings {
        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        @NotNull
        private Duration inactivityThreshold = Duration.ofMinutes(30);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getInactivityThreshold() {
            return inactivityThreshold;
        }

        public void setInactivityThreshold(Duration inactivityThreshold) {
            this.inactivityThreshold = inactivityThreshold;
        }
    }

    public static class PresenceSettings {
        @NotNull
        private Duration typingTtl = Duration.ofSeconds(5);

        public Duration getTypingTtl() {
            return typingTtl;
        }

        public void setTypingTtl(Duration typingTtl) {
            this.typingTtl = typingTtl;
        }
    }
}
