package com.signalhub.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;

import com.signalhub.handler.SignalingWebSocketHandler;

import reactor.netty.http.server.WebsocketServerSpec;

/**
 * WebFlux WebSocket configuration.
 * Mounts the signaling handler on the configured endpoint, on Netty.
 */
@Configuration
public class WebFluxWebSocketConfig {

    private final SignalingWebSocketHandler signalingHandler;
    private final SignalingProperties properties;

    public WebFluxWebSocketConfig(SignalingWebSocketHandler signalingHandler, SignalingProperties properties) {
        this.signalingHandler = signalingHandler;
        this.properties = properties;
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(Ordered.HIGHEST_PRECEDENCE);
        handlerMapping.setUrlMap(Map.of(properties.getEndpoint(), signalingHandler));
        return handlerMapping;
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() {
        return new WebSocketHandlerAdapter(webSocketService());
    }

    /**
     * Inbound frames larger than the configured maximum fail the read and
     * close the connection.
     */
    @Bean
    public WebSocketService webSocketService() {
        int maxFrame = properties.getConnection().getMaxMessageSize();
        ReactorNettyRequestUpgradeStrategy strategy = new ReactorNettyRequestUpgradeStrategy(
            () -> WebsocketServerSpec.builder()
                .maxFramePayloadLength(maxFrame)
        );
        return new HandshakeWebSocketService(strategy);
    }
}
