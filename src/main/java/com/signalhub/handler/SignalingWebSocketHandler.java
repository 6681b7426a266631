package com.signalhub.handler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;

import com.signalhub.config.SignalingProperties;
import com.signalhub.dto.ErrorResponse;
import com.signalhub.exception.RoomException;
import com.signalhub.model.Connection;
import com.signalhub.service.MessageRouter;
import com.signalhub.service.PresenceBroadcaster;
import com.signalhub.service.RoomDirectory;
import com.signalhub.service.SignalCodec;
import com.signalhub.validation.InputValidator;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive WebSocket handler for room signaling
 *
 * Each accepted socket becomes a {@link Connection} with two independent pumps:
 * - inbound: reads frames, hands text to the {@link MessageRouter}; a read
 *   error, close frame or read inactivity ends it and tears the connection down
 * - outbound: drains the connection's bounded queue to the socket and sends a
 *   keepalive ping on a fixed interval; once the queue is closed it sends a
 *   close frame and exits
 */
@Component
public class SignalingWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    private static final String ROOM_ID_PARAM = "room_id";
    private static final String USER_ID_PARAM = "user_id";

    private final RoomDirectory roomDirectory;
    private final MessageRouter messageRouter;
    private final PresenceBroadcaster presence;
    private final SignalCodec codec;
    private final InputValidator inputValidator;

    private final int queueCapacity;
    private final Duration pingInterval;
    private final Duration pongTimeout;

    private final AtomicLong acceptedHandshakes = new AtomicLong();
    private final AtomicLong rejectedHandshakes = new AtomicLong();

    public SignalingWebSocketHandler(RoomDirectory roomDirectory,
                                     MessageRouter messageRouter,
                                     PresenceBroadcaster presence,
                                     SignalCodec codec,
                                     InputValidator inputValidator,
                                     SignalingProperties properties) {
        this.roomDirectory = roomDirectory;
        this.messageRouter = messageRouter;
        this.presence = presence;
        this.codec = codec;
        this.inputValidator = inputValidator;
        this.queueCapacity = properties.getConnection().getOutboundQueueCapacity();
        this.pingInterval = properties.getConnection().getPingInterval();
        this.pongTimeout = properties.getConnection().getPongTimeout();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        MultiValueMap<String, String> params = UriComponentsBuilder
                .fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams();
        String roomId = params.getFirst(ROOM_ID_PARAM);
        String requestedPeerId = params.getFirst(USER_ID_PARAM);
        if (requestedPeerId != null && requestedPeerId.isBlank()) {
            requestedPeerId = null;
        }

        // Validate identifiers before touching any room
        try {
            inputValidator.validateRoomId(roomId);
            inputValidator.validatePeerId(requestedPeerId);
        } catch (RoomException e) {
            return reject(session, roomId, e);
        }

        String peerId = requestedPeerId != null ? requestedPeerId : UUID.randomUUID().toString();
        Connection connection = new Connection(peerId, roomId, queueCapacity);

        RoomDirectory.JoinResult joined;
        try {
            joined = roomDirectory.join(roomId, peerId, connection, presence.greeting(roomId));
        } catch (RoomException e) {
            return reject(session, roomId, e);
        }

        acceptedHandshakes.incrementAndGet();
        logger.info("🔌 Connection {} accepted as peer {} in room {}", session.getId(), peerId, roomId);

        connection.onClose(() -> session.close(CloseStatus.GOING_AWAY)
                .subscribe(null, e -> logger.debug("Close of session {} failed: {}", session.getId(), e.getMessage())));

        presence.announceJoin(joined.room(), connection);

        return Mono.when(inbound(session, connection), outbound(session, connection));
    }

    // ==========================================
    // PUMPS
    // ==========================================

    /**
     * Read loop. Pongs and other control frames only count as read activity.
     */
    private Mono<Void> inbound(WebSocketSession session, Connection connection) {
        return session.receive()
                .timeout(pongTimeout)
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> messageRouter.route(connection, message.getPayloadAsText()))
                .doOnError(TimeoutException.class, e ->
                        logger.warn("⏱️ Peer {} silent for {}, treating as dead", connection.getPeerId(), pongTimeout))
                .onErrorResume(e -> {
                    if (!(e instanceof TimeoutException)) {
                        logger.warn("❌ Read failed for peer {}: {}", connection.getPeerId(), e.getMessage());
                    }
                    return Mono.empty();
                })
                .doFinally(signalType -> teardown(connection))
                .then();
    }

    /**
     * Write loop. Completes when the connection's queue is closed and drained.
     */
    private Mono<Void> outbound(WebSocketSession session, Connection connection) {
        Flux<WebSocketMessage> frames = connection.outbound()
                .map(session::textMessage);

        Flux<WebSocketMessage> pings = Flux.interval(pingInterval, pingInterval)
                .takeUntilOther(connection.closed())
                .map(tick -> session.pingMessage(factory -> factory.wrap(new byte[0])));

        return session.send(Flux.merge(frames, pings))
                .then(Mono.defer(() -> session.close(CloseStatus.NORMAL)))
                .onErrorResume(e -> {
                    logger.warn("❌ Write failed for peer {}: {}", connection.getPeerId(), e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signalType -> connection.close());
    }

    /**
     * Leave the room once, whichever pump ended first.
     */
    private void teardown(Connection connection) {
        connection.close();
        roomDirectory.leave(connection).ifPresent(room -> presence.announceLeave(room, connection.getPeerId()));
        logger.info("🚪 Peer {} disconnected from room {}", connection.getPeerId(), connection.getRoomId());
    }

    /**
     * Send one error frame and close with policy violation.
     */
    private Mono<Void> reject(WebSocketSession session, String roomId, RoomException e) {
        rejectedHandshakes.incrementAndGet();
        logger.warn("🚫 Rejected connection {}: {}", session.getId(), e.getMessage());

        ErrorResponse error = ErrorResponse.of(e.getErrorCode(), e.getDetails());
        String frame = codec.encodeError(roomId, error);
        return session.send(Mono.just(session.textMessage(frame)))
                .then(session.close(CloseStatus.POLICY_VIOLATION.withReason(e.getErrorCode().getMessage())));
    }

    /**
     * Get hub statistics
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalRooms", roomDirectory.getRoomCount());
        stats.put("totalConnections", roomDirectory.getConnectionCount());
        stats.put("acceptedHandshakes", acceptedHandshakes.get());
        stats.put("rejectedHandshakes", rejectedHandshakes.get());
        stats.put("relayedMessages", messageRouter.getRelayedMessages());
        stats.put("droppedMessages", messageRouter.getDroppedMessages());
        return stats;
    }
}
