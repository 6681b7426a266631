package com.signalhub.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalhub.exception.ProtocolException;
import com.signalhub.model.Connection;
import com.signalhub.model.MessageType;
import com.signalhub.model.Room;
import com.signalhub.model.SignalMessage;

/**
 * Routes one inbound frame from a connection against its room.
 *
 * Routing is best-effort: malformed envelopes, unknown types, missing fields
 * and absent targets are logged and dropped. Nothing is reported back to the
 * sender and nothing here closes the sender's connection.
 */
@Service
public class MessageRouter {
    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final SignalCodec codec;
    private final PresenceBroadcaster presence;

    private final AtomicLong relayedMessages = new AtomicLong();
    private final AtomicLong droppedMessages = new AtomicLong();

    public MessageRouter(SignalCodec codec, PresenceBroadcaster presence) {
        this.codec = codec;
        this.presence = presence;
    }

    /**
     * Route a raw text frame. Never throws.
     */
    public void route(Connection sender, String payload) {
        try {
            dispatch(sender, payload);
        } catch (RuntimeException e) {
            droppedMessages.incrementAndGet();
            logger.error("Unexpected error routing message from {}: {}", sender.getPeerId(), e.getMessage(), e);
        }
    }

    private void dispatch(Connection sender, String payload) {
        SignalMessage message;
        try {
            message = codec.decode(payload);
        } catch (ProtocolException e) {
            drop(sender, e.getMessage());
            return;
        }

        Optional<Room> roomRef = sender.room();
        if (roomRef.isEmpty() || !roomRef.get().hasPeer(sender.getPeerId())) {
            drop(sender, "sender is not a room member");
            return;
        }
        Room room = roomRef.get();

        String envelopeRoom = message.getRoomId();
        if (envelopeRoom != null && !envelopeRoom.isBlank() && !envelopeRoom.equals(room.getRoomId())) {
            drop(sender, "room_id " + envelopeRoom + " does not match room " + room.getRoomId());
            return;
        }

        room.touch();

        Optional<MessageType> type = MessageType.fromWireName(message.getType());
        if (type.isEmpty()) {
            drop(sender, "unknown message type: " + message.getType());
            return;
        }

        logger.debug("📨 {} from {} in room {}", type.get().wireName(), sender.getPeerId(), room.getRoomId());

        switch (type.get()) {
            case READY -> handleReady(room, sender, message);
            case OFFER, ANSWER, ICE_CANDIDATE -> relayToTarget(room, sender, type.get(), message, payload);
            case CHAT_MESSAGE -> handleChatMessage(room, sender, payload);
            case START_MEETING -> handleStartMeeting(room, sender);
            case USER_LIST -> presence.sendUserList(room, sender);
            case TYPING -> handleTyping(room, sender, message);
            default -> drop(sender, "server-only message type: " + message.getType());
        }
    }

    // ==========================================
    // MESSAGE HANDLERS
    // ==========================================

    /**
     * {@code ready}: content may be omitted, or carry {@code status}; anything
     * other than "ready" clears readiness.
     */
    private void handleReady(Room room, Connection sender, SignalMessage message) {
        String status = message.contentText("status");
        JsonNode content = message.getContent();
        if (status == null && content != null && content.isTextual()) {
            status = content.asText();
        }
        boolean ready = status == null || status.isBlank() || "ready".equalsIgnoreCase(status);

        if (room.setReady(sender.getPeerId(), ready)) {
            logger.info("✅ Peer {} ready={} in room {} ({}/{} ready)",
                    sender.getPeerId(), ready, room.getRoomId(), room.getReadyCount(), room.getMemberCount());
            presence.onReadinessChanged(room);
        }
    }

    /**
     * {@code offer}/{@code answer}/{@code iceCandidate}: the verbatim frame goes
     * to the target peer's queue and nowhere else.
     */
    private void relayToTarget(Room room, Connection sender, MessageType type, SignalMessage message, String payload) {
        String fromPeerId = message.contentText("fromPeerID");
        String targetPeerId = message.contentText("targetPeerID");
        String payloadField = type == MessageType.ICE_CANDIDATE ? "candidate" : "sdp";

        if (fromPeerId == null || targetPeerId == null || !message.hasContentField(payloadField)) {
            drop(sender, type.wireName() + " is missing fromPeerID, targetPeerID or " + payloadField);
            return;
        }
        if (!fromPeerId.equals(sender.getPeerId())) {
            drop(sender, type.wireName() + " fromPeerID " + fromPeerId + " is not the sender");
            return;
        }
        if (targetPeerId.equals(sender.getPeerId())) {
            drop(sender, type.wireName() + " targets its own sender");
            return;
        }

        Optional<Connection> target = room.getConnection(targetPeerId);
        if (target.isEmpty()) {
            drop(sender, type.wireName() + " target " + targetPeerId + " not in room " + room.getRoomId());
            return;
        }

        if (target.get().send(payload)) {
            relayedMessages.incrementAndGet();
            logger.debug("📤 {} relayed {} -> {} in room {}", type.wireName(), fromPeerId, targetPeerId, room.getRoomId());
        } else {
            drop(sender, type.wireName() + " refused by target " + targetPeerId);
        }
    }

    /**
     * {@code chatMessage}: ephemeral relay to everyone else in the room.
     */
    private void handleChatMessage(Room room, Connection sender, String payload) {
        int delivered = room.broadcast(payload, sender.getPeerId());
        relayedMessages.addAndGet(delivered);
        logger.debug("💬 Chat from {} relayed to {} peers in room {}", sender.getPeerId(), delivered, room.getRoomId());
    }

    /**
     * {@code startMeeting}: every member is told the meeting started, then gets a
     * {@code createOffer} naming the peers it must offer to. If everyone is
     * already ready, {@code allReady} follows.
     */
    private void handleStartMeeting(Room room, Connection sender) {
        List<String> members = room.startMeeting();
        Map<String, List<String>> assignments = assignOfferTargets(members);

        logger.info("🎬 Meeting started in room {} by {} ({} members)", room.getRoomId(), sender.getPeerId(), members.size());

        room.broadcast(codec.encode(MessageType.START_MEETING, room.getRoomId(), true), null);

        assignments.forEach((peerId, targets) -> room.getConnection(peerId).ifPresent(connection -> {
            Map<String, Object> content = Map.of("peers", targets);
            connection.send(codec.encode(MessageType.CREATE_OFFER, room.getRoomId(), content));
        }));

        presence.broadcastAllReadyIfDue(room);
    }

    /**
     * {@code typing}: content {@code {"typing": bool}}, true when omitted.
     */
    private void handleTyping(Room room, Connection sender, SignalMessage message) {
        boolean typing = true;
        JsonNode content = message.getContent();
        if (content != null && content.isObject() && content.has("typing")) {
            typing = content.get("typing").asBoolean(true);
        }
        presence.announceTyping(room, sender, typing);
    }

    /**
     * Each peer offers only to peers whose id sorts after its own, so every
     * unordered pair gets exactly one offer, in one direction.
     *
     * @return peer id -> ids it must send offers to, in id order
     */
    public static Map<String, List<String>> assignOfferTargets(Collection<String> peerIds) {
        List<String> ordered = new ArrayList<>(peerIds);
        ordered.sort(null);

        Map<String, List<String>> assignments = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            assignments.put(ordered.get(i), List.copyOf(ordered.subList(i + 1, ordered.size())));
        }
        return assignments;
    }

    private void drop(Connection sender, String reason) {
        droppedMessages.incrementAndGet();
        logger.warn("❌ Dropped message from {} in room {}: {}", sender.getPeerId(), sender.getRoomId(), reason);
    }

    public long getRelayedMessages() {
        return relayedMessages.get();
    }

    public long getDroppedMessages() {
        return droppedMessages.get();
    }
}
