package com.signalhub.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.signalhub.config.SignalingProperties;
import com.signalhub.model.Connection;
import com.signalhub.model.MessageType;
import com.signalhub.model.Room;

/**
 * Emits room-wide presence: user count (only when it changed), the member
 * list, join/leave notices and typing markers.
 */
@Service
public class PresenceBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(PresenceBroadcaster.class);

    private static final String TYPING_KEY_PREFIX = "typing:";
    private static final String ALL_READY_TEXT = "All clients are ready";

    private final SignalCodec codec;
    private final PresenceStore presenceStore;
    private final Duration typingTtl;

    public PresenceBroadcaster(SignalCodec codec, PresenceStore presenceStore, SignalingProperties properties) {
        this.codec = codec;
        this.presenceStore = presenceStore;
        this.typingTtl = properties.getPresence().getTypingTtl();
    }

    /**
     * The frames a newcomer gets first: its own id, then whether it is the initiator.
     * Handed to {@link RoomDirectory#join} so they are queued under the room lock.
     */
    public Room.Greeting greeting(String roomId) {
        return (peerId, initiator) -> List.of(
                codec.encode(MessageType.USER_ID, roomId, peerId),
                codec.encode(MessageType.INITIATOR_STATUS, roomId, initiator));
    }

    /**
     * Follow up a greeted peer with the room snapshot. Other members learn about the join.
     */
    public void announceJoin(Room room, Connection connection) {
        String roomId = room.getRoomId();
        String peerId = connection.getPeerId();

        room.broadcast(codec.encode(MessageType.USER_JOINED, roomId, peerId), peerId);
        broadcastUserList(room);

        // The newcomer always gets a count, even when the room-wide one is suppressed
        if (!broadcastUserCount(room)) {
            connection.send(codec.encode(MessageType.USER_COUNT, roomId, room.getMemberCount()));
        }
    }

    /**
     * Tell the remaining members that a peer left and refresh the room summary.
     */
    public void announceLeave(Room room, String peerId) {
        String roomId = room.getRoomId();
        updateTypingMarker(typingKey(roomId, peerId), false);

        room.broadcast(codec.encode(MessageType.USER_LEFT, roomId, peerId), null);
        broadcastUserList(room);
        broadcastUserCount(room);
    }

    /**
     * Re-broadcast after a readiness change. Suppressed unless the count moved.
     */
    public void onReadinessChanged(Room room) {
        broadcastUserCount(room);
        broadcastAllReadyIfDue(room);
    }

    /**
     * Tell every member, once per room, that the meeting has started and all
     * members are ready.
     *
     * @return true if the notice was sent by this call
     */
    public boolean broadcastAllReadyIfDue(Room room) {
        boolean sent = room.broadcastAllReadyIfDue(
                () -> codec.encode(MessageType.ALL_READY, room.getRoomId(), ALL_READY_TEXT));
        if (sent) {
            logger.info("✅ All peers ready in room {}", room.getRoomId());
        }
        return sent;
    }

    /**
     * Broadcast {@code userCount} if it differs from the last count delivered.
     *
     * @return true if a broadcast was made
     */
    public boolean broadcastUserCount(Room room) {
        boolean sent = room.broadcastUserCountIfChanged(
                count -> codec.encode(MessageType.USER_COUNT, room.getRoomId(), count));
        if (sent) {
            logger.debug("📊 userCount broadcast in room {}: {}", room.getRoomId(), room.getLastBroadcastUserCount());
        }
        return sent;
    }

    public void broadcastUserList(Room room) {
        room.broadcast(codec.encode(MessageType.USER_LIST, room.getRoomId(), room.getPeerIds()), null);
    }

    /**
     * Answer a {@code userList} query from one member.
     */
    public void sendUserList(Room room, Connection requester) {
        requester.send(codec.encode(MessageType.USER_LIST, room.getRoomId(), room.getPeerIds()));
    }

    /**
     * Record or clear a typing marker and relay it to the other members.
     */
    public void announceTyping(Room room, Connection sender, boolean typing) {
        String roomId = room.getRoomId();
        String peerId = sender.getPeerId();
        updateTypingMarker(typingKey(roomId, peerId), typing);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("peerID", peerId);
        content.put("typing", typing);
        room.broadcast(codec.encode(MessageType.TYPING, roomId, content), peerId);
    }

    /**
     * Peers of the room with a live typing marker.
     */
    public Set<String> typingPeers(String roomId) {
        String prefix = TYPING_KEY_PREFIX + roomId + ":";
        Set<String> peers = new TreeSet<>();
        for (String key : presenceStore.scan(prefix)) {
            peers.add(key.substring(prefix.length()));
        }
        return peers;
    }

    private void updateTypingMarker(String key, boolean typing) {
        try {
            if (typing) {
                presenceStore.set(key, typingTtl);
            } else {
                presenceStore.delete(key);
            }
        } catch (RuntimeException e) {
            logger.warn("Presence store unavailable for {}: {}", key, e.getMessage());
        }
    }

    static String typingKey(String roomId, String peerId) {
        return TYPING_KEY_PREFIX + roomId + ":" + peerId;
    }
}
