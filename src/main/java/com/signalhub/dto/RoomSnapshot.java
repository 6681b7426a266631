package com.signalhub.dto;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a room, taken under the room lock.
 */
public record RoomSnapshot(
        String roomId,
        List<String> members,
        String initiatorId,
        List<String> readyPeers,
        int memberCount,
        String state,
        Instant createdAt,
        Instant lastActivity) {
}
