package com.signalhub.dto;

/**
 * How far a room has progressed towards a meeting.
 */
public record HandshakeStages(boolean initiator, int readyClients, int totalClients) {

    public static HandshakeStages of(RoomSnapshot snapshot) {
        return new HandshakeStages(
                snapshot.initiatorId() != null,
                snapshot.readyPeers().size(),
                snapshot.memberCount());
    }
}
