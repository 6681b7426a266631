package com.signalhub.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.function.Supplier;

import com.signalhub.dto.RoomSnapshot;
import com.signalhub.exception.RoomException;

/**
 * In-memory signaling room: its member connections plus the state peers use to
 * coordinate setup (initiator, readiness, meeting flag).
 *
 * All mutable state is guarded by the room's own monitor, so rooms never
 * serialize each other. Frames are only handed to {@link Connection#send},
 * which never blocks.
 */
public class Room {

    private final String roomId;
    private final Clock clock;
    private final Instant createdAt;

    // peerId -> connection, join order
    private final Map<String, Connection> members = new LinkedHashMap<>();
    private final Set<String> readyPeers = new LinkedHashSet<>();

    private String initiatorId;
    private Instant lastActivity;
    private int lastBroadcastUserCount;
    private boolean meetingStarted;
    private boolean allReadySent;
    private boolean closed;

    public Room(String roomId, Clock clock) {
        this.roomId = roomId;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
    }

    /**
     * Frames a newcomer must receive before anything else the room sends it.
     */
    @FunctionalInterface
    public interface Greeting {
        Greeting NONE = (peerId, initiator) -> List.of();

        List<String> frames(String peerId, boolean initiator);
    }

    public boolean addConnection(String peerId, Connection connection) {
        return addConnection(peerId, connection, Greeting.NONE);
    }

    /**
     * Add a peer. The first peer added while no initiator is set becomes the initiator.
     * The greeting is queued on the connection before the room lock is released, so
     * no broadcast or relay can reach the newcomer ahead of it.
     *
     * @return true if this peer is now the initiator
     * @throws RoomException ROOM_010 if the peer id is taken, ROOM_011 if the room was evicted
     */
    public synchronized boolean addConnection(String peerId, Connection connection, Greeting greeting) {
        if (closed) {
            throw RoomException.closed(roomId);
        }
        if (members.containsKey(peerId)) {
            throw RoomException.peerAlreadyInRoom(peerId);
        }

        members.put(peerId, connection);
        connection.bindRoom(this);
        lastActivity = clock.instant();

        boolean initiator = initiatorId == null;
        if (initiator) {
            initiatorId = peerId;
        }

        for (String frame : greeting.frames(peerId, initiator)) {
            connection.send(frame);
        }
        return initiator;
    }

    /**
     * Remove a peer if, and only if, the given connection is the one registered
     * under its id. Leaving as initiator clears the initiator; the next joiner
     * is elected.
     *
     * @return true if the connection was a member
     */
    public synchronized boolean removeConnection(Connection connection) {
        String peerId = connection.getPeerId();
        if (members.get(peerId) != connection) {
            return false;
        }

        members.remove(peerId);
        readyPeers.remove(peerId);
        if (peerId.equals(initiatorId)) {
            initiatorId = null;
        }
        lastActivity = clock.instant();
        return true;
    }

    /**
     * @return false if the peer is not a member
     */
    public synchronized boolean setReady(String peerId, boolean ready) {
        if (!members.containsKey(peerId)) {
            return false;
        }
        if (ready) {
            readyPeers.add(peerId);
        } else {
            readyPeers.remove(peerId);
        }
        return true;
    }

    public synchronized void touch() {
        lastActivity = clock.instant();
    }

    /**
     * Send a frame to every member except {@code excludePeerId} (may be null).
     * Members are snapshotted under the lock; sends happen outside it.
     *
     * @return number of members the frame was queued for
     */
    public int broadcast(String frame, String excludePeerId) {
        int delivered = 0;
        for (Connection connection : getConnections()) {
            if (connection.getPeerId().equals(excludePeerId)) {
                continue;
            }
            if (connection.send(frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Deliver the user count to every member only if it differs from the last
     * count delivered. Decision, update and enqueue happen under the room lock
     * so counts reach each member in the order they were decided.
     *
     * @return true if a broadcast was made
     */
    public synchronized boolean broadcastUserCountIfChanged(IntFunction<String> frameForCount) {
        int count = members.size();
        if (count == lastBroadcastUserCount) {
            return false;
        }
        lastBroadcastUserCount = count;

        String frame = frameForCount.apply(count);
        for (Connection connection : new ArrayList<>(members.values())) {
            connection.send(frame);
        }
        return true;
    }

    /**
     * Mark the room as started and return the members in id order.
     */
    public synchronized List<String> startMeeting() {
        meetingStarted = true;
        lastActivity = clock.instant();
        List<String> peerIds = new ArrayList<>(members.keySet());
        peerIds.sort(null);
        return peerIds;
    }

    /**
     * Deliver the all-ready notice to every member the first time the meeting is
     * started and every member is ready. Never sent twice for the same room.
     *
     * @return true if the notice was sent by this call
     */
    public synchronized boolean broadcastAllReadyIfDue(Supplier<String> frame) {
        if (allReadySent || !meetingStarted || members.isEmpty()
                || !readyPeers.containsAll(members.keySet())) {
            return false;
        }
        allReadySent = true;

        String notice = frame.get();
        for (Connection connection : new ArrayList<>(members.values())) {
            connection.send(notice);
        }
        return true;
    }

    /**
     * Empty, or no join/leave/message for longer than the threshold.
     */
    public synchronized boolean isIdle(Instant now, Duration inactivityThreshold) {
        return members.isEmpty()
                || Duration.between(lastActivity, now).compareTo(inactivityThreshold) > 0;
    }

    /**
     * Close the room to further joins if it is idle. Check and close are one
     * atomic step so a concurrent join either lands first (room not idle) or
     * fails with ROOM_011.
     *
     * @return connections still attached, for the caller to force-close;
     *         empty if the room is not idle or already closed
     */
    public synchronized Optional<List<Connection>> retireIfIdle(Instant now, Duration inactivityThreshold) {
        if (closed || !isIdle(now, inactivityThreshold)) {
            return Optional.empty();
        }
        closed = true;
        return Optional.of(new ArrayList<>(members.values()));
    }

    public synchronized RoomSnapshot snapshot() {
        return new RoomSnapshot(
                roomId,
                new ArrayList<>(members.keySet()),
                initiatorId,
                new ArrayList<>(readyPeers),
                members.size(),
                getState(),
                createdAt,
                lastActivity);
    }

    public synchronized Optional<Connection> getConnection(String peerId) {
        return Optional.ofNullable(members.get(peerId));
    }

    public synchronized List<Connection> getConnections() {
        return new ArrayList<>(members.values());
    }

    public synchronized List<String> getPeerIds() {
        return new ArrayList<>(members.keySet());
    }

    public synchronized boolean hasPeer(String peerId) {
        return members.containsKey(peerId);
    }

    public synchronized int getMemberCount() {
        return members.size();
    }

    public synchronized Optional<String> getInitiatorId() {
        return Optional.ofNullable(initiatorId);
    }

    public synchronized Set<String> getReadyPeers() {
        return new LinkedHashSet<>(readyPeers);
    }

    public synchronized int getReadyCount() {
        return readyPeers.size();
    }

    public synchronized Instant getLastActivity() {
        return lastActivity;
    }

    public synchronized int getLastBroadcastUserCount() {
        return lastBroadcastUserCount;
    }

    public synchronized boolean isMeetingStarted() {
        return meetingStarted;
    }

    public synchronized boolean isAllReadySent() {
        return allReadySent;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized String getState() {
        if (closed) {
            return "closed";
        }
        return meetingStarted ? "started" : "waiting";
    }

    public String getRoomId() {
        return roomId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
