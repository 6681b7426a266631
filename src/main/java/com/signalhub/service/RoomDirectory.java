package com.signalhub.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.signalhub.exception.RoomException;
import com.signalhub.model.Connection;
import com.signalhub.model.Room;

/**
 * Process-wide registry of rooms by id.
 *
 * Structural changes (create, evict) are serialized on the directory's monitor;
 * everything inside a room is guarded by that room's own lock. Lock order is
 * always directory, then room.
 */
@Service
public class RoomDirectory {
    private static final Logger logger = LoggerFactory.getLogger(RoomDirectory.class);

    // Room ID -> Room mapping
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    private final Clock clock;

    public RoomDirectory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Look up a room or create it. Concurrent callers with the same id get the same room.
     */
    public synchronized Room getOrCreateRoom(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            room = new Room(roomId, clock);
            rooms.put(roomId, room);
            logger.info("📦 Room created: {}", roomId);
        }
        return room;
    }

    /**
     * Create an empty room under an id that must not be in use yet.
     */
    public synchronized Room createRoom(String roomId) {
        if (rooms.containsKey(roomId)) {
            throw RoomException.alreadyExists(roomId);
        }
        Room room = new Room(roomId, clock);
        rooms.put(roomId, room);
        logger.info("📦 Room created explicitly: {}", roomId);
        return room;
    }

    /**
     * @throws RoomException ROOM_001 if no room has this id
     */
    public Room getRoom(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw RoomException.notFound(roomId);
        }
        return room;
    }

    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public JoinResult join(String roomId, String peerId, Connection connection) {
        return join(roomId, peerId, connection, Room.Greeting.NONE);
    }

    /**
     * Add a connection to the room with the given id, creating the room if needed.
     * A room evicted between lookup and insert is replaced by a fresh one. The
     * greeting reaches the connection before any other room traffic.
     *
     * @throws RoomException ROOM_010 if the peer id is already in the room
     */
    public JoinResult join(String roomId, String peerId, Connection connection, Room.Greeting greeting) {
        while (true) {
            Room room = getOrCreateRoom(roomId);
            try {
                boolean initiator = room.addConnection(peerId, connection, greeting);
                logger.info("👋 Peer {} joined room {} (initiator: {}, members: {})",
                        peerId, roomId, initiator, room.getMemberCount());
                return new JoinResult(room, initiator);
            } catch (RoomException e) {
                if (!e.isRoomClosed()) {
                    throw e;
                }
                logger.debug("Room {} was evicted during join of {}, retrying", roomId, peerId);
            }
        }
    }

    /**
     * Remove a connection from the room it is bound to.
     *
     * @return the room it left, empty if it was not (or no longer) a member
     */
    public Optional<Room> leave(Connection connection) {
        Optional<Room> room = connection.room();
        if (room.isEmpty() || !room.get().removeConnection(connection)) {
            return Optional.empty();
        }
        logger.info("🚪 Peer {} left room {} (remaining: {})",
                connection.getPeerId(), room.get().getRoomId(), room.get().getMemberCount());
        return room;
    }

    /**
     * Remove the room if it is still registered and idle. Connections still
     * attached are closed after the room is gone from the directory.
     *
     * @return true if the room was evicted
     */
    public boolean evictIfIdle(Room room, Instant now, Duration inactivityThreshold) {
        List<Connection> attached;
        synchronized (this) {
            if (rooms.get(room.getRoomId()) != room) {
                return false;
            }
            Optional<List<Connection>> retired = room.retireIfIdle(now, inactivityThreshold);
            if (retired.isEmpty()) {
                return false;
            }
            rooms.remove(room.getRoomId());
            attached = retired.get();
        }

        for (Connection connection : attached) {
            connection.close();
        }
        logger.info("🗑️ Room evicted: {} (force-closed {} connections)", room.getRoomId(), attached.size());
        return true;
    }

    /**
     * Copy of the directory; never a live view.
     */
    public Map<String, Room> snapshot() {
        return new LinkedHashMap<>(rooms);
    }

    public List<Room> getAllRooms() {
        return new ArrayList<>(rooms.values());
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public int getConnectionCount() {
        return rooms.values().stream().mapToInt(Room::getMemberCount).sum();
    }

    /**
     * Outcome of a successful join.
     */
    public record JoinResult(Room room, boolean initiator) {}
}
