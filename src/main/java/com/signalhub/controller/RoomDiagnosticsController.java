package com.signalhub.controller;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import com.signalhub.dto.ErrorResponse;
import com.signalhub.dto.HandshakeStages;
import com.signalhub.dto.RoomSnapshot;
import com.signalhub.exception.RoomException;
import com.signalhub.handler.SignalingWebSocketHandler;
import com.signalhub.model.Room;
import com.signalhub.service.JanitorSweep;
import com.signalhub.service.PresenceBroadcaster;
import com.signalhub.service.RoomDirectory;
import com.signalhub.validation.InputValidator;

/**
 * Read-only HTTP view of the hub, plus explicit room creation.
 */
@RestController
public class RoomDiagnosticsController {

    private static final Logger logger = LoggerFactory.getLogger(RoomDiagnosticsController.class);

    private final RoomDirectory roomDirectory;
    private final SignalingWebSocketHandler signalingHandler;
    private final JanitorSweep janitorSweep;
    private final PresenceBroadcaster presence;
    private final InputValidator inputValidator;

    public RoomDiagnosticsController(RoomDirectory roomDirectory,
                                     SignalingWebSocketHandler signalingHandler,
                                     JanitorSweep janitorSweep,
                                     PresenceBroadcaster presence,
                                     InputValidator inputValidator) {
        this.roomDirectory = roomDirectory;
        this.signalingHandler = signalingHandler;
        this.janitorSweep = janitorSweep;
        this.presence = presence;
        this.inputValidator = inputValidator;
    }

    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    /**
     * Debug dump of every room in the directory
     */
    @GetMapping("/api/rooms")
    public ResponseEntity<List<RoomSnapshot>> listRooms() {
        List<RoomSnapshot> rooms = new ArrayList<>();
        for (Room room : roomDirectory.getAllRooms()) {
            rooms.add(room.snapshot());
        }
        return ResponseEntity.ok(rooms);
    }

    @GetMapping("/api/rooms/{roomId}")
    public ResponseEntity<RoomSnapshot> getRoom(@PathVariable String roomId) {
        return ResponseEntity.ok(lookup(roomId).snapshot());
    }

    /**
     * Connection progress of a room: initiator present, ready and total peers
     */
    @GetMapping("/api/rooms/{roomId}/handshake")
    public ResponseEntity<HandshakeStages> getHandshakeStages(@PathVariable String roomId) {
        return ResponseEntity.ok(HandshakeStages.of(lookup(roomId).snapshot()));
    }

    @GetMapping("/api/rooms/{roomId}/initiator")
    public ResponseEntity<Map<String, Object>> getInitiator(@PathVariable String roomId) {
        Room room = lookup(roomId);
        // HashMap, the value is null once the initiator has left
        Map<String, Object> body = new HashMap<>();
        body.put("initiatorId", room.getInitiatorId().orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/rooms/{roomId}/typing")
    public ResponseEntity<Set<String>> getTypingPeers(@PathVariable String roomId) {
        Room room = lookup(roomId);
        return ResponseEntity.ok(presence.typingPeers(room.getRoomId()));
    }

    @GetMapping("/api/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = signalingHandler.getStats();
        stats.put("roomsEvicted", janitorSweep.getRoomsEvicted());
        return ResponseEntity.ok(stats);
    }

    /**
     * Create an empty room with a server-generated id
     */
    @PostMapping("/api/rooms")
    public ResponseEntity<Map<String, String>> createRoom() {
        Room room = roomDirectory.createRoom(UUID.randomUUID().toString());
        logger.info("🏠 Room {} created over HTTP", room.getRoomId());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("roomId", room.getRoomId()));
    }

    private Room lookup(String roomId) {
        inputValidator.validateRoomId(roomId);
        return roomDirectory.getRoom(roomId);
    }

    @ExceptionHandler(RoomException.class)
    public ResponseEntity<ErrorResponse> handleRoomException(RoomException e) {
        HttpStatus status = switch (e.getErrorCode()) {
            case ROOM_001 -> HttpStatus.NOT_FOUND;
            case ROOM_002, ROOM_010 -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
        logger.debug("Diagnostics request failed with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getErrorCode(), e.getDetails()));
    }
}
