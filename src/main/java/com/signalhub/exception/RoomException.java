package com.signalhub.exception;

import com.signalhub.dto.ErrorResponse.ErrorCode;

/**
 * Raised when a peer cannot be seated or a room cannot be resolved: the room is
 * unknown or already taken, the peer id is in use, the room was evicted
 * between lookup and join, or the handshake query carried a malformed id.
 *
 * The handler turns it into an {@code error} frame, the diagnostics API into a
 * status code.
 */
public class RoomException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public RoomException(ErrorCode errorCode) {
        this(errorCode, null);
    }

    public RoomException(ErrorCode errorCode, String details) {
        super(details == null ? errorCode.getMessage() : errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public static RoomException notFound(String roomId) {
        return new RoomException(ErrorCode.ROOM_001, roomId);
    }

    public static RoomException alreadyExists(String roomId) {
        return new RoomException(ErrorCode.ROOM_002, roomId);
    }

    public static RoomException peerAlreadyInRoom(String peerId) {
        return new RoomException(ErrorCode.ROOM_010, peerId);
    }

    public static RoomException closed(String roomId) {
        return new RoomException(ErrorCode.ROOM_011, roomId);
    }

    /**
     * The room was retired by the janitor while the peer was joining; a fresh
     * room can be created under the same id.
     */
    public boolean isRoomClosed() {
        return errorCode == ErrorCode.ROOM_011;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
