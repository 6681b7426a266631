package com.signalhub.validation;

import com.signalhub.dto.ErrorResponse.ErrorCode;
import com.signalhub.exception.RoomException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validation of the identifiers a client supplies at handshake time.
 */
@Component
public class InputValidator {

    // Room ID and peer ID: alphanumeric, hyphens, underscores, max 64 chars
    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private static final int MAX_ID_LENGTH = 64;

    /**
     * Validate room ID format.
     */
    public void validateRoomId(String roomId) {
        if (roomId == null || roomId.isEmpty()) {
            throw new RoomException(ErrorCode.VAL_002, "room_id is required");
        }

        if (roomId.length() > MAX_ID_LENGTH) {
            throw new RoomException(ErrorCode.VAL_003, "room_id exceeds maximum length of " + MAX_ID_LENGTH);
        }

        if (!ID_PATTERN.matcher(roomId).matches()) {
            throw new RoomException(ErrorCode.ROOM_008,
                    "room_id can only contain letters, numbers, hyphens, and underscores");
        }
    }

    /**
     * Validate a client-supplied peer ID. Absent is fine: the server generates one.
     */
    public void validatePeerId(String peerId) {
        if (peerId == null) {
            return;
        }

        if (peerId.length() > MAX_ID_LENGTH) {
            throw new RoomException(ErrorCode.VAL_003, "user_id exceeds maximum length of " + MAX_ID_LENGTH);
        }

        if (!ID_PATTERN.matcher(peerId).matches()) {
            throw new RoomException(ErrorCode.VAL_004,
                    "user_id can only contain letters, numbers, hyphens, and underscores");
        }
    }
}
