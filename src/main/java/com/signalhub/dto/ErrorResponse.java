package com.signalhub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Standardized error payload.
 * Used as the body of diagnostic HTTP errors and as the content of
 * WebSocket {@code error} frames sent before a rejected handshake is closed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;

    public ErrorResponse() {
        this.timestamp = LocalDateTime.now();
    }

    public ErrorResponse(String code, String message) {
        this();
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Room lifecycle errors (ROOM_XXX)
        ROOM_001("ROOM_001", "Room not found"),
        ROOM_002("ROOM_002", "Room already exists"),
        ROOM_008("ROOM_008", "Invalid room ID format"),
        ROOM_010("ROOM_010", "Peer already in room"),
        ROOM_011("ROOM_011", "Room is closed"),

        // Envelope and handshake validation errors (VAL_XXX)
        VAL_001("VAL_001", "Malformed message"),
        VAL_002("VAL_002", "Missing required field"),
        VAL_003("VAL_003", "Field too long"),
        VAL_004("VAL_004", "Invalid format");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }
}
