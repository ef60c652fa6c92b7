package com.aegis.common.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related failures on the platform.
 *
 * FEATURES:
 * - Type-safe error codes via {@link ErrorCode}
 * - Metadata support for runtime context enrichment
 * - Fluent API for adding metadata in catch blocks
 * - Unique error IDs for correlating log lines across services
 *
 * USAGE PATTERNS:
 * 1. Simple construction: new BusinessException(ErrorCode.XXX, "message")
 * 2. With cause: new BusinessException(ErrorCode.XXX, "message", cause)
 * 3. With metadata: new BusinessException(ErrorCode.XXX, "message").withMetadata("key", value)
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    /**
     * Most comprehensive constructor for maximum context preservation
     *
     * Example:
     * catch (IOException e) {
     *     throw new BusinessException(ErrorCode.INT_WATCHLIST_LOAD_FAILED,
     *         "Cannot read seed file", e, Map.of("location", location));
     * }
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.timestamp = Instant.now();
    }

    // ===== FLUENT API FOR METADATA ENRICHMENT =====

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getErrorId() {
        return errorId;
    }

    /**
     * Get metadata map (unmodifiable view). To modify metadata use withMetadata()
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }
}
