package io.captionsync.error;

import io.captionsync.model.InstanceId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the typed failures raised by the database subsystem.
 * Carries an {@link ErrorCode}, a recoverability flag and free-form context for the event log.
 */
public class DatabaseException extends RuntimeException {
    private final ErrorCode code;
    private final boolean recoverable;
    private final InstanceId instanceId;
    private final Map<String, Object> context;

    public DatabaseException(ErrorCode code, String message) {
        this(code, message, null, null, code.recoverableByDefault(), Map.of());
    }

    public DatabaseException(ErrorCode code, String message, Throwable cause) {
        this(code, message, cause, null, code.recoverableByDefault(), Map.of());
    }

    public DatabaseException(ErrorCode code, String message, InstanceId instanceId, Throwable cause) {
        this(code, message, cause, instanceId, code.recoverableByDefault(), Map.of());
    }

    public DatabaseException(
            ErrorCode code,
            String message,
            Throwable cause,
            InstanceId instanceId,
            boolean recoverable,
            Map<String, Object> context
    ) {
        super(message, cause);
        this.code = code == null ? ErrorCode.UNKNOWN_ERROR : code;
        this.recoverable = recoverable;
        this.instanceId = instanceId;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public ErrorCode code() {
        return code;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public InstanceId instanceId() {
        return instanceId;
    }

    public Map<String, Object> context() {
        return context;
    }

    public RecoveryStrategy recoveryStrategy() {
        return RecoveryStrategy.forError(this);
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", code.name());
        out.put("message", getMessage() == null ? "" : getMessage());
        out.put("recoverable", recoverable);
        out.put("recovery", recoveryStrategy().name().toLowerCase());
        if (instanceId != null) {
            out.put("instance_id", instanceId.value());
        }
        if (getCause() != null) {
            out.put("cause", getCause().getClass().getSimpleName() + ": " + getCause().getMessage());
        }
        out.putAll(context);
        return out;
    }

    /**
     * Wraps an arbitrary failure, keeping typed exceptions as they are.
     */
    public static DatabaseException wrap(Throwable error, ErrorCode fallback, InstanceId instanceId) {
        if (error instanceof DatabaseException typed) {
            return typed;
        }
        String message = error == null || error.getMessage() == null ? fallback.name() : error.getMessage();
        return new DatabaseException(fallback, message, instanceId, error);
    }
}
