package io.captionsync.error;

import io.captionsync.model.InstanceId;

import java.util.Map;

public class QueryException extends DatabaseException {

    public QueryException(ErrorCode code, String message, InstanceId instanceId, String sql, Throwable cause) {
        super(code, message, cause, instanceId, code.recoverableByDefault(),
                sql == null ? Map.of() : Map.of("sql", sql));
    }
}
