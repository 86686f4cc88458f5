package com.ilograph.edit.batch;

import java.util.List;

/**
 * One typed mutation request, as read from an ops file or an inline JSON
 * payload.
 */
public interface Operation {
    OperationKind kind();

    /**
     * Schema problems beyond what deserialization catches, each formatted as
     * {@code field: message}. Empty when the operation is well-formed.
     */
    default List<String> validate() {
        return List.of();
    }
}
