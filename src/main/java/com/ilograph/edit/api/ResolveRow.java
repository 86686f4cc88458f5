package com.ilograph.edit.api;

/**
 * One row of a reference resolution: the comma-separated part the token came
 * from, the token itself, its status and a status-specific detail (resolved
 * path, ambiguous paths, alias target, or {@code -}).
 */
public record ResolveRow(String part, String token, ResolveStatus status, String details) {
}
