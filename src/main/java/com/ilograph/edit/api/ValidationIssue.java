package com.ilograph.edit.api;

/**
 * A single validator finding.
 *
 * @param code    stable rule code, e.g. {@code broken-reference}
 * @param path    document path of the offending value, e.g. {@code perspectives[0].relations[1].to}
 * @param message human-readable description
 */
public record ValidationIssue(String code, String path, String message) {
    public String render() {
        return code + " at " + path + ": " + message;
    }
}
