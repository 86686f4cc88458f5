package com.ilograph.edit.io;

/** A reference key whose value was written as a bare {@code [...]} bracket expression. */
public record BracketScalar(String key, String value) {
}
