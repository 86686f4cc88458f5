package com.ilograph.edit.engine;

/** One walkthrough slide as listed; {@code index} is 1-based. */
public record SlideRow(String perspective, int index, Slide slide) {
}
