package com.ilograph.edit.io;

import com.ilograph.edit.doc.DocMap;

import java.nio.file.Path;

/**
 * A document together with the exact text it was parsed from and the
 * formatting profile detected in that text.
 */
public record LoadedDiagram(Path path, String text, FormatProfile profile, DocMap document) {
}
