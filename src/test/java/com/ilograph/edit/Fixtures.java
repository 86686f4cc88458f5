package com.ilograph.edit;

import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.io.DiagramYaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads diagram fixtures from {@code src/test/resources/fixtures}. */
public final class Fixtures {
    private Fixtures() {
        // Utility class
    }

    public static String text(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static DocMap sample() {
        return DiagramYaml.parse(text("sample.yaml"), "sample.yaml");
    }

    public static DocMap parse(String yaml) {
        return DiagramYaml.parse(yaml, "inline.yaml");
    }
}
