package com.ilograph.edit.io;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.doc.DocNode;
import com.ilograph.edit.doc.DocTrees;
import lombok.extern.log4j.Log4j2;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.serializer.AnchorGenerator;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Format-preserving load and dump of diagram documents.
 *
 * <p>
 * Loading quotes bare bracket references, composes the YAML node graph with
 * comments kept and converts it to the document model. Dumping converts back,
 * emits with the indentation of the detected {@link FormatProfile}, puts item
 * comments and unchanged block scalars back in their source form, then
 * re-indents top-level sections and unquotes the bracket references that were
 * bare in the source. {@link #dump} depends only on the document and the
 * profile.
 */
@Log4j2
public final class DiagramYaml {
    static final String BRACKET_HINT =
            "hint: quote Ilograph bracket references (example: from: '[*.cloudfront.net]')";

    private DiagramYaml() {
        // Utility class
    }

    // ── Reading ──────────────────────────────────────────────────────

    public static String readText(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /** Reads, profiles and parses a file. */
    public static LoadedDiagram load(Path path) {
        String text = readText(path);
        FormatProfile profile = FormatProfiles.detect(text);
        return new LoadedDiagram(path, text, profile, parse(text, path.toString()));
    }

    /**
     * Parses diagram text. An empty document yields an empty mapping.
     *
     * @param sourceName file name used in error messages
     */
    public static DocMap parse(String text, String sourceName) {
        Node root;
        try {
            root = yaml(loaderOptions(), dumperOptions(FormatProfile.defaults(), Set.of()))
                    .compose(new StringReader(BracketScalars.quote(text)));
        } catch (YAMLException e) {
            String base = "yaml parse error in " + sourceName + ": " + e.getMessage();
            String raw = String.valueOf(e.getMessage());
            throw new DiagramException(raw.contains("found undefined alias") ? base + "\n" + BRACKET_HINT : base, e);
        }
        if (root == null) {
            return new DocMap();
        }
        DocNode doc = SnakeBridge.toDoc(root, LineDiff.lines(text));
        if (doc instanceof DocMap map) {
            return map;
        }
        if (doc.tag() != null && doc.tag().equals(Tag.NULL)) {
            return new DocMap();
        }
        throw new DiagramException("yaml root must be a mapping/object (file: " + sourceName + ")");
    }

    // ── Writing ──────────────────────────────────────────────────────

    public static String dump(DocMap document, FormatProfile profile) {
        Set<String> used = DocTrees.anchorNames(document);
        StringWriter out = new StringWriter();
        EmitPlaceholders placeholders = new EmitPlaceholders();
        yaml(loaderOptions(), dumperOptions(profile, used)).serialize(SnakeBridge.toNode(document, placeholders), out);
        String emitted = placeholders.restore(out.toString());
        String indented = SectionIndenter.apply(emitted, profile.topLevelSequenceIndents());
        return BracketScalars.restore(indented, profile.unquotedBrackets());
    }

    // ── Configuration ────────────────────────────────────────────────

    private static Yaml yaml(LoaderOptions loader, DumperOptions dumper) {
        return new Yaml(new SafeConstructor(loader), new Representer(dumper), dumper, loader);
    }

    private static LoaderOptions loaderOptions() {
        LoaderOptions lo = new LoaderOptions();
        lo.setProcessComments(true);
        lo.setAllowDuplicateKeys(true);
        lo.setMaxAliasesForCollections(10_000);
        lo.setCodePointLimit(64 * 1024 * 1024);
        return lo;
    }

    private static DumperOptions dumperOptions(FormatProfile profile, Set<String> usedAnchors) {
        DumperOptions dop = new DumperOptions();
        dop.setProcessComments(true);
        dop.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dop.setWidth(4096);
        dop.setSplitLines(false);
        dop.setIndent(2);
        if (profile.sequenceIndentStyle() == SequenceIndentStyle.INDENTED) {
            dop.setIndicatorIndent(2);
            dop.setIndentWithIndicator(true);
        } else {
            dop.setIndicatorIndent(0);
            dop.setIndentWithIndicator(false);
        }
        dop.setAnchorGenerator(new PreservingAnchorGenerator(usedAnchors));
        return dop;
    }

    /**
     * Emits a node's own label when it has one; shared nodes without a label
     * get a fresh {@code idNNN} name that no authored anchor uses.
     */
    static final class PreservingAnchorGenerator implements AnchorGenerator {
        private final Set<String> used;
        private int counter;

        PreservingAnchorGenerator(Set<String> used) {
            this.used = new HashSet<>(used);
        }

        @Override
        public String nextAnchor(Node node) {
            if (node.getAnchor() != null) {
                return node.getAnchor();
            }
            String candidate;
            do {
                candidate = String.format("id%03d", ++counter);
            } while (used.contains(candidate));
            used.add(candidate);
            return candidate;
        }
    }
}
