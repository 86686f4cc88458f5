package com.ilograph.edit.io;

import com.ilograph.edit.doc.DocScalar;
import org.yaml.snakeyaml.comments.CommentLine;
import org.yaml.snakeyaml.comments.CommentType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parts of the output the emitter cannot place by itself, swapped in after
 * emitting.
 *
 * <p>
 * Comments and blank lines above a block sequence item are written by the
 * emitter after the {@code -} indicator, which splits {@code - id: x} over two
 * lines. They are emitted as one marker comment instead and moved back above
 * the indicator here. Literal and folded scalars whose value is unchanged are
 * emitted as a plain marker and replaced by their source lines, so their line
 * breaks and trailing blank lines survive.
 */
final class EmitPlaceholders {
    private static final String ITEM_MARKER = "@ilo-edit-item-";
    private static final String BLOCK_MARKER = "iloeditblock";

    private static final Pattern ITEM_ON_DASH = Pattern.compile(
            "^(?<indent> *)-\\s+#\\s*@ilo-edit-item-(?<n>\\d{1,9})\\s*$");
    private static final Pattern ITEM_ALONE = Pattern.compile("^(?<indent> *)#\\s*@ilo-edit-item-(?<n>\\d{1,9})\\s*$");
    private static final Pattern DASH_ONLY = Pattern.compile("^(?<indent> *)-\\s*$");
    private static final Pattern BLOCK = Pattern.compile(
            "^(?<prefix>.*?)iloeditblock(?<n>\\d{1,9})x(?<rest>(?:\\s+#.*)?)$");

    private final List<List<CommentLine>> leading = new ArrayList<>();
    private final List<DocScalar.SourceBlock> blocks = new ArrayList<>();

    /** Stores comments that belong above a sequence item and returns the marker standing in for them. */
    CommentLine itemMarker(List<CommentLine> comments) {
        leading.add(List.copyOf(comments));
        return new CommentLine(null, null, ITEM_MARKER + (leading.size() - 1), CommentType.BLOCK);
    }

    /** Stores a block scalar's source and returns the plain value standing in for it. */
    String blockMarker(DocScalar.SourceBlock block) {
        blocks.add(block);
        return BLOCK_MARKER + (blocks.size() - 1) + "x";
    }

    String restore(String emitted) {
        if (leading.isEmpty() && blocks.isEmpty()) {
            return emitted;
        }
        List<String> lines = restoreBlocks(restoreItems(LineDiff.lines(emitted)));
        String joined = String.join("\n", lines);
        return emitted.endsWith("\n") ? joined + "\n" : joined;
    }

    private List<String> restoreItems(List<String> lines) {
        if (leading.isEmpty()) {
            return lines;
        }
        List<String> out = new ArrayList<>(lines.size() + 16);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            Matcher onDash = ITEM_ON_DASH.matcher(line);
            if (onDash.matches() && index(onDash, leading.size()) >= 0) {
                i = mergeItem(out, lines, i, onDash.group("indent"), leading.get(index(onDash, leading.size())));
                continue;
            }
            Matcher alone = ITEM_ALONE.matcher(line);
            if (alone.matches() && index(alone, leading.size()) >= 0) {
                List<CommentLine> comments = leading.get(index(alone, leading.size()));
                Matcher dash = out.isEmpty() ? null : DASH_ONLY.matcher(out.get(out.size() - 1));
                if (dash != null && dash.matches()) {
                    out.remove(out.size() - 1);
                    i = mergeItem(out, lines, i, dash.group("indent"), comments);
                } else {
                    addComments(out, comments, alone.group("indent"));
                }
                continue;
            }
            out.add(line);
        }
        return out;
    }

    private List<String> restoreBlocks(List<String> lines) {
        if (blocks.isEmpty()) {
            return lines;
        }
        List<String> out = new ArrayList<>(lines.size() + 16);
        for (String line : lines) {
            Matcher block = BLOCK.matcher(line);
            if (!block.matches() || index(block, blocks.size()) < 0) {
                out.add(line);
                continue;
            }
            DocScalar.SourceBlock source = blocks.get(index(block, blocks.size()));
            out.add(block.group("prefix") + source.indicator() + block.group("rest"));
            int delta = leadingSpaces(line) - source.headerIndent();
            for (String content : source.lines()) {
                out.add(shift(content, delta));
            }
        }
        return out;
    }

    /** Writes the comments above the item, then the item's first line joined to its indicator. */
    private static int mergeItem(List<String> out, List<String> lines, int markerLine, String indent,
            List<CommentLine> comments) {
        addComments(out, comments, indent);
        int next = markerLine + 1;
        if (next >= lines.size()) {
            out.add(indent + "-");
            return markerLine;
        }
        out.add(indent + "- " + lines.get(next).stripLeading());
        return next;
    }

    private static void addComments(List<String> out, List<CommentLine> comments, String indent) {
        for (CommentLine c : comments) {
            if (c.getCommentType() == CommentType.BLANK_LINE) {
                out.add("");
            } else {
                out.add(indent + "#" + c.getValue());
            }
        }
    }

    private static int index(Matcher m, int size) {
        int n = Integer.parseInt(m.group("n"));
        return n < size ? n : -1;
    }

    private static String shift(String line, int delta) {
        if (delta == 0 || line.isBlank()) {
            return line;
        }
        if (delta > 0) {
            return " ".repeat(delta) + line;
        }
        return line.substring(Math.min(-delta, leadingSpaces(line)));
    }

    private static int leadingSpaces(String s) {
        int n = 0;
        while (n < s.length() && s.charAt(n) == ' ') {
            n++;
        }
        return n;
    }
}
