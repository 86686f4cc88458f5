package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Walkthrough slides of a perspective, addressed by 1-based index. */
public final class WalkthroughOps {
    private WalkthroughOps() {
        // Utility class
    }

    public static List<SlideRow> list(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        List<SlideRow> rows = new ArrayList<>();
        DocList slides = loc.node().getList("walkthrough");
        if (slides == null) {
            return rows;
        }
        for (int i = 0; i < slides.size(); i++) {
            if (slides.get(i) instanceof DocMap s) {
                rows.add(new SlideRow(loc.identifier(), i + 1, new Slide(s.getString("text"),
                        s.getString("select"), s.getString("expand"), s.getString("highlight"),
                        s.getString("hide"), EngineSupport.numberValue(s.get("detail")))));
            }
        }
        return rows;
    }

    public static boolean add(DocMap document, String perspective, Slide slide, Integer index1) {
        if (slide.isEmpty()) {
            throw new DiagramException("slide requires at least one field");
        }
        DocMap node = DocumentIndex.singlePerspective(document, perspective).node();
        DocList existing = node.getList("walkthrough");
        if (index1 != null) {
            EngineSupport.insertIndex(index1, existing == null ? 0 : existing.size());
        }
        DocMap payload = new DocMap();
        apply(payload, slide, List.of());
        EngineSupport.place(node.ensureList("walkthrough"), payload, index1);
        return true;
    }

    /** Sets the non-null fields of {@code update}, then drops the {@code clear} keys. */
    public static boolean edit(DocMap document, String perspective, int index1, Slide update,
            Collection<SlideField> clear) {
        if (update.isEmpty() && clear.isEmpty()) {
            throw new DiagramException("set at least one update field");
        }
        DocList slides = slides(document, perspective);
        if (!(slides.get(slideIndex(index1, slides)) instanceof DocMap slide)) {
            throw new DiagramException("walkthrough slide at index " + index1 + " is not a mapping");
        }
        List<String> before = EngineSupport.snapshot(slide);
        apply(slide, update, clear);
        return !before.equals(EngineSupport.snapshot(slide));
    }

    public static boolean remove(DocMap document, String perspective, int index1) {
        DocList slides = slides(document, perspective);
        slides.remove(slideIndex(index1, slides));
        return true;
    }

    private static void apply(DocMap slide, Slide values, Collection<SlideField> clear) {
        putIfPresent(slide, SlideField.TEXT, values.text());
        putIfPresent(slide, SlideField.SELECT, values.select());
        putIfPresent(slide, SlideField.EXPAND, values.expand());
        putIfPresent(slide, SlideField.HIGHLIGHT, values.highlight());
        putIfPresent(slide, SlideField.HIDE, values.hide());
        if (values.detail() != null) {
            slide.putNumber(SlideField.DETAIL.key(), values.detail());
        }
        for (SlideField field : clear) {
            slide.remove(field.key());
        }
    }

    private static void putIfPresent(DocMap slide, SlideField field, String value) {
        if (value != null) {
            slide.putString(field.key(), value);
        }
    }

    private static DocList slides(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocList slides = loc.node().getList("walkthrough");
        if (slides == null) {
            throw new DiagramException("perspective has no walkthrough: " + loc.identifier());
        }
        return slides;
    }

    private static int slideIndex(int index1, DocList slides) {
        if (index1 < 1 || index1 > slides.size()) {
            throw new DiagramException("walkthrough slide index out of range: " + index1);
        }
        return index1 - 1;
    }
}
