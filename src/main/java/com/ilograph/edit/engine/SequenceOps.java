package com.ilograph.edit.engine;

import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.doc.DocList;
import com.ilograph.edit.doc.DocMap;
import com.ilograph.edit.index.DocumentIndex;
import com.ilograph.edit.index.PerspectiveLocation;
import com.ilograph.edit.index.ReferenceSection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Top-level steps of a perspective's {@code sequence}, addressed by 1-based index. */
public final class SequenceOps {
    private SequenceOps() {
        // Utility class
    }

    public static List<StepRow> list(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        List<StepRow> rows = new ArrayList<>();
        DocMap sequence = loc.node().getMap("sequence");
        DocList steps = sequence == null ? null : sequence.getList("steps");
        if (steps == null) {
            return rows;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) instanceof DocMap s) {
                rows.add(new StepRow(loc.identifier(), i + 1, s.getString("to"), s.getString("toAndBack"),
                        s.getString("toAsync"), s.getString("restartAt"), s.getString("label"),
                        s.getString("description"),
                        Boolean.TRUE.equals(EngineSupport.booleanValue(s.get("bidirectional"))),
                        s.getString("color")));
            }
        }
        return rows;
    }

    /**
     * Adds a step. A perspective without a sequence gets one only when
     * {@code startIfMissing} supplies its {@code start}.
     */
    public static boolean add(DocMap document, String perspective, SequenceStep step, Integer index1,
            String startIfMissing) {
        if (step.actions().size() != 1) {
            throw new DiagramException("step requires exactly one action: to/to-and-back/to-async/restart-at");
        }
        DocMap node = DocumentIndex.singlePerspective(document, perspective).node();
        DocMap sequence = node.getMap("sequence");
        if (sequence == null && startIfMissing == null) {
            throw new DiagramException("perspective has no sequence; pass --start to initialize sequence");
        }
        DocList steps = sequence == null ? null : sequence.getList("steps");
        if (index1 != null) {
            EngineSupport.insertIndex(index1, steps == null ? 0 : steps.size());
        }

        DocMap payload = new DocMap();
        step.actions().forEach(payload::putString);
        putOptional(payload, step);
        if (sequence == null) {
            sequence = new DocMap();
            sequence.putString("start", startIfMissing);
            sequence.put("steps", new DocList());
            node.put("sequence", sequence);
        }
        EngineSupport.place(sequence.ensureList("steps"), payload, index1);
        return true;
    }

    /**
     * Updates one step. Setting an action replaces whichever action the step
     * had; the step must end with an action.
     */
    public static boolean edit(DocMap document, String perspective, int index1, SequenceStep update,
            boolean clearLabel, boolean clearDescription, boolean clearColor) {
        DocMap step = step(document, perspective, index1);
        if (update.actions().size() > 1) {
            throw new DiagramException(
                    "step action is ambiguous: set exactly one of to/to-and-back/to-async/restart-at");
        }
        DocMap candidate = step.deepCopy();
        apply(candidate, update, clearLabel, clearDescription, clearColor);
        if (ReferenceSection.STEP_KEYS.stream().noneMatch(candidate::containsKey)) {
            throw new DiagramException("step requires one action field");
        }
        List<String> before = EngineSupport.snapshot(step);
        apply(step, update, clearLabel, clearDescription, clearColor);
        return !before.equals(EngineSupport.snapshot(step));
    }

    public static boolean remove(DocMap document, String perspective, int index1) {
        DocList steps = steps(document, perspective);
        steps.remove(stepIndex(index1, steps));
        return true;
    }

    private static void apply(DocMap step, SequenceStep update, boolean clearLabel, boolean clearDescription,
            boolean clearColor) {
        Map<String, String> actions = update.actions();
        if (!actions.isEmpty()) {
            Map.Entry<String, String> action = actions.entrySet().iterator().next();
            for (String key : ReferenceSection.STEP_KEYS) {
                if (!key.equals(action.getKey())) {
                    step.remove(key);
                }
            }
            step.putString(action.getKey(), action.getValue());
        }
        putOptional(step, update);
        if (clearLabel) {
            step.remove("label");
        }
        if (clearDescription) {
            step.remove("description");
        }
        if (clearColor) {
            step.remove("color");
        }
    }

    private static void putOptional(DocMap step, SequenceStep values) {
        if (values.label() != null) {
            step.putString("label", values.label());
        }
        if (values.description() != null) {
            step.putString("description", values.description());
        }
        if (values.bidirectional() != null) {
            step.putBoolean("bidirectional", values.bidirectional());
        }
        if (values.color() != null) {
            step.putString("color", values.color());
        }
    }

    private static DocList steps(DocMap document, String perspective) {
        PerspectiveLocation loc = DocumentIndex.singlePerspective(document, perspective);
        DocMap sequence = loc.node().getMap("sequence");
        if (sequence == null) {
            throw new DiagramException("perspective has no sequence: " + loc.identifier());
        }
        DocList steps = sequence.getList("steps");
        if (steps == null) {
            throw new DiagramException("perspective has no sequence steps: " + perspective);
        }
        return steps;
    }

    private static DocMap step(DocMap document, String perspective, int index1) {
        DocList steps = steps(document, perspective);
        if (!(steps.get(stepIndex(index1, steps)) instanceof DocMap step)) {
            throw new DiagramException("sequence step at index " + index1 + " is not a mapping");
        }
        return step;
    }

    private static int stepIndex(int index1, DocList steps) {
        if (index1 < 1 || index1 > steps.size()) {
            throw new DiagramException("sequence step index out of range: " + index1);
        }
        return index1 - 1;
    }
}
