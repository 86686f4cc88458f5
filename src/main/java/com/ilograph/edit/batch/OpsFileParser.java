package com.ilograph.edit.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.ilograph.edit.api.DiagramException;
import com.ilograph.edit.io.DiagramYaml;
import lombok.extern.log4j.Log4j2;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads ops files ({@code ops: [...]} in YAML or JSON) into typed
 * {@link Operation}s. Every schema problem is collected before failing.
 */
@Log4j2
public final class OpsFileParser {
    private static final YAMLMapper MAPPER = YAMLMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final String HEADER = "invalid ops file:";

    private OpsFileParser() {
        // Utility class
    }

    public static List<Operation> parseFile(Path path) {
        return parse(DiagramYaml.readText(path));
    }

    public static List<Operation> parse(String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DiagramException("invalid ops file: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw DiagramException.of(HEADER, List.of("ops: field required"));
        }
        List<String> problems = new ArrayList<>();
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.equals("ops")) {
                problems.add(name + ": extra inputs are not permitted");
            }
        }
        JsonNode ops = root.get("ops");
        if (ops == null) {
            problems.add("ops: field required");
        } else if (!ops.isArray()) {
            problems.add("ops: input should be a valid list");
        } else if (ops.isEmpty()) {
            problems.add("ops: ops must contain at least one operation (example op: rename.resource)");
        }
        if (!problems.isEmpty()) {
            throw DiagramException.of(HEADER, problems);
        }

        List<Operation> out = new ArrayList<>();
        for (int i = 0; i < ops.size(); i++) {
            Operation op = bind(ops.get(i), "ops[" + i + "]", problems);
            if (op != null) {
                out.add(op);
            }
        }
        if (!problems.isEmpty()) {
            throw DiagramException.of(HEADER, problems);
        }
        log.debug("Parsed {} operation(s): {}", out.size(),
                out.stream().map(o -> o.kind().label()).collect(Collectors.joining(", ")));
        return out;
    }

    /** Parses one operation given as a JSON object with an {@code op} key. */
    public static Operation parseInline(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DiagramException("invalid operation: " + e.getOriginalMessage(), e);
        }
        List<String> problems = new ArrayList<>();
        Operation op = bind(node, "op", problems);
        if (!problems.isEmpty()) {
            throw DiagramException.of("invalid operation:", problems);
        }
        return op;
    }

    private static Operation bind(JsonNode node, String prefix, List<String> problems) {
        if (node == null || !node.isObject()) {
            problems.add(prefix + ": input should be an object");
            return null;
        }
        JsonNode opNode = node.get("op");
        if (opNode == null || !opNode.isTextual()) {
            problems.add(prefix + ".op: field required");
            return null;
        }
        OperationKind kind;
        try {
            kind = OperationKind.fromString(opNode.asText().strip());
        } catch (IllegalArgumentException e) {
            problems.add(prefix + ".op: " + e.getMessage());
            return null;
        }
        ObjectNode fields = ((ObjectNode) node).deepCopy();
        fields.remove("op");
        Operation op;
        try {
            op = MAPPER.treeToValue(fields, kind.type());
        } catch (UnrecognizedPropertyException e) {
            problems.add(prefix + "." + e.getPropertyName() + ": extra inputs are not permitted");
            return null;
        } catch (JsonMappingException e) {
            problems.add(prefix + path(e) + ": " + firstLine(e));
            return null;
        } catch (JsonProcessingException e) {
            problems.add(prefix + ": " + e.getOriginalMessage());
            return null;
        }
        for (String problem : op.validate()) {
            problems.add(prefix + "." + problem);
        }
        return op;
    }

    private static String path(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                sb.append('.').append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }

    private static String firstLine(JsonMappingException e) {
        Throwable cause = e.getCause();
        String message = cause instanceof IllegalArgumentException ? cause.getMessage() : e.getOriginalMessage();
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
