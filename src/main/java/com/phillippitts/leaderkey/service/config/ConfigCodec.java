package com.phillippitts.leaderkey.service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.ActionType;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.KeyGlyphs;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.domain.ScriptArgument;
import com.phillippitts.leaderkey.exception.ConfigDecodeException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes the JSON config document.
 *
 * <p>Output is deterministic: object fields in sorted order, four-space indentation,
 * {@code \n} line endings, {@code /} unescaped, absent fields omitted. Equal trees always
 * encode to identical bytes, which keeps file checksums comparable across runs.
 *
 * <p>Special keys are written by name ({@code "enter"}) and read back as glyphs ({@code "↩"}).
 */
@Component
public class ConfigCodec {

    private static final String TYPE = "type";
    private static final String KEY = "key";
    private static final String LABEL = "label";
    private static final String VALUE = "value";
    private static final String ACTIONS = "actions";
    private static final String ICON_PATH = "iconPath";
    private static final String OPEN_WITH = "openWith";
    private static final String ARGUMENTS = "arguments";
    private static final String NAME = "name";
    private static final String DEFAULT_VALUE = "defaultValue";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;

    public ConfigCodec() {
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = mapper.writer(printer);
    }

    /**
     * Decodes a document whose root must be a group.
     *
     * @throws ConfigDecodeException when the bytes are not JSON or do not describe a valid tree
     */
    public Group decode(byte[] json) {
        if (json == null) {
            throw new ConfigDecodeException("document is null");
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigDecodeException("not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigDecodeException("unreadable document: " + e.getMessage(), e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new ConfigDecodeException("document is empty");
        }
        Node root = decodeNode(tree, "$");
        if (!(root instanceof Group group)) {
            throw new ConfigDecodeException("root must be a group, got '" + root.type().jsonName() + "'");
        }
        return group;
    }

    public Group decode(String json) {
        return decode(json == null ? null : json.getBytes(StandardCharsets.UTF_8));
    }

    /** Encodes a tree to UTF-8 bytes. */
    public byte[] encode(Group root) {
        try {
            return writer.writeValueAsBytes(encodeNode(root));
        } catch (JsonProcessingException e) {
            // Tree nodes only hold strings, arrays and objects
            throw new IllegalStateException("Failed to encode config tree", e);
        }
    }

    public String encodeToString(Group root) {
        return new String(encode(root), StandardCharsets.UTF_8);
    }

    /** Encodes a tree to a Jackson node, used for REST responses. */
    public ObjectNode toJson(Group root) {
        return encodeNode(root);
    }

    private Node decodeNode(JsonNode json, String where) {
        if (!json.isObject()) {
            throw new ConfigDecodeException("expected an object at " + where);
        }
        String typeName = requiredText(json, TYPE, where);
        ActionType type = ActionType.fromJsonName(typeName)
                .orElseThrow(() -> new ConfigDecodeException("unknown type '" + typeName + "' at " + where));

        String key = KeyGlyphs.toGlyph(optionalText(json, KEY, where));
        String label = optionalText(json, LABEL, where);
        String iconPath = optionalText(json, ICON_PATH, where);

        if (type == ActionType.GROUP) {
            JsonNode actions = json.get(ACTIONS);
            if (actions == null || !actions.isArray()) {
                throw new ConfigDecodeException("group at " + where + " requires an 'actions' array");
            }
            List<Node> children = new ArrayList<>(actions.size());
            for (int i = 0; i < actions.size(); i++) {
                children.add(decodeNode(actions.get(i), where + ".actions[" + i + "]"));
            }
            return new Group(null, key, label, iconPath, children);
        }

        String value = requiredText(json, VALUE, where);
        String openWith = optionalText(json, OPEN_WITH, where);
        List<ScriptArgument> arguments = decodeArguments(json.get(ARGUMENTS), where);
        return new Action(null, key, type, label, value, iconPath, openWith, arguments);
    }

    private static List<ScriptArgument> decodeArguments(JsonNode json, String where) {
        if (json == null || json.isNull()) {
            return List.of();
        }
        if (!json.isArray()) {
            throw new ConfigDecodeException("'arguments' at " + where + " must be an array");
        }
        List<ScriptArgument> result = new ArrayList<>(json.size());
        for (int i = 0; i < json.size(); i++) {
            JsonNode arg = json.get(i);
            String argWhere = where + ".arguments[" + i + "]";
            if (!arg.isObject()) {
                throw new ConfigDecodeException("expected an object at " + argWhere);
            }
            result.add(new ScriptArgument(requiredText(arg, NAME, argWhere),
                    optionalText(arg, DEFAULT_VALUE, argWhere)));
        }
        return result;
    }

    private static String requiredText(JsonNode json, String field, String where) {
        JsonNode v = json.get(field);
        if (v == null || v.isNull()) {
            throw new ConfigDecodeException("missing '" + field + "' at " + where);
        }
        if (!v.isTextual()) {
            throw new ConfigDecodeException("'" + field + "' at " + where + " must be a string");
        }
        return v.asText();
    }

    private static String optionalText(JsonNode json, String field, String where) {
        JsonNode v = json.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new ConfigDecodeException("'" + field + "' at " + where + " must be a string");
        }
        return v.asText();
    }

    private ObjectNode encodeNode(Node node) {
        Map<String, JsonNode> fields = new TreeMap<>();
        JsonNodeFactory f = mapper.getNodeFactory();

        fields.put(TYPE, f.textNode(node.type().jsonName()));
        if (node.key() != null) {
            fields.put(KEY, f.textNode(KeyGlyphs.toText(node.key())));
        }
        if (node.label() != null) {
            fields.put(LABEL, f.textNode(node.label()));
        }
        if (node.iconPath() != null) {
            fields.put(ICON_PATH, f.textNode(node.iconPath()));
        }

        if (node instanceof Group group) {
            ArrayNode actions = f.arrayNode();
            for (Node child : group.children()) {
                actions.add(encodeNode(child));
            }
            fields.put(ACTIONS, actions);
        } else if (node instanceof Action action) {
            fields.put(VALUE, f.textNode(action.value()));
            if (action.openWith() != null) {
                fields.put(OPEN_WITH, f.textNode(action.openWith()));
            }
            if (!action.arguments().isEmpty()) {
                ArrayNode args = f.arrayNode();
                for (ScriptArgument a : action.arguments()) {
                    ObjectNode arg = f.objectNode();
                    if (a.defaultValue() != null) {
                        arg.put(DEFAULT_VALUE, a.defaultValue());
                    }
                    arg.put(NAME, a.name());
                    args.add(arg);
                }
                fields.put(ARGUMENTS, args);
            }
        }

        ObjectNode out = f.objectNode();
        out.setAll(fields);
        return out;
    }
}
