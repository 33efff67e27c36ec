package com.bsa.analyzer.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over one node of the compiler's JSON AST.
 *
 * Lookups never fail: a missing or mistyped child yields {@link #EMPTY}, a missing list
 * yields an empty list and a missing scalar yields the supplied default.
 */
public final class AstNode {

    public static final AstNode EMPTY = new AstNode(new JsonObject());

    private final JsonObject json;

    private AstNode(JsonObject json) {
        this.json = json;
    }

    public static AstNode of(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return EMPTY;
        }
        return new AstNode(element.getAsJsonObject());
    }

    /** Builds a synthetic node, e.g. {@code {"nodeType":"Expression","expression":cond}}. */
    public static AstNode synthetic(NodeType type, String childKey, AstNode child) {
        JsonObject obj = new JsonObject();
        obj.addProperty("nodeType", type.jsonName());
        obj.add(childKey, child.json.deepCopy());
        return new AstNode(obj);
    }

    public boolean isPresent() { return json.size() > 0; }

    public String nodeTypeName() { return string("nodeType", "Unknown"); }

    public NodeType type() { return NodeType.of(nodeTypeName()); }

    public boolean is(NodeType type) { return type() == type; }

    public boolean has(String key) {
        return json.has(key) && !json.get(key).isJsonNull();
    }

    public AstNode get(String key) {
        return of(json.get(key));
    }

    public List<AstNode> list(String key) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonArray()) {
            return Collections.emptyList();
        }
        JsonArray array = element.getAsJsonArray();
        List<AstNode> out = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            out.add(of(e));
        }
        return out;
    }

    /** Scalar list entries as strings (e.g. pragma {@code literals}); non-scalars are skipped. */
    public List<String> strings(String key) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonArray()) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (JsonElement e : element.getAsJsonArray()) {
            if (e.isJsonPrimitive()) out.add(e.getAsString());
        }
        return out;
    }

    public String string(String key, String defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return defaultValue;
        }
        return element.getAsString();
    }

    public boolean bool(String key, boolean defaultValue) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return defaultValue;
        }
        JsonPrimitive p = element.getAsJsonPrimitive();
        return p.isBoolean() ? p.getAsBoolean() : defaultValue;
    }

    /** Object-valued members and object elements of array members, in document order. */
    public List<AstNode> children() {
        List<AstNode> out = new ArrayList<>();
        for (Map.Entry<String, JsonElement> e : json.entrySet()) {
            JsonElement value = e.getValue();
            if (value.isJsonObject()) {
                out.add(new AstNode(value.getAsJsonObject()));
            } else if (value.isJsonArray()) {
                for (JsonElement item : value.getAsJsonArray()) {
                    if (item.isJsonObject()) out.add(new AstNode(item.getAsJsonObject()));
                }
            }
        }
        return out;
    }

    public String name() { return string("name", ""); }

    public String src() { return string("src", "0:0:0"); }

    /**
     * The statements of a body node. A {@code Block} yields its statements; any other present
     * node is a single-statement body.
     */
    public List<AstNode> bodyStatements() {
        if (!isPresent()) return Collections.emptyList();
        if (has("statements")) return list("statements");
        if (is(NodeType.BLOCK)) return Collections.emptyList();
        return List.of(this);
    }

    JsonObject json() { return json; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode)) return false;
        return json.equals(((AstNode) o).json);
    }

    @Override
    public int hashCode() { return json.hashCode(); }

    @Override
    public String toString() { return json.toString(); }
}
