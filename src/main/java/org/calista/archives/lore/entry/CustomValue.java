package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value of a category-specific custom field: string | number | boolean | list of scalars.
 *
 * <p>The kind is fixed at construction; consumers switch on {@link #kind()} instead of
 * inspecting runtime types. Nested objects and nested lists are rejected.</p>
 */
public final class CustomValue {

    public enum Kind { STRING, NUMBER, BOOLEAN, LIST }

    private final Kind kind;
    /** Scalar payload (String, Number or Boolean); null for LIST. */
    private final Object scalar;
    /** Elements of a LIST, each a scalar CustomValue; empty otherwise. */
    private final List<CustomValue> items;

    private CustomValue(Kind kind, Object scalar, List<CustomValue> items) {
        this.kind = kind;
        this.scalar = scalar;
        this.items = items;
    }

    public static CustomValue of(String s) {
        return new CustomValue(Kind.STRING, Objects.requireNonNull(s, "s"), List.of());
    }

    public static CustomValue of(Number n) {
        return new CustomValue(Kind.NUMBER, Objects.requireNonNull(n, "n"), List.of());
    }

    public static CustomValue of(boolean b) {
        return new CustomValue(Kind.BOOLEAN, b, List.of());
    }

    public static CustomValue ofList(List<?> values) {
        Objects.requireNonNull(values, "values");
        ArrayList<CustomValue> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v == null) continue;
            if (v instanceof String s) out.add(of(s));
            else if (v instanceof Number n) out.add(of(n));
            else if (v instanceof Boolean b) out.add(of(b.booleanValue()));
            else if (v instanceof CustomValue cv && cv.kind != Kind.LIST) out.add(cv);
            else throw new IllegalArgumentException("custom field lists hold scalars only, got: " + v.getClass().getSimpleName());
        }
        return new CustomValue(Kind.LIST, null, Collections.unmodifiableList(out));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CustomValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("custom field value is null");
        }
        if (node.isArray()) {
            ArrayList<CustomValue> out = new ArrayList<>(node.size());
            for (JsonNode el : node) {
                if (el.isNull()) continue;
                if (el.isContainerNode()) throw new IllegalArgumentException("nested structures are not allowed in custom field lists");
                out.add(scalarFromJson(el));
            }
            return new CustomValue(Kind.LIST, null, Collections.unmodifiableList(out));
        }
        if (node.isObject()) throw new IllegalArgumentException("custom field objects are not supported");
        return scalarFromJson(node);
    }

    private static CustomValue scalarFromJson(JsonNode node) {
        if (node.isTextual()) return of(node.textValue());
        if (node.isNumber()) return of(node.numberValue());
        if (node.isBoolean()) return of(node.booleanValue());
        throw new IllegalArgumentException("unsupported custom field value: " + node.getNodeType());
    }

    public Kind kind() {
        return kind;
    }

    public List<CustomValue> items() {
        return items;
    }

    /**
     * Text fragments contributed by this value: one for a scalar, one per element for a list.
     */
    public List<String> texts() {
        switch (kind) {
            case STRING:
                return List.of((String) scalar);
            case NUMBER:
            case BOOLEAN:
                return List.of(String.valueOf(scalar));
            case LIST:
                ArrayList<String> out = new ArrayList<>(items.size());
                for (CustomValue item : items) out.addAll(item.texts());
                return out;
            default:
                throw new IllegalStateException("unknown kind " + kind);
        }
    }

    /** Human-readable form used by exports: lists are comma-joined. */
    public String display() {
        return String.join(", ", texts());
    }

    @JsonValue
    public Object toJson() {
        if (kind != Kind.LIST) return scalar;
        ArrayList<Object> out = new ArrayList<>(items.size());
        for (CustomValue item : items) out.add(item.scalar);
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof CustomValue v)) return false;
        return kind == v.kind && Objects.equals(scalar, v.scalar) && items.equals(v.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, scalar, items);
    }

    @Override
    public String toString() {
        return kind + ":" + display();
    }
}
