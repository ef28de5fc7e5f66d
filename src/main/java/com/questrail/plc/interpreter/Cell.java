package com.questrail.plc.interpreter;

import com.questrail.plc.store.VariableStore;

import java.util.Objects;

/**
 * Cell
 * -----------------------------------------------------------------------------
 * A resolved storage location: one key in one {@link VariableStore}, together
 * with the declared type that governs reads and writes.
 * <p>
 * Cells are how VAR_IN_OUT aliasing works: a callee scope maps the parameter
 * name to the caller's cell, so every write lands in the caller's storage
 * immediately.
 *
 * <h2>Reads</h2>
 * A declared scalar type reads its own family. Anything else reads the first
 * family containing the key (bool, int, real, time) and falls back to
 * {@code FALSE}.
 *
 * <h2>Writes</h2>
 * <ul>
 *   <li>BOOL  - truthiness of the value</li>
 *   <li>INT   - numeric value truncated toward zero</li>
 *   <li>TIME  - numeric value truncated toward zero, in ms</li>
 *   <li>REAL  - numeric value</li>
 *   <li>otherwise - by value: booleans to the bool family, whole finite
 *       numbers to the int family, anything else to the real family</li>
 * </ul>
 * The {@code constant} flag is informational; callers decide whether a write
 * to a constant is allowed.
 */
public record Cell(VariableStore store, String key, DeclaredType type, boolean constant)
{
    public Cell {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
    }

    public Value read() {
        return switch (type) {
            case BOOL -> Value.of(store.getBool(key));
            case INT -> Value.of((double) store.getInt(key));
            case REAL -> Value.of(store.getReal(key));
            case TIME -> Value.of((double) store.getTime(key));
            default -> readByPresence(store, key);
        };
    }

    public void write(Value value) {
        Objects.requireNonNull(value, "value");
        switch (type) {
            case BOOL -> store.setBool(key, value.asBoolean());
            case INT -> store.setInt(key, truncate(value.asNumber()));
            case TIME -> store.setTime(key, truncate(value.asNumber()));
            case REAL -> store.setReal(key, value.asNumber());
            default -> writeByValue(store, key, value);
        }
    }

    /** Reads whichever family holds {@code key}; {@code FALSE} when none does. */
    static Value readByPresence(VariableStore store, String key) {
        if (store.containsBool(key)) {
            return Value.of(store.getBool(key));
        }
        if (store.containsInt(key)) {
            return Value.of((double) store.getInt(key));
        }
        if (store.containsReal(key)) {
            return Value.of(store.getReal(key));
        }
        if (store.containsTime(key)) {
            return Value.of((double) store.getTime(key));
        }
        return Value.FALSE;
    }

    static void writeByValue(VariableStore store, String key, Value value) {
        if (value instanceof Value.BoolValue b) {
            store.setBool(key, b.value());
        } else if (value instanceof Value.NumberValue n && n.isWhole()) {
            store.setInt(key, (long) n.value());
        } else {
            store.setReal(key, value.asNumber());
        }
    }

    /** Truncation toward zero; NaN becomes 0 and infinities saturate. */
    static long truncate(double value) {
        return (long) value;
    }
}
