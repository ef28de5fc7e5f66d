package com.questrail.plc.interpreter;

import com.questrail.plc.ast.StAst;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RuntimeState
 * -----------------------------------------------------------------------------
 * Interpreter state that persists across scans but is not a program
 * variable:
 * <ul>
 *   <li>the {@link TypeRegistry} built for the loaded program</li>
 *   <li>the previous-input table holding counter edge memory, keyed
 *       {@code instance.CU} and {@code instance.CD}</li>
 *   <li>descending CASE ranges already reported, so each is reported once</li>
 * </ul>
 * One RuntimeState belongs to one program and one store.
 */
public final class RuntimeState
{
    private final StAst ast;
    private final TypeRegistry registry;
    private final Map<String, Boolean> previousInputs = new HashMap<>();
    private final Set<String> reportedRanges = new HashSet<>();

    public RuntimeState(StAst ast, TypeRegistry registry) {
        this.ast = Objects.requireNonNull(ast, "ast");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static RuntimeState create(StAst ast) {
        return new RuntimeState(ast, TypeRegistry.build(ast));
    }

    public StAst ast() {
        return ast;
    }

    public TypeRegistry registry() {
        return registry;
    }

    public boolean previousInput(String key) {
        return previousInputs.getOrDefault(key, false);
    }

    public void setPreviousInput(String key, boolean value) {
        previousInputs.put(key, value);
    }

    /** Forgets the edge memory of one counter instance. */
    public void clearPreviousInputs(String instanceKey) {
        previousInputs.remove(instanceKey + ".CU");
        previousInputs.remove(instanceKey + ".CD");
    }

    /**
     * @return {@code true} the first time a given range is seen
     */
    boolean firstReportOf(String range) {
        return reportedRanges.add(range);
    }

    /** Drops edge memory and reporting history; the registry is kept. */
    public void reset() {
        previousInputs.clear();
        reportedRanges.clear();
    }
}
