package com.questrail.plc.interpreter;

import com.questrail.plc.store.VariableStore;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scope
 * -----------------------------------------------------------------------------
 * Name resolution for the body currently executing.
 *
 * <h2>Global scope</h2>
 * Names map to themselves in the root store.
 *
 * <h2>Member scope</h2>
 * Used for user function-block bodies and function calls. A name resolves in
 * this order:
 * <ol>
 *   <li>a bound VAR_IN_OUT parameter: the caller's cell</li>
 *   <li>a declared member: {@code prefix + name} in this scope's store</li>
 *   <li>otherwise the global scope</li>
 * </ol>
 * Dotted names resolve their first segment this way and append the rest, so
 * {@code Inner.Q} inside instance {@code Outer} becomes {@code Outer.Inner.Q}.
 */
public final class Scope
{
    private final TypeRegistry registry;
    private final VariableStore store;
    private final String prefix;
    private final Set<String> members;
    private final Map<String, Cell> aliases;
    private final Scope global;

    private Scope(TypeRegistry registry,
                  VariableStore store,
                  String prefix,
                  Set<String> members,
                  Map<String, Cell> aliases,
                  Scope global) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.store = Objects.requireNonNull(store, "store");
        this.prefix = prefix;
        this.members = members;
        this.aliases = aliases;
        this.global = global;
    }

    public static Scope global(TypeRegistry registry, VariableStore store) {
        return new Scope(registry, store, "", Set.of(), Map.of(), null);
    }

    /**
     * A scope whose members live under {@code prefix} in {@code store}.
     */
    public Scope member(VariableStore memberStore, String memberPrefix, Set<String> memberNames,
                        Map<String, Cell> inOutAliases) {
        return new Scope(registry, memberStore, memberPrefix,
                Set.copyOf(memberNames), Map.copyOf(inOutAliases), global());
    }

    public Scope global() {
        return global == null ? this : global;
    }

    public boolean isGlobal() {
        return global == null;
    }

    public VariableStore store() {
        return store;
    }

    public TypeRegistry registry() {
        return registry;
    }

    /**
     * Resolves a (possibly dotted) variable name to its cell.
     */
    public Cell resolve(String name) {
        int dot = name.indexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        String rest = dot < 0 ? "" : name.substring(dot);

        Cell alias = aliases.get(base);
        if (alias != null) {
            return rest.isEmpty() ? alias : cell(alias.store(), alias.key() + rest);
        }
        if (members.contains(base)) {
            return cell(store, prefix + name);
        }
        if (global != null) {
            return global.resolve(name);
        }
        return cell(store, name);
    }

    private Cell cell(VariableStore target, String key) {
        return new Cell(target, key, registry.typeOf(key), registry.isConstant(key));
    }
}
