package com.questrail.plc.interpreter;

import com.questrail.plc.ast.PouType;
import com.questrail.plc.ast.Program;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.ast.VarBlock;
import com.questrail.plc.ast.VariableDeclaration;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TypeRegistry
 * -----------------------------------------------------------------------------
 * Declared type of every variable name a program can touch, built once per
 * program and immutable afterwards.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>PROGRAM and top-level declarations are registered under their plain
 *       names; all programs share one namespace</li>
 *   <li>members of a user function-block instance are registered under
 *       {@code Instance.Member}, recursively for nested instances</li>
 *   <li>locals of a FUNCTION are registered under {@code Function.Local}; the
 *       result is {@code Function.Function}</li>
 * </ul>
 * Variable keys are case-sensitive. POU names are looked up case-insensitively.
 *
 * <h2>Recursion</h2>
 * A function block that (directly or indirectly) contains an instance of its
 * own type is expanded only once along each path.
 */
public final class TypeRegistry
{
    private final Map<String, DeclaredType> types;
    private final Map<String, String> typeNames;
    private final Set<String> constants;
    private final Map<String, PouInterface> functionBlocks;
    private final Map<String, PouInterface> functions;

    private TypeRegistry(Map<String, DeclaredType> types,
                         Map<String, String> typeNames,
                         Set<String> constants,
                         Map<String, PouInterface> functionBlocks,
                         Map<String, PouInterface> functions) {
        this.types = Collections.unmodifiableMap(types);
        this.typeNames = Collections.unmodifiableMap(typeNames);
        this.constants = Collections.unmodifiableSet(constants);
        this.functionBlocks = Collections.unmodifiableMap(functionBlocks);
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static TypeRegistry build(StAst ast) {
        Objects.requireNonNull(ast, "ast");
        return new Builder(ast).build();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /** {@link DeclaredType#UNKNOWN} for undeclared names. */
    public DeclaredType typeOf(String key) {
        return types.getOrDefault(key, DeclaredType.UNKNOWN);
    }

    public Optional<String> typeNameOf(String key) {
        return Optional.ofNullable(typeNames.get(key));
    }

    public boolean isDeclared(String key) {
        return types.containsKey(key);
    }

    public boolean isConstant(String key) {
        return constants.contains(key);
    }

    public Optional<PouInterface> functionBlock(String typeName) {
        return typeName == null ? Optional.empty() : Optional.ofNullable(functionBlocks.get(upper(typeName)));
    }

    public Optional<PouInterface> function(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(upper(name)));
    }

    /**
     * The function-block kind of a declared instance: a built-in family, or
     * {@link FunctionBlockKind#USER_DEFINED} when the type names a declared
     * FUNCTION_BLOCK.
     */
    public Optional<FunctionBlockKind> functionBlockKind(String key) {
        String typeName = typeNames.get(key);
        if (typeName == null) {
            return Optional.empty();
        }
        Optional<FunctionBlockKind> builtIn = FunctionBlockKind.fromTypeName(typeName);
        if (builtIn.isPresent()) {
            return builtIn;
        }
        return functionBlock(typeName).map(fb -> FunctionBlockKind.USER_DEFINED);
    }

    /** Every registered key in registration order. */
    public Set<String> names() {
        return types.keySet();
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    private static final class Builder
    {
        private final StAst ast;
        private final Map<String, DeclaredType> types = new LinkedHashMap<>();
        private final Map<String, String> typeNames = new HashMap<>();
        private final Set<String> constants = new HashSet<>();
        private final Map<String, PouInterface> functionBlocks = new HashMap<>();
        private final Map<String, PouInterface> functions = new HashMap<>();
        private final Deque<String> expanding = new ArrayDeque<>();

        private Builder(StAst ast) {
            this.ast = ast;
        }

        private TypeRegistry build() {
            for (Program pou : ast.programs()) {
                if (pou.pouType() == PouType.FUNCTION_BLOCK) {
                    functionBlocks.put(upper(pou.name()), PouInterface.of(pou));
                } else if (pou.pouType() == PouType.FUNCTION) {
                    functions.put(upper(pou.name()), PouInterface.of(pou));
                }
            }

            registerBlocks("", ast.topLevelVarBlocks());
            for (Program pou : ast.programs()) {
                if (pou.pouType() == PouType.PROGRAM) {
                    registerBlocks("", pou.varBlocks());
                } else if (pou.pouType() == PouType.FUNCTION) {
                    String prefix = pou.name() + ".";
                    expanding.push(upper(pou.name()));
                    registerBlocks(prefix, pou.varBlocks());
                    expanding.pop();
                    String returnType = pou.declaredReturnType().orElse("");
                    register(prefix + pou.name(), returnType, false);
                }
            }
            return new TypeRegistry(types, typeNames, constants, functionBlocks, functions);
        }

        private void registerBlocks(String prefix, List<VarBlock> blocks) {
            for (VarBlock block : blocks) {
                for (VariableDeclaration decl : block.declarations()) {
                    for (String name : decl.names()) {
                        register(prefix + name, decl.typeName(), block.constant());
                    }
                }
            }
        }

        private void register(String key, String typeName, boolean constant) {
            DeclaredType type = DeclaredType.classify(typeName);
            PouInterface userBlock = null;
            if (type == DeclaredType.UNKNOWN) {
                userBlock = functionBlocks.get(upper(typeName));
                if (userBlock != null) {
                    type = DeclaredType.USER_FUNCTION_BLOCK;
                }
            }

            types.put(key, type);
            typeNames.put(key, typeName);
            if (constant) {
                constants.add(key);
            }

            if (userBlock != null) {
                String fbName = upper(userBlock.pou().name());
                if (!expanding.contains(fbName)) {
                    expanding.push(fbName);
                    registerBlocks(key + ".", userBlock.pou().varBlocks());
                    expanding.pop();
                }
            }
        }
    }
}
