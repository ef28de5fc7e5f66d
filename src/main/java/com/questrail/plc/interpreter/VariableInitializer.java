package com.questrail.plc.interpreter;

import com.questrail.plc.ast.PouType;
import com.questrail.plc.ast.Program;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.ast.VarBlock;
import com.questrail.plc.ast.VarScope;
import com.questrail.plc.ast.VariableDeclaration;
import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.observability.ScanObservabilitySink;
import com.questrail.plc.store.CounterKind;
import com.questrail.plc.store.TimerKind;
import com.questrail.plc.store.VariableStore;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * VariableInitializer
 * -----------------------------------------------------------------------------
 * Seeds a store from the declarations of a program.
 *
 * <h2>What gets initialized</h2>
 * <ul>
 *   <li>top-level and PROGRAM declarations, under their plain names</li>
 *   <li>members of every user function-block instance, under
 *       {@code Instance.Member}, recursively</li>
 * </ul>
 * FUNCTION locals are not stored here; each call initializes its own frame.
 *
 * <h2>Per declared type</h2>
 * Scalars receive their initializer, coerced to the declared type, or the
 * family's zero value. Built-in function blocks get a zero-state instance of
 * the declared kind. VAR_IN_OUT parameters are aliases and get no storage.
 * A declaration of an unknown type is written by value when it has an
 * initializer and left absent otherwise.
 * <p>
 * Initializers are evaluated in declaration order, so a later declaration
 * may refer to an earlier constant.
 */
public final class VariableInitializer
{
    private final StatementExecutor executor;

    VariableInitializer(StatementExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Clears {@code store} and initializes it from {@code ast}.
     */
    public static void initializeVariables(StAst ast, VariableStore store) {
        initializeVariables(ast, store, true);
    }

    public static void initializeVariables(StAst ast, VariableStore store, boolean clearFirst) {
        initializeVariables(RuntimeState.create(ast), store, clearFirst, NullObservabilitySink.INSTANCE);
    }

    /**
     * Initializes {@code store} for the program held by {@code runtime}, reusing
     * its registry.
     */
    public static void initializeVariables(RuntimeState runtime, VariableStore store, boolean clearFirst,
                                           ScanObservabilitySink sink) {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(store, "store");
        if (clearFirst) {
            store.clearAll();
        }

        StatementExecutor executor = new StatementExecutor();
        ExecutionContext ctx = ExecutionContext.root(store, runtime, sink);
        VariableInitializer initializer = executor.initializer();

        StAst ast = runtime.ast();
        initializer.initializeMembers(ast.topLevelVarBlocks(), "", store, ctx);
        for (Program pou : ast.programs()) {
            if (pou.pouType() == PouType.PROGRAM) {
                initializer.initializeMembers(pou.varBlocks(), "", store, ctx);
            }
        }
    }

    /**
     * Initializes the declarations in {@code blocks} under {@code prefix}.
     * Initializer expressions are evaluated in {@code ctx}.
     */
    void initializeMembers(List<VarBlock> blocks, String prefix, VariableStore store, ExecutionContext ctx) {
        for (VarBlock block : blocks) {
            if (block.scope() == VarScope.VAR_IN_OUT) {
                continue;
            }
            for (VariableDeclaration decl : block.declarations()) {
                for (String name : decl.names()) {
                    initialize(prefix + name, decl, store, ctx);
                }
            }
        }
    }

    /**
     * Resets the VAR_TEMP declarations in {@code blocks} to their initial
     * values. Run before every execution of the owning body.
     */
    void initializeTemps(List<VarBlock> blocks, String prefix, VariableStore store, ExecutionContext ctx) {
        for (VarBlock block : blocks) {
            if (block.scope() != VarScope.VAR_TEMP) {
                continue;
            }
            for (VariableDeclaration decl : block.declarations()) {
                for (String name : decl.names()) {
                    initialize(prefix + name, decl, store, ctx);
                }
            }
        }
    }

    private void initialize(String key, VariableDeclaration decl, VariableStore store, ExecutionContext ctx) {
        TypeRegistry registry = ctx.registry();
        DeclaredType type = registry.isDeclared(key) ? registry.typeOf(key) : DeclaredType.classify(decl.typeName());
        String typeName = decl.typeName().trim().toUpperCase(Locale.ROOT);
        Optional<Value> initial = decl.initializer().map(e -> executor.evaluator().evaluate(e, ctx));

        switch (type) {
            case BOOL, INT, REAL, TIME -> new Cell(store, key, type, false).write(initial.orElse(Value.ZERO));
            case TIMER -> store.initTimer(key, 0, TimerKind.valueOf(typeName));
            case COUNTER -> store.initCounter(key, 0, CounterKind.valueOf(typeName));
            case R_TRIG, F_TRIG -> store.initEdgeDetector(key);
            case BISTABLE -> store.initBistable(key);
            case USER_FUNCTION_BLOCK -> registry.functionBlock(decl.typeName()).ifPresent(block ->
                    initializeMembers(block.pou().varBlocks(), key + ".", store, ctx));
            case UNKNOWN -> initial.ifPresent(value -> Cell.writeByValue(store, key, value));
        }
    }
}
