package com.questrail.plc.interpreter;

import com.questrail.plc.ast.Expression;
import com.questrail.plc.ast.Program;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.ast.Statement;
import com.questrail.plc.observability.RecordingObservabilitySink;
import com.questrail.plc.store.VariableStore;

import java.util.List;

/**
 * Wires a store, runtime state and recording sink around a program so that
 * tests can execute single statements and expressions against it.
 */
final class Harness {
    final StAst ast;
    final VariableStore store = new VariableStore();
    final RuntimeState runtime;
    final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    final StatementExecutor executor = new StatementExecutor();
    final ScanCycleDriver driver = new ScanCycleDriver(sink);

    private Harness(StAst ast) {
        this.ast = ast;
        this.runtime = RuntimeState.create(ast);
        VariableInitializer.initializeVariables(runtime, store, true, sink);
    }

    static Harness of(Program... programs) {
        return new Harness(StAst.of(programs));
    }

    static Harness of(StAst ast) {
        return new Harness(ast);
    }

    static Harness empty() {
        return new Harness(new StAst(List.of(), List.of(), List.of()));
    }

    ExecutionContext context() {
        return ExecutionContext.root(store, runtime, sink);
    }

    Value eval(Expression expression) {
        return executor.evaluator().evaluate(expression, context());
    }

    void exec(Statement... statements) {
        executor.executeBody(List.of(statements), context());
    }

    void scan() {
        driver.runScanCycle(ast, store, runtime);
    }

    void scans(int count) {
        for (int i = 0; i < count; i++) {
            scan();
        }
    }
}
