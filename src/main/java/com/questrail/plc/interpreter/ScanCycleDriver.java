package com.questrail.plc.interpreter;

import com.questrail.plc.ast.Program;
import com.questrail.plc.ast.StAst;
import com.questrail.plc.ast.Statement;
import com.questrail.plc.observability.NullObservabilitySink;
import com.questrail.plc.observability.ScanCompletedEvent;
import com.questrail.plc.observability.ScanObservabilitySink;
import com.questrail.plc.store.TimerInstance;
import com.questrail.plc.store.VariableStore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * ScanCycleDriver
 * -----------------------------------------------------------------------------
 * Runs one PLC scan.
 *
 * <h2>Scan order</h2>
 * <ol>
 *   <li>every PROGRAM body, in declaration order, with its VAR_TEMP
 *       variables reset first (FUNCTION and FUNCTION_BLOCK
 *       declarations are only run when called)</li>
 *   <li>statements written outside any POU</li>
 *   <li>every running timer advances by {@code store.scanTime()}</li>
 * </ol>
 * A RETURN ends only the program it occurs in. Because time is applied at the
 * end, one scan period always separates the bodies of two consecutive scans:
 * a TON started in scan 1 reports {@code ET = scanTime} in scan 2.
 *
 * <h2>Determinism</h2>
 * Program state never depends on a clock: timers advance only by
 * {@code store.scanTime()}. Given the same program, the same store contents
 * and the same sequence of scan times, every scan produces the same result.
 * The wall clock is read once per scan, to timestamp the
 * {@link ScanCompletedEvent}.
 *
 * <h2>Threading</h2>
 * A scan is synchronous and runs on the caller's thread. Callers that drive
 * independent programs from several threads use one store and runtime state
 * per program.
 */
public final class ScanCycleDriver
{
    private final StatementExecutor executor;
    private final ScanObservabilitySink sink;

    public ScanCycleDriver() {
        this(NullObservabilitySink.INSTANCE);
    }

    public ScanCycleDriver(ScanObservabilitySink sink) {
        this.executor = new StatementExecutor();
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void runScanCycle(StAst ast, VariableStore store, RuntimeState runtime) {
        Objects.requireNonNull(ast, "ast");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(runtime, "runtime");

        ExecutionContext ctx = ExecutionContext.root(store, runtime, sink);

        int programs = 0;
        for (Program pou : ast.programs()) {
            if (pou.isExecutedEachScan()) {
                executor.initializer().initializeTemps(pou.varBlocks(), "", store, ctx);
                executor.executeBody(pou.statements(), ctx);
                programs++;
            }
        }
        executor.executeBody(ast.topLevelStatements(), ctx);

        int advanced = advanceTimers(store);
        sink.onScanCompleted(new ScanCompletedEvent(Instant.now(), programs, advanced, store.scanTime()));
    }

    /**
     * Executes a single statement, for single-step debugging. Timers are not
     * advanced.
     *
     * @param index position in the flattened order of PROGRAM statements
     *              followed by top-level statements
     * @return {@code false} when {@code index} is out of range
     */
    public boolean executeOneStatement(StAst ast, VariableStore store, RuntimeState runtime, int index) {
        Objects.requireNonNull(ast, "ast");
        if (index < 0) {
            return false;
        }
        int remaining = index;
        for (Program pou : ast.programs()) {
            if (!pou.isExecutedEachScan()) {
                continue;
            }
            if (remaining < pou.statements().size()) {
                executeSingle(pou.statements().get(remaining), store, runtime);
                return true;
            }
            remaining -= pou.statements().size();
        }
        List<Statement> topLevel = ast.topLevelStatements();
        if (remaining < topLevel.size()) {
            executeSingle(topLevel.get(remaining), store, runtime);
            return true;
        }
        return false;
    }

    /**
     * Number of statements {@link #executeOneStatement} can step through.
     */
    public static int totalStatementCount(StAst ast) {
        int count = ast.topLevelStatements().size();
        for (Program pou : ast.programs()) {
            if (pou.isExecutedEachScan()) {
                count += pou.statements().size();
            }
        }
        return count;
    }

    private void executeSingle(Statement statement, VariableStore store, RuntimeState runtime) {
        executor.executeBody(List.of(statement), ExecutionContext.root(store, runtime, sink));
    }

    private static int advanceTimers(VariableStore store) {
        int advanced = 0;
        for (TimerInstance timer : store.timers().values()) {
            if (timer.advance(store.scanTime())) {
                advanced++;
            }
        }
        return advanced;
    }
}
