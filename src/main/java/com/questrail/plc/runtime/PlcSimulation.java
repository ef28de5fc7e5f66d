package com.questrail.plc.runtime;

import com.questrail.plc.ast.StAst;
import com.questrail.plc.config.InterpreterConfig;
import com.questrail.plc.interpreter.RuntimeState;
import com.questrail.plc.interpreter.ScanCycleDriver;
import com.questrail.plc.interpreter.VariableInitializer;
import com.questrail.plc.store.VariableStore;

import java.util.Objects;

/**
 * PlcSimulation
 * -----------------------------------------------------------------------------
 * Composition root for running one Structured Text program: owns a
 * {@link VariableStore}, the {@link RuntimeState} of the loaded program, and
 * a {@link ScanCycleDriver}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   PlcSimulation sim = new PlcSimulation(InterpreterConfig.defaults());
 *   sim.load(ast);          // build registry, initialize variables
 *   sim.store().setBool("Start", true);
 *   sim.run(10);            // ten scans
 *   sim.reset();            // back to declared initial values
 * </pre>
 *
 * <h2>Threading</h2>
 * Not thread-safe. The host paces scans; nothing here schedules or sleeps.
 */
public final class PlcSimulation
{
    private final InterpreterConfig config;
    private final VariableStore store;
    private final ScanCycleDriver driver;

    private StAst ast;
    private RuntimeState runtime;
    private long scanCount;
    private long elapsedMillis;

    public PlcSimulation(InterpreterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = new VariableStore(config.scanTimeMillis());
        this.driver = new ScanCycleDriver(config.observabilitySink());
    }

    /**
     * Loads a program: builds its type registry and initializes the store
     * from its declarations. Scan count and elapsed time restart at zero.
     */
    public void load(StAst program) {
        this.ast = Objects.requireNonNull(program, "program");
        this.runtime = RuntimeState.create(program);
        VariableInitializer.initializeVariables(runtime, store, config.clearOnLoad(), config.observabilitySink());
        scanCount = 0;
        elapsedMillis = 0;
    }

    /**
     * Runs one scan.
     *
     * @throws IllegalStateException if no program is loaded
     */
    public void step() {
        requireLoaded();
        driver.runScanCycle(ast, store, runtime);
        scanCount++;
        elapsedMillis += store.scanTime();
    }

    public void run(int scans) {
        if (scans < 0) {
            throw new IllegalArgumentException("scans must be non-negative");
        }
        for (int i = 0; i < scans; i++) {
            step();
        }
    }

    /**
     * Re-initializes the loaded program: the store is cleared and seeded again,
     * edge memory is forgotten, and the counters restart.
     */
    public void reset() {
        requireLoaded();
        runtime.reset();
        VariableInitializer.initializeVariables(runtime, store, true, config.observabilitySink());
        scanCount = 0;
        elapsedMillis = 0;
    }

    public boolean isLoaded() {
        return ast != null;
    }

    public VariableStore store() {
        return store;
    }

    public long scanCount() {
        return scanCount;
    }

    /** Sum of the scan times of all scans run since load or reset, in ms. */
    public long elapsedTime() {
        return elapsedMillis;
    }

    public InterpreterConfig config() {
        return config;
    }

    private void requireLoaded() {
        if (ast == null) {
            throw new IllegalStateException("No program loaded");
        }
    }
}
