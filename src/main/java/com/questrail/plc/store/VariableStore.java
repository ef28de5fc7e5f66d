package com.questrail.plc.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * VariableStore
 * -----------------------------------------------------------------------------
 * The observable state of a running program: typed variable slots plus the
 * instance tables of the standard function blocks.
 *
 * <h2>Variable families</h2>
 * Every variable lives in exactly one of four families:
 * <ul>
 *   <li>BOOL  – {@code boolean}</li>
 *   <li>INT   – {@code long}</li>
 *   <li>REAL  – IEEE-754 {@code double}</li>
 *   <li>TIME  – {@code long} milliseconds</li>
 * </ul>
 * Writing a name into one family removes it from the other three. Reading a
 * name that is absent from a family yields that family's zero value; lookups
 * never throw.
 *
 * <h2>Instance tables</h2>
 * Timers, counters, edge detectors and bistables are keyed by instance name.
 * The {@code timer(..)}, {@code counter(..)}, {@code edgeDetector(..)} and
 * {@code bistable(..)} accessors are get-or-insert: a missing instance is
 * created in its zero state, so the first call on an instance always sees a
 * clean slate.
 *
 * <h2>Lifecycle</h2>
 * Entries are created on first declaration or first use, mutated by whichever
 * statements name them, and destroyed only by {@link #clearAll()}.
 *
 * <h2>Threading</h2>
 * Not synchronized. A store is owned by one scan loop at a time; independent
 * programs use independent stores.
 */
public final class VariableStore
{
    public static final long DEFAULT_SCAN_TIME_MILLIS = 100;

    private final Map<String, Boolean> booleans = new LinkedHashMap<>();
    private final Map<String, Long> integers = new LinkedHashMap<>();
    private final Map<String, Double> reals = new LinkedHashMap<>();
    private final Map<String, Long> times = new LinkedHashMap<>();

    private final Map<String, TimerInstance> timers = new LinkedHashMap<>();
    private final Map<String, CounterInstance> counters = new LinkedHashMap<>();
    private final Map<String, EdgeDetectorInstance> edgeDetectors = new LinkedHashMap<>();
    private final Map<String, BistableInstance> bistables = new LinkedHashMap<>();

    private long scanTime;

    public VariableStore() {
        this(DEFAULT_SCAN_TIME_MILLIS);
    }

    public VariableStore(long scanTimeMillis) {
        setScanTime(scanTimeMillis);
    }

    // ---------------------------------------------------------------------
    // Scan time
    // ---------------------------------------------------------------------

    /** Elapsed time applied to running timers at the end of each scan, in ms. */
    public long scanTime() {
        return scanTime;
    }

    public void setScanTime(long scanTimeMillis) {
        if (scanTimeMillis < 0) {
            throw new IllegalArgumentException("scanTime must be non-negative");
        }
        this.scanTime = scanTimeMillis;
    }

    // ---------------------------------------------------------------------
    // Variables
    // ---------------------------------------------------------------------

    public boolean getBool(String name) {
        return booleans.getOrDefault(name, false);
    }

    public long getInt(String name) {
        return integers.getOrDefault(name, 0L);
    }

    public double getReal(String name) {
        return reals.getOrDefault(name, 0.0);
    }

    public long getTime(String name) {
        return times.getOrDefault(name, 0L);
    }

    public void setBool(String name, boolean value) {
        Objects.requireNonNull(name, "name");
        integers.remove(name);
        reals.remove(name);
        times.remove(name);
        booleans.put(name, value);
    }

    public void setInt(String name, long value) {
        Objects.requireNonNull(name, "name");
        booleans.remove(name);
        reals.remove(name);
        times.remove(name);
        integers.put(name, value);
    }

    public void setReal(String name, double value) {
        Objects.requireNonNull(name, "name");
        booleans.remove(name);
        integers.remove(name);
        times.remove(name);
        reals.put(name, value);
    }

    public void setTime(String name, long millis) {
        Objects.requireNonNull(name, "name");
        booleans.remove(name);
        integers.remove(name);
        reals.remove(name);
        times.put(name, millis);
    }

    public boolean containsBool(String name) {
        return booleans.containsKey(name);
    }

    public boolean containsInt(String name) {
        return integers.containsKey(name);
    }

    public boolean containsReal(String name) {
        return reals.containsKey(name);
    }

    public boolean containsTime(String name) {
        return times.containsKey(name);
    }

    /** Read-only views, in insertion order, for hosts that render the store. */
    public Map<String, Boolean> booleans() {
        return Collections.unmodifiableMap(booleans);
    }

    public Map<String, Long> integers() {
        return Collections.unmodifiableMap(integers);
    }

    public Map<String, Double> reals() {
        return Collections.unmodifiableMap(reals);
    }

    public Map<String, Long> times() {
        return Collections.unmodifiableMap(times);
    }

    // ---------------------------------------------------------------------
    // Function-block instances
    // ---------------------------------------------------------------------

    /**
     * Creates (or replaces) a timer instance in its zero state.
     */
    public TimerInstance initTimer(String name, long pt, TimerKind kind) {
        TimerInstance timer = new TimerInstance(kind, pt);
        timers.put(Objects.requireNonNull(name, "name"), timer);
        return timer;
    }

    /** Get-or-insert. An existing instance keeps its kind. */
    public TimerInstance timer(String name, TimerKind kind) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        return timers.computeIfAbsent(name, n -> new TimerInstance(kind, 0));
    }

    public Optional<TimerInstance> findTimer(String name) {
        return Optional.ofNullable(timers.get(name));
    }

    public Map<String, TimerInstance> timers() {
        return Collections.unmodifiableMap(timers);
    }

    public CounterInstance initCounter(String name, long pv, CounterKind kind) {
        CounterInstance counter = new CounterInstance(kind, pv);
        counters.put(Objects.requireNonNull(name, "name"), counter);
        return counter;
    }

    /** Get-or-insert. An existing instance keeps its kind. */
    public CounterInstance counter(String name, CounterKind kind) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        return counters.computeIfAbsent(name, n -> new CounterInstance(kind, 0));
    }

    public Optional<CounterInstance> findCounter(String name) {
        return Optional.ofNullable(counters.get(name));
    }

    public Map<String, CounterInstance> counters() {
        return Collections.unmodifiableMap(counters);
    }

    public EdgeDetectorInstance initEdgeDetector(String name) {
        EdgeDetectorInstance detector = new EdgeDetectorInstance();
        edgeDetectors.put(Objects.requireNonNull(name, "name"), detector);
        return detector;
    }

    public EdgeDetectorInstance edgeDetector(String name) {
        Objects.requireNonNull(name, "name");
        return edgeDetectors.computeIfAbsent(name, n -> new EdgeDetectorInstance());
    }

    public Optional<EdgeDetectorInstance> findEdgeDetector(String name) {
        return Optional.ofNullable(edgeDetectors.get(name));
    }

    public BistableInstance initBistable(String name) {
        BistableInstance latch = new BistableInstance();
        bistables.put(Objects.requireNonNull(name, "name"), latch);
        return latch;
    }

    public BistableInstance bistable(String name) {
        Objects.requireNonNull(name, "name");
        return bistables.computeIfAbsent(name, n -> new BistableInstance());
    }

    public Optional<BistableInstance> findBistable(String name) {
        return Optional.ofNullable(bistables.get(name));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Removes every variable and instance. The scan time is kept.
     */
    public void clearAll() {
        booleans.clear();
        integers.clear();
        reals.clear();
        times.clear();
        timers.clear();
        counters.clear();
        edgeDetectors.clear();
        bistables.clear();
    }

    @Override
    public String toString() {
        return "VariableStore{bools=" + booleans + ", ints=" + integers + ", reals=" + reals
                + ", times=" + times + ", timers=" + timers + ", counters=" + counters + "}";
    }
}
