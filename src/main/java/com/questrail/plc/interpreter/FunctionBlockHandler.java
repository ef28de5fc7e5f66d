package com.questrail.plc.interpreter;

import com.questrail.plc.ast.CallArgument;
import com.questrail.plc.ast.FunctionBlockCall;
import com.questrail.plc.ast.VariableRef;
import com.questrail.plc.observability.InterpreterDiagnostic;
import com.questrail.plc.store.BistableInstance;
import com.questrail.plc.store.CounterInstance;
import com.questrail.plc.store.CounterKind;
import com.questrail.plc.store.EdgeDetectorInstance;
import com.questrail.plc.store.TimerInstance;
import com.questrail.plc.store.TimerKind;
import com.questrail.plc.store.VariableStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FunctionBlockHandler
 * -----------------------------------------------------------------------------
 * Executes one function-block call statement.
 *
 * <h2>Dispatch</h2>
 * The instance's {@link FunctionBlockKind} comes from its declared type; an
 * undeclared instance keeps the kind of an existing timer or counter of the
 * same name, and is otherwise classified from the call's argument names. An
 * instance that cannot be classified is reported and the call is skipped.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li>{@code name := expr} on a VAR_INPUT: evaluated before the body</li>
 *   <li>{@code name := var} on a VAR_IN_OUT: the caller's cell is aliased for
 *       the duration of the call</li>
 *   <li>{@code name => var}: copied to the caller after the body, for
 *       built-in and user-defined blocks alike</li>
 * </ul>
 * Omitted inputs of a built-in block keep the value of the previous call.
 *
 * <h2>Time</h2>
 * Timer calls only react to edges of {@code IN}. Elapsed time is applied by
 * {@link ScanCycleDriver} once per scan.
 */
public final class FunctionBlockHandler
{
    private static final Set<String> TIMER_INPUTS = Set.of("IN", "PT");
    private static final Set<String> EDGE_INPUTS = Set.of("CLK");

    private final StatementExecutor executor;

    FunctionBlockHandler(StatementExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void call(FunctionBlockCall call, ExecutionContext ctx) {
        Objects.requireNonNull(call, "call");

        Cell instance = ctx.scope().resolve(call.instanceName());
        Optional<FunctionBlockKind> resolved = resolveKind(instance, call, ctx);
        if (resolved.isEmpty()) {
            ctx.report(InterpreterDiagnostic.Kind.UNRESOLVED_FUNCTION_BLOCK, call.instanceName(),
                    "Cannot determine the function block type of " + call.instanceName() + "; call ignored");
            return;
        }

        FunctionBlockKind kind = resolved.get();
        switch (kind) {
            case TON, TOF, TP -> callTimer(instance, kind, call, ctx);
            case CTU, CTD, CTUD -> callCounter(instance, kind, call, ctx);
            case R_TRIG, F_TRIG -> callEdgeDetector(instance, kind, call, ctx);
            case SR, RS -> callBistable(instance, kind, call, ctx);
            case USER_DEFINED -> callUserDefined(instance, call, ctx);
        }
    }

    private static Optional<FunctionBlockKind> resolveKind(Cell instance, FunctionBlockCall call,
                                                           ExecutionContext ctx) {
        Optional<FunctionBlockKind> declared = ctx.registry().functionBlockKind(instance.key());
        if (declared.isPresent()) {
            return declared;
        }
        Optional<TimerInstance> timer = instance.store().findTimer(instance.key());
        if (timer.isPresent()) {
            return Optional.of(FunctionBlockKind.valueOf(timer.get().kind().name()));
        }
        Optional<CounterInstance> counter = instance.store().findCounter(instance.key());
        if (counter.isPresent()) {
            return Optional.of(FunctionBlockKind.valueOf(counter.get().kind().name()));
        }
        return FunctionBlockKind.infer(call.instanceName(), call.arguments());
    }

    // ---------------------------------------------------------------------
    // Built-in families
    // ---------------------------------------------------------------------

    private void callTimer(Cell instance, FunctionBlockKind kind, FunctionBlockCall call, ExecutionContext ctx) {
        Map<String, Value> inputs = builtInInputs(call, TIMER_INPUTS, ctx);
        TimerInstance timer = instance.store().timer(instance.key(), TimerKind.valueOf(kind.name()));

        Value pt = inputs.get("PT");
        if (pt != null) {
            timer.setPt(Cell.truncate(pt.asNumber()));
        }
        Value in = inputs.get("IN");
        timer.applyInput(in != null ? in.asBoolean() : timer.in());

        bindOutputs(call, ctx, field -> timerOutput(timer, field));
    }

    private void callCounter(Cell instance, FunctionBlockKind kind, FunctionBlockCall call, ExecutionContext ctx) {
        CounterKind counterKind = CounterKind.valueOf(kind.name());
        Map<String, Value> inputs = builtInInputs(call, counterInputs(counterKind), ctx);

        VariableStore store = instance.store();
        String key = instance.key();
        if (store.findCounter(key).isEmpty()) {
            ctx.runtime().clearPreviousInputs(key);
        }
        CounterInstance counter = store.counter(key, counterKind);

        boolean cu = flag(inputs, "CU", counter.cu());
        boolean cd = flag(inputs, "CD", counter.cd());
        boolean r = flag(inputs, "R", counter.r());
        boolean ld = flag(inputs, "LD", counter.ld());
        Value pv = inputs.get("PV");
        if (pv != null) {
            counter.setPv(Cell.truncate(pv.asNumber()));
        }

        RuntimeState runtime = ctx.runtime();
        if (counterKind.countsUp()) {
            if (cu && !runtime.previousInput(key + ".CU")) {
                counter.countUp();
            }
            runtime.setPreviousInput(key + ".CU", cu);
        }
        if (counterKind.countsDown()) {
            if (cd && !runtime.previousInput(key + ".CD")) {
                counter.countDown();
            }
            runtime.setPreviousInput(key + ".CD", cd);
        }
        if (r) {
            counter.reset();
        }
        if (ld) {
            counter.load();
        }

        counter.recordInputs(cu, cd, r, ld);
        counter.recomputeOutputs();

        bindOutputs(call, ctx, field -> counterOutput(counter, field));
    }

    private static Set<String> counterInputs(CounterKind kind) {
        return switch (kind) {
            case CTU -> Set.of("CU", "R", "PV");
            case CTD -> Set.of("CD", "LD", "PV");
            case CTUD -> Set.of("CU", "CD", "R", "LD", "PV");
        };
    }

    private void callEdgeDetector(Cell instance, FunctionBlockKind kind, FunctionBlockCall call,
                                  ExecutionContext ctx) {
        Map<String, Value> inputs = builtInInputs(call, EDGE_INPUTS, ctx);
        EdgeDetectorInstance detector = instance.store().edgeDetector(instance.key());

        boolean clk = flag(inputs, "CLK", detector.clk());
        if (kind == FunctionBlockKind.R_TRIG) {
            detector.updateRising(clk);
        } else {
            detector.updateFalling(clk);
        }

        bindOutputs(call, ctx, field -> edgeOutput(detector, field));
    }

    private void callBistable(Cell instance, FunctionBlockKind kind, FunctionBlockCall call, ExecutionContext ctx) {
        boolean setDominant = kind == FunctionBlockKind.SR;
        Set<String> accepted = setDominant ? Set.of("S1", "R") : Set.of("S", "R1");
        Map<String, Value> inputs = builtInInputs(call, accepted, ctx);
        BistableInstance latch = instance.store().bistable(instance.key());

        if (setDominant) {
            latch.updateSetDominant(flag(inputs, "S1", false), flag(inputs, "R", false));
        } else {
            latch.updateResetDominant(flag(inputs, "S", false), flag(inputs, "R1", false));
        }

        bindOutputs(call, ctx, field -> "Q1".equals(field)
                ? Optional.of(Value.of(latch.q1()))
                : Optional.empty());
    }

    /**
     * Evaluates every named input of a built-in call, keyed by upper-case
     * parameter name. Parameters the family does not accept are reported and
     * dropped.
     */
    private Map<String, Value> builtInInputs(FunctionBlockCall call, Set<String> accepted, ExecutionContext ctx) {
        Map<String, Value> inputs = new HashMap<>();
        for (CallArgument argument : call.arguments()) {
            if (argument.isOutput()) {
                continue;
            }
            String parameter = argument.isPositional() ? null : argument.name().toUpperCase(Locale.ROOT);
            if (parameter == null || !accepted.contains(parameter)) {
                ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, call.instanceName(),
                        "Parameter " + (parameter == null ? "<positional>" : argument.name())
                                + " is not an input of " + call.instanceName() + "; ignored");
                continue;
            }
            inputs.put(parameter, executor.evaluator().evaluate(argument.expression(), ctx));
        }
        return inputs;
    }

    private static boolean flag(Map<String, Value> inputs, String parameter, boolean fallback) {
        Value value = inputs.get(parameter);
        return value != null ? value.asBoolean() : fallback;
    }

    private static Optional<Value> timerOutput(TimerInstance timer, String field) {
        return switch (field) {
            case "Q" -> Optional.of(Value.of(timer.q()));
            case "ET" -> Optional.of(Value.of((double) timer.et()));
            default -> Optional.empty();
        };
    }

    private static Optional<Value> counterOutput(CounterInstance counter, String field) {
        return switch (field) {
            case "CV" -> Optional.of(Value.of((double) counter.cv()));
            case "QU", "Q" -> Optional.of(Value.of(counter.qu()));
            case "QD" -> Optional.of(Value.of(counter.qd()));
            default -> Optional.empty();
        };
    }

    private static Optional<Value> edgeOutput(EdgeDetectorInstance detector, String field) {
        return "Q".equals(field) ? Optional.of(Value.of(detector.q())) : Optional.empty();
    }

    private interface OutputReader
    {
        Optional<Value> read(String upperCaseField);
    }

    private void bindOutputs(FunctionBlockCall call, ExecutionContext ctx, OutputReader reader) {
        for (CallArgument argument : call.arguments()) {
            if (!argument.isOutput()) {
                continue;
            }
            Optional<Value> value = reader.read(argument.name().toUpperCase(Locale.ROOT));
            if (value.isEmpty()) {
                ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, call.instanceName(),
                        "Parameter " + argument.name() + " is not an output of " + call.instanceName());
                continue;
            }
            executor.assign((VariableRef) argument.expression(), value.get(), ctx);
        }
    }

    // ---------------------------------------------------------------------
    // User-defined function blocks
    // ---------------------------------------------------------------------

    /**
     * Input values are all evaluated in the caller's scope before any is
     * written, so an argument expression never observes another argument's
     * assignment.
     */
    private void callUserDefined(Cell instance, FunctionBlockCall call, ExecutionContext ctx) {
        TypeRegistry registry = ctx.registry();
        String typeName = registry.typeNameOf(instance.key()).orElseThrow();
        PouInterface block = registry.functionBlock(typeName).orElseThrow();
        String prefix = instance.key() + ".";

        Map<String, Value> inputs = new LinkedHashMap<>();
        Map<String, Cell> aliases = new HashMap<>();
        List<CallArgument> outputs = new ArrayList<>();

        for (CallArgument argument : call.arguments()) {
            Optional<String> parameter = argument.isPositional()
                    ? Optional.empty()
                    : block.parameter(argument.name());
            if (parameter.isEmpty()) {
                ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, call.instanceName(),
                        "Parameter " + (argument.isPositional() ? "<positional>" : argument.name())
                                + " is not declared by " + block.pou().name() + "; ignored");
                continue;
            }
            String name = parameter.get();

            if (argument.isOutput()) {
                outputs.add(argument);
            } else if (block.isInOut(name)) {
                if (argument.expression() instanceof VariableRef ref) {
                    aliases.put(name, ctx.scope().resolve(ref.name()));
                } else {
                    ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, call.instanceName(),
                            "VAR_IN_OUT " + name + " must be bound to a variable; ignored");
                }
            } else if (block.isInput(name)) {
                inputs.put(name, executor.evaluator().evaluate(argument.expression(), ctx));
            } else {
                ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, call.instanceName(),
                        "Output " + name + " cannot be assigned with :=; ignored");
            }
        }

        Scope scope = ctx.scope().member(instance.store(), prefix, block.members(), aliases);
        ExecutionContext inner = ctx.withScope(scope);
        executor.initializer().initializeTemps(block.pou().varBlocks(), prefix, instance.store(), inner);
        inputs.forEach((name, value) -> scope.resolve(name).write(value));

        executor.executeBody(block.pou().statements(), inner);

        for (CallArgument argument : outputs) {
            String name = block.parameter(argument.name()).orElseThrow();
            executor.assign((VariableRef) argument.expression(), scope.resolve(name).read(), ctx);
        }
    }
}
