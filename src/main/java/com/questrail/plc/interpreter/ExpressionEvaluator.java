package com.questrail.plc.interpreter;

import com.questrail.plc.ast.BinaryExpression;
import com.questrail.plc.ast.CallArgument;
import com.questrail.plc.ast.Expression;
import com.questrail.plc.ast.FunctionCall;
import com.questrail.plc.ast.Literal;
import com.questrail.plc.ast.LiteralType;
import com.questrail.plc.ast.ParenExpression;
import com.questrail.plc.ast.UnaryExpression;
import com.questrail.plc.ast.VariableRef;
import com.questrail.plc.observability.InterpreterDiagnostic;
import com.questrail.plc.store.BistableInstance;
import com.questrail.plc.store.CounterInstance;
import com.questrail.plc.store.EdgeDetectorInstance;
import com.questrail.plc.store.TimerInstance;
import com.questrail.plc.store.VariableStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ExpressionEvaluator
 * -----------------------------------------------------------------------------
 * Evaluates an expression subtree to a {@link Value}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Arithmetic is carried out in {@code double}. Division by zero follows
 *       IEEE-754; {@code MOD} takes the sign of the dividend.</li>
 *   <li>{@code =} and {@code <>} are strict: a boolean never equals a number.
 *       Ordering comparisons are numeric.</li>
 *   <li>{@code AND}, {@code OR}, {@code XOR} always evaluate both operands.</li>
 *   <li>{@code X.F} reads field {@code F} of instance {@code X}; an absent
 *       instance reads {@code FALSE} for Q-like outputs and 0 otherwise.</li>
 *   <li>Calls resolve to a user FUNCTION first, then a standard function. An
 *       unknown name is reported and evaluates to 0.</li>
 * </ul>
 *
 * <h2>Side effects</h2>
 * Reads never touch the store. Calls to user functions execute their body in
 * a private frame; only the function's own locals are written.
 */
public final class ExpressionEvaluator
{
    private final StatementExecutor executor;

    ExpressionEvaluator(StatementExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Value evaluate(Expression expression, ExecutionContext ctx) {
        Objects.requireNonNull(expression, "expression");

        if (expression instanceof Literal literal) {
            return literal.literalType() == LiteralType.BOOL
                    ? Value.of(literal.boolValue())
                    : Value.of(literal.numericValue());
        }
        if (expression instanceof VariableRef ref) {
            return ref.isMemberAccess() ? readField(ref, ctx) : ctx.scope().resolve(ref.name()).read();
        }
        if (expression instanceof BinaryExpression binary) {
            return evaluateBinary(binary, ctx);
        }
        if (expression instanceof UnaryExpression unary) {
            Value operand = evaluate(unary.operand(), ctx);
            return switch (unary.operator()) {
                case NOT -> Value.of(!operand.asBoolean());
                case NEGATE -> Value.of(-operand.asNumber());
            };
        }
        if (expression instanceof ParenExpression paren) {
            return evaluate(paren.expression(), ctx);
        }
        if (expression instanceof FunctionCall call) {
            return evaluateCall(call, ctx);
        }
        throw new IllegalStateException("Unhandled expression: " + expression);
    }

    // ---------------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------------

    private Value evaluateBinary(BinaryExpression binary, ExecutionContext ctx) {
        Value left = evaluate(binary.left(), ctx);
        Value right = evaluate(binary.right(), ctx);

        double l = left.asNumber();
        double r = right.asNumber();

        return switch (binary.operator()) {
            case AND -> Value.of(left.asBoolean() && right.asBoolean());
            case OR -> Value.of(left.asBoolean() || right.asBoolean());
            case XOR -> Value.of(left.asBoolean() ^ right.asBoolean());
            case EQ -> Value.of(strictlyEqual(left, right));
            case NE -> Value.of(!strictlyEqual(left, right));
            case LT -> Value.of(l < r);
            case GT -> Value.of(l > r);
            case LE -> Value.of(l <= r);
            case GE -> Value.of(l >= r);
            case ADD -> Value.of(l + r);
            case SUB -> Value.of(l - r);
            case MUL -> Value.of(l * r);
            case DIV -> Value.of(l / r);
            case MOD -> Value.of(l % r);
            case POW -> Value.of(Math.pow(l, r));
        };
    }

    private static boolean strictlyEqual(Value left, Value right) {
        if (left instanceof Value.BoolValue lb && right instanceof Value.BoolValue rb) {
            return lb.value() == rb.value();
        }
        if (left instanceof Value.NumberValue ln && right instanceof Value.NumberValue rn) {
            return ln.value() == rn.value();
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Field access
    // ---------------------------------------------------------------------

    /**
     * Reads {@code Instance.Field}. The instance part may itself be dotted
     * ({@code Outer.Inner.Q}).
     */
    Value readField(VariableRef ref, ExecutionContext ctx) {
        List<String> path = ref.accessPath();
        String field = path.get(path.size() - 1);
        String instanceName = String.join(".", path.subList(0, path.size() - 1));

        Cell instance = ctx.scope().resolve(instanceName);
        VariableStore store = instance.store();
        String key = instance.key();
        TypeRegistry registry = ctx.registry();

        if (instance.type() == DeclaredType.USER_FUNCTION_BLOCK) {
            return ctx.scope().resolve(ref.name()).read();
        }

        Optional<TimerInstance> timer = store.findTimer(key);
        if (timer.isPresent()) {
            return timerField(timer.get(), field);
        }
        Optional<CounterInstance> counter = store.findCounter(key);
        if (counter.isPresent()) {
            return counterField(counter.get(), field);
        }
        Optional<EdgeDetectorInstance> edge = store.findEdgeDetector(key);
        if (edge.isPresent()) {
            return edgeField(edge.get(), field);
        }
        Optional<BistableInstance> latch = store.findBistable(key);
        if (latch.isPresent()) {
            return "Q1".equalsIgnoreCase(field) ? Value.of(latch.get().q1()) : absentField(field);
        }

        // Not an instance: a plain dotted variable written by the host, or nothing.
        Cell plain = new Cell(store, key + "." + field, registry.typeOf(key + "." + field), false);
        if (registry.isDeclared(plain.key()) || hasAnyFamily(store, plain.key())) {
            return plain.read();
        }
        return absentField(field);
    }

    private static Value timerField(TimerInstance timer, String field) {
        return switch (field.toUpperCase(Locale.ROOT)) {
            case "Q" -> Value.of(timer.q());
            case "IN" -> Value.of(timer.in());
            case "ET" -> Value.of((double) timer.et());
            case "PT" -> Value.of((double) timer.pt());
            default -> absentField(field);
        };
    }

    private static Value counterField(CounterInstance counter, String field) {
        return switch (field.toUpperCase(Locale.ROOT)) {
            case "CV" -> Value.of((double) counter.cv());
            case "PV" -> Value.of((double) counter.pv());
            case "QU", "Q" -> Value.of(counter.qu());
            case "QD" -> Value.of(counter.qd());
            case "CU" -> Value.of(counter.cu());
            case "CD" -> Value.of(counter.cd());
            case "R" -> Value.of(counter.r());
            case "LD" -> Value.of(counter.ld());
            default -> absentField(field);
        };
    }

    private static Value edgeField(EdgeDetectorInstance edge, String field) {
        return switch (field.toUpperCase(Locale.ROOT)) {
            case "Q" -> Value.of(edge.q());
            case "CLK" -> Value.of(edge.clk());
            case "M" -> Value.of(edge.m());
            default -> absentField(field);
        };
    }

    /** Q-like outputs of a missing instance read FALSE, everything else 0. */
    static Value absentField(String field) {
        return switch (field.toUpperCase(Locale.ROOT)) {
            case "Q", "QU", "QD", "Q1" -> Value.FALSE;
            default -> Value.ZERO;
        };
    }

    private static boolean hasAnyFamily(VariableStore store, String key) {
        return store.containsBool(key) || store.containsInt(key)
                || store.containsReal(key) || store.containsTime(key);
    }

    // ---------------------------------------------------------------------
    // Function calls
    // ---------------------------------------------------------------------

    private Value evaluateCall(FunctionCall call, ExecutionContext ctx) {
        Optional<PouInterface> userFunction = ctx.registry().function(call.name());
        if (userFunction.isPresent()) {
            return callUserFunction(userFunction.get(), call, ctx);
        }

        List<Value> args = standardArguments(call, ctx);
        Optional<Value> result = StandardFunctions.call(call.name(), args);
        if (result.isPresent()) {
            return result.get();
        }

        ctx.report(InterpreterDiagnostic.Kind.UNKNOWN_FUNCTION, call.name(),
                "Unknown function " + call.name() + "; evaluated as 0");
        return Value.ZERO;
    }

    /**
     * Evaluates arguments in call order. Named arguments of LIMIT and EXPT
     * are placed by parameter name.
     */
    private List<Value> standardArguments(FunctionCall call, ExecutionContext ctx) {
        Optional<List<String>> parameters = StandardFunctions.parameterNames(call.name());
        Value[] placed = parameters.map(p -> new Value[p.size()]).orElse(null);
        List<Value> ordered = new ArrayList<>();

        for (CallArgument argument : call.arguments()) {
            Value value = evaluate(argument.expression(), ctx);
            if (placed != null && !argument.isPositional()) {
                int index = indexOfIgnoreCase(parameters.get(), argument.name());
                if (index >= 0) {
                    placed[index] = value;
                    continue;
                }
            }
            ordered.add(value);
        }

        if (placed == null || Arrays.stream(placed).allMatch(Objects::isNull)) {
            return ordered;
        }
        List<Value> merged = new ArrayList<>();
        int next = 0;
        for (Value v : placed) {
            if (v != null) {
                merged.add(v);
            } else {
                merged.add(next < ordered.size() ? ordered.get(next++) : Value.ZERO);
            }
        }
        return merged;
    }

    private static int indexOfIgnoreCase(List<String> names, String name) {
        for (int i = 0; i < names.size(); i++) {
            if (names.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Runs a user FUNCTION in a fresh frame. Inputs are bound positionally in
     * VAR_INPUT order or by name; locals start from their declared initial
     * values on every call; the result is the value last assigned to the
     * function's name.
     */
    private Value callUserFunction(PouInterface function, FunctionCall call, ExecutionContext ctx) {
        String name = function.pou().name();
        String prefix = name + ".";
        TypeRegistry registry = ctx.registry();

        Map<String, Value> bound = new HashMap<>();
        int position = 0;
        for (CallArgument argument : call.arguments()) {
            Value value = evaluate(argument.expression(), ctx);
            Optional<String> parameter;
            if (argument.isPositional()) {
                parameter = position < function.inputs().size()
                        ? Optional.of(function.inputs().get(position++))
                        : Optional.empty();
            } else {
                parameter = function.parameter(argument.name()).filter(function::isInput);
            }
            if (parameter.isEmpty()) {
                ctx.report(InterpreterDiagnostic.Kind.INVALID_ARGUMENT, name,
                        "Argument " + (argument.isPositional() ? "#" + (position + 1) : argument.name())
                                + " does not match an input of " + name);
                continue;
            }
            bound.put(parameter.get(), value);
        }

        VariableStore frame = new VariableStore(ctx.store().scanTime());
        Scope scope = ctx.scope().member(frame, prefix, function.members(), Map.of());
        ExecutionContext inner = ctx.withScope(scope);

        executor.initializer().initializeMembers(function.pou().varBlocks(), prefix, frame, inner);
        Cell result = scope.resolve(name);
        result.write(Value.ZERO);
        bound.forEach((parameter, value) -> scope.resolve(parameter).write(value));

        executor.executeBody(function.pou().statements(), inner);

        return result.read();
    }
}
