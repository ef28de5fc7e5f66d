package com.questrail.plc.interpreter;

import com.questrail.plc.ast.Assignment;
import com.questrail.plc.ast.CaseClause;
import com.questrail.plc.ast.CaseLabel;
import com.questrail.plc.ast.CaseStatement;
import com.questrail.plc.ast.ContinueStatement;
import com.questrail.plc.ast.ElsifClause;
import com.questrail.plc.ast.ExitStatement;
import com.questrail.plc.ast.Expression;
import com.questrail.plc.ast.ForStatement;
import com.questrail.plc.ast.FunctionBlockCall;
import com.questrail.plc.ast.IfStatement;
import com.questrail.plc.ast.RepeatStatement;
import com.questrail.plc.ast.ReturnStatement;
import com.questrail.plc.ast.Statement;
import com.questrail.plc.ast.VariableRef;
import com.questrail.plc.ast.WhileStatement;
import com.questrail.plc.observability.InterpreterDiagnostic;

import java.util.List;
import java.util.Objects;

/**
 * StatementExecutor
 * -----------------------------------------------------------------------------
 * Executes statements in source order against an {@link ExecutionContext}.
 *
 * <h2>Assignment</h2>
 * The right-hand side is evaluated completely, then written through the
 * target's {@link Cell}, which coerces by declared type. Writes to a CONSTANT
 * are skipped and reported; writes to a function-block instance (or to a
 * field of a built-in one) are ignored.
 *
 * <h2>Loops</h2>
 * <ul>
 *   <li>FOR evaluates start, end and step once. A step of 0, or bounds that
 *       point the wrong way, run zero iterations. The loop variable is set
 *       before each iteration and keeps the value of the last iteration run
 *       (or the one EXIT left from).</li>
 *   <li>WHILE tests before each iteration, REPEAT after; REPEAT stops when its
 *       condition becomes true.</li>
 *   <li>EXIT leaves the innermost loop. CONTINUE ends the current iteration
 *       (REPEAT still evaluates its condition).</li>
 * </ul>
 * There is no iteration cap: a loop that never terminates hangs the scan.
 *
 * <h2>RETURN</h2>
 * Ends the innermost POU body: the PROGRAM being scanned, or the function
 * block or function being called.
 *
 * <p>An executor holds no per-program state and may be shared between
 * programs driven from the same thread.</p>
 */
public final class StatementExecutor
{
    private final ExpressionEvaluator evaluator;
    private final FunctionBlockHandler functionBlocks;
    private final VariableInitializer initializer;

    public StatementExecutor() {
        this.evaluator = new ExpressionEvaluator(this);
        this.functionBlocks = new FunctionBlockHandler(this);
        this.initializer = new VariableInitializer(this);
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public FunctionBlockHandler functionBlocks() {
        return functionBlocks;
    }

    public VariableInitializer initializer() {
        return initializer;
    }

    public void executeAll(List<Statement> statements, ExecutionContext ctx) {
        for (Statement statement : statements) {
            execute(statement, ctx);
        }
    }

    /**
     * Executes a POU body. A RETURN ends the body; so does an EXIT or CONTINUE
     * that is not inside a loop, since control never crosses a POU boundary.
     */
    public void executeBody(List<Statement> statements, ExecutionContext ctx) {
        try {
            executeAll(statements, ctx);
        } catch (ControlFlow.Signal ended) {
            // body finished early
        }
    }

    public void execute(Statement statement, ExecutionContext ctx) {
        Objects.requireNonNull(statement, "statement");

        if (statement instanceof Assignment assignment) {
            Value value = evaluator.evaluate(assignment.expression(), ctx);
            assign(assignment.target(), value, ctx);
        } else if (statement instanceof FunctionBlockCall call) {
            functionBlocks.call(call, ctx);
        } else if (statement instanceof IfStatement ifStatement) {
            executeIf(ifStatement, ctx);
        } else if (statement instanceof CaseStatement caseStatement) {
            executeCase(caseStatement, ctx);
        } else if (statement instanceof ForStatement forStatement) {
            executeFor(forStatement, ctx);
        } else if (statement instanceof WhileStatement whileStatement) {
            executeWhile(whileStatement, ctx);
        } else if (statement instanceof RepeatStatement repeatStatement) {
            executeRepeat(repeatStatement, ctx);
        } else if (statement instanceof ExitStatement) {
            throw ControlFlow.EXIT;
        } else if (statement instanceof ContinueStatement) {
            throw ControlFlow.CONTINUE;
        } else if (statement instanceof ReturnStatement) {
            throw ControlFlow.RETURN;
        } else {
            throw new IllegalStateException("Unhandled statement: " + statement);
        }
    }

    // ---------------------------------------------------------------------
    // Assignment
    // ---------------------------------------------------------------------

    /**
     * Writes {@code value} to {@code target} as an assignment statement would.
     * Also used for {@code name => var} output bindings.
     */
    void assign(VariableRef target, Value value, ExecutionContext ctx) {
        if (target.isMemberAccess()) {
            Cell owner = ctx.scope().resolve(String.join(".",
                    target.accessPath().subList(0, target.accessPath().size() - 1)));
            if (owner.type().isFunctionBlock() && owner.type() != DeclaredType.USER_FUNCTION_BLOCK) {
                return;
            }
        }

        Cell cell = ctx.scope().resolve(target.name());
        if (cell.type().isFunctionBlock()) {
            return;
        }
        if (cell.constant()) {
            ctx.report(InterpreterDiagnostic.Kind.CONSTANT_ASSIGNMENT, target.name(),
                    "Cannot assign to CONSTANT " + target.name() + "; assignment skipped");
            return;
        }
        cell.write(value);
    }

    // ---------------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------------

    private void executeIf(IfStatement statement, ExecutionContext ctx) {
        if (condition(statement.condition(), ctx)) {
            executeAll(statement.thenBranch(), ctx);
            return;
        }
        for (ElsifClause elsif : statement.elsifClauses()) {
            if (condition(elsif.condition(), ctx)) {
                executeAll(elsif.statements(), ctx);
                return;
            }
        }
        executeAll(statement.elseBranch(), ctx);
    }

    private void executeCase(CaseStatement statement, ExecutionContext ctx) {
        double selector = evaluator.evaluate(statement.selector(), ctx).asNumber();

        for (CaseClause clause : statement.cases()) {
            for (CaseLabel label : clause.labels()) {
                if (label.isDescending()) {
                    reportDescending(label, ctx);
                }
                if (label.matches(selector)) {
                    executeAll(clause.statements(), ctx);
                    return;
                }
            }
        }
        executeAll(statement.elseBranch(), ctx);
    }

    private static void reportDescending(CaseLabel label, ExecutionContext ctx) {
        String range = label.start() + ".." + label.end();
        if (ctx.runtime().firstReportOf(range)) {
            ctx.report(InterpreterDiagnostic.Kind.DESCENDING_CASE_RANGE, range,
                    "CASE range " + range + " is descending; matched as " + label.end() + ".." + label.start());
        }
    }

    // ---------------------------------------------------------------------
    // Iteration
    // ---------------------------------------------------------------------

    private void executeFor(ForStatement statement, ExecutionContext ctx) {
        double start = evaluator.evaluate(statement.start(), ctx).asNumber();
        double end = evaluator.evaluate(statement.end(), ctx).asNumber();
        double step = statement.stepExpression()
                .map(e -> evaluator.evaluate(e, ctx).asNumber())
                .orElse(1.0);

        if (step == 0 || Double.isNaN(step)) {
            return;
        }

        Cell variable = ctx.scope().resolve(statement.variable());
        for (double i = start; step > 0 ? i <= end : i >= end; i += step) {
            variable.write(Value.of(i));
            try {
                executeAll(statement.body(), ctx);
            } catch (ControlFlow.ExitSignal exit) {
                return;
            } catch (ControlFlow.ContinueSignal next) {
                // next iteration
            }
        }
    }

    private void executeWhile(WhileStatement statement, ExecutionContext ctx) {
        while (condition(statement.condition(), ctx)) {
            try {
                executeAll(statement.body(), ctx);
            } catch (ControlFlow.ExitSignal exit) {
                return;
            } catch (ControlFlow.ContinueSignal next) {
                // next iteration
            }
        }
    }

    private void executeRepeat(RepeatStatement statement, ExecutionContext ctx) {
        do {
            try {
                executeAll(statement.body(), ctx);
            } catch (ControlFlow.ExitSignal exit) {
                return;
            } catch (ControlFlow.ContinueSignal next) {
                // re-check the condition
            }
        } while (!condition(statement.until(), ctx));
    }

    private boolean condition(Expression expression, ExecutionContext ctx) {
        return evaluator.evaluate(expression, ctx).asBoolean();
    }
}
