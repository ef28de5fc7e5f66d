package com.questrail.plc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * St
 * -----------------------------------------------------------------------------
 * Compact factory for building Structured Text trees in code.
 * <p>
 * Hosts that embed the interpreter without the ST parser, and the test
 * suites, build programs through this class instead of spelling out records:
 *
 * <pre>
 *   StAst ast = StAst.of(St.program("Main")
 *           .var("Timer1", "TON")
 *           .var("Start", "BOOL")
 *           .body(St.call("Timer1",
 *                   St.arg("IN", St.ref("Start")),
 *                   St.arg("PT", St.time("T#500ms"))))
 *           .build());
 * </pre>
 */
public final class St
{
    private St() {
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    public static Literal bool(boolean value) {
        return Literal.ofBool(value);
    }

    public static Literal num(long value) {
        return Literal.ofInt(value);
    }

    public static Literal real(double value) {
        return Literal.ofReal(value);
    }

    public static Literal time(String text) {
        return Literal.ofTime(text);
    }

    public static VariableRef ref(String dottedName) {
        return VariableRef.of(dottedName);
    }

    public static BinaryExpression binary(BinaryOperator op, Expression left, Expression right) {
        return new BinaryExpression(op, left, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return binary(BinaryOperator.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return binary(BinaryOperator.OR, left, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return binary(BinaryOperator.ADD, left, right);
    }

    public static BinaryExpression sub(Expression left, Expression right) {
        return binary(BinaryOperator.SUB, left, right);
    }

    public static BinaryExpression mul(Expression left, Expression right) {
        return binary(BinaryOperator.MUL, left, right);
    }

    public static BinaryExpression div(Expression left, Expression right) {
        return binary(BinaryOperator.DIV, left, right);
    }

    public static BinaryExpression mod(Expression left, Expression right) {
        return binary(BinaryOperator.MOD, left, right);
    }

    public static BinaryExpression eq(Expression left, Expression right) {
        return binary(BinaryOperator.EQ, left, right);
    }

    public static BinaryExpression ne(Expression left, Expression right) {
        return binary(BinaryOperator.NE, left, right);
    }

    public static BinaryExpression le(Expression left, Expression right) {
        return binary(BinaryOperator.LE, left, right);
    }

    public static BinaryExpression lt(Expression left, Expression right) {
        return binary(BinaryOperator.LT, left, right);
    }

    public static BinaryExpression gt(Expression left, Expression right) {
        return binary(BinaryOperator.GT, left, right);
    }

    public static BinaryExpression ge(Expression left, Expression right) {
        return binary(BinaryOperator.GE, left, right);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }

    public static UnaryExpression neg(Expression operand) {
        return new UnaryExpression(UnaryOperator.NEGATE, operand);
    }

    public static ParenExpression paren(Expression inner) {
        return new ParenExpression(inner);
    }

    public static FunctionCall fn(String name, Expression... positional) {
        List<CallArgument> args = new ArrayList<>();
        for (Expression e : positional) {
            args.add(CallArgument.positional(e));
        }
        return new FunctionCall(name, args);
    }

    public static FunctionCall fnNamed(String name, CallArgument... arguments) {
        return new FunctionCall(name, Arrays.asList(arguments));
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    public static Assignment assign(String target, Expression value) {
        return new Assignment(VariableRef.of(target), value);
    }

    public static CallArgument arg(String name, Expression value) {
        return CallArgument.input(name, value);
    }

    public static CallArgument out(String name, String target) {
        return CallArgument.output(name, VariableRef.of(target));
    }

    public static FunctionBlockCall call(String instance, CallArgument... arguments) {
        return new FunctionBlockCall(instance, Arrays.asList(arguments));
    }

    public static IfStatement ifThen(Expression condition, Statement... then) {
        return new IfStatement(condition, List.of(then), List.of(), List.of());
    }

    public static IfStatement ifThenElse(Expression condition, List<Statement> then, List<Statement> otherwise) {
        return new IfStatement(condition, then, List.of(), otherwise);
    }

    public static ElsifClause elsif(Expression condition, Statement... statements) {
        return new ElsifClause(condition, List.of(statements));
    }

    public static CaseClause when(List<CaseLabel> labels, Statement... statements) {
        return new CaseClause(labels, List.of(statements));
    }

    public static CaseClause when(long value, Statement... statements) {
        return new CaseClause(List.of(CaseLabel.single(value)), List.of(statements));
    }

    public static CaseStatement caseOf(Expression selector, List<CaseClause> cases, Statement... otherwise) {
        return new CaseStatement(selector, cases, List.of(otherwise));
    }

    public static ForStatement forLoop(String variable, Expression start, Expression end, Expression step,
                                       Statement... body) {
        return new ForStatement(variable, start, end, step, List.of(body));
    }

    public static WhileStatement whileLoop(Expression condition, Statement... body) {
        return new WhileStatement(condition, List.of(body));
    }

    public static RepeatStatement repeat(Expression until, Statement... body) {
        return new RepeatStatement(List.of(body), until);
    }

    public static ExitStatement exit() {
        return new ExitStatement();
    }

    public static ContinueStatement continueLoop() {
        return new ContinueStatement();
    }

    public static ReturnStatement ret() {
        return new ReturnStatement();
    }

    // ---------------------------------------------------------------------
    // POUs
    // ---------------------------------------------------------------------

    public static PouBuilder program(String name) {
        return new PouBuilder(name, PouType.PROGRAM, null);
    }

    public static PouBuilder functionBlock(String name) {
        return new PouBuilder(name, PouType.FUNCTION_BLOCK, null);
    }

    public static PouBuilder function(String name, String returnType) {
        return new PouBuilder(name, PouType.FUNCTION, Objects.requireNonNull(returnType, "returnType"));
    }

    /**
     * Accumulates declarations one name at a time; consecutive declarations
     * of the same block kind share a {@link VarBlock}.
     */
    public static final class PouBuilder {
        private final String name;
        private final PouType type;
        private final String returnType;
        private final List<VarBlock> blocks = new ArrayList<>();
        private final List<Statement> statements = new ArrayList<>();

        private PouBuilder(String name, PouType type, String returnType) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = type;
            this.returnType = returnType;
        }

        public PouBuilder var(String varName, String typeName) {
            return declare(VarScope.VAR, false, varName, typeName, null);
        }

        public PouBuilder var(String varName, String typeName, Expression initialValue) {
            return declare(VarScope.VAR, false, varName, typeName, initialValue);
        }

        public PouBuilder constant(String varName, String typeName, Expression initialValue) {
            return declare(VarScope.VAR, true, varName, typeName, initialValue);
        }

        public PouBuilder input(String varName, String typeName) {
            return declare(VarScope.VAR_INPUT, false, varName, typeName, null);
        }

        public PouBuilder input(String varName, String typeName, Expression initialValue) {
            return declare(VarScope.VAR_INPUT, false, varName, typeName, initialValue);
        }

        public PouBuilder output(String varName, String typeName) {
            return declare(VarScope.VAR_OUTPUT, false, varName, typeName, null);
        }

        public PouBuilder output(String varName, String typeName, Expression initialValue) {
            return declare(VarScope.VAR_OUTPUT, false, varName, typeName, initialValue);
        }

        public PouBuilder inOut(String varName, String typeName) {
            return declare(VarScope.VAR_IN_OUT, false, varName, typeName, null);
        }

        public PouBuilder temp(String varName, String typeName) {
            return declare(VarScope.VAR_TEMP, false, varName, typeName, null);
        }

        public PouBuilder temp(String varName, String typeName, Expression initialValue) {
            return declare(VarScope.VAR_TEMP, false, varName, typeName, initialValue);
        }

        public PouBuilder declare(VarScope scope, boolean constant, String varName, String typeName,
                                  Expression initialValue) {
            VariableDeclaration decl = new VariableDeclaration(List.of(varName), typeName, initialValue);
            int last = blocks.size() - 1;
            if (last >= 0 && blocks.get(last).scope() == scope && blocks.get(last).constant() == constant) {
                List<VariableDeclaration> merged = new ArrayList<>(blocks.get(last).declarations());
                merged.add(decl);
                blocks.set(last, new VarBlock(scope, constant, merged));
            } else {
                blocks.add(new VarBlock(scope, constant, List.of(decl)));
            }
            return this;
        }

        public PouBuilder body(Statement... body) {
            statements.addAll(Arrays.asList(body));
            return this;
        }

        public Program build() {
            return new Program(name, type, returnType, blocks, statements);
        }
    }
}
