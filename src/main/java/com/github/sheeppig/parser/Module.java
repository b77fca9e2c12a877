package com.github.sheeppig.parser;

import java.util.List;
import java.util.Optional;

import com.github.sheeppig.Identifier;
import com.github.sheeppig.Literal;
import com.github.sheeppig.Operator;

/**
 * Root of the syntax tree of one source module. All nodes are immutable and own their children.
 */
public record Module(Identifier name, List<Import> imports, List<Function> functions, StatementBlock statements) {

    public Module {
        imports = List.copyOf(imports);
        functions = List.copyOf(functions);
    }

    public record Import(Identifier name, Identifier alias, Identifier source) {
        public Import(Identifier name, Identifier source) {
            this(name, name, source);
        }
    }

    public record Function(Identifier name, List<Parameter> parameters, Optional<Identifier> returnType, StatementBlock body) {
        public Function {
            parameters = List.copyOf(parameters);
        }
    }
    public record Parameter(Identifier name, Identifier type) {}

    public record StatementBlock(List<Statement> statements) {
        public static final StatementBlock EMPTY = new StatementBlock(List.of());

        public StatementBlock {
            statements = List.copyOf(statements);
        }
        public StatementBlock(Statement... statements) {
            this(List.of(statements));
        }
    }

    public sealed interface Statement {}

    public record DeclarationStatement(Identifier name, Identifier type, Expression value, boolean mutable) implements Statement {}
    public record AssignmentStatement(Reference reference, Expression value) implements Statement {}
    public record ExpressionStatement(Expression expression) implements Statement {}
    public record ReturnStatement(Expression value) implements Statement {}
    public record ConditionalStatement(Expression condition, StatementBlock body, Optional<StatementBlock> elseBody) implements Statement {
        public ConditionalStatement(Expression condition, StatementBlock body) {
            this(condition, body, Optional.empty());
        }
        public ConditionalStatement(Expression condition, StatementBlock body, StatementBlock elseBody) {
            this(condition, body, Optional.of(elseBody));
        }
    }
    public record LoopStatement(Expression condition, StatementBlock body) implements Statement {}

    public sealed interface Expression {}

    public record TernaryCondition(Expression condition, Expression trueValue, Expression falseValue) implements Expression {}
    public record BinaryOperation(Expression left, Operator operator, Expression right) implements Expression {}
    public record UnaryOperation(Operator operator, Expression operand) implements Expression {}
    public record Atomic(AtomicExpression value) implements Expression {
        public Atomic(Literal literal) {
            this(new LiteralExpression(literal));
        }
        public Atomic(Identifier identifier) {
            this(new IdentifierExpression(identifier));
        }
    }

    /**
     * Primary expressions: no operator at the outermost level.
     */
    public sealed interface AtomicExpression {}

    public record LiteralExpression(Literal literal) implements AtomicExpression {}
    public record IdentifierExpression(Identifier identifier) implements AtomicExpression {}
    public record FunctionCall(Identifier name, List<Expression> parameters) implements AtomicExpression {
        public FunctionCall {
            parameters = List.copyOf(parameters);
        }
    }
    public record Parenthesized(Expression value) implements AtomicExpression {}
    public record ArrayLiteral(List<Expression> values) implements AtomicExpression {
        public ArrayLiteral {
            values = List.copyOf(values);
        }
    }
    public record ArrayIndex(AtomicExpression array, Index index) implements AtomicExpression {}

    public sealed interface Index {}
    public record SingleIndex(Expression value) implements Index {}
    public record SliceIndex(Optional<Expression> start, Optional<Expression> end) implements Index {}

    /**
     * Assignable place on the left of {@code =}.
     */
    public sealed interface Reference {}
    public record IdentifierReference(Identifier identifier) implements Reference {}
    public record ArrayReference(Reference array, Index index) implements Reference {}

}
