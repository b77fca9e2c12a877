package com.github.sheeppig.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.sheeppig.ErrorKind;
import com.github.sheeppig.Identifier;
import com.github.sheeppig.Keyword;
import com.github.sheeppig.ParseException;
import com.github.sheeppig.Token;
import com.github.sheeppig.TokenType;
import com.github.sheeppig.Tokens;
import com.github.sheeppig.parser.Module.ArrayIndex;
import com.github.sheeppig.parser.Module.ArrayReference;
import com.github.sheeppig.parser.Module.AssignmentStatement;
import com.github.sheeppig.parser.Module.Atomic;
import com.github.sheeppig.parser.Module.AtomicExpression;
import com.github.sheeppig.parser.Module.BinaryOperation;
import com.github.sheeppig.parser.Module.ConditionalStatement;
import com.github.sheeppig.parser.Module.DeclarationStatement;
import com.github.sheeppig.parser.Module.Expression;
import com.github.sheeppig.parser.Module.ExpressionStatement;
import com.github.sheeppig.parser.Module.IdentifierExpression;
import com.github.sheeppig.parser.Module.IdentifierReference;
import com.github.sheeppig.parser.Module.LoopStatement;
import com.github.sheeppig.parser.Module.Reference;
import com.github.sheeppig.parser.Module.ReturnStatement;
import com.github.sheeppig.parser.Module.Statement;
import com.github.sheeppig.parser.Module.StatementBlock;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class StatementParser {

    private final ExpressionParser expressionParser;

    // <> "{" (statement | NEWLINE)* "}"
    public StatementBlock parseStatementBlock(Tokens tokens) {
        tokens.next(TokenType.OPEN_BRACE, "'{' to open a statement block");

        List<Statement> statements = new ArrayList<>();
        while (true) {
            tokens.skipNewlines();
            if (tokens.matches(TokenType.CLOSE_BRACE)) {
                tokens.next();
                break;
            }
            if (!tokens.hasNext() || tokens.matches(TokenType.END_OF_MODULE)) {
                throw tokens.expected("'}' to close the statement block");
            }
            statements.add(parseBlockStatement(tokens));
        }
        return new StatementBlock(statements);
    }

    /**
     * One statement inside a block or at the top level of a module. Conditionals and loops read
     * straight from {@code tokens}; everything else is sliced out first.
     */
    Statement parseBlockStatement(Tokens tokens) {
        if (tokens.matches(Keyword.IF)) {
            return parseConditional(tokens);
        }
        if (tokens.matches(Keyword.WHILE)) {
            return parseLoop(tokens);
        }
        if (tokens.matches(Keyword.FOR)) {
            throw tokens.error(ErrorKind.UNSUPPORTED, "'for' loops are not supported, use 'while'");
        }
        return parseStatement(tokens);
    }

    // <> "if" expression block ("else" (conditional | block))?
    private ConditionalStatement parseConditional(Tokens tokens) {
        tokens.nextKeyword(Keyword.IF, "'if'");
        var condition = expressionParser.parseExpression(tokens);
        var body = parseStatementBlock(tokens);

        if (!tokens.matches(Keyword.ELSE)) {
            return new ConditionalStatement(condition, body);
        }
        tokens.next();
        if (tokens.matches(Keyword.IF)) {
            return new ConditionalStatement(condition, body, new StatementBlock(parseConditional(tokens)));
        }
        return new ConditionalStatement(condition, body, parseStatementBlock(tokens));
    }

    // <> "while" expression block
    private LoopStatement parseLoop(Tokens tokens) {
        tokens.nextKeyword(Keyword.WHILE, "'while'");
        var condition = expressionParser.parseExpression(tokens);
        var body = parseStatementBlock(tokens);
        return new LoopStatement(condition, body);
    }

    /**
     * Cuts the next statement out of {@code tokens} and parses it.
     */
    public Statement parseStatement(Tokens tokens) {
        return parseStatementTokens(tokens.consumeStatement());
    }

    /**
     * Parses a run of tokens that holds exactly one statement.
     */
    Statement parseStatementTokens(Tokens statement) {
        if (!statement.hasNext()) {
            throw statement.expected("a statement");
        }

        if (statement.matches(Keyword.RETURN)) {
            statement.next();
            var value = expressionParser.parseExpression(statement);
            expectEndOfStatement(statement);
            return new ReturnStatement(value);
        }

        boolean mutable = false;
        if (statement.matches(Keyword.VARIABLE)) {
            statement.next();
            mutable = true;
        }

        var left = expressionParser.parseExpression(statement);

        if (!statement.hasNext()) {
            if (mutable) {
                throw statement.expected("':' and a type in the variable declaration");
            }
            return new ExpressionStatement(left);
        }

        var token = statement.peek();
        return switch (token.type()) {
            case COLON -> parseDeclaration(left, statement, mutable);
            case ASSIGN -> {
                rejectUntypedDeclaration(statement, mutable);
                var reference = toReference(left, statement);
                statement.next();
                var value = expressionParser.parseExpression(statement);
                expectEndOfStatement(statement);
                yield new AssignmentStatement(reference, value);
            }
            case BINARY_ASSIGN -> {
                rejectUntypedDeclaration(statement, mutable);
                var reference = toReference(left, statement);
                var operator = ((Token.BinaryAssign) statement.next()).operator();
                var right = expressionParser.parseExpression(statement);
                expectEndOfStatement(statement);
                yield new AssignmentStatement(reference, new BinaryOperation(left, operator, right));
            }
            default -> throw statement.error(ErrorKind.UNEXPECTED_TOKEN, "Unrecognised token in statement");
        };
    }

    // <> "var"? name ":" type "=" expression
    private DeclarationStatement parseDeclaration(Expression left, Tokens statement, boolean mutable) {
        var name = declaredName(left, statement);
        statement.next(TokenType.COLON, "':'");
        var type = statement.nextIdentifier("a type after ':'");
        statement.next(TokenType.ASSIGN, "'=' to initialise the declared variable");
        var value = expressionParser.parseExpression(statement);
        expectEndOfStatement(statement);
        return new DeclarationStatement(name, type, value, mutable);
    }

    private static Identifier declaredName(Expression left, Tokens statement) {
        if (left instanceof Atomic atomic
                && atomic.value() instanceof IdentifierExpression ie
                && ie.identifier() instanceof Identifier.Simple) {
            return ie.identifier();
        }
        throw new ParseException(ErrorKind.INVALID_REFERENCE,
            "Expected a simple name before ':' in a declaration, got " + left,
            Optional.of(statement.peek()), statement.position());
    }

    private static void rejectUntypedDeclaration(Tokens statement, boolean mutable) {
        if (mutable) {
            throw statement.error(ErrorKind.EXPECTED_TOKEN, "A variable declaration must be followed by ':' and a type");
        }
    }

    private static Reference toReference(Expression left, Tokens statement) {
        if (left instanceof Atomic atomic) {
            var reference = toReference(atomic.value());
            if (reference.isPresent()) {
                return reference.get();
            }
        }
        throw new ParseException(ErrorKind.INVALID_REFERENCE,
            "Expected a name or an array element before an assignment, got " + left,
            Optional.of(statement.peek()), statement.position());
    }

    private static Optional<Reference> toReference(AtomicExpression atom) {
        if (atom instanceof IdentifierExpression ie) {
            return Optional.of(new IdentifierReference(ie.identifier()));
        }
        if (atom instanceof ArrayIndex ai) {
            return toReference(ai.array()).<Reference>map(array -> new ArrayReference(array, ai.index()));
        }
        return Optional.empty();
    }

    private static void expectEndOfStatement(Tokens statement) {
        if (statement.hasNext()) {
            throw statement.error(ErrorKind.UNEXPECTED_TOKEN, "Unrecognised token in statement");
        }
    }

}
