package com.github.sheeppig.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.sheeppig.ErrorKind;
import com.github.sheeppig.Identifier;
import com.github.sheeppig.Keyword;
import com.github.sheeppig.TokenType;
import com.github.sheeppig.Tokens;
import com.github.sheeppig.parser.Module.Function;
import com.github.sheeppig.parser.Module.Import;
import com.github.sheeppig.parser.Module.Parameter;
import com.github.sheeppig.parser.Module.Statement;
import com.github.sheeppig.parser.Module.StatementBlock;

/**
 * Entry point of syntactic analysis: parses a preprocessed token sequence into a {@link Module}.
 * A module is an optional {@code using} block, then function definitions, then top-level
 * statements, in that order.
 */
public class Parser {

    public static final Identifier DEFAULT_MODULE_NAME = Identifier.of("main");

    private final ExpressionParser expressionParser = new ExpressionParser();
    private final StatementParser statementParser = new StatementParser(expressionParser);

    public Module parseModule(Tokens tokens) {
        return parseModule(tokens, DEFAULT_MODULE_NAME);
    }

    public Module parseModule(Tokens tokens, Identifier name) {
        boolean hasImports = false;
        boolean hasFunctions = false;
        boolean hasStatements = false;

        List<Import> imports = new ArrayList<>();
        List<Function> functions = new ArrayList<>();
        List<Statement> statements = new ArrayList<>();

        while (true) {
            if (!tokens.hasNext()) {
                throw tokens.expected("the end of the module");
            }

            if (tokens.matches(TokenType.NEWLINE)) {
                tokens.next();
            } else if (tokens.matches(TokenType.END_OF_MODULE)) {
                tokens.next();
                break;
            } else if (tokens.matches(Keyword.USING)) {
                if (hasImports || hasFunctions || hasStatements) {
                    throw tokens.error(ErrorKind.MISPLACED_DECLARATION,
                        "Only one using block is allowed and it must be at the top of the module");
                }
                imports.addAll(parseUsingBlock(tokens));
                hasImports = true;
            } else if (tokens.matches(Keyword.FUNCTION)) {
                if (hasStatements) {
                    throw tokens.error(ErrorKind.MISPLACED_DECLARATION, "Functions must be defined before any statements");
                }
                tokens.next();
                functions.add(parseFunction(tokens));
                hasFunctions = true;
            } else if (tokens.matches(TokenType.CLOSE_BRACE)) {
                throw tokens.error(ErrorKind.UNEXPECTED_TOKEN, "Unexpected '}' outside of a block");
            } else {
                statements.add(statementParser.parseBlockStatement(tokens));
                hasStatements = true;
            }
        }

        return new Module(name, imports, functions, new StatementBlock(statements));
    }

    // fun <> name "(" parameters ")" (":" type)? block
    public Function parseFunction(Tokens tokens) {
        var name = tokens.nextIdentifier("a function name after 'fun'");
        var parameters = parseParameterList(tokens);

        Optional<Identifier> returnType = Optional.empty();
        if (tokens.matches(TokenType.COLON)) {
            tokens.next();
            returnType = Optional.of(tokens.nextIdentifier("a return type after ':'"));
        }

        var body = statementParser.parseStatementBlock(tokens);
        return new Function(name, parameters, returnType, body);
    }

    private List<Parameter> parseParameterList(Tokens tokens) {
        tokens.next(TokenType.OPEN_PAREN, "a parameter list starting with '('");
        List<Parameter> parameters = new ArrayList<>();

        tokens.skipNewlines();
        if (tokens.matches(TokenType.CLOSE_PAREN)) {
            tokens.next();
            return parameters;
        }

        while (true) {
            tokens.skipNewlines();
            parameters.add(parseParameter(tokens));
            tokens.skipNewlines();
            if (tokens.matches(TokenType.CLOSE_PAREN)) {
                tokens.next();
                return parameters;
            }
            tokens.next(TokenType.LIST_SEPARATOR, "',' or ')' after a parameter");
        }
    }

    // <> name ":" type
    private Parameter parseParameter(Tokens tokens) {
        var name = tokens.nextIdentifier("a parameter");
        tokens.next(TokenType.COLON, "':' after the parameter name");
        var type = tokens.nextIdentifier("a type identifier after ':'");
        return new Parameter(name, type);
    }

    /**
     * <pre>
     * using {
     *     sin, cos from math.trig
     *     vector as vec from math
     * }
     * </pre>
     * Every name on a line becomes one {@link Import} of the module named after {@code from}.
     */
    public List<Import> parseUsingBlock(Tokens tokens) {
        tokens.nextKeyword(Keyword.USING, "'using'");
        tokens.next(TokenType.OPEN_BRACE, "'{' after 'using'");

        List<Import> imports = new ArrayList<>();
        while (true) {
            tokens.skipNewlines();
            if (tokens.matches(TokenType.CLOSE_BRACE)) {
                tokens.next();
                return imports;
            }
            imports.addAll(parseImportLine(tokens));
            if (!tokens.matches(TokenType.CLOSE_BRACE)) {
                tokens.next(TokenType.NEWLINE, "a newline or '}' after an import");
            }
        }
    }

    // <> name ("as" alias)? ("," name ("as" alias)?)* "from" module
    private List<Import> parseImportLine(Tokens tokens) {
        List<Identifier> names = new ArrayList<>();
        List<Identifier> aliases = new ArrayList<>();

        while (true) {
            var name = tokens.nextIdentifier("an imported name");
            var alias = name;
            if (tokens.matches(Keyword.AS)) {
                tokens.next();
                alias = tokens.nextIdentifier("an alias after 'as'");
            }
            names.add(name);
            aliases.add(alias);

            if (!tokens.matches(TokenType.LIST_SEPARATOR)) {
                break;
            }
            tokens.next();
        }

        tokens.nextKeyword(Keyword.FROM, "'from' and the module to import from");
        var source = tokens.nextIdentifier("a module name after 'from'");

        List<Import> imports = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            imports.add(new Import(names.get(i), aliases.get(i), source));
        }
        return imports;
    }

}
