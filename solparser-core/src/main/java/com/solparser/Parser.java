package com.solparser;

import com.google.common.flogger.GoogleLogger;
import com.solparser.assembly.AssemblyBlock;
import com.solparser.ast.*;
import com.solparser.version.SemVerMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Parser extends ParserBase {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    // Comma, assignment and conditional take precedences 1 to 3 and are handled outside the binary loop
    private static final int MIN_BINARY_PRECEDENCE = 4;

    // Enables the placeholder statement '_'
    private boolean insideModifier = false;

    /**
     * Outcome of looking at the start of a statement: a declaration, an expression,
     * or a path that must be consumed before deciding.
     */
    private enum StatementKind {
        VARIABLE_DECLARATION,
        EXPRESSION,
        INDEX_ACCESS_PATH
    }

    private record PathLookahead(StatementKind kind, IndexAccessedPath path) {}

    private record CallArguments(List<Expression> arguments, List<String> names) {}

    private record ContractKindSpec(ContractKind kind, boolean abstractContract) {}

    private record VarDeclOptions(
        boolean stateVariable,
        boolean allowIndexed,
        boolean allowEmptyName,
        boolean allowInitialValue,
        boolean allowLocationSpecifier
    ) {
        static final VarDeclOptions PLAIN = new VarDeclOptions(false, false, false, false, false);
        static final VarDeclOptions STATE_VARIABLE = new VarDeclOptions(true, false, false, true, false);
        static final VarDeclOptions WITH_LOCATION = new VarDeclOptions(false, false, false, false, true);
        static final VarDeclOptions EVENT_PARAMETER = new VarDeclOptions(false, true, false, false, false);
        static final VarDeclOptions MODIFIER_PARAMETER = new VarDeclOptions(false, true, false, false, true);
        static final VarDeclOptions UNNAMED_WITH_LOCATION = new VarDeclOptions(false, false, true, false, true);

        VarDeclOptions withEmptyName() {
            return new VarDeclOptions(stateVariable, allowIndexed, true, allowInitialValue, allowLocationSpecifier);
        }
    }

    // Collected while parsing a function or function type header
    private static final class FunctionHeader {
        ParameterList parameters;
        List<ModifierInvocation> modifiers = new ArrayList<>();
        Visibility visibility = Visibility.DEFAULT;
        StateMutability stateMutability = StateMutability.NON_PAYABLE;
        boolean virtual = false;
        OverrideSpecifier overrides;
        ParameterList returnParameters;
    }

    public Parser(ErrorReporter reporter, ParserOptions options) {
        super(reporter, options);
    }

    public Parser(ErrorReporter reporter) {
        this(reporter, ParserOptions.defaults());
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Parses a whole source file. Returns null if a fatal error aborted the parse;
     * the reason is in the reporter.
     */
    public SourceUnit parse(TokenSource source) {
        if (insideModifier) {
            throw new IllegalStateException("Parser reused while inside a modifier");
        }
        beginSession(source);
        logger.atFine().log("Parsing source unit %s", source.sourceName());
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            List<SourceUnitMember> nodes = new ArrayList<>();
            while (currentToken() != TokenType.EOS) {
                SourceUnitMember node = switch (currentToken()) {
                    case PRAGMA -> parsePragmaDirective();
                    case IMPORT -> parseImportDirective();
                    case ABSTRACT, INTERFACE, CONTRACT, LIBRARY -> parseContractDefinition();
                    case STRUCT -> parseStructDefinition();
                    case ENUM -> parseEnumDefinition();
                    case FUNCTION -> parseFunctionDefinition(true);
                    default -> throw fatalParserError(7858,
                        "Expected pragma, import directive or contract/interface/library/struct/enum/function definition.");
                };
                nodes.add(node);
            }
            checkRecursionBalanced();
            String license = LicenseFinder.findLicense(scanner.source(), sourceName(), nodes, reporter);
            SourceUnit unit = nodeFactory.create((id, loc) -> new SourceUnit(id, loc, license, nodes));
            logger.atFine().log("Parsed %s: %d top-level nodes, %d diagnostics",
                source.sourceName(), nodes.size(), reporter.diagnostics().size());
            return unit;
        } catch (ParseException e) {
            return abandon(e);
        }
    }

    /**
     * Parses a standalone expression that must make up the whole input.
     */
    public Expression parseExpression(TokenSource source) {
        beginSession(source);
        try {
            Expression result = parseExpression();
            checkRecursionBalanced();
            if (currentToken() != TokenType.EOS) {
                parserError(4272, "Expected end of expression but got " + tokenName(currentToken()));
            }
            return result;
        } catch (ParseException e) {
            return abandon(e);
        }
    }

    /**
     * Parses a specification expression: an optional quantifier prefix followed by
     * an ordinary expression.
     */
    public SpecificationExpression parseSpecificationExpression(TokenSource source) {
        beginSession(source);
        try {
            SpecificationExpression result = parseSpecificationExpression();
            checkRecursionBalanced();
            if (currentToken() != TokenType.EOS) {
                parserError(1553, "Expected end of expression but got " + tokenName(currentToken()));
            }
            return result;
        } catch (ParseException e) {
            return abandon(e);
        }
    }

    /**
     * Parses {@code [ case pre : post ; ... ]}. On a fatal error the cases parsed so far
     * are returned.
     */
    public List<SpecificationCase> parseSpecificationCases(TokenSource source) {
        beginSession(source);
        List<SpecificationCase> cases = new ArrayList<>();
        try {
            expectToken(TokenType.LBRACK);
            while (currentToken() == TokenType.CASE) {
                advance();
                SpecificationExpression precondition = parseSpecificationExpression();
                expectToken(TokenType.COLON);
                SpecificationExpression postcondition = parseSpecificationExpression();
                expectToken(TokenType.SEMICOLON);
                cases.add(new SpecificationCase(precondition, postcondition));
            }
            expectToken(TokenType.RBRACK);
            checkRecursionBalanced();
            if (currentToken() != TokenType.EOS) {
                parserError(2180, "Expected end of expression but got " + tokenName(currentToken()));
            }
        } catch (ParseException e) {
            abandon(e);
        }
        return cases;
    }

    public static SourceUnit parse(String source) {
        return new Parser(new ErrorReporter()).parse(new Scanner(source));
    }

    public static SourceUnit parse(String source, String sourceName, ErrorReporter reporter, ParserOptions options) {
        return new Parser(reporter, options).parse(new Scanner(source, sourceName));
    }

    private <T> T abandon(ParseException e) {
        if (!reporter.hasErrors()) {
            throw e;
        }
        logger.atFine().log("Parse of %s aborted: %s", sourceName(), e.getMessage());
        return null;
    }

    private void checkRecursionBalanced() {
        if (recursionDepth() != 0) {
            throw new IllegalStateException("Unbalanced recursion depth " + recursionDepth());
        }
    }

    // ========================================================================
    // Source unit members
    // ========================================================================

    private PragmaDirective parsePragmaDirective() {
        increaseRecursionDepth();
        try {
            // pragma anything* ;
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.PRAGMA);
            List<String> literals = new ArrayList<>();
            List<TokenType> tokens = new ArrayList<>();
            do {
                TokenType token = currentToken();
                if (token == TokenType.ILLEGAL) {
                    parserError(6281, "Token incompatible with Solidity parser as part of pragma directive.");
                } else {
                    String literal = currentLiteral();
                    if (literal.isEmpty() && token.text() != null) {
                        literal = token.text();
                    }
                    literals.add(literal);
                    tokens.add(token);
                }
                advance();
            } while (currentToken() != TokenType.SEMICOLON && currentToken() != TokenType.EOS);
            expectClosingToken(nodeFactory, TokenType.SEMICOLON);

            if (literals.size() >= 2 && literals.get(0).equals("solidity")) {
                parsePragmaVersion(
                    nodeFactory.location(),
                    tokens.subList(1, tokens.size()),
                    literals.subList(1, literals.size()));
            }
            return nodeFactory.create((id, loc) -> new PragmaDirective(id, loc, tokens, literals));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private void parsePragmaVersion(SourceLocation location, List<TokenType> tokens, List<String> literals) {
        boolean matches;
        try {
            matches = SemVerMatcher.fromTokens(tokens, literals).matches(options.compilerVersion());
        } catch (IllegalArgumentException e) {
            // An unparsable constraint matches no version
            logger.atFine().withCause(e).log("Unparsable version pragma at %s", location);
            matches = false;
        }
        // With recovery enabled the mismatch is left to later checks
        if (!matches && !options.errorRecovery()) {
            throw fatalParserError(5333, location,
                "Source file requires different compiler version (current compiler is "
                    + options.compilerVersion() + ") - note that nightly builds are considered to be "
                    + "strictly less than the released version");
        }
    }

    private ImportDirective parseImportDirective() {
        increaseRecursionDepth();
        try {
            // import "abc" [as x];
            // import * as x from "abc";
            // import {a as b, c} from "abc";
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.IMPORT);
            String path;
            String unitAlias = "";
            List<ImportDirective.SymbolAlias> symbolAliases = new ArrayList<>();

            if (currentToken() == TokenType.STRING_LITERAL) {
                path = getLiteralAndAdvance();
                if (currentToken() == TokenType.AS) {
                    advance();
                    unitAlias = expectIdentifierToken();
                }
            } else {
                if (currentToken() == TokenType.LBRACE) {
                    advance();
                    while (true) {
                        String alias = null;
                        SourceLocation aliasLocation = currentLocation();
                        Identifier symbol = parseIdentifier();
                        if (currentToken() == TokenType.AS) {
                            expectToken(TokenType.AS);
                            aliasLocation = currentLocation();
                            alias = expectIdentifierToken();
                        }
                        symbolAliases.add(new ImportDirective.SymbolAlias(symbol, alias, aliasLocation));
                        if (currentToken() != TokenType.COMMA) {
                            break;
                        }
                        advance();
                    }
                    expectToken(TokenType.RBRACE);
                } else if (currentToken() == TokenType.MUL) {
                    advance();
                    expectToken(TokenType.AS);
                    unitAlias = expectIdentifierToken();
                } else {
                    throw fatalParserError(9478, "Expected string literal (path), \"*\" or alias list.");
                }
                // "from" is an ordinary identifier, not a keyword
                if (currentToken() != TokenType.IDENTIFIER || !currentLiteral().equals("from")) {
                    throw fatalParserError(8208, "Expected \"from\".");
                }
                advance();
                if (currentToken() != TokenType.STRING_LITERAL) {
                    throw fatalParserError(6845, "Expected import path.");
                }
                path = getLiteralAndAdvance();
            }
            if (path.isEmpty()) {
                throw fatalParserError(6326, "Import path cannot be empty.");
            }
            expectClosingToken(nodeFactory, TokenType.SEMICOLON);
            String importPath = path;
            String importAlias = unitAlias;
            return nodeFactory.create((id, loc) -> new ImportDirective(id, loc, importPath, importAlias, symbolAliases));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ContractKindSpec parseContractKind() {
        boolean abstractContract = false;
        if (currentToken() == TokenType.ABSTRACT) {
            abstractContract = true;
            advance();
        }
        ContractKind kind;
        switch (currentToken()) {
            case INTERFACE -> kind = ContractKind.INTERFACE;
            case CONTRACT -> kind = ContractKind.CONTRACT;
            case LIBRARY -> kind = ContractKind.LIBRARY;
            default -> {
                parserError(3515, "Expected keyword \"contract\", \"interface\" or \"library\".");
                return new ContractKindSpec(ContractKind.CONTRACT, abstractContract);
            }
        }
        advance();
        return new ContractKindSpec(kind, abstractContract);
    }

    private ContractDefinition parseContractDefinition() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            String name = null;
            StructuredDocumentation documentation = null;
            List<InheritanceSpecifier> baseContracts = new ArrayList<>();
            List<ContractMember> subNodes = new ArrayList<>();
            ContractKindSpec kind = new ContractKindSpec(ContractKind.CONTRACT, false);
            try {
                documentation = parseStructuredDocumentation();
                kind = parseContractKind();
                name = expectIdentifierToken();
                if (currentToken() == TokenType.IS) {
                    do {
                        advance();
                        baseContracts.add(parseInheritanceSpecifier());
                    } while (currentToken() == TokenType.COMMA);
                }
                expectToken(TokenType.LBRACE);
                while (true) {
                    TokenType token = currentToken();
                    if (token == TokenType.RBRACE) {
                        break;
                    } else if ((token == TokenType.FUNCTION && peekNextToken() != TokenType.LPAREN)
                        || token == TokenType.CONSTRUCTOR
                        || token == TokenType.RECEIVE
                        || token == TokenType.FALLBACK) {
                        subNodes.add(parseFunctionDefinition(false));
                    } else if (token == TokenType.STRUCT) {
                        subNodes.add(parseStructDefinition());
                    } else if (token == TokenType.ENUM) {
                        subNodes.add(parseEnumDefinition());
                    } else if (token == TokenType.IDENTIFIER
                        || token == TokenType.MAPPING
                        || token.isElementaryTypeName()
                        || (token == TokenType.FUNCTION && peekNextToken() == TokenType.LPAREN)) {
                        subNodes.add(parseVariableDeclaration(VarDeclOptions.STATE_VARIABLE, null));
                        expectToken(TokenType.SEMICOLON);
                    } else if (token == TokenType.MODIFIER) {
                        subNodes.add(parseModifierDefinition());
                    } else if (token == TokenType.EVENT) {
                        subNodes.add(parseEventDefinition());
                    } else if (token == TokenType.USING) {
                        subNodes.add(parseUsingDirective());
                    } else {
                        throw fatalParserError(9182, "Function, variable, struct or modifier declaration expected.");
                    }
                }
            } catch (ParseException e) {
                enterRecoveryOrRethrow(e, "ContractDefinition");
            }
            if (inRecovery) {
                expectTokenOrConsumeUntil(TokenType.RBRACE, "ContractDefinition", false);
                nodeFactory.markEndPosition();
                advance();
            } else {
                expectClosingToken(nodeFactory, TokenType.RBRACE);
            }
            String contractName = name;
            StructuredDocumentation contractDocumentation = documentation;
            ContractKindSpec contractKind = kind;
            return nodeFactory.create((id, loc) -> new ContractDefinition(id, loc, contractName, contractDocumentation,
                baseContracts, subNodes, contractKind.kind(), contractKind.abstractContract()));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private InheritanceSpecifier parseInheritanceSpecifier() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            UserDefinedTypeName baseName = parseUserDefinedTypeName();
            List<Expression> arguments = null;
            if (currentToken() == TokenType.LPAREN) {
                advance();
                arguments = parseFunctionCallListArguments();
                expectClosingToken(nodeFactory, TokenType.RPAREN);
            } else {
                nodeFactory.setEndPositionFromNode(baseName);
            }
            List<Expression> baseArguments = arguments;
            return nodeFactory.create((id, loc) -> new InheritanceSpecifier(id, loc, baseName, baseArguments));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Visibility parseVisibilitySpecifier() {
        Visibility visibility = switch (currentToken()) {
            case PUBLIC -> Visibility.PUBLIC;
            case INTERNAL -> Visibility.INTERNAL;
            case PRIVATE -> Visibility.PRIVATE;
            case EXTERNAL -> Visibility.EXTERNAL;
            default -> throw new IllegalStateException("Invalid visibility specifier " + currentToken());
        };
        advance();
        return visibility;
    }

    private StateMutability parseStateMutability() {
        StateMutability stateMutability = switch (currentToken()) {
            case PAYABLE -> StateMutability.PAYABLE;
            case VIEW -> StateMutability.VIEW;
            case PURE -> StateMutability.PURE;
            default -> throw new IllegalStateException("Invalid state mutability specifier " + currentToken());
        };
        advance();
        return stateMutability;
    }

    private OverrideSpecifier parseOverrideSpecifier() {
        if (currentToken() != TokenType.OVERRIDE) {
            throw new IllegalStateException("Expected 'override'");
        }
        NodeFactory nodeFactory = new NodeFactory(this);
        List<UserDefinedTypeName> overrides = new ArrayList<>();

        nodeFactory.markEndPosition();
        advance();

        if (currentToken() == TokenType.LPAREN) {
            advance();
            while (true) {
                overrides.add(parseUserDefinedTypeName());
                if (currentToken() == TokenType.RPAREN) {
                    break;
                }
                expectToken(TokenType.COMMA);
            }
            expectClosingToken(nodeFactory, TokenType.RPAREN);
        }
        return nodeFactory.create((id, loc) -> new OverrideSpecifier(id, loc, overrides));
    }

    /**
     * Parameters, specifiers and return parameters shared by function definitions
     * and function type names. For function types, a second {@code internal} or
     * {@code external} ends the header: it belongs to the state variable.
     */
    private FunctionHeader parseFunctionHeader(boolean isStateVariable) {
        increaseRecursionDepth();
        try {
            FunctionHeader header = new FunctionHeader();
            header.parameters = parseParameterList(VarDeclOptions.WITH_LOCATION, true);
            while (true) {
                TokenType token = currentToken();
                if (!isStateVariable && token == TokenType.IDENTIFIER) {
                    header.modifiers.add(parseModifierInvocation());
                } else if (token.isVisibilitySpecifier()) {
                    if (header.visibility != Visibility.DEFAULT) {
                        if (isStateVariable
                            && (header.visibility == Visibility.EXTERNAL || header.visibility == Visibility.INTERNAL)) {
                            break;
                        }
                        parserError(9439, "Visibility already specified as \"" + visibilityName(header.visibility) + "\".");
                        advance();
                    } else {
                        header.visibility = parseVisibilitySpecifier();
                    }
                } else if (token.isStateMutabilitySpecifier()) {
                    if (header.stateMutability != StateMutability.NON_PAYABLE) {
                        parserError(9680, "State mutability already specified as \""
                            + mutabilityName(header.stateMutability) + "\".");
                        advance();
                    } else {
                        header.stateMutability = parseStateMutability();
                    }
                } else if (!isStateVariable && token == TokenType.OVERRIDE) {
                    if (header.overrides != null) {
                        parserError(1827, "Override already specified.");
                    }
                    header.overrides = parseOverrideSpecifier();
                } else if (!isStateVariable && token == TokenType.VIRTUAL) {
                    if (header.virtual) {
                        parserError(6879, "Virtual already specified.");
                    }
                    header.virtual = true;
                    advance();
                } else {
                    break;
                }
            }
            if (currentToken() == TokenType.RETURNS) {
                advance();
                header.returnParameters = parseParameterList(VarDeclOptions.WITH_LOCATION, false);
            } else {
                header.returnParameters = createEmptyParameterList();
            }
            return header;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private FunctionDefinition parseFunctionDefinition(boolean freeFunction) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            StructuredDocumentation documentation = parseStructuredDocumentation();

            TokenType kindToken = currentToken();
            String name;
            if (kindToken == TokenType.FUNCTION) {
                advance();
                TokenType token = currentToken();
                if (token == TokenType.CONSTRUCTOR || token == TokenType.FALLBACK || token == TokenType.RECEIVE) {
                    String expected = switch (token) {
                        case CONSTRUCTOR -> "constructor";
                        case FALLBACK -> "fallback function";
                        default -> "receive function";
                    };
                    name = token.text();
                    String message = "This function is named \"" + name + "\" but is not the " + expected
                        + " of the contract. If you intend this to be a " + expected + ", use \"" + name
                        + "(...) { ... }\" without the \"function\" keyword to define it.";
                    if (token == TokenType.CONSTRUCTOR) {
                        parserError(3323, message);
                    } else {
                        parserWarning(3445, message);
                    }
                    advance();
                } else {
                    name = expectIdentifierToken();
                }
            } else {
                if (kindToken != TokenType.CONSTRUCTOR && kindToken != TokenType.FALLBACK && kindToken != TokenType.RECEIVE) {
                    throw new IllegalStateException("Unexpected function kind " + kindToken);
                }
                advance();
                name = "";
            }

            FunctionHeader header = parseFunctionHeader(false);

            Block body = null;
            nodeFactory.markEndPosition();
            if (currentToken() == TokenType.SEMICOLON) {
                advance();
            } else {
                body = parseBlock(null);
                nodeFactory.setEndPositionFromNode(body);
            }
            Block functionBody = body;
            FunctionKind kind = functionKind(kindToken);
            return nodeFactory.create((id, loc) -> new FunctionDefinition(id, loc, name, header.visibility,
                header.stateMutability, freeFunction, kind, header.virtual, header.overrides, documentation,
                header.parameters, header.modifiers, header.returnParameters, functionBody));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private StructDefinition parseStructDefinition() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.STRUCT);
            String name = expectIdentifierToken();
            List<VariableDeclaration> members = new ArrayList<>();
            expectToken(TokenType.LBRACE);
            while (currentToken() != TokenType.RBRACE) {
                members.add(parseVariableDeclaration(VarDeclOptions.PLAIN, null));
                expectToken(TokenType.SEMICOLON);
            }
            expectClosingToken(nodeFactory, TokenType.RBRACE);
            return nodeFactory.create((id, loc) -> new StructDefinition(id, loc, name, members));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private EnumValue parseEnumValue() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            nodeFactory.markEndPosition();
            String name = expectIdentifierToken();
            return nodeFactory.create((id, loc) -> new EnumValue(id, loc, name));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private EnumDefinition parseEnumDefinition() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.ENUM);
            String name = expectIdentifierToken();
            List<EnumValue> members = new ArrayList<>();
            expectToken(TokenType.LBRACE);

            while (currentToken() != TokenType.RBRACE) {
                members.add(parseEnumValue());
                if (currentToken() == TokenType.RBRACE) {
                    break;
                }
                expectToken(TokenType.COMMA);
                if (currentToken() != TokenType.IDENTIFIER) {
                    throw fatalParserError(1612, "Expected identifier after ','");
                }
            }
            if (members.isEmpty()) {
                parserError(3147, "enum with no members is not allowed.");
            }

            expectClosingToken(nodeFactory, TokenType.RBRACE);
            return nodeFactory.create((id, loc) -> new EnumDefinition(id, loc, name, members));
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * Parses a variable declaration. {@code lookAheadType} is a type name already
     * consumed by the statement lookahead, or null.
     */
    private VariableDeclaration parseVariableDeclaration(VarDeclOptions declOptions, TypeName lookAheadType) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = lookAheadType != null
                ? new NodeFactory(this, lookAheadType)
                : new NodeFactory(this);

            StructuredDocumentation documentation = parseStructuredDocumentation();
            TypeName type = lookAheadType != null ? lookAheadType : parseTypeName();
            nodeFactory.setEndPositionFromNode(type);

            if (!declOptions.stateVariable() && documentation != null) {
                parserError(2837, "Only state variables can have a docstring.");
            }

            if (type instanceof FunctionTypeName && declOptions.stateVariable() && currentToken() == TokenType.LBRACE) {
                throw fatalParserError(2915,
                    "Expected a state variable declaration. If you intended this as a fallback function "
                        + "or a function to handle plain ether transactions, use the \"fallback\" keyword "
                        + "or the \"receive\" keyword instead.");
            }

            boolean indexed = false;
            Mutability mutability = Mutability.MUTABLE;
            OverrideSpecifier overrides = null;
            Visibility visibility = Visibility.DEFAULT;
            DataLocation location = DataLocation.UNSPECIFIED;

            while (true) {
                TokenType token = currentToken();
                if (declOptions.stateVariable() && token.isVariableVisibilitySpecifier()) {
                    nodeFactory.markEndPosition();
                    if (visibility != Visibility.DEFAULT) {
                        parserError(4110, "Visibility already specified as \"" + visibilityName(visibility) + "\".");
                        advance();
                    } else {
                        visibility = parseVisibilitySpecifier();
                    }
                } else if (declOptions.stateVariable() && token == TokenType.OVERRIDE) {
                    if (overrides != null) {
                        parserError(9125, "Override already specified.");
                    }
                    overrides = parseOverrideSpecifier();
                } else {
                    if (declOptions.allowIndexed() && token == TokenType.INDEXED) {
                        indexed = true;
                    } else if (token == TokenType.CONSTANT || token == TokenType.IMMUTABLE) {
                        if (mutability != Mutability.MUTABLE) {
                            parserError(3109, "Mutability already set to "
                                + (mutability == Mutability.CONSTANT ? "\"constant\"" : "\"immutable\""));
                        } else if (token == TokenType.CONSTANT) {
                            mutability = Mutability.CONSTANT;
                        } else {
                            mutability = Mutability.IMMUTABLE;
                        }
                    } else if (declOptions.allowLocationSpecifier() && token.isLocationSpecifier()) {
                        if (location != DataLocation.UNSPECIFIED) {
                            parserError(3548, "Location already specified.");
                        } else {
                            location = switch (token) {
                                case STORAGE -> DataLocation.STORAGE;
                                case MEMORY -> DataLocation.MEMORY;
                                case CALLDATA -> DataLocation.CALLDATA;
                                default -> throw new IllegalStateException("Unknown data location " + token);
                            };
                        }
                    } else {
                        break;
                    }
                    nodeFactory.markEndPosition();
                    advance();
                }
            }

            String name;
            if (declOptions.allowEmptyName() && currentToken() != TokenType.IDENTIFIER) {
                name = "";
            } else {
                nodeFactory.markEndPosition();
                name = expectIdentifierToken();
            }
            Expression value = null;
            if (declOptions.allowInitialValue() && currentToken() == TokenType.ASSIGN) {
                advance();
                value = parseExpression();
                nodeFactory.setEndPositionFromNode(value);
            }

            Expression initialValue = value;
            Visibility declaredVisibility = visibility;
            boolean declaredIndexed = indexed;
            Mutability declaredMutability = mutability;
            OverrideSpecifier declaredOverrides = overrides;
            DataLocation storageLocation = location;
            return nodeFactory.create((id, loc) -> new VariableDeclaration(id, loc, type, name, initialValue,
                declaredVisibility, documentation, declOptions.stateVariable(), declaredIndexed, declaredMutability,
                declaredOverrides, storageLocation));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ModifierDefinition parseModifierDefinition() {
        increaseRecursionDepth();
        insideModifier = true;
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            StructuredDocumentation documentation = parseStructuredDocumentation();

            expectToken(TokenType.MODIFIER);
            String name = expectIdentifierToken();
            ParameterList parameters;
            if (currentToken() == TokenType.LPAREN) {
                parameters = parseParameterList(VarDeclOptions.MODIFIER_PARAMETER, true);
            } else {
                parameters = createEmptyParameterList();
            }

            OverrideSpecifier overrides = null;
            boolean virtual = false;
            while (true) {
                if (currentToken() == TokenType.OVERRIDE) {
                    if (overrides != null) {
                        parserError(9102, "Override already specified.");
                    }
                    overrides = parseOverrideSpecifier();
                } else if (currentToken() == TokenType.VIRTUAL) {
                    if (virtual) {
                        parserError(2662, "Virtual already specified.");
                    }
                    virtual = true;
                    advance();
                } else {
                    break;
                }
            }

            Block body = null;
            nodeFactory.markEndPosition();
            if (currentToken() != TokenType.SEMICOLON) {
                body = parseBlock(null);
                nodeFactory.setEndPositionFromNode(body);
            } else {
                advance();
            }

            Block modifierBody = body;
            boolean isVirtual = virtual;
            OverrideSpecifier modifierOverrides = overrides;
            return nodeFactory.create((id, loc) -> new ModifierDefinition(id, loc, name, documentation, parameters,
                isVirtual, modifierOverrides, modifierBody));
        } finally {
            insideModifier = false;
            decreaseRecursionDepth();
        }
    }

    private EventDefinition parseEventDefinition() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            StructuredDocumentation documentation = parseStructuredDocumentation();

            expectToken(TokenType.EVENT);
            String name = expectIdentifierToken();
            ParameterList parameters = parseParameterList(VarDeclOptions.EVENT_PARAMETER, true);

            boolean anonymous = false;
            if (currentToken() == TokenType.ANONYMOUS) {
                anonymous = true;
                advance();
            }
            expectClosingToken(nodeFactory, TokenType.SEMICOLON);
            boolean isAnonymous = anonymous;
            return nodeFactory.create((id, loc) -> new EventDefinition(id, loc, name, documentation, parameters, isAnonymous));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private UsingForDirective parseUsingDirective() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.USING);
            UserDefinedTypeName library = parseUserDefinedTypeName();
            TypeName typeName = null;
            expectToken(TokenType.FOR);
            if (currentToken() == TokenType.MUL) {
                advance();
            } else {
                typeName = parseTypeName();
            }
            expectClosingToken(nodeFactory, TokenType.SEMICOLON);
            TypeName target = typeName;
            return nodeFactory.create((id, loc) -> new UsingForDirective(id, loc, library, target));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ModifierInvocation parseModifierInvocation() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            Identifier name = parseIdentifier();
            List<Expression> arguments = null;
            if (currentToken() == TokenType.LPAREN) {
                advance();
                arguments = parseFunctionCallListArguments();
                expectClosingToken(nodeFactory, TokenType.RPAREN);
            } else {
                nodeFactory.setEndPositionFromNode(name);
            }
            List<Expression> invocationArguments = arguments;
            return nodeFactory.create((id, loc) -> new ModifierInvocation(id, loc, name, invocationArguments));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Identifier parseIdentifier() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            nodeFactory.markEndPosition();
            String name = expectIdentifierToken();
            return nodeFactory.create((id, loc) -> new Identifier(id, loc, name));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private StructuredDocumentation parseStructuredDocumentation() {
        String text = scanner.currentCommentLiteral();
        if (text.isEmpty()) {
            return null;
        }
        NodeFactory nodeFactory = new NodeFactory(this);
        nodeFactory.setLocation(scanner.currentCommentLocation());
        return nodeFactory.create((id, loc) -> new StructuredDocumentation(id, loc, text));
    }

    // ========================================================================
    // Type names
    // ========================================================================

    private UserDefinedTypeName parseUserDefinedTypeName() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            nodeFactory.markEndPosition();
            List<String> namePath = new ArrayList<>();
            namePath.add(expectIdentifierToken());
            while (currentToken() == TokenType.PERIOD) {
                advance();
                nodeFactory.markEndPosition();
                namePath.add(expectIdentifierToken());
            }
            return nodeFactory.create((id, loc) -> new UserDefinedTypeName(id, loc, namePath));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private TypeName parseTypeNameSuffix(TypeName type, NodeFactory nodeFactory) {
        increaseRecursionDepth();
        try {
            while (currentToken() == TokenType.LBRACK) {
                advance();
                Expression length = null;
                if (currentToken() != TokenType.RBRACK) {
                    length = parseExpression();
                }
                expectClosingToken(nodeFactory, TokenType.RBRACK);
                TypeName baseType = type;
                Expression arrayLength = length;
                type = nodeFactory.create((id, loc) -> new ArrayTypeName(id, loc, baseType, arrayLength));
            }
            return type;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private TypeName parseTypeName() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            TypeName type;
            TokenType token = currentToken();
            if (token.isElementaryTypeName()) {
                ElementaryTypeNameToken typeNameToken = scanner.currentElementaryTypeNameToken();
                NodeFactory elementaryFactory = new NodeFactory(this);
                elementaryFactory.markEndPosition();
                advance();
                StateMutability stateMutability = token == TokenType.ADDRESS ? StateMutability.NON_PAYABLE : null;
                if (currentToken().isStateMutabilitySpecifier()) {
                    if (token == TokenType.ADDRESS) {
                        elementaryFactory.markEndPosition();
                        stateMutability = parseStateMutability();
                    } else {
                        parserError(9106, "State mutability can only be specified for address types.");
                        advance();
                    }
                }
                StateMutability addressMutability = stateMutability;
                type = elementaryFactory.create((id, loc) -> new ElementaryTypeName(id, loc, typeNameToken, addressMutability));
            } else if (token == TokenType.FUNCTION) {
                type = parseFunctionType();
            } else if (token == TokenType.MAPPING) {
                type = parseMapping();
            } else if (token == TokenType.IDENTIFIER) {
                type = parseUserDefinedTypeName();
            } else {
                throw fatalParserError(3546, "Expected type name");
            }
            return parseTypeNameSuffix(type, nodeFactory);
        } finally {
            decreaseRecursionDepth();
        }
    }

    private FunctionTypeName parseFunctionType() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.FUNCTION);
            FunctionHeader header = parseFunctionHeader(true);
            return nodeFactory.create((id, loc) -> new FunctionTypeName(id, loc, header.parameters,
                header.returnParameters, header.visibility, header.stateMutability));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Mapping parseMapping() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.MAPPING);
            expectToken(TokenType.LPAREN);
            TypeName keyType;
            TokenType token = currentToken();
            if (token == TokenType.IDENTIFIER) {
                keyType = parseUserDefinedTypeName();
            } else if (token.isElementaryTypeName()) {
                ElementaryTypeNameToken keyToken = scanner.currentElementaryTypeNameToken();
                keyType = new NodeFactory(this).create((id, loc) -> new ElementaryTypeName(id, loc, keyToken, null));
                advance();
            } else {
                throw fatalParserError(1005, "Expected elementary type name or identifier for mapping key type");
            }
            expectToken(TokenType.DOUBLE_ARROW);
            TypeName valueType = parseTypeName();
            expectClosingToken(nodeFactory, TokenType.RPAREN);
            return nodeFactory.create((id, loc) -> new Mapping(id, loc, keyType, valueType));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ParameterList parseParameterList(VarDeclOptions declOptions, boolean allowEmpty) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            List<VariableDeclaration> parameters = new ArrayList<>();
            VarDeclOptions parameterOptions = declOptions.withEmptyName();
            expectToken(TokenType.LPAREN);
            if (!allowEmpty || currentToken() != TokenType.RPAREN) {
                parameters.add(parseVariableDeclaration(parameterOptions, null));
                while (currentToken() != TokenType.RPAREN) {
                    if (currentToken() == TokenType.COMMA && peekNextToken() == TokenType.RPAREN) {
                        throw fatalParserError(7591, "Unexpected trailing comma in parameter list.");
                    }
                    expectToken(TokenType.COMMA);
                    parameters.add(parseVariableDeclaration(parameterOptions, null));
                }
            }
            nodeFactory.markEndPosition();
            advance();
            return nodeFactory.create((id, loc) -> new ParameterList(id, loc, parameters));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ParameterList createEmptyParameterList() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            nodeFactory.setLocationEmpty();
            return nodeFactory.create((id, loc) -> new ParameterList(id, loc, new ArrayList<>()));
        } finally {
            decreaseRecursionDepth();
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Block parseBlock(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.LBRACE);
            List<Statement> statements = new ArrayList<>();
            try {
                while (currentToken() != TokenType.RBRACE) {
                    Statement statement = parseStatement();
                    // Statements dropped by recovery leave no trace
                    if (statement != null) {
                        statements.add(statement);
                    }
                }
            } catch (ParseException e) {
                enterRecoveryOrRethrow(e, "Block");
            }
            if (inRecovery) {
                expectTokenOrConsumeUntil(TokenType.RBRACE, "Block", false);
                nodeFactory.markEndPosition();
                advance();
            } else {
                expectClosingToken(nodeFactory, TokenType.RBRACE);
            }
            return nodeFactory.create((id, loc) -> new Block(id, loc, docString, statements));
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * Parses one statement. Returns null for a statement skipped by error recovery.
     */
    private Statement parseStatement() {
        increaseRecursionDepth();
        try {
            String docString = null;
            Statement statement = null;
            try {
                if (!scanner.currentCommentLiteral().isEmpty()) {
                    docString = scanner.currentCommentLiteral();
                }
                String doc = docString;
                switch (currentToken()) {
                    case IF:
                        return parseIfStatement(doc);
                    case WHILE:
                        return parseWhileStatement(doc);
                    case DO:
                        return parseDoWhileStatement(doc);
                    case FOR:
                        return parseForStatement(doc);
                    case LBRACE:
                        return parseBlock(doc);
                    case TRY:
                        return parseTryStatement(doc);
                    case ASSEMBLY:
                        return parseInlineAssembly(doc);
                    // From here on every statement ends with a semicolon
                    case CONTINUE:
                        statement = new NodeFactory(this).create((id, loc) -> new Continue(id, loc, doc));
                        advance();
                        break;
                    case BREAK:
                        statement = new NodeFactory(this).create((id, loc) -> new Break(id, loc, doc));
                        advance();
                        break;
                    case RETURN: {
                        NodeFactory nodeFactory = new NodeFactory(this);
                        Expression expression = null;
                        if (advance() != TokenType.SEMICOLON) {
                            expression = parseExpression();
                            nodeFactory.setEndPositionFromNode(expression);
                        }
                        Expression returned = expression;
                        statement = nodeFactory.create((id, loc) -> new Return(id, loc, doc, returned));
                        break;
                    }
                    case THROW:
                        statement = new NodeFactory(this).create((id, loc) -> new Throw(id, loc, doc));
                        advance();
                        break;
                    case EMIT:
                        statement = parseEmitStatement(doc);
                        break;
                    case IDENTIFIER:
                        if (insideModifier && currentLiteral().equals("_")) {
                            statement = new NodeFactory(this).create((id, loc) -> new PlaceholderStatement(id, loc, doc));
                            advance();
                        } else {
                            statement = parseSimpleStatement(doc);
                        }
                        break;
                    default:
                        statement = parseSimpleStatement(doc);
                        break;
                }
            } catch (ParseException e) {
                enterRecoveryOrRethrow(e, "Statement");
            }
            if (inRecovery) {
                expectTokenOrConsumeUntil(TokenType.SEMICOLON, "Statement");
            } else {
                expectToken(TokenType.SEMICOLON);
            }
            return statement;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private InlineAssembly parseInlineAssembly(String docString) {
        increaseRecursionDepth();
        try {
            SourceLocation location = currentLocation();

            expectToken(TokenType.ASSEMBLY);
            String dialect = "evmasm";
            if (currentToken() == TokenType.STRING_LITERAL) {
                if (!currentLiteral().equals("evmasm")) {
                    throw fatalParserError(4531, "Only \"evmasm\" supported.");
                }
                advance();
            }

            AssemblyBlock block = options.assemblyParser().parse(scanner, reporter);
            if (block == null) {
                List<Diagnostic> errors = reporter.errors();
                if (errors.isEmpty()) {
                    throw new IllegalStateException("Inline assembly parser failed without reporting an error");
                }
                throw new ParseException(errors.get(errors.size() - 1), true);
            }

            SourceLocation assemblyLocation = location.withEnd(block.location().end());
            return new InlineAssembly(nextId(), assemblyLocation, docString, dialect, block);
        } finally {
            decreaseRecursionDepth();
        }
    }

    private IfStatement parseIfStatement(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.IF);
            expectToken(TokenType.LPAREN);
            Expression condition = parseExpression();
            expectToken(TokenType.RPAREN);
            Statement trueBody = parseStatement();
            Statement falseBody = null;
            if (currentToken() == TokenType.ELSE) {
                advance();
                falseBody = parseStatement();
                setEndFromStatement(nodeFactory, falseBody);
            } else {
                setEndFromStatement(nodeFactory, trueBody);
            }
            Statement elseBody = falseBody;
            return nodeFactory.create((id, loc) -> new IfStatement(id, loc, docString, condition, trueBody, elseBody));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private TryStatement parseTryStatement(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.TRY);
            Expression externalCall = parseExpression();
            List<TryCatchClause> clauses = new ArrayList<>();

            NodeFactory successClauseFactory = new NodeFactory(this);
            ParameterList returnsParameters = null;
            if (currentToken() == TokenType.RETURNS) {
                advance();
                returnsParameters = parseParameterList(VarDeclOptions.UNNAMED_WITH_LOCATION, false);
            }
            Block successBlock = parseBlock(null);
            successClauseFactory.setEndPositionFromNode(successBlock);
            ParameterList successParameters = returnsParameters;
            clauses.add(successClauseFactory.create((id, loc) -> new TryCatchClause(id, loc, "", successParameters, successBlock)));

            do {
                clauses.add(parseCatchClause());
            } while (currentToken() == TokenType.CATCH);
            nodeFactory.setEndPositionFromNode(clauses.get(clauses.size() - 1));
            return nodeFactory.create((id, loc) -> new TryStatement(id, loc, docString, externalCall, clauses));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private TryCatchClause parseCatchClause() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.CATCH);
            String errorName = "";
            ParameterList errorParameters = null;
            if (currentToken() != TokenType.LBRACE) {
                if (currentToken() == TokenType.IDENTIFIER) {
                    errorName = expectIdentifierToken();
                }
                errorParameters = parseParameterList(VarDeclOptions.UNNAMED_WITH_LOCATION, !errorName.isEmpty());
            }
            Block block = parseBlock(null);
            nodeFactory.setEndPositionFromNode(block);
            String name = errorName;
            ParameterList parameters = errorParameters;
            return nodeFactory.create((id, loc) -> new TryCatchClause(id, loc, name, parameters, block));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private WhileStatement parseWhileStatement(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.WHILE);
            expectToken(TokenType.LPAREN);
            Expression condition = parseExpression();
            expectToken(TokenType.RPAREN);
            Statement body = parseStatement();
            setEndFromStatement(nodeFactory, body);
            return nodeFactory.create((id, loc) -> new WhileStatement(id, loc, docString, condition, body, false));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private WhileStatement parseDoWhileStatement(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            expectToken(TokenType.DO);
            Statement body = parseStatement();
            expectToken(TokenType.WHILE);
            expectToken(TokenType.LPAREN);
            Expression condition = parseExpression();
            expectToken(TokenType.RPAREN);
            expectClosingToken(nodeFactory, TokenType.SEMICOLON);
            return nodeFactory.create((id, loc) -> new WhileStatement(id, loc, docString, condition, body, true));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ForStatement parseForStatement(String docString) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            Statement initExpression = null;
            Expression conditionExpression = null;
            ExpressionStatement loopExpression = null;
            expectToken(TokenType.FOR);
            expectToken(TokenType.LPAREN);

            if (currentToken() != TokenType.SEMICOLON) {
                initExpression = parseSimpleStatement(null);
            }
            expectToken(TokenType.SEMICOLON);

            if (currentToken() != TokenType.SEMICOLON) {
                conditionExpression = parseExpression();
            }
            expectToken(TokenType.SEMICOLON);

            if (currentToken() != TokenType.RPAREN) {
                loopExpression = parseExpressionStatement(null, null);
            }
            expectToken(TokenType.RPAREN);

            Statement body = parseStatement();
            setEndFromStatement(nodeFactory, body);
            Statement init = initExpression;
            Expression condition = conditionExpression;
            ExpressionStatement loop = loopExpression;
            return nodeFactory.create((id, loc) -> new ForStatement(id, loc, docString, init, condition, loop, body));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private EmitStatement parseEmitStatement(String docString) {
        expectToken(TokenType.EMIT, false);

        NodeFactory nodeFactory = new NodeFactory(this);
        advance();
        NodeFactory eventCallFactory = new NodeFactory(this);

        if (currentToken() != TokenType.IDENTIFIER) {
            throw fatalParserError(5620, "Expected event name or path.");
        }

        IndexAccessedPath iap = new IndexAccessedPath();
        while (true) {
            iap.path.add(parseIdentifier());
            if (currentToken() != TokenType.PERIOD) {
                break;
            }
            advance();
        }

        Expression eventName = expressionFromIndexAccessStructure(iap);
        expectToken(TokenType.LPAREN);

        CallArguments arguments = parseFunctionCallArguments();
        eventCallFactory.markEndPosition();
        expectClosingToken(nodeFactory, TokenType.RPAREN);
        FunctionCall eventCall = eventCallFactory.create((id, loc) ->
            new FunctionCall(id, loc, eventName, arguments.arguments(), arguments.names()));
        return nodeFactory.create((id, loc) -> new EmitStatement(id, loc, docString, eventCall));
    }

    /**
     * A variable declaration statement or an expression statement, including the
     * tuple forms that start with {@code (} and may have leading empty components.
     */
    private Statement parseSimpleStatement(String docString) {
        increaseRecursionDepth();
        try {
            if (currentToken() == TokenType.LPAREN) {
                NodeFactory nodeFactory = new NodeFactory(this);
                int emptyComponents = 0;
                // First consume all empty components
                expectToken(TokenType.LPAREN);
                while (currentToken() == TokenType.COMMA) {
                    advance();
                    emptyComponents++;
                }

                PathLookahead lookahead = tryParseIndexAccessedPath();
                switch (lookahead.kind()) {
                    case VARIABLE_DECLARATION: {
                        // Something like `(,,,,a.b.c[2][3]` has been consumed
                        List<VariableDeclaration> variables = new ArrayList<>(Collections.nCopies(emptyComponents, null));
                        variables.add(parseVariableDeclaration(VarDeclOptions.WITH_LOCATION,
                            typeNameFromIndexAccessStructure(lookahead.path())));

                        while (currentToken() != TokenType.RPAREN) {
                            expectToken(TokenType.COMMA);
                            if (currentToken() == TokenType.COMMA || currentToken() == TokenType.RPAREN) {
                                variables.add(null);
                            } else {
                                variables.add(parseVariableDeclaration(VarDeclOptions.WITH_LOCATION, null));
                            }
                        }
                        expectToken(TokenType.RPAREN);
                        expectToken(TokenType.ASSIGN);
                        Expression value = parseExpression();
                        nodeFactory.setEndPositionFromNode(value);
                        return nodeFactory.create((id, loc) -> new VariableDeclarationStatement(id, loc, docString, variables, value));
                    }
                    case EXPRESSION: {
                        List<Expression> components = new ArrayList<>(Collections.nCopies(emptyComponents, null));
                        components.add(parseExpression(expressionFromIndexAccessStructure(lookahead.path())));
                        while (currentToken() != TokenType.RPAREN) {
                            expectToken(TokenType.COMMA);
                            if (currentToken() == TokenType.COMMA || currentToken() == TokenType.RPAREN) {
                                components.add(null);
                            } else {
                                components.add(parseExpression());
                            }
                        }
                        expectClosingToken(nodeFactory, TokenType.RPAREN);
                        TupleExpression tuple = nodeFactory.create((id, loc) -> new TupleExpression(id, loc, components, false));
                        return parseExpressionStatement(docString, tuple);
                    }
                    default:
                        throw new IllegalStateException("Unresolved statement kind " + lookahead.kind());
                }
            }

            PathLookahead lookahead = tryParseIndexAccessedPath();
            return switch (lookahead.kind()) {
                case VARIABLE_DECLARATION ->
                    parseVariableDeclarationStatement(docString, typeNameFromIndexAccessStructure(lookahead.path()));
                case EXPRESSION ->
                    parseExpressionStatement(docString, expressionFromIndexAccessStructure(lookahead.path()));
                default -> throw new IllegalStateException("Unresolved statement kind " + lookahead.kind());
            };
        } finally {
            decreaseRecursionDepth();
        }
    }

    private VariableDeclarationStatement parseVariableDeclarationStatement(String docString, TypeName lookAheadType) {
        // Declarations starting with '(' are handled by parseSimpleStatement
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            if (lookAheadType != null) {
                nodeFactory.setLocation(lookAheadType.location());
            }

            List<VariableDeclaration> variables = new ArrayList<>();
            variables.add(parseVariableDeclaration(VarDeclOptions.WITH_LOCATION, lookAheadType));
            nodeFactory.setEndPositionFromNode(variables.get(variables.size() - 1));

            Expression value = null;
            if (currentToken() == TokenType.ASSIGN) {
                advance();
                value = parseExpression();
                nodeFactory.setEndPositionFromNode(value);
            }
            Expression initialValue = value;
            return nodeFactory.create((id, loc) -> new VariableDeclarationStatement(id, loc, docString, variables, initialValue));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ExpressionStatement parseExpressionStatement(String docString, Expression partiallyParsed) {
        increaseRecursionDepth();
        try {
            Expression expression = parseExpression(partiallyParsed);
            return new NodeFactory(this, expression).create((id, loc) -> new ExpressionStatement(id, loc, docString, expression));
        } finally {
            decreaseRecursionDepth();
        }
    }

    // A statement dropped by recovery contributes no end position
    private void setEndFromStatement(NodeFactory nodeFactory, Statement statement) {
        if (statement != null) {
            nodeFactory.setEndPositionFromNode(statement);
        }
    }

    // ========================================================================
    // Lookahead
    // ========================================================================

    /**
     * Classifies the statement at the cursor with at most one token of lookahead.
     * <pre>
     *   x[7 * 20 + 3] a;     declares a
     *   x[7 * 20 + 3] = 9;   assigns to an element of x
     * </pre>
     * cannot be told apart this way and yield {@link StatementKind#INDEX_ACCESS_PATH}.
     */
    private StatementKind peekStatementType() {
        TokenType token = currentToken();
        boolean mightBeTypeName = token.isElementaryTypeName() || token == TokenType.IDENTIFIER;

        if (token == TokenType.MAPPING || token == TokenType.FUNCTION) {
            return StatementKind.VARIABLE_DECLARATION;
        }
        if (mightBeTypeName) {
            TokenType next = peekNextToken();
            // 'address payable' is only accepted in declarations
            if (token.isElementaryTypeName() && next.isStateMutabilitySpecifier()) {
                return StatementKind.VARIABLE_DECLARATION;
            }
            if (next == TokenType.IDENTIFIER || next.isLocationSpecifier()) {
                return StatementKind.VARIABLE_DECLARATION;
            }
            if (next == TokenType.LBRACK || next == TokenType.PERIOD) {
                return StatementKind.INDEX_ACCESS_PATH;
            }
        }
        return StatementKind.EXPRESSION;
    }

    private PathLookahead tryParseIndexAccessedPath() {
        StatementKind kind = peekStatementType();
        if (kind != StatementKind.INDEX_ACCESS_PATH) {
            return new PathLookahead(kind, new IndexAccessedPath());
        }

        // The cursor is at 'Identifier "["', 'Identifier "."' or 'ElementaryTypeName "["'.
        // Consume '(Identifier ("." Identifier)* | ElementaryTypeName) ("[" Expression "]")*'
        // and decide on the token after it.
        IndexAccessedPath iap = parseIndexAccessedPath();
        if (currentToken() == TokenType.IDENTIFIER || currentToken().isLocationSpecifier()) {
            return new PathLookahead(StatementKind.VARIABLE_DECLARATION, iap);
        }
        return new PathLookahead(StatementKind.EXPRESSION, iap);
    }

    private IndexAccessedPath parseIndexAccessedPath() {
        IndexAccessedPath iap = new IndexAccessedPath();
        if (currentToken() == TokenType.IDENTIFIER) {
            iap.path.add(parseIdentifier());
            while (currentToken() == TokenType.PERIOD) {
                advance();
                iap.path.add(parseIdentifier());
            }
        } else {
            ElementaryTypeNameToken typeNameToken = scanner.currentElementaryTypeNameToken();
            ElementaryTypeName typeName = new NodeFactory(this).create((id, loc) ->
                new ElementaryTypeName(id, loc, typeNameToken, null));
            iap.path.add(new NodeFactory(this).create((id, loc) -> new ElementaryTypeNameExpression(id, loc, typeName)));
            advance();
        }
        while (currentToken() == TokenType.LBRACK) {
            expectToken(TokenType.LBRACK);
            Expression index = null;
            if (currentToken() != TokenType.RBRACK && currentToken() != TokenType.COLON) {
                index = parseExpression();
            }
            SourceLocation indexLocation = iap.path.get(0).location();
            if (currentToken() == TokenType.COLON) {
                expectToken(TokenType.COLON);
                Expression endIndex = null;
                if (currentToken() != TokenType.RBRACK) {
                    endIndex = parseExpression();
                }
                indexLocation = indexLocation.withEnd(endPosition());
                iap.indices.add(new IndexAccessedPath.Index(index, endIndex, true, indexLocation));
                expectToken(TokenType.RBRACK);
            } else {
                indexLocation = indexLocation.withEnd(endPosition());
                iap.indices.add(new IndexAccessedPath.Index(index, null, false, indexLocation));
                expectToken(TokenType.RBRACK);
            }
        }
        return iap;
    }

    private TypeName typeNameFromIndexAccessStructure(IndexAccessedPath iap) {
        if (iap.isEmpty()) {
            return null;
        }

        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            SourceLocation first = iap.path.get(0).location();
            nodeFactory.setLocation(first.withEnd(iap.path.get(iap.path.size() - 1).location().end()));

            TypeName type;
            if (iap.path.get(0) instanceof ElementaryTypeNameExpression typeExpression) {
                if (iap.path.size() != 1) {
                    throw new IllegalStateException("Elementary type name inside a member path");
                }
                ElementaryTypeNameToken typeNameToken = typeExpression.typeName().typeName();
                type = nodeFactory.create((id, loc) -> new ElementaryTypeName(id, loc, typeNameToken, null));
            } else {
                List<String> path = new ArrayList<>();
                for (Expression element : iap.path) {
                    path.add(((Identifier) element).name());
                }
                type = nodeFactory.create((id, loc) -> new UserDefinedTypeName(id, loc, path));
            }
            for (IndexAccessedPath.Index length : iap.indices) {
                if (length.range()) {
                    parserError(5464, length.location(), "Expected array length expression.");
                }
                nodeFactory.setLocation(length.location());
                TypeName baseType = type;
                type = nodeFactory.create((id, loc) -> new ArrayTypeName(id, loc, baseType, length.start()));
            }
            return type;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Expression expressionFromIndexAccessStructure(IndexAccessedPath iap) {
        if (iap.isEmpty()) {
            return null;
        }

        increaseRecursionDepth();
        try {
            Expression first = iap.path.get(0);
            NodeFactory nodeFactory = new NodeFactory(this, first);
            Expression expression = first;
            for (int i = 1; i < iap.path.size(); i++) {
                nodeFactory.setLocation(first.location().withEnd(iap.path.get(i).location().end()));
                String memberName = ((Identifier) iap.path.get(i)).name();
                Expression base = expression;
                expression = nodeFactory.create((id, loc) -> new MemberAccess(id, loc, base, memberName));
            }
            for (IndexAccessedPath.Index index : iap.indices) {
                nodeFactory.setLocation(index.location());
                Expression base = expression;
                if (index.range()) {
                    expression = nodeFactory.create((id, loc) -> new IndexRangeAccess(id, loc, base, index.start(), index.end()));
                } else {
                    expression = nodeFactory.create((id, loc) -> new IndexAccess(id, loc, base, index.start()));
                }
            }
            return expression;
        } finally {
            decreaseRecursionDepth();
        }
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression parseExpression() {
        return parseExpression((Expression) null);
    }

    /**
     * Assignment and conditional layers on top of the binary operators. Both are
     * right-associative: their right-hand sides recurse into a full expression.
     */
    private Expression parseExpression(Expression partiallyParsed) {
        increaseRecursionDepth();
        try {
            Expression expression = parseBinaryExpression(MIN_BINARY_PRECEDENCE, partiallyParsed);
            if (currentToken().isAssignmentOp()) {
                TokenType assignmentOperator = currentToken();
                advance();
                Expression rightHandSide = parseExpression();
                NodeFactory nodeFactory = new NodeFactory(this, expression);
                nodeFactory.setEndPositionFromNode(rightHandSide);
                return nodeFactory.create((id, loc) -> new Assignment(id, loc, expression, assignmentOperator, rightHandSide));
            } else if (currentToken() == TokenType.CONDITIONAL) {
                advance();
                Expression trueExpression = parseExpression();
                expectToken(TokenType.COLON);
                Expression falseExpression = parseExpression();
                NodeFactory nodeFactory = new NodeFactory(this, expression);
                nodeFactory.setEndPositionFromNode(falseExpression);
                return nodeFactory.create((id, loc) -> new Conditional(id, loc, expression, trueExpression, falseExpression));
            }
            return expression;
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * Precedence climbing. Operators of equal precedence associate to the left
     * because the right operand is parsed at {@code precedence + 1}.
     */
    private Expression parseBinaryExpression(int minPrecedence, Expression partiallyParsed) {
        increaseRecursionDepth();
        try {
            Expression expression = parseUnaryExpression(partiallyParsed);
            NodeFactory nodeFactory = new NodeFactory(this, expression);
            for (int precedence = currentToken().precedence(); precedence >= minPrecedence; precedence--) {
                while (currentToken().precedence() == precedence) {
                    TokenType operator = currentToken();
                    advance();
                    Expression right = parseBinaryExpression(precedence + 1, null);
                    nodeFactory.setEndPositionFromNode(right);
                    Expression left = expression;
                    expression = nodeFactory.create((id, loc) -> new BinaryOperation(id, loc, left, operator, right));
                }
            }
            return expression;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Expression parseUnaryExpression(Expression partiallyParsed) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = partiallyParsed != null
                ? new NodeFactory(this, partiallyParsed)
                : new NodeFactory(this);
            TokenType token = currentToken();
            if (partiallyParsed == null && (token.isUnaryOp() || token.isCountOp())) {
                // prefix expression
                advance();
                Expression subExpression = parseUnaryExpression(null);
                nodeFactory.setEndPositionFromNode(subExpression);
                return nodeFactory.create((id, loc) -> new UnaryOperation(id, loc, token, subExpression, true));
            }
            // potential postfix expression
            Expression subExpression = parseLeftHandSideExpression(partiallyParsed);
            TokenType postfix = currentToken();
            if (!postfix.isCountOp()) {
                return subExpression;
            }
            nodeFactory.markEndPosition();
            advance();
            return nodeFactory.create((id, loc) -> new UnaryOperation(id, loc, postfix, subExpression, false));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Expression parseLeftHandSideExpression(Expression partiallyParsed) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = partiallyParsed != null
                ? new NodeFactory(this, partiallyParsed)
                : new NodeFactory(this);

            Expression expression;
            if (partiallyParsed != null) {
                expression = partiallyParsed;
            } else if (currentToken() == TokenType.NEW) {
                expectToken(TokenType.NEW);
                TypeName typeName = parseTypeName();
                nodeFactory.setEndPositionFromNode(typeName);
                expression = nodeFactory.create((id, loc) -> new NewExpression(id, loc, typeName));
            } else if (currentToken() == TokenType.PAYABLE) {
                // 'payable(x)' converts to 'address payable'
                expectClosingToken(nodeFactory, TokenType.PAYABLE);
                ElementaryTypeName typeName = nodeFactory.create((id, loc) ->
                    new ElementaryTypeName(id, loc, ElementaryTypeNameToken.of(TokenType.ADDRESS), StateMutability.PAYABLE));
                expression = nodeFactory.create((id, loc) -> new ElementaryTypeNameExpression(id, loc, typeName));
                expectToken(TokenType.LPAREN, false);
            } else {
                expression = parsePrimaryExpression();
            }

            while (true) {
                Expression base = expression;
                switch (currentToken()) {
                    case LBRACK: {
                        advance();
                        Expression index = null;
                        if (currentToken() != TokenType.RBRACK && currentToken() != TokenType.COLON) {
                            index = parseExpression();
                        }
                        Expression startIndex = index;
                        if (currentToken() == TokenType.COLON) {
                            expectToken(TokenType.COLON);
                            Expression endIndex = null;
                            if (currentToken() != TokenType.RBRACK) {
                                endIndex = parseExpression();
                            }
                            expectClosingToken(nodeFactory, TokenType.RBRACK);
                            Expression rangeEnd = endIndex;
                            expression = nodeFactory.create((id, loc) -> new IndexRangeAccess(id, loc, base, startIndex, rangeEnd));
                        } else {
                            expectClosingToken(nodeFactory, TokenType.RBRACK);
                            expression = nodeFactory.create((id, loc) -> new IndexAccess(id, loc, base, startIndex));
                        }
                        break;
                    }
                    case PERIOD: {
                        advance();
                        nodeFactory.markEndPosition();
                        String memberName;
                        if (currentToken() == TokenType.ADDRESS) {
                            memberName = "address";
                            advance();
                        } else {
                            memberName = expectIdentifierToken();
                        }
                        expression = nodeFactory.create((id, loc) -> new MemberAccess(id, loc, base, memberName));
                        break;
                    }
                    case LPAREN: {
                        advance();
                        CallArguments arguments = parseFunctionCallArguments();
                        expectClosingToken(nodeFactory, TokenType.RPAREN);
                        expression = nodeFactory.create((id, loc) ->
                            new FunctionCall(id, loc, base, arguments.arguments(), arguments.names()));
                        break;
                    }
                    case LBRACE: {
                        // Call options only when followed by 'identifier :', otherwise this
                        // is the block of a try statement
                        if (peekNextToken() != TokenType.IDENTIFIER || scanner.peekNextNextToken() != TokenType.COLON) {
                            return expression;
                        }
                        expectToken(TokenType.LBRACE);
                        CallArguments callOptions = parseNamedArguments();
                        expectClosingToken(nodeFactory, TokenType.RBRACE);
                        expression = nodeFactory.create((id, loc) ->
                            new FunctionCallOptions(id, loc, base, callOptions.arguments(), callOptions.names()));
                        break;
                    }
                    default:
                        return expression;
                }
            }
        } finally {
            decreaseRecursionDepth();
        }
    }

    private Expression parsePrimaryExpression() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            TokenType token = currentToken();

            switch (token) {
                case TRUE_LITERAL, FALSE_LITERAL -> {
                    nodeFactory.markEndPosition();
                    String value = getLiteralAndAdvance();
                    return nodeFactory.create((id, loc) -> new Literal(id, loc, token, value, SubDenomination.NONE));
                }
                case NUMBER -> {
                    TokenType next = peekNextToken();
                    if (next.isEtherSubdenomination() || next.isTimeSubdenomination()) {
                        String value = getLiteralAndAdvance();
                        nodeFactory.markEndPosition();
                        SubDenomination unit = subDenomination(currentToken());
                        advance();
                        return nodeFactory.create((id, loc) -> new Literal(id, loc, token, value, unit));
                    }
                    nodeFactory.markEndPosition();
                    String value = getLiteralAndAdvance();
                    return nodeFactory.create((id, loc) -> new Literal(id, loc, token, value, SubDenomination.NONE));
                }
                case STRING_LITERAL, UNICODE_STRING_LITERAL, HEX_STRING_LITERAL -> {
                    // Adjacent literals of the same kind are concatenated
                    StringBuilder literal = new StringBuilder(currentLiteral());
                    while (peekNextToken() == token) {
                        advance();
                        literal.append(currentLiteral());
                    }
                    nodeFactory.markEndPosition();
                    advance();
                    if (currentToken() == TokenType.ILLEGAL) {
                        throw fatalParserError(5428, scanner.currentError().message());
                    }
                    String value = literal.toString();
                    return nodeFactory.create((id, loc) -> new Literal(id, loc, token, value, SubDenomination.NONE));
                }
                case IDENTIFIER -> {
                    nodeFactory.markEndPosition();
                    String name = getLiteralAndAdvance();
                    return nodeFactory.create((id, loc) -> new Identifier(id, loc, name));
                }
                case TYPE -> {
                    // Inside expressions 'type' names the global type(...) function
                    nodeFactory.markEndPosition();
                    advance();
                    return nodeFactory.create((id, loc) -> new Identifier(id, loc, "type"));
                }
                case LPAREN, LBRACK -> {
                    return parseTupleExpression(nodeFactory, token);
                }
                case ILLEGAL -> throw fatalParserError(8936, scanner.currentError().message());
                default -> {
                    if (token.isElementaryTypeName()) {
                        // used for casts
                        ElementaryTypeNameToken typeNameToken = scanner.currentElementaryTypeNameToken();
                        ElementaryTypeName typeName = nodeFactory.create((id, loc) ->
                            new ElementaryTypeName(id, loc, typeNameToken, null));
                        Expression expression = nodeFactory.create((id, loc) -> new ElementaryTypeNameExpression(id, loc, typeName));
                        advance();
                        return expression;
                    }
                    throw fatalParserError(6933, "Expected primary expression.");
                }
            }
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * Tuple, parenthesized expression or inline array. {@code ()} is the empty tuple,
     * {@code (x)} is not a real tuple and {@code (x,)} has one component. Only tuples
     * may leave components out.
     */
    private TupleExpression parseTupleExpression(NodeFactory nodeFactory, TokenType open) {
        advance();
        List<Expression> components = new ArrayList<>();
        TokenType close = open == TokenType.LPAREN ? TokenType.RPAREN : TokenType.RBRACK;
        boolean isArray = open == TokenType.LBRACK;

        if (currentToken() != close) {
            while (true) {
                if (currentToken() != TokenType.COMMA && currentToken() != close) {
                    components.add(parseExpression());
                } else if (isArray) {
                    parserError(4799, "Expected expression (inline array elements cannot be omitted).");
                } else {
                    components.add(null);
                }

                if (currentToken() == close) {
                    break;
                }
                expectToken(TokenType.COMMA);
            }
        }
        expectClosingToken(nodeFactory, close);
        return nodeFactory.create((id, loc) -> new TupleExpression(id, loc, components, isArray));
    }

    private List<Expression> parseFunctionCallListArguments() {
        increaseRecursionDepth();
        try {
            List<Expression> arguments = new ArrayList<>();
            if (currentToken() != TokenType.RPAREN) {
                arguments.add(parseExpression());
                while (currentToken() != TokenType.RPAREN) {
                    if (currentToken() == TokenType.COMMA && peekNextToken() == TokenType.RPAREN) {
                        parserError(2074, "Unexpected trailing comma.");
                        advance();
                        break;
                    }
                    expectToken(TokenType.COMMA);
                    arguments.add(parseExpression());
                }
            }
            return arguments;
        } finally {
            decreaseRecursionDepth();
        }
    }

    private CallArguments parseFunctionCallArguments() {
        increaseRecursionDepth();
        try {
            if (currentToken() == TokenType.LBRACE) {
                // call({arg1 : 1, arg2 : 2 })
                expectToken(TokenType.LBRACE);
                CallArguments arguments = parseNamedArguments();
                expectToken(TokenType.RBRACE);
                return arguments;
            }
            return new CallArguments(parseFunctionCallListArguments(), new ArrayList<>());
        } finally {
            decreaseRecursionDepth();
        }
    }

    private CallArguments parseNamedArguments() {
        List<Expression> arguments = new ArrayList<>();
        List<String> names = new ArrayList<>();

        boolean first = true;
        while (currentToken() != TokenType.RBRACE) {
            if (!first) {
                expectToken(TokenType.COMMA);
            }

            names.add(expectIdentifierToken());
            expectToken(TokenType.COLON);
            arguments.add(parseExpression());

            if (currentToken() == TokenType.COMMA && peekNextToken() == TokenType.RBRACE) {
                parserError(2074, "Unexpected trailing comma.");
                advance();
            }
            first = false;
        }
        return new CallArguments(arguments, names);
    }

    // ========================================================================
    // Specification expressions
    // ========================================================================

    /**
     * Either {@code property(a) (i) body}, which binds {@code uint i} universally, or
     * any number of {@code forall}/{@code exists} binders followed by the body.
     */
    private SpecificationExpression parseSpecificationExpression() {
        List<Quantifier> quantifiers = new ArrayList<>();
        Identifier arrayId = null;
        if (currentToken() == TokenType.IDENTIFIER && currentLiteral().equals("property")) {
            SourceLocation propertyLocation = currentLocation();
            advance();

            expectToken(TokenType.LPAREN);
            arrayId = parseIdentifier();
            expectToken(TokenType.RPAREN);

            quantifiers.add(new Quantifier(true, parseSpecificationParameterList(propertyLocation)));
        } else {
            while (currentToken() == TokenType.IDENTIFIER) {
                boolean forall;
                if (currentLiteral().equals("forall")) {
                    forall = true;
                } else if (currentLiteral().equals("exists")) {
                    forall = false;
                } else {
                    break;
                }
                advance();
                ParameterList variables = currentToken() == TokenType.LPAREN
                    ? parseSpecificationParameterList(null)
                    : parseSharedTypeQuantifierList();
                quantifiers.add(new Quantifier(forall, variables));
            }
        }
        return new SpecificationExpression(parseExpression(), quantifiers, arrayId);
    }

    /**
     * Declares one quantifier variable. {@code type} is the variable's own copy of a
     * type written once for the whole binder, or null to parse one.
     */
    private VariableDeclaration parseSpecificationVariableDeclaration(TypeName type) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            if (type == null) {
                type = parseTypeName();
                nodeFactory.setEndPositionFromNode(type);
            }

            boolean stateVariable = false;
            if (type instanceof Mapping || type instanceof ArrayTypeName) {
                // Only meaningful in storage
                stateVariable = true;
            } else if (!(type instanceof ElementaryTypeName)) {
                parserError(5674, "Unsupported type for quantifier variable.");
            }

            nodeFactory.markEndPosition();
            String name = expectIdentifierToken();

            TypeName variableType = type;
            boolean inStorage = stateVariable;
            return nodeFactory.create((id, loc) -> new VariableDeclaration(id, loc, variableType, name, null,
                Visibility.DEFAULT, null, inStorage, false, Mutability.MUTABLE, null, DataLocation.UNSPECIFIED));
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * {@code (T a, U b)}. With {@code impliedUintLocation} set, as after {@code property(a)},
     * the names carry no type and each gets a {@code uint} placed at that location.
     */
    private ParameterList parseSpecificationParameterList(SourceLocation impliedUintLocation) {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            List<VariableDeclaration> parameters = new ArrayList<>();
            expectToken(TokenType.LPAREN);
            parameters.add(parseSpecificationVariableDeclaration(impliedUint(impliedUintLocation)));
            while (currentToken() != TokenType.RPAREN) {
                if (currentToken() == TokenType.COMMA && peekNextToken() == TokenType.RPAREN) {
                    throw fatalParserError(6155, "Unexpected trailing comma in quantifier variable list.");
                }
                expectToken(TokenType.COMMA);
                parameters.add(parseSpecificationVariableDeclaration(impliedUint(impliedUintLocation)));
            }
            nodeFactory.markEndPosition();
            advance();
            return nodeFactory.create((id, loc) -> new ParameterList(id, loc, parameters));
        } finally {
            decreaseRecursionDepth();
        }
    }

    /**
     * {@code uint i, j;} after a quantifier keyword: one type shared by all names,
     * terminated by a semicolon.
     */
    private ParameterList parseSharedTypeQuantifierList() {
        increaseRecursionDepth();
        try {
            NodeFactory nodeFactory = new NodeFactory(this);
            List<VariableDeclaration> parameters = new ArrayList<>();
            TypeName type = parseTypeName();
            parameters.add(parseSpecificationVariableDeclaration(type));
            while (currentToken() != TokenType.SEMICOLON) {
                if (currentToken() == TokenType.COMMA && peekNextToken() == TokenType.SEMICOLON) {
                    throw fatalParserError(6155, "Unexpected trailing comma in quantifier variable list.");
                }
                expectToken(TokenType.COMMA);
                parameters.add(parseSpecificationVariableDeclaration(reparseTypeName(type)));
            }
            nodeFactory.markEndPosition();
            advance();
            return nodeFactory.create((id, loc) -> new ParameterList(id, loc, parameters));
        } finally {
            decreaseRecursionDepth();
        }
    }

    private ElementaryTypeName impliedUint(SourceLocation location) {
        if (location == null) {
            return null;
        }
        return new ElementaryTypeName(nextId(), location, ElementaryTypeNameToken.of(TokenType.UINT), null);
    }

    /**
     * Parses the tokens of {@code type} again so that the result owns fresh nodes.
     * Those tokens were already checked once; diagnostics of the second pass are dropped.
     */
    private TypeName reparseTypeName(TypeName type) {
        int resume = position();
        ErrorReporter savedReporter = reporter;
        scanner.setPosition(type.location().start());
        reporter = new ErrorReporter();
        try {
            return parseTypeName();
        } finally {
            reporter = savedReporter;
            scanner.setPosition(resume);
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String expectIdentifierToken() {
        // does not advance on success so that the literal can be taken
        expectToken(TokenType.IDENTIFIER, false);
        return getLiteralAndAdvance();
    }

    private static FunctionKind functionKind(TokenType token) {
        return switch (token) {
            case FUNCTION -> FunctionKind.FUNCTION;
            case CONSTRUCTOR -> FunctionKind.CONSTRUCTOR;
            case FALLBACK -> FunctionKind.FALLBACK;
            case RECEIVE -> FunctionKind.RECEIVE;
            default -> throw new IllegalStateException("Not a function kind: " + token);
        };
    }

    private static SubDenomination subDenomination(TokenType token) {
        return switch (token) {
            case SUB_WEI -> SubDenomination.WEI;
            case SUB_GWEI -> SubDenomination.GWEI;
            case SUB_SZABO -> SubDenomination.SZABO;
            case SUB_FINNEY -> SubDenomination.FINNEY;
            case SUB_ETHER -> SubDenomination.ETHER;
            case SUB_SECOND -> SubDenomination.SECOND;
            case SUB_MINUTE -> SubDenomination.MINUTE;
            case SUB_HOUR -> SubDenomination.HOUR;
            case SUB_DAY -> SubDenomination.DAY;
            case SUB_WEEK -> SubDenomination.WEEK;
            case SUB_YEAR -> SubDenomination.YEAR;
            default -> throw new IllegalStateException("Not a unit suffix: " + token);
        };
    }

    private static String visibilityName(Visibility visibility) {
        return visibility.name().toLowerCase(java.util.Locale.ROOT);
    }

    private static String mutabilityName(StateMutability stateMutability) {
        return stateMutability == StateMutability.NON_PAYABLE
            ? "nonpayable"
            : stateMutability.name().toLowerCase(java.util.Locale.ROOT);
    }
}
