package com.solparser;

import com.solparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.solparser.TestParsing.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeclarationParserTest {

    private static final String TOKEN_SOURCE = """
        // SPDX-License-Identifier: MIT
        pragma solidity ^0.7.0;
        pragma abicoder v2;
        import "./a.sol";
        import "./b.sol" as B;
        import * as x from "c.sol";
        import {A as AA, C} from "d.sol";

        /// The token
        abstract contract Token is Base(1), Other {
            using SafeMath for uint;
            using L for *;
            uint public constant MAX = 100;
            mapping(address => uint) internal balances;
            address immutable owner;
            function() external callback;
            struct Point { uint x; uint y; }
            enum Color { Red, Green }
            event Transfer(address indexed from, address to, uint value) anonymous;
            modifier onlyOwner() virtual { require(msg.sender == owner); _; }
            modifier open { _; }
            constructor(uint a) { }
            fallback() external payable { }
            receive() external payable { }
            function get() public view virtual override(Base, Other) onlyOwner returns (uint result) { return MAX; }
            function hook(uint) internal virtual;
        }

        interface IERC20 { function total() external view returns (uint); }
        library Math { }
        struct Free { uint a; }
        enum Top { A }
        function helper(uint a) pure returns (uint) { return a; }
        """;

    private static <T> T member(ContractDefinition contract, int index, Class<T> type) {
        return assertInstanceOf(type, contract.subNodes().get(index));
    }

    @Test
    void testSourceUnitMembers() {
        SourceUnit unit = parseClean(TOKEN_SOURCE);
        List<SourceUnitMember> nodes = unit.nodes();
        assertEquals(12, nodes.size());
        assertEquals("MIT", unit.licenseString());

        assertInstanceOf(ContractDefinition.class, nodes.get(6));
        assertEquals(ContractKind.INTERFACE, assertInstanceOf(ContractDefinition.class, nodes.get(7)).kind());
        assertEquals(ContractKind.LIBRARY, assertInstanceOf(ContractDefinition.class, nodes.get(8)).kind());
        assertEquals("Free", assertInstanceOf(StructDefinition.class, nodes.get(9)).name());
        assertEquals("Top", assertInstanceOf(EnumDefinition.class, nodes.get(10)).name());

        FunctionDefinition helper = assertInstanceOf(FunctionDefinition.class, nodes.get(11));
        assertTrue(helper.free());
        assertEquals(StateMutability.PURE, helper.stateMutability());
    }

    @Test
    void testPragmas() {
        SourceUnit unit = parseClean(TOKEN_SOURCE);
        PragmaDirective version = assertInstanceOf(PragmaDirective.class, unit.nodes().get(0));
        assertEquals(List.of("solidity", "^", "0.7", ".0"), version.literals());
        assertEquals(TokenType.IDENTIFIER, version.tokens().get(0));

        PragmaDirective abicoder = assertInstanceOf(PragmaDirective.class, unit.nodes().get(1));
        assertEquals(List.of("abicoder", "v2"), abicoder.literals());
    }

    @Test
    void testImports() {
        SourceUnit unit = parseClean(TOKEN_SOURCE);
        ImportDirective plain = assertInstanceOf(ImportDirective.class, unit.nodes().get(2));
        assertEquals("./a.sol", plain.path());
        assertEquals("", plain.unitAlias());
        assertTrue(plain.symbolAliases().isEmpty());

        assertEquals("B", assertInstanceOf(ImportDirective.class, unit.nodes().get(3)).unitAlias());
        assertEquals("x", assertInstanceOf(ImportDirective.class, unit.nodes().get(4)).unitAlias());

        ImportDirective symbols = assertInstanceOf(ImportDirective.class, unit.nodes().get(5));
        assertEquals("d.sol", symbols.path());
        assertEquals(2, symbols.symbolAliases().size());
        assertEquals("A", symbols.symbolAliases().get(0).symbol().name());
        assertEquals("AA", symbols.symbolAliases().get(0).alias());
        assertNull(symbols.symbolAliases().get(1).alias());
    }

    @Test
    void testContractHeader() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));
        assertEquals("Token", token.name());
        assertTrue(token.abstractContract());
        assertEquals(ContractKind.CONTRACT, token.kind());
        assertEquals("The token", token.documentation().text());

        assertEquals(2, token.baseContracts().size());
        InheritanceSpecifier base = token.baseContracts().get(0);
        assertEquals(List.of("Base"), base.baseName().namePath());
        assertEquals(1, base.arguments().size());
        assertNull(token.baseContracts().get(1).arguments());
    }

    @Test
    void testStateVariables() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));

        assertNotNull(member(token, 0, UsingForDirective.class).typeName());
        assertNull(member(token, 1, UsingForDirective.class).typeName());

        VariableDeclaration max = member(token, 2, VariableDeclaration.class);
        assertEquals("MAX", max.name());
        assertTrue(max.stateVariable());
        assertEquals(Visibility.PUBLIC, max.visibility());
        assertEquals(Mutability.CONSTANT, max.mutability());
        assertEquals("100", assertInstanceOf(Literal.class, max.value()).value());

        VariableDeclaration balances = member(token, 3, VariableDeclaration.class);
        assertInstanceOf(Mapping.class, balances.typeName());
        assertEquals(Visibility.INTERNAL, balances.visibility());

        assertEquals(Mutability.IMMUTABLE, member(token, 4, VariableDeclaration.class).mutability());

        VariableDeclaration callback = member(token, 5, VariableDeclaration.class);
        assertEquals("callback", callback.name());
        FunctionTypeName functionType = assertInstanceOf(FunctionTypeName.class, callback.typeName());
        assertEquals(Visibility.EXTERNAL, functionType.visibility());
        assertTrue(functionType.parameterTypes().parameters().isEmpty());
    }

    @Test
    void testStructsEnumsAndEvents() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));

        StructDefinition point = member(token, 6, StructDefinition.class);
        assertEquals(List.of("x", "y"), point.members().stream().map(VariableDeclaration::name).toList());

        EnumDefinition color = member(token, 7, EnumDefinition.class);
        assertEquals(List.of("Red", "Green"), color.members().stream().map(EnumValue::name).toList());

        EventDefinition transfer = member(token, 8, EventDefinition.class);
        assertTrue(transfer.anonymous());
        List<VariableDeclaration> parameters = transfer.parameters().parameters();
        assertEquals(3, parameters.size());
        assertTrue(parameters.get(0).indexed());
        assertFalse(parameters.get(1).indexed());
    }

    @Test
    void testModifiers() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));

        ModifierDefinition onlyOwner = member(token, 9, ModifierDefinition.class);
        assertTrue(onlyOwner.virtual());
        assertEquals(2, onlyOwner.body().statements().size());
        assertInstanceOf(PlaceholderStatement.class, onlyOwner.body().statements().get(1));

        ModifierDefinition open = member(token, 10, ModifierDefinition.class);
        assertTrue(open.parameters().parameters().isEmpty());
        assertFalse(open.virtual());
    }

    @Test
    void testSpecialFunctions() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));

        FunctionDefinition constructor = member(token, 11, FunctionDefinition.class);
        assertEquals(FunctionKind.CONSTRUCTOR, constructor.kind());
        assertEquals("", constructor.name());
        assertEquals(1, constructor.parameters().parameters().size());

        FunctionDefinition fallback = member(token, 12, FunctionDefinition.class);
        assertEquals(FunctionKind.FALLBACK, fallback.kind());
        assertEquals(StateMutability.PAYABLE, fallback.stateMutability());
        assertEquals(Visibility.EXTERNAL, fallback.visibility());

        assertEquals(FunctionKind.RECEIVE, member(token, 13, FunctionDefinition.class).kind());
    }

    @Test
    void testFunctionHeaders() {
        ContractDefinition token = firstContract(parseClean(TOKEN_SOURCE));

        FunctionDefinition get = member(token, 14, FunctionDefinition.class);
        assertEquals("get", get.name());
        assertFalse(get.free());
        assertEquals(Visibility.PUBLIC, get.visibility());
        assertEquals(StateMutability.VIEW, get.stateMutability());
        assertTrue(get.virtual());
        assertEquals(2, get.overrides().overrides().size());
        assertEquals(1, get.modifiers().size());
        assertEquals("onlyOwner", get.modifiers().get(0).name().name());
        assertNull(get.modifiers().get(0).arguments());
        assertEquals("result", get.returnParameters().parameters().get(0).name());
        assertNotNull(get.body());

        FunctionDefinition hook = member(token, 15, FunctionDefinition.class);
        assertNull(hook.body());
        assertEquals("", hook.parameters().parameters().get(0).name());
        assertTrue(hook.returnParameters().parameters().isEmpty());
    }

    @Test
    void testDuplicateSpecifiersAreReported() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public public view pure {} }";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, ParserOptions.defaults());
        assertNotNull(unit);
        assertEquals(List.of(9439, 9680), codes(reporter.errors()));
    }

    @Test
    void testMisnamedSpecialFunctions() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function constructor() public {} function fallback() external {} }";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, ParserOptions.defaults());
        assertNotNull(unit);
        assertEquals(List.of(3323), codes(reporter.errors()));
        assertEquals(List.of(3445), codes(reporter.warnings()));
        assertEquals("constructor", assertInstanceOf(FunctionDefinition.class, firstContract(unit).subNodes().get(0)).name());
    }

    @Test
    void testEmptyEnumIsReported() {
        ErrorReporter reporter = new ErrorReporter();
        SourceUnit unit = Parser.parse(LICENSE + "enum E {}", SOURCE_NAME, reporter, ParserOptions.defaults());
        assertNotNull(unit);
        assertEquals(List.of(3147), codes(reporter.errors()));
    }

    @Test
    void testStateVariableDocumentation() {
        ContractDefinition contract = firstContract(parseClean(LICENSE + "contract C {\n /// the supply\n uint supply;\n}"));
        VariableDeclaration supply = assertInstanceOf(VariableDeclaration.class, contract.subNodes().get(0));
        assertEquals("the supply", supply.documentation().text());
    }

    @Test
    void testLocalVariableDocumentationIsRejected() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public {\n /// nope\n uint x;\n } }";
        assertNotNull(Parser.parse(source, SOURCE_NAME, reporter, ParserOptions.defaults()));
        assertEquals(List.of(2837), codes(reporter.errors()));
    }

    @Test
    void testVersionPragmaMismatch() {
        String source = LICENSE + "pragma solidity ^0.8.0;";

        ErrorReporter strict = new ErrorReporter();
        assertNull(Parser.parse(source, SOURCE_NAME, strict, ParserOptions.defaults()));
        assertEquals(List.of(5333), codes(strict.errors()));

        ErrorReporter matching = new ErrorReporter();
        assertNotNull(Parser.parse(source, SOURCE_NAME, matching, ParserOptions.defaults().withCompilerVersion("0.8.4")));
        assertTrue(matching.errors().isEmpty());

        // left to later stages when recovering
        ErrorReporter recovering = new ErrorReporter();
        assertNotNull(Parser.parse(source, SOURCE_NAME, recovering, ParserOptions.defaults().withErrorRecovery(true)));
        assertTrue(recovering.errors().isEmpty());
    }

    @Test
    void testUnexpectedTopLevelToken() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(Parser.parse(LICENSE + "uint x;", SOURCE_NAME, reporter, ParserOptions.defaults()));
        assertEquals(List.of(7858), codes(reporter.errors()));
    }

    @Test
    void testEmptyImportPath() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(Parser.parse(LICENSE + "import \"\";", SOURCE_NAME, reporter, ParserOptions.defaults()));
        assertEquals(List.of(6326), codes(reporter.errors()));
    }

    @Test
    void testEnumTrailingCommaAborts() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(Parser.parse(LICENSE + "enum E { A, }", SOURCE_NAME, reporter, ParserOptions.defaults()));
        assertEquals(List.of(1612), codes(reporter.errors()));
        assertEquals("Expected identifier after ','", reporter.errors().get(0).message());
    }

    @Test
    void testStateMutabilityOnlyForAddress() {
        ErrorReporter reporter = new ErrorReporter();
        SourceUnit unit = Parser.parse(LICENSE + "contract C { uint payable x; address payable y; }",
            SOURCE_NAME, reporter, ParserOptions.defaults());
        assertNotNull(unit);
        assertEquals(List.of(9106), codes(reporter.errors()));

        ContractDefinition contract = firstContract(unit);
        VariableDeclaration x = member(contract, 0, VariableDeclaration.class);
        assertNull(assertInstanceOf(ElementaryTypeName.class, x.typeName()).stateMutability());
        VariableDeclaration y = member(contract, 1, VariableDeclaration.class);
        assertEquals(StateMutability.PAYABLE, assertInstanceOf(ElementaryTypeName.class, y.typeName()).stateMutability());
    }
}
