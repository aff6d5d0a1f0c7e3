package com.solparser;

import com.solparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.solparser.TestParsing.*;
import static org.junit.jupiter.api.Assertions.*;

public class ErrorRecoveryTest {

    private static final ParserOptions RECOVERING = ParserOptions.defaults().withErrorRecovery(true);

    private static final String BAD_STATEMENT = LICENSE + """
        contract C {
            function f() public {
                uint x = ;
                x = 2;
            }
            function g() public {}
        }
        """;

    @Test
    @DisplayName("Without recovery the first fatal error aborts the parse")
    void testFatalErrorWithoutRecovery() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(Parser.parse(BAD_STATEMENT, SOURCE_NAME, reporter, ParserOptions.defaults()));
        assertEquals(List.of(6933), codes(reporter.errors()));
    }

    @Test
    @DisplayName("A broken statement is skipped up to its semicolon")
    void testStatementRecovery() {
        ErrorReporter reporter = new ErrorReporter();
        SourceUnit unit = Parser.parse(BAD_STATEMENT, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        assertEquals(List.of(6933), codes(reporter.errors()));
        assertEquals(List.of(3347), codes(reporter.warnings()));

        ContractDefinition contract = firstContract(unit);
        assertEquals(2, contract.subNodes().size());
        FunctionDefinition f = assertInstanceOf(FunctionDefinition.class, contract.subNodes().get(0));
        assertEquals(1, f.body().statements().size());
        assertInstanceOf(ExpressionStatement.class, f.body().statements().get(0));
        assertEquals("g", assertInstanceOf(FunctionDefinition.class, contract.subNodes().get(1)).name());
    }

    @Test
    void testMissingSemicolonIsReportedAndParsingContinues() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public { x = 1 y = 2; } }";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        assertEquals(List.of(6635), codes(reporter.errors()));
        FunctionDefinition f = assertInstanceOf(FunctionDefinition.class, firstContract(unit).subNodes().get(0));
        assertEquals(2, f.body().statements().size());
    }

    @Test
    void testSkippedTokensAreReportedAsRecoveryWarning() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public { x = ) + 1 2; y = 3; } }";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        assertEquals(List.of(6933), codes(reporter.errors()));
        assertEquals(List.of(3796), codes(reporter.warnings()));
        FunctionDefinition f = assertInstanceOf(FunctionDefinition.class, firstContract(unit).subNodes().get(0));
        assertEquals(1, f.body().statements().size());
    }

    @Test
    @DisplayName("A broken contract member is skipped up to the closing brace")
    void testContractRecovery() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function g() public {} 123 } contract D {}";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        assertEquals(List.of(9182), codes(reporter.errors()));
        assertEquals(List.of(3796), codes(reporter.warnings()));
        assertEquals(2, unit.nodes().size());
        assertEquals(1, firstContract(unit).subNodes().size());
    }

    @Test
    @DisplayName("Recovery that runs off the end of the source fails further out")
    void testRecoveryReachingEndOfSource() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public { x = ) ";
        assertNull(Parser.parse(source, SOURCE_NAME, reporter, RECOVERING));
        List<Integer> errors = codes(reporter.errors());
        assertEquals(6933, (int) errors.get(0));
        assertTrue(errors.contains(1957), () -> "errors: " + errors);
    }

    @Test
    void testTooManyErrorsAbort() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            body.append("x = 1 ");
        }
        String source = LICENSE + "contract C { function f() public { " + body + "; } }";
        ErrorReporter reporter = new ErrorReporter();
        assertNull(Parser.parse(source, SOURCE_NAME, reporter, RECOVERING));
        List<Diagnostic> errors = reporter.errors();
        assertEquals(ErrorReporter.MAX_ERRORS_ALLOWED + 2, errors.size());
        assertEquals(4013, errors.get(errors.size() - 1).code());
        assertTrue(reporter.hasExcessiveErrors());
    }

    @Test
    @DisplayName("An import without its semicolon ends at the path")
    void testImportMissingSemicolon() {
        for (String directive : List.of("import \"a.sol\"", "import {A} from \"a.sol\"")) {
            ErrorReporter reporter = new ErrorReporter();
            SourceUnit unit = Parser.parse(LICENSE + directive + "\ncontract C {}", SOURCE_NAME, reporter, RECOVERING);
            assertNotNull(unit, directive);
            assertEquals(List.of(6635), codes(reporter.errors()), directive);
            assertEquals("MIT", unit.licenseString());
            assertEquals(2, unit.nodes().size());

            ImportDirective directiveNode = assertInstanceOf(ImportDirective.class, unit.nodes().get(0));
            assertEquals("a.sol", directiveNode.path());
            assertEquals(new SourceLocation(LICENSE.length(), LICENSE.length() + directive.length(), SOURCE_NAME),
                directiveNode.location());
        }
    }

    @Test
    void testRecoveredContractEndsAtClosingBrace() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function g() public {} 123 } contract D {}";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        SourceLocation location = firstContract(unit).location();
        assertEquals("contract C { function g() public {} 123 }", source.substring(location.start(), location.end()));
    }

    @Test
    void testRecoveredBlockEndsAtClosingBrace() {
        ErrorReporter reporter = new ErrorReporter();
        String source = LICENSE + "contract C { function f() public { x = ) } function g() public {} }";
        SourceUnit unit = Parser.parse(source, SOURCE_NAME, reporter, RECOVERING);
        assertNotNull(unit);
        assertEquals(List.of(6933, 1957), codes(reporter.errors()));
        assertEquals(List.of(3796), codes(reporter.warnings()));

        ContractDefinition contract = firstContract(unit);
        assertEquals(2, contract.subNodes().size());
        FunctionDefinition f = assertInstanceOf(FunctionDefinition.class, contract.subNodes().get(0));
        assertTrue(f.body().statements().isEmpty());
        SourceLocation body = f.body().location();
        assertEquals("{ x = ) }", source.substring(body.start(), body.end()));
        assertEquals("function f() public { x = ) }", source.substring(f.location().start(), f.location().end()));
    }
}
