package com.solparser;

import com.solparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.solparser.TestParsing.allNodes;
import static com.solparser.TestParsing.codes;
import static org.junit.jupiter.api.Assertions.*;

public class SpecificationParserTest {

    private static SpecificationExpression parse(String source, ErrorReporter reporter) {
        return new Parser(reporter).parseSpecificationExpression(new Scanner(source));
    }

    private static SpecificationExpression parseClean(String source) {
        ErrorReporter reporter = new ErrorReporter();
        SpecificationExpression result = parse(source, reporter);
        assertNotNull(result, () -> "parse aborted: " + reporter.diagnostics());
        assertTrue(reporter.errors().isEmpty(), () -> "unexpected errors: " + reporter.errors());
        return result;
    }

    private static List<String> names(Quantifier quantifier) {
        return quantifier.variables().parameters().stream().map(VariableDeclaration::name).toList();
    }

    @Test
    void testPlainExpression() {
        SpecificationExpression spec = parseClean("balance >= amount");
        assertTrue(spec.quantifiers().isEmpty());
        assertNull(spec.arrayId());
        assertFalse(spec.isArrayProperty());
        assertInstanceOf(BinaryOperation.class, spec.expression());
    }

    @Test
    void testSharedTypeQuantifier() {
        SpecificationExpression spec = parseClean("forall uint i; a[i] > 0");
        assertEquals(1, spec.quantifiers().size());
        Quantifier forall = spec.quantifiers().get(0);
        assertTrue(forall.forall());
        assertEquals(List.of("i"), names(forall));

        BinaryOperation body = assertInstanceOf(BinaryOperation.class, spec.expression());
        assertInstanceOf(IndexAccess.class, body.leftExpression());

        SpecificationExpression pair = parseClean("exists uint i, j; x[i] == y[j]");
        assertFalse(pair.quantifiers().get(0).forall());
        assertEquals(List.of("i", "j"), names(pair.quantifiers().get(0)));
    }

    @Test
    void testParenthesizedQuantifiers() {
        SpecificationExpression spec = parseClean("forall (uint i, address owner) exists (uint j) m[owner][i] == j");
        assertEquals(2, spec.quantifiers().size());
        assertEquals(List.of("i", "owner"), names(spec.quantifiers().get(0)));
        assertFalse(spec.quantifiers().get(1).forall());

        VariableDeclaration owner = spec.quantifiers().get(0).variables().parameters().get(1);
        ElementaryTypeName type = assertInstanceOf(ElementaryTypeName.class, owner.typeName());
        assertEquals(TokenType.ADDRESS, type.typeName().token());
        assertFalse(owner.stateVariable());
    }

    @Test
    void testArrayAndMappingVariablesLiveInStorage() {
        SpecificationExpression spec = parseClean("forall (uint[] a, mapping(uint => uint) m) true");
        List<VariableDeclaration> variables = spec.quantifiers().get(0).variables().parameters();
        assertTrue(variables.get(0).stateVariable());
        assertTrue(variables.get(1).stateVariable());
    }

    @Test
    void testArrayProperty() {
        SpecificationExpression spec = parseClean("property(balances) (i) balances[i] <= total");
        assertTrue(spec.isArrayProperty());
        assertEquals("balances", spec.arrayId().name());

        Quantifier quantifier = spec.quantifiers().get(0);
        assertTrue(quantifier.forall());
        VariableDeclaration index = quantifier.variables().parameters().get(0);
        assertEquals("i", index.name());
        ElementaryTypeName type = assertInstanceOf(ElementaryTypeName.class, index.typeName());
        assertEquals(TokenType.UINT, type.typeName().token());
    }

    @Test
    void testTrailingCommaInQuantifierList() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(parse("forall (uint i,) true", reporter));
        assertEquals(List.of(6155), codes(reporter.errors()));

        ErrorReporter shared = new ErrorReporter();
        assertNull(parse("forall uint i, ; true", shared));
        assertEquals(List.of(6155), codes(shared.errors()));
    }

    @Test
    void testUnsupportedQuantifierType() {
        ErrorReporter reporter = new ErrorReporter();
        SpecificationExpression spec = parse("forall (Token t) t.ok()", reporter);
        assertNotNull(spec);
        assertEquals(List.of(5674), codes(reporter.errors()));
    }

    @Test
    void testTrailingInputIsReported() {
        ErrorReporter reporter = new ErrorReporter();
        SpecificationExpression spec = parse("x y", reporter);
        assertNotNull(spec);
        assertEquals(List.of(1553), codes(reporter.errors()));
    }

    @Test
    void testSpecificationCases() {
        ErrorReporter reporter = new ErrorReporter();
        List<SpecificationCase> cases = new Parser(reporter).parseSpecificationCases(
            new Scanner("[ case amount > 0 : balance == old + amount ; case forall uint i; i >= 0 : true ; ]"));
        assertTrue(reporter.errors().isEmpty(), () -> "unexpected errors: " + reporter.errors());
        assertEquals(2, cases.size());
        assertInstanceOf(BinaryOperation.class, cases.get(0).precondition().expression());
        assertEquals(1, cases.get(1).precondition().quantifiers().size());
        assertInstanceOf(Literal.class, cases.get(1).postcondition().expression());
    }

    @Test
    void testBrokenCaseKeepsEarlierCases() {
        ErrorReporter reporter = new ErrorReporter();
        List<SpecificationCase> cases = new Parser(reporter).parseSpecificationCases(
            new Scanner("[ case a : b ; case c ]"));
        assertEquals(1, cases.size());
        assertEquals(List.of(2314), codes(reporter.errors()));

        ErrorReporter empty = new ErrorReporter();
        assertTrue(new Parser(empty).parseSpecificationCases(new Scanner("[ ]")).isEmpty());
        assertTrue(empty.errors().isEmpty());
    }

    private static void assertUniqueIds(SpecificationExpression spec) {
        Set<Long> ids = new HashSet<>();
        List<Node> nodes = new ArrayList<>(allNodes(spec.expression()));
        for (Quantifier quantifier : spec.quantifiers()) {
            nodes.addAll(allNodes(quantifier.variables()));
        }
        for (Node node : nodes) {
            assertTrue(ids.add(node.id()), () -> "duplicate id " + node.id() + " in " + spec);
        }
    }

    @Test
    void testSharedTypeIsCopiedPerVariable() {
        SpecificationExpression spec = parseClean("exists uint[] i, j, k; x[i] == y[j]");
        List<VariableDeclaration> variables = spec.quantifiers().get(0).variables().parameters();
        assertEquals(3, variables.size());

        ArrayTypeName first = assertInstanceOf(ArrayTypeName.class, variables.get(0).typeName());
        for (VariableDeclaration variable : variables.subList(1, 3)) {
            ArrayTypeName type = assertInstanceOf(ArrayTypeName.class, variable.typeName());
            assertNotSame(first, type);
            assertNotEquals(first.id(), type.id());
            assertNotEquals(first.baseType().id(), type.baseType().id());
            assertEquals(first.location(), type.location());
            assertTrue(variable.stateVariable());
        }
        assertEquals(List.of("i", "j", "k"), variables.stream().map(VariableDeclaration::name).toList());
        assertUniqueIds(spec);
    }

    @Test
    void testPropertyIndexTypesAreDistinct() {
        SpecificationExpression spec = parseClean("property(m) (i, j) m[i][j] == 0");
        List<VariableDeclaration> variables = spec.quantifiers().get(0).variables().parameters();
        TypeName i = variables.get(0).typeName();
        TypeName j = variables.get(1).typeName();
        assertNotSame(i, j);
        assertNotEquals(i.id(), j.id());
        assertEquals(i.location(), j.location());
        assertUniqueIds(spec);
    }
}
