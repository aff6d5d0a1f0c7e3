package com.solparser;

import com.solparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.solparser.TestParsing.expression;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private static String literalValue(Expression expression) {
        return assertInstanceOf(Literal.class, expression).value();
    }

    private static String identifierName(Expression expression) {
        return assertInstanceOf(Identifier.class, expression).name();
    }

    @Test
    @DisplayName("Multiplication binds tighter than addition")
    void testPrecedence() {
        BinaryOperation sum = assertInstanceOf(BinaryOperation.class, expression("2 + 3 * 4"));
        assertEquals(TokenType.ADD, sum.operator());
        assertEquals("2", literalValue(sum.leftExpression()));
        BinaryOperation product = assertInstanceOf(BinaryOperation.class, sum.rightExpression());
        assertEquals(TokenType.MUL, product.operator());
        assertEquals("3", literalValue(product.leftExpression()));
        assertEquals("4", literalValue(product.rightExpression()));
    }

    @Test
    void testBinaryOperatorsAssociateLeft() {
        BinaryOperation outer = assertInstanceOf(BinaryOperation.class, expression("1 - 2 - 3"));
        assertEquals("3", literalValue(outer.rightExpression()));
        BinaryOperation inner = assertInstanceOf(BinaryOperation.class, outer.leftExpression());
        assertEquals("1", literalValue(inner.leftExpression()));
        assertEquals("2", literalValue(inner.rightExpression()));
    }

    @Test
    void testComparisonAndLogicalOperators() {
        BinaryOperation or = assertInstanceOf(BinaryOperation.class, expression("a < b && c || d"));
        assertEquals(TokenType.OR, or.operator());
        BinaryOperation and = assertInstanceOf(BinaryOperation.class, or.leftExpression());
        assertEquals(TokenType.AND, and.operator());
        assertEquals(TokenType.LESS_THAN, assertInstanceOf(BinaryOperation.class, and.leftExpression()).operator());
    }

    @Test
    @DisplayName("Assignment and conditional are right-associative")
    void testAssignmentAndConditional() {
        Assignment assignment = assertInstanceOf(Assignment.class, expression("a = b ? c = d : e"));
        assertEquals(TokenType.ASSIGN, assignment.operator());
        assertEquals("a", identifierName(assignment.leftHandSide()));

        Conditional conditional = assertInstanceOf(Conditional.class, assignment.rightHandSide());
        assertEquals("b", identifierName(conditional.condition()));
        Assignment inner = assertInstanceOf(Assignment.class, conditional.trueExpression());
        assertEquals("c", identifierName(inner.leftHandSide()));
        assertEquals("e", identifierName(conditional.falseExpression()));

        Assignment chained = assertInstanceOf(Assignment.class, expression("x += y -= 1"));
        assertEquals(TokenType.ASSIGN_ADD, chained.operator());
        assertEquals(TokenType.ASSIGN_SUB, assertInstanceOf(Assignment.class, chained.rightHandSide()).operator());
    }

    @Test
    void testUnaryOperators() {
        UnaryOperation not = assertInstanceOf(UnaryOperation.class, expression("!done"));
        assertTrue(not.prefix());
        assertEquals(TokenType.NOT, not.operator());

        UnaryOperation postfix = assertInstanceOf(UnaryOperation.class, expression("i++"));
        assertFalse(postfix.prefix());
        assertEquals(TokenType.INC, postfix.operator());

        UnaryOperation delete = assertInstanceOf(UnaryOperation.class, expression("delete a[1]"));
        assertEquals(TokenType.DELETE, delete.operator());
        assertInstanceOf(IndexAccess.class, delete.subExpression());

        // prefix binds tighter than any binary operator
        BinaryOperation sum = assertInstanceOf(BinaryOperation.class, expression("-x + 1"));
        assertInstanceOf(UnaryOperation.class, sum.leftExpression());
    }

    @Test
    void testLiteralsWithUnits() {
        Literal ether = assertInstanceOf(Literal.class, expression("1 ether"));
        assertEquals("1", ether.value());
        assertEquals(SubDenomination.ETHER, ether.subDenomination());

        Literal days = assertInstanceOf(Literal.class, expression("2 days"));
        assertEquals(SubDenomination.DAY, days.subDenomination());

        Literal plain = assertInstanceOf(Literal.class, expression("0x1f"));
        assertEquals(SubDenomination.NONE, plain.subDenomination());
        assertEquals(TokenType.NUMBER, plain.token());

        assertEquals(TokenType.TRUE_LITERAL, assertInstanceOf(Literal.class, expression("true")).token());
    }

    @Test
    void testAdjacentStringLiteralsAreConcatenated() {
        Literal literal = assertInstanceOf(Literal.class, expression("\"abc\" \"def\""));
        assertEquals("abcdef", literal.value());
        assertEquals(TokenType.STRING_LITERAL, literal.token());
        assertEquals(0, literal.location().start());
        assertEquals(11, literal.location().end());
    }

    @Test
    void testMemberIndexAndRangeAccess() {
        MemberAccess member = assertInstanceOf(MemberAccess.class, expression("a.b.c"));
        assertEquals("c", member.memberName());
        assertEquals("b", assertInstanceOf(MemberAccess.class, member.expression()).memberName());

        IndexRangeAccess range = assertInstanceOf(IndexRangeAccess.class, expression("data[1:2]"));
        assertEquals("1", literalValue(range.startExpression()));
        assertEquals("2", literalValue(range.endExpression()));

        IndexRangeAccess open = assertInstanceOf(IndexRangeAccess.class, expression("data[:]"));
        assertNull(open.startExpression());
        assertNull(open.endExpression());

        MemberAccess addressMember = assertInstanceOf(MemberAccess.class, expression("this.address"));
        assertEquals("address", addressMember.memberName());
    }

    @Test
    void testFunctionCalls() {
        FunctionCall call = assertInstanceOf(FunctionCall.class, expression("f(1, x)"));
        assertEquals("f", identifierName(call.expression()));
        assertEquals(2, call.arguments().size());
        assertTrue(call.names().isEmpty());

        FunctionCall named = assertInstanceOf(FunctionCall.class, expression("f({a: 1, b: 2})"));
        assertEquals(List.of("a", "b"), named.names());
        assertEquals(2, named.arguments().size());

        FunctionCall cast = assertInstanceOf(FunctionCall.class, expression("uint8(x)"));
        ElementaryTypeNameExpression type = assertInstanceOf(ElementaryTypeNameExpression.class, cast.expression());
        assertEquals("uint8", type.typeName().typeName().toString());
    }

    @Test
    void testCallOptions() {
        FunctionCall call = assertInstanceOf(FunctionCall.class, expression("c.f{value: 1, gas: 2}(3)"));
        FunctionCallOptions callOptions = assertInstanceOf(FunctionCallOptions.class, call.expression());
        assertEquals(List.of("value", "gas"), callOptions.names());
        assertEquals("1", literalValue(callOptions.options().get(0)));
        assertInstanceOf(MemberAccess.class, callOptions.expression());
        assertEquals("3", literalValue(call.arguments().get(0)));
    }

    @Test
    @DisplayName("payable(x) converts to address payable")
    void testPayableConversion() {
        FunctionCall call = assertInstanceOf(FunctionCall.class, expression("payable(owner)"));
        ElementaryTypeNameExpression callee = assertInstanceOf(ElementaryTypeNameExpression.class, call.expression());
        assertEquals(TokenType.ADDRESS, callee.typeName().typeName().token());
        assertEquals(StateMutability.PAYABLE, callee.typeName().stateMutability());
        // the type covers just the keyword
        assertEquals(0, callee.location().start());
        assertEquals(7, callee.location().end());
        assertEquals(14, call.location().end());
    }

    @Test
    void testNewAndTypeExpressions() {
        FunctionCall creation = assertInstanceOf(FunctionCall.class, expression("new uint[](3)"));
        NewExpression newExpression = assertInstanceOf(NewExpression.class, creation.expression());
        ArrayTypeName array = assertInstanceOf(ArrayTypeName.class, newExpression.typeName());
        assertNull(array.length());

        MemberAccess typeName = assertInstanceOf(MemberAccess.class, expression("type(C).name"));
        FunctionCall typeCall = assertInstanceOf(FunctionCall.class, typeName.expression());
        assertEquals("type", identifierName(typeCall.expression()));
    }

    @Test
    void testTuplesAndInlineArrays() {
        TupleExpression tuple = assertInstanceOf(TupleExpression.class, expression("(1, , 3)"));
        assertFalse(tuple.inlineArray());
        assertEquals(3, tuple.components().size());
        assertNull(tuple.components().get(1));

        TupleExpression empty = assertInstanceOf(TupleExpression.class, expression("()"));
        assertTrue(empty.components().isEmpty());

        TupleExpression array = assertInstanceOf(TupleExpression.class, expression("[1, 2]"));
        assertTrue(array.inlineArray());
        assertEquals(2, array.components().size());
    }

    @Test
    void testOmittedInlineArrayElementIsReported() {
        ErrorReporter reporter = new ErrorReporter();
        Expression result = new Parser(reporter).parseExpression(new Scanner("[1, , 2]"));
        TupleExpression array = assertInstanceOf(TupleExpression.class, result);
        assertEquals(2, array.components().size());
        assertEquals(List.of(4799), TestParsing.codes(reporter.errors()));
    }

    @Test
    void testIncompleteExpressionAborts() {
        ErrorReporter reporter = new ErrorReporter();
        assertNull(new Parser(reporter).parseExpression(new Scanner("1 +")));
        assertEquals(List.of(6933), TestParsing.codes(reporter.errors()));
    }

    @Test
    void testTrailingTokensAreReported() {
        ErrorReporter reporter = new ErrorReporter();
        Expression result = new Parser(reporter).parseExpression(new Scanner("a b"));
        assertEquals("a", identifierName(result));
        assertEquals(List.of(4272), TestParsing.codes(reporter.errors()));
    }

    @Test
    void testTrailingCommaInArguments() {
        ErrorReporter reporter = new ErrorReporter();
        Expression result = new Parser(reporter).parseExpression(new Scanner("f(1, 2,)"));
        FunctionCall call = assertInstanceOf(FunctionCall.class, result);
        assertEquals(2, call.arguments().size());
        assertEquals(List.of(2074), TestParsing.codes(reporter.errors()));
    }
}
