package com.raditha.treediff.model;

import com.raditha.treediff.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    @Test
    void testSizeCountsEveryNode() {
        // PROGRAM > STMT > OPERATOR > (a, +, b)
        assertEquals(6, Fixtures.sum("a", "b").size());
        assertEquals(1, Term.leaf(Category.IDENTIFIER, "x").size());
    }

    @Test
    void testFoldVisitsInPreOrder() {
        Term tree = Fixtures.sum("a", "b");
        List<Category> order = tree.fold(new ArrayList<>(), (acc, t) -> {
            acc.add(t.category());
            return acc;
        });
        assertEquals(List.of(Category.PROGRAM, Category.EXPRESSION_STATEMENT, Category.MATH_OPERATOR,
                Category.IDENTIFIER, Category.OTHER, Category.IDENTIFIER), order);
    }

    @Test
    void testMapRebuildsBottomUp() {
        Term tree = Fixtures.sum("a", "b");
        Term renamed = tree.map(t -> t.isLeaf() && t.syntax().payload().equals("b")
                ? Term.leaf(Category.IDENTIFIER, "c")
                : t);
        assertEquals(Fixtures.sum("a", "c"), renamed);
        assertEquals(Fixtures.sum("a", "b"), tree, "Original tree must be untouched");
    }

    @Test
    void testStructuralEquality() {
        assertEquals(Fixtures.sum("a", "b"), Fixtures.sum("a", "b"));
        assertNotEquals(Fixtures.sum("a", "b"), Fixtures.sum("a", "c"));
    }

    @Test
    void testWithChildrenArityMismatch() {
        Term call = Term.of(Category.FUNCTION_CALL, new Syntax.FunctionCall(
                Term.leaf(Category.IDENTIFIER, "f"), List.of(Term.leaf(Category.IDENTIFIER, "x"))));
        assertThrows(IllegalArgumentException.class,
                () -> call.withChildren(List.of(Term.leaf(Category.IDENTIFIER, "g"))));

        Term rebuilt = call.withChildren(List.of(
                Term.leaf(Category.IDENTIFIER, "g"), Term.leaf(Category.IDENTIFIER, "y")));
        assertEquals(SyntaxKind.FUNCTION_CALL, rebuilt.kind());
        assertEquals("g", rebuilt.children().get(0).syntax().payload());
    }

    @Test
    void testFunctionSkipsAbsentFields() {
        Term body = Term.indexed(Category.BLOCK);
        Syntax anonymous = new Syntax.Function(null, null, body);
        assertEquals(List.of(body), anonymous.children());

        Term id = Term.leaf(Category.IDENTIFIER, "f");
        Syntax named = new Syntax.Function(id, null, body);
        assertEquals(List.of(id, body), named.children());

        Syntax rebuilt = named.withChildren(List.of(Term.leaf(Category.IDENTIFIER, "g"), body));
        assertInstanceOf(Syntax.Function.class, rebuilt);
        assertNull(((Syntax.Function) rebuilt).params());
    }

    @Test
    void testKeyedEqualityDependsOnKeyOrder() {
        Term one = Term.leaf(Category.INTEGER_LITERAL, "1");
        Term two = Term.leaf(Category.INTEGER_LITERAL, "2");

        Map<String, Term> ab = new LinkedHashMap<>();
        ab.put("a", one);
        ab.put("b", two);
        Map<String, Term> ba = new LinkedHashMap<>();
        ba.put("b", two);
        ba.put("a", one);

        assertNotEquals(new Syntax.Keyed(ab), new Syntax.Keyed(ba));
        assertEquals(new Syntax.Keyed(ab), new Syntax.Keyed(new LinkedHashMap<>(ab)));
        assertEquals(List.of("a", "b"), new Syntax.Keyed(ab).keys());
    }

    @Test
    void testDeepChainWalkedWithoutRecursion() {
        Term chain = Term.leaf(Category.IDENTIFIER, "x");
        for (int i = 0; i < 20_000; i++) {
            chain = Term.indexed(Category.BLOCK, chain);
        }
        assertEquals(20_001, chain.size());

        Term renamed = chain.map(t -> t.isLeaf() ? Term.leaf(Category.IDENTIFIER, "y") : t);
        assertEquals(20_001, renamed.size());
        String leaf = renamed.fold("", (acc, t) -> t.isLeaf() ? t.syntax().payload() : acc);
        assertEquals("y", leaf);
    }

    @Test
    void testVariadicKinds() {
        assertTrue(SyntaxKind.INDEXED.isVariadic());
        assertTrue(SyntaxKind.FUNCTION_CALL.isVariadic());
        assertTrue(SyntaxKind.RETURN.isVariadic());
        assertFalse(SyntaxKind.OPERATOR.isVariadic());
        assertFalse(SyntaxKind.FUNCTION.isVariadic());
        assertFalse(SyntaxKind.ASSIGNMENT.isVariadic());
        assertFalse(SyntaxKind.LEAF.isVariadic());
    }

    @Test
    void testInvalidAnnotations() {
        assertThrows(IllegalArgumentException.class, () -> new ByteRange(5, 2));
        assertThrows(IllegalArgumentException.class, () -> new Span(0, 1, 1, 1));
        assertThrows(NullPointerException.class, () -> new Info(ByteRange.empty(), Span.unknown(), null));
    }

    @Test
    void testOperatorFamily() {
        assertTrue(Category.BITWISE_OPERATOR.isOperator());
        assertTrue(Category.UNARY.isOperator());
        assertFalse(Category.ASSIGNMENT.isOperator());
    }
}
