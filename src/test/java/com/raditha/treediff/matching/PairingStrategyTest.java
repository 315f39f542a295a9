package com.raditha.treediff.matching;

import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.SyntaxKind;
import com.raditha.treediff.model.Term;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PairingStrategyTest {

    private static final Term A = Term.leaf(Category.IDENTIFIER, "a");
    private static final Term B = Term.leaf(Category.IDENTIFIER, "b");

    private static List<Syntax> oneOfEach() {
        return List.of(
                new Syntax.Leaf("a"),
                new Syntax.Comment("// a"),
                new Syntax.Indexed(List.of(A, B)),
                new Syntax.Fixed(List.of(A, B)),
                new Syntax.Keyed(Map.of("a", A)),
                new Syntax.FunctionCall(A, List.of(B)),
                new Syntax.Function(A, B, A),
                new Syntax.Assignment(A, B),
                new Syntax.MemberAccess(A, B),
                new Syntax.MethodCall(A, B, List.of(A)),
                new Syntax.If(A, List.of(B)),
                new Syntax.Operator(List.of(A, B)),
                new Syntax.ParseError(List.of(A)),
                new Syntax.Pair(A, B),
                new Syntax.Switch(List.of(A), List.of(B)),
                new Syntax.Case(A, List.of(B)),
                new Syntax.While(A, List.of(B)),
                new Syntax.Return(List.of(A)),
                new Syntax.Yield(List.of(A)),
                new Syntax.Throw(A),
                new Syntax.Break(null),
                new Syntax.Continue(null));
    }

    @Test
    void testVariadicKindsAreAligned() {
        Set<SyntaxKind> seen = EnumSet.noneOf(SyntaxKind.class);
        for (Syntax syntax : oneOfEach()) {
            SyntaxKind kind = syntax.kind();
            seen.add(kind);
            PairingStrategy strategy = PairingStrategy.of(syntax);
            if (kind.isVariadic()) {
                assertEquals(PairingStrategy.ALIGNED, strategy, kind.name());
            } else {
                assertNotEquals(PairingStrategy.ALIGNED, strategy, kind.name());
            }
        }
        assertEquals(EnumSet.allOf(SyntaxKind.class), seen);
    }

    @Test
    void testFixedShapes() {
        assertEquals(PairingStrategy.POSITIONAL, PairingStrategy.of(new Syntax.Operator(List.of(A, B))));
        assertEquals(PairingStrategy.POSITIONAL, PairingStrategy.of(new Syntax.Function(null, A, B)));
        assertEquals(PairingStrategy.KEYED, PairingStrategy.of(new Syntax.Keyed(Map.of("a", A))));
        assertEquals(PairingStrategy.NONE, PairingStrategy.of(new Syntax.Leaf("a")));
    }
}
