package com.raditha.treediff.model;

/**
 * Visitor with one method per {@link Syntax} variant.
 * Adding a variant breaks every implementation until it is handled.
 *
 * @param <R> result type
 */
public interface SyntaxVisitor<R> {

    R visitLeaf(Syntax.Leaf leaf);

    R visitComment(Syntax.Comment comment);

    R visitIndexed(Syntax.Indexed indexed);

    R visitFixed(Syntax.Fixed fixed);

    R visitKeyed(Syntax.Keyed keyed);

    R visitFunctionCall(Syntax.FunctionCall call);

    R visitFunction(Syntax.Function function);

    R visitAssignment(Syntax.Assignment assignment);

    R visitMemberAccess(Syntax.MemberAccess access);

    R visitMethodCall(Syntax.MethodCall call);

    R visitIf(Syntax.If conditional);

    R visitOperator(Syntax.Operator operator);

    R visitParseError(Syntax.ParseError error);

    R visitPair(Syntax.Pair pair);

    R visitSwitch(Syntax.Switch switchSyntax);

    R visitCase(Syntax.Case caseSyntax);

    R visitWhile(Syntax.While loop);

    R visitReturn(Syntax.Return returnSyntax);

    R visitYield(Syntax.Yield yieldSyntax);

    R visitThrow(Syntax.Throw throwSyntax);

    R visitBreak(Syntax.Break breakSyntax);

    R visitContinue(Syntax.Continue continueSyntax);
}
