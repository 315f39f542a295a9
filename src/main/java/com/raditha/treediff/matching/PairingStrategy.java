package com.raditha.treediff.matching;

import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.SyntaxVisitor;

/**
 * How the children of two matched nodes of the same variant are paired.
 */
enum PairingStrategy {
    /** Fixed-arity shapes: i-th child with i-th child. */
    POSITIONAL,

    /** Keyed shapes: children under the same key. */
    KEYED,

    /** Variable-length sequences: anchored diff plus best match within the siblings. */
    ALIGNED,

    /** Nothing to pair. */
    NONE;

    private static final SyntaxVisitor<PairingStrategy> CLASSIFIER = new Classifier();

    /**
     * Strategy for two matched nodes of the same variant: variadic shapes are
     * aligned, fixed shapes are classified by variant.
     */
    static PairingStrategy of(Syntax syntax) {
        if (syntax.kind().isVariadic()) {
            return ALIGNED;
        }
        return syntax.accept(CLASSIFIER);
    }

    /**
     * Variadic variants are settled by {@link #of} before the classifier is
     * consulted; their methods answer ALIGNED to agree with the flag.
     */
    private static final class Classifier implements SyntaxVisitor<PairingStrategy> {

        @Override
        public PairingStrategy visitLeaf(Syntax.Leaf leaf) {
            return NONE;
        }

        @Override
        public PairingStrategy visitComment(Syntax.Comment comment) {
            return NONE;
        }

        @Override
        public PairingStrategy visitIndexed(Syntax.Indexed indexed) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitFixed(Syntax.Fixed fixed) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitKeyed(Syntax.Keyed keyed) {
            return KEYED;
        }

        @Override
        public PairingStrategy visitFunctionCall(Syntax.FunctionCall call) {
            return ALIGNED;
        }

        // Absent id or params change the arity; the proposer aligns those
        @Override
        public PairingStrategy visitFunction(Syntax.Function function) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitAssignment(Syntax.Assignment assignment) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitMemberAccess(Syntax.MemberAccess access) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitMethodCall(Syntax.MethodCall call) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitIf(Syntax.If conditional) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitOperator(Syntax.Operator operator) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitParseError(Syntax.ParseError error) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitPair(Syntax.Pair pair) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitSwitch(Syntax.Switch switchSyntax) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitCase(Syntax.Case caseSyntax) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitWhile(Syntax.While loop) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitReturn(Syntax.Return returnSyntax) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitYield(Syntax.Yield yieldSyntax) {
            return ALIGNED;
        }

        @Override
        public PairingStrategy visitThrow(Syntax.Throw throwSyntax) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitBreak(Syntax.Break breakSyntax) {
            return POSITIONAL;
        }

        @Override
        public PairingStrategy visitContinue(Syntax.Continue continueSyntax) {
            return POSITIONAL;
        }
    }
}
