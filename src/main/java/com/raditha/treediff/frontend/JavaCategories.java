package com.raditha.treediff.frontend;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.type.UnknownType;
import com.raditha.treediff.model.Category;

import java.util.HashMap;
import java.util.Map;

/**
 * Category table for the Java grammar.
 * Node types without an entry fall back to {@link Category#OTHER}.
 */
final class JavaCategories {

    private static final Map<Class<? extends Node>, Category> BY_TYPE = new HashMap<>();

    static {
        BY_TYPE.put(CompilationUnit.class, Category.PROGRAM);

        BY_TYPE.put(SimpleName.class, Category.IDENTIFIER);
        BY_TYPE.put(Name.class, Category.IDENTIFIER);
        BY_TYPE.put(NameExpr.class, Category.IDENTIFIER);

        BY_TYPE.put(StringLiteralExpr.class, Category.STRING_LITERAL);
        BY_TYPE.put(CharLiteralExpr.class, Category.STRING_LITERAL);
        BY_TYPE.put(TextBlockLiteralExpr.class, Category.STRING_LITERAL);
        BY_TYPE.put(IntegerLiteralExpr.class, Category.INTEGER_LITERAL);
        BY_TYPE.put(LongLiteralExpr.class, Category.INTEGER_LITERAL);
        BY_TYPE.put(DoubleLiteralExpr.class, Category.FLOAT_LITERAL);
        BY_TYPE.put(BooleanLiteralExpr.class, Category.BOOLEAN_LITERAL);
        BY_TYPE.put(NullLiteralExpr.class, Category.NULL_LITERAL);

        BY_TYPE.put(UnaryExpr.class, Category.UNARY);
        BY_TYPE.put(ConditionalExpr.class, Category.OPERATOR);
        BY_TYPE.put(InstanceOfExpr.class, Category.RELATIONAL_OPERATOR);
        BY_TYPE.put(CastExpr.class, Category.OPERATOR);

        BY_TYPE.put(IfStmt.class, Category.IF);
        BY_TYPE.put(SwitchStmt.class, Category.SWITCH);
        BY_TYPE.put(SwitchExpr.class, Category.SWITCH);
        BY_TYPE.put(SwitchEntry.class, Category.CASE);
        BY_TYPE.put(WhileStmt.class, Category.WHILE);
        BY_TYPE.put(DoStmt.class, Category.WHILE);
        BY_TYPE.put(ForStmt.class, Category.FOR);
        BY_TYPE.put(ForEachStmt.class, Category.FOR);
        BY_TYPE.put(ReturnStmt.class, Category.RETURN);
        BY_TYPE.put(YieldStmt.class, Category.YIELD);
        BY_TYPE.put(ThrowStmt.class, Category.THROW);
        BY_TYPE.put(BreakStmt.class, Category.BREAK);
        BY_TYPE.put(ContinueStmt.class, Category.CONTINUE);

        BY_TYPE.put(MethodDeclaration.class, Category.FUNCTION);
        BY_TYPE.put(ConstructorDeclaration.class, Category.FUNCTION);
        BY_TYPE.put(LambdaExpr.class, Category.FUNCTION);
        BY_TYPE.put(ObjectCreationExpr.class, Category.FUNCTION_CALL);
        BY_TYPE.put(MethodReferenceExpr.class, Category.MEMBER_ACCESS);
        BY_TYPE.put(Parameter.class, Category.PARAMS);
        BY_TYPE.put(AssignExpr.class, Category.ASSIGNMENT);
        BY_TYPE.put(FieldAccessExpr.class, Category.MEMBER_ACCESS);
        BY_TYPE.put(ArrayAccessExpr.class, Category.MEMBER_ACCESS);
        BY_TYPE.put(MemberValuePair.class, Category.PAIR);
        BY_TYPE.put(ArrayCreationExpr.class, Category.ARRAY);
        BY_TYPE.put(ArrayInitializerExpr.class, Category.ARRAY);
        BY_TYPE.put(ClassOrInterfaceDeclaration.class, Category.CLASS);
        BY_TYPE.put(EnumDeclaration.class, Category.CLASS);
        BY_TYPE.put(RecordDeclaration.class, Category.CLASS);
        BY_TYPE.put(AnnotationDeclaration.class, Category.CLASS);
        BY_TYPE.put(BlockStmt.class, Category.BLOCK);
        BY_TYPE.put(ExpressionStmt.class, Category.EXPRESSION_STATEMENT);
        BY_TYPE.put(VariableDeclarationExpr.class, Category.VAR_DECL);
        BY_TYPE.put(FieldDeclaration.class, Category.VAR_DECL);
        BY_TYPE.put(VariableDeclarator.class, Category.VAR_DECL);

        BY_TYPE.put(EmptyStmt.class, Category.EMPTY);
        BY_TYPE.put(UnknownType.class, Category.EMPTY);
    }

    private JavaCategories() {
    }

    static Category categoryOf(Node node) {
        if (node instanceof Comment) {
            return Category.COMMENT;
        }
        if (node instanceof BinaryExpr binary) {
            return binaryCategory(binary.getOperator());
        }
        if (node instanceof MethodCallExpr call) {
            return call.getScope().isPresent() ? Category.METHOD_CALL : Category.FUNCTION_CALL;
        }
        return BY_TYPE.getOrDefault(node.getClass(), Category.OTHER);
    }

    private static Category binaryCategory(BinaryExpr.Operator operator) {
        switch (operator) {
            case AND:
            case OR:
                return Category.BOOLEAN_OPERATOR;
            case PLUS:
            case MINUS:
            case MULTIPLY:
            case DIVIDE:
            case REMAINDER:
                return Category.MATH_OPERATOR;
            case EQUALS:
            case NOT_EQUALS:
            case LESS:
            case GREATER:
            case LESS_EQUALS:
            case GREATER_EQUALS:
                return Category.RELATIONAL_OPERATOR;
            case BINARY_AND:
            case BINARY_OR:
            case XOR:
            case LEFT_SHIFT:
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return Category.BITWISE_OPERATOR;
            default:
                return Category.BINARY;
        }
    }
}
