package com.raditha.treediff.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of a single syntax construct.
 * <p>
 * The set of variants is closed. Code that needs to treat every variant
 * explicitly goes through {@link #accept(SyntaxVisitor)}; generic traversal
 * uses {@link #children()} and {@link #withChildren(List)}, which list and
 * replace children in declared field order.
 */
public sealed interface Syntax {

    SyntaxKind kind();

    /**
     * Children in declared field order. Absent optional fields are skipped.
     */
    List<Term> children();

    /**
     * Rebuild this node with its children replaced positionally.
     *
     * @param children replacement children, same count as {@link #children()}
     * @return a node of the same variant
     * @throws IllegalArgumentException if the count differs
     */
    Syntax withChildren(List<Term> children);

    <R> R accept(SyntaxVisitor<R> visitor);

    /**
     * Atomic content that belongs to the node itself rather than to its
     * children: leaf and comment text, or the key order of a keyed node.
     */
    default String payload() {
        return "";
    }

    private static List<Term> requireArity(List<Term> children, int expected, SyntaxKind kind) {
        if (children.size() != expected) {
            throw new IllegalArgumentException(
                    String.format("%s expects %d children, got %d", kind, expected, children.size()));
        }
        return children;
    }

    private static List<Term> concat(Term head, List<Term> tail) {
        List<Term> all = new ArrayList<>(tail.size() + 1);
        all.add(head);
        all.addAll(tail);
        return Collections.unmodifiableList(all);
    }

    /** A terminal node, e.g. an identifier or an atomic literal. */
    record Leaf(String text) implements Syntax {
        public Leaf {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.LEAF;
        }

        @Override
        public List<Term> children() {
            return List.of();
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 0, kind());
            return this;
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitLeaf(this);
        }

        @Override
        public String payload() {
            return text;
        }
    }

    record Comment(String text) implements Syntax {
        public Comment {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.COMMENT;
        }

        @Override
        public List<Term> children() {
            return List.of();
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 0, kind());
            return this;
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitComment(this);
        }

        @Override
        public String payload() {
            return text;
        }
    }

    /** Ordered children of variable length, e.g. a statement list. */
    record Indexed(List<Term> children) implements Syntax {
        public Indexed {
            children = List.copyOf(children);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.INDEXED;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new Indexed(requireArity(children, this.children.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitIndexed(this);
        }
    }

    /** Ordered children of fixed length, e.g. a binary operator and its operands. */
    record Fixed(List<Term> children) implements Syntax {
        public Fixed {
            children = List.copyOf(children);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.FIXED;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new Fixed(requireArity(children, this.children.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitFixed(this);
        }
    }

    /**
     * Children addressed by a textual key, in insertion order. Two keyed
     * nodes are equal only if their keys appear in the same order.
     */
    record Keyed(Map<String, Term> entries) implements Syntax {
        public Keyed {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public List<String> keys() {
            return List.copyOf(entries.keySet());
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.KEYED;
        }

        @Override
        public List<Term> children() {
            return List.copyOf(entries.values());
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, entries.size(), kind());
            Map<String, Term> rebuilt = new LinkedHashMap<>();
            Iterator<Term> it = children.iterator();
            for (String key : entries.keySet()) {
                rebuilt.put(key, it.next());
            }
            return new Keyed(rebuilt);
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitKeyed(this);
        }

        @Override
        public String payload() {
            return String.join("\u0000", entries.keySet());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Keyed other)) return false;
            return entries.equals(other.entries) && keys().equals(other.keys());
        }

        @Override
        public int hashCode() {
            return Objects.hash(keys(), entries);
        }
    }

    /** A call of a function value with its arguments. */
    record FunctionCall(Term function, List<Term> arguments) implements Syntax {
        public FunctionCall {
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.FUNCTION_CALL;
        }

        @Override
        public List<Term> children() {
            return concat(function, arguments);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, arguments.size() + 1, kind());
            return new FunctionCall(children.get(0), children.subList(1, children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /** A function definition. Anonymous functions have no id. */
    record Function(@Nullable Term id, @Nullable Term params, Term body) implements Syntax {
        public Function {
            Objects.requireNonNull(body, "body");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.FUNCTION;
        }

        @Override
        public List<Term> children() {
            List<Term> all = new ArrayList<>(3);
            if (id != null) {
                all.add(id);
            }
            if (params != null) {
                all.add(params);
            }
            all.add(body);
            return Collections.unmodifiableList(all);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, children().size(), kind());
            int i = 0;
            Term newId = id != null ? children.get(i++) : null;
            Term newParams = params != null ? children.get(i++) : null;
            return new Function(newId, newParams, children.get(i));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    /** The target may itself be a member access. */
    record Assignment(Term target, Term value) implements Syntax {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.ASSIGNMENT;
        }

        @Override
        public List<Term> children() {
            return List.of(target, value);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 2, kind());
            return new Assignment(children.get(0), children.get(1));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /** {@code object.property} */
    record MemberAccess(Term object, Term property) implements Syntax {
        public MemberAccess {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(property, "property");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.MEMBER_ACCESS;
        }

        @Override
        public List<Term> children() {
            return List.of(object, property);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 2, kind());
            return new MemberAccess(children.get(0), children.get(1));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitMemberAccess(this);
        }
    }

    /** {@code target.method(arguments)} */
    record MethodCall(Term target, Term method, List<Term> arguments) implements Syntax {
        public MethodCall {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(method, "method");
            arguments = List.copyOf(arguments);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.METHOD_CALL;
        }

        @Override
        public List<Term> children() {
            List<Term> all = new ArrayList<>(arguments.size() + 2);
            all.add(target);
            all.add(method);
            all.addAll(arguments);
            return Collections.unmodifiableList(all);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, arguments.size() + 2, kind());
            return new MethodCall(children.get(0), children.get(1), children.subList(2, children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitMethodCall(this);
        }
    }

    /** A condition followed by its branches (then, else-if chains, else). */
    record If(Term condition, List<Term> branches) implements Syntax {
        public If {
            Objects.requireNonNull(condition, "condition");
            branches = List.copyOf(branches);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.IF;
        }

        @Override
        public List<Term> children() {
            return concat(condition, branches);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, branches.size() + 1, kind());
            return new If(children.get(0), children.subList(1, children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /** Operator application; operands include the operator token itself. */
    record Operator(List<Term> operands) implements Syntax {
        public Operator {
            operands = List.copyOf(operands);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.OPERATOR;
        }

        @Override
        public List<Term> children() {
            return operands;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new Operator(requireArity(children, operands.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitOperator(this);
        }
    }

    /** Placeholder for unparseable input, holding whatever was recovered. */
    record ParseError(List<Term> recovered) implements Syntax {
        public ParseError {
            recovered = List.copyOf(recovered);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.PARSE_ERROR;
        }

        @Override
        public List<Term> children() {
            return recovered;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new ParseError(requireArity(children, recovered.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitParseError(this);
        }
    }

    /** A key/value pair, e.g. an object literal member. */
    record Pair(Term key, Term value) implements Syntax {
        public Pair {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.PAIR;
        }

        @Override
        public List<Term> children() {
            return List.of(key, value);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 2, kind());
            return new Pair(children.get(0), children.get(1));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitPair(this);
        }
    }

    /** Subject expressions followed by the case clauses. */
    record Switch(List<Term> subject, List<Term> cases) implements Syntax {
        public Switch {
            subject = List.copyOf(subject);
            cases = List.copyOf(cases);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.SWITCH;
        }

        @Override
        public List<Term> children() {
            List<Term> all = new ArrayList<>(subject);
            all.addAll(cases);
            return Collections.unmodifiableList(all);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, subject.size() + cases.size(), kind());
            return new Switch(children.subList(0, subject.size()),
                    children.subList(subject.size(), children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitSwitch(this);
        }
    }

    record Case(Term expression, List<Term> body) implements Syntax {
        public Case {
            Objects.requireNonNull(expression, "expression");
            body = List.copyOf(body);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.CASE;
        }

        @Override
        public List<Term> children() {
            return concat(expression, body);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, body.size() + 1, kind());
            return new Case(children.get(0), children.subList(1, children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitCase(this);
        }
    }

    record While(Term condition, List<Term> body) implements Syntax {
        public While {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.WHILE;
        }

        @Override
        public List<Term> children() {
            return concat(condition, body);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, body.size() + 1, kind());
            return new While(children.get(0), children.subList(1, children.size()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record Return(List<Term> values) implements Syntax {
        public Return {
            values = List.copyOf(values);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.RETURN;
        }

        @Override
        public List<Term> children() {
            return values;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new Return(requireArity(children, values.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Yield(List<Term> values) implements Syntax {
        public Yield {
            values = List.copyOf(values);
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.YIELD;
        }

        @Override
        public List<Term> children() {
            return values;
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            return new Yield(requireArity(children, values.size(), kind()));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record Throw(Term expression) implements Syntax {
        public Throw {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public SyntaxKind kind() {
            return SyntaxKind.THROW;
        }

        @Override
        public List<Term> children() {
            return List.of(expression);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, 1, kind());
            return new Throw(children.get(0));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitThrow(this);
        }
    }

    record Break(@Nullable Term label) implements Syntax {
        @Override
        public SyntaxKind kind() {
            return SyntaxKind.BREAK;
        }

        @Override
        public List<Term> children() {
            return label == null ? List.of() : List.of(label);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, label == null ? 0 : 1, kind());
            return new Break(children.isEmpty() ? null : children.get(0));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(@Nullable Term label) implements Syntax {
        @Override
        public SyntaxKind kind() {
            return SyntaxKind.CONTINUE;
        }

        @Override
        public List<Term> children() {
            return label == null ? List.of() : List.of(label);
        }

        @Override
        public Syntax withChildren(List<Term> children) {
            requireArity(children, label == null ? 0 : 1, kind());
            return new Continue(children.isEmpty() ? null : children.get(0));
        }

        @Override
        public <R> R accept(SyntaxVisitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }
}
