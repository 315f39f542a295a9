package com.raditha.treediff.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.raditha.treediff.model.ByteRange;
import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Info;
import com.raditha.treediff.model.Span;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds syntax trees from Java source with JavaParser.
 * <p>
 * Every JavaParser node becomes one term, annotated with its byte range,
 * line span and category from {@link JavaCategories}; the variant is
 * chosen by a {@link TermAssignment}. Source that does not parse is not an
 * error: the result is a parse-error root holding whatever was recovered.
 */
public class JavaSourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceParser.class);

    private final TermAssignment assignment;
    private final ParserConfiguration configuration;

    public JavaSourceParser() {
        this(new DefaultTermAssignment());
    }

    public JavaSourceParser(TermAssignment assignment) {
        this.assignment = assignment;
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * Read and parse a source file as UTF-8.
     *
     * @throws IOException if the file cannot be read
     */
    public Term parse(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Parse source text.
     */
    public Term parse(String source) {
        SourceText text = new SourceText(source);
        // JavaParser instances are not thread-safe; one per call
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        Optional<CompilationUnit> unit = result.getResult();

        if (result.isSuccessful() && unit.isPresent()) {
            return toTerm(unit.get(), text);
        }
        logger.debug("Source did not parse cleanly: {}", result.getProblems());
        List<Term> recovered = new ArrayList<>();
        unit.ifPresent(cu -> recovered.add(toTerm(cu, text)));
        Info info = new Info(new ByteRange(0, text.byteOffset(text.length())), wholeSpan(text), Category.PARSE_ERROR);
        return new Term(info, new Syntax.ParseError(recovered));
    }

    private Term toTerm(Node node, SourceText text) {
        List<Node> childNodes = new ArrayList<>(node.getChildNodes());
        childNodes.sort(Node.NODE_BY_BEGIN_POSITION);

        List<Term> children = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            children.add(toTerm(child, text));
        }

        int start = 0;
        int end = text.length();
        Span span = Span.unknown();
        Optional<Range> range = node.getRange();
        if (range.isPresent()) {
            start = text.charOffset(range.get().begin);
            end = Math.max(start, Math.min(text.length(), text.charOffset(range.get().end) + 1));
            span = new Span(range.get().begin.line, range.get().begin.column,
                    range.get().end.line, range.get().end.column + 1);
        }
        Category category = JavaCategories.categoryOf(node);
        String source = text.slice(start, end);
        Info info = new Info(new ByteRange(text.byteOffset(start), text.byteOffset(end)), span, category);

        Syntax syntax = assignment.assign(source, category, children, () -> withOperatorToken(node, children));
        return new Term(info, syntax);
    }

    /**
     * JavaParser keeps operator symbols as fields; put them back between the
     * operands as leaves.
     */
    private static List<Term> withOperatorToken(Node node, List<Term> children) {
        List<Term> all = new ArrayList<>(children);
        if (node instanceof BinaryExpr binary && children.size() == 2) {
            all.add(1, Term.leaf(Category.OTHER, binary.getOperator().asString()));
        } else if (node instanceof UnaryExpr unary && children.size() == 1) {
            Term symbol = Term.leaf(Category.OTHER, unary.getOperator().asString());
            if (unary.isPrefix()) {
                all.add(0, symbol);
            } else {
                all.add(symbol);
            }
        }
        return all;
    }

    private static Span wholeSpan(SourceText text) {
        String s = text.text();
        int lines = 1;
        int lastLineStart = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                lines++;
                lastLineStart = i + 1;
            }
        }
        return new Span(1, 1, lines, s.length() - lastLineStart + 1);
    }
}
