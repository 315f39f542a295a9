package com.raditha.treediff.report;

import com.raditha.treediff.analyzer.DiffReport;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.matching.Mapping;
import com.raditha.treediff.script.Edit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a diff as an indented text tree, one edit per line.
 * <pre>
 *   =  copy        CLASS:INDEXED L1-20
 *   ~  replace     IDENTIFIER:LEAF "b" -> "c" L4
 *   +  insert      EXPRESSION_STATEMENT:INDEXED L7 (3 nodes)
 *   -  delete      RETURN:RETURN L9 (2 nodes)
 *   >  move        BLOCK:INDEXED L12-15
 * </pre>
 */
public class EditScriptRenderer {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT = 40;

    public String render(DiffReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(report.getSummary()).append("\n\n");

        Deque<Line> stack = new ArrayDeque<>();
        List<Edit> top = report.script().edits();
        for (int i = top.size() - 1; i >= 0; i--) {
            stack.push(new Line(top.get(i), 0));
        }
        while (!stack.isEmpty()) {
            Line line = stack.pop();
            render(line.edit(), line.depth(), sb);
            List<Edit> children = line.edit().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Line(children.get(i), line.depth() + 1));
            }
        }
        return sb.toString();
    }

    /**
     * Mapped pairs, one per line, in old pre-order.
     */
    public String renderMapping(Mapping mapping) {
        StringBuilder sb = new StringBuilder();
        for (Mapping.Pair pair : mapping.pairs()) {
            sb.append(describe(pair.oldNode())).append("  <->  ").append(describe(pair.newNode())).append("\n");
        }
        return sb.toString();
    }

    private void render(Edit edit, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth));
        if (edit instanceof Edit.Copy copy) {
            sb.append(copy.moved() ? ">  move     " : "=  copy     ").append(describe(copy.newNode()));
        } else if (edit instanceof Edit.Replace replace) {
            sb.append("~  replace  ").append(describe(replace.oldNode()))
                    .append(" -> ").append(describe(replace.newNode()));
        } else if (edit instanceof Edit.Insert insert) {
            sb.append("+  insert   ").append(describe(insert.newNode()))
                    .append(" (").append(insert.covered().size()).append(" nodes)");
        } else if (edit instanceof Edit.Delete delete) {
            sb.append("-  delete   ").append(describe(delete.oldNode()))
                    .append(" (").append(delete.covered().size()).append(" nodes)");
        }
        sb.append("\n");
    }

    private record Line(Edit edit, int depth) {
    }

    static String describe(TreeNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.category()).append(':').append(node.kind());
        if (node.isLeaf()) {
            String text = node.term().syntax().payload().strip().replace('\n', ' ');
            if (!text.isEmpty()) {
                if (text.length() > MAX_TEXT) {
                    text = text.substring(0, MAX_TEXT - 3) + "...";
                }
                sb.append(" \"").append(text).append('"');
            }
        }
        sb.append(' ').append(node.term().info().span().toDisplayString());
        return sb.toString();
    }
}
