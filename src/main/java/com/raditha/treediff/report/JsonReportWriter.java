package com.raditha.treediff.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.treediff.analyzer.DiffReport;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.matching.Mapping;
import com.raditha.treediff.matching.MatchStats;
import com.raditha.treediff.script.Edit;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a diff as JSON. Trees are flattened into DTOs so only positions
 * and labels are serialized, never the node graph.
 */
public class JsonReportWriter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Whole report.
     */
    public record ReportDTO(
            String summary,
            MatchStats stats,
            boolean changed,
            List<EditDTO> edits,
            List<PairDTO> mapping) {
    }

    public record EditDTO(
            String type,
            NodeDTO oldNode,
            NodeDTO newNode,
            Boolean moved,
            Integer covered,
            List<EditDTO> children) {
    }

    public record NodeDTO(
            int index,
            String category,
            String kind,
            String text,
            int startLine,
            int endLine,
            int startByte,
            int endByte) {
    }

    public record PairDTO(int oldIndex, int newIndex) {
    }

    public ReportDTO toDTO(DiffReport report, boolean includeMapping) {
        List<EditDTO> edits = new ArrayList<>();
        for (Edit edit : report.script().edits()) {
            edits.add(toDTO(edit));
        }
        return new ReportDTO(
                report.getSummary(),
                report.stats(),
                report.hasChanges(),
                edits,
                includeMapping ? pairs(report.mapping()) : null);
    }

    public String toJson(DiffReport report, boolean includeMapping) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(report, includeMapping));
    }

    public void write(DiffReport report, boolean includeMapping, Writer out) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(out, toDTO(report, includeMapping));
    }

    public void write(DiffReport report, boolean includeMapping, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toDTO(report, includeMapping));
    }

    private EditDTO toDTO(Edit edit) {
        List<EditDTO> children = new ArrayList<>();
        for (Edit child : edit.children()) {
            children.add(toDTO(child));
        }
        List<EditDTO> nested = children.isEmpty() ? null : children;

        if (edit instanceof Edit.Copy copy) {
            return new EditDTO("copy", node(copy.oldNode()), node(copy.newNode()), copy.moved(), null, nested);
        } else if (edit instanceof Edit.Replace replace) {
            return new EditDTO("replace", node(replace.oldNode()), node(replace.newNode()), null, null, nested);
        } else if (edit instanceof Edit.Insert insert) {
            return new EditDTO("insert", null, node(insert.newNode()), null, insert.covered().size(), nested);
        }
        Edit.Delete delete = (Edit.Delete) edit;
        return new EditDTO("delete", node(delete.oldNode()), null, null, delete.covered().size(), null);
    }

    private static NodeDTO node(TreeNode node) {
        var info = node.term().info();
        String text = node.isLeaf() ? node.term().syntax().payload() : null;
        return new NodeDTO(
                node.index(),
                node.category().name(),
                node.kind().name(),
                text == null || text.isEmpty() ? null : text,
                info.span().startLine(),
                info.span().endLine(),
                info.range().start(),
                info.range().end());
    }

    private static List<PairDTO> pairs(Mapping mapping) {
        List<PairDTO> pairs = new ArrayList<>(mapping.size());
        for (Mapping.Pair pair : mapping.pairs()) {
            pairs.add(new PairDTO(pair.oldNode().index(), pair.newNode().index()));
        }
        return pairs;
    }
}
