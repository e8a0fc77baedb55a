package com.rulebook.graph;

import com.rulebook.formula.ast.BinaryOp;
import com.rulebook.formula.ast.Concat;
import com.rulebook.formula.ast.FieldRef;
import com.rulebook.formula.ast.FormulaNode;
import com.rulebook.formula.ast.FormulaVisitor;
import com.rulebook.formula.ast.FuncCall;
import com.rulebook.formula.ast.LiteralBool;
import com.rulebook.formula.ast.LiteralInt;
import com.rulebook.formula.ast.LiteralString;
import com.rulebook.formula.ast.UnaryOp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the provenance graph of a parsed formula.
 * <p>
 * Nodes are numbered in post-order, operands before their consumer, so the same
 * tree always yields the same ids and the same {@code template_hash}.
 */
public class GraphExporter {

    static final String CONCAT = "CONCAT";

    /**
     * @param ast       Parsed formula
     * @param fieldName Calculated field the formula defines
     * @param formula   Formula text, part of the hashed content
     */
    public ProvenanceGraph export(FormulaNode ast, String fieldName, String formula) {
        Arena arena = new Arena();
        String root = ast.accept(arena);

        Map<String, NodeDescriptor> nodes = new LinkedHashMap<>();
        for (int i = 0; i < arena.nodes.size(); i++) {
            nodes.put(nodeId(arena.nodes.get(i).kind(), i), arena.nodes.get(i));
        }
        List<List<String>> edges = new ArrayList<>(arena.edges);

        String resultId = "n_result_" + fieldName;
        nodes.put(resultId, NodeDescriptor.result(fieldName, root));
        edges.add(List.of(root, resultId));

        String templateHash = TemplateHasher.templateHash(nodes, edges, formula);
        return new ProvenanceGraph(fieldName, formula, resultId, nodes, edges, arena.nodes, templateHash);
    }

    /**
     * Id of the arena node at {@code index}.
     */
    public static String nodeId(NodeKind kind, int index) {
        return "n_" + kind.idPrefix() + "_" + (index + 1);
    }

    /**
     * Appends nodes in post-order; each visit returns the id of the node it added.
     */
    private static final class Arena implements FormulaVisitor<String> {

        private final List<NodeDescriptor> nodes = new ArrayList<>();
        private final List<List<String>> edges = new ArrayList<>();

        private String add(NodeDescriptor node) {
            nodes.add(node);
            String id = nodeId(node.kind(), nodes.size() - 1);
            if (node.args() != null) {
                for (String arg : node.args()) {
                    edges.add(List.of(arg, id));
                }
            }
            return id;
        }

        private List<String> visitAll(List<FormulaNode> operands) {
            List<String> ids = new ArrayList<>();
            for (FormulaNode operand : operands) {
                ids.add(operand.accept(this));
            }
            return ids;
        }

        @Override
        public String visitBool(LiteralBool node) {
            return add(NodeDescriptor.constant(node.value(), "boolean"));
        }

        @Override
        public String visitInt(LiteralInt node) {
            return add(NodeDescriptor.constant(node.value(), "integer"));
        }

        @Override
        public String visitString(LiteralString node) {
            return add(NodeDescriptor.constant(node.value(), "string"));
        }

        @Override
        public String visitFieldRef(FieldRef node) {
            return add(NodeDescriptor.fieldRef(node.name()));
        }

        @Override
        public String visitUnary(UnaryOp node) {
            String operand = node.operand().accept(this);
            return add(NodeDescriptor.function(node.op().symbol(), List.of(operand)));
        }

        @Override
        public String visitBinary(BinaryOp node) {
            String left = node.left().accept(this);
            String right = node.right().accept(this);
            return add(NodeDescriptor.operator(node.op().symbol(), List.of(left, right)));
        }

        @Override
        public String visitConcat(Concat node) {
            return add(NodeDescriptor.operator(CONCAT, visitAll(node.parts())));
        }

        @Override
        public String visitFuncCall(FuncCall node) {
            return add(NodeDescriptor.function(node.name(), visitAll(node.args())));
        }
    }
}
