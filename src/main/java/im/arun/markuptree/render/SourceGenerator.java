package im.arun.markuptree.render;

import im.arun.markuptree.model.Attribute;
import im.arun.markuptree.model.AttributeStore;
import im.arun.markuptree.model.CompositeNode;
import im.arun.markuptree.model.LeafNode;
import im.arun.markuptree.model.Node;
import im.arun.markuptree.model.NodeKind;
import im.arun.markuptree.model.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits Java statements that rebuild a node tree through the public model API.
 * <p>
 * Nodes are named {@code node0}, {@code node1}, ... in pre-order. A composite is declared
 * first; each child is then declared, completed and pushed into it, so every
 * {@code pushBack} copies a finished subtree. With {@link RenderOptions#isIncludeEntryPoint()}
 * the statements are wrapped in a runnable {@code Main} class that prints the result.
 */
public class SourceGenerator {
    static final String ENTRY_POINT_CLASS = "Main";
    private static final String IDENTIFIER_PREFIX = "node";

    private final RenderOptions options;

    public SourceGenerator(RenderOptions options) {
        this.options = options;
    }

    public String generate(Node root, int indentLevel) {
        List<String> statements = new ArrayList<>();
        String rootId = emit(root, statements, new int[]{0});

        int level = Math.max(indentLevel, 0);
        List<String> lines = new ArrayList<>();
        if (options.isIncludeEntryPoint()) {
            lines.add(indent(level) + "import im.arun.markuptree.model.Attribute;");
            lines.add(indent(level) + "import im.arun.markuptree.model.AttributeStore;");
            lines.add(indent(level) + "import im.arun.markuptree.model.CompositeNode;");
            lines.add(indent(level) + "import im.arun.markuptree.model.LeafNode;");
            lines.add(indent(level) + "import im.arun.markuptree.model.NodeKind;");
            lines.add(indent(level) + "import im.arun.markuptree.render.FormattingMode;");
            lines.add("");
            lines.add(indent(level) + "public final class " + ENTRY_POINT_CLASS + " {");
            lines.add(indent(level + 1) + "public static void main(String[] args) {");
            for (String statement : statements) {
                lines.add(indent(level + 2) + statement);
            }
            lines.add(indent(level + 2) + "System.out.println(" + rootId + ".get(FormattingMode.INDENTED, 0));");
            lines.add(indent(level + 1) + "}");
            lines.add(indent(level) + "}");
        } else {
            for (String statement : statements) {
                lines.add(indent(level) + statement);
            }
        }
        return String.join("\n", lines);
    }

    private String emit(Node node, List<String> statements, int[] counter) {
        String id = IDENTIFIER_PREFIX + counter[0]++;
        node.accept(new NodeVisitor<Void>() {
            @Override
            public Void visitLeaf(LeafNode leaf) {
                if (leaf.getTag().isEmpty() && leaf.getKind() != NodeKind.TEXT) {
                    // the constructors reject an untagged non-text leaf, only the setters allow it
                    statements.add("LeafNode " + id + " = LeafNode.text(" + literal(leaf.getPayload()) + ");");
                    if (!leaf.getAttributes().isEmpty()) {
                        statements.add(id + ".setAttributes(" + attributes(leaf.getAttributes()) + ");");
                    }
                    statements.add(id + ".setKind(NodeKind." + leaf.getKind().name() + ");");
                    return null;
                }
                statements.add("LeafNode " + id + " = new LeafNode("
                        + literal(leaf.getTag()) + ", "
                        + attributes(leaf.getAttributes()) + ", "
                        + literal(leaf.getPayload()) + ", "
                        + "NodeKind." + leaf.getKind().name() + ");");
                return null;
            }

            @Override
            public Void visitComposite(CompositeNode composite) {
                statements.add("CompositeNode " + id + " = new CompositeNode("
                        + literal(composite.getTag()) + ", "
                        + attributes(composite.getAttributes()) + ");");
                for (Node child : composite) {
                    String childId = emit(child, statements, counter);
                    statements.add(id + ".pushBack(" + childId + ");");
                }
                return null;
            }
        });
        return id;
    }

    private static String attributes(AttributeStore store) {
        if (store.isEmpty()) {
            return "new AttributeStore()";
        }
        List<String> parts = new ArrayList<>();
        for (Attribute attribute : store) {
            parts.add("new Attribute(" + literal(attribute.getKey()) + ", " + literal(attribute.getValue()) + ")");
        }
        return "AttributeStore.of(" + String.join(", ", parts) + ")";
    }

    static String literal(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private String indent(int level) {
        return options.getIndentUnit().repeat(level);
    }
}
