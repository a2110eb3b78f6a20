package im.arun.markuptree.render;

import im.arun.markuptree.model.AttributeStore;
import im.arun.markuptree.model.AttributeStyle;
import im.arun.markuptree.model.CompositeNode;
import im.arun.markuptree.model.LeafNode;
import im.arun.markuptree.model.Node;
import im.arun.markuptree.model.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node tree back to markup in the compact, indented or line-per-node format.
 * Traversal is pre-order and depth-first; the indentation level is always passed down
 * explicitly.
 */
public class MarkupRenderer {
    private final FormattingMode mode;
    private final RenderOptions options;

    public MarkupRenderer(FormattingMode mode, RenderOptions options) {
        if (mode == FormattingMode.RECONSTRUCTION_SOURCE) {
            throw new IllegalArgumentException("Reconstruction source is produced by SourceGenerator");
        }
        this.mode = mode;
        this.options = options;
    }

    public String render(Node node, int indentLevel) {
        if (mode == FormattingMode.COMPACT) {
            StringBuilder sb = new StringBuilder();
            appendCompact(node, sb);
            return sb.toString();
        }
        List<String> lines = new ArrayList<>();
        appendLines(node, Math.max(indentLevel, 0), lines);
        return String.join("\n", lines);
    }

    private void appendCompact(Node node, StringBuilder sb) {
        node.accept(new NodeVisitor<Void>() {
            @Override
            public Void visitLeaf(LeafNode leaf) {
                sb.append(renderLeaf(leaf));
                return null;
            }

            @Override
            public Void visitComposite(CompositeNode composite) {
                boolean named = !composite.getTag().isEmpty();
                if (named) {
                    sb.append(openTag(composite.getTag(), composite.getAttributes()));
                }
                for (Node child : composite) {
                    appendCompact(child, sb);
                }
                if (named) {
                    sb.append(closeTag(composite.getTag()));
                }
                return null;
            }
        });
    }

    private void appendLines(Node node, int level, List<String> lines) {
        node.accept(new NodeVisitor<Void>() {
            @Override
            public Void visitLeaf(LeafNode leaf) {
                lines.add(indent(level) + renderLeaf(leaf));
                return null;
            }

            @Override
            public Void visitComposite(CompositeNode composite) {
                // anonymous wrappers contribute no line and no nesting level
                if (composite.getTag().isEmpty()) {
                    for (Node child : composite) {
                        appendLines(child, level, lines);
                    }
                    return null;
                }
                lines.add(indent(level) + openTag(composite.getTag(), composite.getAttributes()));
                for (Node child : composite) {
                    appendLines(child, level + 1, lines);
                }
                lines.add(indent(level) + closeTag(composite.getTag()));
                return null;
            }
        });
    }

    static String renderLeaf(LeafNode leaf) {
        switch (leaf.getKind()) {
            case VOID:
                return "<" + leaf.getTag() + attributeSuffix(leaf.getAttributes()) + "/>";
            case TEXT:
                return leaf.getPayload();
            case COMMENT:
                return "<!--" + leaf.getPayload() + "-->";
            case NORMAL:
            default:
                return openTag(leaf.getTag(), leaf.getAttributes()) + leaf.getPayload() + closeTag(leaf.getTag());
        }
    }

    private static String openTag(String tag, AttributeStore attributes) {
        return "<" + tag + attributeSuffix(attributes) + ">";
    }

    private static String closeTag(String tag) {
        return "</" + tag + ">";
    }

    private static String attributeSuffix(AttributeStore attributes) {
        if (attributes.isEmpty()) {
            return "";
        }
        return " " + attributes.render(AttributeStyle.MARKUP, FormattingMode.COMPACT, 0);
    }

    private String indent(int level) {
        return mode == FormattingMode.INDENTED ? options.getIndentUnit().repeat(level) : "";
    }
}
