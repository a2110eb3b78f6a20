package im.arun.markuptree.model;

import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.render.Serializer;

/**
 * A child of a {@link CompositeNode}: either a {@link LeafNode} or a {@link CompositeNode}.
 * <p>
 * The hierarchy is closed. The constructor is package-private, so those two classes are
 * the only variants, and consumers dispatch through {@link #accept(NodeVisitor)} so that
 * both cases are always handled.
 */
public abstract class Node {

    /**
     * Returned by every search operation when nothing matches. Never a valid index.
     */
    public static final int NPOS = -1;

    Node() {
    }

    public abstract <R> R accept(NodeVisitor<R> visitor);

    public abstract String getTag();

    public abstract void setTag(String tag);

    public abstract AttributeStore getAttributes();

    public abstract void setAttributes(AttributeStore attributes);

    /**
     * Deep copy. Nodes are copied whenever they are inserted into a tree.
     */
    public abstract Node copy();

    public abstract boolean isLeaf();

    public boolean isComposite() {
        return !isLeaf();
    }

    public LeafNode asLeaf() {
        return accept(new NodeVisitor<LeafNode>() {
            @Override
            public LeafNode visitLeaf(LeafNode leaf) {
                return leaf;
            }

            @Override
            public LeafNode visitComposite(CompositeNode composite) {
                throw new WrongVariantException("Expected a leaf node but found composite <" + composite.getTag() + ">");
            }
        });
    }

    public CompositeNode asComposite() {
        return accept(new NodeVisitor<CompositeNode>() {
            @Override
            public CompositeNode visitLeaf(LeafNode leaf) {
                throw new WrongVariantException("Expected a composite node but found leaf <" + leaf.getTag() + ">");
            }

            @Override
            public CompositeNode visitComposite(CompositeNode composite) {
                return composite;
            }
        });
    }

    /**
     * Renders this node and everything below it.
     */
    public String get(FormattingMode mode, int indentLevel) {
        return Serializer.render(this, mode, indentLevel);
    }

    public String get() {
        return get(FormattingMode.COMPACT, 0);
    }
}
