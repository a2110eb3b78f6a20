package im.arun.markuptree.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Terminal node of the tree: a tag, its attributes, an optional text payload and a
 * {@link NodeKind} that decides how it is rendered.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class LeafNode extends Node {
    private String tag;
    private AttributeStore attributes;
    private String payload;
    private NodeKind kind;

    public LeafNode(String tag) {
        this(tag, new AttributeStore(), "", NodeKind.NORMAL);
    }

    public LeafNode(String tag, AttributeStore attributes) {
        this(tag, attributes, "", NodeKind.NORMAL);
    }

    public LeafNode(String tag, AttributeStore attributes, String payload) {
        this(tag, attributes, payload, NodeKind.NORMAL);
    }

    public LeafNode(String tag, AttributeStore attributes, String payload, NodeKind kind) {
        NodeKind effectiveKind = kind != null ? kind : NodeKind.NORMAL;
        if (effectiveKind != NodeKind.TEXT && (tag == null || tag.isEmpty())) {
            throw new IllegalArgumentException("Leaf node of kind " + effectiveKind + " requires a tag");
        }
        this.tag = tag != null ? tag : "";
        this.attributes = attributes != null ? attributes.copy() : new AttributeStore();
        this.payload = payload != null ? payload : "";
        this.kind = effectiveKind;
    }

    private LeafNode(LeafNode other) {
        this.tag = other.tag;
        this.attributes = other.attributes.copy();
        this.payload = other.payload;
        this.kind = other.kind;
    }

    /**
     * Creates a text leaf that renders its payload verbatim.
     */
    public static LeafNode text(String payload) {
        return new LeafNode("", new AttributeStore(), payload, NodeKind.TEXT);
    }

    public static LeafNode comment(String payload) {
        return new LeafNode("!--", new AttributeStore(), payload, NodeKind.COMMENT);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLeaf(this);
    }

    @Override
    public void setTag(String tag) {
        this.tag = tag != null ? tag : "";
    }

    @Override
    public void setAttributes(AttributeStore attributes) {
        this.attributes = attributes != null ? attributes.copy() : new AttributeStore();
    }

    public void setPayload(String payload) {
        this.payload = payload != null ? payload : "";
    }

    public void setKind(NodeKind kind) {
        this.kind = kind != null ? kind : NodeKind.NORMAL;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public LeafNode copy() {
        return new LeafNode(this);
    }
}
