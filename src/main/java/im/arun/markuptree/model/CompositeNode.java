package im.arun.markuptree.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Node holding an ordered sequence of children, each a {@link LeafNode} or another
 * {@link CompositeNode}.
 * <p>
 * The node owns its children exclusively: everything passed in is copied, and the
 * accessors hand out the stored child so it can be changed in place. A composite with
 * an empty tag is an anonymous wrapper that renders only its children.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class CompositeNode extends Node implements Iterable<Node> {
    private String tag;
    private AttributeStore attributes;
    @Getter(AccessLevel.NONE)
    private final List<Node> children = new ArrayList<>();

    public CompositeNode() {
        this("", new AttributeStore());
    }

    public CompositeNode(String tag) {
        this(tag, new AttributeStore());
    }

    public CompositeNode(String tag, AttributeStore attributes) {
        this.tag = tag != null ? tag : "";
        this.attributes = attributes != null ? attributes.copy() : new AttributeStore();
    }

    public CompositeNode(String tag, AttributeStore attributes, Node... children) {
        this(tag, attributes);
        for (Node child : children) {
            pushBack(child);
        }
    }

    public CompositeNode(String tag, AttributeStore attributes, Collection<? extends Node> children) {
        this(tag, attributes);
        pushBackAll(children);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComposite(this);
    }

    @Override
    public void setTag(String tag) {
        this.tag = tag != null ? tag : "";
    }

    @Override
    public void setAttributes(AttributeStore attributes) {
        this.attributes = attributes != null ? attributes.copy() : new AttributeStore();
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    // -- mutation --

    public void pushFront(Node node) {
        children.add(0, node.copy());
    }

    public void pushBack(Node node) {
        children.add(node.copy());
    }

    /**
     * Appends an attribute to this node's own attribute store.
     */
    public void pushBack(Attribute attribute) {
        attributes.pushBack(attribute);
    }

    public void pushBackAll(Collection<? extends Node> nodes) {
        for (Node node : nodes) {
            pushBack(node);
        }
    }

    public void insert(int index, Node node) {
        if (index < 0 || index > children.size()) {
            throw outOfRange(index);
        }
        children.add(index, node.copy());
    }

    public void erase(int index) {
        checkIndex(index);
        children.remove(index);
    }

    /**
     * Removes the first child structurally equal to {@code node}.
     *
     * @return whether a child was removed
     */
    public boolean erase(Node node) {
        return children.remove(node);
    }

    public void set(int index, Node node) {
        checkIndex(index);
        children.set(index, node.copy());
    }

    public void swap(int first, int second) {
        checkIndex(first);
        checkIndex(second);
        Collections.swap(children, first, second);
    }

    public void clear() {
        children.clear();
    }

    // -- access --

    public Node nodeAt(int index) {
        checkIndex(index);
        return children.get(index);
    }

    /**
     * Leaf child at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     * @throws WrongVariantException if the child is a composite
     */
    public LeafNode at(int index) {
        return nodeAt(index).asLeaf();
    }

    /**
     * Composite child at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     * @throws WrongVariantException if the child is a leaf
     */
    public CompositeNode atSection(int index) {
        return nodeAt(index).asComposite();
    }

    public LeafNode front() {
        return first().asLeaf();
    }

    public LeafNode back() {
        return last().asLeaf();
    }

    public CompositeNode frontSection() {
        return first().asComposite();
    }

    public CompositeNode backSection() {
        return last().asComposite();
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Live, read-only view of the children.
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * The leaf children in their original relative order. Computed on every call.
     */
    public List<LeafNode> getElements() {
        List<LeafNode> elements = new ArrayList<>();
        for (Node child : children) {
            child.accept(new NodeVisitor<Void>() {
                @Override
                public Void visitLeaf(LeafNode leaf) {
                    elements.add(leaf);
                    return null;
                }

                @Override
                public Void visitComposite(CompositeNode composite) {
                    return null;
                }
            });
        }
        return elements;
    }

    /**
     * The composite children in their original relative order. Computed on every call.
     */
    public List<CompositeNode> getSections() {
        List<CompositeNode> sections = new ArrayList<>();
        for (Node child : children) {
            child.accept(new NodeVisitor<Void>() {
                @Override
                public Void visitLeaf(LeafNode leaf) {
                    return null;
                }

                @Override
                public Void visitComposite(CompositeNode composite) {
                    sections.add(composite);
                    return null;
                }
            });
        }
        return sections;
    }

    // -- search --

    public int find(Node criteria) {
        return find(criteria, 0, Finder.DEFAULT_NODE_FLAGS);
    }

    public int find(Node criteria, int begin) {
        return find(criteria, begin, Finder.DEFAULT_NODE_FLAGS);
    }

    public int find(Node criteria, int begin, Set<FindFlag> flags) {
        return Finder.find(children, begin, Finder.matching(criteria, flags));
    }

    public int find(String text) {
        return find(text, 0, Finder.DEFAULT_NODE_FLAGS);
    }

    public int find(String text, int begin) {
        return find(text, begin, Finder.DEFAULT_NODE_FLAGS);
    }

    public int find(String text, int begin, Set<FindFlag> flags) {
        return Finder.find(children, begin, Finder.matching(text, flags));
    }

    public int find(Attribute criteria) {
        return find(criteria, 0, Finder.DEFAULT_ATTRIBUTE_FLAGS);
    }

    public int find(Attribute criteria, int begin, Set<FindFlag> flags) {
        return Finder.find(children, begin, Finder.matching(criteria, flags));
    }

    public int find(AttributeStore criteria) {
        return find(criteria, 0, Finder.DEFAULT_ATTRIBUTE_FLAGS);
    }

    public int find(AttributeStore criteria, int begin, Set<FindFlag> flags) {
        return Finder.find(children, begin, Finder.matching(criteria, flags));
    }

    @Override
    public Iterator<Node> iterator() {
        return getChildren().iterator();
    }

    @Override
    public CompositeNode copy() {
        return new CompositeNode(tag, attributes, children);
    }

    private Node first() {
        if (children.isEmpty()) {
            throw new NoSuchElementException("Composite <" + tag + "> has no children");
        }
        return children.get(0);
    }

    private Node last() {
        if (children.isEmpty()) {
            throw new NoSuchElementException("Composite <" + tag + "> has no children");
        }
        return children.get(children.size() - 1);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= children.size()) {
            throw outOfRange(index);
        }
    }

    private IndexOutOfBoundsException outOfRange(int index) {
        return new IndexOutOfBoundsException("Index " + index + " out of range for " + children.size() + " children");
    }
}
