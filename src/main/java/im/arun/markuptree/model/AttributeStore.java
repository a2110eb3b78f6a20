package im.arun.markuptree.model;

import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.render.RenderOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered collection of attributes.
 * Insertion order is kept and duplicate keys are allowed; callers that need
 * last-wins semantics have to dedupe themselves.
 */
public class AttributeStore implements Iterable<Attribute> {
    private final List<Attribute> attributes = new ArrayList<>();

    public AttributeStore() {
    }

    public AttributeStore(List<Attribute> attributes) {
        if (attributes != null) {
            for (Attribute attribute : attributes) {
                pushBack(attribute);
            }
        }
    }

    public static AttributeStore of(Attribute... attributes) {
        AttributeStore store = new AttributeStore();
        for (Attribute attribute : attributes) {
            store.pushBack(attribute);
        }
        return store;
    }

    public void pushFront(Attribute attribute) {
        attributes.add(0, new Attribute(attribute));
    }

    public void pushBack(Attribute attribute) {
        attributes.add(new Attribute(attribute));
    }

    public void insert(int index, Attribute attribute) {
        if (index < 0 || index > attributes.size()) {
            throw outOfRange(index);
        }
        attributes.add(index, new Attribute(attribute));
    }

    public void erase(int index) {
        checkIndex(index);
        attributes.remove(index);
    }

    public Attribute at(int index) {
        checkIndex(index);
        return attributes.get(index);
    }

    public void set(int index, Attribute attribute) {
        checkIndex(index);
        attributes.set(index, new Attribute(attribute));
    }

    /**
     * Index of the first attribute with the given key, or {@link Node#NPOS}.
     */
    public int find(String key) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).getKey().equals(key)) {
                return i;
            }
        }
        return Node.NPOS;
    }

    /**
     * Index of the first attribute equal to the given one, or {@link Node#NPOS}.
     */
    public int find(Attribute attribute) {
        int index = attributes.indexOf(attribute);
        return index < 0 ? Node.NPOS : index;
    }

    public void swap(int first, int second) {
        checkIndex(first);
        checkIndex(second);
        Collections.swap(attributes, first, second);
    }

    public Attribute front() {
        if (attributes.isEmpty()) {
            throw new NoSuchElementException("Attribute store is empty");
        }
        return attributes.get(0);
    }

    public Attribute back() {
        if (attributes.isEmpty()) {
            throw new NoSuchElementException("Attribute store is empty");
        }
        return attributes.get(attributes.size() - 1);
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public void clear() {
        attributes.clear();
    }

    public List<Attribute> asList() {
        return Collections.unmodifiableList(attributes);
    }

    public AttributeStore copy() {
        return new AttributeStore(attributes);
    }

    public String render(AttributeStyle style, FormattingMode mode, int indentLevel) {
        return render(style, mode, indentLevel, RenderOptions.DEFAULT_INDENT_UNIT);
    }

    /**
     * Renders every attribute in order. Indented mode writes one attribute per line,
     * each prefixed with {@code indentLevel} indentation units; line-per-node mode writes
     * one per line without indentation; every other mode separates them with a space.
     */
    public String render(AttributeStyle style, FormattingMode mode, int indentLevel, String indentUnit) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < attributes.size(); i++) {
            if (i > 0) {
                sb.append(mode == FormattingMode.INDENTED || mode == FormattingMode.LINE_PER_NODE ? "\n" : " ");
            }
            if (mode == FormattingMode.INDENTED) {
                sb.append(indentUnit.repeat(Math.max(indentLevel, 0)));
            }
            sb.append(attributes.get(i).render(style));
        }
        return sb.toString();
    }

    @Override
    public Iterator<Attribute> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeStore)) return false;
        return attributes.equals(((AttributeStore) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "AttributeStore" + attributes;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= attributes.size()) {
            throw outOfRange(index);
        }
    }

    private IndexOutOfBoundsException outOfRange(int index) {
        return new IndexOutOfBoundsException("Index " + index + " out of range for " + attributes.size() + " attributes");
    }
}
