package im.arun.markuptree.model;

import im.arun.markuptree.render.FormattingMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class AttributeStoreTest {
    private AttributeStore store;

    @BeforeEach
    public void setUp() {
        store = AttributeStore.of(new Attribute("id", "a"), new Attribute("class", "b"));
    }

    @DisplayName("Find by exact key returns the index, unknown keys the sentinel")
    @Test
    public void testFindByKey() {
        assertEquals(1, store.find("class"));
        assertEquals(Node.NPOS, store.find("missing"));
        assertEquals(0, store.find(new Attribute("id", "a")));
        assertEquals(Node.NPOS, store.find(new Attribute("id", "b")));
    }

    @Test
    public void testInsertionOrderAndDuplicates() {
        store.pushBack(new Attribute("id", "c"));
        store.pushFront(new Attribute("lang", "en"));

        assertEquals(4, store.size());
        assertEquals("lang", store.front().getKey());
        assertEquals(new Attribute("id", "c"), store.back());
        // first match wins, no dedup
        assertEquals(1, store.find("id"));
    }

    @Test
    public void testInsertBounds() {
        store.insert(2, new Attribute("title", "t"));
        assertEquals("title", store.at(2).getKey());

        assertThrows(IndexOutOfBoundsException.class, () -> store.insert(4, new Attribute("x", "y")));
        assertThrows(IndexOutOfBoundsException.class, () -> store.insert(-1, new Attribute("x", "y")));
    }

    @Test
    public void testEraseAndSwap() {
        store.swap(0, 1);
        assertEquals("class", store.at(0).getKey());

        store.erase(0);
        assertEquals(1, store.size());
        assertEquals("id", store.front().getKey());

        assertThrows(IndexOutOfBoundsException.class, () -> store.erase(1));
        assertThrows(IndexOutOfBoundsException.class, () -> store.swap(0, 3));
    }

    @Test
    public void testEmptyStore() {
        AttributeStore empty = new AttributeStore();
        assertTrue(empty.isEmpty());
        assertThrows(NoSuchElementException.class, empty::front);
        assertThrows(NoSuchElementException.class, empty::back);
        assertEquals("", empty.render(AttributeStyle.MARKUP, FormattingMode.INDENTED, 2));
    }

    @Test
    public void testStoredAttributesAreCopies() {
        Attribute attribute = new Attribute("href", "/");
        AttributeStore links = AttributeStore.of(attribute);
        attribute.setValue("/changed");

        assertEquals("/", links.front().getValue());
    }

    @DisplayName("Inline rendering joins with spaces, indented rendering puts one attribute per line")
    @Test
    public void testRender() {
        assertEquals("id=\"a\" class=\"b\"", store.render(AttributeStyle.MARKUP, FormattingMode.COMPACT, 0));
        assertEquals("id: a; class: b;", store.render(AttributeStyle.STYLE, FormattingMode.COMPACT, 3));
        assertEquals("  id: a;\n  class: b;", store.render(AttributeStyle.STYLE, FormattingMode.INDENTED, 1, "  "));
        assertEquals("id: a;\nclass: b;", store.render(AttributeStyle.STYLE, FormattingMode.LINE_PER_NODE, 1));
    }

    @Test
    public void testStructuralEquality() {
        AttributeStore same = AttributeStore.of(new Attribute("id", "a"), new Attribute("class", "b"));
        assertEquals(same, store);
        assertEquals(same.hashCode(), store.hashCode());
        assertEquals(store, store.copy());
    }
}
