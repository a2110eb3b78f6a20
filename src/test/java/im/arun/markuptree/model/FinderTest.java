package im.arun.markuptree.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class FinderTest {
    private CompositeNode body;

    @BeforeEach
    public void setUp() {
        body = new CompositeNode("body");
        body.pushBack(new LeafNode("h1", AttributeStore.of(new Attribute("id", "top")), "Welcome"));
        body.pushBack(new LeafNode("p", AttributeStore.of(new Attribute("id", "a"), new Attribute("class", "b")), "hello world"));
        body.pushBack(new CompositeNode("div", AttributeStore.of(new Attribute("class", "b")),
                new LeafNode("span", new AttributeStore(), "inner")));
        body.pushBack(new LeafNode("p", new AttributeStore(), "hello"));
    }

    @DisplayName("Attribute key search on a store returns the first exact match or the sentinel")
    @Test
    public void testAttributeKeySearch() {
        AttributeStore store = AttributeStore.of(new Attribute("id", "a"), new Attribute("class", "b"));
        assertEquals(1, store.find("class"));
        assertEquals(Node.NPOS, store.find("missing"));
    }

    @Test
    public void testFindNodeExact() {
        assertEquals(3, body.find(new LeafNode("p", new AttributeStore(), "hello")));
        assertEquals(Node.NPOS, body.find(new LeafNode("p", new AttributeStore(), "hell")));
        // attributes are ignored unless requested
        assertEquals(1, body.find(new LeafNode("p", new AttributeStore(), "hello world")));
        assertEquals(Node.NPOS, body.find(new LeafNode("p", new AttributeStore(), "hello world"), 0,
                EnumSet.of(FindFlag.TAG, FindFlag.PAYLOAD, FindFlag.ATTRIBUTES, FindFlag.EXACT)));
    }

    @Test
    public void testFindNodeContains() {
        LeafNode criteria = new LeafNode("p", new AttributeStore(), "hello");
        EnumSet<FindFlag> contains = EnumSet.of(FindFlag.TAG, FindFlag.PAYLOAD, FindFlag.CONTAINS);
        assertEquals(1, body.find(criteria, 0, contains));
        assertEquals(3, body.find(criteria, 2, contains));
    }

    @DisplayName("Node criteria only match children of the same variant")
    @Test
    public void testFindNodeVariant() {
        EnumSet<FindFlag> tagOnly = EnumSet.of(FindFlag.TAG);
        assertEquals(2, body.find(new CompositeNode("div"), 0, tagOnly));
        assertEquals(Node.NPOS, body.find(new LeafNode("div"), 0, tagOnly));
        assertEquals(2, body.find(new CompositeNode("div", new AttributeStore(),
                new LeafNode("span", new AttributeStore(), "inner"))));
    }

    @Test
    public void testFindString() {
        assertEquals(1, body.find("p"));
        assertEquals(3, body.find("p", 2));
        assertEquals(0, body.find("Welcome"));
        assertEquals(Node.NPOS, body.find("Welc"));
        assertEquals(0, body.find("Welc", 0, EnumSet.of(FindFlag.PAYLOAD, FindFlag.CONTAINS)));
        assertEquals(2, body.find("inner", 0, EnumSet.of(FindFlag.PAYLOAD, FindFlag.CONTAINS)));
        assertEquals(0, body.find("top", 0, EnumSet.of(FindFlag.ATTRIBUTES)));
        assertEquals(1, body.find("class", 0, EnumSet.of(FindFlag.ATTRIBUTES, FindFlag.EXACT)));
    }

    @Test
    public void testFindAttribute() {
        assertEquals(1, body.find(new Attribute("class", "b")));
        assertEquals(2, body.find(new Attribute("class", "b"), 2, Finder.DEFAULT_ATTRIBUTE_FLAGS));
        assertEquals(Node.NPOS, body.find(new Attribute("class", "")));
        assertEquals(1, body.find(new Attribute("cla", ""), 0, EnumSet.of(FindFlag.ATTRIBUTES, FindFlag.CONTAINS)));
    }

    @Test
    public void testFindAttributeStore() {
        assertEquals(2, body.find(AttributeStore.of(new Attribute("class", "b"))));
        assertEquals(1, body.find(AttributeStore.of(new Attribute("class", "b")), 0,
                EnumSet.of(FindFlag.ATTRIBUTES, FindFlag.CONTAINS)));
        assertEquals(3, body.find(new AttributeStore()));
    }

    @DisplayName("Searches starting outside the children return the sentinel")
    @Test
    public void testBeginOutOfRange() {
        assertEquals(Node.NPOS, body.find("p", 4));
        assertEquals(Node.NPOS, body.find("p", 100));
        assertEquals(Node.NPOS, body.find("p", -1));
        assertEquals(Node.NPOS, new CompositeNode("div").find("p"));
    }

    @DisplayName("The returned index is the first match at or after begin")
    @Test
    public void testFirstMatchWins() {
        for (int begin = 0; begin < body.size(); begin++) {
            int found = body.find("p", begin);
            int expected = Node.NPOS;
            for (int i = begin; i < body.size(); i++) {
                if (body.nodeAt(i).getTag().equals("p")) {
                    expected = i;
                    break;
                }
            }
            assertEquals(expected, found);
        }
    }
}
