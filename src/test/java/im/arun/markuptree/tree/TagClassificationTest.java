package im.arun.markuptree.tree;

import im.arun.markuptree.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class TagClassificationTest {

    @Test
    public void testDefaultTable() {
        TagClassification table = TagClassification.defaults();
        assertTrue(table.isContainer("div"));
        assertTrue(table.isContainer("UL"));
        assertTrue(table.isVoid("br"));
        assertEquals(TagClass.OTHER, table.classify("span"));
        assertEquals(TagClass.OTHER, table.classify(null));
        assertSame(table, TagClassification.defaults());
    }

    @Test
    public void testKindFor() {
        TagClassification table = TagClassification.defaults();
        assertEquals(NodeKind.VOID, table.kindFor("img"));
        assertEquals(NodeKind.NORMAL, table.kindFor("p"));
        assertEquals(NodeKind.NORMAL, table.kindFor("div"));
    }

    @Test
    public void testCustomTableIgnoresCase() {
        TagClassification table = new TagClassification(Map.of("Panel", TagClass.CONTAINER));
        assertTrue(table.isContainer("panel"));
        assertFalse(table.isContainer("div"));
    }
}
