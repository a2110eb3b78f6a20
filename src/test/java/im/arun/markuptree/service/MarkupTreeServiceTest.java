package im.arun.markuptree.service;

import im.arun.markuptree.config.MarkupTreeConfig;
import im.arun.markuptree.model.CompositeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class MarkupTreeServiceTest {
    private MarkupTreeService service;
    private MarkupTreeConfig config;

    @BeforeEach
    public void setUp() {
        service = new MarkupTreeService();
        config = new MarkupTreeConfig();
    }

    @Test
    public void testProcessMarkup() throws IOException {
        String output = service.process("<ul><li>x</li><li>y</li></ul>", config);
        assertEquals("<ul>\n    <li>x</li>\n    <li>y</li>\n</ul>", output);
    }

    @DisplayName("Inline markup stays inside its element")
    @Test
    public void testMixedContentKeepsParent() throws IOException {
        config.setFormatting("compact");
        assertEquals("<div><h1>T</h1><p>a<br>b</p></div>", service.process("<div><h1>T</h1><p>a<br>b</p></div>", config));
        assertEquals("<p>Hello <b>world</b></p>", service.process("<p>Hello <b>world</b></p>", config));
    }

    @Test
    public void testProcessTokens() throws IOException {
        config.setInputFormat(MarkupTreeService.INPUT_TOKENS);
        config.setFormatting("compact");

        String output = service.process("[{\"tag\": \"div\", \"depth\": 0},"
                + " {\"tag\": \"p\", \"payload\": \"hello\", \"depth\": 1},"
                + " {\"tag\": \"span\", \"depth\": 1}]", config);
        assertEquals("<div><p>hello</p><span></span></div>", output);
    }

    @Test
    public void testSourceOutput() throws IOException {
        config.setFormatting("source");
        config.setIncludeEntryPoint(true);

        String output = service.process("<p>hi</p>", config);
        assertTrue(output.contains("public final class Main {"));
        assertTrue(output.contains("new LeafNode(\"p\", new AttributeStore(), \"hi\", NodeKind.NORMAL);"));
    }

    @Test
    public void testParseReturnsAnonymousRoot() throws IOException {
        CompositeNode root = service.parse("<h1>a</h1><p>b</p>", config);
        assertEquals("", root.getTag());
        assertEquals(2, root.size());
    }

    @Test
    public void testRejectsBadInput() {
        config.setInputFormat("xml");
        assertThrows(IllegalArgumentException.class, () -> service.process("<p>x</p>", config));

        config.setInputFormat(MarkupTreeService.INPUT_TOKENS);
        assertThrows(IOException.class, () -> service.process("{broken", config));

        MarkupTreeConfig badMode = new MarkupTreeConfig();
        badMode.setFormatting("fancy");
        assertThrows(IllegalArgumentException.class, () -> service.process("<p>x</p>", badMode));
    }
}
