package im.arun.markuptree.tokenize;

import im.arun.markuptree.model.Attribute;
import im.arun.markuptree.model.CompositeNode;
import im.arun.markuptree.model.NodeKind;
import im.arun.markuptree.model.Token;
import im.arun.markuptree.tree.TreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class JsoupTokenizerTest {
    private JsoupTokenizer tokenizer;

    @BeforeEach
    public void setUp() {
        tokenizer = new JsoupTokenizer();
    }

    private static List<String> tagsWithDepth(List<Token> tokens) {
        List<String> result = new ArrayList<>();
        for (Token token : tokens) {
            result.add(token.getTag() + "@" + token.getDepth());
        }
        return result;
    }

    @Test
    public void testFragment() {
        List<Token> tokens = tokenizer.tokenize("<div><p>hello</p><ul><li>x</li><li>y</li></ul></div>");

        assertEquals(List.of("div@0", "p@1", "ul@1", "li@2", "li@2"), tagsWithDepth(tokens));
        assertEquals("", tokens.get(0).getPayload());
        assertEquals("hello", tokens.get(1).getPayload());
        assertEquals("y", tokens.get(4).getPayload());
    }

    @Test
    public void testAttributesKeepOrder() {
        Token link = tokenizer.tokenize("<a href=\"/x\" class=\"c\">go</a>").get(0);
        assertEquals(List.of(new Attribute("href", "/x"), new Attribute("class", "c")), link.getAttributes());
        assertEquals("go", link.getPayload());
    }

    @Test
    public void testKinds() {
        List<Token> tokens = tokenizer.tokenize("<ul><!-- nav --><li>one</li></ul><hr><p>a</p>");

        assertEquals(List.of("ul@0", "#comment@1", "li@1", "hr@0", "p@0"), tagsWithDepth(tokens));
        assertEquals(NodeKind.COMMENT, tokens.get(1).getKind());
        assertEquals(" nav ", tokens.get(1).getPayload());
        assertEquals(NodeKind.VOID, tokens.get(3).getKind());
        assertEquals(NodeKind.NORMAL, tokens.get(4).getKind());
    }

    @DisplayName("Mixed content of a non-container element stays in its payload")
    @Test
    public void testMixedContentPayload() {
        List<Token> tokens = tokenizer.tokenize("<div><h1>T</h1><p>a<br>b</p></div>");

        assertEquals(List.of("div@0", "h1@1", "p@1"), tagsWithDepth(tokens));
        assertEquals("a<br>b", tokens.get(2).getPayload());
        assertEquals(NodeKind.NORMAL, tokens.get(2).getKind());
    }

    @Test
    public void testInlinePayloads() {
        assertEquals("", tokenizer.tokenize("<span></span>").get(0).getPayload());
        assertEquals("x = 1;", tokenizer.tokenize("<script>x = 1;</script>").get(0).getPayload());

        List<Token> tokens = tokenizer.tokenize("<p>Hello <b>world</b></p>");
        assertEquals(1, tokens.size());
        assertEquals("Hello <b>world</b>", tokens.get(0).getPayload());
    }

    @Test
    public void testFullDocument() {
        List<Token> tokens = tokenizer.tokenize(
                "<!DOCTYPE html><html><head><title>T</title></head><body><p>x</p></body></html>");

        assertEquals(List.of("#doctype@0", "html@0", "head@1", "title@2", "body@1", "p@2"), tagsWithDepth(tokens));
        assertEquals(NodeKind.TEXT, tokens.get(0).getKind());
        assertEquals("T", tokens.get(3).getPayload());
    }

    @Test
    public void testBlankInput() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   \n").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
    }

    @DisplayName("Compact output re-parses to the same tree")
    @Test
    public void testCompactRoundTrip() {
        TreeBuilder builder = new TreeBuilder();
        String markup = "<div class=\"page\"><h1>Title</h1><ul><li>x</li><li>y</li></ul><p>end</p></div>";

        CompositeNode tree = builder.build(tokenizer.tokenize(markup));
        String compact = tree.get();
        assertEquals(markup, compact);

        CompositeNode rebuilt = builder.build(tokenizer.tokenize(compact));
        assertEquals(tree, rebuilt);
    }
}
