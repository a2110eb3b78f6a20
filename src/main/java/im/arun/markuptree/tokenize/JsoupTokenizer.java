package im.arun.markuptree.tokenize;

import im.arun.markuptree.model.Attribute;
import im.arun.markuptree.model.NodeKind;
import im.arun.markuptree.model.Token;
import im.arun.markuptree.tree.TagClassification;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link MarkupTokenizer} backed by jsoup.
 * <p>
 * Input containing an {@code <html>} tag is parsed as a full document; anything else as
 * a body fragment whose top-level nodes get depth 0. Elements are emitted in document
 * order with their nesting depth. An element whose only child is text carries that text
 * as its payload instead of emitting a separate text token; a non-container element with
 * mixed content carries its inner markup. Blank text is dropped.
 */
public class JsoupTokenizer implements MarkupTokenizer {
    private static final Logger logger = LoggerFactory.getLogger(JsoupTokenizer.class);

    private final TagClassification tagClassification;

    public JsoupTokenizer() {
        this(TagClassification.defaults());
    }

    public JsoupTokenizer(TagClassification tagClassification) {
        this.tagClassification = tagClassification;
    }

    @Override
    public List<Token> tokenize(String markup) {
        List<Token> tokens = new ArrayList<>();
        if (markup == null || markup.isBlank()) {
            return tokens;
        }

        if (markup.toLowerCase(Locale.ROOT).contains("<html")) {
            Document document = Jsoup.parse(markup);
            document.outputSettings().prettyPrint(false);
            for (Node child : document.childNodes()) {
                walk(child, 0, tokens);
            }
        } else {
            Document document = Jsoup.parseBodyFragment(markup);
            document.outputSettings().prettyPrint(false);
            for (Node child : document.body().childNodes()) {
                walk(child, 0, tokens);
            }
        }

        logger.debug("Tokenized {} characters into {} tokens", markup.length(), tokens.size());
        return tokens;
    }

    private void walk(Node node, int depth, List<Token> tokens) {
        if (node instanceof TextNode) {
            TextNode text = (TextNode) node;
            if (!text.isBlank()) {
                tokens.add(new Token(text.nodeName(), text.getWholeText(), NodeKind.TEXT, depth));
            }
        } else if (node instanceof DataNode) {
            // script and style bodies
            tokens.add(new Token(node.nodeName(), ((DataNode) node).getWholeData(), NodeKind.TEXT, depth));
        } else if (node instanceof Comment) {
            tokens.add(new Token(node.nodeName(), ((Comment) node).getData(), NodeKind.COMMENT, depth));
        } else if (node instanceof DocumentType) {
            tokens.add(new Token(node.nodeName(), node.outerHtml().trim(), NodeKind.TEXT, depth));
        } else if (node instanceof Element) {
            Element element = (Element) node;
            String tag = element.tagName();

            List<Attribute> attributes = new ArrayList<>();
            for (org.jsoup.nodes.Attribute attribute : element.attributes()) {
                attributes.add(new Attribute(attribute.getKey(), attribute.getValue()));
            }

            String payload = inlinePayload(element);
            tokens.add(new Token(tag, attributes, payload == null ? "" : payload, tagClassification.kindFor(tag), depth));
            if (payload == null) {
                for (Node child : element.childNodes()) {
                    walk(child, depth + 1, tokens);
                }
            }
        }
    }

    /**
     * Payload carried directly by the element, or {@code null} when its children have to be
     * emitted as tokens of their own. Only containers have their children emitted; any
     * other element keeps its content as a single payload, inner markup included.
     */
    private String inlinePayload(Element element) {
        if (element.childNodeSize() == 0) {
            return "";
        }
        if (tagClassification.isContainer(element.tagName())) {
            return null;
        }
        if (element.childNodeSize() == 1) {
            Node only = element.childNode(0);
            if (only instanceof TextNode) {
                return ((TextNode) only).getWholeText();
            }
            if (only instanceof DataNode) {
                return ((DataNode) only).getWholeData();
            }
        }
        return element.html();
    }
}
