package im.arun.markuptree.render;

import im.arun.markuptree.model.AttributeStore;
import im.arun.markuptree.model.Node;

/**
 * Entry point for turning trees into text.
 * Rendering is a total function of the tree, the mode and the indentation level.
 */
public final class Serializer {

    private Serializer() {
    }

    public static String render(Node node, FormattingMode mode, int indentLevel) {
        return render(node, mode, indentLevel, RenderOptions.defaults());
    }

    public static String render(Node node, FormattingMode mode, int indentLevel, RenderOptions options) {
        if (mode == FormattingMode.RECONSTRUCTION_SOURCE) {
            return new SourceGenerator(options).generate(node, indentLevel);
        }
        return new MarkupRenderer(mode, options).render(node, indentLevel);
    }

    /**
     * Renders a free-standing attribute store in the configured attribute style.
     */
    public static String render(AttributeStore attributes, FormattingMode mode, int indentLevel, RenderOptions options) {
        return attributes.render(options.getAttributeStyle(), mode, indentLevel, options.getIndentUnit());
    }
}
