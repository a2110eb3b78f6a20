package im.arun.markuptree.model;

import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.render.RenderOptions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A style rule: a selector and its declarations, e.g. {@code p {color: red;}}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class StyleRule {
    private String selector;
    private AttributeStore declarations;

    public StyleRule(String selector) {
        this(selector, new AttributeStore());
    }

    public StyleRule(String selector, AttributeStore declarations) {
        this.selector = selector != null ? selector : "";
        this.declarations = declarations != null ? declarations.copy() : new AttributeStore();
    }

    public StyleRule(String selector, Attribute... declarations) {
        this(selector, AttributeStore.of(declarations));
    }

    public void setSelector(String selector) {
        this.selector = selector != null ? selector : "";
    }

    public void setDeclarations(AttributeStore declarations) {
        this.declarations = declarations != null ? declarations.copy() : new AttributeStore();
    }

    public void pushBack(Attribute declaration) {
        declarations.pushBack(declaration);
    }

    public String get(FormattingMode mode, int indentLevel) {
        return get(mode, indentLevel, RenderOptions.DEFAULT_INDENT_UNIT);
    }

    /**
     * Indented and line-per-node modes put each declaration on its own line; other modes
     * keep the whole rule on one line.
     */
    public String get(FormattingMode mode, int indentLevel, String indentUnit) {
        String indent = mode == FormattingMode.INDENTED ? indentUnit.repeat(Math.max(indentLevel, 0)) : "";
        if (mode != FormattingMode.INDENTED && mode != FormattingMode.LINE_PER_NODE) {
            return selector + " {" + declarations.render(AttributeStyle.STYLE, mode, 0, indentUnit) + "}";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(selector).append(" {");
        if (!declarations.isEmpty()) {
            sb.append('\n').append(declarations.render(AttributeStyle.STYLE, mode, indentLevel + 1, indentUnit));
        }
        sb.append('\n').append(indent).append('}');
        return sb.toString();
    }

    public String get() {
        return get(FormattingMode.COMPACT, 0);
    }
}
