package im.arun.markuptree.render;

import im.arun.markuptree.model.AttributeStyle;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings shared by all formatting modes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RenderOptions {
    public static final String DEFAULT_INDENT_UNIT = "    ";

    private String indentUnit = DEFAULT_INDENT_UNIT;
    private AttributeStyle attributeStyle = AttributeStyle.MARKUP;
    // wrap reconstruction source in a runnable class
    private boolean includeEntryPoint = false;

    public static RenderOptions defaults() {
        return new RenderOptions();
    }
}
