package im.arun.markuptree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.markuptree.model.AttributeStyle;
import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.render.RenderOptions;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarkupTreeConfig {
    @JsonProperty("formatting")
    private String formatting = FormattingMode.INDENTED.getKey();

    @JsonProperty("indent_unit")
    private String indentUnit = RenderOptions.DEFAULT_INDENT_UNIT;

    @JsonProperty("attribute_style")
    private AttributeStyle attributeStyle = AttributeStyle.MARKUP;

    @JsonProperty("include_entry_point")
    private boolean includeEntryPoint = false;

    // html or tokens
    @JsonProperty("input_format")
    private String inputFormat = "html";

    /**
     * @throws IllegalArgumentException if {@code formatting} names no mode
     */
    public FormattingMode formattingMode() {
        return FormattingMode.fromKey(formatting);
    }

    public RenderOptions toRenderOptions() {
        return new RenderOptions(indentUnit, attributeStyle, includeEntryPoint);
    }
}
