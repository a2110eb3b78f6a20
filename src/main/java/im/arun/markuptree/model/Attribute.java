package im.arun.markuptree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single key/value pair attached to a node or a style rule.
 * Equality is structural.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Attribute {

    @JsonProperty("key")
    private String key = "";

    @JsonProperty("value")
    private String value = "";

    public Attribute(Attribute other) {
        this(other.getKey(), other.getValue());
    }

    /**
     * Renders this attribute in the given style, e.g. {@code id="main"} or {@code color: red;}.
     */
    public String render(AttributeStyle style) {
        if (style == AttributeStyle.STYLE) {
            return key + ": " + value + ";";
        }
        return key + "=\"" + value + "\"";
    }
}
