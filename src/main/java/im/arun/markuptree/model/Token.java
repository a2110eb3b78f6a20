package im.arun.markuptree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One record of the flat token stream produced by a markup tokenizer.
 * {@code depth} is the nesting level of the token, 0 for top-level tokens.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Token {

    @JsonProperty("tag")
    private String tag = "";

    @JsonProperty("attributes")
    private List<Attribute> attributes = new ArrayList<>();

    @JsonProperty("payload")
    private String payload = "";

    @JsonProperty("kind")
    private NodeKind kind = NodeKind.NORMAL;

    @JsonProperty("depth")
    private int depth;

    public Token(String tag, String payload, NodeKind kind, int depth) {
        this(tag, new ArrayList<>(), payload, kind, depth);
    }

    public AttributeStore attributeStore() {
        return new AttributeStore(attributes);
    }
}
