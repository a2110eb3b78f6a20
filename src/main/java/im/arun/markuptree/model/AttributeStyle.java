package im.arun.markuptree.model;

/**
 * How an attribute is written out.
 */
public enum AttributeStyle {
    /** {@code key="value"}, used inside markup tags. */
    MARKUP,
    /** {@code key: value;}, used for style declarations. */
    STYLE
}
