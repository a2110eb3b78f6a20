package im.arun.markuptree.model;

/**
 * Classifies how a leaf node is rendered.
 */
public enum NodeKind {
    /** {@code <tag>payload</tag>} */
    NORMAL,
    /** {@code <tag/>}, never renders payload or a closing tag */
    VOID,
    /** payload only, no tag wrapper */
    TEXT,
    /** {@code <!--payload-->} */
    COMMENT
}
