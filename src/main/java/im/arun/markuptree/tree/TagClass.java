package im.arun.markuptree.tree;

/**
 * Structural class of a markup tag.
 */
public enum TagClass {
    /** opens a composite node that receives deeper tokens */
    CONTAINER,
    /** self-closing, never has content */
    VOID,
    OTHER
}
