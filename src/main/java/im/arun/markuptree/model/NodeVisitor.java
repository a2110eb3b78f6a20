package im.arun.markuptree.model;

/**
 * Exhaustive match over the two node variants.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

    R visitLeaf(LeafNode leaf);

    R visitComposite(CompositeNode composite);
}
