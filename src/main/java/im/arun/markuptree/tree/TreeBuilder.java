package im.arun.markuptree.tree;

import im.arun.markuptree.model.CompositeNode;
import im.arun.markuptree.model.LeafNode;
import im.arun.markuptree.model.NodeKind;
import im.arun.markuptree.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds a nested node tree from a flat, depth-annotated token stream.
 * <p>
 * A stack holds the composite nodes that are still open, starting with the anonymous
 * root at depth 0. For every token the stack is popped down to {@code depth + 1}
 * entries, so the top is the token's parent. Container tags (per
 * {@link TagClassification}) open a new composite; everything else becomes a leaf.
 * <p>
 * One exception: when a non-container token with an empty payload sits deeper than the
 * previous token, and that token's payload was empty too, the pair is read as nesting.
 * The previous token's leaf is turned into a composite and the current token is
 * opened as an empty composite inside it (void, text and comment tokens stay leaves).
 * Only the immediately preceding token is considered.
 * <p>
 * Depth sequences are not validated. Jumps deeper than the number of open levels attach
 * to the innermost open node.
 */
public class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final TagClassification tagClassification;

    public TreeBuilder() {
        this(TagClassification.defaults());
    }

    public TreeBuilder(TagClassification tagClassification) {
        this.tagClassification = tagClassification;
    }

    /**
     * Builds the tree for the given tokens.
     *
     * @param tokens tokens in stream order
     * @return an anonymous root whose children are the top-level nodes
     */
    public CompositeNode build(List<Token> tokens) {
        CompositeNode root = new CompositeNode();
        Deque<CompositeNode> open = new ArrayDeque<>();
        open.push(root);

        int implicitWrappers = 0;
        // parent of the leaf created for the previous token, null if that token opened a composite
        CompositeNode previousLeafParent = null;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            int depth = Math.max(token.getDepth(), 0);

            // close every node that is no longer an ancestor of this token
            int closed = 0;
            while (open.size() > depth + 1) {
                open.pop();
                closed++;
            }
            if (closed > 1) {
                logger.debug("Depth drop to {} at <{}> closed {} levels", depth, token.getTag(), closed);
            }
            CompositeNode current = open.peek();

            if (tagClassification.isContainer(token.getTag())) {
                current.pushBack(new CompositeNode(token.getTag(), token.attributeStore()));
                open.push(current.backSection());
                previousLeafParent = null;
            } else if (i > 0 && opensImplicitWrapper(tokens.get(i - 1), token)) {
                logger.debug("Treating <{}> at depth {} as nested in <{}>", token.getTag(), depth, tokens.get(i - 1).getTag());
                if (previousLeafParent == current && current.back().getKind() == NodeKind.NORMAL) {
                    current = promoteLastLeaf(current);
                    open.push(current);
                }
                implicitWrappers++;
                if (kindOf(token) == NodeKind.NORMAL) {
                    current.pushBack(new CompositeNode(token.getTag(), token.attributeStore()));
                    open.push(current.backSection());
                    previousLeafParent = null;
                } else {
                    // void, text and comment tokens cannot hold children
                    current.pushBack(new LeafNode(token.getTag(), token.attributeStore(), token.getPayload(), kindOf(token)));
                    previousLeafParent = current;
                }
            } else {
                current.pushBack(new LeafNode(token.getTag(), token.attributeStore(), token.getPayload(), kindOf(token)));
                previousLeafParent = current;
            }
        }

        logger.debug("Built tree from {} tokens ({} implicit wrappers, {} top-level nodes)",
                tokens.size(), implicitWrappers, root.size());
        return root;
    }

    /**
     * Two structurally adjacent non-container tags with empty payloads, the second one
     * deeper, describe nesting rather than siblings.
     */
    private static boolean opensImplicitWrapper(Token previous, Token token) {
        return token.getDepth() > previous.getDepth()
                && isEmpty(token.getPayload())
                && isEmpty(previous.getPayload());
    }

    /**
     * Replaces the trailing empty leaf of {@code parent} by an empty composite with the same
     * tag and attributes, and returns that composite.
     */
    private static CompositeNode promoteLastLeaf(CompositeNode parent) {
        LeafNode leaf = parent.back();
        parent.set(parent.size() - 1, new CompositeNode(leaf.getTag(), leaf.getAttributes()));
        return parent.backSection();
    }

    private static NodeKind kindOf(Token token) {
        return token.getKind() == null ? NodeKind.NORMAL : token.getKind();
    }

    private static boolean isEmpty(String payload) {
        return payload == null || payload.isEmpty();
    }
}
