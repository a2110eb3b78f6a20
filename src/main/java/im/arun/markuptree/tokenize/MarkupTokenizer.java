package im.arun.markuptree.tokenize;

import im.arun.markuptree.model.Token;

import java.util.List;

/**
 * Turns markup text into the flat, depth-annotated token stream consumed by
 * {@link im.arun.markuptree.tree.TreeBuilder}.
 */
public interface MarkupTokenizer {

    List<Token> tokenize(String markup);
}
