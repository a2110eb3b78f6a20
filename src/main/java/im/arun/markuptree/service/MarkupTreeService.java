package im.arun.markuptree.service;

import im.arun.markuptree.config.MarkupTreeConfig;
import im.arun.markuptree.model.CompositeNode;
import im.arun.markuptree.model.Token;
import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.render.Serializer;
import im.arun.markuptree.tokenize.JsoupTokenizer;
import im.arun.markuptree.tokenize.MarkupTokenizer;
import im.arun.markuptree.tokenize.TokenStreamReader;
import im.arun.markuptree.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Ties the pipeline together: input text -> tokens -> tree -> rendered text.
 */
public class MarkupTreeService {
    private static final Logger logger = LoggerFactory.getLogger(MarkupTreeService.class);

    public static final String INPUT_HTML = "html";
    public static final String INPUT_TOKENS = "tokens";

    private final MarkupTokenizer tokenizer;
    private final TokenStreamReader tokenStreamReader;
    private final TreeBuilder treeBuilder;

    public MarkupTreeService() {
        this(new JsoupTokenizer(), new TokenStreamReader(), new TreeBuilder());
    }

    public MarkupTreeService(MarkupTokenizer tokenizer, TokenStreamReader tokenStreamReader, TreeBuilder treeBuilder) {
        this.tokenizer = tokenizer;
        this.tokenStreamReader = tokenStreamReader;
        this.treeBuilder = treeBuilder;
    }

    /**
     * Parses the input according to {@link MarkupTreeConfig#getInputFormat()}.
     *
     * @throws IOException if a token stream cannot be read
     * @throws IllegalArgumentException for an unknown input format
     */
    public CompositeNode parse(String input, MarkupTreeConfig config) throws IOException {
        String format = config.getInputFormat();
        if (INPUT_HTML.equals(format)) {
            return parseMarkup(input);
        }
        if (INPUT_TOKENS.equals(format)) {
            return parseTokens(input);
        }
        throw new IllegalArgumentException("Unknown input format '" + format + "', expected html or tokens");
    }

    public CompositeNode parseMarkup(String markup) {
        List<Token> tokens = tokenizer.tokenize(markup);
        logger.info("Tokenized markup into {} tokens", tokens.size());
        return treeBuilder.build(tokens);
    }

    public CompositeNode parseTokens(String json) throws IOException {
        List<Token> tokens = tokenStreamReader.read(json);
        logger.info("Read {} tokens", tokens.size());
        return treeBuilder.build(tokens);
    }

    public String render(CompositeNode root, MarkupTreeConfig config) {
        FormattingMode mode = config.formattingMode();
        return Serializer.render(root, mode, 0, config.toRenderOptions());
    }

    public String process(String input, MarkupTreeConfig config) throws IOException {
        CompositeNode root = parse(input, config);
        logger.info("Rendering {} top-level nodes as {}", root.size(), config.getFormatting());
        return render(root, config);
    }
}
