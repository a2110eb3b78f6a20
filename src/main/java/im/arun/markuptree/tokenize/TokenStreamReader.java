package im.arun.markuptree.tokenize;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.markuptree.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes token streams stored as JSON arrays, e.g.
 * <pre>
 * [{"tag": "div", "depth": 0}, {"tag": "p", "payload": "hello", "depth": 1}]
 * </pre>
 * Missing fields take the {@link Token} defaults; unknown fields are rejected.
 */
public class TokenStreamReader {
    private static final Logger logger = LoggerFactory.getLogger(TokenStreamReader.class);

    private final ObjectMapper objectMapper;

    public TokenStreamReader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<Token> read(String json) throws IOException {
        List<Token> tokens = objectMapper.readValue(json, new TypeReference<List<Token>>() {});
        logger.debug("Read {} tokens", tokens.size());
        return tokens;
    }

    public List<Token> read(Path path) throws IOException {
        return read(Files.readString(path));
    }

    public String write(List<Token> tokens) throws IOException {
        return objectMapper.writeValueAsString(tokens);
    }
}
