package im.arun.markuptree.tree;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.markuptree.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed mapping from tag name to {@link TagClass}. Lookups are case-insensitive and
 * unlisted tags are {@link TagClass#OTHER}.
 * <p>
 * The default table is read once from {@code tag-classification.yaml} on the classpath.
 */
public class TagClassification {
    private static final Logger logger = LoggerFactory.getLogger(TagClassification.class);
    static final String RESOURCE = "tag-classification.yaml";

    private static volatile TagClassification defaultTable;

    private final Map<String, TagClass> classes;

    public TagClassification(Map<String, TagClass> classes) {
        Map<String, TagClass> normalized = new HashMap<>();
        classes.forEach((tag, tagClass) -> normalized.put(tag.toLowerCase(Locale.ROOT), tagClass));
        this.classes = Collections.unmodifiableMap(normalized);
    }

    public static TagClassification defaults() {
        if (defaultTable == null) {
            synchronized (TagClassification.class) {
                if (defaultTable == null) {
                    defaultTable = load();
                }
            }
        }
        return defaultTable;
    }

    private static TagClassification load() {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = TagClassification.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Tag classification table not found on classpath: " + RESOURCE);
            }
            Map<String, List<String>> raw = yamlMapper.readValue(in, new TypeReference<Map<String, List<String>>>() {});
            Map<String, TagClass> classes = new HashMap<>();
            raw.forEach((key, tags) -> {
                TagClass tagClass = TagClass.valueOf(key.toUpperCase(Locale.ROOT));
                for (String tag : tags) {
                    classes.put(tag, tagClass);
                }
            });
            logger.debug("Loaded {} tag classifications", classes.size());
            return new TagClassification(classes);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read tag classification table " + RESOURCE, e);
        }
    }

    public TagClass classify(String tag) {
        if (tag == null) {
            return TagClass.OTHER;
        }
        return classes.getOrDefault(tag.toLowerCase(Locale.ROOT), TagClass.OTHER);
    }

    public boolean isContainer(String tag) {
        return classify(tag) == TagClass.CONTAINER;
    }

    public boolean isVoid(String tag) {
        return classify(tag) == TagClass.VOID;
    }

    /**
     * Leaf kind for an element with this tag.
     */
    public NodeKind kindFor(String tag) {
        return isVoid(tag) ? NodeKind.VOID : NodeKind.NORMAL;
    }
}
