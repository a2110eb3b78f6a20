package im.arun.markuptree.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Linear searches over a list of child nodes.
 * <p>
 * Every search runs left to right from a start index and returns the first matching
 * index, or {@link Node#NPOS} when nothing matches. No state is kept between calls.
 */
public final class Finder {

    public static final Set<FindFlag> DEFAULT_NODE_FLAGS =
            Collections.unmodifiableSet(EnumSet.of(FindFlag.TAG, FindFlag.PAYLOAD, FindFlag.EXACT));

    public static final Set<FindFlag> DEFAULT_ATTRIBUTE_FLAGS =
            Collections.unmodifiableSet(EnumSet.of(FindFlag.ATTRIBUTES, FindFlag.EXACT));

    private static final NodeVisitor<String> PAYLOAD_OF = new NodeVisitor<>() {
        @Override
        public String visitLeaf(LeafNode leaf) {
            return leaf.getPayload();
        }

        @Override
        public String visitComposite(CompositeNode composite) {
            StringBuilder sb = new StringBuilder();
            for (Node child : composite.getChildren()) {
                sb.append(child.get());
            }
            return sb.toString();
        }
    };

    private Finder() {
    }

    public static int find(List<Node> children, int begin, Predicate<Node> matcher) {
        if (begin < 0) {
            return Node.NPOS;
        }
        for (int i = begin; i < children.size(); i++) {
            if (matcher.test(children.get(i))) {
                return i;
            }
        }
        return Node.NPOS;
    }

    /**
     * Matches children of the same variant as {@code criteria} whose selected fields all match.
     * Without a field flag, tag and payload are compared.
     */
    public static Predicate<Node> matching(Node criteria, Set<FindFlag> flags) {
        boolean contains = contains(flags);
        boolean tag = flags.contains(FindFlag.TAG) || !hasFieldFlag(flags);
        boolean payload = flags.contains(FindFlag.PAYLOAD) || !hasFieldFlag(flags);
        boolean attributes = flags.contains(FindFlag.ATTRIBUTES);
        String criteriaPayload = payload ? criteria.accept(PAYLOAD_OF) : null;

        return candidate -> {
            if (candidate.isLeaf() != criteria.isLeaf()) {
                return false;
            }
            if (tag && !compare(candidate.getTag(), criteria.getTag(), contains)) {
                return false;
            }
            if (payload && !compare(candidate.accept(PAYLOAD_OF), criteriaPayload, contains)) {
                return false;
            }
            return !attributes || storeMatches(candidate.getAttributes(), criteria.getAttributes(), contains);
        };
    }

    /**
     * Matches children where any selected field matches {@code text}.
     * {@link FindFlag#ATTRIBUTES} compares both keys and values.
     */
    public static Predicate<Node> matching(String text, Set<FindFlag> flags) {
        boolean contains = contains(flags);
        boolean tag = flags.contains(FindFlag.TAG) || !hasFieldFlag(flags);
        boolean payload = flags.contains(FindFlag.PAYLOAD) || !hasFieldFlag(flags);
        boolean attributes = flags.contains(FindFlag.ATTRIBUTES);

        return candidate -> {
            if (tag && compare(candidate.getTag(), text, contains)) {
                return true;
            }
            if (payload && compare(candidate.accept(PAYLOAD_OF), text, contains)) {
                return true;
            }
            if (attributes) {
                for (Attribute attribute : candidate.getAttributes()) {
                    if (compare(attribute.getKey(), text, contains) || compare(attribute.getValue(), text, contains)) {
                        return true;
                    }
                }
            }
            return false;
        };
    }

    public static Predicate<Node> matching(Attribute criteria, Set<FindFlag> flags) {
        boolean contains = contains(flags);
        return candidate -> hasAttribute(candidate.getAttributes(), criteria, contains);
    }

    public static Predicate<Node> matching(AttributeStore criteria, Set<FindFlag> flags) {
        boolean contains = contains(flags);
        return candidate -> storeMatches(candidate.getAttributes(), criteria, contains);
    }

    private static boolean storeMatches(AttributeStore actual, AttributeStore expected, boolean contains) {
        if (!contains) {
            return actual.equals(expected);
        }
        for (Attribute attribute : expected) {
            if (actual.find(attribute) == Node.NPOS) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasAttribute(AttributeStore store, Attribute criteria, boolean contains) {
        if (!contains) {
            return store.find(criteria) != Node.NPOS;
        }
        for (Attribute attribute : store) {
            if (attribute.getKey().contains(criteria.getKey()) && attribute.getValue().contains(criteria.getValue())) {
                return true;
            }
        }
        return false;
    }

    private static boolean compare(String actual, String expected, boolean contains) {
        return contains ? actual.contains(expected) : actual.equals(expected);
    }

    private static boolean contains(Set<FindFlag> flags) {
        return flags.contains(FindFlag.CONTAINS);
    }

    private static boolean hasFieldFlag(Set<FindFlag> flags) {
        return flags.contains(FindFlag.TAG) || flags.contains(FindFlag.PAYLOAD) || flags.contains(FindFlag.ATTRIBUTES);
    }
}
