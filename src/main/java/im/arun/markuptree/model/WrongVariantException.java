package im.arun.markuptree.model;

/**
 * Thrown when a leaf view is requested for a composite child or the other way round.
 */
public class WrongVariantException extends RuntimeException {

    public WrongVariantException(String message) {
        super(message);
    }
}
