package eu.virtualparadox.helpindex.index;

/**
 * A rebuild failed. The previously active index and its metadata are untouched.
 */
public class IndexBuildException extends RuntimeException {

    public IndexBuildException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
