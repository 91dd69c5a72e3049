package cladeguess.exceptions;

/**
 * Thrown when we find multiple matches where we were expecting only one,
 * indicating a problem with the underlying data.
 */
public class MultipleHitsException extends java.lang.IllegalStateException {

    private static final long serialVersionUID = 1L;

    String error;

    public MultipleHitsException(Object searchTerm, Object firstHit, Object secondHit) {
        super();
        error = "The search for '" + String.valueOf(searchTerm) + "' produced multiple hits ('" + String.valueOf(firstHit)
            + "' and '" + String.valueOf(secondHit) + "'), but only one hit was expected.";
    }

    @Override
    public String getMessage() {
        return error;
    }

    @Override
    public String toString() {
        return error;
    }
}
