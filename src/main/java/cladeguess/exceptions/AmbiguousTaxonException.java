package cladeguess.exceptions;

/**
 * A MultipleHitsException reserved for species binding: a scientific name claimed by two different labels,
 * or a label claimed by two different taxa.
 */
public class AmbiguousTaxonException extends MultipleHitsException {

    private static final long serialVersionUID = 1L;

    public AmbiguousTaxonException(Object searchTerm, Object firstHit, Object secondHit) {
        super(searchTerm, firstHit, secondHit);
    }
}
