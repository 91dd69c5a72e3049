package cladeguess.exceptions;

import java.util.List;

/**
 * Thrown when a scientific name or a species label cannot be found in the taxonomy.
 */
public class TaxonNotFoundException extends StoredEntityNotFoundException {

    private static final long serialVersionUID = 1L;

    // single name constructor
    public TaxonNotFoundException(String nameOfTaxon) {
        super(nameOfTaxon, "taxon", "taxa");
    }

    // list of names constructor
    public TaxonNotFoundException(List<String> namesOfTaxa) {
        super(namesOfTaxa, "taxon", "taxa");
    }
}
