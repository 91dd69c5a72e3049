package cladeguess.synthesis;

import java.util.Set;

import cladeguess.exceptions.TaxonNotFoundException;

/**
 * Picks the species to guess next among the species still possible.
 */
public interface GuessSelector {

	/**
	 * @param candidates the species still consistent with every answer so far; never empty
	 * @return a member of `candidates`
	 */
	public String selectGuess(Set<String> candidates) throws TaxonNotFoundException;

	public String getDescription();

}
