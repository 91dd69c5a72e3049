package cladeguess.synthesis;

import java.util.Set;

/**
 * Guesses the candidate that comes first in a GuessOrdering.
 */
public class OrderedGuessSelector implements GuessSelector {

	private final GuessOrdering ordering;

	public OrderedGuessSelector(GuessOrdering ordering) {
		this.ordering = ordering;
	}

	@Override
	public String selectGuess(Set<String> candidates) {
		String best = null;
		int bestRank = Integer.MAX_VALUE;
		for (String label : candidates) {
			int rank = ordering.rankOf(label);
			if (rank < 0) {
				throw new IllegalArgumentException("'" + label + "' is not a bound species");
			}
			if (rank < bestRank) {
				best = label;
				bestRank = rank;
			}
		}
		if (best == null) {
			throw new IllegalArgumentException("no candidates to guess from");
		}
		return best;
	}

	@Override
	public String getDescription() {
		return "first candidate in largest-clade-first order";
	}
}
