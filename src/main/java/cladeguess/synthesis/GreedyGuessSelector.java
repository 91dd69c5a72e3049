package cladeguess.synthesis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import cladeguess.exceptions.TaxonNotFoundException;
import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

/**
 * Tries every candidate, in sorted order, and keeps the one whose answers split the remaining
 * candidates into the lexicographically smallest list of bucket sizes (sizes sorted largest
 * first). The first candidate reaching the best profile wins.
 */
public class GreedyGuessSelector implements GuessSelector {

	private final TaxonTree tree;

	public GreedyGuessSelector(TaxonTree tree) {
		this.tree = tree;
	}

	@Override
	public String selectGuess(Set<String> candidates) throws TaxonNotFoundException {
		String best = null;
		List<Integer> bestProfile = null;
		for (String guess : new TreeSet<String>(candidates)) {
			List<Integer> profile = bucketProfile(DecisionTreeSynthesizer.partition(tree, guess, candidates));
			if (bestProfile == null || compareProfiles(profile, bestProfile) < 0) {
				best = guess;
				bestProfile = profile;
			}
		}
		if (best == null) {
			throw new IllegalArgumentException("no candidates to guess from");
		}
		return best;
	}

	static List<Integer> bucketProfile(Map<TaxonNode, ? extends Set<String>> buckets) {
		ArrayList<Integer> sizes = new ArrayList<Integer>();
		for (Set<String> bucket : buckets.values()) {
			sizes.add(bucket.size());
		}
		Collections.sort(sizes, Collections.reverseOrder());
		return sizes;
	}

	/**
	 * Element-wise comparison; a proper prefix is smaller.
	 */
	static int compareProfiles(List<Integer> a, List<Integer> b) {
		int n = Math.min(a.size(), b.size());
		for (int i = 0; i < n; i++) {
			int c = Integer.compare(a.get(i), b.get(i));
			if (c != 0) {
				return c;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	@Override
	public String getDescription() {
		return "greedy smallest bucket-size profile";
	}
}
