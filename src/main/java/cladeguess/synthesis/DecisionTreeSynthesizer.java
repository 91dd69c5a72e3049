package cladeguess.synthesis;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import cladeguess.exceptions.TaxonNotFoundException;
import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

/**
 * Builds the guess tree for a bound TaxonTree. At every step the GuessSelector picks a guess,
 * the other candidates are grouped by the LCA of guess and candidate, and each group is solved
 * recursively under that LCA.
 */
public class DecisionTreeSynthesizer {
	static Logger _LOG = Logger.getLogger(DecisionTreeSynthesizer.class);

	private final TaxonTree tree;
	private final GuessSelector selector;

	public DecisionTreeSynthesizer(TaxonTree tree, GuessSelector selector) {
		this.tree = tree;
		this.selector = selector;
	}

	/**
	 * Uses the canonical largest-clade-first ordering.
	 */
	public DecisionTreeSynthesizer(TaxonTree tree) {
		this(tree, new OrderedGuessSelector(new GuessOrdering(tree)));
	}

	/**
	 * @return the guess tree over every bound species, starting at the root of the tree
	 */
	public DecisionNode synthesize() throws TaxonNotFoundException {
		_LOG.info("Synthesizing guess tree for " + tree.getSpeciesCount() + " species (" + selector.getDescription() + ")");
		return synthesize(tree.getRoot(), tree.getSpeciesLabels());
	}

	/**
	 * @param subject the clade all `candidates` are known to share
	 * @param candidates species still possible; must not be empty
	 * @throws IllegalArgumentException if `candidates` is empty
	 * @throws TaxonNotFoundException if a candidate is not a bound species
	 */
	public DecisionNode synthesize(TaxonNode subject, Collection<String> candidates) throws TaxonNotFoundException {
		if (candidates.isEmpty()) {
			throw new IllegalArgumentException("cannot choose a guess for '" + subject.getName() + "' without candidates");
		}
		Set<String> poss = new LinkedHashSet<String>(candidates);
		String guess = selector.selectGuess(poss);
		if (poss.contains(guess) == false) {
			throw new IllegalStateException("selector chose '" + guess + "', which is not a candidate under '" + subject.getName() + "'");
		}
		Map<TaxonNode, LinkedHashSet<String>> buckets = partition(tree, guess, poss);
		_LOG.trace(subject.getName() + ": guess " + guess + " splits " + poss.size() + " candidates into " + buckets.size() + " buckets");

		TreeMap<TaxonNode, DecisionNode> sorted = new TreeMap<TaxonNode, DecisionNode>(BY_NAME);
		for (Map.Entry<TaxonNode, LinkedHashSet<String>> bucket : buckets.entrySet()) {
			sorted.put(bucket.getKey(), synthesize(bucket.getKey(), bucket.getValue()));
		}
		return new DecisionNode(subject, guess, poss, sorted);
	}

	/**
	 * Groups every candidate except `guess` by the LCA of its node and the guess's node.
	 * Buckets appear in the order their first member is met.
	 */
	public static Map<TaxonNode, LinkedHashSet<String>> partition(TaxonTree tree, String guess, Collection<String> candidates) throws TaxonNotFoundException {
		TaxonNode guessNode = tree.getSpeciesNode(guess);
		LinkedHashMap<TaxonNode, LinkedHashSet<String>> ret = new LinkedHashMap<TaxonNode, LinkedHashSet<String>>();
		for (String real : candidates) {
			if (real.equals(guess)) {
				continue;
			}
			TaxonNode outcome = tree.getMRCA(guessNode, tree.getSpeciesNode(real));
			LinkedHashSet<String> bucket = ret.get(outcome);
			if (bucket == null) {
				bucket = new LinkedHashSet<String>();
				ret.put(outcome, bucket);
			}
			bucket.add(real);
		}
		return ret;
	}

	static final Comparator<TaxonNode> BY_NAME = new Comparator<TaxonNode>() {
		@Override
		public int compare(TaxonNode a, TaxonNode b) {
			return a.getName().compareTo(b.getName());
		}
	};
}
