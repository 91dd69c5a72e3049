package cladeguess.synthesis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import cladeguess.tree.TaxonNode;

/**
 * One step of a guess tree: the clade the remaining candidates are known to share, the species
 * guessed there, and one follow-up step per possible answer (the LCA of guess and true species).
 */
public class DecisionNode {

	private final TaxonNode subject;
	private final String guess;
	private final Set<String> candidates;
	private final Map<TaxonNode, DecisionNode> branches;

	public DecisionNode(TaxonNode subject, String guess, Set<String> candidates, Map<TaxonNode, DecisionNode> branches) {
		this.subject = subject;
		this.guess = guess;
		this.candidates = Collections.unmodifiableSet(new LinkedHashSet<String>(candidates));
		this.branches = Collections.unmodifiableMap(new LinkedHashMap<TaxonNode, DecisionNode>(branches));
	}

	public TaxonNode getSubject() {return subject;}

	public String getGuess() {return guess;}

	/**
	 * @return the species still possible at this step, the guess included
	 */
	public Set<String> getCandidates() {return candidates;}

	/**
	 * @return answer -> next step, ordered by the answer's scientific name
	 */
	public Map<TaxonNode, DecisionNode> getBranches() {return branches;}

	public int getBranchCount() {return branches.size();}

	public boolean isExternal() {return branches.isEmpty();}

	@Override
	public String toString() {
		return "DecisionNode(" + subject.getName() + ": " + guess + ", candidates=" + candidates.size() + ")";
	}
}
