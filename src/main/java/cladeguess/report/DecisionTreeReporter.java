package cladeguess.report;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import cladeguess.exceptions.DecisionTreeCheckException;
import cladeguess.exceptions.TaxonNotFoundException;
import cladeguess.synthesis.DecisionNode;
import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

/**
 * Prints a guess tree one step per line, indented by the number of guesses already made:
 *
 * <pre>
 * * Carnivora: dog (max=2, avg=1.667, cnt=3)
 *   * Canidae: wolf (max=1, avg=1, cnt=1)
 *   * Carnivora: cat (max=1, avg=1, cnt=1)
 * </pre>
 *
 * While walking, every step is checked against the answers that lead to it: for each species
 * resolved at or below a step, the deepest LCA with any earlier guess must be the step's clade.
 * Sibling steps must resolve disjoint species and the whole tree must resolve every species
 * exactly once. A tree failing any of this is rejected.
 */
public class DecisionTreeReporter {
	static Logger _LOG = Logger.getLogger(DecisionTreeReporter.class);

	private final TaxonTree tree;

	public DecisionTreeReporter(TaxonTree tree) {
		this.tree = tree;
	}

	public DecisionReport buildReport(DecisionNode root) throws DecisionTreeCheckException, TaxonNotFoundException {
		return buildReport(root, tree.getSpeciesLabels());
	}

	/**
	 * @param universe the species the tree must resolve
	 */
	public DecisionReport buildReport(DecisionNode root, Set<String> universe) throws DecisionTreeCheckException, TaxonNotFoundException {
		ArrayList<String> lines = new ArrayList<String>();
		HashSet<String> seen = new HashSet<String>();
		Walk top = walk(root, 0, new ArrayList<TaxonNode>(), lines, seen);
		if (top.covered.equals(universe) == false) {
			HashSet<String> missing = new HashSet<String>(universe);
			missing.removeAll(top.covered);
			HashSet<String> extra = new HashSet<String>(top.covered);
			extra.removeAll(universe);
			throw new DecisionTreeCheckException("guess tree resolves " + top.covered.size() + " of " + universe.size()
				+ " species; missing " + missing + ", unexpected " + extra);
		}
		_LOG.info("Guess tree checked: " + top.stats);
		return new DecisionReport(lines, top.stats);
	}

	/*
	 * result of checking one subtree
	 */
	private static class Walk {
		final GuessStats stats;
		final Set<String> covered;

		Walk(GuessStats stats, Set<String> covered) {
			this.stats = stats;
			this.covered = covered;
		}
	}

	private Walk walk(DecisionNode node, int pathDepth, List<TaxonNode> earlierGuesses, List<String> lines, Set<String> seen)
			throws DecisionTreeCheckException, TaxonNotFoundException {
		String guess = node.getGuess();
		TaxonNode subject = node.getSubject();
		if (node.getCandidates().contains(guess) == false) {
			throw new DecisionTreeCheckException("guess '" + guess + "' under '" + subject.getName() + "' is not one of its candidates");
		}
		if (seen.add(guess) == false) {
			throw new DecisionTreeCheckException("species '" + guess + "' is guessed more than once");
		}
		int lineIndex = lines.size();
		lines.add(null); // filled in once the subtree stats are known

		ArrayList<TaxonNode> path = new ArrayList<TaxonNode>(earlierGuesses);
		path.add(tree.getSpeciesNode(guess));
		LinkedHashSet<String> covered = new LinkedHashSet<String>();
		covered.add(guess);
		ArrayList<GuessStats> childStats = new ArrayList<GuessStats>();
		for (Map.Entry<TaxonNode, DecisionNode> branch : node.getBranches().entrySet()) {
			DecisionNode child = branch.getValue();
			if (child.getSubject() != branch.getKey()) {
				throw new DecisionTreeCheckException("answer '" + branch.getKey().getName() + "' under '" + subject.getName()
					+ "' leads to a step about '" + child.getSubject().getName() + "'");
			}
			Walk sub = walk(child, pathDepth + 1, path, lines, seen);
			for (String s : sub.covered) {
				if (covered.add(s) == false) {
					throw new DecisionTreeCheckException("species '" + s + "' is reachable through more than one answer under '" + subject.getName() + "'");
				}
			}
			childStats.add(sub.stats);
		}
		if (covered.equals(node.getCandidates()) == false) {
			throw new DecisionTreeCheckException("step '" + subject.getName() + ": " + guess + "' resolves " + covered
				+ " but was given " + node.getCandidates());
		}
		for (String s : covered) {
			TaxonNode placed = deepestSharedAncestor(tree.getSpeciesNode(s), earlierGuesses);
			if (placed != subject) {
				throw new DecisionTreeCheckException("species '" + s + "' belongs under '" + placed.getName() + "' but was placed under '"
					+ subject.getName() + "'");
			}
		}

		GuessStats stats = GuessStats.combine(childStats);
		lines.set(lineIndex, StringUtils.repeat("  ", pathDepth) + "* " + subject.getName() + ": " + guess + " (" + stats + ")");
		return new Walk(stats, covered);
	}

	/**
	 * @return the deepest of the LCAs of `species` with each earlier guess, or the root when
	 *		nothing has been guessed yet
	 */
	private TaxonNode deepestSharedAncestor(TaxonNode species, List<TaxonNode> earlierGuesses) {
		TaxonNode deepest = tree.getRoot();
		for (TaxonNode g : earlierGuesses) {
			TaxonNode lca = tree.getMRCA(g, species);
			if (lca.getDepth() > deepest.getDepth()) {
				deepest = lca;
			}
		}
		return deepest;
	}
}
