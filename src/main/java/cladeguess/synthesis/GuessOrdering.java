package cladeguess.synthesis;

import gnu.trove.impl.Constants;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

/**
 * A fixed total order over every bound species, built post-order with the largest clades first.
 * Each node orders the species of each child, sorts the children's lists by descending size
 * (ties broken by comparing the lists themselves), concatenates them and finally appends its
 * own species, so a clade's own species comes after everything beneath it.
 */
public class GuessOrdering {

	private final ArrayList<String> order;

	private final TObjectIntHashMap<String> ranks;

	public GuessOrdering(TaxonTree tree) {
		this.order = orderSubtree(tree.getRoot());
		this.ranks = new TObjectIntHashMap<String>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, -1);
		for (int i = 0; i < order.size(); i++) {
			ranks.put(order.get(i), i);
		}
	}

	/**
	 * @return every species label, first preferred first
	 */
	public List<String> getOrder() {return Collections.unmodifiableList(order);}

	/**
	 * @return position of `label` in the order, or -1 if it is not a bound species
	 */
	public int rankOf(String label) {return ranks.get(label);}

	public int size() {return order.size();}

	private static ArrayList<String> orderSubtree(TaxonNode node) {
		ArrayList<ArrayList<String>> childOrders = new ArrayList<ArrayList<String>>();
		for (TaxonNode child : node.getChildren()) {
			ArrayList<String> childOrder = orderSubtree(child);
			if (childOrder.isEmpty() == false) {
				childOrders.add(childOrder);
			}
		}
		Collections.sort(childOrders, LARGEST_FIRST);
		ArrayList<String> ret = new ArrayList<String>();
		for (ArrayList<String> childOrder : childOrders) {
			ret.addAll(childOrder);
		}
		if (node.isSpecies()) {
			ret.add(node.getSpecies());
		}
		return ret;
	}

	static final Comparator<List<String>> LARGEST_FIRST = new Comparator<List<String>>() {
		@Override
		public int compare(List<String> a, List<String> b) {
			if (a.size() != b.size()) {
				return b.size() - a.size();
			}
			for (int i = 0; i < a.size(); i++) {
				int c = a.get(i).compareTo(b.get(i));
				if (c != 0) {
					return c;
				}
			}
			return 0;
		}
	};
}
