package cladeguess.tree;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import cladeguess.exceptions.AmbiguousTaxonException;
import cladeguess.exceptions.TaxonNotFoundException;

/**
 * Attaches the playable species to the nodes of a parsed outline and records, on every
 * ancestor, which species lie beneath it.
 */
public class SpeciesBinder {
	static Logger _LOG = Logger.getLogger(SpeciesBinder.class);

	private final TaxonTree tree;

	public SpeciesBinder(TaxonTree tree) {
		this.tree = tree;
	}

	/**
	 * Binds every record. All unknown scientific names are collected before failing so that
	 * a single run reports all of them.
	 *
	 * @throws TaxonNotFoundException if any scientific name is not in the tree
	 * @throws AmbiguousTaxonException if a node or a label would be bound twice inconsistently
	 */
	public void bind(List<SpeciesRecord> records) throws TaxonNotFoundException {
		ArrayList<String> missing = new ArrayList<String>();
		for (SpeciesRecord rec : records) {
			if (tree.hasNode(rec.getScientific()) == false) {
				missing.add(rec.getScientific());
			}
		}
		if (missing.isEmpty() == false) {
			throw new TaxonNotFoundException(missing);
		}
		for (SpeciesRecord rec : records) {
			bind(rec.getLabel(), rec.getScientific());
		}
		_LOG.info("Bound " + tree.getSpeciesCount() + " species; root covers " + tree.getRoot().getLeafSpeciesCount());
	}

	/**
	 * Binds `label` to the node named `scientific` and adds it to the leaf set of that node and
	 * every ancestor. Binding the same pair twice is a no-op.
	 */
	public void bind(String label, String scientific) throws TaxonNotFoundException {
		TaxonNode node = tree.getNode(scientific);
		if (node.isSpecies()) {
			if (node.getSpecies().equals(label)) {
				return;
			}
			throw new AmbiguousTaxonException(scientific, node.getSpecies(), label);
		}
		if (tree.getSpeciesLabels().contains(label)) {
			throw new AmbiguousTaxonException(label, tree.getSpeciesNode(label).getName(), scientific);
		}
		node.setSpecies(label);
		tree.registerSpecies(label, node);
		TaxonNode cur = node;
		while (cur != null) {
			cur.addLeafSpecies(label);
			cur = cur.getParent();
		}
		_LOG.debug("bound " + label + " to " + scientific);
	}
}
