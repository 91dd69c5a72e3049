package cladeguess.report;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

/**
 * Lists the bound tree as nested bullets. A species node prints its label and stops there, a node
 * with a single child is replaced by that child, and any other node prints how many species it
 * holds before its children.
 */
public class SpeciesListWriter {

	public List<String> listSpecies(TaxonTree tree) {
		ArrayList<String> lines = new ArrayList<String>();
		listSpecies(tree.getRoot(), 0, lines);
		return lines;
	}

	public void write(TaxonTree tree, Writer out) throws IOException {
		for (String line : listSpecies(tree)) {
			out.write(line);
			out.write("\n");
		}
		out.flush();
	}

	private void listSpecies(TaxonNode node, int indent, List<String> lines) {
		TaxonNode cur = node;
		while (cur.isSpecies() == false && cur.getChildCount() == 1) {
			cur = cur.getChild(0);
		}
		String prefix = StringUtils.repeat("  ", indent) + "* " + cur.getName() + ": ";
		if (cur.isSpecies()) {
			lines.add(prefix + cur.getSpecies());
			return;
		}
		lines.add(prefix + "(" + cur.getLeafSpeciesCount() + " species)");
		for (TaxonNode child : cur.getChildren()) {
			listSpecies(child, indent + 1, lines);
		}
	}
}
