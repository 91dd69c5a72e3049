package cladeguess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import cladeguess.tree.OutlineReader;
import cladeguess.tree.SpeciesBinder;
import cladeguess.tree.SpeciesRecord;
import cladeguess.tree.TaxonTree;

/**
 * Small outlines shared by the tests.
 */
public class TreeFixtures {

	public static final List<String> APES = Arrays.asList(
		"Hominoidea",
		"+-Hominidae",
		"| +-Homininae",
		"| | +-Hominini",
		"| | | +-Homo sapiens",
		"| | | \\-Pan troglodytes",
		"| | \\-Gorilla gorilla",
		"| \\-Pongo pygmaeus",
		"\\-Hylobatidae",
		"  +-Hylobates lar",
		"  \\-Nomascus leucogenys");

	public static final List<SpeciesRecord> APE_SPECIES = Arrays.asList(
		new SpeciesRecord("human", "Homo sapiens"),
		new SpeciesRecord("chimp", "Pan troglodytes"),
		new SpeciesRecord("gorilla", "Gorilla gorilla"),
		new SpeciesRecord("orang", "Pongo pygmaeus"),
		new SpeciesRecord("lar gibbon", "Hylobates lar"),
		new SpeciesRecord("white-cheeked gibbon", "Nomascus leucogenys"));

	public static final List<String> CARNIVORES = Arrays.asList(
		"Carnivora",
		"+-Felidae",
		"| \\-Felis catus",
		"\\-Canidae",
		"  +-Canis familiaris",
		"  \\-Canis lupus");

	public static final List<SpeciesRecord> CARNIVORE_SPECIES = Arrays.asList(
		new SpeciesRecord("cat", "Felis catus"),
		new SpeciesRecord("dog", "Canis familiaris"),
		new SpeciesRecord("wolf", "Canis lupus"));

	public static TaxonTree bound(List<String> outline, List<SpeciesRecord> species) throws Exception {
		TaxonTree tree = new OutlineReader().readOutline(outline);
		new SpeciesBinder(tree).bind(species);
		return tree;
	}

	public static TaxonTree apes() throws Exception {
		return bound(APES, APE_SPECIES);
	}

	public static TaxonTree carnivores() throws Exception {
		return bound(CARNIVORES, CARNIVORE_SPECIES);
	}

	/**
	 * Turns species-listing lines back into an outline with the same nesting.
	 */
	public static List<String> listingToOutline(List<String> listing) {
		ArrayList<String> outline = new ArrayList<String>();
		for (String line : listing) {
			int spaces = 0;
			while (line.charAt(spaces) == ' ') {
				spaces++;
			}
			int indent = spaces / 2;
			String rest = line.substring(spaces + 2);
			String name = rest.substring(0, rest.indexOf(": "));
			if (indent == 0) {
				outline.add(name);
			} else {
				StringBuilder sb = new StringBuilder();
				for (int i = 0; i < 2 * (indent - 1); i++) {
					sb.append(' ');
				}
				outline.add(sb.append("+-").append(name).toString());
			}
		}
		return outline;
	}
}
