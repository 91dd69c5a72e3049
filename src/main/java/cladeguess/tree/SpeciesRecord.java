package cladeguess.tree;

/**
 * One playable species: the label shown in the game and the scientific name of its outline node.
 */
public class SpeciesRecord {
	private final String label;
	private final String scientific;

	public SpeciesRecord(String label, String scientific) {
		this.label = label;
		this.scientific = scientific;
	}

	public String getLabel() {return this.label;}

	public String getScientific() {return this.scientific;}

	@Override
	public String toString() {
		return this.label + " (" + this.scientific + ")";
	}
}
