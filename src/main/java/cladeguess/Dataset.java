package cladeguess;

import java.io.File;

/**
 * The two games an analysis can be run for, and where their files live under a data directory.
 */
public enum Dataset {
    METAZOOA("metazooa"),
    METAFLORA("metaflora");

    private final String name;

    Dataset(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the dataset called `name`, or null if there is none
     */
    public static Dataset forName(String name) {
        for (Dataset d : values()) {
            if (d.name.equals(name)) {
                return d;
            }
        }
        return null;
    }

    public File getOutlineFile(File dataDir) {
        return new File(new File(dataDir, "input"), "phylo-" + name + ".txt");
    }

    public File getSpeciesFile(File dataDir) {
        return new File(new File(dataDir, "input"), "game-" + name + ".json");
    }

    public File getSpeciesListFile(File dataDir) {
        return new File(new File(dataDir, "output"), "species-" + name + ".txt");
    }

    public File getTreeJSONFile(File dataDir) {
        return new File(new File(dataDir, "output"), "species-" + name + ".json");
    }

    public File getDecisionFile(File dataDir) {
        return new File(new File(dataDir, "output"), "decision-" + name + ".txt");
    }

    @Override
    public String toString() {
        return name;
    }
}
