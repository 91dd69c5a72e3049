package cladeguess;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import cladeguess.exceptions.DataFormatException;
import cladeguess.exceptions.DecisionTreeCheckException;
import cladeguess.exceptions.MultipleHitsException;
import cladeguess.exceptions.StoredEntityNotFoundException;
import cladeguess.exceptions.TaxonNotFoundException;
import cladeguess.report.DecisionReport;
import cladeguess.report.DecisionTreeReporter;
import cladeguess.report.SpeciesListWriter;
import cladeguess.synthesis.DecisionNode;
import cladeguess.synthesis.DecisionTreeSynthesizer;
import cladeguess.synthesis.GreedyGuessSelector;
import cladeguess.synthesis.GuessOrdering;
import cladeguess.synthesis.GuessSelector;
import cladeguess.synthesis.OrderedGuessSelector;
import cladeguess.tree.OutlineReader;
import cladeguess.tree.SpeciesBinder;
import cladeguess.tree.SpeciesRecord;
import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

public class MainRunner {
    static Logger _LOG = Logger.getLogger(MainRunner.class);

    /**
     * Reads the outline and species of `dataset` under `dataDir` and binds them.
     */
    public TaxonTree loadTree(Dataset dataset, File dataDir) throws IOException, DataFormatException, TaxonNotFoundException {
        File outlineFile = dataset.getOutlineFile(dataDir);
        File speciesFile = dataset.getSpeciesFile(dataDir);
        if (!outlineFile.exists()) {
            throw new IOException("Could not open the outline file '" + outlineFile + "'");
        }
        if (!speciesFile.exists()) {
            throw new IOException("Could not open the species file '" + speciesFile + "'");
        }
        TaxonTree tree = new OutlineReader().readOutline(outlineFile.getPath());
        List<SpeciesRecord> species = new SpeciesListReader().readSpecies(speciesFile.getPath());
        if (species.isEmpty()) {
            throw new DataFormatException("species list '" + speciesFile + "' names no species");
        }
        new SpeciesBinder(tree).bind(species);
        return tree;
    }

    // @returns 0 for success, 1 for poorly formed command
    public int analyse(String [] args) throws IOException, DataFormatException, TaxonNotFoundException, DecisionTreeCheckException {
        String usageString = "arguments should be: dataset[metazooa|metaflora] (datadir) (greedy)";
        if (args.length < 2 || args.length > 4) {
            System.out.println(usageString);
            return 1;
        }
        Dataset dataset = Dataset.forName(args[1]);
        if (dataset == null) {
            System.out.println("unknown dataset '" + args[1] + "'");
            System.out.println(usageString);
            return 1;
        }
        File dataDir = new File(".");
        boolean greedy = false;
        for (int i = 2; i < args.length; i++) {
            if (args[i].equals("greedy")) {
                greedy = true;
            } else if (i == 2) {
                dataDir = new File(args[i]);
            } else {
                System.out.println(usageString);
                return 1;
            }
        }

        TaxonTree tree = loadTree(dataset, dataDir);
        GuessSelector selector;
        if (greedy) {
            selector = new GreedyGuessSelector(tree);
        } else {
            selector = new OrderedGuessSelector(new GuessOrdering(tree));
        }
        DecisionNode decisionTree = new DecisionTreeSynthesizer(tree, selector).synthesize();
        // nothing is written unless the guess tree passes its checks
        DecisionReport report = new DecisionTreeReporter(tree).buildReport(decisionTree);

        File speciesListFile = dataset.getSpeciesListFile(dataDir);
        File outDir = speciesListFile.getParentFile();
        if (!outDir.isDirectory() && !outDir.mkdirs()) {
            throw new IOException("Could not create the output directory '" + outDir + "'");
        }
        Writer out = openWriter(speciesListFile);
        try {
            new SpeciesListWriter().write(tree, out);
        } finally {
            out.close();
        }
        out = openWriter(dataset.getTreeJSONFile(dataDir));
        try {
            tree.toJSON().writeJSONString(out);
            out.write("\n");
        } finally {
            out.close();
        }
        out = openWriter(dataset.getDecisionFile(dataDir));
        try {
            report.write(out);
        } finally {
            out.close();
        }

        System.out.println(dataset + ": " + tree.getSpeciesCount() + " species, " + report.getStats());
        System.out.println("Wrote " + speciesListFile + ", " + dataset.getTreeJSONFile(dataDir) + " and " + dataset.getDecisionFile(dataDir));
        return 0;
    }

    // @returns 0 for success, 1 for poorly formed command
    public int lca(String [] args) throws IOException, DataFormatException, TaxonNotFoundException {
        if (args.length < 5) {
            System.out.println("arguments should be: dataset[metazooa|metaflora] datadir species species ...");
            return 1;
        }
        Dataset dataset = Dataset.forName(args[1]);
        if (dataset == null) {
            System.out.println("unknown dataset '" + args[1] + "'");
            return 1;
        }
        TaxonTree tree = loadTree(dataset, new File(args[2]));
        List<String> labels = Arrays.asList(args).subList(3, args.length);
        ArrayList<String> missing = new ArrayList<String>();
        for (String label : labels) {
            if (!tree.getSpeciesLabels().contains(label)) {
                missing.add(label);
            }
        }
        if (!missing.isEmpty()) {
            throw new TaxonNotFoundException(missing);
        }
        TaxonNode mrca = tree.getMRCA(labels);
        System.out.println(mrca.getName() + " (" + mrca.getLeafSpeciesCount() + " species)");
        return 0;
    }

    private static Writer openWriter(File f) throws IOException {
        _LOG.info("Writing " + f);
        return new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8);
    }

    public static void printHelp() {
        System.out.println("==========================");
        System.out.println("usage: cladeguess is run as:");
        System.out.println("");
        System.out.println("analyse dataset[metazooa|metaflora] (datadir) (greedy)");
        System.out.println("    reads datadir/input/phylo-<dataset>.txt and datadir/input/game-<dataset>.json,");
        System.out.println("    writes the species listing, tree JSON and guess tree under datadir/output");
        System.out.println("lca dataset[metazooa|metaflora] datadir species species ...");
        System.out.println("    prints the lowest common ancestor of the given species");
        System.out.println("");
    }

    /**
     * @param args
     * @throws Exception
     */
    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            printHelp();
            System.exit(1);
        }
        String command = args[0];
        if (command.compareTo("help") == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printHelp();
            System.exit(0);
        }
        int cmdReturnCode = 0;
        String action = "Command \"" + command + "\"";
        try {
            MainRunner mr = new MainRunner();

            if (command.compareTo("analyse") == 0) {
                cmdReturnCode = mr.analyse(args);
            } else if (command.compareTo("lca") == 0) {
                cmdReturnCode = mr.lca(args);
            } else {
                System.err.println("Unrecognized command \"" + command + "\"");
                cmdReturnCode = 2;
            }
        } catch (StoredEntityNotFoundException tnfx) {
            tnfx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (DataFormatException dfx) {
            dfx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (DecisionTreeCheckException dtcx) {
            dtcx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (MultipleHitsException mhx) {
            System.err.println(action + " failed. " + mhx.toString());
            cmdReturnCode = -1;
        } catch (IOException iox) {
            _LOG.error(action + " failed", iox);
            System.err.println(action + " failed. " + iox.getMessage());
            cmdReturnCode = -1;
        }
        if (cmdReturnCode == 2) {
            printHelp();
        }
        System.exit(cmdReturnCode);
    }

}
