package cladeguess.report;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import cladeguess.TreeFixtures;
import cladeguess.exceptions.DecisionTreeCheckException;
import cladeguess.synthesis.DecisionNode;
import cladeguess.synthesis.DecisionTreeSynthesizer;
import cladeguess.synthesis.GreedyGuessSelector;
import cladeguess.tree.TaxonNode;
import cladeguess.tree.TaxonTree;

public class DecisionTreeReporterTest {

	protected TaxonTree carnivores;
	protected TaxonNode carnivora;
	protected TaxonNode canidae;

	@Before
	public void setUp() throws Exception {
		carnivores = TreeFixtures.carnivores();
		carnivora = carnivores.getRoot();
		canidae = carnivores.getNode("Canidae");
	}

	@Test
	public void testCatDogWolfReport() throws Exception {
		DecisionNode root = new DecisionTreeSynthesizer(carnivores).synthesize();
		DecisionReport report = new DecisionTreeReporter(carnivores).buildReport(root);
		assertEquals(Arrays.asList(
			"* Carnivora: dog (max=2, avg=1.667, cnt=3)",
			"  * Canidae: wolf (max=1, avg=1, cnt=1)",
			"  * Carnivora: cat (max=1, avg=1, cnt=1)"), report.getLines());
		assertEquals(2, report.getStats().getMax());
		assertEquals(5, report.getStats().getSum());
		assertEquals(3, report.getStats().getCount());
	}

	@Test
	public void testApesReport() throws Exception {
		TaxonTree apes = TreeFixtures.apes();
		DecisionReport report = new DecisionTreeReporter(apes).buildReport(new DecisionTreeSynthesizer(apes).synthesize());
		assertEquals(Arrays.asList(
			"* Hominoidea: chimp (max=3, avg=2, cnt=6)",
			"  * Hominidae: orang (max=1, avg=1, cnt=1)",
			"  * Homininae: gorilla (max=1, avg=1, cnt=1)",
			"  * Hominini: human (max=1, avg=1, cnt=1)",
			"  * Hominoidea: lar gibbon (max=2, avg=1.5, cnt=2)",
			"    * Hylobatidae: white-cheeked gibbon (max=1, avg=1, cnt=1)"), report.getLines());

		StringWriter out = new StringWriter();
		report.write(out);
		assertTrue(out.toString().startsWith("* Hominoidea: chimp (max=3, avg=2, cnt=6)\n  * Hominidae: orang"));
		assertTrue(out.toString().endsWith("white-cheeked gibbon (max=1, avg=1, cnt=1)\n"));
	}

	@Test
	public void testReportIsDeterministic() throws Exception {
		TaxonTree apes = TreeFixtures.apes();
		StringWriter first = new StringWriter();
		new DecisionTreeReporter(apes).buildReport(new DecisionTreeSynthesizer(apes).synthesize()).write(first);
		TaxonTree again = TreeFixtures.apes();
		StringWriter second = new StringWriter();
		new DecisionTreeReporter(again).buildReport(new DecisionTreeSynthesizer(again).synthesize()).write(second);
		assertEquals(first.toString(), second.toString());
	}

	@Test
	public void testGreedyTreePassesChecks() throws Exception {
		TaxonTree apes = TreeFixtures.apes();
		DecisionNode root = new DecisionTreeSynthesizer(apes, new GreedyGuessSelector(apes)).synthesize();
		DecisionReport report = new DecisionTreeReporter(apes).buildReport(root);
		assertEquals(6, report.getStats().getCount());
		assertEquals(report.getStats().getCount(), report.getLines().size());
	}

	@Test(expected = DecisionTreeCheckException.class)
	public void testMisplacedSpecies() throws Exception {
		// wolf shares Canidae with dog, so it cannot be answered with Carnivora
		Map<TaxonNode, DecisionNode> branches = new LinkedHashMap<TaxonNode, DecisionNode>();
		branches.put(canidae, new DecisionNode(canidae, "cat", set("cat"), new LinkedHashMap<TaxonNode, DecisionNode>()));
		branches.put(carnivora, new DecisionNode(carnivora, "wolf", set("wolf"), new LinkedHashMap<TaxonNode, DecisionNode>()));
		new DecisionTreeReporter(carnivores).buildReport(new DecisionNode(carnivora, "dog", set("dog", "wolf", "cat"), branches));
	}

	@Test(expected = DecisionTreeCheckException.class)
	public void testMissingSpecies() throws Exception {
		Map<TaxonNode, DecisionNode> branches = new LinkedHashMap<TaxonNode, DecisionNode>();
		branches.put(canidae, leaf(canidae, "wolf"));
		new DecisionTreeReporter(carnivores).buildReport(new DecisionNode(carnivora, "dog", set("dog", "wolf"), branches));
	}

	@Test(expected = DecisionTreeCheckException.class)
	public void testOverlappingBranches() throws Exception {
		Map<TaxonNode, DecisionNode> inner = new LinkedHashMap<TaxonNode, DecisionNode>();
		inner.put(canidae, leaf(canidae, "wolf"));
		Map<TaxonNode, DecisionNode> branches = new LinkedHashMap<TaxonNode, DecisionNode>();
		branches.put(canidae, leaf(canidae, "wolf"));
		branches.put(carnivora, new DecisionNode(carnivora, "cat", set("cat", "wolf"), inner));
		new DecisionTreeReporter(carnivores).buildReport(new DecisionNode(carnivora, "dog", set("dog", "wolf", "cat"), branches));
	}

	@Test(expected = DecisionTreeCheckException.class)
	public void testGuessOutsideCandidates() throws Exception {
		DecisionNode root = new DecisionNode(carnivora, "dog", set("cat"), new LinkedHashMap<TaxonNode, DecisionNode>());
		new DecisionTreeReporter(carnivores).buildReport(root, set("cat"));
	}

	@Test(expected = DecisionTreeCheckException.class)
	public void testAnswerDoesNotMatchStep() throws Exception {
		Map<TaxonNode, DecisionNode> branches = new LinkedHashMap<TaxonNode, DecisionNode>();
		branches.put(canidae, leaf(carnivora, "wolf"));
		branches.put(carnivora, leaf(carnivora, "cat"));
		new DecisionTreeReporter(carnivores).buildReport(new DecisionNode(carnivora, "dog", set("dog", "wolf", "cat"), branches));
	}

	@Test
	public void testCheckMessageNamesTheSpecies() throws Exception {
		Map<TaxonNode, DecisionNode> branches = new LinkedHashMap<TaxonNode, DecisionNode>();
		branches.put(carnivora, new DecisionNode(carnivora, "cat", set("cat", "wolf"),
			singleBranch(carnivora, leaf(carnivora, "wolf"))));
		try {
			new DecisionTreeReporter(carnivores).buildReport(new DecisionNode(carnivora, "dog", set("dog", "wolf", "cat"), branches));
			fail("expected DecisionTreeCheckException");
		} catch (DecisionTreeCheckException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("'wolf'"));
		}
	}

	private static DecisionNode leaf(TaxonNode subject, String guess) {
		return new DecisionNode(subject, guess, set(guess), new LinkedHashMap<TaxonNode, DecisionNode>());
	}

	private static Map<TaxonNode, DecisionNode> singleBranch(TaxonNode answer, DecisionNode next) {
		Map<TaxonNode, DecisionNode> ret = new LinkedHashMap<TaxonNode, DecisionNode>();
		ret.put(answer, next);
		return ret;
	}

	private static Set<String> set(String... labels) {
		return new LinkedHashSet<String>(Arrays.asList(labels));
	}

	@Test
	public void testUniverseMustMatch() throws Exception {
		DecisionNode root = new DecisionTreeSynthesizer(carnivores).synthesize();
		try {
			new DecisionTreeReporter(carnivores).buildReport(root, new HashSet<String>(Arrays.asList("dog", "wolf", "cat", "fox")));
			fail("expected DecisionTreeCheckException");
		} catch (DecisionTreeCheckException e) {
			assertTrue(e.getMessage().contains("fox"));
		}
	}
}
