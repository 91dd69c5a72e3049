package cladeguess.tree;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import cladeguess.exceptions.DataFormatException;

/**
 * Reads the indented ASCII outline of a classification, e.g.
 *
 * <pre>
 * Animalia
 * +-Chordata
 * | +-Felis catus
 * | \-Canis lupus
 * \-Arthropoda
 * </pre>
 *
 * The first line without drawing characters is the root. Every other node is introduced by a
 * "+-" or "\-" marker whose column gives its level (two columns per level).
 */
public class OutlineReader {
	static Logger _LOG = Logger.getLogger(OutlineReader.class);

	/*
	 * one parsed line
	 */
	static class OutlineEntry {
		final int level;
		final String name;

		OutlineEntry(int level, String name) {
			this.level = level;
			this.name = name;
		}
	}

	public OutlineReader() {
	}

	public TaxonTree readOutline(String filename) throws IOException, DataFormatException {
		_LOG.info("Reading outline from file: " + filename);
		Reader r = new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8);
		try {
			return readOutline(r);
		} finally {
			r.close();
		}
	}

	public TaxonTree readOutline(Reader r) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(r);
		ArrayList<String> lines = new ArrayList<String>();
		String str;
		while ((str = br.readLine()) != null) {
			lines.add(str);
		}
		return readOutline(lines);
	}

	/**
	 * Builds the tree described by `lines`.
	 * @throws DataFormatException if the outline holds no node, repeats a name, or has a node
	 *		that no earlier line can be the parent of
	 */
	public TaxonTree readOutline(List<String> lines) throws DataFormatException {
		// most recent node seen at each level
		TreeMap<Integer, TaxonNode> frontier = new TreeMap<Integer, TaxonNode>();
		TaxonTree tree = null;
		int lineNumber = 0;
		for (String line : lines) {
			lineNumber++;
			if (StringUtils.isBlank(line)) {
				continue;
			}
			OutlineEntry entry = parseLine(line);
			if (entry == null) {
				_LOG.warn("skipping outline line " + lineNumber + " without a node: \"" + line + "\"");
				continue;
			}
			TaxonNode node = new TaxonNode(entry.name);
			if (tree == null) {
				// first node is the root, whatever its level
				tree = new TaxonTree(node);
				tree.registerNode(node);
				frontier.put(entry.level, node);
				continue;
			}
			TaxonNode parent = null;
			for (int parentLevel = entry.level - 1; parentLevel >= 0; parentLevel--) {
				parent = frontier.get(parentLevel);
				if (parent != null) {
					break;
				}
			}
			if (parent == null) {
				throw new DataFormatException("no parent for '" + entry.name + "' at level " + entry.level + " (line " + lineNumber + ")");
			}
			try {
				tree.registerNode(node);
			} catch (DataFormatException dfe) {
				throw new DataFormatException(dfe.getMessage() + " (line " + lineNumber + ")", dfe);
			}
			parent.addChild(node);
			_LOG.trace("attached " + node.getName() + " under " + parent.getName());
			frontier.put(entry.level, node);
			frontier.tailMap(entry.level, false).clear();
		}
		if (tree == null) {
			throw new DataFormatException("outline contains no nodes");
		}
		_LOG.info("Read " + tree.getNodeCount() + " nodes; root is " + tree.getRoot().getName());
		return tree;
	}

	/**
	 * @return the level and name encoded in `line`, or null if the line names no node
	 */
	static OutlineEntry parseLine(String line) {
		if (line.isEmpty()) {
			return null;
		}
		char first = line.charAt(0);
		if (first != ' ' && first != '|' && first != '+' && first != '\\') {
			String name = line.trim();
			return name.isEmpty() ? null : new OutlineEntry(0, name);
		}
		int markerPos = findMarker(line);
		if (markerPos == -1) {
			return null;
		}
		String name = line.substring(markerPos + 2).trim();
		if (name.isEmpty()) {
			return null;
		}
		return new OutlineEntry(markerPos / 2 + 1, name);
	}

	/**
	 * @return column of the first "+-" or "\-" in `line`, or -1
	 */
	static int findMarker(String line) {
		for (int i = 0; i < line.length() - 1; i++) {
			char c = line.charAt(i);
			if ((c == '+' || c == '\\') && line.charAt(i + 1) == '-') {
				return i;
			}
		}
		return -1;
	}
}
