package cladeguess.report;

import java.io.IOException;
import java.io.Writer;
import java.util.Collections;
import java.util.List;

/**
 * The checked, printable form of a guess tree.
 */
public class DecisionReport {

	private final List<String> lines;
	private final GuessStats stats;

	DecisionReport(List<String> lines, GuessStats stats) {
		this.lines = Collections.unmodifiableList(lines);
		this.stats = stats;
	}

	public List<String> getLines() {return lines;}

	/**
	 * @return stats of the whole tree
	 */
	public GuessStats getStats() {return stats;}

	public void write(Writer out) throws IOException {
		for (String line : lines) {
			out.write(line);
			out.write("\n");
		}
		out.flush();
	}
}
