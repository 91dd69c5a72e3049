package cladeguess.report;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Guess counts over the species resolved in one subtree of a guess tree.
 * `max` is the worst number of guesses, `sum` the total over every species, `count` the
 * number of species.
 */
public class GuessStats {

	private final int max;
	private final long sum;
	private final int count;

	public GuessStats(int max, long sum, int count) {
		this.max = max;
		this.sum = sum;
		this.count = count;
	}

	/**
	 * Stats of a step given the stats of its follow-up steps: the guess itself resolves one
	 * species, and every species below costs this step's guess on top of its own.
	 */
	public static GuessStats combine(List<GuessStats> children) {
		int max = 0;
		long sum = 1;
		int count = 1;
		for (GuessStats child : children) {
			max = Math.max(max, child.max);
			sum += child.sum + child.count;
			count += child.count;
		}
		return new GuessStats(max + 1, sum, count);
	}

	public int getMax() {return max;}

	public long getSum() {return sum;}

	public int getCount() {return count;}

	public double getAverage() {return (double) sum / count;}

	/**
	 * @return the average to 4 significant digits, without trailing zeros
	 */
	public String formatAverage() {
		BigDecimal avg = new BigDecimal(sum).divide(new BigDecimal(count), new MathContext(4));
		return avg.stripTrailingZeros().toPlainString();
	}

	@Override
	public String toString() {
		return "max=" + max + ", avg=" + formatAverage() + ", cnt=" + count;
	}
}
