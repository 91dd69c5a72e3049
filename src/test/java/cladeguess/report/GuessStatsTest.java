package cladeguess.report;

import org.junit.Test;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;

public class GuessStatsTest {

	@Test
	public void testLeaf() {
		GuessStats leaf = GuessStats.combine(new ArrayList<GuessStats>());
		assertEquals(1, leaf.getMax());
		assertEquals(1, leaf.getSum());
		assertEquals(1, leaf.getCount());
		assertEquals(1.0, leaf.getAverage(), 1e-12);
		assertEquals("1", leaf.formatAverage());
	}

	@Test
	public void testCombine() {
		GuessStats a = new GuessStats(3, 7, 4);
		GuessStats b = new GuessStats(1, 1, 1);
		GuessStats c = new GuessStats(2, 3, 2);
		GuessStats parent = GuessStats.combine(Arrays.asList(a, b, c));
		assertEquals(4, parent.getMax());
		// 1 + (7 + 4) + (1 + 1) + (3 + 2)
		assertEquals(19, parent.getSum());
		assertEquals(8, parent.getCount());
		assertEquals(19.0 / 8, parent.getAverage(), 1e-12);
	}

	@Test
	public void testFormatAverage() {
		assertEquals("1.667", new GuessStats(2, 5, 3).formatAverage());
		assertEquals("1.5", new GuessStats(2, 3, 2).formatAverage());
		assertEquals("2", new GuessStats(3, 12, 6).formatAverage());
		assertEquals("3.143", new GuessStats(5, 22, 7).formatAverage());
		assertEquals("12.35", new GuessStats(20, 1235, 100).formatAverage());
		assertEquals("max=2, avg=1.667, cnt=3", new GuessStats(2, 5, 3).toString());
	}
}
