package org.javai.specmark.clause;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces section numbers in document order.
 * <p>
 * Ordinary clauses get dotted numeric paths. Top-level annexes are lettered
 * A to Z, then AA, AB, and so on; clauses nested in an annex are numbered
 * relative to its letter ({@code A.1}, {@code A.1.1}). Entering a clause at some
 * depth resets every deeper counter, so later siblings never inherit stale
 * sub-numbers.
 */
public class ClauseNumberer {

	// counters.get(0) is the top-level clause count and survives annexes
	private final List<Integer> counters = new ArrayList<>();
	private int annexCount = 0;
	private boolean inAnnex = false;

	/**
	 * Returns the next number for a clause entered at {@code depth} (0 for top level).
	 *
	 * @param annex whether the clause is an annex element; only significant at depth 0
	 */
	public String next(int depth, boolean annex) {
		if (depth < 0) {
			throw new IllegalArgumentException("depth must be >= 0");
		}
		if (counters.isEmpty()) {
			counters.add(0);
		}

		if (depth == 0) {
			truncate(1);
			if (annex) {
				annexCount++;
				inAnnex = true;
				return annexLetter(annexCount);
			}
			inAnnex = false;
			counters.set(0, counters.get(0) + 1);
			return String.valueOf(counters.get(0));
		}

		while (counters.size() <= depth) {
			counters.add(0);
		}
		counters.set(depth, counters.get(depth) + 1);
		truncate(depth + 1);

		StringBuilder number = new StringBuilder(inAnnex ? annexLetter(annexCount) : String.valueOf(counters.get(0)));
		for (int level = 1; level <= depth; level++) {
			number.append('.').append(counters.get(level));
		}
		return number.toString();
	}

	/**
	 * Whether the most recent top-level clause was an annex.
	 */
	public boolean inAnnex() {
		return inAnnex;
	}

	/**
	 * Bijective base-26 letters: 1 is A, 26 is Z, 27 is AA, 28 is AB.
	 */
	static String annexLetter(int index) {
		StringBuilder letters = new StringBuilder();
		int n = index;
		while (n > 0) {
			n--;
			letters.append((char) ('A' + n % 26));
			n /= 26;
		}
		return letters.reverse().toString();
	}

	private void truncate(int size) {
		while (counters.size() > size) {
			counters.remove(counters.size() - 1);
		}
	}
}
