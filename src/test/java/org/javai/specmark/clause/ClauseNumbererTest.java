package org.javai.specmark.clause;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClauseNumberer")
class ClauseNumbererTest {

	@Test
	@DisplayName("deeper counters reset when a shallower clause starts")
	void resetsDeeperCounters() {
		ClauseNumberer numberer = new ClauseNumberer();

		assertThat(numberer.next(0, false)).isEqualTo("1");
		assertThat(numberer.next(0, false)).isEqualTo("2");
		assertThat(numberer.next(0, false)).isEqualTo("3");
		assertThat(numberer.next(1, false)).isEqualTo("3.1");
		assertThat(numberer.next(1, false)).isEqualTo("3.2");
		assertThat(numberer.next(2, false)).isEqualTo("3.2.1");
		assertThat(numberer.next(0, false)).isEqualTo("4");
		assertThat(numberer.next(1, false)).isEqualTo("4.1");
	}

	@Test
	@DisplayName("annexes are lettered and their children numbered from the letter")
	void annexes() {
		ClauseNumberer numberer = new ClauseNumberer();
		numberer.next(0, false);

		assertThat(numberer.next(0, true)).isEqualTo("A");
		assertThat(numberer.next(1, false)).isEqualTo("A.1");
		assertThat(numberer.next(2, false)).isEqualTo("A.1.1");
		assertThat(numberer.next(1, false)).isEqualTo("A.2");
		assertThat(numberer.next(0, true)).isEqualTo("B");
		assertThat(numberer.next(1, false)).isEqualTo("B.1");
		assertThat(numberer.inAnnex()).isTrue();
	}

	@Test
	@DisplayName("letters continue past Z as AA, AB")
	void annexLetters() {
		assertThat(ClauseNumberer.annexLetter(1)).isEqualTo("A");
		assertThat(ClauseNumberer.annexLetter(26)).isEqualTo("Z");
		assertThat(ClauseNumberer.annexLetter(27)).isEqualTo("AA");
		assertThat(ClauseNumberer.annexLetter(28)).isEqualTo("AB");
		assertThat(ClauseNumberer.annexLetter(52)).isEqualTo("AZ");
		assertThat(ClauseNumberer.annexLetter(53)).isEqualTo("BA");
	}
}
