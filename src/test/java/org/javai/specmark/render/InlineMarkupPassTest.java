package org.javai.specmark.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.Test;

class InlineMarkupPassTest {

	private final InlineMarkupPass pass = new InlineMarkupPass(new EmdLiteRenderer());

	private static Element fragment(String html) {
		return Jsoup.parseBodyFragment(html).body().child(0);
	}

	@Test
	void shouldRenderRunsAndPreserveSurroundingWhitespace() {
		Element div = fragment("<div><p> Let _x_ be 1. </p></div>");

		int replaced = pass.apply(div);

		Element p = div.selectFirst("p");
		assertThat(replaced).isEqualTo(1);
		assertThat(p.selectFirst("var").text()).isEqualTo("x");
		assertThat(((TextNode) p.childNode(0)).getWholeText()).isEqualTo(" Let ");
		assertThat(((TextNode) p.childNode(p.childNodeSize() - 1)).getWholeText()).isEqualTo(" be 1. ");
	}

	@Test
	void shouldNotDescendIntoOpaqueElements() {
		Element div = fragment("<div><pre>_y_</pre><emu-alg>1. Let _z_ be 2.</emu-alg><code>_w_</code></div>");

		int replaced = pass.apply(div);

		assertThat(replaced).isZero();
		assertThat(div.select("var")).isEmpty();
		assertThat(div.selectFirst("emu-alg").text()).isEqualTo("1. Let _z_ be 2.");
	}

	@Test
	void shouldLeavePlainTextNodesUntouched() {
		Element div = fragment("<div>plain text</div>");
		TextNode original = (TextNode) div.childNode(0);

		assertThat(pass.apply(div)).isZero();
		assertThat(div.childNode(0)).isSameAs(original);
	}

	@Test
	void shouldDelegateToTheConfiguredRenderer() {
		InlineMarkupPass shouting = new InlineMarkupPass(text -> "<b>" + text.toUpperCase() + "</b>");
		Element div = fragment("<div>hello <i>world</i></div>");

		assertThat(shouting.apply(div)).isEqualTo(2);
		assertThat(div.select("b")).extracting(Element::text).containsExactly("HELLO", "WORLD");
	}
}
