package org.javai.specmark;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.util.Objects;
import org.junit.jupiter.api.Test;

class CompilerOptionsLoaderTest {

	private final CompilerOptionsLoader loader = new CompilerOptionsLoader();

	@Test
	void shouldLoadOptionsFromResource() throws Exception {
		try (InputStream is = getClass().getClassLoader().getResourceAsStream("specmark-test.yml")) {
			CompilerOptions options = loader.load(is);

			assertThat(options.namespace()).isEqualTo("https://example.org/proposal/");
			assertThat(options.strictHeaders()).isTrue();
			assertThat(options.inlineMarkup()).isFalse();
			assertThat(options.knownEffects()).containsExactly("user-code", "allocation");
		}
	}

	@Test
	void shouldLoadOptionsFromPath() throws Exception {
		URL resource = Objects.requireNonNull(getClass().getClassLoader().getResource("specmark-test.yml"));

		CompilerOptions options = loader.load(Path.of(resource.toURI()));

		assertThat(options.namespace()).isEqualTo("https://example.org/proposal/");
	}

	@Test
	void shouldKeepDefaultsForAbsentKeys() {
		CompilerOptions options = loader.loadString("strict_headers: true\n");

		assertThat(options.namespace()).isEqualTo(CompilerOptions.DEFAULT_NAMESPACE);
		assertThat(options.inlineMarkup()).isTrue();
		assertThat(options.knownEffects()).containsExactly("user-code");
	}

	@Test
	void shouldUseDefaultsForEmptyDocument() {
		assertThat(loader.loadString("")).isEqualTo(CompilerOptions.defaults());
	}

	@Test
	void shouldUseDefaultsWhenNoClasspathResource() {
		assertThat(loader.loadDefault(getClass().getClassLoader())).isEqualTo(CompilerOptions.defaults());
	}

	@Test
	void shouldRejectNonBooleanFlags() {
		assertThatThrownBy(() -> loader.loadString("inline_markup: sometimes\n"))
				.isInstanceOf(SpecCompilationException.class)
				.hasMessageContaining("inline_markup");
	}

	@Test
	void shouldRejectNonMappingDocument() {
		assertThatThrownBy(() -> loader.loadString("- just\n- a list\n"))
				.isInstanceOf(SpecCompilationException.class)
				.hasMessageContaining("mapping");
	}

	@Test
	void shouldWrapMissingFile() {
		assertThatThrownBy(() -> loader.load(Path.of("does-not-exist.yml")))
				.isInstanceOf(SpecCompilationException.class)
				.hasMessageContaining("does-not-exist.yml");
	}
}
