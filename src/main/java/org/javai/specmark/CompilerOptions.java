package org.javai.specmark;

import java.util.List;
import java.util.Objects;
import org.javai.specmark.effect.Effects;

/**
 * Settings for one compile run.
 *
 * @param namespace name of the document namespace in the bibliography
 * @param strictHeaders when true, a clause without any header aborts compilation
 * @param inlineMarkup whether text runs are passed through the inline renderer
 * @param knownEffects effect names accepted without an {@code unknown-effect} diagnostic
 */
public record CompilerOptions(String namespace, boolean strictHeaders, boolean inlineMarkup,
		List<String> knownEffects) {

	public static final String DEFAULT_NAMESPACE = "https://tc39.es/ecma262/";

	public CompilerOptions {
		Objects.requireNonNull(namespace, "namespace must not be null");
		if (namespace.isBlank()) {
			throw new IllegalArgumentException("namespace must not be blank");
		}
		knownEffects = knownEffects == null ? List.of(Effects.USER_CODE) : List.copyOf(knownEffects);
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(DEFAULT_NAMESPACE, false, true, List.of(Effects.USER_CODE));
	}

	public CompilerOptions withNamespace(String namespace) {
		return new CompilerOptions(namespace, strictHeaders, inlineMarkup, knownEffects);
	}

	public CompilerOptions withStrictHeaders(boolean strictHeaders) {
		return new CompilerOptions(namespace, strictHeaders, inlineMarkup, knownEffects);
	}

	public CompilerOptions withInlineMarkup(boolean inlineMarkup) {
		return new CompilerOptions(namespace, strictHeaders, inlineMarkup, knownEffects);
	}
}
