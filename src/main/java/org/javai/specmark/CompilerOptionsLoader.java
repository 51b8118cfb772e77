package org.javai.specmark;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link CompilerOptions} from YAML. Keys that are absent keep their defaults.
 *
 * <pre>
 * namespace: https://example.org/spec/
 * strict_headers: false
 * inline_markup: true
 * known_effects:
 *   - user-code
 * </pre>
 */
public class CompilerOptionsLoader {

	private static final Logger logger = LoggerFactory.getLogger(CompilerOptionsLoader.class);

	public static final String DEFAULT_RESOURCE = "specmark.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when it is absent.
	 */
	public CompilerOptions loadDefault(ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using default options", DEFAULT_RESOURCE);
				return CompilerOptions.defaults();
			}
			return load(is);
		} catch (SpecCompilationException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecCompilationException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public CompilerOptions load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (SpecCompilationException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecCompilationException("Failed to read options from path: " + path, e);
		}
	}

	public CompilerOptions load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (SpecCompilationException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecCompilationException("Failed to parse options from input stream", e);
		}
	}

	public CompilerOptions load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (SpecCompilationException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecCompilationException("Failed to parse options from reader", e);
		}
	}

	public CompilerOptions loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (SpecCompilationException e) {
			throw e;
		} catch (Exception e) {
			throw new SpecCompilationException("Failed to parse options from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private CompilerOptions build(Object loaded) {
		CompilerOptions defaults = CompilerOptions.defaults();
		if (loaded == null) {
			return defaults;
		}
		if (!(loaded instanceof Map)) {
			throw new SpecCompilationException("Options must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) loaded;

		String namespace = data.containsKey("namespace") ? String.valueOf(data.get("namespace")) : defaults.namespace();
		boolean strictHeaders = toBoolean(data, "strict_headers", defaults.strictHeaders());
		boolean inlineMarkup = toBoolean(data, "inline_markup", defaults.inlineMarkup());
		List<String> knownEffects = defaults.knownEffects();
		Object effects = data.get("known_effects");
		if (effects instanceof List<?> list) {
			knownEffects = new ArrayList<>();
			for (Object effect : list) {
				knownEffects.add(String.valueOf(effect));
			}
		} else if (effects != null) {
			throw new SpecCompilationException("known_effects must be a list");
		}

		return new CompilerOptions(namespace, strictHeaders, inlineMarkup, knownEffects);
	}

	private static boolean toBoolean(Map<String, Object> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new SpecCompilationException("Option " + key + " must be true or false, found: " + value);
	}
}
