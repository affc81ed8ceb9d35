package org.sensitiveword.core.dictionary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a newline-delimited word list into a {@link Dictionary}.
 *
 * <p>One word per line, UTF-8, {@code \n} or {@code \r\n} terminated. Lines are trimmed; blank lines and
 * lines starting with {@code #} are skipped; repeated words keep their first position.</p>
 */
public class DictionaryLoader {
	private static final Logger logger = LoggerFactory.getLogger(DictionaryLoader.class);

	private static final char BYTE_ORDER_MARK = '\uFEFF';
	private static final String COMMENT_PREFIX = "#";

	/**
	 * Load the dictionary from a file
	 */
	public Dictionary load(Path source) throws SourceUnavailableException {
		if (!Files.isRegularFile(source)) {
			throw new SourceUnavailableException("Dictionary file not found: " + source);
		}

		try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
			return read(reader, source.toString());
		} catch (NoSuchFileException e) {
			throw new SourceUnavailableException("Dictionary file not found: " + source, e);
		} catch (AccessDeniedException e) {
			throw new SourceUnavailableException("Dictionary file is not readable: " + source, e);
		} catch (CharacterCodingException e) {
			throw new SourceUnavailableException("Dictionary file is not valid UTF-8: " + source, e);
		} catch (IOException e) {
			throw new SourceUnavailableException("Failed to read dictionary file " + source + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Load the dictionary from an already opened character source
	 */
	public Dictionary load(Reader source) throws SourceUnavailableException {
		try {
			BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
			return read(reader, "reader");
		} catch (IOException e) {
			throw new SourceUnavailableException("Failed to read dictionary source: " + e.getMessage(), e);
		}
	}

	private Dictionary read(BufferedReader reader, String origin) throws IOException {
		Set<String> words = new LinkedHashSet<>();
		int duplicates = 0;
		boolean firstLine = true;

		String line;
		while ((line = reader.readLine()) != null) {
			if (firstLine && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
				line = line.substring(1);
			}
			firstLine = false;

			String word = line.strip();
			if (word.isEmpty() || word.startsWith(COMMENT_PREFIX)) {
				continue;
			}
			if (!words.add(word)) {
				duplicates++;
			}
		}

		if (duplicates > 0) {
			logger.info("Dropped {} duplicate dictionary entries from {}", duplicates, origin);
		}
		Dictionary dictionary = new Dictionary(List.copyOf(words));
		logger.info("Loaded {} words from dictionary {}", dictionary.size(), origin);
		return dictionary;
	}
}
