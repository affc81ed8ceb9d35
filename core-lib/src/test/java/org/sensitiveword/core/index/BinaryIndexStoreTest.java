package org.sensitiveword.core.index;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sensitiveword.core.dictionary.Dictionary;
import org.sensitiveword.core.filter.FilterEngine;
import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.AutomatonBuilder;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class BinaryIndexStoreTest {

	private static final List<String> CORPUS = List.of(
			"",
			"这是一个包含敏感词1的文本",
			"敏感词2敏感词1敏感词2",
			"clean text",
			"ushers and his hers",
			"😀 emoji around 敏感词1 😀"
	);

	private final AutomatonBuilder builder = new AutomatonBuilder();
	private final FilterEngine engine = new FilterEngine();
	private final BinaryIndexStore store = new BinaryIndexStore();

	@Test
	public void testRoundTripBehavesLikeFreshBuild(@TempDir Path tempDir) throws Exception {
		Automaton built = builder.build(Dictionary.of("敏感词1", "敏感词2", "he", "she", "his", "hers"));
		Path indexPath = tempDir.resolve("models/ac_index.bin");

		store.save(built, indexPath);
		Automaton loaded = store.load(indexPath);

		assertEquals(built.patterns(), loaded.patterns());
		for (String text : CORPUS) {
			assertEquals(engine.scan(built, text), engine.scan(loaded, text));
			assertEquals(engine.contains(built, text), engine.contains(loaded, text));
			assertEquals(engine.redact(built, text), engine.redact(loaded, text));
		}
	}

	@Test
	public void testEmptyDictionaryRoundTrip(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");

		store.save(builder.build(Dictionary.empty()), indexPath);
		Automaton loaded = store.load(indexPath);

		assertTrue(loaded.isEmpty());
		assertFalse(engine.contains(loaded, "anything"));
	}

	@Test
	public void testHeaderLayout(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		store.save(builder.build(Dictionary.of("abc")), indexPath);

		ByteBuffer header = ByteBuffer.wrap(Files.readAllBytes(indexPath));
		assertEquals(BinaryIndexStore.MAGIC, header.getInt());
		assertEquals(BinaryIndexStore.FORMAT_VERSION, header.getInt());
		assertEquals(Files.size(indexPath) - 12 - 8, header.getInt());
	}

	@Test
	public void testSaveReplacesExistingFileWithoutLeftovers(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");

		store.save(builder.build(Dictionary.of("old")), indexPath);
		store.save(builder.build(Dictionary.of("new", "newer")), indexPath);

		assertEquals(List.of("new", "newer"), store.load(indexPath).patterns());
		try (Stream<Path> files = Files.list(tempDir)) {
			assertEquals(List.of(indexPath), files.toList());
		}
	}

	@Test
	public void testTruncatedFileIsCorrupt(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		store.save(builder.build(Dictionary.of("敏感词1", "敏感词2")), indexPath);

		byte[] data = Files.readAllBytes(indexPath);
		Files.write(indexPath, Arrays.copyOf(data, data.length / 2));

		assertThrows(CorruptIndexException.class, () -> store.load(indexPath));
	}

	@Test
	public void testTinyFileIsCorrupt(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		Files.write(indexPath, new byte[]{1, 2, 3});

		assertThrows(CorruptIndexException.class, () -> store.load(indexPath));
	}

	@Test
	public void testFlippedPayloadByteFailsChecksum(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		store.save(builder.build(Dictionary.of("abc", "bcd")), indexPath);

		byte[] data = Files.readAllBytes(indexPath);
		data[20] ^= 0x7F;
		Files.write(indexPath, data);

		CorruptIndexException e = assertThrows(CorruptIndexException.class, () -> store.load(indexPath));
		assertTrue(e.getMessage().contains("Checksum"));
	}

	@Test
	public void testForeignFileIsCorrupt(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		Files.writeString(indexPath, "{\"alice\": [11], \"wonderland\": [11]}");

		assertThrows(CorruptIndexException.class, () -> store.load(indexPath));
	}

	@Test
	public void testOtherFormatVersionIsRejected(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		new BinaryIndexStore(BinaryIndexStore.FORMAT_VERSION + 1).save(builder.build(Dictionary.of("abc")), indexPath);

		VersionMismatchException e = assertThrows(VersionMismatchException.class, () -> store.load(indexPath));
		assertEquals(BinaryIndexStore.FORMAT_VERSION + 1, e.getFoundVersion());
		assertEquals(BinaryIndexStore.FORMAT_VERSION, e.getExpectedVersion());
	}

	@Test
	public void testMissingFile(@TempDir Path tempDir) {
		Path indexPath = tempDir.resolve("absent.bin");

		assertFalse(store.exists(indexPath));
		assertEquals(0L, store.sizeInBytes(indexPath));
		IndexStoreException e = assertThrows(IndexStoreException.class, () -> store.load(indexPath));
		assertFalse(e instanceof CorruptIndexException);
	}

	@Test
	public void testExistsAndSize(@TempDir Path tempDir) throws Exception {
		Path indexPath = tempDir.resolve("ac_index.bin");
		store.save(builder.build(Dictionary.of("abc")), indexPath);

		assertTrue(store.exists(indexPath));
		assertEquals(Files.size(indexPath), store.sizeInBytes(indexPath));
		assertFalse(store.exists(tempDir));
	}

	@Test
	public void testUnwritableLocation(@TempDir Path tempDir) throws Exception {
		Path blocker = tempDir.resolve("models");
		Files.writeString(blocker, "not a directory");

		assertThrows(IndexStoreException.class,
				() -> store.save(builder.build(Dictionary.of("abc")), blocker.resolve("ac_index.bin")));
	}
}
