package org.sensitiveword.core.index;

import org.sensitiveword.core.matcher.Automaton;
import org.sensitiveword.core.matcher.AutomatonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.CRC32;

/**
 * Stores the automaton as {@code magic | version | payload length | payload | CRC32(payload)}.
 *
 * <p>All header fields are big-endian; magic and version are four bytes each. Files are written to a
 * temporary sibling and moved into place, so the published path always holds a complete artifact.</p>
 */
public class BinaryIndexStore implements IndexStore {
	private static final Logger logger = LoggerFactory.getLogger(BinaryIndexStore.class);

	/** "SWAC" */
	public static final int MAGIC = 0x53574143;
	public static final int FORMAT_VERSION = 1;

	private static final int HEADER_BYTES = Integer.BYTES * 3;
	private static final int TRAILER_BYTES = Long.BYTES;

	private final int formatVersion;

	public BinaryIndexStore() {
		this(FORMAT_VERSION);
	}

	BinaryIndexStore(int formatVersion) {
		this.formatVersion = formatVersion;
	}

	@Override
	public void save(Automaton automaton, Path path) throws IndexStoreException {
		byte[] payload = AutomatonCodec.encode(automaton);
		CRC32 crc = new CRC32();
		crc.update(payload);

		ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + payload.length + TRAILER_BYTES);
		buffer.putInt(MAGIC);
		buffer.putInt(formatVersion);
		buffer.putInt(payload.length);
		buffer.put(payload);
		buffer.putLong(crc.getValue());

		Path target = path.toAbsolutePath();
		Path temp = null;
		try {
			Files.createDirectories(target.getParent());
			temp = Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", ".tmp");
			Files.write(temp, buffer.array());
			publish(temp, target);
			temp = null;
		} catch (IOException e) {
			throw new IndexStoreException("Failed to save index to " + target + ": " + e.getMessage(), e);
		} finally {
			deleteQuietly(temp);
		}

		logger.info("Saved index to {} ({} words, {} bytes)", target, automaton.patternCount(), buffer.capacity());
	}

	@Override
	public Automaton load(Path path) throws IndexStoreException {
		byte[] data;
		try {
			data = Files.readAllBytes(path);
		} catch (NoSuchFileException e) {
			throw new IndexStoreException("Index file not found: " + path, e);
		} catch (IOException e) {
			throw new IndexStoreException("Failed to read index file " + path + ": " + e.getMessage(), e);
		}

		if (data.length < HEADER_BYTES + TRAILER_BYTES) {
			throw new CorruptIndexException("Index file too short (" + data.length + " bytes): " + path);
		}

		ByteBuffer buffer = ByteBuffer.wrap(data);
		int magic = buffer.getInt();
		if (magic != MAGIC) {
			throw new CorruptIndexException("Not a sensitive word index (bad magic 0x"
					+ Integer.toHexString(magic) + "): " + path);
		}

		int version = buffer.getInt();
		if (version != formatVersion) {
			throw new VersionMismatchException(version, formatVersion);
		}

		int payloadLength = buffer.getInt();
		if (payloadLength < 0 || (long) HEADER_BYTES + payloadLength + TRAILER_BYTES != data.length) {
			throw new CorruptIndexException("Payload length " + payloadLength + " does not match file size "
					+ data.length + ": " + path);
		}

		byte[] payload = new byte[payloadLength];
		buffer.get(payload);
		long expectedChecksum = buffer.getLong();

		CRC32 crc = new CRC32();
		crc.update(payload);
		if (crc.getValue() != expectedChecksum) {
			throw new CorruptIndexException("Checksum mismatch: " + path);
		}

		Automaton automaton;
		try {
			automaton = AutomatonCodec.decode(payload);
		} catch (IOException | IllegalArgumentException e) {
			throw new CorruptIndexException("Malformed automaton in " + path + ": " + e.getMessage(), e);
		}

		logger.info("Loaded index from {} ({} words, {} states)", path, automaton.patternCount(), automaton.stateCount());
		return automaton;
	}

	@Override
	public boolean exists(Path path) {
		return Files.isRegularFile(path);
	}

	@Override
	public long sizeInBytes(Path path) {
		try {
			if (Files.exists(path)) {
				return Files.size(path);
			}
		} catch (IOException e) {
			logger.warn("Failed to get index file size", e);
		}
		return 0L;
	}

	private static void publish(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, replacing in place", target);
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			logger.warn("Failed to remove temporary index file {}", temp, e);
		}
	}
}
