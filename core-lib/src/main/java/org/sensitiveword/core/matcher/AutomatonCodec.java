package org.sensitiveword.core.matcher;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Binary encoding of a compiled {@link Automaton}.
 *
 * <p>Layout (big-endian): pattern count, then each pattern as byte length + UTF-8 bytes; state count, then
 * per state depth, fail, output, dictionary link, transition count and (char, target) pairs. The payload
 * carries the compiled tables, so decoding does not rebuild anything; it only checks that the tables
 * describe a well-formed automaton.</p>
 */
public final class AutomatonCodec {
	private AutomatonCodec() {}

	public static byte[] encode(Automaton automaton) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (DataOutputStream out = new DataOutputStream(bytes)) {
			String[] patterns = automaton.patternArray();
			out.writeInt(patterns.length);
			for (String pattern : patterns) {
				byte[] utf8 = pattern.getBytes(StandardCharsets.UTF_8);
				out.writeInt(utf8.length);
				out.write(utf8);
			}

			int[] offsets = automaton.transitionOffsetArray();
			char[] chars = automaton.transitionCharArray();
			int[] targets = automaton.transitionTargetArray();
			int states = automaton.stateCount();
			out.writeInt(states);
			for (int state = 0; state < states; state++) {
				out.writeInt(automaton.depthArray()[state]);
				out.writeInt(automaton.failArray()[state]);
				out.writeInt(automaton.outputArray()[state]);
				out.writeInt(automaton.dictionaryLinkArray()[state]);
				out.writeInt(offsets[state + 1] - offsets[state]);
				for (int t = offsets[state]; t < offsets[state + 1]; t++) {
					out.writeChar(chars[t]);
					out.writeInt(targets[t]);
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("In-memory encoding failed", e);
		}
		return bytes.toByteArray();
	}

	/**
	 * Decode and validate a payload produced by {@link #encode(Automaton)}.
	 *
	 * @throws IOException if the payload is truncated
	 * @throws IllegalArgumentException if the payload decodes but does not describe a valid automaton
	 */
	public static Automaton decode(byte[] payload) throws IOException {
		DataInputStream in = new DataInputStream(new ByteArrayInputStream(payload));

		int patternCount = readCount(in, payload.length, "pattern count");
		String[] patterns = new String[patternCount];
		for (int i = 0; i < patternCount; i++) {
			int length = readCount(in, payload.length, "pattern length");
			byte[] utf8 = new byte[length];
			in.readFully(utf8);
			patterns[i] = new String(utf8, StandardCharsets.UTF_8);
		}

		int states = readCount(in, payload.length, "state count");
		if (states < 1) {
			throw new IllegalArgumentException("Automaton has no root state");
		}
		int[] depth = new int[states];
		int[] fail = new int[states];
		int[] output = new int[states];
		int[] dictionaryLink = new int[states];
		int[] offsets = new int[states + 1];
		int transitions = states - 1;
		char[] chars = new char[transitions];
		int[] targets = new int[transitions];

		int cursor = 0;
		for (int state = 0; state < states; state++) {
			depth[state] = in.readInt();
			fail[state] = in.readInt();
			output[state] = in.readInt();
			dictionaryLink[state] = in.readInt();
			int count = readCount(in, payload.length, "transition count");
			if (count > transitions - cursor) {
				throw new IllegalArgumentException("Too many transitions at state " + state);
			}
			offsets[state] = cursor;
			for (int t = 0; t < count; t++) {
				chars[cursor] = in.readChar();
				targets[cursor] = in.readInt();
				cursor++;
			}
		}
		offsets[states] = cursor;

		if (in.available() > 0) {
			throw new IllegalArgumentException(in.available() + " unexpected trailing bytes");
		}

		validate(patterns, depth, fail, output, dictionaryLink, offsets, chars, targets);
		return new Automaton(patterns, depth, fail, output, dictionaryLink, offsets, chars, targets);
	}

	private static int readCount(DataInputStream in, int limit, String what) throws IOException {
		int value = in.readInt();
		if (value < 0 || value > limit) {
			throw new IllegalArgumentException("Invalid " + what + ": " + value);
		}
		return value;
	}

	private static void validate(String[] patterns, int[] depth, int[] fail, int[] output, int[] dictionaryLink,
								 int[] offsets, char[] chars, int[] targets) {
		int states = depth.length;
		if (offsets[states] != states - 1) {
			throw new IllegalArgumentException("Expected " + (states - 1) + " transitions, found " + offsets[states]);
		}
		if (depth[Automaton.ROOT] != 0 || fail[Automaton.ROOT] != Automaton.ROOT
				|| output[Automaton.ROOT] != Automaton.NONE || dictionaryLink[Automaton.ROOT] != Automaton.NONE) {
			throw new IllegalArgumentException("Malformed root state");
		}

		boolean[] reached = new boolean[states];
		reached[Automaton.ROOT] = true;
		for (int state = 0; state < states; state++) {
			for (int t = offsets[state]; t < offsets[state + 1]; t++) {
				if (t > offsets[state] && chars[t] <= chars[t - 1]) {
					throw new IllegalArgumentException("Transitions of state " + state + " are not sorted");
				}
				int target = targets[t];
				if (target <= Automaton.ROOT || target >= states || reached[target]) {
					throw new IllegalArgumentException("Invalid transition target " + target + " from state " + state);
				}
				if (depth[target] != depth[state] + 1) {
					throw new IllegalArgumentException("Inconsistent depth at state " + target);
				}
				reached[target] = true;
			}
		}

		boolean[] patternSeen = new boolean[patterns.length];
		for (int state = 1; state < states; state++) {
			if (!reached[state]) {
				throw new IllegalArgumentException("Unreachable state " + state);
			}
			int suffix = fail[state];
			if (suffix < 0 || suffix >= states || depth[suffix] >= depth[state]) {
				throw new IllegalArgumentException("Invalid failure link at state " + state);
			}
			int link = dictionaryLink[state];
			if (link != Automaton.NONE && (link < 0 || link >= states
					|| output[link] == Automaton.NONE || depth[link] >= depth[state])) {
				throw new IllegalArgumentException("Invalid dictionary link at state " + state);
			}
			int pattern = output[state];
			if (pattern != Automaton.NONE) {
				if (pattern < 0 || pattern >= patterns.length || patternSeen[pattern]
						|| patterns[pattern].length() != depth[state]) {
					throw new IllegalArgumentException("Invalid output " + pattern + " at state " + state);
				}
				patternSeen[pattern] = true;
			}
		}
		for (int pattern = 0; pattern < patterns.length; pattern++) {
			if (!patternSeen[pattern]) {
				throw new IllegalArgumentException("Pattern " + pattern + " has no accepting state");
			}
		}
	}
}
