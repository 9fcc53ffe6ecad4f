package io.nosqlbench.arrays.binary;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.arrays.ArrayChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Encoding, hashing, bitwise, compression and pattern helpers for {@code byte[]}.
 *
 * <h2>Formats</h2>
 *
 * <ul>
 *   <li><b>hex</b> - two digits per byte, upper case by default, no separators</li>
 *   <li><b>base64</b> - RFC 4648 basic alphabet with padding</li>
 *   <li><b>gzip</b> - RFC 1952 member, readable by {@code gunzip}</li>
 *   <li><b>deflate</b> - zlib-wrapped (RFC 1950) DEFLATE stream</li>
 * </ul>
 *
 * <p>Compression runs entirely in memory. Corrupt compressed input raises
 * {@link UncheckedIOException}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
 * String digest = ByteArrays.toHexLower(ByteArrays.sha256(payload));
 * byte[] packed = ByteArrays.gzip(payload);
 * }</pre>
 */
public final class ByteArrays {

    private static final Logger logger = LogManager.getLogger(ByteArrays.class);

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ByteArrays() {}

    /**
     * Encodes as upper-case hexadecimal.
     */
    public static String toHex(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return HexFormat.of().withUpperCase().formatHex(bytes);
    }

    /**
     * Encodes as lower-case hexadecimal.
     */
    public static String toHexLower(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Decodes hexadecimal text of either case.
     *
     * @throws IllegalArgumentException on odd length or a non-hex character
     */
    public static byte[] fromHex(String hex) {
        Objects.requireNonNull(hex, "hex cannot be null");
        return HexFormat.of().parseHex(hex);
    }

    public static String toBase64(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * @throws IllegalArgumentException if the text is not valid base64
     */
    public static byte[] fromBase64(String base64) {
        Objects.requireNonNull(base64, "base64 cannot be null");
        return Base64.getDecoder().decode(base64);
    }

    public static String toString(byte[] bytes, Charset charset) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.requireNonNull(charset, "charset cannot be null");
        return new String(bytes, charset);
    }

    public static String toUtf8String(byte[] bytes) {
        return toString(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Decodes as US-ASCII; bytes above 0x7F become the replacement character.
     */
    public static String toAsciiString(byte[] bytes) {
        return toString(bytes, StandardCharsets.US_ASCII);
    }

    /** 16-byte MD5 digest. */
    public static byte[] md5(byte[] bytes) {
        return digest("MD5", bytes);
    }

    /** 20-byte SHA-1 digest. */
    public static byte[] sha1(byte[] bytes) {
        return digest("SHA-1", bytes);
    }

    /** 32-byte SHA-256 digest. */
    public static byte[] sha256(byte[] bytes) {
        return digest("SHA-256", bytes);
    }

    /** 64-byte SHA-512 digest. */
    public static byte[] sha512(byte[] bytes) {
        return digest("SHA-512", bytes);
    }

    private static byte[] digest(String algorithm, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        try {
            return MessageDigest.getInstance(algorithm).digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }

    public static byte[] xor(byte[] first, byte[] second) {
        requirePair(first, second);
        byte[] result = new byte[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = (byte) (first[i] ^ second[i]);
        }
        return result;
    }

    public static byte[] and(byte[] first, byte[] second) {
        requirePair(first, second);
        byte[] result = new byte[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = (byte) (first[i] & second[i]);
        }
        return result;
    }

    public static byte[] or(byte[] first, byte[] second) {
        requirePair(first, second);
        byte[] result = new byte[first.length];
        for (int i = 0; i < first.length; i++) {
            result[i] = (byte) (first[i] | second[i]);
        }
        return result;
    }

    public static byte[] not(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        byte[] result = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            result[i] = (byte) ~bytes[i];
        }
        return result;
    }

    /**
     * Shifts each byte left independently; bits shifted past bit 7 are dropped.
     *
     * @param positions 0 to 7
     */
    public static byte[] shiftLeft(byte[] bytes, int positions) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ArrayChecks.requireInRange(positions, 0, 7, "positions");
        byte[] result = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            result[i] = (byte) (bytes[i] << positions);
        }
        return result;
    }

    /**
     * Shifts each byte right independently, filling with zeros.
     *
     * @param positions 0 to 7
     */
    public static byte[] shiftRight(byte[] bytes, int positions) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ArrayChecks.requireInRange(positions, 0, 7, "positions");
        byte[] result = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            result[i] = (byte) ((bytes[i] & 0xFF) >>> positions);
        }
        return result;
    }

    /**
     * @return the most frequent byte, the first seen on ties
     * @throws IllegalArgumentException if the array is null or empty
     */
    public static byte mostFrequent(byte[] bytes) {
        ArrayChecks.requireNonEmpty(bytes, "bytes");
        byte best = bytes[0];
        int bestCount = 0;
        for (Map.Entry<Byte, Integer> entry : frequency(bytes).entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Occurrence count of each byte value, in first-seen order.
     */
    public static Map<Byte, Integer> frequency(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Map<Byte, Integer> counts = new LinkedHashMap<>();
        for (byte b : bytes) {
            counts.merge(b, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Shannon entropy in bits per byte, 0 to 8. Null or empty input gives 0.
     */
    public static double entropy(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return 0;
        }
        int[] counts = new int[256];
        for (byte b : bytes) {
            counts[b & 0xFF]++;
        }
        double entropy = 0;
        for (int count : counts) {
            if (count > 0) {
                double p = (double) count / bytes.length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    public static byte[] gzip(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(buffer)) {
            out.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip compression failed", e);
        }
        byte[] compressed = buffer.toByteArray();
        logger.debug("gzip: {} -> {} bytes", bytes.length, compressed.length);
        return compressed;
    }

    /**
     * @throws UncheckedIOException if the input is not a valid gzip stream
     */
    public static byte[] gunzip(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            byte[] restored = in.readAllBytes();
            logger.debug("gunzip: {} -> {} bytes", bytes.length, restored.length);
            return restored;
        } catch (IOException e) {
            throw new UncheckedIOException("gzip decompression failed", e);
        }
    }

    public static byte[] deflate(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new DeflaterOutputStream(buffer)) {
            out.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("deflate compression failed", e);
        }
        byte[] compressed = buffer.toByteArray();
        logger.debug("deflate: {} -> {} bytes", bytes.length, compressed.length);
        return compressed;
    }

    /**
     * @throws UncheckedIOException if the input is not a valid zlib stream
     */
    public static byte[] inflate(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(bytes))) {
            byte[] restored = in.readAllBytes();
            logger.debug("inflate: {} -> {} bytes", bytes.length, restored.length);
            return restored;
        } catch (IOException e) {
            throw new UncheckedIOException("deflate decompression failed", e);
        }
    }

    /**
     * Every offset at which {@code pattern} starts, overlapping matches included.
     * An empty pattern, or one longer than the data, matches nowhere.
     */
    public static int[] findPattern(byte[] bytes, byte[] pattern) {
        if (bytes == null || pattern == null || pattern.length == 0 || pattern.length > bytes.length) {
            return new int[0];
        }
        int[] found = new int[bytes.length - pattern.length + 1];
        int count = 0;
        for (int i = 0; i <= bytes.length - pattern.length; i++) {
            if (matchesAt(bytes, pattern, i)) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }

    /**
     * Replaces each occurrence of {@code oldPattern} in one left-to-right pass.
     * Bytes produced by a replacement are never scanned again. An empty
     * {@code oldPattern} returns an unchanged copy.
     */
    public static byte[] replacePattern(byte[] bytes, byte[] oldPattern, byte[] newPattern) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.requireNonNull(oldPattern, "oldPattern cannot be null");
        Objects.requireNonNull(newPattern, "newPattern cannot be null");
        if (oldPattern.length == 0) {
            return bytes.clone();
        }
        ByteArrayOutputStream result = new ByteArrayOutputStream(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            if (i <= bytes.length - oldPattern.length && matchesAt(bytes, oldPattern, i)) {
                result.write(newPattern, 0, newPattern.length);
                i += oldPattern.length;
            } else {
                result.write(bytes[i]);
                i++;
            }
        }
        return result.toByteArray();
    }

    public static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes == null || prefix == null || prefix.length > bytes.length) {
            return false;
        }
        return matchesAt(bytes, prefix, 0);
    }

    public static boolean endsWith(byte[] bytes, byte[] suffix) {
        if (bytes == null || suffix == null || suffix.length > bytes.length) {
            return false;
        }
        return matchesAt(bytes, suffix, bytes.length - suffix.length);
    }

    /**
     * Splits into consecutive chunks; the last may be shorter. Empty input gives no chunks.
     *
     * @throws IllegalArgumentException if chunkSize is not positive
     */
    public static byte[][] split(byte[] bytes, int chunkSize) {
        ArrayChecks.requirePositive(chunkSize, "chunk size");
        Objects.requireNonNull(bytes, "bytes cannot be null");
        int count = (bytes.length + chunkSize - 1) / chunkSize;
        byte[][] chunks = new byte[count][];
        for (int c = 0; c < count; c++) {
            int start = c * chunkSize;
            chunks[c] = Arrays.copyOfRange(bytes, start, Math.min(start + chunkSize, bytes.length));
        }
        return chunks;
    }

    /**
     * Fills a new array from a shared {@link SecureRandom}.
     *
     * @throws IllegalArgumentException if length is negative
     */
    public static byte[] secureRandom(int length) {
        ArrayChecks.requireNonNegative(length, "length");
        byte[] bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    private static boolean matchesAt(byte[] bytes, byte[] pattern, int offset) {
        for (int j = 0; j < pattern.length; j++) {
            if (bytes[offset + j] != pattern[j]) {
                return false;
            }
        }
        return true;
    }

    private static void requirePair(byte[] first, byte[] second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        ArrayChecks.requireSameLength(first.length, second.length);
    }
}
