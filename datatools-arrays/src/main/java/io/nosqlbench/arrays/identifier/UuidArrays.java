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

package io.nosqlbench.arrays.identifier;

import io.nosqlbench.arrays.ArrayChecks;
import io.nosqlbench.arrays.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/// # UuidArrays
///
/// Queries, formatting, ordering and generation for `UUID[]`.
///
/// ## Ordering
/// [UUID#compareTo(UUID)] compares the two halves as signed longs, which does
/// not match the canonical text order. [#CANONICAL_ORDER] compares the 16
/// big-endian bytes as unsigned values instead, so sorting UUIDs and sorting
/// their hyphenated strings give the same result.
///
/// ## Nil
/// The nil UUID has all 128 bits zero, see [#NIL].
///
/// ## Null elements
/// Membership and validity checks ([#contains], [#indexOf], [#allUnique],
/// [#findDuplicates], [#allValid]) accept null elements. Methods that read the
/// bits of every element (formatting, byte conversion, ordering and version
/// queries) reject a null element with an [IllegalArgumentException] naming
/// its index.
///
/// ## Byte layout
/// [#toByteArrays(UUID[])] uses [UuidByteLayout#MIXED_ENDIAN], the standard
/// 16-byte GUID layout with the version nibble in the high half of byte 7.
/// Pass [UuidByteLayout#BIG_ENDIAN] for RFC 4122 network order.
///
/// ## Randomness
/// Generated UUIDs are version 4, IETF variant, drawn from a
/// [UniformRandomProvider]. Overloads without a provider use a fresh
/// generator per call.
public final class UuidArrays {

    public static final UUID NIL = new UUID(0L, 0L);

    public static final Comparator<UUID> CANONICAL_ORDER = (a, b) -> {
        int high = Long.compareUnsigned(a.getMostSignificantBits(), b.getMostSignificantBits());
        return high != 0 ? high : Long.compareUnsigned(a.getLeastSignificantBits(), b.getLeastSignificantBits());
    };

    private static final int IETF_VARIANT = 2;

    private UuidArrays() {} // Utility class

    public static UUID[] removeNil(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        return Arrays.stream(uuids).filter(u -> !NIL.equals(u)).toArray(UUID[]::new);
    }

    public static boolean anyNil(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        return Arrays.stream(uuids).anyMatch(NIL::equals);
    }

    /// True for an empty array.
    public static boolean allNil(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        return Arrays.stream(uuids).allMatch(NIL::equals);
    }

    public static boolean allUnique(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        return new HashSet<>(Arrays.asList(uuids)).size() == uuids.length;
    }

    /// @return each UUID occurring more than once, in first-seen order
    public static UUID[] findDuplicates(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        Map<UUID, Integer> counts = new LinkedHashMap<>();
        for (UUID uuid : uuids) {
            counts.merge(uuid, 1, Integer::sum);
        }
        return counts.entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .map(Map.Entry::getKey)
            .toArray(UUID[]::new);
    }

    public static boolean contains(UUID[] uuids, UUID uuid) {
        return indexOf(uuids, uuid) >= 0;
    }

    public static int indexOf(UUID[] uuids, UUID uuid) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        for (int i = 0; i < uuids.length; i++) {
            if (Objects.equals(uuids[i], uuid)) {
                return i;
            }
        }
        return -1;
    }

    /// Insertion-ordered set of the UUIDs.
    public static Set<UUID> toSet(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        return new LinkedHashSet<>(Arrays.asList(uuids));
    }

    /// Lower-case hyphenated strings.
    public static String[] toStrings(UUID[] uuids) {
        return toStrings(uuids, UuidFormat.HYPHENATED, false);
    }

    public static String[] toStrings(UUID[] uuids, UuidFormat format, boolean upperCase) {
        requireNoNullElements(uuids);
        Objects.requireNonNull(format, "format cannot be null");
        return Arrays.stream(uuids).map(u -> format.format(u, upperCase)).toArray(String[]::new);
    }

    public static String join(UUID[] uuids, String separator) {
        Objects.requireNonNull(separator, "separator cannot be null");
        return String.join(separator, toStrings(uuids));
    }

    public static String toCommaSeparated(UUID[] uuids) {
        return join(uuids, ",");
    }

    /// GUID byte layout, see [UuidByteLayout#MIXED_ENDIAN].
    public static byte[][] toByteArrays(UUID[] uuids) {
        return toByteArrays(uuids, UuidByteLayout.MIXED_ENDIAN);
    }

    public static byte[][] toByteArrays(UUID[] uuids, UuidByteLayout layout) {
        requireNoNullElements(uuids);
        Objects.requireNonNull(layout, "layout cannot be null");
        byte[][] result = new byte[uuids.length][];
        for (int i = 0; i < uuids.length; i++) {
            result[i] = layout.toBytes(uuids[i]);
        }
        return result;
    }

    public static UUID[] sortAscending(UUID[] uuids) {
        requireNoNullElements(uuids);
        UUID[] sorted = uuids.clone();
        Arrays.sort(sorted, CANONICAL_ORDER);
        return sorted;
    }

    public static UUID[] sortDescending(UUID[] uuids) {
        requireNoNullElements(uuids);
        UUID[] sorted = uuids.clone();
        Arrays.sort(sorted, CANONICAL_ORDER.reversed());
        return sorted;
    }

    public static UUID min(UUID[] uuids) {
        ArrayChecks.requireNonEmpty(uuids, "uuids");
        requireNoNullElements(uuids);
        return Arrays.stream(uuids).min(CANONICAL_ORDER).orElseThrow();
    }

    public static UUID max(UUID[] uuids) {
        ArrayChecks.requireNonEmpty(uuids, "uuids");
        requireNoNullElements(uuids);
        return Arrays.stream(uuids).max(CANONICAL_ORDER).orElseThrow();
    }

    /// The version nibble of each UUID; 0 for the nil UUID.
    public static int[] versions(UUID[] uuids) {
        requireNoNullElements(uuids);
        return Arrays.stream(uuids).mapToInt(UUID::version).toArray();
    }

    /// @throws io.nosqlbench.arrays.ValueOutOfRangeException if version is outside 1..5
    public static UUID[] filterByVersion(UUID[] uuids, int version) {
        requireNoNullElements(uuids);
        ArrayChecks.requireInRange(version, 1, 5, "version");
        return Arrays.stream(uuids).filter(u -> u.version() == version).toArray(UUID[]::new);
    }

    /// Groups by version nibble, keys in first-seen order.
    public static Map<Integer, List<UUID>> groupByVersion(UUID[] uuids) {
        requireNoNullElements(uuids);
        return Arrays.stream(uuids)
            .collect(Collectors.groupingBy(UUID::version, LinkedHashMap::new, Collectors.toList()));
    }

    public static UUID[] randomUuids(int count) {
        return randomUuids(count, RandomGenerators.fresh());
    }

    /// @throws IllegalArgumentException if count is negative
    public static UUID[] randomUuids(int count, UniformRandomProvider rng) {
        ArrayChecks.requireNonNegative(count, "count");
        Objects.requireNonNull(rng, "rng cannot be null");
        UUID[] result = new UUID[count];
        for (int i = 0; i < count; i++) {
            result[i] = randomUuid(rng);
        }
        return result;
    }

    public static UUID[] replaceNilWithRandom(UUID[] uuids) {
        return replaceNilWithRandom(uuids, RandomGenerators.fresh());
    }

    public static UUID[] replaceNilWithRandom(UUID[] uuids, UniformRandomProvider rng) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");
        UUID[] result = new UUID[uuids.length];
        for (int i = 0; i < uuids.length; i++) {
            result[i] = NIL.equals(uuids[i]) ? randomUuid(rng) : uuids[i];
        }
        return result;
    }

    /// True when every element is non-null and is either nil or an IETF
    /// variant UUID of version 1 to 5.
    public static boolean allValid(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        for (UUID uuid : uuids) {
            if (uuid == null) {
                return false;
            }
            if (NIL.equals(uuid)) {
                continue;
            }
            if (uuid.variant() != IETF_VARIANT || uuid.version() < 1 || uuid.version() > 5) {
                return false;
            }
        }
        return true;
    }

    private static void requireNoNullElements(UUID[] uuids) {
        Objects.requireNonNull(uuids, "uuids cannot be null");
        for (int i = 0; i < uuids.length; i++) {
            if (uuids[i] == null) {
                throw new IllegalArgumentException("uuids[" + i + "] is null");
            }
        }
    }

    static UUID randomUuid(UniformRandomProvider rng) {
        long msb = rng.nextLong();
        long lsb = rng.nextLong();
        msb = (msb & ~0xF000L) | 0x4000L;
        lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }
}
