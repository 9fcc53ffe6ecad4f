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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.UUID;

/// Byte orders for the 16-byte binary form of a UUID.
///
/// [#BIG_ENDIAN] is the RFC 4122 network order: the bytes read left to right
/// as the hex digits of the canonical string. [#MIXED_ENDIAN] stores the
/// first three fields (4, 2 and 2 bytes) little-endian and the last 8 bytes
/// unchanged. That is the layout of Microsoft GUID structures, where the
/// version nibble ends up in the high half of byte 7.
public enum UuidByteLayout {
    BIG_ENDIAN,
    MIXED_ENDIAN;

    public static final int LENGTH = 16;

    public byte[] toBytes(UUID uuid) {
        Objects.requireNonNull(uuid, "uuid cannot be null");
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        long msb = uuid.getMostSignificantBits();
        if (this == BIG_ENDIAN) {
            buffer.putLong(msb);
        } else {
            buffer.order(ByteOrder.LITTLE_ENDIAN);
            buffer.putInt((int) (msb >>> 32));
            buffer.putShort((short) (msb >>> 16));
            buffer.putShort((short) msb);
            buffer.order(ByteOrder.BIG_ENDIAN);
        }
        buffer.putLong(uuid.getLeastSignificantBits());
        return buffer.array();
    }

    /// @throws IllegalArgumentException unless exactly 16 bytes are given
    public UUID fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("A UUID needs " + LENGTH + " bytes, but got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long msb;
        if (this == BIG_ENDIAN) {
            msb = buffer.getLong();
        } else {
            buffer.order(ByteOrder.LITTLE_ENDIAN);
            long timeLow = buffer.getInt() & 0xFFFFFFFFL;
            long timeMid = buffer.getShort() & 0xFFFFL;
            long timeHigh = buffer.getShort() & 0xFFFFL;
            buffer.order(ByteOrder.BIG_ENDIAN);
            msb = (timeLow << 32) | (timeMid << 16) | timeHigh;
        }
        return new UUID(msb, buffer.getLong());
    }

    /// Reads the version nibble straight from bytes in this layout.
    public int versionOf(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        int index = this == BIG_ENDIAN ? 6 : 7;
        return (bytes[index] & 0xF0) >> 4;
    }
}
