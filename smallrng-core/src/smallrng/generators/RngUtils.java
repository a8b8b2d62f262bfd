/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package smallrng.generators;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * Seed decoding and byte serialization shared by all generators.
 */
public class RngUtils
{
    public static void checkSeedSize(String generator, byte[] seed, int expected)
    {
        Objects.requireNonNull(seed, "seed");
        if (seed.length != expected)
            throw InvalidSeedException.wrongLength(generator, expected, seed.length);
    }

    public static long[] readLongsLE(byte[] src, int count)
    {
        ByteBuffer buffer = ByteBuffer.wrap(src).order(ByteOrder.LITTLE_ENDIAN);
        long[] words = new long[count];
        for (int i = 0; i < count; i++)
            words[i] = buffer.getLong();
        return words;
    }

    public static int[] readIntsLE(byte[] src, int count)
    {
        ByteBuffer buffer = ByteBuffer.wrap(src).order(ByteOrder.LITTLE_ENDIAN);
        int[] words = new int[count];
        for (int i = 0; i < count; i++)
            words[i] = buffer.getInt();
        return words;
    }

    /**
     * Writes successive 64-bit words into {@code dest} in little-endian order. Only the leading bytes of the
     * final word are written when {@code length} is not a multiple of eight.
     */
    public static void fillViaLong(LongSupplier next, byte[] dest, int offset, int length)
    {
        Objects.checkFromIndexSize(offset, length, dest.length);
        int end = offset + length;
        while (offset < end)
        {
            long word = next.getAsLong();
            int n = Math.min(Long.BYTES, end - offset);
            for (int i = 0; i < n; i++)
                dest[offset++] = (byte) (word >>> (8 * i));
        }
    }

    /**
     * Same as {@link #fillViaLong}, for generators producing 32-bit words.
     */
    public static void fillViaInt(IntSupplier next, byte[] dest, int offset, int length)
    {
        Objects.checkFromIndexSize(offset, length, dest.length);
        int end = offset + length;
        while (offset < end)
        {
            int word = next.getAsInt();
            int n = Math.min(Integer.BYTES, end - offset);
            for (int i = 0; i < n; i++)
                dest[offset++] = (byte) (word >>> (8 * i));
        }
    }

    /**
     * Packs two successive 32-bit words, the first one into the low half.
     */
    public static long nextLongViaInt(IntSupplier next)
    {
        long low = next.getAsInt() & 0xffffffffL;
        long high = next.getAsInt() & 0xffffffffL;
        return (high << 32) | low;
    }
}
