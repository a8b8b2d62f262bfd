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

/**
 * Deterministic, non-cryptographic source of random words.
 * <p>
 * Implementations own their state exclusively and are not safe for concurrent use. Two instances
 * seeded with identical bytes produce identical output for identical call sequences. Every
 * arithmetic step wraps on overflow.
 */
public interface RandomGenerator
{
    /**
     * Advances the state and returns the next 32-bit word.
     */
    int nextInt();

    /**
     * Advances the state and returns the next 64-bit word.
     */
    long next();

    /**
     * Fills {@code length} bytes of {@code dest}, starting at {@code offset}, with successive
     * generated words in little-endian order. Bytes of the last word that do not fit are discarded.
     */
    void fill(byte[] dest, int offset, int length);

    default void fill(byte[] dest)
    {
        fill(dest, 0, dest.length);
    }

    default byte[] nextBytes(int n)
    {
        byte[] bytes = new byte[n];
        fill(bytes);
        return bytes;
    }

    default long[] next(int n)
    {
        long[] next = new long[n];
        for (int i = 0; i < n; i++)
            next[i] = next();
        return next;
    }

    /**
     * Returns an independent copy with identical state. The copy and the original produce the same
     * output until either of them is advanced on its own.
     */
    RandomGenerator copy();
}
