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
 * Middle Square Weyl Sequence generator (Bernard Widynski).
 * <p>
 * The middle square of {@code x} is perturbed by a Weyl sequence {@code w += s}, which keeps the
 * generator away from the short cycles of the plain middle-square method. Period 2<sup>64</sup>,
 * 192 bits of state, 64-bit words, 128-bit seed.
 */
public class MswsRng implements RandomGenerator
{
    public static final int SEED_SIZE = 16;
    public static final SeedableGenerator<MswsRng> FACTORY = SeedableGenerator.of(SEED_SIZE, MswsRng::fromSeed);

    private static final long HIGH_BITS = 0xffffffff00000000L;

    private long x;
    private long w;
    private final long s;

    private MswsRng(long x, long w, long s)
    {
        this.x = x;
        this.w = w;
        this.s = s;
    }

    /**
     * Uses the first seed word as the Weyl constant and the second one as the initial {@code x}.
     *
     * @throws InvalidSeedException if the constant has no bits set in its upper half
     */
    public static MswsRng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("msws", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 2);
        long stream = words[0] | 1;
        if ((stream & HIGH_BITS) == 0)
            throw InvalidSeedException.badValue("msws", "high bits of the stream constant %#x are zero", stream);
        return new MswsRng(words[1], 0, stream);
    }

    /**
     * Draws the Weyl constant from {@code source} until one with a non-zero upper half comes up,
     * then draws the initial {@code x}.
     */
    public static MswsRng fromGenerator(RandomGenerator source)
    {
        long stream;
        do
        {
            stream = source.next() | 1;
        }
        while ((stream & HIGH_BITS) == 0);
        return new MswsRng(source.next(), 0, stream);
    }

    public int nextInt()
    {
        return (int) next();
    }

    public long next()
    {
        x *= x;
        w += s;
        x += w;
        return Long.rotateLeft(x, 32);
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaLong(this::next, dest, offset, length);
    }

    public MswsRng copy()
    {
        return new MswsRng(x, w, s);
    }

    long stream()
    {
        return s;
    }
}
