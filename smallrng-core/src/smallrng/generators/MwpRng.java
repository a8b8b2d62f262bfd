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

import com.google.common.annotations.VisibleForTesting;

/**
 * Multiplicative congruential generator combined with a Weyl sequence, followed by a PCG output
 * function.
 * <p>
 * 32-bit and 64-bit words are produced by different output functions (XSH RR and RXS M XS) applied
 * to the same state transition. A 64-bit word is therefore not two 32-bit words, and a 32-bit word
 * is not half of a 64-bit one. Byte output uses 64-bit words.
 */
public class MwpRng implements RandomGenerator
{
    public static final int SEED_SIZE = 16;
    public static final SeedableGenerator<MwpRng> FACTORY = SeedableGenerator.of(SEED_SIZE, MwpRng::fromSeed);

    private static final long MULTIPLIER = 6364136223846793005L;
    private static final long WEYL_INCREMENT = 1442695040888963407L;

    private long m;
    private long w;

    private MwpRng(long m, long w)
    {
        this.m = m;
        this.w = w;
    }

    /**
     * First seed word is the MCG state, which is made odd, second one the Weyl counter.
     */
    public static MwpRng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("mwp", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 2);
        return new MwpRng(words[0] | 1, words[1]);
    }

    private long step()
    {
        m *= MULTIPLIER;
        w += WEYL_INCREMENT;
        return m ^ w;
    }

    public int nextInt()
    {
        long state = step();

        // XSH RR
        int xsh = (int) (((state >>> 18) ^ state) >>> 27);
        return Integer.rotateRight(xsh, (int) (state >>> 59));
    }

    public long next()
    {
        long state = step();

        // RXS M XS: random xorshift, mcg multiply, fixed xorshift
        int rshift = (int) (state >>> 59);
        state ^= state >>> (5 + rshift);
        state *= MULTIPLIER;
        return state ^ (state >>> 42);
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaLong(this::next, dest, offset, length);
    }

    public MwpRng copy()
    {
        return new MwpRng(m, w);
    }

    @VisibleForTesting
    long multiplicand()
    {
        return m;
    }
}
