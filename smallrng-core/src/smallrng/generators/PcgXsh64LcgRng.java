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
 * PCG with a 64-bit LCG and the XSH RR output function: xorshift high bits, then a random rotation.
 * Emits 32-bit words; 64-bit words are two 32-bit ones, low half first.
 */
public class PcgXsh64LcgRng implements RandomGenerator
{
    public static final int SEED_SIZE = 16;
    public static final SeedableGenerator<PcgXsh64LcgRng> FACTORY = SeedableGenerator.of(SEED_SIZE, PcgXsh64LcgRng::fromSeed);

    static final long MULTIPLIER = 6364136223846793005L;

    private static final int ROTATE = 59;  // 64 - 5
    private static final int XSHIFT = 18;  // (32 + 5) / 2
    private static final int SPARE = 27;   // 64 - 32 - 5

    private long state;
    private final long increment;

    private PcgXsh64LcgRng(long state, long increment)
    {
        this.state = state;
        this.increment = increment;
    }

    /**
     * First seed word is the state, second one the increment, which is made odd.
     */
    public static PcgXsh64LcgRng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("pcg_xsh_64_lcg", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 2);
        long increment = words[1] | 1;
        return new PcgXsh64LcgRng(words[0] * MULTIPLIER + increment, increment);
    }

    public int nextInt()
    {
        long state = this.state;
        this.state = state * MULTIPLIER + increment;

        int xsh = (int) (((state >>> XSHIFT) ^ state) >>> SPARE);
        return Integer.rotateRight(xsh, (int) (state >>> ROTATE));
    }

    public long next()
    {
        return RngUtils.nextLongViaInt(this::nextInt);
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaInt(this::nextInt, dest, offset, length);
    }

    public PcgXsh64LcgRng copy()
    {
        return new PcgXsh64LcgRng(state, increment);
    }

    @VisibleForTesting
    long increment()
    {
        return increment;
    }
}
