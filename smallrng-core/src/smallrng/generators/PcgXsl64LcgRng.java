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
 * PCG with a 64-bit LCG and the XSL RR output function: the two state halves xor-ed together,
 * then a random rotation. Seeding and state transition are the same as in {@link PcgXsh64LcgRng}.
 */
public class PcgXsl64LcgRng implements RandomGenerator
{
    public static final int SEED_SIZE = 16;
    public static final SeedableGenerator<PcgXsl64LcgRng> FACTORY = SeedableGenerator.of(SEED_SIZE, PcgXsl64LcgRng::fromSeed);

    private static final long MULTIPLIER = PcgXsh64LcgRng.MULTIPLIER;
    private static final int ROTATE = 59;
    private static final int XSHIFT = 32;

    private long state;
    private final long increment;

    private PcgXsl64LcgRng(long state, long increment)
    {
        this.state = state;
        this.increment = increment;
    }

    public static PcgXsl64LcgRng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("pcg_xsl_64_lcg", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 2);
        long increment = words[1] | 1;
        return new PcgXsl64LcgRng(words[0] * MULTIPLIER + increment, increment);
    }

    public int nextInt()
    {
        long state = this.state;
        this.state = state * MULTIPLIER + increment;

        int xsl = (int) (state >>> XSHIFT) ^ (int) state;
        return Integer.rotateRight(xsl, (int) (state >>> ROTATE));
    }

    public long next()
    {
        return RngUtils.nextLongViaInt(this::nextInt);
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaInt(this::nextInt, dest, offset, length);
    }

    public PcgXsl64LcgRng copy()
    {
        return new PcgXsl64LcgRng(state, increment);
    }

    @VisibleForTesting
    long increment()
    {
        return increment;
    }
}
