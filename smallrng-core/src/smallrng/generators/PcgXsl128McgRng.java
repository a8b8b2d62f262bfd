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
 * PCG with a 128-bit multiplicative congruential generator and the XSL RR output function.
 * Emits 64-bit words; 32-bit words are the low half of a 64-bit one.
 * <p>
 * The 128-bit state is kept as two longs. An MCG never leaves zero, so an all-zero seed yields
 * an all-zero stream.
 */
public class PcgXsl128McgRng implements RandomGenerator
{
    public static final int SEED_SIZE = 16;
    public static final SeedableGenerator<PcgXsl128McgRng> FACTORY = SeedableGenerator.of(SEED_SIZE, PcgXsl128McgRng::fromSeed);

    static final long MULTIPLIER_HIGH = 2549297995355413924L;
    static final long MULTIPLIER_LOW = 4865540595714422341L;

    private static final int ROTATE = 58;  // 128 - 6, counted in the high half

    private long high;
    private long low;

    private PcgXsl128McgRng(long high, long low)
    {
        this.high = high;
        this.low = low;
    }

    /**
     * First seed word is the high half of the state, second one the low half.
     */
    public static PcgXsl128McgRng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("pcg_xsl_128_mcg", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 2);
        PcgXsl128McgRng rng = new PcgXsl128McgRng(words[0], words[1]);
        rng.step();
        return rng;
    }

    public int nextInt()
    {
        return (int) next();
    }

    public long next()
    {
        long high = this.high;
        long low = this.low;
        step();

        return Long.rotateRight(high ^ low, (int) (high >>> ROTATE));
    }

    private void step()
    {
        long newHigh = multiplyHigh128(high, low, MULTIPLIER_HIGH, MULTIPLIER_LOW);
        low *= MULTIPLIER_LOW;
        high = newHigh;
    }

    /**
     * High half of {@code (ah:al) * (bh:bl) mod 2^128}. The low half is simply {@code al * bl}.
     */
    static long multiplyHigh128(long ah, long al, long bh, long bl)
    {
        // Math.multiplyHigh is signed; adding each operand where the other one has its sign bit set gives the unsigned product
        long carry = Math.multiplyHigh(al, bl) + ((al >> 63) & bl) + ((bl >> 63) & al);
        return carry + ah * bl + al * bh;
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaLong(this::next, dest, offset, length);
    }

    public PcgXsl128McgRng copy()
    {
        return new PcgXsl128McgRng(high, low);
    }
}
