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
 * XSM, 64-bit version (Chris Doty-Humphrey, PractRand).
 * <p>
 * Same construction as {@link Xsm32Rng} at twice the width: a 128-bit LCG over two words with an
 * odd adder, rotation by 19 and shifts by 32. Period 2<sup>128</sup>, 192-bit seed. 32-bit words are
 * the low half of a 64-bit one.
 */
public class Xsm64Rng implements RandomGenerator
{
    public static final int SEED_SIZE = 24;
    public static final SeedableGenerator<Xsm64Rng> FACTORY = SeedableGenerator.of(SEED_SIZE, Xsm64Rng::fromSeed);

    private static final long K = 0xa3ec647659359acdL;

    private long lcgLow;
    private long lcgHigh;
    private final long lcgAdder;
    private long history;

    private Xsm64Rng(long lcgLow, long lcgHigh, long lcgAdder, long history)
    {
        this.lcgLow = lcgLow;
        this.lcgHigh = lcgHigh;
        this.lcgAdder = lcgAdder;
        this.history = history;
    }

    public static Xsm64Rng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("xsm64", seed, SEED_SIZE);
        long[] words = RngUtils.readLongsLE(seed, 3);
        Xsm64Rng rng = new Xsm64Rng(words[0], words[1], words[2] | 1, 0);
        rng.next();
        return rng;
    }

    public int nextInt()
    {
        return (int) next();
    }

    public long next()
    {
        history *= K;
        long tmp = (lcgHigh + Long.rotateLeft(lcgHigh ^ lcgLow, 19)) * K;

        long oldLow = lcgLow;
        lcgLow += lcgAdder;
        if (Long.compareUnsigned(lcgLow, lcgAdder) < 0)
            oldLow++;
        lcgHigh += oldLow;

        long mixed = history ^ (history >>> 32);
        history = tmp ^ (tmp >>> 32);
        return tmp + mixed;
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaLong(this::next, dest, offset, length);
    }

    public Xsm64Rng copy()
    {
        return new Xsm64Rng(lcgLow, lcgHigh, lcgAdder, history);
    }

    long adder()
    {
        return lcgAdder;
    }
}
