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
 * XSM, 32-bit version (Chris Doty-Humphrey, PractRand).
 * <p>
 * A 64-bit LCG split over two words, with an odd adder, mixed through a one-word history.
 * Period 2<sup>64</sup>, 96-bit seed. 64-bit words are two 32-bit ones, low half first.
 */
public class Xsm32Rng implements RandomGenerator
{
    public static final int SEED_SIZE = 12;
    public static final SeedableGenerator<Xsm32Rng> FACTORY = SeedableGenerator.of(SEED_SIZE, Xsm32Rng::fromSeed);

    private static final int K = 0x6595a395;

    private int lcgLow;
    private int lcgHigh;
    private final int lcgAdder;
    private int history;

    private Xsm32Rng(int lcgLow, int lcgHigh, int lcgAdder, int history)
    {
        this.lcgLow = lcgLow;
        this.lcgHigh = lcgHigh;
        this.lcgAdder = lcgAdder;
        this.history = history;
    }

    /**
     * Seed words are the low LCG word, the high LCG word and the adder, which is made odd. One output
     * is discarded to fill the history.
     */
    public static Xsm32Rng fromSeed(byte[] seed)
    {
        RngUtils.checkSeedSize("xsm32", seed, SEED_SIZE);
        int[] words = RngUtils.readIntsLE(seed, 3);
        Xsm32Rng rng = new Xsm32Rng(words[0], words[1], words[2] | 1, 0);
        rng.nextInt();
        return rng;
    }

    public int nextInt()
    {
        int rv = history * K;
        int tmp = (lcgHigh + Integer.rotateLeft(lcgHigh ^ lcgLow, 11)) * K;

        int oldLow = lcgLow;
        lcgLow += lcgAdder;
        if (Integer.compareUnsigned(lcgLow, lcgAdder) < 0)
            oldLow++;
        lcgHigh += oldLow;

        rv ^= rv >>> 16;
        history = tmp ^ (tmp >>> 16);
        return rv + history;
    }

    public long next()
    {
        return RngUtils.nextLongViaInt(this::nextInt);
    }

    public void fill(byte[] dest, int offset, int length)
    {
        RngUtils.fillViaInt(this::nextInt, dest, offset, length);
    }

    public Xsm32Rng copy()
    {
        return new Xsm32Rng(lcgLow, lcgHigh, lcgAdder, history);
    }

    int adder()
    {
        return lcgAdder;
    }
}
