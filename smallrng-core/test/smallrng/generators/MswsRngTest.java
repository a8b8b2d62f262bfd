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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import org.junit.Assert;
import org.junit.Test;

public class MswsRngTest
{
    @Test
    public void testGoldenVector()
    {
        MswsRng rng = MswsRng.fromSeed(Seeds.sequential(16));
        Assert.assertEquals(0x67f39141023b8aefL, rng.next());
        Assert.assertEquals(0x67d4b483e19b3c05L, rng.next());
        Assert.assertEquals(0xeb467e0cdebd5e26L, rng.next());
        Assert.assertEquals(0x40a7d4947f88ce73L, rng.next());
    }

    @Test
    public void testIntIsLowHalfOfLong()
    {
        MswsRng ints = MswsRng.fromSeed(Seeds.sequential(16));
        MswsRng longs = MswsRng.fromSeed(Seeds.sequential(16));
        for (int i = 0; i < 1000; i++)
            Assert.assertEquals((int) longs.next(), ints.nextInt());
    }

    @Test
    public void testSeedValidity()
    {
        long[] firstWords = { 0L, 1L, 0xfffffffeL, 0xffffffffL, 0x100000000L, 0x100000001L,
                              0x8000000000000000L, -1L, 0x0706050403020100L };
        for (long first : firstWords)
        {
            boolean degenerate = ((first | 1) & 0xffffffff00000000L) == 0;
            try
            {
                MswsRng rng = MswsRng.fromSeed(Seeds.ofLongs(first, 42));
                Assert.assertFalse(Long.toHexString(first), degenerate);
                Assert.assertEquals(first | 1, rng.stream());
            }
            catch (InvalidSeedException e)
            {
                Assert.assertTrue(Long.toHexString(first), degenerate);
                Assert.assertEquals(InvalidSeedException.Kind.VALUE, e.kind);
            }
        }
    }

    @Test
    public void testZeroSeedIsRejected()
    {
        try
        {
            MswsRng.fromSeed(new byte[16]);
            Assert.fail("Should have thrown");
        }
        catch (InvalidSeedException e)
        {
            Assert.assertEquals(InvalidSeedException.Kind.VALUE, e.kind);
        }
    }

    @Test
    public void testFromGeneratorRejectsDegenerateStream()
    {
        ScriptedGenerator source = new ScriptedGenerator(0L, 0xffffffffL, 0x0706050403020100L, 0x0f0e0d0c0b0a0908L);
        MswsRng rng = MswsRng.fromGenerator(source);
        Assert.assertEquals(0x0706050403020101L, rng.stream());
        Assert.assertTrue(source.isEmpty());

        MswsRng expected = MswsRng.fromSeed(Seeds.sequential(16));
        Assert.assertArrayEquals(expected.next(16), rng.next(16));
    }

    private static class ScriptedGenerator implements RandomGenerator
    {
        private final Deque<Long> words;

        ScriptedGenerator(long... words)
        {
            this.words = new ArrayDeque<>();
            Arrays.stream(words).forEach(this.words::add);
        }

        boolean isEmpty()
        {
            return words.isEmpty();
        }

        public int nextInt()
        {
            return (int) next();
        }

        public long next()
        {
            return words.remove();
        }

        public void fill(byte[] dest, int offset, int length)
        {
            RngUtils.fillViaLong(this::next, dest, offset, length);
        }

        public RandomGenerator copy()
        {
            throw new UnsupportedOperationException();
        }
    }
}
