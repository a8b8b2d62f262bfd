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

import org.junit.Assert;
import org.junit.Test;

public class PcgLcgRngTest
{
    @Test
    public void testXshGoldenVector()
    {
        PcgXsh64LcgRng rng = PcgXsh64LcgRng.fromSeed(Seeds.sequential(16));
        Assert.assertEquals(0x7a44f1fb, rng.nextInt());
        Assert.assertEquals(0x37d7e52d, rng.nextInt());
        Assert.assertEquals(0xbc9eb7a1, rng.nextInt());
        Assert.assertEquals(0xc5b666d6, rng.nextInt());
    }

    @Test
    public void testXshFromZeroStateUnitIncrement()
    {
        // seeding leaves state = 0 * M + 1 = 1, whose xorshift and rotation are both zero
        PcgXsh64LcgRng rng = PcgXsh64LcgRng.fromSeed(Seeds.ofLongs(0, 1));
        Assert.assertEquals(0, rng.nextInt());
        Assert.assertEquals(0xe4c14788, rng.nextInt());
        Assert.assertEquals(0x379c6516, rng.nextInt());
    }

    @Test
    public void testXslGoldenVector()
    {
        PcgXsl64LcgRng rng = PcgXsl64LcgRng.fromSeed(Seeds.sequential(16));
        Assert.assertEquals(0xc00c147b, rng.nextInt());
        Assert.assertEquals(0xc03c4189, rng.nextInt());
        Assert.assertEquals(0x0c4b80eb, rng.nextInt());
        Assert.assertEquals(0xb6a448a4, rng.nextInt());
    }

    @Test
    public void testLongIsTwoInts()
    {
        PcgXsh64LcgRng xsh = PcgXsh64LcgRng.fromSeed(Seeds.sequential(16));
        Assert.assertEquals(0x37d7e52d7a44f1fbL, xsh.next());
        Assert.assertEquals(0xc5b666d6bc9eb7a1L, xsh.next());

        PcgXsl64LcgRng xsl = PcgXsl64LcgRng.fromSeed(Seeds.sequential(16));
        Assert.assertEquals(0xc03c4189c00c147bL, xsl.next());
        Assert.assertEquals(0xb6a448a40c4b80ebL, xsl.next());

        PcgXsh64LcgRng longs = PcgXsh64LcgRng.fromSeed(Seeds.ofLongs(123456789L, -987654321L));
        PcgXsh64LcgRng ints = longs.copy();
        for (int i = 0; i < 1000; i++)
        {
            long low = ints.nextInt() & 0xffffffffL;
            long high = ints.nextInt() & 0xffffffffL;
            Assert.assertEquals(high << 32 | low, longs.next());
        }
    }

    @Test
    public void testIncrementIsOdd()
    {
        for (long increment : new long[]{ 0, 1, 2, 0xfffffffffffffffeL, -1L, 0x8000000000000000L })
        {
            long expected = increment | 1;
            Assert.assertEquals(expected, PcgXsh64LcgRng.fromSeed(Seeds.ofLongs(7, increment)).increment());
            Assert.assertEquals(expected, PcgXsl64LcgRng.fromSeed(Seeds.ofLongs(7, increment)).increment());
        }
    }

    @Test
    public void testEvenAndOddIncrementAreSameStream()
    {
        PcgXsl64LcgRng even = PcgXsl64LcgRng.fromSeed(Seeds.ofLongs(99, 4));
        PcgXsl64LcgRng odd = PcgXsl64LcgRng.fromSeed(Seeds.ofLongs(99, 5));
        Assert.assertArrayEquals(odd.next(64), even.next(64));
    }
}
