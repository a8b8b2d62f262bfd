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

public class XsmRngTest
{
    @Test
    public void testXsm32GoldenVector()
    {
        Xsm32Rng rng = Xsm32Rng.fromSeed(Seeds.sequential(12));
        Assert.assertEquals(0x8326578e, rng.nextInt());
        Assert.assertEquals(0x300bf057, rng.nextInt());
        Assert.assertEquals(0xc0856367, rng.nextInt());
        Assert.assertEquals(0xdeb47bdd, rng.nextInt());
    }

    @Test
    public void testXsm32LongIsTwoInts()
    {
        Xsm32Rng rng = Xsm32Rng.fromSeed(Seeds.sequential(12));
        Assert.assertEquals(0x300bf0578326578eL, rng.next());
        Assert.assertEquals(0xdeb47bddc0856367L, rng.next());
        Assert.assertEquals(0x21507618f15dda8bL, rng.next());
    }

    @Test
    public void testXsm64GoldenVector()
    {
        Xsm64Rng rng = Xsm64Rng.fromSeed(Seeds.sequential(24));
        Assert.assertEquals(0xfbe9c5410936b9cfL, rng.next());
        Assert.assertEquals(0x80c4e83223d15a2fL, rng.next());
        Assert.assertEquals(0x4545d6a3e96afdd7L, rng.next());
        Assert.assertEquals(0x6bf9c194c49526d6L, rng.next());
    }

    @Test
    public void testXsm64IntIsLowHalfOfLong()
    {
        Xsm64Rng rng = Xsm64Rng.fromSeed(Seeds.sequential(24));
        Assert.assertEquals(0x0936b9cf, rng.nextInt());
        Assert.assertEquals(0x23d15a2f, rng.nextInt());
    }

    @Test
    public void testZeroSeeds()
    {
        Xsm32Rng xsm32 = Xsm32Rng.fromSeed(new byte[12]);
        Assert.assertEquals(1, xsm32.adder());
        Assert.assertEquals(0x0ac74815ad1c051cL, xsm32.next());
        Assert.assertEquals(0x2e0519679702fa93L, xsm32.next());

        Xsm64Rng xsm64 = Xsm64Rng.fromSeed(new byte[24]);
        Assert.assertEquals(1, xsm64.adder());
        Assert.assertEquals(0x23b2c9acd6680000L, xsm64.next());
        Assert.assertEquals(0x4cfa68941442ec78L, xsm64.next());
    }

    @Test
    public void testCarryIntoHighWord()
    {
        // the low LCG word wraps during the warm-up step
        Xsm32Rng xsm32 = Xsm32Rng.fromSeed(Seeds.ofInts(0xffffffff, 5, 1));
        Assert.assertEquals(0xc21350a9, xsm32.nextInt());
        Assert.assertEquals(0x644deecc, xsm32.nextInt());
        Assert.assertEquals(0xe79e15b4, xsm32.nextInt());

        Xsm64Rng xsm64 = Xsm64Rng.fromSeed(Seeds.ofLongs(-1L, 5, 1));
        Assert.assertEquals(0x6c2b8c7022e5fa6aL, xsm64.next());
        Assert.assertEquals(0x410ddaa094ed30ccL, xsm64.next());
        Assert.assertEquals(0x5a520f436a64fa21L, xsm64.next());
    }
}
