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

import java.security.SecureRandom;
import java.util.function.Function;

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates generators of one kind from a fixed-size seed.
 */
public interface SeedableGenerator<T extends RandomGenerator>
{
    Logger logger = LoggerFactory.getLogger(SeedableGenerator.class);

    /**
     * Exact number of seed bytes accepted by {@link #fromSeed(byte[])}.
     */
    int seedSize();

    /**
     * @throws InvalidSeedException if the seed has the wrong length or decodes to an unusable state
     */
    T fromSeed(byte[] seed);

    default T fromSeed(String hexSeed)
    {
        return fromSeed(BaseEncoding.base16().decode(hexSeed.toUpperCase()));
    }

    /**
     * Seeds a new generator from {@link SecureRandom}. The seed is logged, so the stream can be reproduced
     * with {@link #fromSeed(String)}.
     */
    default T fromEntropy()
    {
        byte[] seed = new byte[seedSize()];
        new SecureRandom().nextBytes(seed);
        logger.info("Seed: {}", BaseEncoding.base16().lowerCase().encode(seed));
        return fromSeed(seed);
    }

    static <T extends RandomGenerator> SeedableGenerator<T> of(int size, Function<byte[], T> constructor)
    {
        return new SeedableGenerator<T>()
        {
            public int seedSize()
            {
                return size;
            }

            public T fromSeed(byte[] seed)
            {
                return constructor.apply(seed);
            }
        };
    }
}
