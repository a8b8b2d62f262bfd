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

package smallrng.runner;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import smallrng.generators.MswsRng;
import smallrng.generators.MwpRng;
import smallrng.generators.PcgXsh64LcgRng;
import smallrng.generators.PcgXsl128McgRng;
import smallrng.generators.PcgXsl64LcgRng;
import smallrng.generators.SeedableGenerator;
import smallrng.generators.Xsm32Rng;
import smallrng.generators.Xsm64Rng;

/**
 * Generators that can be selected by name from the command line or a configuration file.
 */
public class Generators
{
    private static final Map<String, SeedableGenerator<?>> GENERATORS =
        ImmutableMap.<String, SeedableGenerator<?>>builder()
                    .put("msws", MswsRng.FACTORY)
                    .put("mwp", MwpRng.FACTORY)
                    .put("pcg_xsh_64_lcg", PcgXsh64LcgRng.FACTORY)
                    .put("pcg_xsl_64_lcg", PcgXsl64LcgRng.FACTORY)
                    .put("pcg_xsl_128_mcg", PcgXsl128McgRng.FACTORY)
                    .put("xsm32", Xsm32Rng.FACTORY)
                    .put("xsm64", Xsm64Rng.FACTORY)
                    .build();

    public static Set<String> names()
    {
        return GENERATORS.keySet();
    }

    public static boolean contains(String name)
    {
        return GENERATORS.containsKey(name);
    }

    public static SeedableGenerator<?> get(String name)
    {
        SeedableGenerator<?> factory = GENERATORS.get(name);
        if (factory == null)
            throw new IllegalArgumentException(String.format("Unknown generator %s. Known generators: %s", name, names()));
        return factory;
    }
}
