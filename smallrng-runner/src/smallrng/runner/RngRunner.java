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

import java.io.IOException;
import java.io.OutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import smallrng.generators.RandomGenerator;

/**
 * Writes generator output to a sink, one buffer at a time.
 */
public class RngRunner
{
    private static final Logger logger = LoggerFactory.getLogger(RngRunner.class);

    public static final long UNLIMITED = 0;

    private final String name;
    private final RandomGenerator rng;
    private final int bufferSize;
    private final long limit;

    public RngRunner(String name, RandomGenerator rng, int bufferSize, long limit)
    {
        if (bufferSize <= 0)
            throw new IllegalArgumentException("Buffer size should be positive, but was " + bufferSize);
        if (limit < 0)
            throw new IllegalArgumentException("Limit should not be negative, but was " + limit);
        this.name = name;
        this.rng = rng;
        this.bufferSize = bufferSize;
        this.limit = limit;
    }

    public RandomGenerator getRng()
    {
        return rng;
    }

    /**
     * Streams {@code limit} bytes, or until the sink fails when unlimited. The last buffer is cut short
     * to stay within the limit.
     *
     * @return number of bytes written
     */
    public long run(OutputStream out) throws IOException
    {
        logger.info("Streaming {} from {}", limit == UNLIMITED ? "unlimited bytes" : limit + " bytes", name);
        byte[] buffer = new byte[bufferSize];
        long written = 0;
        while (limit == UNLIMITED || written < limit)
        {
            int n = limit == UNLIMITED ? bufferSize : (int) Math.min(bufferSize, limit - written);
            rng.fill(buffer, 0, n);
            out.write(buffer, 0, n);
            written += n;
        }
        out.flush();
        logger.info("Wrote {} bytes from {}", written, name);
        return written;
    }
}
