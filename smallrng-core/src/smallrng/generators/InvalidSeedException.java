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
 * Thrown when a generator can not be constructed from the given seed. Seeds are never corrected
 * or retried.
 */
public class InvalidSeedException extends IllegalArgumentException
{
    public enum Kind
    {
        /**
         * Seed is not exactly as long as the generator requires.
         */
        LENGTH,
        /**
         * Seed decodes to a state the generator can not run from.
         */
        VALUE
    }

    public final Kind kind;

    private InvalidSeedException(Kind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public static InvalidSeedException wrongLength(String generator, int expected, int actual)
    {
        return new InvalidSeedException(Kind.LENGTH,
                                        String.format("%s requires a seed of %d bytes, but got %d",
                                                      generator, expected, actual));
    }

    public static InvalidSeedException badValue(String generator, String format, Object... objects)
    {
        return new InvalidSeedException(Kind.VALUE, generator + ": " + String.format(format, objects));
    }
}
