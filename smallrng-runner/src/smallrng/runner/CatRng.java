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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.OutputStream;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Endlessly writes the output of a generator to stdout, for example to feed PractRand:
 * <pre>
 *   java smallrng.runner.CatRng xsm64 | RNG_test stdin -multithreaded
 * </pre>
 * or runs a YAML configuration with {@code --config <file>}.
 */
public class CatRng
{
    private static final Logger logger = LoggerFactory.getLogger(CatRng.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String... args)
    {
        System.exit(run(args));
    }

    @VisibleForTesting
    static int run(String... args)
    {
        Configuration config;
        try
        {
            if (args.length == 2 && args[0].equals("--config"))
            {
                config = Configuration.fromFile(loadConfig(args[1]));
            }
            else if (args.length == 1 && Generators.contains(args[0]))
            {
                config = new Configuration.ConfigurationBuilder().setGenerator(args[0]).build();
            }
            else
            {
                if (args.length == 1)
                    System.err.println("Error: unknown generator: " + args[0]);
                printUsage();
                return USAGE;
            }
        }
        catch (Exception e)
        {
            logger.error("Could not load configuration: " + e.getMessage(), e);
            return FAILED;
        }

        return run(config);
    }

    public static int run(Configuration config)
    {
        Throwable thrown = null;
        OutputStream out = null;
        try
        {
            RngRunner runner = config.createRunner();
            out = config.output.make();
            runner.run(out);
        }
        catch (Throwable e)
        {
            logger.error("Failed due to exception: " + e.getMessage(), e);
            thrown = e;
        }
        finally
        {
            if (out != null)
                tryRun(out::close);
            logger.info("Exiting...");
        }
        return thrown == null ? OK : FAILED;
    }

    static void tryRun(ThrowingRunnable runnable)
    {
        try
        {
            runnable.run();
        }
        catch (Throwable t)
        {
            logger.error("Encountered an error while closing the output, ignoring.", t);
        }
    }

    /**
     * Returns the configuration file at {@code path}.
     * @throws Exception If file is not found or cannot be read.
     */
    public static File loadConfig(String path) throws Exception
    {
        File configFile = new File(path);
        if (!configFile.exists())
            throw new FileNotFoundException(configFile.getAbsolutePath());

        if (!configFile.canRead())
            throw new Exception("Cannot read config file, check your permissions on " + configFile.getAbsolutePath());

        return configFile;
    }

    private static void printUsage()
    {
        System.err.println("Usage: CatRng RNG");
        System.err.println("       CatRng --config FILE.yaml");
        System.err.println("where RNG is one of: " + Generators.names());
        System.err.println();
        System.err.println("Endlessly writes the output of RNG to stdout. It can for example be used with PractRand:");
        System.err.println("  CatRng xsm64 | RNG_test stdin -multithreaded");
    }
}
