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

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import smallrng.generators.RandomGenerator;
import smallrng.generators.SeedableGenerator;

public class Configuration
{
    public static final int DEFAULT_BUFFER_SIZE = 32;

    private static final ObjectMapper mapper;

    static
    {
        mapper = new ObjectMapper(new YAMLFactory()
                                  .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                                  .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                  .disable(YAMLGenerator.Feature.CANONICAL_OUTPUT)
                                  .enable(YAMLGenerator.Feature.INDENT_ARRAYS));
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.registerSubtypes(StdoutConfiguration.class);
        mapper.registerSubtypes(FileOutputConfiguration.class);
    }

    public final String generator;
    /**
     * Hex-encoded seed. When absent, the generator is seeded from system entropy.
     */
    public final String seed;
    public final int buffer_size;
    public final long limit;
    public final OutputConfiguration output;

    @JsonCreator
    public Configuration(@JsonProperty("generator") String generator,
                         @JsonProperty("seed") String seed,
                         @JsonProperty("buffer_size") int buffer_size,
                         @JsonProperty("limit") long limit,
                         @JsonProperty("output") OutputConfiguration output)
    {
        this.generator = generator;
        this.seed = seed;
        this.buffer_size = buffer_size == 0 ? DEFAULT_BUFFER_SIZE : buffer_size;
        this.limit = limit;
        this.output = output == null ? new StdoutConfiguration() : output;
    }

    public static String toYamlString(Configuration config)
    {
        try
        {
            return mapper.writeValueAsString(config);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromYamlString(String config)
    {
        try
        {
            return mapper.readValue(config, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static Configuration fromFile(String path)
    {
        return fromFile(new File(path));
    }

    public static Configuration fromFile(File file)
    {
        try
        {
            return mapper.readValue(file, Configuration.class);
        }
        catch (Throwable t)
        {
            throw new RuntimeException(t);
        }
    }

    public static void validate(Configuration config)
    {
        Objects.requireNonNull(config.generator, "Generator should not be null");
        if (!Generators.contains(config.generator))
            throw new IllegalArgumentException(String.format("Unknown generator %s. Known generators: %s", config.generator, Generators.names()));
        if (config.buffer_size < 0)
            throw new IllegalArgumentException("Buffer size should be positive, but was " + config.buffer_size);
        if (config.limit < 0)
            throw new IllegalArgumentException("Limit should not be negative, but was " + config.limit);
    }

    public RngRunner createRunner()
    {
        return createRunner(this);
    }

    public static RngRunner createRunner(Configuration config)
    {
        validate(config);
        SeedableGenerator<?> factory = Generators.get(config.generator);
        RandomGenerator rng = config.seed == null ? factory.fromEntropy() : factory.fromSeed(config.seed);
        return new RngRunner(config.generator, rng, config.buffer_size, config.limit);
    }

    public static class ConfigurationBuilder
    {
        String generator;
        String seed;
        int buffer_size = DEFAULT_BUFFER_SIZE;
        long limit = RngRunner.UNLIMITED;
        OutputConfiguration output = new StdoutConfiguration();

        public ConfigurationBuilder setGenerator(String generator)
        {
            this.generator = generator;
            return this;
        }

        public ConfigurationBuilder setSeed(String seed)
        {
            this.seed = seed;
            return this;
        }

        public ConfigurationBuilder setBufferSize(int buffer_size)
        {
            this.buffer_size = buffer_size;
            return this;
        }

        public ConfigurationBuilder setLimit(long limit)
        {
            this.limit = limit;
            return this;
        }

        public ConfigurationBuilder setOutput(OutputConfiguration output)
        {
            this.output = output;
            return this;
        }

        public Configuration build()
        {
            return new Configuration(generator,
                                     seed,
                                     buffer_size,
                                     limit,
                                     output);
        }
    }

    public ConfigurationBuilder unbuild()
    {
        ConfigurationBuilder builder = new ConfigurationBuilder();
        builder.generator = generator;
        builder.seed = seed;
        builder.buffer_size = buffer_size;
        builder.limit = limit;
        builder.output = output;
        return builder;
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    public interface OutputConfiguration
    {
        OutputStream make() throws IOException;
    }

    /**
     * Writes to the process' standard output. {@link System#out} is not used, since it swallows write errors.
     */
    @JsonTypeName("stdout")
    public static class StdoutConfiguration implements OutputConfiguration
    {
        @JsonCreator
        public StdoutConfiguration()
        {
        }

        public OutputStream make()
        {
            return new BufferedOutputStream(new FileOutputStream(FileDescriptor.out));
        }
    }

    @JsonTypeName("file")
    public static class FileOutputConfiguration implements OutputConfiguration
    {
        public final String path;
        public final boolean append;

        @JsonCreator
        public FileOutputConfiguration(@JsonProperty("path") String path,
                                       @JsonProperty("append") boolean append)
        {
            this.path = Objects.requireNonNull(path, "path");
            this.append = append;
        }

        public OutputStream make() throws IOException
        {
            return new BufferedOutputStream(new FileOutputStream(path, append));
        }
    }
}
