/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.slha.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for reading and writing SLHA files.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dslha.charset=ISO-8859-1})</li>
 *   <li>Environment variables (e.g., {@code SLHA_CHARSET})</li>
 *   <li>Properties file ({@code slha.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>charset</td><td>slha.charset</td><td>SLHA_CHARSET</td><td>UTF-8</td></tr>
 *   <tr><td>warnOnDuplicates</td><td>slha.warnOnDuplicates</td><td>SLHA_WARN_ON_DUPLICATES</td><td>true</td></tr>
 *   <tr><td>maxFileSizeMb</td><td>slha.maxFileSizeMb</td><td>SLHA_MAX_FILE_SIZE_MB</td><td>64</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # slha.properties
 * slha.charset=UTF-8
 * slha.warnOnDuplicates=false
 * slha.maxFileSizeMb=16
 * </pre>
 */
public final class SlhaConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SlhaConfig.class);

    private static final String PROPERTIES_FILE = "slha.properties";

    // Property keys
    private static final String PROP_CHARSET = "slha.charset";
    private static final String PROP_WARN_ON_DUPLICATES = "slha.warnOnDuplicates";
    private static final String PROP_MAX_FILE_SIZE_MB = "slha.maxFileSizeMb";

    // Environment variable keys
    private static final String ENV_CHARSET = "SLHA_CHARSET";
    private static final String ENV_WARN_ON_DUPLICATES = "SLHA_WARN_ON_DUPLICATES";
    private static final String ENV_MAX_FILE_SIZE_MB = "SLHA_MAX_FILE_SIZE_MB";

    // Defaults
    private static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;
    private static final boolean DEFAULT_WARN_ON_DUPLICATES = true;
    private static final int DEFAULT_MAX_FILE_SIZE_MB = 64;

    private final Charset charset;
    private final boolean warnOnDuplicates;
    private final int maxFileSizeMb;

    private SlhaConfig(Builder builder) {
        this.charset = builder.charset;
        this.warnOnDuplicates = builder.warnOnDuplicates;
        this.maxFileSizeMb = builder.maxFileSizeMb;
    }

    /** Charset used for files and standard streams. */
    public Charset charset() {
        return charset;
    }

    /** Whether duplicate records are logged at WARN (true) or DEBUG (false). */
    public boolean warnOnDuplicates() {
        return warnOnDuplicates;
    }

    /** Largest file in MB the reader accepts. */
    public int maxFileSizeMb() {
        return maxFileSizeMb;
    }

    public long maxFileSizeBytes() {
        return (long) maxFileSizeMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "SlhaConfig{" +
                "charset=" + charset +
                ", warnOnDuplicates=" + warnOnDuplicates +
                ", maxFileSizeMb=" + maxFileSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code SlhaConfig.builder().build()}.
     */
    public static SlhaConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link SlhaConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Charset charset;
        private Boolean warnOnDuplicates;
        private Integer maxFileSizeMb;

        private final Properties fileProperties;

        private Builder() {
            // Load properties file once
            this(loadPropertiesFile());
        }

        private Builder(Properties fileProperties) {
            this.fileProperties = fileProperties;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        /**
         * @throws UnsupportedCharsetException if the JVM does not know the charset
         */
        public Builder charset(String charset) {
            this.charset = Charset.forName(charset);
            return this;
        }

        public Builder warnOnDuplicates(boolean warnOnDuplicates) {
            this.warnOnDuplicates = warnOnDuplicates;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code maxFileSizeMb} is not positive
         */
        public Builder maxFileSizeMb(int maxFileSizeMb) {
            if (maxFileSizeMb < 1) {
                throw new IllegalArgumentException("maxFileSizeMb must be positive: " + maxFileSizeMb);
            }
            this.maxFileSizeMb = maxFileSizeMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public SlhaConfig build() {
            return new SlhaConfig(resolve());
        }

        /** Resolves unset values into a fresh builder, leaving this one reusable. */
        private Builder resolve() {
            Builder copy = new Builder(fileProperties);
            copy.charset = charset != null
                    ? charset
                    : resolveCharset(PROP_CHARSET, ENV_CHARSET, DEFAULT_CHARSET);
            copy.warnOnDuplicates = warnOnDuplicates != null
                    ? warnOnDuplicates
                    : resolveBoolean(PROP_WARN_ON_DUPLICATES, ENV_WARN_ON_DUPLICATES, DEFAULT_WARN_ON_DUPLICATES);
            copy.maxFileSizeMb = maxFileSizeMb != null
                    ? maxFileSizeMb
                    : resolveInt(PROP_MAX_FILE_SIZE_MB, ENV_MAX_FILE_SIZE_MB, DEFAULT_MAX_FILE_SIZE_MB);
            return copy;
        }

        /**
         * First non-blank value from system property, environment variable,
         * then properties file; null if none is set.
         */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
            return null;
        }

        private Charset resolveCharset(String sysProp, String envVar, Charset defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Charset.forName(value);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                LOG.warn("Unknown charset '{}' for {}, using {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value == null ? defaultValue : Boolean.parseBoolean(value);
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = lookup(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                int parsed = Integer.parseInt(value);
                if (parsed > 0) {
                    return parsed;
                }
                LOG.warn("Non-positive value {} for {}, using {}", parsed, sysProp, defaultValue);
                return defaultValue;
            } catch (NumberFormatException e) {
                LOG.warn("Invalid integer '{}' for {}, using {}", value, sysProp, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = SlhaConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Cannot load {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
                props.clear();
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Cannot load {}: {}", localFile.toAbsolutePath(), e.getMessage());
                    props.clear();
                }
            }

            return props;
        }
    }
}
