package io.nosqlbench.arrays.numeric;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.arrays.ArrayChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * JSON-serializable settings for {@link DoubleArrays#summarize(double[], SummaryConfig)}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "percentiles": [1, 5, 25, 50, 75, 95, 99],
 *   "outlier_factor": 1.5
 * }
 * }</pre>
 *
 * <p>Missing keys fall back to the defaults shown above.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SummaryConfig config = SummaryConfig.load(Path.of("summary.json"));
 * DistributionSummary summary = DoubleArrays.summarize(latencies, config);
 * }</pre>
 */
public class SummaryConfig {

    private static final Logger logger = LogManager.getLogger(SummaryConfig.class);

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    static final double[] DEFAULT_PERCENTILES = {1, 5, 25, 50, 75, 95, 99};
    static final double DEFAULT_OUTLIER_FACTOR = 1.5;

    /** Percentile ranks to report, each in 0..100 */
    @SerializedName("percentiles")
    private double[] percentiles;

    /** Multiplier of the interquartile range used for the outlier fences */
    @SerializedName("outlier_factor")
    private Double outlierFactor;

    public SummaryConfig() {
    }

    public SummaryConfig(double[] percentiles, double outlierFactor) {
        this.percentiles = percentiles.clone();
        this.outlierFactor = outlierFactor;
    }

    /**
     * Returns a configuration holding the default percentiles and a 1.5 outlier factor.
     */
    public static SummaryConfig defaults() {
        return new SummaryConfig(DEFAULT_PERCENTILES, DEFAULT_OUTLIER_FACTOR);
    }

    public double[] getPercentiles() {
        return percentiles == null ? DEFAULT_PERCENTILES.clone() : percentiles.clone();
    }

    public void setPercentiles(double[] percentiles) {
        this.percentiles = percentiles == null ? null : percentiles.clone();
    }

    public double getOutlierFactor() {
        return outlierFactor == null ? DEFAULT_OUTLIER_FACTOR : outlierFactor;
    }

    public void setOutlierFactor(Double outlierFactor) {
        this.outlierFactor = outlierFactor;
    }

    /**
     * Checks every value against its allowed range.
     *
     * @return this configuration
     * @throws io.nosqlbench.arrays.ValueOutOfRangeException if a percentile is outside 0..100
     *         or the outlier factor is negative or not finite
     */
    public SummaryConfig validate() {
        for (double p : getPercentiles()) {
            ArrayChecks.requireInRange(p, 0, 100, "percentile");
        }
        ArrayChecks.requireInRange(getOutlierFactor(), 0, Double.MAX_VALUE, "outlier_factor");
        return this;
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON text
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is empty
     */
    public static SummaryConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        SummaryConfig config = GSON.fromJson(json, SummaryConfig.class);
        if (config == null) {
            throw new IllegalArgumentException("JSON content is empty");
        }
        return config;
    }

    /**
     * Loads and validates a configuration from a JSON file.
     *
     * @param path the file to read
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static SummaryConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path)) {
            SummaryConfig config = GSON.fromJson(reader, SummaryConfig.class);
            if (config == null) {
                throw new IllegalArgumentException("JSON content is empty: " + path);
            }
            config.validate();
            logger.debug("loaded summary config from {}: {}", path, config);
            return config;
        }
    }

    /**
     * Serializes this configuration to JSON.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SummaryConfig that)) return false;
        return Arrays.equals(getPercentiles(), that.getPercentiles())
            && Double.compare(getOutlierFactor(), that.getOutlierFactor()) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(getPercentiles()) + Double.hashCode(getOutlierFactor());
    }

    @Override
    public String toString() {
        return "SummaryConfig[percentiles=" + Arrays.toString(getPercentiles())
            + ", outlierFactor=" + getOutlierFactor() + "]";
    }
}
