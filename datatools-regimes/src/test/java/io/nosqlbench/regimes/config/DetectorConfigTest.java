package io.nosqlbench.regimes.config;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class DetectorConfigTest {

    @Test
    void testDefaults() {
        DetectorConfig config = DetectorConfig.defaults();

        assertEquals(1e-4, config.alpha());
        assertEquals(3, config.minAgree());
        assertEquals(5, config.numTest());
        assertEquals(30, config.lookback());
        assertEquals(0.125, config.trimProportion());
        assertEquals(3.0, config.outlierThreshold());
        assertEquals(BandMode.FIXED, config.bandMode());
        assertEquals(RegressionDirection.DOWNWARD, config.direction());
        assertEquals(DetectorConfig.CONFIG_VERSION, config.version());
    }

    @Test
    void testBuilderOverrides() {
        DetectorConfig config = DetectorConfig.builder()
            .alpha(0.01)
            .minAgree(2)
            .lookback(50)
            .bandMode(BandMode.STD_ERROR)
            .direction(RegressionDirection.UPWARD)
            .build();

        assertEquals(0.01, config.alpha());
        assertEquals(2, config.minAgree());
        assertEquals(50, config.lookback());
        assertEquals(BandMode.STD_ERROR, config.bandMode());
        assertEquals(config, config.toBuilder().build());
        assertNotEquals(DetectorConfig.defaults(), config);
    }

    @Test
    void testValidation() {
        assertInvalid("alpha", DetectorConfig.builder().alpha(0.0));
        assertInvalid("alpha", DetectorConfig.builder().alpha(1.0));
        assertInvalid("min_agree", DetectorConfig.builder().minAgree(0));
        assertInvalid("lookback", DetectorConfig.builder().lookback(2));
        assertInvalid("num_test", DetectorConfig.builder().numTest(0));
        assertInvalid("num_test", DetectorConfig.builder().numTest(30));
        assertInvalid("trim_proportion", DetectorConfig.builder().trimProportion(1.0));
        assertInvalid("outlier_threshold", DetectorConfig.builder().outlierThreshold(-1.0));
        assertInvalid("band_alpha", DetectorConfig.builder().bandAlpha(Double.NaN));
        assertInvalid("fixed_band_multiplier", DetectorConfig.builder().fixedBandMultiplier(0.0));
        assertInvalid("band_mode", DetectorConfig.builder().bandMode(null));
        assertInvalid("direction", DetectorConfig.builder().direction(null));
    }

    private static void assertInvalid(String parameter, DetectorConfig.Builder builder) {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, builder::build);
        assertEquals(parameter, e.getParameter());
    }

    @Test
    void testPartialJsonKeepsDefaults() {
        DetectorConfig config = DetectorConfig.fromJson(new StringReader("""
            {"alpha": 0.001, "direction": "UPWARD", "band_mode": "STD_ERROR"}
            """));

        assertEquals(0.001, config.alpha());
        assertEquals(RegressionDirection.UPWARD, config.direction());
        assertEquals(BandMode.STD_ERROR, config.bandMode());
        assertEquals(DetectorConfig.DEFAULT_LOOKBACK, config.lookback());
    }

    @Test
    void testRejectsBadDocuments() {
        InvalidConfigurationException version = assertThrows(InvalidConfigurationException.class,
            () -> DetectorConfig.fromJson(new StringReader("{\"version\": 2}")));
        assertEquals("version", version.getParameter());

        InvalidConfigurationException direction = assertThrows(InvalidConfigurationException.class,
            () -> DetectorConfig.fromJson(new StringReader("{\"direction\": \"SIDEWAYS\"}")));
        assertEquals("direction", direction.getParameter());

        assertThrows(InvalidConfigurationException.class,
            () -> DetectorConfig.fromJson(new StringReader("{\"alpha\": ")));
        assertThrows(InvalidConfigurationException.class,
            () -> DetectorConfig.fromJson(new StringReader("")));
    }

    @Test
    void testSaveAndLoad(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("detector.json");
        DetectorConfig config = DetectorConfig.builder().numTest(7).trimProportion(0.2).build();

        config.save(file);

        assertThat(Files.readString(file)).contains("\"num_test\": 7", "\"trim_proportion\": 0.2");
        assertEquals(config, DetectorConfig.load(file));
    }
}
