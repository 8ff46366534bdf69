package com.alertsentinel.core.config;

import com.alertsentinel.core.detection.BoundType;
import com.alertsentinel.core.detection.DetectorConfig;
import com.alertsentinel.core.detection.Direction;
import com.alertsentinel.core.detection.MadConfig;
import com.alertsentinel.core.detection.SeriesTransform;
import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.detection.ZScoreConfig;
import com.alertsentinel.core.error.InvalidConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfigParser}.
 */
class DetectorConfigParserTest {

    private final DetectorConfigParser parser = new DetectorConfigParser(true);

    @Test
    @DisplayName("Should parse a z-score map and apply defaults")
    void parsesZScore() {
        DetectorConfig config = parser.parse(Map.of("type", "zscore", "window", 20, "on", "delta"));

        assertThat(config).isInstanceOf(ZScoreConfig.class);
        ZScoreConfig zscore = (ZScoreConfig) config;
        assertThat(zscore.getWindow()).isEqualTo(20);
        assertThat(zscore.getOn()).isEqualTo(SeriesTransform.DELTA);
        assertThat(zscore.getZThreshold()).isEqualTo(3.0);
        assertThat(zscore.getMinPoints()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should parse a MAD config from JSON, case-insensitive type")
    void parsesMadJson() {
        DetectorConfig config = parser.parse(
                "{\"type\":\"MAD\",\"window\":12,\"k\":4,\"min_points\":6,\"direction\":\"down\"}");

        assertThat(config).isInstanceOf(MadConfig.class);
        MadConfig mad = (MadConfig) config;
        assertThat(mad.getK()).isEqualTo(4.0);
        assertThat(mad.getMinPoints()).isEqualTo(6);
        assertThat(mad.effectiveDirection()).isEqualTo(Direction.DOWN);
    }

    @Test
    @DisplayName("Should parse a threshold config with nested bounds")
    void parsesThreshold() {
        DetectorConfig config = parser.parse(Map.of(
                "type", "threshold",
                "bound_type", "percentage",
                "bounds", Map.of("upper", 0.25)));

        ThresholdConfig threshold = (ThresholdConfig) config;
        assertThat(threshold.getBoundType()).isEqualTo(BoundType.PERCENTAGE);
        assertThat(threshold.getOn()).isEqualTo(SeriesTransform.PCT_DELTA);
        assertThat(threshold.getBounds().getUpper()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should reject an unknown detector type")
    void rejectsUnknownType() {
        assertThatThrownBy(() -> parser.parse(Map.of("type", "prophet")))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Unknown detector type: 'prophet'");
    }

    @Test
    @DisplayName("Should reject a config without a type")
    void rejectsMissingType() {
        assertThatThrownBy(() -> parser.parse(Map.of("window", 10)))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("'type' is required");
    }

    @Test
    @DisplayName("Should reject properties that belong to another variant")
    void rejectsUnknownProperty() {
        assertThatThrownBy(() -> parser.parse(Map.of("type", "zscore", "k", 3.5)))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Invalid zscore detector config");
    }

    @Test
    @DisplayName("Should reject out-of-range parameters")
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> parser.parse(Map.of("type", "zscore", "window", 5, "min_points", 8)))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("'min_points' (8) must not exceed 'window' (5)");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> parser.parse("{\"type\": "))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Malformed detector config");
    }

    @Test
    @DisplayName("With detectors disabled only threshold configs are accepted")
    void featureFlagOff() {
        DetectorConfigParser restricted = new DetectorConfigParser(false);

        assertThatThrownBy(() -> restricted.parse(Map.of("type", "zscore")))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("Detector type 'zscore' is not enabled");
        assertThat(restricted.parse(Map.of("type", "threshold", "bounds", Map.of("lower", 1))))
                .isInstanceOf(ThresholdConfig.class);
    }

    @Test
    @DisplayName("Legacy threshold reads the bound type from 'type'")
    void legacyThreshold() {
        ThresholdConfig threshold = parser.parseThreshold(Map.of(
                "type", "percentage",
                "bounds", Map.of("lower", -0.1, "upper", 0.3)));

        assertThat(threshold.getBoundType()).isEqualTo(BoundType.PERCENTAGE);
        assertThat(threshold.getBounds().getLower()).isEqualTo(-0.1);
        assertThat(threshold.getBounds().getUpper()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Serialized configs parse back to the same parameters")
    void jsonIsReadable() {
        ZScoreConfig original = new ZScoreConfig(14, SeriesTransform.PCT_DELTA, 2.5, 7, Direction.UP);

        String json = parser.toJson(original);
        ZScoreConfig parsed = (ZScoreConfig) parser.parse(json);

        assertThat(json).contains("\"type\":\"zscore\"").contains("\"z_threshold\":2.5");
        assertThat(parsed.getWindow()).isEqualTo(14);
        assertThat(parsed.getOn()).isEqualTo(SeriesTransform.PCT_DELTA);
        assertThat(parsed.getMinPoints()).isEqualTo(7);
        assertThat(parsed.effectiveDirection()).isEqualTo(Direction.UP);
    }
}
