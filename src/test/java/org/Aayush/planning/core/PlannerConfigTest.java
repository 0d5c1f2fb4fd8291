package org.Aayush.planning.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Planner Config Tests")
class PlannerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(PlannerConfig.PROPERTY_PREFIX + "seed");
        System.clearProperty(PlannerConfig.PROPERTY_PREFIX + "maxIterations");
        System.clearProperty(PlannerConfig.PROPERTY_PREFIX + "rewirePolicy");
        System.clearProperty(PlannerConfig.PROPERTY_PREFIX + "timeBudget");
        System.clearProperty(PlannerConfig.PROPERTY_PREFIX + "regionBias");
    }

    @Nested
    @DisplayName("1. Defaults and Validation")
    class Validation {

        @Test
        @DisplayName("Defaults are valid")
        void testDefaults() {
            PlannerConfig config = PlannerConfig.builder().build();
            assertSame(config, config.validate());
            assertEquals(RewirePolicy.TRANSITION, config.getRewirePolicy());
            assertEquals(SamplerPolicy.REGION_BIASED, config.getSamplerPolicy());
            assertNull(config.getTimeBudget());
        }

        static Stream<Arguments> invalidConfigs() {
            return Stream.of(
                    Arguments.of("maxIterations", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.maxIterations(0)),
                    Arguments.of("maxVertices", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.maxVertices(1)),
                    Arguments.of("timeBudget", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.timeBudget(Duration.ZERO)),
                    Arguments.of("stepSize", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.stepSize(Double.NaN)),
                    Arguments.of("collisionResolution", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.collisionResolution(0.75d)),
                    Arguments.of("rewireGamma", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.rewireGamma(-1.0d)),
                    Arguments.of("nearestCandidates", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.nearestCandidates(0)),
                    Arguments.of("rewirePolicy", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.rewirePolicy(null)),
                    Arguments.of("regionBias", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.regionBias(1.5d)),
                    Arguments.of("cycleCheckInterval", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.cycleCheckInterval(0)),
                    Arguments.of("convergenceWindow", (UnaryOperator<PlannerConfig.PlannerConfigBuilder>) b -> b.convergenceWindow(-1))
            );
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("invalidConfigs")
        @DisplayName("Out-of-range fields are rejected with P4_CONFIG_INVALID")
        void testInvalid(String field, UnaryOperator<PlannerConfig.PlannerConfigBuilder> change) {
            PlannerConfig config = change.apply(PlannerConfig.builder()).build();
            PlanningException ex = assertThrows(PlanningException.class, config::validate);
            assertEquals(PlanningException.REASON_CONFIG_INVALID, ex.reasonCode());
            assertTrue(ex.getMessage().contains(field), "message should name " + field + ": " + ex.getMessage());
        }
    }

    @Nested
    @DisplayName("2. System Properties")
    class SystemProperties {

        @Test
        @DisplayName("Properties overlay the defaults")
        void testOverlay() {
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "seed", "7");
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "maxIterations", " 123 ");
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "rewirePolicy", "SAME_STATE");
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "timeBudget", "PT2S");

            PlannerConfig config = PlannerConfig.fromSystemProperties();

            assertEquals(7L, config.getSeed());
            assertEquals(123, config.getMaxIterations());
            assertEquals(RewirePolicy.SAME_STATE, config.getRewirePolicy());
            assertEquals(Duration.ofSeconds(2), config.getTimeBudget());
        }

        @Test
        @DisplayName("Malformed values fall back to defaults")
        void testMalformed() {
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "maxIterations", "lots");
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "rewirePolicy", "sometimes");
            System.setProperty(PlannerConfig.PROPERTY_PREFIX + "regionBias", "");

            PlannerConfig config = PlannerConfig.fromSystemProperties();
            PlannerConfig defaults = PlannerConfig.builder().build();

            assertEquals(defaults, config);
        }
    }

    @Nested
    @DisplayName("3. Rewiring Radius")
    class Radius {

        @Test
        @DisplayName("Radius is capped and shrinks with the vertex count")
        void testShrinks() {
            PlannerConfig config = PlannerConfig.builder().rewireGamma(2.0d).rewireRadiusMax(1.0d).build();
            assertEquals(1.0d, config.rewireRadius(0, 2), 1e-12);
            assertEquals(1.0d, config.rewireRadius(3, 2), 1e-12, "2 * sqrt(ln 3 / 3) exceeds the cap");

            double r100 = config.rewireRadius(100, 2);
            double r10000 = config.rewireRadius(10_000, 2);
            assertEquals(2.0d * Math.sqrt(Math.log(100) / 100), r100, 1e-12);
            assertTrue(r10000 < r100, "radius must shrink as the graph grows");
        }
    }
}
