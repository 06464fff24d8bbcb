package axonsentry.core.model.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SamplingSettings")
class SamplingSettingsTest {

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject probability above 1.0")
        void shouldRejectProbabilityAboveOne() {
            assertThrows(IllegalArgumentException.class, () -> SamplingSettings.probabilityOnly(1.5));
        }

        @Test
        @DisplayName("should reject negative probability")
        void shouldRejectNegativeProbability() {
            assertThrows(IllegalArgumentException.class, () -> SamplingSettings.probabilityOnly(-0.1));
        }

        @Test
        @DisplayName("should reject non-positive traces per second")
        void shouldRejectNonPositiveRate() {
            assertThrows(IllegalArgumentException.class, () -> SamplingSettings.rateLimitOnly(0));
            assertThrows(IllegalArgumentException.class, () -> SamplingSettings.rateLimitOnly(-5));
        }

        @Test
        @DisplayName("should reject non-positive burst capacity")
        void shouldRejectNonPositiveBurst() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new SamplingSettings(
                            true, Optional.empty(), Optional.of(10), Optional.of(0), CombineStrategy.AND));
        }

        @Test
        @DisplayName("should treat null components as absent")
        void shouldTreatNullComponentsAsAbsent() {
            var settings = new SamplingSettings(true, null, null, null, null);

            assertTrue(settings.probability().isEmpty());
            assertTrue(settings.tracesPerSecond().isEmpty());
            assertTrue(settings.burstCapacity().isEmpty());
            assertEquals(CombineStrategy.AND, settings.combineStrategy());
        }
    }

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("defaults should have no strategy")
        void defaultsShouldHaveNoStrategy() {
            var settings = SamplingSettings.defaults();

            assertTrue(settings.enabled());
            assertFalse(settings.hasSamplingStrategy());
        }

        @Test
        @DisplayName("production should combine 10% with 100 traces per second")
        void productionShouldCombineProbabilityAndRate() {
            var settings = SamplingSettings.production();

            assertEquals(Optional.of(0.1), settings.probability());
            assertEquals(Optional.of(100), settings.tracesPerSecond());
            assertEquals(CombineStrategy.AND, settings.combineStrategy());
            assertTrue(settings.hasSamplingStrategy());
        }

        @Test
        @DisplayName("high traffic should combine 1% with 50 traces per second")
        void highTrafficShouldCombineProbabilityAndRate() {
            var settings = SamplingSettings.highTraffic();

            assertEquals(Optional.of(0.01), settings.probability());
            assertEquals(Optional.of(50), settings.tracesPerSecond());
        }

        @Test
        @DisplayName("disabled should report no strategy even with values set")
        void disabledShouldReportNoStrategy() {
            var settings =
                    new SamplingSettings(false, Optional.of(0.5), Optional.of(10), Optional.empty(), CombineStrategy.OR);

            assertFalse(settings.hasSamplingStrategy());
        }
    }

    @Nested
    @DisplayName("effectiveBurstCapacity")
    class EffectiveBurstCapacity {

        @Test
        @DisplayName("should default to traces per second")
        void shouldDefaultToRate() {
            assertEquals(25, SamplingSettings.rateLimitOnly(25).effectiveBurstCapacity());
        }

        @Test
        @DisplayName("should use explicit burst capacity")
        void shouldUseExplicitBurst() {
            var settings =
                    new SamplingSettings(true, Optional.empty(), Optional.of(10), Optional.of(40), CombineStrategy.AND);

            assertEquals(40, settings.effectiveBurstCapacity());
        }

        @Test
        @DisplayName("should fail without a rate limit")
        void shouldFailWithoutRate() {
            assertThrows(IllegalStateException.class, () -> SamplingSettings.defaults().effectiveBurstCapacity());
        }
    }
}
