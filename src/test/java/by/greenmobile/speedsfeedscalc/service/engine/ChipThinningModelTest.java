package by.greenmobile.speedsfeedscalc.service.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ChipThinningModelTest {

    private final ChipThinningModel model = new ChipThinningModel(5.0);

    @ParameterizedTest
    @CsvSource({
            "0.5,  1.0",
            "0.7,  1.0",
            "0.1,  0.6",
            "0.25, 0.8660254037844386",
            "0.0,  0.0"
    })
    void thinningFactor(double engagement, double expected) {
        assertThat(model.thinningFactor(engagement)).isCloseTo(expected, within(1e-12));
    }

    @Test
    void compensationIsInverseOfFactor() {
        assertThat(model.compensation(0.1)).isCloseTo(1.0 / 0.6, within(1e-12));
        assertThat(model.compensation(0.5)).isEqualTo(1.0);
        assertThat(model.isCapped(0.1)).isFalse();
    }

    @Test
    void tinyEngagementIsCapped() {
        // r = 0.01 -> RCTF ~0.199 -> 1/RCTF ~5.03
        assertThat(model.compensation(0.01)).isEqualTo(5.0);
        assertThat(model.isCapped(0.01)).isTrue();
        assertThat(model.compensation(0.0)).isEqualTo(5.0);
        assertThat(model.isCapped(0.0)).isTrue();
    }

    @Test
    void compensationGrowsAsEngagementDrops() {
        assertThat(model.compensation(0.05)).isGreaterThan(model.compensation(0.2));
        assertThat(model.compensation(0.2)).isGreaterThan(model.compensation(0.4));
        assertThat(model.compensation(0.4)).isGreaterThan(1.0);
    }

    @Test
    void capMustExceedOne() {
        assertThatThrownBy(() -> new ChipThinningModel(1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChipThinningModel(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
