package by.greenmobile.speedsfeedscalc.service.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CuttingPowerModelTest {

    private final CuttingPowerModel model = new CuttingPowerModel(0.8, 0.8);

    @Test
    void cuttingPower() {
        // 60 cm3/min in steel at 2000 N/mm2 = 2 kW
        assertThat(model.cuttingPowerKw(60_000, 2000)).isCloseTo(2.0, within(1e-12));
        assertThat(model.spindlePowerKw(2.0)).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void torque() {
        // 1 kW at 60/(2pi) rev/min -> omega 1 rad/s -> 1000 N·m
        assertThat(model.torqueNm(1.0, 60.0 / (2 * Math.PI))).isCloseTo(1000.0, within(1e-9));
        assertThat(model.torqueNm(1.0, 0.0)).isZero();
    }

    @Test
    void capacityWarnings() {
        assertThat(model.capacityWarnings(3.0, null)).isEmpty();
        assertThat(model.capacityWarnings(3.0, 0.0)).isEmpty();
        assertThat(model.capacityWarnings(1.0, 2.2)).isEmpty();

        List<String> near = model.capacityWarnings(2.0, 2.2);
        assertThat(near).containsExactly("Required spindle power 2.00 kW is above 80% of machine capacity 2.20 kW");

        List<String> over = model.capacityWarnings(3.0, 2.2);
        assertThat(over).hasSize(1);
        assertThat(over.get(0)).startsWith("Required spindle power 3.00 kW exceeds machine capacity 2.20 kW");
    }

    @Test
    void efficiencyMustBeAFraction() {
        assertThatThrownBy(() -> new CuttingPowerModel(0.0, 0.8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CuttingPowerModel(1.2, 0.8)).isInstanceOf(IllegalArgumentException.class);
    }
}
