package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.config.MachiningProperties;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.exception.InvalidConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredLookupTest {

    private MachiningProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MachiningProperties();

        MachiningProperties.Material steel = new MachiningProperties.Material();
        steel.setName("Mild steel 1018");
        steel.setKc(2000);
        steel.setSfm(350);
        steel.setSmm(107);
        steel.setChipLoad(0.03);
        steel.setMinRigidityFactor(0.6);
        properties.getMaterials().put("steel-1018", steel);

        MachiningProperties.Material unnamed = new MachiningProperties.Material();
        unnamed.setKc(150);
        properties.getMaterials().put("hdpe", unnamed);

        MachiningProperties.Rigidity hobby = new MachiningProperties.Rigidity();
        hobby.setName("Hobby router");
        hobby.setFactor(0.4);
        properties.getRigidityLevels().put("hobby", hobby);

        MachiningProperties.Rigidity broken = new MachiningProperties.Rigidity();
        broken.setFactor(0.0);
        properties.getRigidityLevels().put("broken", broken);

        properties.getCoatings().put("altin", 1.4);
        properties.getCoatings().put("bogus", -1.0);
    }

    @Test
    void materialTable() {
        MaterialLookup lookup = new ConfiguredMaterialLookup(properties);

        MaterialRecord steel = lookup.find("steel-1018").orElseThrow();
        assertThat(steel.name()).isEqualTo("Mild steel 1018");
        assertThat(steel.kc()).isEqualTo(2000);
        assertThat(steel.chipLoadMm()).isEqualTo(0.03);
        assertThat(lookup.find("hdpe").orElseThrow().name()).isEqualTo("hdpe");
        assertThat(lookup.find("unobtainium")).isEmpty();
        assertThat(lookup.find(null)).isEmpty();
        assertThat(lookup.entries()).extracting(MaterialRecord::key).containsExactly("steel-1018", "hdpe");
    }

    @Test
    void tableIsCopiedAtStartup() {
        MaterialLookup lookup = new ConfiguredMaterialLookup(properties);
        properties.getMaterials().clear();

        assertThat(lookup.find("steel-1018")).isPresent();
    }

    @Test
    void rigidityTableSkipsNonPositiveFactors() {
        RigidityLookup lookup = new ConfiguredRigidityLookup(properties);

        assertThat(lookup.require("hobby").factor()).isEqualTo(0.4);
        assertThat(lookup.find("broken")).isEmpty();
        assertThat(lookup.entries()).hasSize(1);
    }

    @Test
    void missingRigidityLevelIsAConfigError() {
        RigidityLookup lookup = new ConfiguredRigidityLookup(properties);

        assertThatThrownBy(() -> lookup.require("gantry"))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessage("Rigidity level 'gantry' is not configured");
    }

    @Test
    void coatingFactors() {
        CoatingLookup lookup = new CoatingLookup(properties);

        assertThat(lookup.speedFactor("altin")).isEqualTo(1.4);
        assertThat(lookup.speedFactor("bogus")).isEqualTo(1.0);
        assertThat(lookup.speedFactor("none-such")).isEqualTo(1.0);
        assertThat(lookup.speedFactor(null)).isEqualTo(1.0);
    }
}
