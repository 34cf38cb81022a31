package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.config.MachiningProperties;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Material table from {@code machining.materials.*}. Copied once at startup.
 */
@Component
@Slf4j
public class ConfiguredMaterialLookup implements MaterialLookup {

    private final Map<String, MaterialRecord> materials;

    public ConfiguredMaterialLookup(MachiningProperties properties) {
        Map<String, MaterialRecord> byKey = new LinkedHashMap<>();
        properties.getMaterials().forEach((key, m) -> byKey.put(key, new MaterialRecord(
                key,
                m.getName() != null ? m.getName() : key,
                m.getKc(),
                m.getSfm(),
                m.getSmm(),
                m.getChipLoad(),
                m.getMinRigidityFactor()
        )));
        this.materials = Collections.unmodifiableMap(byKey);
        log.info("Material table loaded: {} entries {}", materials.size(), materials.keySet());
    }

    @Override
    public Optional<MaterialRecord> find(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        return Optional.ofNullable(materials.get(key));
    }

    @Override
    public List<MaterialRecord> entries() {
        return new ArrayList<>(materials.values());
    }
}
