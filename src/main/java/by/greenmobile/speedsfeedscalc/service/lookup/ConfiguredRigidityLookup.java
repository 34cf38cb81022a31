package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.config.MachiningProperties;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rigidity table from {@code machining.rigidity-levels.*}.
 */
@Component
@Slf4j
public class ConfiguredRigidityLookup implements RigidityLookup {

    private final Map<String, RigidityLevel> levels;

    public ConfiguredRigidityLookup(MachiningProperties properties) {
        Map<String, RigidityLevel> byKey = new LinkedHashMap<>();
        properties.getRigidityLevels().forEach((key, r) -> {
            if (r.getFactor() <= 0) {
                log.warn("Rigidity level '{}' has non-positive factor {}, ignored", key, r.getFactor());
                return;
            }
            byKey.put(key, new RigidityLevel(key, r.getName() != null ? r.getName() : key, r.getFactor()));
        });
        this.levels = Collections.unmodifiableMap(byKey);
        log.info("Rigidity table loaded: {}", levels.keySet());
    }

    @Override
    public Optional<RigidityLevel> find(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(levels.get(key));
    }

    @Override
    public List<RigidityLevel> entries() {
        return new ArrayList<>(levels.values());
    }
}
