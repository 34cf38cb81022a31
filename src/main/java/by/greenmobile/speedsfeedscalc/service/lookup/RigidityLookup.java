package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.exception.InvalidConfigException;

import java.util.List;
import java.util.Optional;

/**
 * Read-only machine rigidity table.
 */
@FunctionalInterface
public interface RigidityLookup {

    Optional<RigidityLevel> find(String key);

    /**
     * Unlike materials, every calculation names a rigidity level, so a miss is a
     * configuration problem.
     */
    default RigidityLevel require(String key) {
        return find(key).orElseThrow(() -> new InvalidConfigException(key,
                "Rigidity level '" + key + "' is not configured"));
    }

    default List<RigidityLevel> entries() {
        return List.of();
    }
}
