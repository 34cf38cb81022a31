package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only material table.
 */
@FunctionalInterface
public interface MaterialLookup {

    /** Empty when the key is null or unknown; the caller then treats the material as absent. */
    Optional<MaterialRecord> find(String key);

    /** All rows in display order. Stub tables used in tests may leave this empty. */
    default List<MaterialRecord> entries() {
        return List.of();
    }
}
