package by.greenmobile.speedsfeedscalc.service.lookup;

import by.greenmobile.speedsfeedscalc.config.MachiningProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Surface speed multiplier per tool coating from {@code machining.coatings.*}.
 */
@Component
@Slf4j
public class CoatingLookup {

    private final Map<String, Double> factors;

    @Autowired
    public CoatingLookup(MachiningProperties properties) {
        this(properties.getCoatings());
    }

    public CoatingLookup(Map<String, Double> factors) {
        this.factors = Collections.unmodifiableMap(new LinkedHashMap<>(factors));
    }

    /** 1.0 for no coating or an unknown one. */
    public double speedFactor(String coating) {
        if (coating == null || coating.isBlank()) return 1.0;
        Double f = factors.get(coating);
        if (f == null || f <= 0) {
            log.debug("Unknown coating '{}', speed factor 1.0", coating);
            return 1.0;
        }
        return f;
    }

    public Map<String, Double> entries() {
        return factors;
    }
}
