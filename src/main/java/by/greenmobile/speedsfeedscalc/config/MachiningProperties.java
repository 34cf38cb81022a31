package by.greenmobile.speedsfeedscalc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup tables for the calculator ({@code machining.*}).
 *
 * Model coefficients and validation thresholds are not here: they are read
 * with {@code @Value} directly by the components that use them.
 */
@Data
@ConfigurationProperties(prefix = "machining")
public class MachiningProperties {

    /** Workpiece materials by key (e.g. {@code aluminum-6061}). */
    private Map<String, Material> materials = new LinkedHashMap<>();

    /** Machine rigidity categories by key (e.g. {@code hobby}). */
    private Map<String, Rigidity> rigidityLevels = new LinkedHashMap<>();

    /** Surface speed multiplier per tool coating, 1.0 = uncoated carbide. */
    private Map<String, Double> coatings = new LinkedHashMap<>();

    @Data
    public static class Material {
        private String name;

        /** Specific cutting force, N/mm². */
        private double kc;

        /** Recommended surface speed, ft/min. */
        private double sfm;

        /** Recommended surface speed, m/min. */
        private double smm;

        /** Recommended chip load, mm/tooth. */
        private double chipLoad;

        /** Lowest rigidity factor on which the material cuts comfortably. 0 = any machine. */
        private double minRigidityFactor;
    }

    @Data
    public static class Rigidity {
        private String name;
        private double factor = 1.0;
    }
}
