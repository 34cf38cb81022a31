package by.greenmobile.speedsfeedscalc.service.engine;

import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.service.lookup.CoatingLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.MaterialLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares a cut with the recommended envelope of the workpiece material.
 *
 * Surface speed is allowed ±speedTolerance around the material's SMM scaled by
 * the coating factor, chip load ±chipLoadTolerance around the material's chip load.
 */
@Component
@Slf4j
public class MaterialAdvisor {

    private final MaterialLookup materialLookup;
    private final CoatingLookup coatingLookup;

    private final double speedTolerance;
    private final double chipLoadTolerance;
    private final double kcTolerance;

    public MaterialAdvisor(MaterialLookup materialLookup,
                           CoatingLookup coatingLookup,
                           @Value("${machining.material.speed-tolerance:0.25}") double speedTolerance,
                           @Value("${machining.material.chip-load-tolerance:0.5}") double chipLoadTolerance,
                           @Value("${machining.material.kc-tolerance:0.5}") double kcTolerance) {
        this.materialLookup = materialLookup;
        this.coatingLookup = coatingLookup;
        this.speedTolerance = speedTolerance;
        this.chipLoadTolerance = chipLoadTolerance;
        this.kcTolerance = kcTolerance;
    }

    public Optional<MaterialRecord> resolve(String materialType) {
        if (materialType == null || materialType.isBlank()) return Optional.empty();
        Optional<MaterialRecord> m = materialLookup.find(materialType);
        if (m.isEmpty()) {
            log.debug("Material '{}' not in table, material checks skipped", materialType);
        }
        return m;
    }

    /** Recommended surface speed for the material with the given coating, m/min. */
    public double recommendedSmm(MaterialRecord material, String coating) {
        return material.smm() * coatingLookup.speedFactor(coating);
    }

    /**
     * @param chipThickness actual maximum chip thickness, mm (feed per tooth after
     *                      compensation times the radial thinning factor)
     * @param rigidity resolved rigidity level, null when it could not be resolved
     */
    public List<String> check(MaterialRecord material, String coating, double smm, double chipThickness,
                              double kc, RigidityLevel rigidity) {
        List<String> warnings = new ArrayList<>();
        String name = material.name();

        double recSmm = recommendedSmm(material, coating);
        if (recSmm > 0) {
            if (smm > recSmm * (1.0 + speedTolerance)) {
                warnings.add(String.format(Locale.US,
                        "Surface speed %.0f m/min is above the recommended %.0f m/min for %s; expect rapid tool wear",
                        smm, recSmm, name));
            } else if (smm < recSmm * (1.0 - speedTolerance)) {
                warnings.add(String.format(Locale.US,
                        "Surface speed %.0f m/min is below the recommended %.0f m/min for %s; risk of built-up edge",
                        smm, recSmm, name));
            }
        }

        double recChip = material.chipLoadMm();
        if (recChip > 0) {
            if (chipThickness > recChip * (1.0 + chipLoadTolerance)) {
                warnings.add(String.format(Locale.US,
                        "Chip load %.4f mm is high for %s (recommended %.4f mm); risk of tool breakage",
                        chipThickness, name, recChip));
            } else if (chipThickness < recChip * (1.0 - chipLoadTolerance)) {
                warnings.add(String.format(Locale.US,
                        "Chip load %.4f mm is low for %s (recommended %.4f mm); tool will rub and work harden",
                        chipThickness, name, recChip));
            }
        }

        if (material.kc() > 0 && Math.abs(kc - material.kc()) > material.kc() * kcTolerance) {
            warnings.add(String.format(Locale.US,
                    "Specific cutting force %.0f N/mm2 differs from the typical %.0f N/mm2 for %s; power estimate may be off",
                    kc, material.kc(), name));
        }

        if (rigidity != null && material.minRigidityFactor() > rigidity.factor()) {
            warnings.add(String.format(Locale.US,
                    "%s is demanding for a %s machine; use light depth and width of cut",
                    name, rigidity.name()));
        }
        return warnings;
    }
}
