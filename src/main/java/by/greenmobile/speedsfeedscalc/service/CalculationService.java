package by.greenmobile.speedsfeedscalc.service;

import by.greenmobile.speedsfeedscalc.entity.CalculationRequest;
import by.greenmobile.speedsfeedscalc.entity.CalculationResult;
import by.greenmobile.speedsfeedscalc.entity.MachineLimits;
import by.greenmobile.speedsfeedscalc.entity.MachiningInputs;
import by.greenmobile.speedsfeedscalc.entity.MachiningOutputs;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.entity.RpmClassification;
import by.greenmobile.speedsfeedscalc.exception.InvalidInputException;
import by.greenmobile.speedsfeedscalc.service.engine.FeedsAndSpeeds;
import by.greenmobile.speedsfeedscalc.service.engine.FeedsAndSpeedsFactory;
import by.greenmobile.speedsfeedscalc.service.engine.Units;
import by.greenmobile.speedsfeedscalc.service.lookup.MaterialLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.RigidityLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for one calculation as the UI sees it:
 * - converts the operator's units to metric and fills material defaults
 * - runs a fresh engine, then the validator on its rpm/feed
 * - classifies the rpm against the machine limits
 *
 * Engine and validator exceptions are passed to the caller unchanged.
 */
@Service
@Slf4j
public class CalculationService {

    private final FeedsAndSpeedsFactory engineFactory;
    private final ParameterValidator validator;
    private final RpmStatusClassifier rpmClassifier;
    private final MaterialLookup materialLookup;
    private final RigidityLookup rigidityLookup;

    private final double defaultMinRpm;
    private final double defaultPreferredRpm;
    private final double defaultMaxRpm;

    public CalculationService(FeedsAndSpeedsFactory engineFactory,
                              ParameterValidator validator,
                              RpmStatusClassifier rpmClassifier,
                              MaterialLookup materialLookup,
                              RigidityLookup rigidityLookup,
                              @Value("${machining.machine.min-rpm:1000}") double defaultMinRpm,
                              @Value("${machining.machine.preferred-rpm:10000}") double defaultPreferredRpm,
                              @Value("${machining.machine.max-rpm:24000}") double defaultMaxRpm) {
        this.engineFactory = engineFactory;
        this.validator = validator;
        this.rpmClassifier = rpmClassifier;
        this.materialLookup = materialLookup;
        this.rigidityLookup = rigidityLookup;
        this.defaultMinRpm = defaultMinRpm;
        this.defaultPreferredRpm = defaultPreferredRpm;
        this.defaultMaxRpm = defaultMaxRpm;
    }

    public CalculationResult calculate(CalculationRequest request) {
        if (request == null) {
            throw InvalidInputException.missing("request");
        }

        log.info("Calculation request: {}", request);

        Optional<MaterialRecord> material = materialLookup.find(request.getMaterialKey());
        material.ifPresent(m -> applyMaterialDefaults(request, m));

        MachiningInputs inputs = toInputs(request);

        FeedsAndSpeeds fs = engineFactory.create();
        fs.setInputs(inputs);
        List<String> calculationWarnings = fs.calculate();
        MachiningOutputs out = fs.getOutputs();

        List<String> validationWarnings = validator.validate(out.getRpm(), out.getFeed(),
                inputs.getDoc(), inputs.getWoc(), inputs.getDiameter());

        List<String> allWarnings = new ArrayList<>(calculationWarnings.size() + validationWarnings.size());
        allWarnings.addAll(calculationWarnings);
        allWarnings.addAll(validationWarnings);

        MachineLimits limits = machineLimits(request);
        RpmClassification rpmStatus = rpmClassifier.classify(out.getRpm(),
                limits.minRpm(), limits.preferredRpm(), limits.maxRpm());

        Double spindleLoad = limits.spindlePowerKw() > 0
                ? 100.0 * out.getSpindlePowerKw() / limits.spindlePowerKw()
                : null;

        String rigidityName = rigidityLookup.find(inputs.getRigidityLevel())
                .map(RigidityLevel::name)
                .orElse(inputs.getRigidityLevel());

        log.info("Result: rpm={} ({} {}), feed={} mm/min, MRR={} cm3/min, P={} kW, warnings={} (engine {}, validator {})",
                Math.round(out.getRpm()), rpmStatus.status(), rpmStatus.message(),
                Math.round(out.getFeed()), out.getMaterialRemovalRateCm3(), out.getSpindlePowerKw(),
                allWarnings.size(), calculationWarnings.size(), validationWarnings.size());

        return CalculationResult.builder()
                .request(request)
                .inputs(inputs)
                .outputs(out)
                .warnings(List.copyOf(allWarnings))
                .rpmStatus(rpmStatus)
                .machineLimits(limits)
                .material(material.orElse(null))
                .rigidityName(rigidityName)
                .spindleLoadPercent(spindleLoad)
                .build();
    }

    /**
     * Fills kc, surface speed and chip load the operator left empty with the
     * material's values, in the request's unit system.
     */
    void applyMaterialDefaults(CalculationRequest request, MaterialRecord m) {
        boolean metric = request.isMetric();
        if (request.getKc() == null) {
            request.setKc(m.kc());
        }
        if (request.getSurfaceSpeed() == null) {
            request.setSurfaceSpeed(metric ? m.smm() : m.sfm());
        }
        if (request.getFeedPerTooth() == null) {
            request.setFeedPerTooth(metric ? m.chipLoadMm() : m.chipLoadMm() * Units.MM_TO_IN);
        }
        log.debug("Material defaults from '{}': kc={}, speed={}, chipLoad={}",
                m.key(), request.getKc(), request.getSurfaceSpeed(), request.getFeedPerTooth());
    }

    /**
     * Operator units -> metric engine inputs. Missing values stay null and are
     * reported by the engine.
     */
    MachiningInputs toInputs(CalculationRequest r) {
        boolean metric = r.isMetric();
        return MachiningInputs.builder()
                .diameter(length(r.getDiameter(), metric))
                .fluteNum(r.getFluteNum())
                .toolStickout(length(r.getToolStickout(), metric))
                .coating(r.getCoating())
                .doc(length(r.getDoc(), metric))
                .woc(length(r.getWoc(), metric))
                .smm(r.getSurfaceSpeed() == null ? null
                        : metric ? r.getSurfaceSpeed() : Units.sfmToSmm(r.getSurfaceSpeed()))
                .mmpt(length(r.getFeedPerTooth(), metric))
                .kc(r.getKc())
                .hsmEnabled(r.isHsmEnabled())
                .chipThinningEnabled(r.isChipThinningEnabled())
                .rigidityLevel(r.getRigidityLevel())
                .materialType(r.getMaterialKey())
                .spindlePowerKw(r.getSpindlePowerKw())
                .build();
    }

    MachineLimits machineLimits(CalculationRequest r) {
        return new MachineLimits(
                r.getMinRpm() != null ? r.getMinRpm() : defaultMinRpm,
                r.getPreferredRpm() != null ? r.getPreferredRpm() : defaultPreferredRpm,
                r.getMaxRpm() != null ? r.getMaxRpm() : defaultMaxRpm,
                r.getSpindlePowerKw() != null ? r.getSpindlePowerKw() : 0.0
        );
    }

    public RpmClassification classifyRpm(double rpm, MachineLimits limits) {
        return rpmClassifier.classify(rpm, limits.minRpm(), limits.preferredRpm(), limits.maxRpm());
    }

    private static Double length(Double value, boolean metric) {
        if (value == null) return null;
        return metric ? value : Units.inchToMm(value);
    }
}
