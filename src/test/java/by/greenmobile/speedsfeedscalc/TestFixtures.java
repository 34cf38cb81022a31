package by.greenmobile.speedsfeedscalc;

import by.greenmobile.speedsfeedscalc.entity.MachiningInputs;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.service.CalculationService;
import by.greenmobile.speedsfeedscalc.service.ParameterValidator;
import by.greenmobile.speedsfeedscalc.service.RpmStatusClassifier;
import by.greenmobile.speedsfeedscalc.service.engine.ChipThinningModel;
import by.greenmobile.speedsfeedscalc.service.engine.CuttingPowerModel;
import by.greenmobile.speedsfeedscalc.service.engine.FeedsAndSpeeds;
import by.greenmobile.speedsfeedscalc.service.engine.FeedsAndSpeedsFactory;
import by.greenmobile.speedsfeedscalc.service.engine.MaterialAdvisor;
import by.greenmobile.speedsfeedscalc.service.engine.RigidityAdvisor;
import by.greenmobile.speedsfeedscalc.service.lookup.CoatingLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.MaterialLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.RigidityLookup;

import java.util.List;
import java.util.Map;

/**
 * Small stub tables and hand-wired components with the default coefficients.
 */
public final class TestFixtures {

    public static final RigidityLevel INDUSTRIAL = new RigidityLevel("industrial", "Industrial VMC", 1.0);
    public static final RigidityLevel HOBBY = new RigidityLevel("hobby", "Hobby router", 0.4);

    public static final MaterialRecord ALUMINUM =
            new MaterialRecord("aluminum", "Aluminum 6061-T6", 800, 1000, 305, 0.05, 0.0);
    public static final MaterialRecord TITANIUM =
            new MaterialRecord("titanium", "Titanium Ti-6Al-4V", 2200, 150, 46, 0.02, 1.0);

    private TestFixtures() {
    }

    public static RigidityLookup rigidityLookup() {
        List<RigidityLevel> levels = List.of(INDUSTRIAL, HOBBY);
        return key -> levels.stream().filter(l -> l.key().equals(key)).findFirst();
    }

    public static MaterialLookup materialLookup() {
        List<MaterialRecord> materials = List.of(ALUMINUM, TITANIUM);
        return key -> materials.stream().filter(m -> m.key().equals(key)).findFirst();
    }

    public static CoatingLookup coatingLookup() {
        return new CoatingLookup(Map.of("altin", 1.4, "tin", 1.15));
    }

    public static FeedsAndSpeedsFactory engineFactory() {
        return new FeedsAndSpeedsFactory(
                new ChipThinningModel(5.0),
                new CuttingPowerModel(0.8, 0.8),
                new RigidityAdvisor(rigidityLookup(), 1.0, 2.0, 1.0, 0.015, 4.0, 3.0),
                new MaterialAdvisor(materialLookup(), coatingLookup(), 0.25, 0.5, 0.5));
    }

    public static FeedsAndSpeeds engine() {
        return engineFactory().create();
    }

    public static ParameterValidator validator() {
        return new ParameterValidator(0.02, 0.95, 1.0, 3.0, 0.2, 25000, 60000);
    }

    public static CalculationService calculationService() {
        return new CalculationService(engineFactory(), validator(), new RpmStatusClassifier(),
                materialLookup(), rigidityLookup(), 1000, 10000, 24000);
    }

    /**
     * 10 mm, 3 flutes, half-diameter engagement on a rigid machine. Produces no warnings.
     */
    public static MachiningInputs baseline() {
        return MachiningInputs.builder()
                .diameter(10.0)
                .fluteNum(3)
                .doc(5.0)
                .woc(5.0)
                .smm(300.0)
                .mmpt(0.05)
                .kc(800.0)
                .rigidityLevel("industrial")
                .build();
    }
}
