package by.greenmobile.speedsfeedscalc.service.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out fresh engine instances wired to the shared, stateless models.
 */
@Component
@RequiredArgsConstructor
public class FeedsAndSpeedsFactory {

    private final ChipThinningModel chipThinningModel;
    private final CuttingPowerModel cuttingPowerModel;
    private final RigidityAdvisor rigidityAdvisor;
    private final MaterialAdvisor materialAdvisor;

    public FeedsAndSpeeds create() {
        return new FeedsAndSpeeds(chipThinningModel, cuttingPowerModel, rigidityAdvisor, materialAdvisor);
    }
}
