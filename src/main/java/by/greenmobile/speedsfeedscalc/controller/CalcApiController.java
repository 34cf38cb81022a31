package by.greenmobile.speedsfeedscalc.controller;

import by.greenmobile.speedsfeedscalc.entity.CalculationRequest;
import by.greenmobile.speedsfeedscalc.entity.MachineLimits;
import by.greenmobile.speedsfeedscalc.entity.MaterialRecord;
import by.greenmobile.speedsfeedscalc.entity.RigidityLevel;
import by.greenmobile.speedsfeedscalc.entity.RpmClassification;
import by.greenmobile.speedsfeedscalc.exception.MachiningException;
import by.greenmobile.speedsfeedscalc.service.CalculationService;
import by.greenmobile.speedsfeedscalc.service.lookup.CoatingLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.MaterialLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.RigidityLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON access to the same calculation the HTML form uses.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CalcApiController {

    private final CalculationService calculationService;
    private final MaterialLookup materialLookup;
    private final RigidityLookup rigidityLookup;
    private final CoatingLookup coatingLookup;

    @PostMapping("/calculate")
    public ResponseEntity<?> calculate(@RequestBody CalculationRequest request) {
        try {
            return ResponseEntity.ok(calculationService.calculate(request));
        } catch (MachiningException e) {
            log.info("API /calculate rejected ({}): {}", e.getSubject(), e.getMessage());
            return ResponseEntity.badRequest().body(error(e));
        }
    }

    @GetMapping("/materials")
    public List<MaterialRecord> materials() {
        return materialLookup.entries();
    }

    @GetMapping("/rigidity-levels")
    public List<RigidityLevel> rigidityLevels() {
        return rigidityLookup.entries();
    }

    @GetMapping("/coatings")
    public Map<String, Double> coatings() {
        return coatingLookup.entries();
    }

    @GetMapping("/rpm-status")
    public RpmClassification rpmStatus(@RequestParam double rpm,
                                       @RequestParam double min,
                                       @RequestParam double preferred,
                                       @RequestParam double max) {
        return calculationService.classifyRpm(rpm, new MachineLimits(min, preferred, max, 0.0));
    }

    private static Map<String, Object> error(MachiningException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("type", e.getClass().getSimpleName());
        body.put("field", e.getSubject());
        return body;
    }
}
