package by.greenmobile.speedsfeedscalc.controller;

import by.greenmobile.speedsfeedscalc.entity.CalculationRequest;
import by.greenmobile.speedsfeedscalc.entity.CalculationResult;
import by.greenmobile.speedsfeedscalc.entity.UnitSystem;
import by.greenmobile.speedsfeedscalc.exception.MachiningException;
import by.greenmobile.speedsfeedscalc.service.CalculationService;
import by.greenmobile.speedsfeedscalc.service.lookup.CoatingLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.MaterialLookup;
import by.greenmobile.speedsfeedscalc.service.lookup.RigidityLookup;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;

@Controller
@Slf4j
public class CalcController {

    public static final String SESSION_LAST_RESULT = "LAST_RESULT";

    private final CalculationService calculationService;
    private final MaterialLookup materialLookup;
    private final RigidityLookup rigidityLookup;
    private final CoatingLookup coatingLookup;
    private final int maxDisplayedWarnings;

    public CalcController(CalculationService calculationService,
                          MaterialLookup materialLookup,
                          RigidityLookup rigidityLookup,
                          CoatingLookup coatingLookup,
                          @Value("${machining.display.max-warnings:3}") int maxDisplayedWarnings) {
        this.calculationService = calculationService;
        this.materialLookup = materialLookup;
        this.rigidityLookup = rigidityLookup;
        this.coatingLookup = coatingLookup;
        this.maxDisplayedWarnings = maxDisplayedWarnings;
    }

    @GetMapping("/")
    public String index(Model model) {
        CalculationRequest request = new CalculationRequest();
        request.setUnitSystem(UnitSystem.METRIC);
        request.setDiameter(6.0);
        request.setFluteNum(3);
        request.setDoc(6.0);
        request.setWoc(1.2);
        request.setToolStickout(20.0);
        request.setMaterialKey("aluminum-6061");
        request.setRigidityLevel("prosumer");
        request.setHsmEnabled(true);
        request.setChipThinningEnabled(true);
        request.setMinRpm(6000.0);
        request.setPreferredRpm(18000.0);
        request.setMaxRpm(24000.0);
        request.setSpindlePowerKw(2.2);

        model.addAttribute("form", request);
        addLookups(model);
        return "index";
    }

    /**
     * Calculates, keeps the result in the session for /result and the PDF export.
     * Invalid input goes back to the form with the message.
     */
    @PostMapping("/calculate")
    public String calculate(@ModelAttribute("form") CalculationRequest request,
                            Model model,
                            HttpSession session) {
        CalculationResult result;
        try {
            result = calculationService.calculate(request);
        } catch (MachiningException e) {
            log.info("Rejected input ({}): {}", e.getSubject(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            addLookups(model);
            return "index";
        }

        session.setAttribute(SESSION_LAST_RESULT, result);

        model.addAttribute("result", result);
        model.addAttribute("maxWarnings", maxDisplayedWarnings);
        return "result";
    }

    @GetMapping("/result")
    public String result(Model model, HttpSession session) {
        CalculationResult last = (CalculationResult) session.getAttribute(SESSION_LAST_RESULT);
        if (last == null) {
            model.addAttribute("error", "No previous result. Run a calculation first.");
            return "result";
        }

        model.addAttribute("result", last);
        model.addAttribute("maxWarnings", maxDisplayedWarnings);
        return "result";
    }

    private void addLookups(Model model) {
        model.addAttribute("materials", materialLookup.entries());
        model.addAttribute("rigidityLevels", rigidityLookup.entries());
        model.addAttribute("coatings", coatingLookup.entries().keySet());
        model.addAttribute("unitSystems", UnitSystem.values());
    }
}
