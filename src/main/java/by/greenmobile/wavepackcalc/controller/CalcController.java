package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.entity.ShapeVariant;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.entity.WeightUnit;
import by.greenmobile.wavepackcalc.exception.InvalidInputException;
import by.greenmobile.wavepackcalc.exception.WavepackException;
import by.greenmobile.wavepackcalc.service.SvgGeneratorService;
import by.greenmobile.wavepackcalc.service.WavepackFacade;
import by.greenmobile.wavepackcalc.service.compliance.ComplianceService;
import by.greenmobile.wavepackcalc.service.library.PropertyLibrary;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;

import java.util.Arrays;
import java.util.Map;

import static by.greenmobile.wavepackcalc.controller.PreviewController.SESSION_LAST_INPUT;
import static by.greenmobile.wavepackcalc.controller.PreviewController.SESSION_LAST_RESULT;

/**
 * Server-rendered calculator form.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class CalcController {

    /** Form property -> JSON field name, so form and API errors name the same field. */
    private static final Map<String, String> WIRE_NAMES = Map.of(
            "widthIn", "a_in",
            "heightIn", "b_in",
            "wallThicknessIn", "t_in",
            "lengthIn", "L_in",
            "velocityTargetFts", "vel_target_fts",
            "dpLimitPsi", "dp_limit_psi",
            "minTemperatureF", "T_min_F",
            "maxTemperatureF", "T_max_F",
            "weightUnit", "weight_unit");

    private final WavepackFacade wavepackFacade;
    private final SvgGeneratorService svgGeneratorService;
    private final ComplianceService complianceService;
    private final PropertyLibrary propertyLibrary;

    @GetMapping("/")
    public String index(Model model) {
        model.addAttribute("params", WavepackParameters.defaults());
        addChoices(model);
        return "index";
    }

    /**
     * Solve, keep the result in the session for preview/export and render result.html.
     * Validation errors go back to the form instead of the JSON error body.
     */
    @PostMapping("/manual")
    public String manual(@ModelAttribute("params") WavepackParameters params,
                         BindingResult binding,
                         Model model,
                         HttpSession session) {
        SolveResult result;
        try {
            requireBound(binding);
            result = wavepackFacade.solve(params);
        } catch (WavepackException e) {
            log.warn("Form solve rejected: kind={} field={} msg={}", e.getKind(), e.getField(), e.getMessage());
            model.addAttribute("error", e.getMessage());
            addChoices(model);
            return "index";
        }

        session.setAttribute(SESSION_LAST_RESULT, result);
        session.setAttribute(SESSION_LAST_INPUT, params);

        render(model, params, result);
        return "result";
    }

    /**
     * Lets "Back to results" and a direct visit to /result work without solving again.
     */
    @GetMapping("/result")
    public String result(Model model, HttpSession session) {
        SolveResult last = (SolveResult) session.getAttribute(SESSION_LAST_RESULT);
        WavepackParameters input = (WavepackParameters) session.getAttribute(SESSION_LAST_INPUT);
        if (last == null || input == null) {
            model.addAttribute("error", "No result yet. Run a calculation first.");
            return "result";
        }

        render(model, input, last);
        return "result";
    }

    private static void requireBound(BindingResult binding) {
        FieldError error = binding.getFieldError();
        if (error == null) {
            return;
        }
        String field = WIRE_NAMES.getOrDefault(error.getField(), error.getField());
        throw new InvalidInputException(field, error.getRejectedValue(),
                "Field '" + field + "' has an invalid value: '" + error.getRejectedValue() + "'");
    }

    private void render(Model model, WavepackParameters input, SolveResult result) {
        model.addAttribute("params", input);
        model.addAttribute("result", result);
        model.addAttribute("svg", svgGeneratorService.generateSvg(result));
        model.addAttribute("compliance", complianceService.evaluate(input, result));
    }

    private void addChoices(Model model) {
        model.addAttribute("materials", propertyLibrary.materialNames());
        model.addAttribute("fluids", propertyLibrary.fluidNames());
        model.addAttribute("shapes", Arrays.stream(ShapeVariant.values()).map(ShapeVariant::getLabel).toList());
        model.addAttribute("weightUnits", WeightUnit.values());
    }
}
