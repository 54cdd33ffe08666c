package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.service.SvgGeneratorService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
@RequiredArgsConstructor
public class PreviewController {

    public static final String SESSION_LAST_RESULT = "LAST_RESULT";
    public static final String SESSION_LAST_INPUT = "LAST_INPUT";

    private final SvgGeneratorService svgGeneratorService;

    @GetMapping("/preview")
    public String preview(Model model, HttpSession session) {
        SolveResult r = (SolveResult) session.getAttribute(SESSION_LAST_RESULT);
        if (r == null) {
            model.addAttribute("error", "Nothing to preview. Run a calculation first.");
            return "preview";
        }

        model.addAttribute("result", r);
        model.addAttribute("svg", svgGeneratorService.generateSvg(r));
        return "preview";
    }
}
