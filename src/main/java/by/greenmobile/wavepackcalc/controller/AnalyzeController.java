package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.service.WavepackFacade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON entry point: one configuration in, one SolveResult out.
 * Errors are rendered by {@link GlobalExceptionHandler}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AnalyzeController {

    private final WavepackFacade wavepackFacade;

    @PostMapping("/analyze")
    public SolveResult analyze(@RequestBody(required = false) WavepackParameters params) {
        log.debug("HTTP /analyze: {}", params);
        return wavepackFacade.solve(params);
    }
}
