package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.entity.ReportRequest;
import by.greenmobile.wavepackcalc.exception.InvalidInputException;
import by.greenmobile.wavepackcalc.service.engine.ArraySynthesizer;
import by.greenmobile.wavepackcalc.service.report.PdfReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

/**
 * Formats a PDF from values the client already has; nothing is solved here.
 */
@RestController
@RequiredArgsConstructor
public class ReportController {

    private final PdfReportService pdfReportService;

    @PostMapping("/report")
    public ResponseEntity<byte[]> report(@RequestBody(required = false) ReportRequest req) throws IOException {
        if (req == null || req.getResults() == null) {
            throw new InvalidInputException("results", null, "Report request needs 'results'");
        }
        requireArrayDims(req.getResults().getArrayDims());

        byte[] pdf = pdfReportService.buildEngineeringReport(req);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"wavepack_report.pdf\"")
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    private static void requireArrayDims(List<Integer> dims) {
        if (dims == null || dims.size() != 2 || dims.get(0) == null || dims.get(1) == null) {
            throw new InvalidInputException("array_dims", dims, "Report results need 'array_dims' as [rows, columns]");
        }
        int rows = dims.get(0);
        int cols = dims.get(1);
        if (rows < 1 || cols < 1 || (long) rows * cols > ArraySynthesizer.HARD_CHANNEL_CAP) {
            throw new InvalidInputException("array_dims", dims,
                    "'array_dims' must be positive with at most " + ArraySynthesizer.HARD_CHANNEL_CAP + " channels");
        }
    }
}
