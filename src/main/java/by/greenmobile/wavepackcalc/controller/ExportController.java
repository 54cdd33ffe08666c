package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.entity.ReportRequest;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.service.DxfGenerator;
import by.greenmobile.wavepackcalc.service.SvgGeneratorService;
import by.greenmobile.wavepackcalc.service.report.PdfReportService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import static by.greenmobile.wavepackcalc.controller.PreviewController.SESSION_LAST_INPUT;
import static by.greenmobile.wavepackcalc.controller.PreviewController.SESSION_LAST_RESULT;

@Controller
@RequiredArgsConstructor
public class ExportController {

    private final SvgGeneratorService svgGeneratorService;
    private final DxfGenerator dxfGenerator;
    private final PdfReportService pdfReportService;

    @GetMapping("/export/svg")
    public ResponseEntity<byte[]> exportSvg(HttpSession session) {
        String svg = svgGeneratorService.generateSvg(getLast(session));

        return ResponseEntity.ok()
                .headers(fileHeaders("wavepack_face.svg"))
                .contentType(MediaType.valueOf("image/svg+xml"))
                .body(svg.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/export/dxf")
    public ResponseEntity<byte[]> exportDxf(HttpSession session) {
        String dxf = dxfGenerator.generateDxf(getLast(session));

        return ResponseEntity.ok()
                .headers(fileHeaders("wavepack_face.dxf"))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(dxf.getBytes(StandardCharsets.UTF_8));
    }

    /** Report of the last form solve; the schematic is drawn by the report itself. */
    @GetMapping("/export/pdf")
    public ResponseEntity<byte[]> exportPdf(HttpSession session) throws IOException {
        SolveResult r = getLast(session);
        WavepackParameters in = (WavepackParameters) session.getAttribute(SESSION_LAST_INPUT);

        byte[] pdf = pdfReportService.buildEngineeringReport(
                ReportRequest.builder().inputs(in).results(r).build());

        return ResponseEntity.ok()
                .headers(fileHeaders("wavepack_report.pdf"))
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    private SolveResult getLast(HttpSession session) {
        Object obj = session.getAttribute(SESSION_LAST_RESULT);
        if (obj instanceof SolveResult r) return r;
        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No result in the session. Run a calculation first.");
    }

    private HttpHeaders fileHeaders(String baseName) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String name = baseName.replace(".", "_" + ts + ".");

        HttpHeaders h = new HttpHeaders();
        h.setContentDisposition(ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build());
        h.setCacheControl("no-cache, no-store, must-revalidate");
        h.setPragma("no-cache");
        return h;
    }
}
