package by.greenmobile.wavepackcalc.service.report;

import by.greenmobile.wavepackcalc.entity.ReportRequest;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.service.WavepackFixtures;
import by.greenmobile.wavepackcalc.service.compliance.ComplianceService;
import by.greenmobile.wavepackcalc.service.engine.ArrayFaceGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class PdfReportServiceTest {

    private PdfReportService service;
    private WavepackParameters input;
    private SolveResult result;

    @BeforeEach
    void setUp() {
        service = new PdfReportService(new ComplianceService(1.0e9, 80.0), new ArrayFaceGeometry());
        ReflectionTestUtils.setField(service, "title", "Wavepack Analysis Report");
        ReflectionTestUtils.setField(service, "footer", "Generated by WavepackCalc");

        input = WavepackFixtures.reference();
        result = WavepackFixtures.facade().solve(input);
    }

    private static String text(byte[] pdf) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return new PDFTextStripper().getText(doc);
        }
    }

    @Test
    @DisplayName("Report carries the solved values, formatted but unchanged")
    void values() throws IOException {
        // Act
        byte[] pdf = service.buildEngineeringReport(ReportRequest.builder().inputs(input).results(result).build());
        String text = text(pdf);
        log.info("Report text:\n{}", text);

        // Assert
        assertTrue(text.contains("Wavepack Analysis Report"));
        assertTrue(text.contains("Stainless Steel"));
        assertTrue(text.contains("38 x 38 tubes"));
        assertTrue(text.contains("0.002 psi"));
        assertTrue(text.contains("776.3 lbm"));
        assertTrue(text.contains("6.439 GHz"));
        assertTrue(text.contains("217.5 dB"));
        assertTrue(text.contains("Compliance Checks"));
        assertTrue(text.contains("FAIL"));
        assertTrue(text.contains("Temperature sweep"));
    }

    @Test
    @DisplayName("PNG attachments are embedded, broken ones are skipped")
    void images() throws IOException {
        // Arrange
        BufferedImage img = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(img, "png", png);
        String dataUri = "data:image/png;base64," + Base64.getEncoder().encodeToString(png.toByteArray());

        ReportRequest req = ReportRequest.builder()
                .inputs(input)
                .results(result)
                .schematic("data:image/svg+xml;base64,PHN2Zz48L3N2Zz4=")
                .pressureChart(dataUri)
                .attenuationChart(Base64.getEncoder().encodeToString("not an image".getBytes()))
                .build();

        // Act
        byte[] pdf = service.buildEngineeringReport(req);

        // Assert
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            assertTrue(doc.getNumberOfPages() >= 3);
        }
        String text = text(pdf);
        assertTrue(text.contains("Pressure and Velocity vs. Temperature"));
        assertTrue(text.contains("(drawn)"));
    }

    @Test
    @DisplayName("Missing results are rejected")
    void noResults() {
        assertThrows(IllegalArgumentException.class,
                () -> service.buildEngineeringReport(ReportRequest.builder().inputs(input).build()));
    }

    @Test
    @DisplayName("data: prefix is stripped before decoding")
    void decode() {
        byte[] raw = {1, 2, 3, 4};
        String b64 = Base64.getEncoder().encodeToString(raw);

        assertArrayEquals(raw, PdfReportService.decodeImage(b64));
        assertArrayEquals(raw, PdfReportService.decodeImage("data:image/png;base64," + b64));
        assertNull(PdfReportService.decodeImage(""));
        assertNull(PdfReportService.decodeImage("%%%"));
    }

    @Test
    @DisplayName("Symbols outside WinAnsi are mapped or replaced")
    void sanitize() {
        assertEquals("~ 362.61 in", PdfReportService.sanitize("≈ 362.61 in"));
        assertEquals("dP <= 5", PdfReportService.sanitize("ΔP ≤ 5"));
        assertEquals("5 ?m", PdfReportService.sanitize("5 μm"));
        assertEquals("-", PdfReportService.sanitize(null));
        assertEquals("Stainless Steel", PdfReportService.sanitize("Stainless\rSteel"));
        assertEquals("a?b", PdfReportService.sanitize("a\u0081b"));
        assertEquals("a?b", PdfReportService.sanitize("a\u0007b"));
        assertEquals("100 \u20ac", PdfReportService.sanitize("100 \u20ac"));
    }

    @Test
    @DisplayName("Control and C1 characters in user text do not break the report")
    void controlCharactersInInputs() throws IOException {
        input.setMaterial("Stainless\rSteel\u0085");

        byte[] pdf = service.buildEngineeringReport(ReportRequest.builder().inputs(input).results(result).build());

        assertTrue(text(pdf).contains("Stainless Steel"));
    }

    @Test
    @DisplayName("Drawn schematic of a long array shows only the first 50 columns")
    void drawnSchematicCapped() throws IOException {
        SolveResult wide = result.toBuilder().arrayDims(List.of(1, 2500)).build();

        byte[] pdf = service.buildEngineeringReport(ReportRequest.builder().inputs(input).results(wide).build());

        assertTrue(text(pdf).contains("first 1 x 50 shown"));
    }
}
