package by.greenmobile.wavepackcalc.service.report;

import by.greenmobile.wavepackcalc.entity.ComplianceResult;
import by.greenmobile.wavepackcalc.entity.ReportRequest;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.TemperaturePoint;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.service.compliance.ComplianceService;
import by.greenmobile.wavepackcalc.service.engine.ArrayFaceGeometry;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.font.encoding.GlyphList;
import org.apache.pdfbox.pdmodel.font.encoding.WinAnsiEncoding;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Engineering PDF report of one solve.
 *
 * Only formats: every number comes from the SolveResult / inputs as they are.
 * Client-rendered images (PNG/JPEG, base64) are embedded when decodable; the schematic slot
 * falls back to a vector drawing of the array face.
 */
@Service
@Slf4j
public class PdfReportService {

    private static final float M = 54f;
    private static final float W = PDRectangle.LETTER.getWidth();
    private static final float H = PDRectangle.LETTER.getHeight();
    private static final float MAX_WIDTH = W - 2 * M;
    private static final float TOP = H - 100;

    private static final float IMAGE_W = 432f; // 6 in
    private static final float IMAGE_H = 252f; // 3.5 in
    private static final int MAX_DRAWN_PER_SIDE = 50;

    private final PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font fontBold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private final PDType1Font fontItalic = new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE);

    private final ComplianceService complianceService;
    private final ArrayFaceGeometry faceGeometry;

    @Value("${report.title:Wavepack Analysis Report}")
    private String title;

    @Value("${report.footer:Generated by WavepackCalc}")
    private String footer;

    public PdfReportService(ComplianceService complianceService, ArrayFaceGeometry faceGeometry) {
        this.complianceService = complianceService;
        this.faceGeometry = faceGeometry;
    }

    public byte[] buildEngineeringReport(ReportRequest req) throws IOException {
        WavepackParameters in = req.getInputs() != null ? req.getInputs() : new WavepackParameters();
        SolveResult r = req.getResults();
        if (r == null) {
            throw new IllegalArgumentException("Report needs solver results");
        }

        try (PDDocument doc = new PDDocument()) {
            Cursor c = new Cursor(doc);

            writeHeader(c, safeTitle());
            writeInputs(c, in);
            writeResults(c, r);
            writeShielding(c, r);

            c.newPage();
            writeHeader(c, "Schematic and charts");
            writeSchematic(c, doc, req.getSchematic(), r);
            writeImage(c, doc, req.getPressureChart(), "Pressure and Velocity vs. Temperature");
            writeImage(c, doc, req.getAttenuationChart(), "Attenuation vs. Frequency");

            c.newPage();
            writeHeader(c, "Temperature sweep");
            writeTemperatureSweep(c, r);

            writeCompliance(c, complianceService.evaluate(in, r));
            writeNotes(c);
            writeFooter(c);

            // close the stream before saving
            c.close();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            log.info("PDF report: {} pages, {} bytes", doc.getNumberOfPages(), out.size());
            return out.toByteArray();
        }
    }

    private void writeInputs(Cursor c, WavepackParameters in) throws IOException {
        float y = c.y;

        y = kv(c, y, "Date", LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
        y = kv(c, y, "Material", safe(in.getMaterial()));
        y = kv(c, y, "Fluid", safe(in.getFluid()));
        y = kv(c, y, "Shape", safe(in.getShape()));
        y = kv(c, y, "Temperature Range", fmt(in.getMinTemperatureF(), 1) + " - " + fmt(in.getMaxTemperatureF(), 1) + " deg F");
        y = kv(c, y, "Velocity Target", fmt(in.getVelocityTargetFts(), 2) + " ft/s");
        y = kv(c, y, "dP Limit", fmt(in.getDpLimitPsi(), 3) + " psi");

        c.y = y - 8;
    }

    private void writeResults(Cursor c, SolveResult r) throws IOException {
        float y = c.y;

        y = h2(c, y, "Results");
        y = kv(c, y, "Array Size", r.getRows() + " x " + r.getColumns() + " tubes");
        y = kv(c, y, "Channel", fmt(r.getWidthIn(), 3) + " x " + fmt(r.getHeightIn(), 3) + " in, wall " + fmt(r.getWallThicknessIn(), 3) + " in");
        y = kv(c, y, "Overall Dimensions", fmt(r.getEnvelopeWidthIn(), 2) + " x " + fmt(r.getEnvelopeHeightIn(), 2) + " in x " + fmt(r.getLengthFt(), 2) + " ft");
        y = kv(c, y, "Flow Velocity", fmt(r.getVelocityFts(), 2) + " ft/s");
        y = kv(c, y, "dP", fmt(r.getDeltaPPsi(), 3) + " psi");
        y = kv(c, y, "Weight", fmt(r.getTotalWeightLbm(), 1) + " lbm");
        y = kv(c, y, "Cutoff Frequency", fmt(r.getCutoffGhz(), 3) + " GHz");

        y -= 6;
        y = h2(c, y, "Flow");
        y = kv(c, y, "Reynolds number", fmt(r.getReynolds(), 0) + " (" + safe(r.getFlowRegime()) + ")");
        y = kv(c, y, "Friction factor", fmt(r.getFrictionFactor(), 5));
        y = kv(c, y, "Hydraulic diameter", fmt(r.getHydraulicDiameterIn(), 4) + " in");
        y = kv(c, y, "Open-area ratio", fmt(r.getOpenAreaRatio(), 4));
        y = kv(c, y, "Mean density / viscosity", sci(r.getMeanDensity()) + " kg/m3 / " + sci(r.getMeanViscosity()) + " Pa s");
        y = kv(c, y, "Channels required / provisioned", r.getChannelsRequired() + " / " + r.getChannelsProvisioned());
        if (r.getChannelShortfall() > 0) {
            y = paragraph(c, y, "Square layout leaves " + r.getChannelShortfall()
                    + " required channels unprovisioned: the array is under-sized for the flow budget.");
        }

        c.y = y - 8;
    }

    private void writeShielding(Cursor c, SolveResult r) throws IOException {
        float y = c.y;

        y = h2(c, y, "Shielding effectiveness");
        List<Double> f = r.getFrequencies();
        List<Double> se = r.getShieldingDb();
        int n = Math.min(f == null ? 0 : f.size(), se == null ? 0 : se.size());
        for (int i = 0; i < n; i++) {
            y = kv(c, y, sci(f.get(i)) + " Hz", fmt(se.get(i), 1) + " dB");
        }

        c.y = y;
    }

    private void writeSchematic(Cursor c, PDDocument doc, String b64, SolveResult r) throws IOException {
        if (embed(c, doc, b64, "Isometric Schematic of Wavepack")) {
            return;
        }

        // vector fallback
        ArrayFaceGeometry.Face face = faceGeometry.build(r, MAX_DRAWN_PER_SIDE);
        float y = c.ensureSpace(c.y, IMAGE_H + 30);
        float scale = (float) Math.min(IMAGE_W / face.getWidth(), IMAGE_H / face.getHeight());
        float ox = M;
        float oy = y - IMAGE_H;

        c.cs.setStrokingColor(Color.DARK_GRAY);
        c.cs.setLineWidth(1f);
        c.cs.addRect(ox, y - (float) face.getHeight() * scale, (float) face.getWidth() * scale, (float) face.getHeight() * scale);
        c.cs.stroke();

        c.cs.setLineWidth(0.3f);
        for (ArrayFaceGeometry.Channel ch : face.getChannels()) {
            float cx = ox + (float) ch.getCx() * scale;
            float cy = y - (float) ch.getCy() * scale;
            float w = (float) ch.getWidth() * scale;
            float h = (float) ch.getHeight() * scale;
            if (ch.isCircular()) {
                circle(c.cs, cx, cy, w / 2f);
            } else {
                c.cs.addRect(cx - w / 2f, cy - h / 2f, w, h);
            }
        }
        c.cs.stroke();

        y = oy - 14;
        String caption = "Array face, " + r.getRows() + " x " + r.getColumns() + " (drawn)";
        if (r.getRows() > MAX_DRAWN_PER_SIDE || r.getColumns() > MAX_DRAWN_PER_SIDE) {
            caption += ", first " + Math.min(r.getRows(), MAX_DRAWN_PER_SIDE) + " x "
                    + Math.min(r.getColumns(), MAX_DRAWN_PER_SIDE) + " shown";
        }
        text(c, fontItalic, 10, M, y, caption);
        c.y = y - 20;
    }

    private void writeImage(Cursor c, PDDocument doc, String b64, String caption) throws IOException {
        if (!embed(c, doc, b64, caption)) {
            log.debug("Report: no image for '{}'", caption);
        }
    }

    /**
     * @return false when there was nothing usable to embed
     */
    private boolean embed(Cursor c, PDDocument doc, String b64, String caption) throws IOException {
        byte[] bytes = decodeImage(b64);
        if (bytes == null) return false;

        PDImageXObject img;
        try {
            img = PDImageXObject.createFromByteArray(doc, bytes, caption);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Report: attachment '{}' is not a PNG/JPEG image, skipped ({})", caption, e.getMessage());
            return false;
        }

        float scale = Math.min(IMAGE_W / img.getWidth(), IMAGE_H / img.getHeight());
        float w = img.getWidth() * scale;
        float h = img.getHeight() * scale;

        float y = c.ensureSpace(c.y, h + 30);
        c.cs.drawImage(img, M, y - h, w, h);
        y = y - h - 14;
        text(c, fontItalic, 10, M, y, caption);
        c.y = y - 20;
        return true;
    }

    static byte[] decodeImage(String b64) {
        if (b64 == null || b64.isBlank()) return null;
        if (b64.startsWith("data:image/svg")) {
            log.warn("Report: SVG attachments cannot be embedded, using drawn schematic");
            return null;
        }
        String payload = b64.substring(b64.lastIndexOf(',') + 1).trim();
        try {
            // the MIME decoder skips characters outside the alphabet, so garbage decodes to nothing
            byte[] bytes = Base64.getMimeDecoder().decode(payload);
            return bytes.length == 0 ? null : bytes;
        } catch (IllegalArgumentException e) {
            log.warn("Report: attachment is not valid base64 ({})", e.getMessage());
            return null;
        }
    }

    private void writeTemperatureSweep(Cursor c, SolveResult r) throws IOException {
        float y = c.y;
        List<TemperaturePoint> pts = r.getTemperatureSweep();
        if (pts == null || pts.isEmpty()) {
            y = paragraph(c, y, "No temperature sweep in the results.");
            c.y = y;
            return;
        }

        float[] cols = {M, M + 90, M + 200, M + 320, M + 410};
        y = c.ensureSpace(y, 20);
        text(c, fontBold, 10, cols[0], y, "T (deg F)");
        text(c, fontBold, 10, cols[1], y, "rho (kg/m3)");
        text(c, fontBold, 10, cols[2], y, "mu (Pa s)");
        text(c, fontBold, 10, cols[3], y, "Re");
        text(c, fontBold, 10, cols[4], y, "dP (psi)");
        y -= 14;

        for (TemperaturePoint p : pts) {
            y = c.ensureSpace(y, 14);
            text(c, font, 10, cols[0], y, fmt(p.getTemperatureF(), 1));
            text(c, font, 10, cols[1], y, fmt(p.getDensity(), 4));
            text(c, font, 10, cols[2], y, sci(p.getViscosity()));
            text(c, font, 10, cols[3], y, fmt(p.getReynolds(), 0));
            text(c, font, 10, cols[4], y, fmt(p.getPressureDropPsi(), 5));
            y -= 14;
        }

        c.y = y - 10;
    }

    private void writeCompliance(Cursor c, ComplianceResult cr) throws IOException {
        float y = c.y;

        y = h2(c, y, "Compliance Checks");
        y = kv(c, y, "Flow dP Limit",
                fmt(cr.getPressureDropPsi(), 3) + " psi " + (cr.isPressureDropMet() ? "<=" : ">") + " "
                        + fmt(cr.getPressureDropLimitPsi(), 3) + " psi (" + (cr.isPressureDropMet() ? "PASS" : "FAIL") + ")");
        y = kv(c, y, "EMI Attenuation at " + sci(cr.getShieldingFrequencyHz()) + " Hz",
                fmt(cr.getShieldingDb(), 1) + " dB vs >= " + fmt(cr.getShieldingRequirementDb(), 1)
                        + " dB (" + (cr.isShieldingMet() ? "PASS" : "FAIL") + ")");
        if (!cr.getRecommendation().isEmpty()) {
            y = paragraph(c, y, cr.getRecommendation());
        }

        c.y = y - 8;
    }

    private void writeNotes(Cursor c) throws IOException {
        float y = c.y;

        y = h2(c, y, "Notes");
        y = paragraph(c, y,
                "1) Tube count comes from a sizing heuristic (10% back-pressure margin on the dP budget), "
                        + "not from a flow balance. All channels are assumed to carry identical flow.");
        y = paragraph(c, y,
                "2) Fluid properties are averaged over the temperature range; the table above shows the "
                        + "channel dP at each sampled temperature for the same velocity.");
        y = paragraph(c, y,
                "3) Below cutoff the attenuation constant is floored at 1 1/m; SE values there are nominal.");

        c.y = y;
    }

    private void writeFooter(Cursor c) throws IOException {
        float y = c.ensureSpace(c.y - 10, 20);
        text(c, font, 8, M, y, sanitize(footer));
        c.y = y - 12;
    }

    // ===== Drawing helpers =====

    private void writeHeader(Cursor c, String t) throws IOException {
        float y = H - 64;
        text(c, fontBold, 18, M, y, t);
        c.y = TOP;
    }

    private float h2(Cursor c, float y, String t) throws IOException {
        y = c.ensureSpace(y, 28);
        text(c, fontBold, 13, M, y, t);
        return y - 18;
    }

    private float kv(Cursor c, float y, String key, String value) throws IOException {
        y = c.ensureSpace(y, 18);
        text(c, font, 11, M, y, key + ":");
        text(c, fontBold, 11, M + 220, y, value);
        return y - 16;
    }

    private float paragraph(Cursor c, float y, String text) throws IOException {
        return wrappedText(c, y, sanitize(text), font, 11, 16);
    }

    private float wrappedText(Cursor c, float y, String text, PDType1Font f, int size, float leading) throws IOException {
        y = c.ensureSpace(y, leading + 6);

        String[] words = text.split("\\s+");
        StringBuilder line = new StringBuilder();

        for (String word : words) {
            String test = (line.length() == 0) ? word : (line + " " + word);
            float tw = f.getStringWidth(test) / 1000f * size;

            if (tw > MAX_WIDTH && line.length() > 0) {
                y = c.ensureSpace(y, leading);
                text(c, f, size, M, y, line.toString());
                y -= leading;
                line = new StringBuilder(word);
            } else {
                if (line.length() > 0) line.append(" ");
                line.append(word);
            }
        }

        if (line.length() > 0) {
            y = c.ensureSpace(y, leading);
            text(c, f, size, M, y, line.toString());
            y -= leading;
        }

        return y - 4;
    }

    private void text(Cursor c, PDType1Font f, int size, float x, float y, String t) throws IOException {
        c.cs.beginText();
        c.cs.setFont(f, size);
        c.cs.newLineAtOffset(x, y);
        c.cs.showText(sanitize(t));
        c.cs.endText();
    }

    /** Four Bézier arcs; k = 0.5523 is the usual quarter-circle constant. */
    private static void circle(PDPageContentStream cs, float cx, float cy, float r) throws IOException {
        float k = 0.5523f * r;
        cs.moveTo(cx + r, cy);
        cs.curveTo(cx + r, cy + k, cx + k, cy + r, cx, cy + r);
        cs.curveTo(cx - k, cy + r, cx - r, cy + k, cx - r, cy);
        cs.curveTo(cx - r, cy - k, cx - k, cy - r, cx, cy - r);
        cs.curveTo(cx + k, cy - r, cx + r, cy - k, cx + r, cy);
        cs.closePath();
    }

    // ===== Formatting =====

    private String safeTitle() {
        return sanitize(title);
    }

    /**
     * Standard 14 fonts only cover WinAnsi: map the few symbols we use, replace the rest with '?'.
     */
    static String sanitize(String s) {
        if (s == null) return "-";
        StringBuilder sb = new StringBuilder(s.length());
        for (char ch : s.toCharArray()) {
            switch (ch) {
                case '≈': sb.append('~'); break;
                case '≤': sb.append("<="); break;
                case '≥': sb.append(">="); break;
                case 'Δ': sb.append("d"); break;
                case '–':
                case '—': sb.append('-'); break;
                case '\r':
                case '\n':
                case '\t': sb.append(' '); break;
                default:
                    sb.append(isWinAnsi(ch) ? ch : '?');
            }
        }
        return sb.toString();
    }

    private static boolean isWinAnsi(char ch) {
        if (Character.isISOControl(ch)) {
            return false;
        }
        return WinAnsiEncoding.INSTANCE.contains(GlyphList.getAdobeGlyphList().codePointToName(ch));
    }

    private static String safe(String v) {
        return v == null || v.isBlank() ? "-" : v;
    }

    private static String fmt(Double v, int decimals) {
        if (v == null) return "-";
        return fmt(v.doubleValue(), decimals);
    }

    private static String fmt(double v, int decimals) {
        return String.format(Locale.US, "%." + decimals + "f", v);
    }

    private static String sci(double v) {
        return String.format(Locale.US, "%.3e", v);
    }

    // ===== Cursor / pagination =====

    private static class Cursor {
        final PDDocument doc;
        PDPage page;
        PDPageContentStream cs;
        float y;

        Cursor(PDDocument doc) throws IOException {
            this.doc = doc;
            newPage();
        }

        void newPage() throws IOException {
            if (cs != null) cs.close();
            page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            cs = new PDPageContentStream(doc, page);
            y = TOP;
        }

        void close() throws IOException {
            if (cs != null) {
                cs.close();
                cs = null;
            }
        }

        float ensureSpace(float currentY, float needed) throws IOException {
            if (currentY - needed < M) {
                newPage();
                return TOP;
            }
            return currentY;
        }
    }
}
