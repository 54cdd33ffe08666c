package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.service.engine.ArrayFaceGeometry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Minimal ASCII DXF (R12 entities only) of the array face, inches.
 * Layers: ENVELOPE for the outline, CHANNEL for the channel cut-outs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DxfGenerator {

    private final ArrayFaceGeometry faceGeometry;

    public String generateDxf(SolveResult result) {
        if (result == null) {
            log.warn("generateDxf(): result = null");
            return "";
        }

        ArrayFaceGeometry.Face face = faceGeometry.build(result);

        StringWriter sw = new StringWriter();
        PrintWriter out = new PrintWriter(sw);

        writeHeader(out);

        // DXF Y axis points up: flip the face so row 0 stays on top
        double h = face.getHeight();
        addRectangle(out, 0, 0, face.getWidth(), h, "ENVELOPE");

        for (ArrayFaceGeometry.Channel c : face.getChannels()) {
            double cy = h - c.getCy();
            if (c.isCircular()) {
                addCircle(out, c.getCx(), cy, c.getWidth() / 2.0, "CHANNEL");
            } else {
                addRectangle(out, c.getCx() - c.getWidth() / 2.0, cy - c.getHeight() / 2.0,
                        c.getWidth(), c.getHeight(), "CHANNEL");
            }
        }

        writeFooter(out);
        out.flush();

        log.debug("DXF: {} channels", face.getChannels().size());
        return sw.toString();
    }

    private void writeHeader(PrintWriter out) {
        out.println("0"); out.println("SECTION");
        out.println("2"); out.println("HEADER");
        out.println("9"); out.println("$INSUNITS");
        out.println("70"); out.println(1); // inches
        out.println("0"); out.println("ENDSEC");
        out.println("0"); out.println("SECTION");
        out.println("2"); out.println("ENTITIES");
    }

    private void writeFooter(PrintWriter out) {
        out.println("0"); out.println("ENDSEC");
        out.println("0"); out.println("EOF");
    }

    private void addLine(PrintWriter out, double x1, double y1, double x2, double y2, String layer) {
        out.println("0"); out.println("LINE");
        out.println("8"); out.println(layer);
        out.println("10"); out.println(x1);
        out.println("20"); out.println(y1);
        out.println("11"); out.println(x2);
        out.println("21"); out.println(y2);
    }

    private void addRectangle(PrintWriter out, double x, double y, double w, double h, String layer) {
        addLine(out, x, y, x + w, y, layer);
        addLine(out, x + w, y, x + w, y + h, layer);
        addLine(out, x + w, y + h, x, y + h, layer);
        addLine(out, x, y + h, x, y, layer);
    }

    private void addCircle(PrintWriter out, double cx, double cy, double r, String layer) {
        out.println("0"); out.println("CIRCLE");
        out.println("8"); out.println(layer);
        out.println("10"); out.println(cx);
        out.println("20"); out.println(cy);
        out.println("40"); out.println(r);
    }
}
