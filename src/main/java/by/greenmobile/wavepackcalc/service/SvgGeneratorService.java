package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.service.engine.ArrayFaceGeometry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * SVG schematic of the array face:
 * - envelope outline;
 * - one rectangle or circle per provisioned channel.
 * User units are inches.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SvgGeneratorService {

    private final ArrayFaceGeometry faceGeometry;

    public String generateSvg(SolveResult result) {
        if (result == null) {
            log.warn("generateSvg(): result = null");
            return "";
        }

        ArrayFaceGeometry.Face face = faceGeometry.build(result);
        double w = face.getWidth();
        double h = face.getHeight();
        double padding = Math.max(w, h) * 0.05;
        double stroke = Math.max(w, h) / 400.0;

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" ")
                .append("width=\"").append(n(w + 2 * padding)).append("in\" ")
                .append("height=\"").append(n(h + 2 * padding)).append("in\" ")
                .append("viewBox=\"")
                .append(n(-padding)).append(" ")
                .append(n(-padding)).append(" ")
                .append(n(w + 2 * padding)).append(" ")
                .append(n(h + 2 * padding)).append("\">\n");

        // background
        svg.append("  <rect x=\"").append(n(-padding)).append("\" y=\"").append(n(-padding))
                .append("\" width=\"").append(n(w + 2 * padding))
                .append("\" height=\"").append(n(h + 2 * padding))
                .append("\" fill=\"#0f1722\" />\n");

        // envelope
        svg.append("  <rect x=\"0\" y=\"0\" width=\"").append(n(w))
                .append("\" height=\"").append(n(h))
                .append("\" fill=\"#8a96a3\" stroke=\"#e6edf3\" stroke-width=\"").append(n(stroke * 2))
                .append("\" />\n");

        svg.append("  <g fill=\"#0f1722\" stroke=\"#39d0ff\" stroke-width=\"").append(n(stroke)).append("\">\n");
        for (ArrayFaceGeometry.Channel c : face.getChannels()) {
            if (c.isCircular()) {
                svg.append("    <circle cx=\"").append(n(c.getCx()))
                        .append("\" cy=\"").append(n(c.getCy()))
                        .append("\" r=\"").append(n(c.getWidth() / 2.0)).append("\" />\n");
            } else {
                svg.append("    <rect x=\"").append(n(c.getCx() - c.getWidth() / 2.0))
                        .append("\" y=\"").append(n(c.getCy() - c.getHeight() / 2.0))
                        .append("\" width=\"").append(n(c.getWidth()))
                        .append("\" height=\"").append(n(c.getHeight())).append("\" />\n");
            }
        }
        svg.append("  </g>\n");

        svg.append("  <text x=\"0\" y=\"").append(n(-padding / 3.0))
                .append("\" fill=\"#e6edf3\" font-family=\"sans-serif\" font-size=\"").append(n(padding / 2.0))
                .append("\">").append(result.getRows()).append(" x ").append(result.getColumns())
                .append(" ").append(result.getShape()).append(", ")
                .append(n(w)).append(" x ").append(n(h)).append(" in</text>\n");

        svg.append("</svg>\n");
        return svg.toString();
    }

    private static String n(double v) {
        return String.format(Locale.US, "%.4f", v);
    }
}
