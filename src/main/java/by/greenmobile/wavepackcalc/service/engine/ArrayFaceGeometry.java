package by.greenmobile.wavepackcalc.service.engine;

import by.greenmobile.wavepackcalc.entity.ShapeVariant;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Front view of the array in inches, origin at the top-left corner of the envelope.
 * Shared by SVG, DXF and the PDF schematic so all three draw the same grid.
 *
 * Each channel sits centred in its (a + 2t) × (b + 2t) pitch cell.
 * Staggered arrays shift every odd row by half a pitch; this is only a drawing
 * convention, the envelope is the same as for inline packing.
 */
@Component
@Slf4j
public class ArrayFaceGeometry {

    @Value
    public static class Channel {
        double cx;
        double cy;
        double width;
        double height;
        boolean circular;
    }

    @Value
    public static class Face {
        double width;
        double height;
        List<Channel> channels;
    }

    public Face build(SolveResult r) {
        return build(r, Integer.MAX_VALUE);
    }

    /**
     * Same face, drawing at most {@code maxPerSide} rows and columns from the top-left corner.
     */
    public Face build(SolveResult r, int maxPerSide) {
        ShapeVariant shape = ShapeVariant.fromLabel(r.getShape()).orElse(ShapeVariant.RECTANGULAR);
        int rows = Math.min(r.getRows(), maxPerSide);
        int cols = Math.min(r.getColumns(), maxPerSide);
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Array face needs positive dimensions, got " + r.getArrayDims());
        }

        double a = r.getWidthIn();
        double b = shape.isCircular() ? a : r.getHeightIn();
        double t = r.getWallThicknessIn();
        double pitchX = a + 2 * t;
        double pitchY = b + 2 * t;

        boolean staggered = shape == ShapeVariant.CIRCULAR_STAGGERED;
        double faceWidth = cols * pitchX + (staggered && rows > 1 ? pitchX / 2.0 : 0.0);
        double faceHeight = rows * pitchY;

        List<Channel> channels = new ArrayList<>(rows * cols);
        for (int row = 0; row < rows; row++) {
            double shift = (staggered && row % 2 == 1) ? pitchX / 2.0 : 0.0;
            double cy = row * pitchY + pitchY / 2.0;
            for (int col = 0; col < cols; col++) {
                double cx = shift + col * pitchX + pitchX / 2.0;
                channels.add(new Channel(cx, cy, a, b, shape.isCircular()));
            }
        }

        log.debug("Face {}x{}: {} x {} in, channels={}", rows, cols, faceWidth, faceHeight, channels.size());
        return new Face(faceWidth, faceHeight, channels);
    }
}
