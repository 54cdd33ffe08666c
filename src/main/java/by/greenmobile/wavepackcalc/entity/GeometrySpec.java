package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

/**
 * Single channel geometry in metres.
 * For circular variants {@code width == height == diameter}.
 */
@Value
public class GeometrySpec {
    ShapeVariant shape;
    double width;
    double height;
    double wallThickness;
    double length;

    public double getDiameter() {
        return width;
    }

    /** Cross-section area of one channel, m². */
    public double channelArea() {
        if (shape.isCircular()) {
            return Math.PI * (width / 2.0) * (width / 2.0);
        }
        return width * height;
    }
}
