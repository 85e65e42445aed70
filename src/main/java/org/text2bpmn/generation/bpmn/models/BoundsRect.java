package org.text2bpmn.generation.bpmn.models;

/**
 * Axis-aligned rectangle of a shape in diagram coordinates ({@code dc:Bounds}).
 */
public record BoundsRect(
        double x,
        double y,
        double width,
        double height
) {
    public BoundsRect {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Bounds must have non-negative size: " + width + "x" + height);
        }
    }

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public BoundsRect union(BoundsRect other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        return new BoundsRect(minX, minY,
                Math.max(maxX(), other.maxX()) - minX,
                Math.max(maxY(), other.maxY()) - minY);
    }

    public BoundsRect pad(double margin) {
        return new BoundsRect(x - margin, y - margin, width + 2 * margin, height + 2 * margin);
    }
}
