package com.calcsheet.commands.placement;

/**
 * Estimated on-canvas rectangle of a node.
 */
public class NodeBox {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public NodeBox(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public NodeBox at(double newX, double newY) {
        return new NodeBox(newX, newY, width, height);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getBottom() {
        return y + height;
    }

    /**
     * Overlap test with a margin added on every side.
     */
    public boolean overlaps(NodeBox other, double marginX, double marginY) {
        return x < other.x + other.width + marginX
            && x + width + marginX > other.x
            && y < other.y + other.height + marginY
            && y + height + marginY > other.y;
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + " " + width + "x" + height + "]";
    }
}
