package com.flamingo.ai.docstructure.service.layout.model;

/**
 * Axis-aligned bounding box in page coordinate units.
 *
 * @param x left edge
 * @param y top edge
 * @param width box width
 * @param height box height
 */
public record BoundingBox(double x, double y, double width, double height) {

  public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

  /**
   * Builds a box from corner coordinates as found in {@code data-bbox="x0,y0,x1,y1"}.
   *
   * @return the box, never with negative extent
   */
  public static BoundingBox fromCorners(double x0, double y0, double x1, double y1) {
    return new BoundingBox(
        Math.min(x0, x1), Math.min(y0, y1), Math.abs(x1 - x0), Math.abs(y1 - y0));
  }

  public double right() {
    return x + width;
  }

  public double bottom() {
    return y + height;
  }

  public double centerX() {
    return x + width / 2;
  }

  public double centerY() {
    return y + height / 2;
  }

  /** Smallest box enclosing both boxes. */
  public BoundingBox merge(BoundingBox other) {
    if (other == null || other.equals(EMPTY)) {
      return this;
    }
    if (this.equals(EMPTY)) {
      return other;
    }
    double minX = Math.min(x, other.x);
    double minY = Math.min(y, other.y);
    return new BoundingBox(
        minX,
        minY,
        Math.max(right(), other.right()) - minX,
        Math.max(bottom(), other.bottom()) - minY);
  }
}
