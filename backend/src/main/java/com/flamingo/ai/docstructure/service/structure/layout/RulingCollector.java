package com.flamingo.ai.docstructure.service.structure.layout;

import com.flamingo.ai.docstructure.service.structure.layout.RulingTableDetector.Ruling;
import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;

/**
 * Collects the axis-aligned lines a page draws: stroked segments, the edges of stroked rectangles
 * and filled rectangles thin enough to act as a line. Coordinates are converted to the top-down
 * space {@link org.apache.pdfbox.text.TextPosition} uses.
 */
final class RulingCollector extends PDFGraphicsStreamEngine {

  /** Filled rectangles at most this thick are drawn lines, anything wider is a shape. */
  private static final float MAX_RULE_THICKNESS = 3.0f;

  private final float originX;
  private final float originY;
  private final List<float[]> segments = new ArrayList<>();
  private final List<float[]> rectangles = new ArrayList<>();
  private final List<Ruling> rulings = new ArrayList<>();
  private Point2D.Float currentPoint = new Point2D.Float();
  private Point2D.Float subpathStart = new Point2D.Float();

  private RulingCollector(PDPage page) {
    super(page);
    PDRectangle cropBox = page.getCropBox();
    this.originX = cropBox.getLowerLeftX();
    this.originY = cropBox.getUpperRightY();
  }

  /** Returns the rulings drawn on a page. */
  static List<Ruling> collect(PDPage page) throws IOException {
    RulingCollector collector = new RulingCollector(page);
    collector.processPage(page);
    return collector.rulings;
  }

  @Override
  public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
    float left = (float) Math.min(Math.min(p0.getX(), p1.getX()), Math.min(p2.getX(), p3.getX()));
    float right = (float) Math.max(Math.max(p0.getX(), p1.getX()), Math.max(p2.getX(), p3.getX()));
    float bottom = (float) Math.min(Math.min(p0.getY(), p1.getY()), Math.min(p2.getY(), p3.getY()));
    float top = (float) Math.max(Math.max(p0.getY(), p1.getY()), Math.max(p2.getY(), p3.getY()));
    rectangles.add(new float[] {left, bottom, right, top});
    currentPoint = new Point2D.Float((float) p0.getX(), (float) p0.getY());
    subpathStart = currentPoint;
  }

  @Override
  public void moveTo(float x, float y) {
    currentPoint = new Point2D.Float(x, y);
    subpathStart = currentPoint;
  }

  @Override
  public void lineTo(float x, float y) {
    segments.add(new float[] {currentPoint.x, currentPoint.y, x, y});
    currentPoint = new Point2D.Float(x, y);
  }

  @Override
  public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
    currentPoint = new Point2D.Float(x3, y3);
  }

  @Override
  public Point2D getCurrentPoint() {
    return currentPoint;
  }

  @Override
  public void closePath() {
    segments.add(new float[] {currentPoint.x, currentPoint.y, subpathStart.x, subpathStart.y});
    currentPoint = subpathStart;
  }

  @Override
  public void endPath() {
    clearPath();
  }

  @Override
  public void strokePath() {
    for (float[] s : segments) {
      addSegment(s[0], s[1], s[2], s[3]);
    }
    for (float[] r : rectangles) {
      addSegment(r[0], r[1], r[2], r[1]);
      addSegment(r[0], r[3], r[2], r[3]);
      addSegment(r[0], r[1], r[0], r[3]);
      addSegment(r[2], r[1], r[2], r[3]);
    }
    clearPath();
  }

  @Override
  public void fillPath(int windingRule) {
    for (float[] r : rectangles) {
      float width = r[2] - r[0];
      float height = r[3] - r[1];
      if (height <= MAX_RULE_THICKNESS && width > height) {
        float y = (r[1] + r[3]) / 2;
        addSegment(r[0], y, r[2], y);
      } else if (width <= MAX_RULE_THICKNESS && height > width) {
        float x = (r[0] + r[2]) / 2;
        addSegment(x, r[1], x, r[3]);
      }
    }
    clearPath();
  }

  @Override
  public void fillAndStrokePath(int windingRule) {
    strokePath();
  }

  @Override
  public void clip(int windingRule) {
    // the clipping path is consumed by the following endPath
  }

  @Override
  public void drawImage(PDImage pdImage) {
    // images carry no rulings
  }

  @Override
  public void shadingFill(COSName shadingName) {
    // shadings carry no rulings
  }

  private void addSegment(float x1, float y1, float x2, float y2) {
    RulingTableDetector.toRuling(x1 - originX, originY - y1, x2 - originX, originY - y2)
        .ifPresent(rulings::add);
  }

  private void clearPath() {
    segments.clear();
    rectangles.clear();
  }
}
