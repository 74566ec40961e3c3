package com.scholary.precip.overlay.geo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Geographic bounding box in degrees.
 *
 * <p>Serialized as {@code [[south, west], [north, east]]}, the corner-pair form map libraries
 * take for image overlays.
 */
public record GeoBounds(double south, double west, double north, double east) {

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static GeoBounds fromCornerArray(double[][] corners) {
    if (corners == null
        || corners.length != 2
        || corners[0].length != 2
        || corners[1].length != 2) {
      throw new IllegalArgumentException("Expected [[south, west], [north, east]]");
    }
    return new GeoBounds(corners[0][0], corners[0][1], corners[1][0], corners[1][1]);
  }

  @JsonValue
  public double[][] toCornerArray() {
    return new double[][] {{south, west}, {north, east}};
  }

  /** Whether this box lies inside {@code other}, edges included. */
  public boolean isWithin(GeoBounds other) {
    return south >= other.south
        && north <= other.north
        && west >= other.west
        && east <= other.east;
  }
}
