package com.scholary.precip.overlay.pipeline;

import com.scholary.precip.overlay.geo.GeoBounds;

/**
 * A published overlay.
 *
 * @param matchExpression the wgrib2 match expression that extracted the field
 */
public record ConversionResult(GeoBounds bounds, String matchExpression) {}
