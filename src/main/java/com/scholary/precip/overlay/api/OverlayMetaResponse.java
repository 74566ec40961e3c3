package com.scholary.precip.overlay.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.precip.overlay.cache.OverlaySource;
import com.scholary.precip.overlay.geo.GeoBounds;

/**
 * Response for overlay metadata.
 *
 * <p>The map front end places {@code overlay.png} at {@code bounds} and shows {@code message} in
 * its status line.
 *
 * @param hour zero-padded hour, null when the default grid file was used
 * @param gribFile file name of the grid file, without directory
 */
public record OverlayMetaResponse(
    String hour,
    @JsonProperty("var") String variable,
    String gribFile,
    long updatedAt,
    GeoBounds bounds,
    OverlaySource source,
    String message) {}
