package com.scholary.precip.overlay.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.precip.overlay.cache.ArtifactPaths;
import com.scholary.precip.overlay.config.OverlayProperties;
import com.scholary.precip.overlay.config.ToolchainProperties;
import com.scholary.precip.overlay.geo.GeoBounds;
import com.scholary.precip.overlay.geo.GeoBoundsResolver;
import com.scholary.precip.overlay.geo.GeoTransform;
import com.scholary.precip.overlay.logging.StructuredLogger;
import com.scholary.precip.overlay.raster.ArtifactFiles;
import com.scholary.precip.overlay.raster.CropResult;
import com.scholary.precip.overlay.raster.PixelPostProcessor;
import com.scholary.precip.overlay.toolchain.CommandResult;
import com.scholary.precip.overlay.toolchain.CommandRunner;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts one GRIB2 field into a georeferenced, transparent PNG overlay.
 *
 * <p>For each candidate match expression, in order:
 *
 * <ol>
 *   <li>wgrib2 extracts the matching field to netCDF
 *   <li>gdalwarp reprojects it to the target SRS (Web Mercator by default)
 *   <li>gdaldem color-relief renders it through the palette with an alpha channel
 *   <li>the reprojection fill colour is made transparent and the margin cropped
 *   <li>the crop rectangle is mapped to lat/lon using the GeoTIFF's geotransform
 *   <li>the PNG is published atomically over the previous overlay
 * </ol>
 *
 * <p>The first candidate that makes it through wins. A candidate fails on any tool error, on an
 * extraction output too small to hold a field (wgrib2 exits 0 when nothing matches), or on a
 * missing geotransform.
 */
@Component
public class GribConversionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(GribConversionPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final CommandRunner commandRunner;
  private final PixelPostProcessor postProcessor;
  private final GeoBoundsResolver boundsResolver;
  private final ArtifactFiles artifactFiles;
  private final ObjectMapper objectMapper;
  private final OverlayProperties overlayProperties;
  private final ToolchainProperties toolchainProperties;

  public GribConversionPipeline(
      CommandRunner commandRunner,
      PixelPostProcessor postProcessor,
      GeoBoundsResolver boundsResolver,
      ArtifactFiles artifactFiles,
      ObjectMapper objectMapper,
      OverlayProperties overlayProperties,
      ToolchainProperties toolchainProperties) {
    this.commandRunner = commandRunner;
    this.postProcessor = postProcessor;
    this.boundsResolver = boundsResolver;
    this.artifactFiles = artifactFiles;
    this.objectMapper = objectMapper;
    this.overlayProperties = overlayProperties;
    this.toolchainProperties = toolchainProperties;
  }

  /**
   * Convert a grid file, trying each match expression until one succeeds.
   *
   * @param gribFile the source GRIB2 file
   * @param matchExpressions candidates in priority order; empty means the configured fallbacks
   * @param paths working and output files for this overlay
   * @return the bounds of the published overlay and the expression that matched
   * @throws ConversionException if the palette is missing or every candidate failed
   */
  public ConversionResult convert(
      Path gribFile, List<String> matchExpressions, ArtifactPaths paths) {
    Path palette = overlayProperties.paletteFile();
    if (!Files.exists(palette)) {
      throw new ConversionException("Palette missing: " + palette);
    }

    List<String> candidates =
        matchExpressions == null || matchExpressions.isEmpty()
            ? overlayProperties.fallbackMatches()
            : matchExpressions;

    Exception lastError = null;
    for (int i = 0; i < candidates.size(); i++) {
      String matchExpr = candidates.get(i);
      try {
        return convertWith(gribFile, matchExpr, palette, paths);
      } catch (IOException | RuntimeException e) {
        lastError = e;
        structuredLogger.logCandidateFailed(
            matchExpr,
            i + 1,
            candidates.size(),
            e.getClass().getSimpleName(),
            Diagnostics.summarize(e, 200));
      }
    }

    throw new ConversionException(
        String.format(
            "No field matched via -match. Tried: %s. Last error: %s",
            String.join(", ", candidates),
            Diagnostics.summarize(lastError, overlayProperties.diagnosticMaxLength())),
        lastError);
  }

  private ConversionResult convertWith(
      Path gribFile, String matchExpr, Path palette, ArtifactPaths paths) throws IOException {
    Files.deleteIfExists(paths.extractedGrid());

    commandRunner.runChecked(
        List.of(
            toolchainProperties.wgrib2(),
            gribFile.toString(),
            "-match",
            matchExpr,
            "-netcdf",
            paths.extractedGrid().toString()));
    ensureMinimumSize(
        paths.extractedGrid(),
        toolchainProperties.minExtractBytes(),
        "wgrib2 (" + matchExpr + ") netcdf");

    commandRunner.runChecked(
        List.of(
            toolchainProperties.gdalwarp(),
            "-overwrite",
            "-t_srs",
            toolchainProperties.targetSrs(),
            paths.extractedGrid().toString(),
            paths.reprojectedRaster().toString()));

    commandRunner.runChecked(
        List.of(
            toolchainProperties.gdaldem(),
            "color-relief",
            paths.reprojectedRaster().toString(),
            palette.toString(),
            paths.overlayTmpPng().toString(),
            "-alpha"));

    BufferedImage rendered = artifactFiles.readImage(paths.overlayTmpPng());
    postProcessor.makeDominantBorderColorTransparent(rendered);

    GeoTransform transform = readGeoTransform(paths.reprojectedRaster());

    Optional<CropResult> crop = postProcessor.cropToContent(rendered);
    if (crop.isEmpty()) {
      LOGGER.info("Overlay for {} is fully transparent, keeping default bounds", matchExpr);
      artifactFiles.writeAndPublish(rendered, paths.overlayTmpPng(), paths.overlayPng());
      return new ConversionResult(overlayProperties.defaultBounds(), matchExpr);
    }

    CropResult c = crop.get();
    GeoBounds bounds = boundsResolver.resolve(transform, c.minX(), c.minY(), c.maxX(), c.maxY());
    artifactFiles.writeAndPublish(c.image(), paths.overlayTmpPng(), paths.overlayPng());

    LOGGER.debug(
        "Published {}x{} overlay (from {}x{}) with bounds {}",
        c.cropWidth(),
        c.cropHeight(),
        c.width(),
        c.height(),
        bounds);
    return new ConversionResult(bounds, matchExpr);
  }

  private GeoTransform readGeoTransform(Path raster) throws IOException {
    CommandResult info =
        commandRunner.runChecked(
            List.of(toolchainProperties.gdalinfo(), "-json", raster.toString()));
    return GeoTransform.fromGdalInfo(objectMapper.readTree(info.stdout()))
        .orElseThrow(() -> new ConversionException("gdalinfo: geoTransform missing"));
  }

  private static void ensureMinimumSize(Path file, long minBytes, String label)
      throws IOException {
    long size = Files.exists(file) ? Files.size(file) : 0;
    if (size < minBytes) {
      throw new ConversionException(
          String.format("%s empty or missing (%d bytes): %s", label, size, file));
    }
  }
}
