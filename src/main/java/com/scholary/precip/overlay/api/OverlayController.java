package com.scholary.precip.overlay.api;

import com.scholary.precip.overlay.logging.StructuredLogger;
import com.scholary.precip.overlay.service.OverlayQueryService;
import com.scholary.precip.overlay.service.OverlayTarget;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for precipitation overlays.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Overlay metadata (bounds, source, status message)
 *   <li>The overlay PNG itself
 *   <li>Cache status, for operators
 * </ul>
 *
 * <p>Both overlay endpoints refresh the overlay before answering, so the first request after a
 * new grid file lands waits for the conversion.
 */
@RestController
@RequestMapping("/api/precip")
@Tag(name = "Precipitation overlay", description = "GRIB-derived map overlays")
public class OverlayController {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlayController.class);

  private final OverlayQueryService queryService;

  public OverlayController(OverlayQueryService queryService) {
    this.queryService = queryService;
  }

  @GetMapping("/meta")
  @Operation(
      summary = "Overlay metadata",
      description = "Refresh the overlay for an hour and variable and return its bounds and status")
  public ResponseEntity<?> meta(
      @Parameter(description = "Hour such as 8, 08 or 08H") @RequestParam(required = false)
          String hour,
      @Parameter(description = "Variable such as RPRATE") @RequestParam(name = "var", required = false)
          String variable) {
    OverlayTarget target = queryService.resolve(variable, hour);
    StructuredLogger.setRequestContext(
        target.key().token(), target.variable().name(), target.hour());
    try {
      return ResponseEntity.ok(queryService.meta(target));
    } catch (Exception e) {
      LOGGER.error("Failed to serve overlay metadata for {}", target.key(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(Map.of("error", String.valueOf(e)));
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  @GetMapping("/overlay.png")
  @Operation(
      summary = "Overlay image",
      description = "Refresh the overlay for an hour and variable and return it as PNG")
  public ResponseEntity<?> overlay(
      @Parameter(description = "Hour such as 8, 08 or 08H") @RequestParam(required = false)
          String hour,
      @Parameter(description = "Variable such as RPRATE") @RequestParam(name = "var", required = false)
          String variable) {
    OverlayTarget target = queryService.resolve(variable, hour);
    StructuredLogger.setRequestContext(
        target.key().token(), target.variable().name(), target.hour());
    try {
      byte[] png = queryService.overlayPng(target);
      return ResponseEntity.ok()
          .cacheControl(CacheControl.noStore())
          .contentType(MediaType.IMAGE_PNG)
          .body(png);
    } catch (Exception e) {
      LOGGER.error("Failed to serve overlay for {}", target.key(), e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .contentType(MediaType.TEXT_PLAIN)
          .body(String.valueOf(e));
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  @GetMapping("/status")
  @Operation(
      summary = "Cache status",
      description = "List cache entries and the latest toolchain probe without refreshing")
  public ResponseEntity<OverlayStatusResponse> status() {
    return ResponseEntity.ok(queryService.status());
  }
}
