package com.scholary.precip.overlay.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external GRIB/GDAL toolchain.
 *
 * <p>Each executable is either a bare name resolved on the PATH or a path to the binary.
 */
@ConfigurationProperties(prefix = "toolchain")
@Validated
public record ToolchainProperties(
    @NotBlank String wgrib2,
    @NotBlank String gdalwarp,
    @NotBlank String gdaldem,
    @NotBlank String gdalinfo,
    @NotBlank String targetSrs,
    @Positive long minExtractBytes) {}
