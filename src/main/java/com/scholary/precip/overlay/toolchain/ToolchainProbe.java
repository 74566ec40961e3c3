package com.scholary.precip.overlay.toolchain;

import com.scholary.precip.overlay.config.ToolchainProperties;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks that wgrib2, gdalwarp and gdaldem can be found.
 *
 * <p>Probed on every request so that installing a tool while the service runs is picked up
 * without a restart. A configured value containing a path separator is checked as a file;
 * a bare name is searched on the PATH (with PATHEXT suffixes on Windows). gdalinfo is not
 * probed, it ships with gdalwarp.
 */
@Component
public class ToolchainProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(ToolchainProbe.class);

  private final Map<String, String> executables = new LinkedHashMap<>();
  private final String searchPath;
  private final List<String> windowsExtensions;

  private volatile ToolchainStatus lastStatus;

  @Autowired
  public ToolchainProbe(ToolchainProperties properties) {
    this(properties, System.getenv("PATH"), System.getenv("PATHEXT"));
  }

  ToolchainProbe(ToolchainProperties properties, String searchPath, String pathExt) {
    executables.put("wgrib2", properties.wgrib2());
    executables.put("gdalwarp", properties.gdalwarp());
    executables.put("gdaldem", properties.gdaldem());
    this.searchPath = searchPath == null ? "" : searchPath;
    this.windowsExtensions = parseExtensions(pathExt);
  }

  /** Probe every required executable. */
  public ToolchainStatus probe() {
    List<String> missing = new ArrayList<>();
    executables.forEach(
        (label, executable) -> {
          if (!isAvailable(executable)) {
            missing.add(label);
          }
        });

    ToolchainStatus status = new ToolchainStatus(missing);
    ToolchainStatus previous = lastStatus;
    if (previous == null || previous.available() != status.available()) {
      if (status.available()) {
        LOGGER.info("Toolchain available: {}", executables.values());
      } else {
        LOGGER.warn("Toolchain unavailable, missing: {}", missing);
      }
    }
    lastStatus = status;
    return status;
  }

  /** The result of the most recent probe, if any. */
  public Optional<ToolchainStatus> lastStatus() {
    return Optional.ofNullable(lastStatus);
  }

  boolean isAvailable(String executable) {
    if (executable.contains("/") || executable.contains("\\")) {
      try {
        return Files.isRegularFile(Path.of(executable));
      } catch (InvalidPathException e) {
        LOGGER.debug("Invalid executable path: {}", executable);
        return false;
      }
    }

    for (String dir : searchPath.split(File.pathSeparator)) {
      if (dir.isBlank()) {
        continue;
      }
      try {
        Path candidate = Path.of(dir, executable);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return true;
        }
        for (String ext : windowsExtensions) {
          if (Files.isRegularFile(Path.of(dir, executable + ext))) {
            return true;
          }
        }
      } catch (InvalidPathException e) {
        LOGGER.debug("Skipping invalid PATH entry: {}", dir);
      }
    }
    return false;
  }

  private static List<String> parseExtensions(String pathExt) {
    if (pathExt == null || pathExt.isBlank()) {
      return List.of();
    }
    List<String> extensions = new ArrayList<>();
    for (String ext : pathExt.split(";")) {
      if (!ext.isBlank()) {
        extensions.add(ext.trim().toLowerCase(Locale.ROOT));
      }
    }
    return extensions;
  }
}
