package com.scholary.precip.overlay.toolchain;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.precip.overlay.config.ToolchainProperties;
import com.scholary.precip.overlay.support.TestProperties;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ToolchainProbeTest {

  @TempDir Path binDir;

  @Test
  void probe_shouldReportAllMissingWhenPathIsEmpty() {
    ToolchainProbe probe = new ToolchainProbe(TestProperties.toolchain(), "", null);

    ToolchainStatus status = probe.probe();

    assertThat(status.available()).isFalse();
    assertThat(status.missing()).containsExactly("wgrib2", "gdalwarp", "gdaldem");
    assertThat(probe.lastStatus()).contains(status);
  }

  @Test
  void probe_shouldFindExecutablesOnPath() throws IOException {
    executable("wgrib2");
    executable("gdalwarp");
    executable("gdaldem");
    String path = binDir.resolve("nowhere") + File.pathSeparator + binDir;
    ToolchainProbe probe = new ToolchainProbe(TestProperties.toolchain(), path, null);

    ToolchainStatus status = probe.probe();

    assertThat(status.available()).isTrue();
    assertThat(status.missing()).isEmpty();
  }

  @Test
  void probe_shouldPickUpToolInstalledAfterFirstProbe() throws IOException {
    executable("wgrib2");
    executable("gdalwarp");
    ToolchainProbe probe =
        new ToolchainProbe(TestProperties.toolchain(), binDir.toString(), null);

    assertThat(probe.probe().missing()).containsExactly("gdaldem");

    executable("gdaldem");
    assertThat(probe.probe().available()).isTrue();
  }

  @Test
  void probe_shouldCheckConfiguredPathsAsFiles() throws IOException {
    Path wgrib2 = executable("wgrib2");
    ToolchainProperties props =
        new ToolchainProperties(
            wgrib2.toString(),
            binDir.resolve("missing-gdalwarp").toString(),
            "gdaldem",
            "gdalinfo",
            "EPSG:3857",
            200);
    executable("gdaldem");
    ToolchainProbe probe = new ToolchainProbe(props, binDir.toString(), null);

    assertThat(probe.probe().missing()).containsExactly("gdalwarp");
  }

  @Test
  void isAvailable_shouldTryPathExtSuffixes() throws IOException {
    Files.createFile(binDir.resolve("wgrib2.exe"));
    ToolchainProbe probe =
        new ToolchainProbe(TestProperties.toolchain(), binDir.toString(), ".COM;.EXE");

    assertThat(probe.isAvailable("wgrib2")).isTrue();
    assertThat(probe.isAvailable("gdalwarp")).isFalse();
  }

  private Path executable(String name) throws IOException {
    Path file = Files.createFile(binDir.resolve(name));
    file.toFile().setExecutable(true);
    return file;
  }
}
