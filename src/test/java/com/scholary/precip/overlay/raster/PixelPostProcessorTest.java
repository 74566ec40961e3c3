package com.scholary.precip.overlay.raster;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.precip.overlay.support.FakeToolchain;
import java.awt.image.BufferedImage;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PixelPostProcessorTest {

  private PixelPostProcessor processor;

  @BeforeEach
  void setUp() {
    processor = new PixelPostProcessor(10, 1);
  }

  @Test
  void makeDominantBorderColorTransparent_shouldClearFillAndKeepData() {
    BufferedImage image = FakeToolchain.dataRectangle(20, 10, 59, 49);

    int cleared = processor.makeDominantBorderColorTransparent(image);

    assertThat(cleared).isEqualTo(100 * 80 - 40 * 40);
    assertThat(image.getRGB(0, 0) >>> 24).isZero();
    assertThat(image.getRGB(99, 79) >>> 24).isZero();
    assertThat(image.getRGB(20, 10)).isEqualTo(FakeToolchain.DATA_RGB);
    assertThat(image.getRGB(59, 49)).isEqualTo(FakeToolchain.DATA_RGB);
  }

  @Test
  void makeDominantBorderColorTransparent_shouldKeepRgbOfClearedPixels() {
    BufferedImage image = FakeToolchain.dataRectangle(20, 10, 59, 49);

    processor.makeDominantBorderColorTransparent(image);

    assertThat(image.getRGB(0, 0) & 0x00FFFFFF).isEqualTo(FakeToolchain.BORDER_RGB & 0x00FFFFFF);
  }

  @Test
  void makeDominantBorderColorTransparent_shouldClearColoursWithinTolerance() {
    BufferedImage image = FakeToolchain.dataRectangle(20, 10, 59, 49);
    // Interior pixel a few levels off the fill colour, and one just outside tolerance
    image.setRGB(30, 20, 0xFF6A6A6A);
    image.setRGB(31, 20, 0xFF6F6464);

    processor.makeDominantBorderColorTransparent(image);

    assertThat(image.getRGB(30, 20) >>> 24).isZero();
    assertThat(image.getRGB(31, 20) >>> 24).isEqualTo(0xFF);
  }

  @Test
  void makeDominantBorderColorTransparent_shouldBeIdempotent() {
    BufferedImage image = FakeToolchain.dataRectangle(20, 10, 59, 49);
    processor.makeDominantBorderColorTransparent(image);
    int[] first = image.getRGB(0, 0, 100, 80, null, 0, 100);

    int clearedAgain = processor.makeDominantBorderColorTransparent(image);

    assertThat(image.getRGB(0, 0, 100, 80, null, 0, 100)).isEqualTo(first);
    // Every border sample is transparent now, so no fill colour is detected
    assertThat(clearedAgain).isZero();
  }

  @Test
  void makeDominantBorderColorTransparent_shouldDoNothingWhenBorderIsTransparent() {
    BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(5, 5, FakeToolchain.DATA_RGB);

    assertThat(processor.makeDominantBorderColorTransparent(image)).isZero();
    assertThat(image.getRGB(5, 5)).isEqualTo(FakeToolchain.DATA_RGB);
  }

  @Test
  void makeDominantBorderColorTransparent_shouldBreakTiesByFirstSeenColour() {
    // Top row blue, bottom row green: equal counts, top is sampled first
    BufferedImage image = new BufferedImage(4, 2, BufferedImage.TYPE_INT_ARGB);
    for (int x = 0; x < 4; x++) {
      image.setRGB(x, 0, 0xFF0000FF);
      image.setRGB(x, 1, 0xFF00FF00);
    }

    processor.makeDominantBorderColorTransparent(image);

    assertThat(image.getRGB(0, 0) >>> 24).isZero();
    assertThat(image.getRGB(0, 1) >>> 24).isEqualTo(0xFF);
  }

  @Test
  void cropToContent_shouldReturnSmallestRectangleHoldingContent() {
    BufferedImage image = FakeToolchain.dataRectangle(20, 10, 59, 49);
    processor.makeDominantBorderColorTransparent(image);

    Optional<CropResult> crop = processor.cropToContent(image);

    assertThat(crop).isPresent();
    CropResult c = crop.get();
    assertThat(c.cropped()).isTrue();
    assertThat(c.minX()).isEqualTo(20);
    assertThat(c.minY()).isEqualTo(10);
    assertThat(c.maxX()).isEqualTo(59);
    assertThat(c.maxY()).isEqualTo(49);
    assertThat(c.image().getWidth()).isEqualTo(40);
    assertThat(c.image().getHeight()).isEqualTo(40);
    assertThat(c.image().getRGB(0, 0)).isEqualTo(FakeToolchain.DATA_RGB);
    assertThat(c.width()).isEqualTo(100);
    assertThat(c.height()).isEqualTo(80);
  }

  @Test
  void cropToContent_shouldReturnEmptyForFullyTransparentImage() {
    BufferedImage image = new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB);

    assertThat(processor.cropToContent(image)).isEmpty();
  }

  @Test
  void cropToContent_shouldKeepImageWhenContentFillsIt() {
    BufferedImage image = FakeToolchain.dataRectangle(0, 0, 99, 79);

    CropResult crop = processor.cropToContent(image).orElseThrow();

    assertThat(crop.cropped()).isFalse();
    assertThat(crop.image()).isSameAs(image);
    assertThat(crop.cropWidth()).isEqualTo(100);
    assertThat(crop.cropHeight()).isEqualTo(80);
  }

  @Test
  void cropToContent_shouldIgnorePixelsBelowAlphaThreshold() {
    PixelPostProcessor strict = new PixelPostProcessor(10, 128);
    BufferedImage image = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(1, 1, 0x10FF0000);
    image.setRGB(5, 6, 0xFFFF0000);

    CropResult crop = strict.cropToContent(image).orElseThrow();

    assertThat(crop.minX()).isEqualTo(5);
    assertThat(crop.minY()).isEqualTo(6);
    assertThat(crop.cropWidth()).isEqualTo(1);
    assertThat(crop.cropHeight()).isEqualTo(1);
  }

  @Test
  void toArgb_shouldConvertOpaqueRgbImages() {
    BufferedImage rgb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
    rgb.setRGB(1, 1, 0x123456);

    BufferedImage argb = PixelPostProcessor.toArgb(rgb);

    assertThat(argb.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
    assertThat(argb.getRGB(1, 1)).isEqualTo(0xFF123456);
  }
}
