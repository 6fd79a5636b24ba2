// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.analysis.ColorScale;
import io.pfive.chunked.analysis.ImageSpec;
import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;
import io.pfive.chunked.raster.Raster;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GifAnimationWriterTest {

    private static final ImageSpec SPEC = ImageSpec.singleBand("frame", "value",
          ColorScale.ramp(0, 0xFF000000, 10, 0xFFFFFFFF, ColorScale.TRANSPARENT));

    @TempDir
    Path dir;

    private Path frame (int step) {
        GridScheme grid = GridScheme.forBounds(Wgs84Bounds.fromMinMax(0, 0, 0.4, 0.3), 0.1);
        float[] values = new float[grid.nElements()];
        for (int i = 0; i < values.length; i++) values[i] = (i + step) % 10;
        values[0] = Float.NaN;
        Raster raster = new Raster(grid);
        raster.putBand("value", values);
        Path path = dir.resolve("animation_" + step + ".png");
        new GeoPngWriter(grid, "frame " + step).write(ImageRenderer.render(SPEC, raster), path);
        return path;
    }

    private static int countFrames (Path gif) throws Exception {
        ImageReader reader = ImageIO.getImageReadersByFormatName("gif").next();
        try (ImageInputStream in = ImageIO.createImageInputStream(gif.toFile())) {
            reader.setInput(in);
            return reader.getNumImages(true);
        } finally {
            reader.dispose();
        }
    }

    @Test
    void missingFramesAreSkipped () throws Exception {
        List<Path> frames = new ArrayList<>();
        frames.add(frame(0));
        frames.add(dir.resolve("animation_1.png"));
        frames.add(frame(2));
        frames.add(frame(3));
        Path gif = dir.resolve("animation.gif");
        int written = GifAnimationWriter.write(frames, gif, 0.5);
        assertEquals(3, written);
        assertTrue(Files.size(gif) > 0);
        assertEquals(3, countFrames(gif));
    }

    @Test
    void nodataIsDrawnInFillColor () throws Exception {
        Path gif = dir.resolve("animation.gif");
        assertEquals(1, GifAnimationWriter.write(List.of(frame(0)), gif, 1.0, 0xC0C0C0));
        BufferedImage image = ImageIO.read(gif.toFile());
        // The NaN pixel is the south-west corner, on the bottom row of the image.
        assertColor(0xC0C0C0, image.getRGB(0, 2));
        // Value 0 at flat index 10, column 2 of the north row, is black data.
        assertColor(0x000000, image.getRGB(2, 0));
    }

    private static void assertColor (int expectedRgb, int actualArgb) {
        for (int shift = 0; shift <= 16; shift += 8) {
            int expected = (expectedRgb >> shift) & 0xFF;
            int actual = (actualArgb >> shift) & 0xFF;
            assertTrue(Math.abs(expected - actual) <= 4,
                  String.format("Expected %06X, got %06X", expectedRgb, actualArgb & 0xFFFFFF));
        }
    }

    @Test
    void durationMustBePositive () {
        assertThrows(IllegalArgumentException.class,
              () -> GifAnimationWriter.write(List.of(), dir.resolve("empty.gif"), 0));
    }

}
