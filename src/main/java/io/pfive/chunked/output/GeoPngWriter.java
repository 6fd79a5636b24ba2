// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import ar.com.hjg.pngj.FilterType;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineHelper;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import ar.com.hjg.pngj.chunks.PngChunkTextVar;
import io.pfive.chunked.geo.GridScheme;
import io.pfive.chunked.geo.Wgs84Bounds;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/// Writes RGBA pixels as a PNG with text chunks locating the image on the map, so a viewer can
/// overlay it without a separate metadata file.
public class GeoPngWriter {
    final GridScheme grid;
    final String title;

    public GeoPngWriter (GridScheme grid, String title) {
        this.grid = grid;
        this.title = title;
    }

    /// The PNGJ library appears to reverse the meaning of iTXt language tag and translated key.
    /// This method specifies that we want uncompressed Latin1, which creates simpler tEXt chunks
    /// instead of iTXt.
    private static void addSimpleTextTag (PngWriter png, String key, String value) {
        png.getMetadata().setText(key, value, true, false);
    }

    public void write (int[] argbPixels, Path path) {
        try (OutputStream out = new BufferedOutputStream(new FileOutputStream(path.toFile()))) {
            streamPng(argbPixels, out);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /// Closes stream when done. No timestamp chunk is written, so the same pixels always produce
    /// the same bytes.
    /// @param argbPixels in image order, rows from north to south.
    public void streamPng (int[] argbPixels, OutputStream outputStream) {
        int cols = grid.nCellsWide();
        int rows = grid.nCellsHigh();
        ImageInfo imi = new ImageInfo(cols, rows, 8, true); // 8 bits per channel, with alpha
        PngWriter png = new PngWriter(outputStream, imi);
        png.setFilterType(FilterType.FILTER_ADAPTIVE_FAST);
        png.setCompLevel(4);
        Wgs84Bounds bounds = grid.wgsBounds();
        addSimpleTextTag(png, PngChunkTextVar.KEY_Title, title);
        addSimpleTextTag(png, "CRS", "WGS84");
        addSimpleTextTag(png, "minX", Double.toString(bounds.minLon()));
        addSimpleTextTag(png, "minY", Double.toString(bounds.minLat()));
        addSimpleTextTag(png, "maxX", Double.toString(bounds.maxLon()));
        addSimpleTextTag(png, "maxY", Double.toString(bounds.maxLat()));
        // ImageLineInt appears to be reusable for successive rows.
        ImageLineInt iline = new ImageLineInt(imi);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                int argb = argbPixels[row * cols + col];
                ImageLineHelper.setPixelRGBA8(iline, col,
                      (argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF, (argb >>> 24) & 0xFF);
            }
            png.writeRow(iline);
        }
        png.end(); // Closes the OutputStream wrapped by the PngWriter.
    }

}
