// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.raster.RasterCube;
import io.pfive.chunked.task.AnimationMode;
import io.pfive.chunked.task.ProcessingMode;

import java.util.List;

import static io.pfive.chunked.analysis.ColorScale.TRANSPARENT;
import static io.pfive.chunked.analysis.RunningAccumulator.NORMALIZED_DATA;
import static io.pfive.chunked.analysis.RunningAccumulator.TOTAL_CLEAN;
import static io.pfive.chunked.analysis.RunningAccumulator.TOTAL_DATA;

/// Counts how often each pixel is observed as open water across a time series, and the fraction
/// of its clean observations that were water.
public class WaterDetectionAnalysis implements AnalysisDefinition {

    public static final String NAME = "water_detection";
    public static final String WATER_BAND = "wofs";

    private static final ColorScale FRACTION = new ColorScale(List.of(
          new ColorScale.Stop(0.0, 0xFFF5E6C8),
          new ColorScale.Stop(0.5, 0xFF6FA8DC),
          new ColorScale.Stop(1.0, 0xFF08306B)
    ), TRANSPARENT);
    private static final ColorScale COUNTS = ColorScale.ramp(0, 0xFFFFFFFF, 50, 0xFF08306B, TRANSPARENT);
    private static final ColorScale WATER = ColorScale.ramp(0, 0xFFF5E6C8, 1, 0xFF2171B5, TRANSPARENT);

    private static final ImageSpec PERCENTAGE = ImageSpec.singleBand("water_percentage", NORMALIZED_DATA, FRACTION);

    @Override
    public String name () {
        return NAME;
    }

    @Override
    public ProcessingMode mode () {
        return ProcessingMode.ITERATIVE;
    }

    /// 1 where the clean pixel is water, 0 where it is clean land.
    @Override
    public Raster classify (RasterCube cube, CleanMask mask, int t) {
        float[] water = SpectralIndices.water(cube.band("green")[t], cube.band("nir")[t]);
        for (int i = 0; i < water.length; i++) {
            if (!mask.isClean(t, i)) water[i] = Float.NaN;
        }
        Raster classified = new Raster(cube.grid);
        classified.putBand(WATER_BAND, water);
        return classified;
    }

    @Override
    public void accumulate (RunningAccumulator accumulator, Raster classified) {
        accumulator.fold(classified, WATER_BAND);
    }

    @Override
    public List<ImageSpec> products () {
        return List.of(
              PERCENTAGE,
              ImageSpec.singleBand("water_observations", TOTAL_DATA, COUNTS),
              ImageSpec.singleBand("clear_observations", TOTAL_CLEAN, COUNTS)
        );
    }

    @Override
    public ImageSpec animationFrame (AnimationMode animation) {
        if (animation == AnimationMode.PER_SCENE) {
            return ImageSpec.singleBand("scene", WATER_BAND, WATER);
        }
        return PERCENTAGE;
    }

}
