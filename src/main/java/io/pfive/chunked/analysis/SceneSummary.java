// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

/// Pixel counts for one acquisition within some area.
public record SceneSummary (long totalPixels, long cleanPixels) {

    public SceneSummary plus (SceneSummary other) {
        return new SceneSummary(totalPixels + other.totalPixels, cleanPixels + other.cleanPixels);
    }

    public double cleanFraction () {
        return totalPixels == 0 ? 0 : ((double) cleanPixels) / totalPixels;
    }
}
