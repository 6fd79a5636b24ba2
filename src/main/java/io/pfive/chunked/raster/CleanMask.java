// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.raster;

import java.util.BitSet;

/// Per-pixel, per-time flags marking usable (cloud-free) observations in a RasterCube.
public class CleanMask {

    /// Quality band written by some processing levels: 0 is clear land, 1 is clear water.
    public static final String CF_MASK_BAND = "cf_mask";

    /// Bit-packed quality band: bit 1 is clear land, bit 2 is clear water.
    public static final String PIXEL_QA_BAND = "pixel_qa";
    public static final int[] PIXEL_QA_CLEAR_BITS = {1, 2};

    private final BitSet[] clean;
    private final int nPixels;

    private CleanMask (int nTimes, int nPixels) {
        this.nPixels = nPixels;
        this.clean = new BitSet[nTimes];
        for (int t = 0; t < nTimes; t++) clean[t] = new BitSet(nPixels);
    }

    /// Choose the mask construction from the quality bands present in the cube. A cube with no
    /// quality band at all is treated as entirely clean.
    public static CleanMask forCube (RasterCube cube) {
        if (cube.hasBand(CF_MASK_BAND)) return fromCfMask(cube.band(CF_MASK_BAND), cube.grid.nElements());
        if (cube.hasBand(PIXEL_QA_BAND)) {
            return fromBitFlags(cube.band(PIXEL_QA_BAND), cube.grid.nElements(), PIXEL_QA_CLEAR_BITS);
        }
        CleanMask mask = new CleanMask(cube.nTimes(), cube.grid.nElements());
        for (BitSet slice : mask.clean) slice.set(0, mask.nPixels);
        return mask;
    }

    public static CleanMask fromCfMask (float[][] cfMask, int nPixels) {
        CleanMask mask = new CleanMask(cfMask.length, nPixels);
        for (int t = 0; t < cfMask.length; t++) {
            for (int i = 0; i < nPixels; i++) {
                float v = cfMask[t][i];
                if (v == 0 || v == 1) mask.clean[t].set(i);
            }
        }
        return mask;
    }

    /// A pixel is clean if any of the given bits is set in its quality value.
    public static CleanMask fromBitFlags (float[][] qa, int nPixels, int... bits) {
        int flags = 0;
        for (int bit : bits) flags |= (1 << bit);
        CleanMask mask = new CleanMask(qa.length, nPixels);
        for (int t = 0; t < qa.length; t++) {
            for (int i = 0; i < nPixels; i++) {
                float v = qa[t][i];
                if (!Float.isNaN(v) && (((int) v) & flags) != 0) mask.clean[t].set(i);
            }
        }
        return mask;
    }

    public boolean isClean (int t, int pixel) {
        return clean[t].get(pixel);
    }

    public int cleanCount (int t) {
        return clean[t].cardinality();
    }

    public int nTimes () {
        return clean.length;
    }
}
