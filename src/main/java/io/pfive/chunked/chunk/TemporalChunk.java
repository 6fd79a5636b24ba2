// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// One group of acquisitions processed together. In batch mode this holds exactly two ranges,
/// the anchor period and the period compared against it. In iterative mode it holds one range per
/// acquisition, each of which is one animation step.
///
/// @param firstStep the global index of this chunk's first animation step across the whole task.
/// @param nSteps the number of animation steps (and scenes counted for progress) in this chunk.
public record TemporalChunk (int index, List<DateRange> ranges, int firstStep, int nSteps) {

    public TemporalChunk {
        checkArgument(!ranges.isEmpty(), "A temporal chunk must contain at least one date range.");
        checkArgument(nSteps > 0, "A temporal chunk must contain at least one step.");
        ranges = ImmutableList.copyOf(ranges);
    }

    /// The global step number of the given step within this chunk.
    public int globalStep (int localStep) {
        return firstStep + localStep;
    }

    public DateRange anchor () {
        return ranges.get(0);
    }

    public DateRange comparison () {
        return ranges.get(ranges.size() - 1);
    }

}
