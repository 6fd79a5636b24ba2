// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.chunk;

import com.google.common.collect.ImmutableList;

import java.util.List;

/// The full set of geographic and temporal chunks for one task. Every pair of one geographic
/// chunk and one temporal chunk is an independent unit of work.
public record ChunkPlan (List<GeographicChunk> geoChunks, List<TemporalChunk> timeChunks) {

    public ChunkPlan {
        geoChunks = ImmutableList.copyOf(geoChunks);
        timeChunks = ImmutableList.copyOf(timeChunks);
    }

    public int totalSteps () {
        return timeChunks.stream().mapToInt(TemporalChunk::nSteps).sum();
    }

    /// The number of scenes the progress counter will reach when every unit has been processed.
    public int totalScenes () {
        return geoChunks.size() * totalSteps();
    }

    public int nUnits () {
        return geoChunks.size() * timeChunks.size();
    }
}
