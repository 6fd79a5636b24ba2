// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.analysis;

import io.pfive.chunked.raster.CleanMask;
import io.pfive.chunked.raster.RasterCube;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/// Per-acquisition statistics travelling alongside a chunk's raster through recombination. The
/// pipeline never interprets these, it only combines them. Instances are immutable.
public final class ChunkMetadata {

    private static final ChunkMetadata EMPTY = new ChunkMetadata(new TreeMap<>());

    /// Keyed on ISO date, so keys sort chronologically.
    private final SortedMap<String, SceneSummary> scenes;

    private ChunkMetadata (SortedMap<String, SceneSummary> scenes) {
        this.scenes = Collections.unmodifiableSortedMap(scenes);
    }

    public static ChunkMetadata empty () {
        return EMPTY;
    }

    /// Count total and clean pixels for each time slice of the cube.
    public static ChunkMetadata forCube (RasterCube cube, CleanMask mask) {
        SortedMap<String, SceneSummary> scenes = new TreeMap<>();
        for (int t = 0; t < cube.nTimes(); t++) {
            String key = cube.dates.get(t).toString();
            SceneSummary summary = new SceneSummary(cube.grid.nElements(), mask.cleanCount(t));
            scenes.merge(key, summary, SceneSummary::plus);
        }
        return new ChunkMetadata(scenes);
    }

    /// Sum the counts for each date. Used across geographic chunks of one time chunk, which cover
    /// different pixels of the same acquisitions. Associative and commutative.
    public ChunkMetadata combineAdditive (ChunkMetadata other) {
        SortedMap<String, SceneSummary> combined = new TreeMap<>(scenes);
        other.scenes.forEach((key, summary) -> combined.merge(key, summary, SceneSummary::plus));
        return new ChunkMetadata(combined);
    }

    /// Replace the entries for any dates also present in the other metadata. Used across time
    /// chunks, which are expected to report disjoint dates. Not commutative: the argument wins.
    public ChunkMetadata overwriteWith (ChunkMetadata other) {
        SortedMap<String, SceneSummary> combined = new TreeMap<>(scenes);
        combined.putAll(other.scenes);
        return new ChunkMetadata(combined);
    }

    public SortedMap<String, SceneSummary> scenes () {
        return scenes;
    }

    public boolean isEmpty () {
        return scenes.isEmpty();
    }

    /// A representation suitable for JSON serialization in the task record.
    public Map<String, Object> toMap () {
        return new LinkedHashMap<>(scenes);
    }

    @Override
    public boolean equals (Object o) {
        return o instanceof ChunkMetadata other && scenes.equals(other.scenes);
    }

    @Override
    public int hashCode () {
        return scenes.hashCode();
    }

    @Override
    public String toString () {
        return "ChunkMetadata" + scenes;
    }
}
