// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.ChunkMetadata;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/// The output of processing one geographic chunk for one temporal chunk. A chunk that intersected
/// no data has no ChunkResult at all (an empty Optional) rather than one with a null path.
public record ChunkResult (@Nonnull Path artifactPath, @Nonnull ChunkMetadata metadata, int geoChunkId,
                           int timeChunkId) { }
