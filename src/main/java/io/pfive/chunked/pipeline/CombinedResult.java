// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.analysis.ChunkMetadata;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/// The output of merging several chunk results, either all geographic chunks of one temporal
/// chunk or all temporal chunks of the task.
/// @param timeChunkId the temporal chunk merged, or for a merge across time the last one included.
public record CombinedResult (@Nonnull Path artifactPath, @Nonnull ChunkMetadata metadata, int timeChunkId) { }
