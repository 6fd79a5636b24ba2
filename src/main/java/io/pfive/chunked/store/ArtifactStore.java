// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.store;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import io.pfive.chunked.raster.Raster;
import io.pfive.chunked.util.RandomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/// Temporary storage for the intermediate results of one task, in a directory named after the
/// task. Artifact names are derived only from chunk indexes, so a unit of work that is delivered
/// more than once overwrites its own earlier output rather than adding a new file. Every write
/// goes to a temporary file that is then moved into place, so readers only ever see complete
/// artifacts.
public class ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String KRYO_SUFFIX = ".kryo";
    private static final String PNG_SUFFIX = ".png";

    public static final String RECOMBINED_TIME = "recombined_time";

    private final Path directory;

    public ArtifactStore (Path tempRoot, String taskId) {
        // The directory is deleted recursively, so never let a malformed ID point it elsewhere.
        checkArgument(RandomId.validRandomStringId(taskId), "Invalid task ID.");
        this.directory = tempRoot.resolve(taskId);
    }

    public static String chunkKey (int geoChunk, int timeChunk) {
        return "chunk_" + geoChunk + "_" + timeChunk;
    }

    public static String animationKey (int geoChunk, int step) {
        return "animation_" + geoChunk + "_" + step;
    }

    public static String frameKey (int step) {
        return "animation_" + step;
    }

    public static String recombinedGeoKey (int timeChunk) {
        return "recombined_geo_" + timeChunk;
    }

    public Path directory () {
        return directory;
    }

    /// False once the task has been finalized or abandoned and its temporary storage removed.
    public boolean exists () {
        return Files.isDirectory(directory);
    }

    public void create () {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public Path path (String key) {
        return directory.resolve(key + KRYO_SUFFIX);
    }

    /// Where the rendered image for one animation step is written.
    public Path framePath (int step) {
        return directory.resolve(frameKey(step) + PNG_SUFFIX);
    }

    public Path write (String key, Raster raster) {
        Path target = path(key);
        try {
            File tempFile = File.createTempFile(key, ".tmp", directory.toFile());
            Serialization.write(tempFile, raster);
            Files.move(tempFile.toPath(), target, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return target;
    }

    public static Raster read (Path path) {
        return Serialization.read(path.toFile(), Raster.class);
    }

    public Optional<Raster> readIfExists (String key) {
        Path path = path(key);
        if (!Files.exists(path)) return Optional.empty();
        return Optional.of(read(path));
    }

    /// Remove the task's temporary directory and everything in it.
    public void deleteAll () {
        if (!exists()) return;
        try {
            MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
            LOG.info("Deleted temporary directory {}", directory);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

}
