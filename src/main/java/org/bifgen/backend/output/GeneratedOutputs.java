package org.bifgen.backend.output;

import org.bifgen.api.GenerationException;
import org.bifgen.api.GeneratorPaths;
import org.bifgen.backend.emit.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the three output files of a run.
 * <p>
 * A dependent build step must see either all artifacts or none, so every file this
 * object created is deleted again by {@link #discard(Throwable)} when the run fails.
 */
public final class GeneratedOutputs implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratedOutputs.class);

    private final Map<ArtifactKind, Path> created = new EnumMap<>(ArtifactKind.class);
    private final Map<ArtifactKind, Writer> open = new EnumMap<>(ArtifactKind.class);

    private GeneratedOutputs() {}

    /**
     * Creates (or truncates) all output files in artifact order.
     *
     * @param paths The paths of the run.
     * @return The open outputs.
     * @throws GenerationException with the artifact's "not creatable" code if a file cannot
     *                             be created; files created before it are removed again.
     */
    public static GeneratedOutputs create(GeneratorPaths paths) throws GenerationException {
        GeneratedOutputs outputs = new GeneratedOutputs();
        for (ArtifactKind kind : ArtifactKind.values()) {
            Path path = kind.pathIn(paths);
            try {
                outputs.open.put(kind, Files.newBufferedWriter(path, StandardCharsets.UTF_8));
                outputs.created.put(kind, path);
            } catch (IOException e) {
                GenerationException failure = new GenerationException(kind.notCreatableCode(),
                        "Cannot open " + kind.label() + " file '" + path + "' for output", e);
                outputs.discard(failure);
                throw failure;
            }
        }
        return outputs;
    }

    /**
     * @param kind The artifact.
     * @return The open writer of the artifact.
     * @throws IllegalStateException if the artifact has already been finished or discarded.
     */
    public Writer writer(ArtifactKind kind) {
        Writer writer = open.get(kind);
        if (writer == null) {
            throw new IllegalStateException("No open output for " + kind.label());
        }
        return writer;
    }

    /**
     * @param kind The artifact.
     * @return The path of the artifact, if it has been created.
     */
    public Path path(ArtifactKind kind) {
        return created.get(kind);
    }

    /**
     * Flushes and closes an artifact once it has been written completely.
     * @param kind The artifact.
     * @throws IOException if flushing or closing fails.
     */
    public void finish(ArtifactKind kind) throws IOException {
        Writer writer = open.remove(kind);
        if (writer != null) {
            writer.close();
        }
    }

    /**
     * Closes and deletes every file created so far. Failures while doing so are
     * attached to {@code primary} as suppressed exceptions.
     *
     * @param primary The failure that aborts the run.
     */
    public void discard(Throwable primary) {
        for (Writer writer : open.values()) {
            try {
                writer.close();
            } catch (IOException e) {
                primary.addSuppressed(e);
            }
        }
        open.clear();
        for (Map.Entry<ArtifactKind, Path> entry : created.entrySet()) {
            try {
                Files.deleteIfExists(entry.getValue());
                LOG.debug("Removed {} output '{}'", entry.getKey().label(), entry.getValue());
            } catch (IOException e) {
                primary.addSuppressed(e);
            }
        }
        created.clear();
    }

    /**
     * Closes any artifact that has not been finished. Files are kept.
     * @throws IOException if closing fails.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Writer writer : open.values()) {
            try {
                writer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        open.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
