package edu.brandeis.cosi103a.swiss.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.swiss.config.ObjectMapperFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores one {@code pairing-round-NN.json} per prepared round in a directory watched by
 * the pairing program. A reader never sees a half-written snapshot: the JSON goes to a
 * scratch file first and replaces the target in a single move.
 */
public class PairingSnapshotWriter {

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public PairingSnapshotWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = ObjectMapperFactory.create();
    }

    /**
     * @return the path of the snapshot, replacing any earlier one for the same round
     */
    public Path write(PairingSnapshot snapshot) throws IOException {
        Files.createDirectories(outputDir);
        Path target = pathFor(snapshot.round());
        replaceAtomically(target, snapshot);
        return target;
    }

    public PairingSnapshot read(int round) throws IOException {
        return objectMapper.readValue(pathFor(round).toFile(), PairingSnapshot.class);
    }

    public boolean exists(int round) {
        return Files.exists(pathFor(round));
    }

    private void replaceAtomically(Path target, Object value) throws IOException {
        Path scratch = Files.createTempFile(outputDir, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(scratch.toFile(), value);
            Files.move(scratch, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(scratch);
            throw e;
        }
    }

    private Path pathFor(int round) {
        return outputDir.resolve(String.format("pairing-round-%02d.json", round));
    }
}
