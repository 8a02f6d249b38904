package edu.brandeis.cosi103a.swiss.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.swiss.dutch.ForbiddenPairRegistrar;
import edu.brandeis.cosi103a.swiss.dutch.PlayerDataComputer;
import edu.brandeis.cosi103a.swiss.dutch.RankingEngine;
import edu.brandeis.cosi103a.swiss.tournament.BuildLimits;
import edu.brandeis.cosi103a.swiss.tournament.Color;
import edu.brandeis.cosi103a.swiss.tournament.MatchScore;
import edu.brandeis.cosi103a.swiss.tournament.Player;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PairingSnapshotWriterTest {

    private static Tournament playedTournament() {
        Tournament tournament = Tournament.builder(BuildLimits.DEFAULT)
            .expectedRounds(5)
            .addPlayer(new Player(0, 0, 1800))
            .addPlayer(new Player(1, 0, 1700))
            .addPlayer(new Player(2, 0, 0))
            .build();
        tournament.getPlayer(2).setAcceleration(1, 10);
        tournament.recordGame(0, 1, MatchScore.DRAW);
        tournament.completeRound();
        PlayerDataComputer.computePlayerData(tournament);
        RankingEngine.updateRanks(tournament);
        ForbiddenPairRegistrar.forbidRematches(tournament);
        return tournament;
    }

    @Test
    void write_producesExpectedStructure(@TempDir Path tempDir) throws Exception {
        PairingSnapshotWriter writer = new PairingSnapshotWriter(tempDir);

        Path file = writer.write(PairingSnapshot.of(playedTournament()));

        assertEquals(tempDir.resolve("pairing-round-02.json"), file);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList(), "Scratch file should be moved onto the snapshot");
        }

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals(2, json.get("round").asInt());
        assertEquals(5, json.get("expectedRounds").asInt());
        assertEquals("-", json.get("initialColor").asText());
        assertEquals(3, json.get("players").size());

        JsonNode top = json.get("players").get(0);
        assertEquals(0, top.get("id").asInt());
        assertEquals(5, top.get("scoreWithoutAcceleration").asInt());
        assertEquals("b", top.get("colorPreference").get("color").asText());
        assertTrue(top.get("colorPreference").get("strong").asBoolean());
        assertEquals(1, top.get("forbiddenOpponents").get(0).asInt());

        JsonNode accelerated = json.get("players").get(2);
        assertEquals(2, accelerated.get("id").asInt());
        assertEquals(10, accelerated.get("scoreWithAcceleration").asInt());
    }

    @Test
    void read_returnsWhatWasWritten(@TempDir Path tempDir) throws Exception {
        PairingSnapshotWriter writer = new PairingSnapshotWriter(tempDir);
        PairingSnapshot snapshot = PairingSnapshot.of(playedTournament());
        writer.write(snapshot);

        assertEquals(snapshot, writer.read(2));
    }

    @Test
    void write_replacesEarlierSnapshotOfTheSameRound(@TempDir Path tempDir) throws Exception {
        PairingSnapshotWriter writer = new PairingSnapshotWriter(tempDir);
        Tournament tournament = playedTournament();
        writer.write(PairingSnapshot.of(tournament));

        tournament.setInitialColor(Color.WHITE);
        PairingSnapshot updated = PairingSnapshot.of(tournament);
        writer.write(updated);

        assertEquals(updated, writer.read(2));
    }

    @Test
    void exists_isFalseBeforeWriting(@TempDir Path tempDir) {
        assertFalse(new PairingSnapshotWriter(tempDir.resolve("missing")).exists(1));
    }

    @Test
    void of_listsPlayersInRankOrderWithoutHoles() {
        Tournament tournament = Tournament.builder(BuildLimits.DEFAULT)
            .initialColor(Color.BLACK)
            .addPlayer(new Player(0, 5, 0))
            .addPlayer(new Player(2, 10, 0))
            .build();
        RankingEngine.updateRanks(tournament);

        PairingSnapshot snapshot = PairingSnapshot.of(tournament);

        assertEquals(2, snapshot.players().size());
        assertEquals(2, snapshot.players().get(0).id());
        assertEquals(0, snapshot.players().get(1).id());
        assertEquals(Color.BLACK, snapshot.initialColor());
    }
}
