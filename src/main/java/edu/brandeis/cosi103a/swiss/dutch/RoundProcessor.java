package edu.brandeis.cosi103a.swiss.dutch;

import edu.brandeis.cosi103a.swiss.snapshot.PairingSnapshot;
import edu.brandeis.cosi103a.swiss.snapshot.PairingSnapshotWriter;
import edu.brandeis.cosi103a.swiss.tournament.Match;
import edu.brandeis.cosi103a.swiss.tournament.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the per-round steps in order: results are recorded, then player data, ranks and
 * rematch restrictions are derived for the next round. Each step reads what the previous
 * one wrote, so they are never reordered.
 */
public class RoundProcessor {

    private static final Logger log = LoggerFactory.getLogger(RoundProcessor.class);

    private final Optional<PairingSnapshotWriter> snapshotWriter;

    public RoundProcessor() {
        this.snapshotWriter = Optional.empty();
    }

    /**
     * @param snapshotWriter receives the snapshot of every prepared round
     */
    public RoundProcessor(PairingSnapshotWriter snapshotWriter) {
        this.snapshotWriter = Optional.of(snapshotWriter);
    }

    /**
     * Records the results of the round being played and closes it. Participants missing
     * from {@code results} are recorded as not paired. If any result is rejected, nothing
     * is recorded.
     *
     * @param results each player's match, keyed by player id
     */
    public void recordRound(Tournament tournament, Map<Integer, Match> results) {
        int round = tournament.getPlayedRounds() + 1;
        tournament.recordRound(results);
        log.info("Recorded {} results for round {}", results.size(), round);
    }

    /**
     * Derives everything the pairing algorithm needs for the next round.
     *
     * @return the snapshot handed to the pairing algorithm
     * @throws IOException if the snapshot cannot be written
     */
    public PairingSnapshot prepareRound(Tournament tournament) throws IOException {
        int round = tournament.getPlayedRounds() + 1;
        log.info("Preparing round {} of {}", round, tournament.getExpectedRounds());

        PlayerDataComputer.computePlayerData(tournament);
        RankingEngine.updateRanks(tournament);
        ForbiddenPairRegistrar.forbidRematches(tournament);

        PairingSnapshot snapshot = PairingSnapshot.of(tournament);
        if (snapshotWriter.isPresent()) {
            log.info("Wrote pairing snapshot {}", snapshotWriter.get().write(snapshot));
        }
        return snapshot;
    }
}
