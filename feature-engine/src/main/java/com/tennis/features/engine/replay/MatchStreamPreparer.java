package com.tennis.features.engine.replay;

import com.tennis.features.engine.model.Match;
import com.tennis.features.engine.model.RawMatch;
import com.tennis.features.engine.model.Surface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns upstream match records into the typed, date-ordered stream the replay expects.
 *
 * Bad rows are dropped with a warning and counted, never thrown. For a repeated
 * match id the first occurrence is kept.
 */
public class MatchStreamPreparer {

    private static final Logger log = LoggerFactory.getLogger(MatchStreamPreparer.class);

    public PreparedStream prepare(Collection<RawMatch> raw) {
        List<Match> matches = new ArrayList<>(raw.size());
        Set<String> seenIds = new HashSet<>();
        int dropped = 0;
        int duplicates = 0;

        for (RawMatch row : raw) {
            String reason = rejectReason(row);
            if (reason != null) {
                log.warn("Dropping match {}: {}", row != null ? row.matchId() : null, reason);
                dropped++;
                continue;
            }

            LocalDate date = parseDate(row.date());
            if (date == null) {
                log.warn("Dropping match {}: unparseable date '{}'", row.matchId(), row.date());
                dropped++;
                continue;
            }

            String matchId = row.matchId().trim();
            if (!seenIds.add(matchId)) {
                log.warn("Duplicate match id {}, keeping the first occurrence", matchId);
                duplicates++;
                continue;
            }

            matches.add(new Match(
                    matchId,
                    date,
                    Surface.resolve(row.surface(), row.tourneyName()),
                    row.winnerId(),
                    row.loserId(),
                    Match.countSets(row.score())));
        }

        // List.sort is stable, so same-day matches keep their source order
        matches.sort(Comparator.comparing(Match::date));

        log.info("Prepared {} matches ({} dropped, {} duplicates)", matches.size(), dropped, duplicates);
        return new PreparedStream(List.copyOf(matches), dropped, duplicates);
    }

    private String rejectReason(RawMatch row) {
        if (row == null) return "null record";
        if (row.matchId() == null || row.matchId().isBlank()) return "missing match id";
        if (row.date() == null || row.date().isBlank()) return "missing date";
        if (row.winnerId() == null) return "missing winner id";
        if (row.loserId() == null) return "missing loser id";
        if (row.winnerId().equals(row.loserId())) return "winner and loser are the same player";
        return null;
    }

    /**
     * Accepts {@code yyyy-MM-dd} and {@code yyyyMMdd}; a trailing time part is ignored.
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) return null;
        String value = text.trim();
        int timeStart = indexOfTime(value);
        if (timeStart > 0) {
            value = value.substring(0, timeStart);
        }
        try {
            if (value.length() == 8) {
                return LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE);
            }
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static int indexOfTime(String value) {
        int t = value.indexOf('T');
        if (t > 0) return t;
        return value.indexOf(' ');
    }
}
