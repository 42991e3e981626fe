package chessdoc.impl;

import chessdoc.contracts.Database;
import chessdoc.exceptions.InvalidPgnException;
import chessdoc.game.Game;
import chessdoc.records.StreamLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Database} over a PGN text. Construction only locates the games; each game is
 * decoded when it is accessed.
 */
public final class PgnDatabaseImpl implements Database {

    private static final Logger LOGGER = Logger.getLogger("PgnDatabaseImpl");

    private final String text;
    private final List<StreamLocation> gameLocations;
    private final PgnReaderImpl reader;

    PgnDatabaseImpl(String pgn, PgnReaderImpl reader) {
        this.reader = reader;
        PgnTokenStream stream = new PgnTokenStream(pgn);
        this.text = stream.text();
        List<StreamLocation> locations = new ArrayList<>();
        while (true) {
            StreamLocation location = stream.currentLocation();
            if (!stream.skipGame()) {
                break;
            }
            locations.add(location);
        }
        this.gameLocations = Collections.unmodifiableList(locations);
        LOGGER.fine(() -> "Found " + gameLocations.size() + " game(s) in " + text.length() + " characters of PGN");
    }

    @Override
    public int gameCount() {
        return gameLocations.size();
    }

    @Override
    public Game game(int gameIndex) {
        if (gameIndex < 0) {
            throw new IllegalArgumentException("Negative game index: " + gameIndex);
        }
        if (gameIndex >= gameLocations.size()) {
            throw new IndexOutOfBoundsException("Game index " + gameIndex + " out of range [0, " + gameLocations.size() + ")");
        }
        return reader.parseGame(new PgnTokenStream(text, gameLocations.get(gameIndex)));
    }

    @Override
    public Iterable<Game> games() {
        return this;
    }

    /** Iterates over the games that decode successfully; the others are logged and skipped. */
    @Override
    public Iterator<Game> iterator() {
        return new Iterator<>() {
            private int nextIndex = 0;
            private Game pending = advance();

            private Game advance() {
                while (nextIndex < gameLocations.size()) {
                    int index = nextIndex++;
                    try {
                        return game(index);
                    } catch (InvalidPgnException e) {
                        LOGGER.log(Level.WARNING, "Skipping game " + index + " (line " + e.lineNumber() + "): " + e.getMessage());
                    }
                }
                return null;
            }

            @Override
            public boolean hasNext() {
                return pending != null;
            }

            @Override
            public Game next() {
                if (pending == null) {
                    throw new NoSuchElementException();
                }
                Game result = pending;
                pending = advance();
                return result;
            }
        };
    }
}
