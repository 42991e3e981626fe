package chessdoc.records;

import chessdoc.contracts.Position;

/**
 * Outcome of decoding a FEN string: the position plus the two move counters.
 */
public record FenParseResult(Position position, int fiftyMoveClock, int fullMoveNumber) {}
