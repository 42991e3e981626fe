package chessdoc.records;

/**
 * A point in a PGN text.
 *
 * @param pos       0-based character index
 * @param lineIndex 1-based line number
 */
public record StreamLocation(int pos, int lineIndex) {}
