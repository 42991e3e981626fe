package chessdoc.records;

import chessdoc.constants.PgnConstants;

/**
 * Options for the PGN writer.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param withPlyCount add a {@code [PlyCount "n"]} header with the number of half-moves of the main line
 * @param lineWidth    column at which move-text lines are soft-wrapped
 */
public record PgnWriteOptions(boolean withPlyCount, int lineWidth) {

    public PgnWriteOptions {
        if (lineWidth < 1) {
            throw new IllegalArgumentException("Line width must be positive: " + lineWidth);
        }
    }

    public static PgnWriteOptions defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private boolean withPlyCount = false;
        private int lineWidth = PgnConstants.LINE_WIDTH;

        public Builder withPlyCount(boolean withPlyCount) { this.withPlyCount = withPlyCount; return this; }
        public Builder lineWidth(int lineWidth) { this.lineWidth = lineWidth; return this; }

        public PgnWriteOptions build() {
            return new PgnWriteOptions(withPlyCount, lineWidth);
        }
    }
}
