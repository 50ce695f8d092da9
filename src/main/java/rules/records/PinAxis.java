package rules.records;

import rules.constants.Direction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Line a pinned piece is confined to.
 *
 * @param towardKing   direction from the pinned piece to its king
 * @param awayFromKing direction from the pinned piece to the pinning slider
 */
public record PinAxis(Direction towardKing, Direction awayFromKing) {

    public PinAxis {
        if (towardKing.opposite() != awayFromKing) {
            throw new IllegalArgumentException(towardKing + " and " + awayFromKing + " are not opposite");
        }
    }

    public boolean contains(Direction d) {
        return d == towardKing || d == awayFromKing;
    }

    /** The subset of {@code moves} lying on this axis. */
    public Set<Direction> restrict(Set<Direction> moves) {
        EnumSet<Direction> kept = EnumSet.noneOf(Direction.class);
        for (Direction d : moves) if (contains(d)) kept.add(d);
        return kept;
    }
}
