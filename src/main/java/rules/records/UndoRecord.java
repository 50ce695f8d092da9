package rules.records;

/**
 * Everything a simulated move overwrote, so it can be put back exactly.
 *
 * @param from          origin of the simulated move
 * @param moved         piece that stood on {@code from}
 * @param to            destination of the simulated move
 * @param captured      previous contents of {@code to}
 * @param sideSquare    en-passant victim square, or {@code null}
 * @param sideContents  previous contents of {@code sideSquare}, or {@code null}
 * @param priorKing     king coordinate before the simulation, or {@code null} if no king moved
 */
public record UndoRecord(
        Coord from,
        Square moved,
        Coord to,
        Square captured,
        Coord sideSquare,
        Square sideContents,
        Coord priorKing
) {}
