package rules.interaction;

import static org.junit.jupiter.api.Assertions.*;
import static rules.interaction.InteractionMode.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import rules.interaction.InteractionMode.Event;

class InteractionModeTest {

    @Test
    void promotionRoundTrip() {
        InteractionMode m = GAMEPLAY.next(Event.PROMOTION_PENDING);
        assertEquals(PROMOTE_PAWN, m);
        assertEquals(PROMOTE_PAWN, m.next(Event.MOVE_APPLIED));
        assertEquals(GAMEPLAY, m.next(Event.PROMOTION_CHOSEN));
    }

    @Test
    void editingCycle() {
        InteractionMode m = GAMEPLAY.next(Event.ENTER_EDIT);
        assertEquals(EDIT_BOARD, m);
        m = m.next(Event.PIECE_CHOSEN);
        assertEquals(CHOOSE_COLOUR, m);
        assertEquals(CHOOSE_COLOUR, m.next(Event.LEAVE_EDIT));
        m = m.next(Event.COLOUR_CHOSEN);
        assertEquals(EDIT_BOARD, m);
        assertEquals(GAMEPLAY, m.next(Event.LEAVE_EDIT));
    }

    @Test
    void irrelevantEventsAreIgnored() {
        assertEquals(GAMEPLAY, GAMEPLAY.next(Event.COLOUR_CHOSEN));
        assertEquals(GAMEPLAY, GAMEPLAY.next(Event.MOVE_APPLIED));
        assertEquals(EDIT_BOARD, EDIT_BOARD.next(Event.PROMOTION_PENDING));
    }

    @ParameterizedTest
    @EnumSource(InteractionMode.class)
    void quitAlwaysExits(InteractionMode mode) {
        assertEquals(EXIT_GAME, mode.next(Event.QUIT));
    }

    @ParameterizedTest
    @EnumSource(Event.class)
    void exitIsAbsorbing(Event event) {
        assertEquals(EXIT_GAME, EXIT_GAME.next(event));
        assertTrue(EXIT_GAME.isTerminal());
    }
}
