package com.tictactoe.gameserver.room;

import com.tictactoe.gameserver.protocol.MembershipMode;
import com.tictactoe.gameserver.protocol.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomTest {
    private static final long ALICE = 1;
    private static final long BOB = 2;
    private static final long VIEWER = 3;
    private static final long CAROL = 4;

    private RecordingSink sink;
    private RoomDirectory directory;
    private Room room;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        directory = new RoomDirectory(sink);
        room = directory.create("Arena", ALICE, "alice");
    }

    private void startMatch() {
        room.addPlayer(BOB, "bob");
        sink.clear();
    }

    // ========== Joining ==========

    @Test
    void newRoomWaitsWithCreatorSeated() {
        assertThat(room.getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(room.playerCount()).isEqualTo(1);
        assertThat(room.isFull()).isFalse();
        assertThat(room.currentTurnUsername()).isEmpty();
        assertThat(sink.deliveries()).isEmpty();
    }

    @Test
    void secondPlayerStartsMatchAndFirstPlayerMovesFirst() {
        room.addViewer(VIEWER);
        room.addPlayer(BOB, "bob");

        assertThat(room.getStatus()).isEqualTo(RoomStatus.IN_PROGRESS);
        assertThat(room.isFull()).isTrue();
        assertThat(room.currentTurnUsername()).contains("alice");
        assertThat(sink.framesFor(ALICE)).containsExactly("BEGIN:alice:bob");
        assertThat(sink.framesFor(BOB)).containsExactly("BEGIN:alice:bob");
        assertThat(sink.framesFor(VIEWER)).containsExactly("BEGIN:alice:bob");
    }

    @Test
    void thirdPlayerIsRefused() {
        startMatch();
        assertThatThrownBy(() -> room.addPlayer(CAROL, "carol")).isInstanceOf(IllegalStateException.class);
        assertThat(room.playerCount()).isEqualTo(2);
    }

    @Test
    void lateViewerIsToldWhoseTurnItIs() {
        startMatch();
        room.place(ALICE, 0, 0);

        room.addViewer(VIEWER);

        assertThat(sink.framesFor(VIEWER)).containsExactly("INPROGRESS:bob:alice");
    }

    @Test
    void viewerOfWaitingRoomGetsNothingUntilBegin() {
        room.addViewer(VIEWER);
        assertThat(sink.framesFor(VIEWER)).isEmpty();
    }

    // ========== Moves ==========

    @Test
    void moveMarksOneCellAndPassesTurn() {
        startMatch();
        room.addViewer(VIEWER);
        sink.clear();

        room.place(ALICE, 0, 0);

        assertThat(room.boardState()).isEqualTo("100000000");
        assertThat(room.currentTurnUsername()).contains("bob");
        assertThat(sink.framesFor(ALICE)).containsExactly("BOARDSTATUS:100000000");
        assertThat(sink.framesFor(BOB)).containsExactly("BOARDSTATUS:100000000");
        assertThat(sink.framesFor(VIEWER)).containsExactly("BOARDSTATUS:100000000");

        room.place(BOB, 1, 1);

        assertThat(room.boardState()).isEqualTo("100020000");
        assertThat(room.currentTurnUsername()).contains("alice");
    }

    @ParameterizedTest
    @CsvSource({"0,0", "1,0", "2,0", "0,1", "1,1", "2,1", "0,2", "1,2", "2,2"})
    void everyCellIsAddressedByRowTimesThreePlusColumn(int column, int row) {
        startMatch();

        room.place(ALICE, column, row);

        String board = room.boardState();
        int index = row * 3 + column;
        assertThat(board.charAt(index)).isEqualTo('1');
        assertThat(board.replace("0", "")).isEqualTo("1");
        assertThat(room.currentTurnUsername()).contains("bob");
    }

    @Test
    void outOfTurnMoveIsIgnoredAndBoardRebroadcast() {
        startMatch();
        room.place(ALICE, 0, 0);
        sink.clear();

        room.place(ALICE, 1, 0);

        assertThat(room.boardState()).isEqualTo("100000000");
        assertThat(room.currentTurnUsername()).contains("bob");
        assertThat(sink.framesFor(ALICE)).containsExactly("BOARDSTATUS:100000000");
        assertThat(sink.framesFor(BOB)).containsExactly("BOARDSTATUS:100000000");
    }

    @Test
    void turnHolderOverwritesOccupiedCellAndPassesTurn() {
        startMatch();
        room.place(ALICE, 1, 1);
        sink.clear();

        room.place(BOB, 1, 1);

        assertThat(room.boardState()).isEqualTo("000020000");
        assertThat(room.currentTurnUsername()).contains("alice");
        assertThat(sink.framesFor(ALICE)).containsExactly("BOARDSTATUS:000020000");
        assertThat(sink.framesFor(BOB)).containsExactly("BOARDSTATUS:000020000");
    }

    @Test
    void overwritingCanCompleteALine() {
        startMatch();
        room.place(ALICE, 0, 0);
        room.place(BOB, 1, 0);
        room.place(ALICE, 2, 0);
        room.place(BOB, 0, 1);
        sink.clear();

        room.place(ALICE, 1, 0);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.FINISHED);
        assertThat(sink.framesFor(BOB)).containsExactly("GAMEEND:111200000:0:alice");
    }

    @Test
    void moveBeforeMatchBeginsChangesNothing() {
        room.place(ALICE, 0, 0);

        assertThat(room.boardState()).isEqualTo("000000000");
        assertThat(sink.framesFor(ALICE)).containsExactly("BOARDSTATUS:000000000");
    }

    // ========== Endings ==========

    @ParameterizedTest
    @CsvSource({
            // alice's three cells then bob's two filler cells, as column/row pairs
            "0,0, 1,0, 2,0, 0,1, 1,1",
            "0,1, 1,1, 2,1, 0,0, 1,0",
            "0,2, 1,2, 2,2, 0,0, 1,0",
            "0,0, 0,1, 0,2, 1,0, 1,1",
            "1,0, 1,1, 1,2, 0,0, 0,1",
            "2,0, 2,1, 2,2, 0,0, 0,1",
            "0,0, 1,1, 2,2, 1,0, 2,0",
            "2,0, 1,1, 0,2, 0,0, 1,0"
    })
    void completingAnyLineWins(int c1, int r1, int c2, int r2, int c3, int r3, int f1c, int f1r, int f2c, int f2r) {
        startMatch();
        room.addViewer(VIEWER);
        sink.clear();

        room.place(ALICE, c1, r1);
        room.place(BOB, f1c, f1r);
        room.place(ALICE, c2, r2);
        room.place(BOB, f2c, f2r);
        room.place(ALICE, c3, r3);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.FINISHED);
        String last = sink.lastFrameFor(VIEWER);
        assertThat(last).startsWith("GAMEEND:").endsWith(":0:alice");
        assertThat(sink.lastFrameFor(BOB)).isEqualTo(last);
        assertThat(directory.find("Arena")).isEmpty();
    }

    @Test
    void secondPlayerCanWinToo() {
        startMatch();
        room.place(ALICE, 0, 0);
        room.place(BOB, 0, 1);
        room.place(ALICE, 1, 0);
        room.place(BOB, 1, 1);
        room.place(ALICE, 2, 2);
        room.place(BOB, 2, 1);

        assertThat(sink.lastFrameFor(ALICE)).isEqualTo("GAMEEND:110222001:0:bob");
    }

    @Test
    void fullBoardWithoutLineIsDraw() {
        startMatch();
        // 1 2 1
        // 1 2 2
        // 2 1 1
        room.place(ALICE, 0, 0);
        room.place(BOB, 1, 0);
        room.place(ALICE, 2, 0);
        room.place(BOB, 1, 1);
        room.place(ALICE, 0, 1);
        room.place(BOB, 2, 1);
        room.place(ALICE, 1, 2);
        room.place(BOB, 0, 2);
        room.place(ALICE, 2, 2);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.FINISHED);
        assertThat(sink.lastFrameFor(ALICE)).isEqualTo("GAMEEND:121122211:1");
        assertThat(sink.lastFrameFor(BOB)).isEqualTo("GAMEEND:121122211:1");
    }

    @Test
    void forfeitDeclaresTheOtherPlayerWinner() {
        startMatch();
        room.addViewer(VIEWER);
        room.place(ALICE, 0, 0);
        sink.clear();

        room.forfeit(BOB);

        assertThat(sink.framesFor(ALICE)).containsExactly("GAMEEND:100000000:2:alice");
        assertThat(sink.framesFor(BOB)).containsExactly("GAMEEND:100000000:2:alice");
        assertThat(sink.framesFor(VIEWER)).containsExactly("GAMEEND:100000000:2:alice");
        assertThat(directory.size()).isZero();
    }

    @Test
    void forfeitByTurnHolderAlsoHandsWinToOpponent() {
        startMatch();

        room.forfeit(ALICE);

        assertThat(sink.lastFrameFor(ALICE)).isEqualTo("GAMEEND:000000000:2:bob");
    }

    @Test
    void finishedRoomClearsMembershipAndAnswersWithTerminalNotice() {
        startMatch();
        room.forfeit(ALICE);
        sink.clear();

        room.place(BOB, 0, 0);
        room.forfeit(BOB);

        assertThat(room.getPlayers()).isEmpty();
        assertThat(room.getViewers()).isEmpty();
        assertThat(sink.framesFor(BOB)).containsExactly("GAMEEND", "GAMEEND");
        assertThatThrownBy(() -> room.addViewer(VIEWER)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> room.addPlayer(CAROL, "carol")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void soleCreatorForfeitingAbandonsRoomQuietly() {
        room.addViewer(VIEWER);

        room.forfeit(ALICE);

        assertThat(room.getStatus()).isEqualTo(RoomStatus.FINISHED);
        assertThat(directory.list(MembershipMode.VIEWER)).isEmpty();
        assertThat(sink.deliveries()).isEmpty();
    }

    @Test
    void forfeitByNonPlayerIsRejected() {
        startMatch();
        assertThatThrownBy(() -> room.forfeit(VIEWER)).isInstanceOf(IllegalArgumentException.class);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.IN_PROGRESS);
    }

    @Test
    void removedViewerStopsReceivingBoards() {
        startMatch();
        room.addViewer(VIEWER);
        assertThat(room.removeViewer(VIEWER)).isTrue();
        sink.clear();

        room.place(ALICE, 2, 2);

        assertThat(sink.framesFor(VIEWER)).isEmpty();
    }
}
