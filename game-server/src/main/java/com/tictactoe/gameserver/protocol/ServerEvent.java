package com.tictactoe.gameserver.protocol;

import java.util.List;
import java.util.Objects;

/**
 * An outbound frame. {@link #frame()} is the exact wire text without the
 * terminating newline, which {@link ProtocolCodec#encode(ServerEvent)} adds.
 */
public sealed interface ServerEvent permits
        ServerEvent.LoginAck,
        ServerEvent.RegisterAck,
        ServerEvent.RoomListAck,
        ServerEvent.CreateAck,
        ServerEvent.JoinAck,
        ServerEvent.PlaceAck,
        ServerEvent.Begin,
        ServerEvent.InProgress,
        ServerEvent.BoardStatus,
        ServerEvent.GameEnd,
        ServerEvent.GameAlreadyEnded,
        ServerEvent.BadAuth,
        ServerEvent.NoRoom,
        ServerEvent.UnknownCommand {

    String frame();

    private static String ack(CommandType command, AckStatus status) {
        return command.name() + ":ACKSTATUS:" + status.code();
    }

    record LoginAck(LoginStatus status) implements ServerEvent {
        @Override public String frame() { return ack(CommandType.LOGIN, status); }
    }

    record RegisterAck(RegisterStatus status) implements ServerEvent {
        @Override public String frame() { return ack(CommandType.REGISTER, status); }
    }

    record RoomListAck(RoomListStatus status, List<String> rooms) implements ServerEvent {
        public RoomListAck {
            Objects.requireNonNull(status, "status");
            rooms = rooms == null ? List.of() : List.copyOf(rooms);
        }

        public static RoomListAck of(List<String> rooms) {
            return new RoomListAck(RoomListStatus.OK, rooms);
        }

        public static RoomListAck invalidMode() {
            return new RoomListAck(RoomListStatus.INVALID_MODE, List.of());
        }

        @Override
        public String frame() {
            if (status != RoomListStatus.OK) {
                return ack(CommandType.ROOMLIST, status);
            }
            return ack(CommandType.ROOMLIST, status) + ":" + String.join(",", rooms);
        }
    }

    record CreateAck(CreateStatus status) implements ServerEvent {
        @Override public String frame() { return ack(CommandType.CREATE, status); }
    }

    record JoinAck(JoinStatus status) implements ServerEvent {
        @Override public String frame() { return ack(CommandType.JOIN, status); }
    }

    record PlaceAck(PlaceStatus status) implements ServerEvent {
        @Override public String frame() { return ack(CommandType.PLACE, status); }
    }

    record Begin(String firstPlayer, String secondPlayer) implements ServerEvent {
        @Override public String frame() { return "BEGIN:" + firstPlayer + ":" + secondPlayer; }
    }

    record InProgress(String currentTurn, String opponent) implements ServerEvent {
        @Override public String frame() { return "INPROGRESS:" + currentTurn + ":" + opponent; }
    }

    record BoardStatus(String board) implements ServerEvent {
        @Override public String frame() { return "BOARDSTATUS:" + board; }
    }

    /**
     * End of a match. {@code winner} is present for a win or a forfeit and absent for a draw.
     */
    record GameEnd(String board, GameEndKind kind, String winner) implements ServerEvent {
        public GameEnd {
            Objects.requireNonNull(board, "board");
            Objects.requireNonNull(kind, "kind");
            if (kind.hasWinner() != (winner != null)) {
                throw new IllegalArgumentException("winner must be given exactly when " + kind + " has one");
            }
        }

        public static GameEnd win(String board, String winner) {
            return new GameEnd(board, GameEndKind.WIN, winner);
        }

        public static GameEnd draw(String board) {
            return new GameEnd(board, GameEndKind.DRAW, null);
        }

        public static GameEnd forfeit(String board, String winner) {
            return new GameEnd(board, GameEndKind.FORFEIT, winner);
        }

        @Override
        public String frame() {
            String frame = "GAMEEND:" + board + ":" + kind.code();
            return winner == null ? frame : frame + ":" + winner;
        }
    }

    /** Sent in reply to an action on a room whose match already ended. */
    record GameAlreadyEnded() implements ServerEvent {
        @Override public String frame() { return "GAMEEND"; }
    }

    record BadAuth() implements ServerEvent {
        @Override public String frame() { return "BADAUTH"; }
    }

    record NoRoom() implements ServerEvent {
        @Override public String frame() { return "NOROOM"; }
    }

    record UnknownCommand() implements ServerEvent {
        @Override public String frame() { return "Unknown command"; }
    }
}
