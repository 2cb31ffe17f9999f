package com.tictactoe.gameserver.room;

import com.tictactoe.gameserver.protocol.ServerEvent;
import com.tictactoe.gameserver.protocol.ServerEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

/**
 * One named match: up to two seated players, any number of viewers, and the
 * board they play on. A room moves WAITING -> IN_PROGRESS -> FINISHED and is
 * never reused once finished.
 * <p>
 * Not thread-safe. All calls are expected from the thread that owns the
 * {@link RoomDirectory}.
 */
public class Room {
    private static final Logger log = LoggerFactory.getLogger(Room.class);
    public static final int MAX_PLAYERS = 2;

    private final String name;
    private final ServerEventSink sink;
    private final Consumer<Room> onFinished;

    private final List<Seat> players = new ArrayList<>(MAX_PLAYERS);
    private final Set<Long> viewers = new LinkedHashSet<>();
    private final Board board = new Board();
    private Seat currentTurn;
    private RoomStatus status = RoomStatus.WAITING;

    Room(String name, ServerEventSink sink, Consumer<Room> onFinished) {
        this.name = name;
        this.sink = sink;
        this.onFinished = onFinished;
    }

    public void addPlayer(long connectionId, String username) {
        if (status != RoomStatus.WAITING || players.size() >= MAX_PLAYERS) {
            throw new IllegalStateException("Room '" + name + "' is not accepting players");
        }
        if (isMember(connectionId)) {
            throw new IllegalStateException("Connection " + connectionId + " is already in room '" + name + "'");
        }
        players.add(new Seat(connectionId, username));
        if (players.size() == MAX_PLAYERS) {
            currentTurn = players.get(0);
            status = RoomStatus.IN_PROGRESS;
            log.info("Room '{}' match begun: {} vs {}", name, players.get(0).username(), players.get(1).username());
            broadcast(new ServerEvent.Begin(players.get(0).username(), players.get(1).username()));
        }
    }

    public void addViewer(long connectionId) {
        if (status == RoomStatus.FINISHED) {
            throw new IllegalStateException("Room '" + name + "' is finished");
        }
        viewers.add(connectionId);
        if (status == RoomStatus.IN_PROGRESS) {
            sink.send(connectionId, new ServerEvent.InProgress(currentTurn.username(), opponentOf(currentTurn).username()));
        }
    }

    /**
     * Applies a move for {@code connectionId}. A move out of turn or before the
     * match has begun changes nothing and re-sends the current board to every
     * member. The turn holder's marker replaces whatever the cell held.
     */
    public void place(long connectionId, int column, int row) {
        if (status == RoomStatus.FINISHED) {
            sink.send(connectionId, new ServerEvent.GameAlreadyEnded());
            return;
        }
        if (!Board.inRange(column, row)) {
            throw new IllegalArgumentException("Cell out of range: column=" + column + ", row=" + row);
        }
        if (status != RoomStatus.IN_PROGRESS || currentTurn.connectionId() != connectionId) {
            log.debug("Room '{}' ignored move ({},{}) from connection {}", name, column, row, connectionId);
            broadcast(new ServerEvent.BoardStatus(board.encode()));
            return;
        }

        Seat mover = currentTurn;
        Marker marker = Marker.forSeat(players.indexOf(mover));
        board.place(column, row, marker);

        if (board.hasLine(marker)) {
            finish(ServerEvent.GameEnd.win(board.encode(), mover.username()));
        } else if (board.isFull()) {
            finish(ServerEvent.GameEnd.draw(board.encode()));
        } else {
            currentTurn = opponentOf(mover);
            broadcast(new ServerEvent.BoardStatus(board.encode()));
        }
    }

    /**
     * Concedes the match for {@code connectionId}; the other player wins. A
     * sole player forfeiting a room that never began abandons it instead.
     */
    public void forfeit(long connectionId) {
        if (status == RoomStatus.FINISHED) {
            sink.send(connectionId, new ServerEvent.GameAlreadyEnded());
            return;
        }
        Seat loser = seatOf(connectionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Connection " + connectionId + " is not a player in room '" + name + "'"));
        if (status == RoomStatus.WAITING) {
            log.info("Room '{}' abandoned by {} before the match began", name, loser.username());
            close();
            return;
        }
        finish(ServerEvent.GameEnd.forfeit(board.encode(), opponentOf(loser).username()));
    }

    public boolean removeViewer(long connectionId) {
        return viewers.remove(connectionId);
    }

    private void finish(ServerEvent.GameEnd outcome) {
        log.info("Room '{}' finished: {}", name, outcome.frame());
        broadcast(outcome);
        close();
    }

    private void close() {
        status = RoomStatus.FINISHED;
        currentTurn = null;
        players.clear();
        viewers.clear();
        onFinished.accept(this);
    }

    private void broadcast(ServerEvent event) {
        for (Seat seat : players) {
            sink.send(seat.connectionId(), event);
        }
        for (Long viewer : viewers) {
            sink.send(viewer, event);
        }
    }

    private Optional<Seat> seatOf(long connectionId) {
        return players.stream().filter(seat -> seat.connectionId() == connectionId).findFirst();
    }

    private Seat opponentOf(Seat seat) {
        return players.get(0).equals(seat) ? players.get(1) : players.get(0);
    }

    public String getName() {
        return name;
    }

    public RoomStatus getStatus() {
        return status;
    }

    public String boardState() {
        return board.encode();
    }

    public boolean isFull() {
        return players.size() == MAX_PLAYERS;
    }

    public int playerCount() {
        return players.size();
    }

    public boolean hasPlayer(long connectionId) {
        return seatOf(connectionId).isPresent();
    }

    public boolean hasViewer(long connectionId) {
        return viewers.contains(connectionId);
    }

    public boolean isMember(long connectionId) {
        return hasPlayer(connectionId) || hasViewer(connectionId);
    }

    public List<Seat> getPlayers() {
        return List.copyOf(players);
    }

    public Set<Long> getViewers() {
        return Set.copyOf(viewers);
    }

    public Optional<String> currentTurnUsername() {
        return Optional.ofNullable(currentTurn).map(Seat::username);
    }

    public record Seat(long connectionId, String username) {}
}
