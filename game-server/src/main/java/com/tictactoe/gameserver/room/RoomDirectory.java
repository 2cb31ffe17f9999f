package com.tictactoe.gameserver.room;

import com.tictactoe.gameserver.protocol.MembershipMode;
import com.tictactoe.gameserver.protocol.ServerEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Room name to {@link Room}. Names are kept in lexicographic order so listings
 * are deterministic. Finished rooms remove themselves through the callback
 * handed to each room on creation.
 */
public class RoomDirectory {
    private static final Logger log = LoggerFactory.getLogger(RoomDirectory.class);
    public static final int DEFAULT_MAX_ROOMS = 256;
    public static final int MAX_NAME_LENGTH = 20;
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_\\- ]{1," + MAX_NAME_LENGTH + "}");

    private final NavigableMap<String, Room> rooms = new TreeMap<>();
    private final ServerEventSink sink;
    private final int maxRooms;

    public RoomDirectory(ServerEventSink sink) {
        this(sink, DEFAULT_MAX_ROOMS);
    }

    public RoomDirectory(ServerEventSink sink, int maxRooms) {
        if (maxRooms < 1) {
            throw new IllegalArgumentException("maxRooms must be positive");
        }
        this.sink = sink;
        this.maxRooms = maxRooms;
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Creates a room seating {@code connectionId} as its first player.
     *
     * @throws RoomCreationException if the name is invalid or taken, or the directory is full
     */
    public Room create(String name, long connectionId, String username) {
        if (!isValidName(name)) {
            throw new RoomCreationException(RoomCreationException.Reason.INVALID_NAME, "Invalid room name: " + name);
        }
        if (rooms.containsKey(name)) {
            throw new RoomCreationException(RoomCreationException.Reason.DUPLICATE_NAME, "Room already exists: " + name);
        }
        if (rooms.size() >= maxRooms) {
            throw new RoomCreationException(RoomCreationException.Reason.DIRECTORY_FULL,
                    "Room limit of " + maxRooms + " reached");
        }
        Room room = new Room(name, sink, this::onRoomFinished);
        rooms.put(name, room);
        room.addPlayer(connectionId, username);
        log.info("Room '{}' created by {}", name, username);
        return room;
    }

    /**
     * PLAYER lists rooms still recruiting (fewer than two players); VIEWER lists every room.
     */
    public List<String> list(MembershipMode mode) {
        List<String> names = new ArrayList<>();
        for (Room room : rooms.values()) {
            if (mode == MembershipMode.VIEWER || !room.isFull()) {
                names.add(room.getName());
            }
        }
        return names;
    }

    public Optional<Room> find(String name) {
        return Optional.ofNullable(rooms.get(name));
    }

    /** The room in which {@code connectionId} holds a player seat, if any. */
    public Optional<Room> findContaining(long connectionId) {
        for (Room room : rooms.values()) {
            if (room.hasPlayer(connectionId)) {
                return Optional.of(room);
            }
        }
        return Optional.empty();
    }

    /** Drops {@code connectionId} from every room it is viewing. */
    public int removeViewer(long connectionId) {
        int removed = 0;
        for (Room room : rooms.values()) {
            if (room.removeViewer(connectionId)) {
                removed++;
            }
        }
        return removed;
    }

    public void remove(String name) {
        if (rooms.remove(name) != null) {
            log.info("Room '{}' removed", name);
        }
    }

    public int size() {
        return rooms.size();
    }

    public int getMaxRooms() {
        return maxRooms;
    }

    private void onRoomFinished(Room room) {
        // Only drop the entry if it is still this room instance.
        rooms.remove(room.getName(), room);
        log.debug("Room '{}' left the directory ({} remaining)", room.getName(), rooms.size());
    }
}
