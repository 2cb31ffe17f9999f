package com.tictactoe.gameserver.nio;

import com.tictactoe.gameserver.protocol.*;
import com.tictactoe.gameserver.room.Room;
import com.tictactoe.gameserver.room.RoomCreationException;
import com.tictactoe.gameserver.room.RoomDirectory;
import com.tictactoe.gameserver.session.SessionRegistry;
import com.tictactoe.gameserver.user.UserCredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies decoded commands to the session registry and room directory and
 * answers the originating connection. Runs on the event loop thread only, one
 * command at a time.
 */
public class CommandRouter implements Command.Handler {
    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    private final SessionRegistry sessions;
    private final RoomDirectory rooms;
    private final UserCredentialService credentialService;
    private final ServerEventSink sink;

    public CommandRouter(SessionRegistry sessions,
                         RoomDirectory rooms,
                         UserCredentialService credentialService,
                         ServerEventSink sink) {
        this.sessions = sessions;
        this.rooms = rooms;
        this.credentialService = credentialService;
        this.sink = sink;
    }

    public void connectionOpened(long connectionId, String remoteAddress) {
        sessions.register(connectionId, remoteAddress);
    }

    /**
     * Cleans up after a lost connection: an in-progress match is forfeited,
     * a waiting room it created is abandoned, and it stops viewing any room.
     */
    public void connectionClosed(long connectionId) {
        rooms.findContaining(connectionId).ifPresent(room -> {
            log.info("Connection {} left room '{}' while {}", connectionId, room.getName(), room.getStatus());
            room.forfeit(connectionId);
        });
        rooms.removeViewer(connectionId);
        sessions.remove(connectionId);
    }

    public void route(long connectionId, Command command) {
        log.debug("Connection {} sent {}", connectionId, command.getClass().getSimpleName());
        if (command.requiresAuth() && !sessions.isAuthenticated(connectionId)) {
            reply(connectionId, new ServerEvent.BadAuth());
            return;
        }
        command.dispatchTo(connectionId, this);
    }

    @Override
    public void onLogin(long connectionId, Command.Login command) {
        LoginStatus status = switch (credentialService.verifyCredentials(command.username(), command.password())) {
            case ACCEPTED -> LoginStatus.OK;
            case UNKNOWN_USER -> LoginStatus.NO_SUCH_USER;
            case WRONG_PASSWORD -> LoginStatus.WRONG_PASSWORD;
        };
        if (status == LoginStatus.OK) {
            sessions.authenticate(connectionId, command.username());
        }
        reply(connectionId, new ServerEvent.LoginAck(status));
    }

    @Override
    public void onRegister(long connectionId, Command.Register command) {
        RegisterStatus status = switch (credentialService.registerUser(command.username(), command.password())) {
            case REGISTERED -> RegisterStatus.OK;
            case DUPLICATE_USER -> RegisterStatus.DUPLICATE_USER;
            case PASSWORD_TOO_SHORT -> RegisterStatus.PASSWORD_TOO_SHORT;
            case NOT_ALPHANUMERIC -> RegisterStatus.NOT_ALPHANUMERIC;
        };
        reply(connectionId, new ServerEvent.RegisterAck(status));
    }

    @Override
    public void onRoomList(long connectionId, Command.RoomList command) {
        reply(connectionId, ServerEvent.RoomListAck.of(rooms.list(command.mode())));
    }

    @Override
    public void onCreate(long connectionId, Command.Create command) {
        if (rooms.findContaining(connectionId).isPresent()) {
            reply(connectionId, new ServerEvent.CreateAck(CreateStatus.ALREADY_SEATED));
            return;
        }
        try {
            rooms.create(command.roomName(), connectionId, username(connectionId));
            reply(connectionId, new ServerEvent.CreateAck(CreateStatus.OK));
        } catch (RoomCreationException e) {
            log.debug("CREATE '{}' rejected: {}", command.roomName(), e.getMessage());
            reply(connectionId, new ServerEvent.CreateAck(switch (e.getReason()) {
                case INVALID_NAME -> CreateStatus.INVALID_NAME;
                case DUPLICATE_NAME -> CreateStatus.DUPLICATE_NAME;
                case DIRECTORY_FULL -> CreateStatus.DIRECTORY_FULL;
            }));
        }
    }

    @Override
    public void onJoin(long connectionId, Command.Join command) {
        Optional<Room> found = rooms.find(command.roomName());
        if (found.isEmpty()) {
            reply(connectionId, new ServerEvent.JoinAck(JoinStatus.NO_SUCH_ROOM));
            return;
        }
        Room room = found.get();
        if (room.isMember(connectionId)) {
            reply(connectionId, new ServerEvent.JoinAck(JoinStatus.ALREADY_JOINED));
            return;
        }
        if (command.mode() == MembershipMode.VIEWER) {
            reply(connectionId, new ServerEvent.JoinAck(JoinStatus.OK));
            room.addViewer(connectionId);
            return;
        }
        if (room.isFull()) {
            reply(connectionId, new ServerEvent.JoinAck(JoinStatus.ROOM_FULL));
            return;
        }
        if (rooms.findContaining(connectionId).isPresent()) {
            reply(connectionId, new ServerEvent.JoinAck(JoinStatus.ALREADY_JOINED));
            return;
        }
        reply(connectionId, new ServerEvent.JoinAck(JoinStatus.OK));
        room.addPlayer(connectionId, username(connectionId));
    }

    @Override
    public void onPlace(long connectionId, Command.Place command) {
        rooms.findContaining(connectionId).ifPresentOrElse(
                room -> room.place(connectionId, command.column(), command.row()),
                () -> reply(connectionId, new ServerEvent.NoRoom()));
    }

    @Override
    public void onForfeit(long connectionId, Command.Forfeit command) {
        rooms.findContaining(connectionId).ifPresentOrElse(
                room -> room.forfeit(connectionId),
                () -> reply(connectionId, new ServerEvent.NoRoom()));
    }

    @Override
    public void onMalformed(long connectionId, Command.Malformed command) {
        log.warn("Malformed {} frame from connection {}", command.type(), connectionId);
        ServerEvent ack = switch (command.type()) {
            case LOGIN -> new ServerEvent.LoginAck(LoginStatus.MALFORMED);
            case REGISTER -> new ServerEvent.RegisterAck(RegisterStatus.MALFORMED);
            case ROOMLIST -> ServerEvent.RoomListAck.invalidMode();
            case CREATE -> new ServerEvent.CreateAck(CreateStatus.MALFORMED);
            case JOIN -> new ServerEvent.JoinAck(JoinStatus.INVALID_MODE);
            case PLACE -> new ServerEvent.PlaceAck(PlaceStatus.MALFORMED);
            case FORFEIT -> new ServerEvent.UnknownCommand();
        };
        reply(connectionId, ack);
    }

    @Override
    public void onUnknown(long connectionId, Command.Unknown command) {
        log.debug("Unknown command '{}' from connection {}", command.keyword(), connectionId);
        reply(connectionId, new ServerEvent.UnknownCommand());
    }

    private String username(long connectionId) {
        return sessions.usernameOf(connectionId)
                .orElseThrow(() -> new IllegalStateException("Connection " + connectionId + " is not logged in"));
    }

    private void reply(long connectionId, ServerEvent event) {
        sink.send(connectionId, event);
    }
}
