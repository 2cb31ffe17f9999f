package com.tictactoe.gameserver.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Text codec for the colon-delimited line protocol.
 * <p>
 * Inbound: one frame per line, keyword first, fields separated by {@code ':'}.
 * Outbound: {@link ServerEvent#frame()} plus a single {@code '\n'}.
 */
public final class ProtocolCodec {
    public static final char FIELD_SEPARATOR = ':';
    public static final String LINE_TERMINATOR = "\n";
    public static final int BOARD_CELLS = 9;

    private ProtocolCodec() {
    }

    /**
     * Decodes one line (without its newline). A trailing {@code '\r'} is
     * dropped and blank lines yield an empty result; fields are otherwise taken
     * as sent, spaces included.
     */
    public static Optional<Command> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String frame = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        String[] parts = frame.split(String.valueOf(FIELD_SEPARATOR), -1);
        String keyword = parts[0];
        String[] args = Arrays.copyOfRange(parts, 1, parts.length);

        Optional<CommandType> type = CommandType.fromKeyword(keyword);
        if (type.isEmpty()) {
            return Optional.of(new Command.Unknown(keyword));
        }
        Command command = switch (type.get()) {
            case LOGIN -> credentials(args)
                    ? new Command.Login(args[0], args[1])
                    : new Command.Malformed(CommandType.LOGIN);
            case REGISTER -> credentials(args)
                    ? new Command.Register(args[0], args[1])
                    : new Command.Malformed(CommandType.REGISTER);
            case ROOMLIST -> decodeRoomList(args);
            case CREATE -> args.length == 1
                    ? new Command.Create(args[0])
                    : new Command.Malformed(CommandType.CREATE);
            case JOIN -> decodeJoin(args);
            case PLACE -> decodePlace(args);
            case FORFEIT -> new Command.Forfeit();
        };
        return Optional.of(command);
    }

    public static String encode(ServerEvent event) {
        return event.frame() + LINE_TERMINATOR;
    }

    /**
     * Parses a server frame back into its event, as a client would.
     *
     * @throws ProtocolException if the frame is not a known server event
     */
    public static ServerEvent decodeEvent(String line) {
        if (line == null) {
            throw new ProtocolException("Empty frame");
        }
        String frame = line.endsWith(LINE_TERMINATOR) ? line.substring(0, line.length() - 1) : line;
        switch (frame) {
            case "GAMEEND":
                return new ServerEvent.GameAlreadyEnded();
            case "BADAUTH":
                return new ServerEvent.BadAuth();
            case "NOROOM":
                return new ServerEvent.NoRoom();
            case "Unknown command":
                return new ServerEvent.UnknownCommand();
            default:
                break;
        }
        String[] parts = frame.split(String.valueOf(FIELD_SEPARATOR), -1);
        try {
            if (parts.length >= 3 && "ACKSTATUS".equals(parts[1])) {
                return decodeAck(parts);
            }
            return switch (parts[0]) {
                case "BEGIN" -> {
                    expectFields(parts, 3);
                    yield new ServerEvent.Begin(parts[1], parts[2]);
                }
                case "INPROGRESS" -> {
                    expectFields(parts, 3);
                    yield new ServerEvent.InProgress(parts[1], parts[2]);
                }
                case "BOARDSTATUS" -> {
                    expectFields(parts, 2);
                    yield new ServerEvent.BoardStatus(board(parts[1]));
                }
                case "GAMEEND" -> decodeGameEnd(parts);
                default -> throw new ProtocolException("Unknown frame: " + frame);
            };
        } catch (NumberFormatException e) {
            throw new ProtocolException("Bad status code in frame: " + frame, e);
        }
    }

    private static boolean credentials(String[] args) {
        return args.length == 2 && !args[0].isBlank() && !args[1].isBlank();
    }

    private static Command decodeRoomList(String[] args) {
        if (args.length != 1) {
            return new Command.Malformed(CommandType.ROOMLIST);
        }
        return MembershipMode.parse(args[0])
                .<Command>map(Command.RoomList::new)
                .orElseGet(() -> new Command.Malformed(CommandType.ROOMLIST));
    }

    private static Command decodeJoin(String[] args) {
        if (args.length != 2) {
            return new Command.Malformed(CommandType.JOIN);
        }
        return MembershipMode.parse(args[1])
                .<Command>map(mode -> new Command.Join(args[0], mode))
                .orElseGet(() -> new Command.Malformed(CommandType.JOIN));
    }

    private static Command decodePlace(String[] args) {
        if (args.length != 2) {
            return new Command.Malformed(CommandType.PLACE);
        }
        Integer column = coordinate(args[0]);
        Integer row = coordinate(args[1]);
        if (column == null || row == null) {
            return new Command.Malformed(CommandType.PLACE);
        }
        return new Command.Place(column, row);
    }

    private static Integer coordinate(String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 && parsed <= 2 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static ServerEvent decodeAck(String[] parts) {
        CommandType command = CommandType.fromKeyword(parts[0])
                .orElseThrow(() -> new ProtocolException("Unknown ack keyword " + parts[0]));
        int code = Integer.parseInt(parts[2]);
        return switch (command) {
            case LOGIN -> new ServerEvent.LoginAck(AckStatus.fromCode(LoginStatus.class, code));
            case REGISTER -> new ServerEvent.RegisterAck(AckStatus.fromCode(RegisterStatus.class, code));
            case ROOMLIST -> {
                RoomListStatus status = AckStatus.fromCode(RoomListStatus.class, code);
                if (status != RoomListStatus.OK) {
                    yield ServerEvent.RoomListAck.invalidMode();
                }
                String names = parts.length > 3 ? String.join(String.valueOf(FIELD_SEPARATOR),
                        Arrays.copyOfRange(parts, 3, parts.length)) : "";
                yield ServerEvent.RoomListAck.of(names.isEmpty() ? List.of() : List.of(names.split(",")));
            }
            case CREATE -> new ServerEvent.CreateAck(AckStatus.fromCode(CreateStatus.class, code));
            case JOIN -> new ServerEvent.JoinAck(AckStatus.fromCode(JoinStatus.class, code));
            case PLACE -> new ServerEvent.PlaceAck(AckStatus.fromCode(PlaceStatus.class, code));
            case FORFEIT -> throw new ProtocolException("FORFEIT has no acknowledgement");
        };
    }

    private static ServerEvent decodeGameEnd(String[] parts) {
        if (parts.length < 3) {
            throw new ProtocolException("GAMEEND needs a board and an outcome");
        }
        GameEndKind kind = GameEndKind.fromCode(Integer.parseInt(parts[2]));
        String board = board(parts[1]);
        if (!kind.hasWinner()) {
            expectFields(parts, 3);
            return ServerEvent.GameEnd.draw(board);
        }
        expectFields(parts, 4);
        return new ServerEvent.GameEnd(board, kind, parts[3]);
    }

    private static String board(String value) {
        if (value.length() != BOARD_CELLS || !value.chars().allMatch(c -> c >= '0' && c <= '2')) {
            throw new ProtocolException("Board must be nine cells of 0, 1 or 2: " + value);
        }
        return value;
    }

    private static void expectFields(String[] parts, int count) {
        if (parts.length != count) {
            throw new ProtocolException(parts[0] + " expects " + count + " fields, got " + parts.length);
        }
    }
}
