package com.tictactoe.gameserver.protocol;

/**
 * A decoded client frame. Every variant hands itself to the matching
 * {@link Handler} method, so a new command cannot be added without the
 * router implementing it.
 */
public sealed interface Command permits
        Command.Login,
        Command.Register,
        Command.RoomList,
        Command.Create,
        Command.Join,
        Command.Place,
        Command.Forfeit,
        Command.Malformed,
        Command.Unknown {

    boolean requiresAuth();

    void dispatchTo(long connectionId, Handler handler);

    interface Handler {
        void onLogin(long connectionId, Login command);
        void onRegister(long connectionId, Register command);
        void onRoomList(long connectionId, RoomList command);
        void onCreate(long connectionId, Create command);
        void onJoin(long connectionId, Join command);
        void onPlace(long connectionId, Place command);
        void onForfeit(long connectionId, Forfeit command);
        void onMalformed(long connectionId, Malformed command);
        void onUnknown(long connectionId, Unknown command);
    }

    record Login(String username, String password) implements Command {
        @Override public boolean requiresAuth() { return false; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onLogin(connectionId, this); }
    }

    record Register(String username, String password) implements Command {
        @Override public boolean requiresAuth() { return false; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onRegister(connectionId, this); }
    }

    record RoomList(MembershipMode mode) implements Command {
        @Override public boolean requiresAuth() { return true; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onRoomList(connectionId, this); }
    }

    record Create(String roomName) implements Command {
        @Override public boolean requiresAuth() { return true; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onCreate(connectionId, this); }
    }

    record Join(String roomName, MembershipMode mode) implements Command {
        @Override public boolean requiresAuth() { return true; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onJoin(connectionId, this); }
    }

    /**
     * Zero-based column and row, both already checked to lie in [0,2].
     */
    record Place(int column, int row) implements Command {
        @Override public boolean requiresAuth() { return true; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onPlace(connectionId, this); }
    }

    record Forfeit() implements Command {
        @Override public boolean requiresAuth() { return true; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onForfeit(connectionId, this); }
    }

    /** A known keyword whose fields did not have the expected shape. */
    record Malformed(CommandType type) implements Command {
        @Override public boolean requiresAuth() { return type.requiresAuth(); }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onMalformed(connectionId, this); }
    }

    record Unknown(String keyword) implements Command {
        @Override public boolean requiresAuth() { return false; }
        @Override public void dispatchTo(long connectionId, Handler handler) { handler.onUnknown(connectionId, this); }
    }
}
