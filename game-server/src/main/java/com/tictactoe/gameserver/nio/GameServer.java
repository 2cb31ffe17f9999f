package com.tictactoe.gameserver.nio;

import com.tictactoe.gameserver.protocol.ProtocolCodec;
import com.tictactoe.gameserver.protocol.ServerEvent;
import com.tictactoe.gameserver.protocol.ServerEventSink;
import com.tictactoe.gameserver.room.RoomDirectory;
import com.tictactoe.gameserver.session.SessionRegistry;
import com.tictactoe.gameserver.user.UserCredentialService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded selector loop serving the game protocol. Every accept,
 * read, command and write runs on the {@code game-selector} thread, so room
 * and session state is only ever touched by one command at a time.
 */
public class GameServer implements Runnable, ServerEventSink {
    private static final Logger log = LoggerFactory.getLogger(GameServer.class);

    private final int port;
    private final int readBufferSize;
    private final int maxFrameLength;
    private final SessionRegistry sessions = new SessionRegistry();
    private final RoomDirectory rooms;
    private final CommandRouter router;

    private final Map<Long, Connection> connections = new HashMap<>();
    private final AtomicLong connectionIds = new AtomicLong();

    private volatile boolean running = false;
    private Selector selector;
    private ServerSocketChannel server;
    private Thread selectorThread;

    public GameServer(int port, int maxRooms, int readBufferSize, int maxFrameLength,
                      UserCredentialService credentialService) {
        this.port = port;
        this.readBufferSize = readBufferSize;
        this.maxFrameLength = maxFrameLength;
        this.rooms = new RoomDirectory(this, maxRooms);
        this.router = new CommandRouter(sessions, rooms, credentialService, this);
    }

    public synchronized void start() throws IOException {
        if (running) return;
        selector = Selector.open();
        server = ServerSocketChannel.open();
        server.configureBlocking(false);
        server.bind(new InetSocketAddress("0.0.0.0", port));
        server.register(selector, SelectionKey.OP_ACCEPT);
        running = true;
        selectorThread = new Thread(this, "game-selector");
        selectorThread.start();
        log.info("Game server listening on :{}", getLocalPort());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        selector.wakeup();
        try {
            if (selectorThread != null) selectorThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            server.close();
            selector.close();
        } catch (IOException e) {
            log.warn("Error closing listener: {}", e.getMessage());
        }
        log.info("Game server stopped");
    }

    @Override
    public void run() {
        try {
            while (running) {
                selector.select();
                var it = selector.selectedKeys().iterator();
                while (it.hasNext()) {
                    var key = it.next();
                    it.remove();
                    try {
                        if (!key.isValid()) continue;
                        if (key.isAcceptable()) onAccept();
                        else if (key.isReadable()) onRead(key);
                        if (key.isValid() && key.isWritable()) onWrite(key);
                    } catch (CancelledKeyException e) {
                        log.debug("Key cancelled while in use: {}", key.attachment());
                    } catch (IOException e) {
                        Connection c = (Connection) key.attachment();
                        if (c != null) disconnect(c, e.getMessage());
                    } catch (RuntimeException e) {
                        log.warn("Key error on {}", key.attachment(), e);
                        Connection c = (Connection) key.attachment();
                        if (c != null) disconnect(c, "error");
                    }
                }
            }
        } catch (ClosedSelectorException e) {
            log.debug("Selector closed");
        } catch (IOException e) {
            log.error("Selector loop crash", e);
        } finally {
            for (Connection c : new ArrayList<>(connections.values())) {
                disconnect(c, "shutdown");
            }
        }
    }

    private void onAccept() throws IOException {
        SocketChannel ch = server.accept();
        if (ch == null) return;
        ch.configureBlocking(false);
        SelectionKey key = ch.register(selector, SelectionKey.OP_READ);
        String remote = String.valueOf(ch.getRemoteAddress());
        Connection c = new Connection(connectionIds.incrementAndGet(), ch, key, readBufferSize, remote);
        connections.put(c.id, c);
        key.attach(c);
        router.connectionOpened(c.id, remote);
        log.info("Accepted {}", c);
    }

    private void onRead(SelectionKey key) throws IOException {
        Connection c = (Connection) key.attachment();

        int n = c.ch.read(c.readBuf);
        if (n == -1) {
            disconnect(c, "EOF");
            return;
        }
        if (n == 0) return;

        c.readBuf.flip();
        // UTF-8 never yields more chars than bytes.
        CharBuffer chars = CharBuffer.allocate(c.readBuf.remaining());
        c.decoder.decode(c.readBuf, chars, false);
        chars.flip();
        c.lineBuffer.append(chars);
        c.readBuf.compact();

        int idx;
        while ((idx = c.lineBuffer.indexOf("\n")) >= 0) {
            String line = c.lineBuffer.substring(0, idx);
            c.lineBuffer.delete(0, idx + 1);
            ProtocolCodec.decode(line).ifPresent(command -> router.route(c.id, command));
            if (!c.key.isValid()) return;
        }
        if (c.lineBuffer.length() > maxFrameLength) {
            log.warn("Frame from {} exceeds {} characters", c, maxFrameLength);
            disconnect(c, "frame too long");
        }
    }

    private void onWrite(SelectionKey key) throws IOException {
        Connection c = (Connection) key.attachment();
        while (true) {
            ByteBuffer buf = c.writeQueue.peek();
            if (buf == null) break;
            c.ch.write(buf);
            if (buf.hasRemaining()) break;
            c.writeQueue.poll();
        }
        if (c.writeQueue.isEmpty()) {
            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
        }
    }

    /**
     * Queues {@code event} for the connection; a connection that has already
     * gone is skipped.
     */
    @Override
    public void send(long connectionId, ServerEvent event) {
        Connection c = connections.get(connectionId);
        if (c == null) {
            log.debug("Dropping {} for closed connection {}", event.frame(), connectionId);
            return;
        }
        c.enqueue(StandardCharsets.UTF_8.encode(ProtocolCodec.encode(event)));
    }

    private void disconnect(Connection c, String reason) {
        if (connections.remove(c.id) == null) return;
        String who = sessions.usernameOf(c.id).orElse(c.toString());
        try {
            router.connectionClosed(c.id);
        } finally {
            c.key.cancel();
            try {
                c.ch.close();
            } catch (IOException e) {
                log.debug("Error closing {}: {}", c, e.getMessage());
            }
        }
        log.info("Disconnected {} ({})", who, reason);
    }

    public int getLocalPort() {
        try {
            return ((InetSocketAddress) server.getLocalAddress()).getPort();
        } catch (IOException e) {
            throw new IllegalStateException("Listener is not bound", e);
        }
    }

    public boolean isRunning() {
        return running;
    }
}
