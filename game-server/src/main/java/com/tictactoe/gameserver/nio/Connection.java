package com.tictactoe.gameserver.nio;

import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Live I/O state of one accepted socket, keyed by its connection id.
 */
class Connection {
    final long id;
    final SocketChannel ch;
    final SelectionKey key;
    final ByteBuffer readBuf;
    final StringBuilder lineBuffer = new StringBuilder(256);
    // Stateful; a multi-byte sequence cut by a read stays in readBuf until the rest arrives.
    final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    final Deque<ByteBuffer> writeQueue = new ArrayDeque<>();
    final String remoteAddress;

    Connection(long id, SocketChannel ch, SelectionKey key, int readBufferSize, String remoteAddress) {
        this.id = id;
        this.ch = ch;
        this.key = key;
        this.readBuf = ByteBuffer.allocate(readBufferSize);
        this.remoteAddress = remoteAddress;
    }

    void enqueue(ByteBuffer data) {
        writeQueue.add(data);
        if (key.isValid()) {
            key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
        }
    }

    @Override
    public String toString() {
        return "#" + id + " " + remoteAddress;
    }
}
