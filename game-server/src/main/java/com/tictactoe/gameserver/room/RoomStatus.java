package com.tictactoe.gameserver.room;

public enum RoomStatus {
    WAITING,
    IN_PROGRESS,
    FINISHED
}
