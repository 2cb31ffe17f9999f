package com.tictactoe.gameserver.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tictactoe.server")
public record GameServerProperties(
        @DefaultValue("8081")
        int port,
        @Min(value = 1, message = "maxRooms must be positive")
        @DefaultValue("256")
        int maxRooms,
        @Min(value = 256, message = "readBufferSize must be at least 256 bytes")
        @DefaultValue("8192")
        int readBufferSize,
        @Min(value = 64, message = "maxFrameLength must be at least 64 characters")
        @DefaultValue("1024")
        int maxFrameLength
) {
    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65535;

    /** Port 0 asks the OS for an ephemeral port. */
    @AssertTrue(message = "port must be 0 or between 1024 and 65535")
    public boolean isPortValid() {
        return port == 0 || (port >= MIN_PORT && port <= MAX_PORT);
    }
}
