package com.tictactoe.gameserver.nio;

import com.tictactoe.gameserver.config.GameServerProperties;
import com.tictactoe.gameserver.user.UserCredentialService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class GameServerStarter {
    private final GameServerProperties properties;
    private final UserCredentialService credentialService;

    public GameServerStarter(GameServerProperties properties, UserCredentialService credentialService) {
        this.properties = properties;
        this.credentialService = credentialService;
    }

    @Bean(destroyMethod = "stop")
    public GameServer gameServer() throws IOException {
        GameServer server = new GameServer(
                properties.port(),
                properties.maxRooms(),
                properties.readBufferSize(),
                properties.maxFrameLength(),
                credentialService);
        server.start();
        return server;
    }
}
