package com.tictactoe.gameserver;

import com.tictactoe.gameserver.config.GameServerProperties;
import com.tictactoe.gameserver.nio.GameServer;
import com.tictactoe.gameserver.user.UserCredentialService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TicTacToeServerApplicationTests {

    @Autowired
    private GameServer gameServer;

    @Autowired
    private GameServerProperties properties;

    @Autowired
    private UserCredentialService credentialService;

    @Test
    void contextStartsGameServerWithConfiguredProperties() {
        assertThat(gameServer.isRunning()).isTrue();
        assertThat(properties.port()).isZero();
        assertThat(gameServer.getLocalPort()).isPositive();
        assertThat(properties.maxRooms()).isEqualTo(256);
        assertThat(properties.readBufferSize()).isEqualTo(8192);
    }

    @Test
    void credentialStoreIsBackedByTheDatabase() {
        assertThat(credentialService.registerUser("contextUser", "secret1"))
                .isEqualTo(UserCredentialService.RegistrationResult.REGISTERED);
        assertThat(credentialService.verifyCredentials("contextUser", "secret1"))
                .isEqualTo(UserCredentialService.CredentialCheck.ACCEPTED);
    }
}
