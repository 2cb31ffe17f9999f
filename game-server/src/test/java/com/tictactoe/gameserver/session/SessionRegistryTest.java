package com.tictactoe.gameserver.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry();
    }

    @Test
    void newSessionIsAnonymous() {
        registry.register(1);

        assertThat(registry.isAuthenticated(1)).isFalse();
        assertThat(registry.usernameOf(1)).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void authenticateSetsUsername() {
        registry.register(1, "127.0.0.1:5000");

        registry.authenticate(1, "alice");

        assertThat(registry.isAuthenticated(1)).isTrue();
        assertThat(registry.usernameOf(1)).contains("alice");
        assertThat(registry.find(1).orElseThrow().remoteAddress()).isEqualTo("127.0.0.1:5000");
    }

    @Test
    void sessionsAreIndependent() {
        registry.register(1);
        registry.register(2);

        registry.authenticate(2, "bob");

        assertThat(registry.isAuthenticated(1)).isFalse();
        assertThat(registry.usernameOf(2)).contains("bob");
    }

    @Test
    void removeForgetsSession() {
        registry.register(1);
        registry.authenticate(1, "alice");

        registry.remove(1);

        assertThat(registry.isAuthenticated(1)).isFalse();
        assertThat(registry.find(1)).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void unknownConnectionCannotAuthenticate() {
        assertThatThrownBy(() -> registry.authenticate(42, "ghost")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void connectionIdsAreRegisteredOnce() {
        registry.register(1);
        assertThatThrownBy(() -> registry.register(1)).isInstanceOf(IllegalStateException.class);
    }
}
