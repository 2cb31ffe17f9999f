package com.tictactoe.gameserver.user;

import com.tictactoe.gameserver.user.UserCredentialService.CredentialCheck;
import com.tictactoe.gameserver.user.UserCredentialService.RegistrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class UserServiceTest {

    @Autowired
    private AppUserRepository repository;

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(repository, new BCryptPasswordEncoder(4));
    }

    @Test
    void registeredUserCanLogIn() {
        assertThat(userService.registerUser("alice", "secret1")).isEqualTo(RegistrationResult.REGISTERED);

        assertThat(userService.verifyCredentials("alice", "secret1")).isEqualTo(CredentialCheck.ACCEPTED);
        assertThat(userService.verifyCredentials("alice", "secret2")).isEqualTo(CredentialCheck.WRONG_PASSWORD);
        assertThat(userService.verifyCredentials("bob", "secret1")).isEqualTo(CredentialCheck.UNKNOWN_USER);
    }

    @Test
    void passwordIsStoredHashed() {
        userService.registerUser("alice", "secret1");

        AppUser stored = repository.findByUsername("alice").orElseThrow();
        assertThat(stored.getPasswordHash()).isNotEqualTo("secret1").startsWith("$2");
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    void duplicateUsernameIsRejectedRegardlessOfCase() {
        userService.registerUser("alice", "secret1");

        assertThat(userService.registerUser("alice", "another1")).isEqualTo(RegistrationResult.DUPLICATE_USER);
        assertThat(userService.registerUser("ALICE", "another1")).isEqualTo(RegistrationResult.DUPLICATE_USER);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void passwordMustBeAtLeastSixCharacters() {
        assertThat(userService.registerUser("alice", "abc12")).isEqualTo(RegistrationResult.PASSWORD_TOO_SHORT);
        assertThat(userService.registerUser("alice", "abc123")).isEqualTo(RegistrationResult.REGISTERED);
    }

    @Test
    void usernameAndPasswordMustBeAlphanumeric() {
        assertThat(userService.registerUser("al ice", "secret1")).isEqualTo(RegistrationResult.NOT_ALPHANUMERIC);
        assertThat(userService.registerUser("alice", "secret-1")).isEqualTo(RegistrationResult.NOT_ALPHANUMERIC);
        assertThat(userService.registerUser("élodie", "secret1")).isEqualTo(RegistrationResult.NOT_ALPHANUMERIC);
        assertThat(repository.count()).isZero();
    }

    @Test
    void loginLookupIsCaseSensitive() {
        userService.registerUser("alice", "secret1");

        assertThat(userService.verifyCredentials("Alice", "secret1")).isEqualTo(CredentialCheck.UNKNOWN_USER);
    }
}
