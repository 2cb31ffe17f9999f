package com.tictactoe.gameserver.user;

/**
 * Credential store seen by the game server: checks a login attempt and
 * persists new accounts. The server never touches password hashes itself.
 */
public interface UserCredentialService {
    CredentialCheck verifyCredentials(String username, String rawPassword);
    RegistrationResult registerUser(String username, String rawPassword);

    enum CredentialCheck {
        ACCEPTED,
        UNKNOWN_USER,
        WRONG_PASSWORD
    }

    enum RegistrationResult {
        REGISTERED,
        DUPLICATE_USER,
        PASSWORD_TOO_SHORT,
        NOT_ALPHANUMERIC
    }
}
