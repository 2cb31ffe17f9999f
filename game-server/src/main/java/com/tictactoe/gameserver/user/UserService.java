package com.tictactoe.gameserver.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService implements UserCredentialService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    static final int MIN_PASSWORD_LENGTH = 6;

    private final AppUserRepository repository;
    private final PasswordEncoder passwordEncoder;

    public UserService(AppUserRepository repository, PasswordEncoder passwordEncoder) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public RegistrationResult registerUser(String username, String rawPassword) {
        if (!isAlphanumeric(username) || !isAlphanumeric(rawPassword)) {
            return RegistrationResult.NOT_ALPHANUMERIC;
        }
        if (rawPassword.length() < MIN_PASSWORD_LENGTH) {
            return RegistrationResult.PASSWORD_TOO_SHORT;
        }
        if (repository.existsByUsernameIgnoreCase(username)) {
            return RegistrationResult.DUPLICATE_USER;
        }

        AppUser saved = repository.save(new AppUser(username, passwordEncoder.encode(rawPassword)));
        log.info("Registered new user '{}'", saved.getUsername());
        return RegistrationResult.REGISTERED;
    }

    @Override
    @Transactional(readOnly = true)
    public CredentialCheck verifyCredentials(String username, String rawPassword) {
        if (username == null || rawPassword == null) {
            return CredentialCheck.UNKNOWN_USER;
        }
        return repository.findByUsername(username)
                .map(user -> passwordEncoder.matches(rawPassword, user.getPasswordHash())
                        ? CredentialCheck.ACCEPTED
                        : CredentialCheck.WRONG_PASSWORD)
                .orElse(CredentialCheck.UNKNOWN_USER);
    }

    private static boolean isAlphanumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ascii = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!ascii) {
                return false;
            }
        }
        return true;
    }
}
