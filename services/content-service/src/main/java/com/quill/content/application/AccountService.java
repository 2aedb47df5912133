package com.quill.content.application;

import com.quill.content.domain.ContentException;
import com.quill.content.domain.NewUser;
import com.quill.content.domain.User;
import com.quill.content.domain.UserPatch;
import com.quill.content.domain.UserStore;
import com.quill.content.domain.WriteResult;
import com.quill.observability.MetricFactory;
import com.quill.observability.SensitiveDataRedactor;
import com.quill.security.CallerIdentity;
import com.quill.security.HashRecord;
import com.quill.security.PasswordHasher;
import com.quill.security.TokenService;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registration, login and profile operations.
 *
 * <p>Register and login are the only ways to obtain a token. Both paths hash or verify through
 * {@link PasswordHasher} and mint through {@link TokenService}; the store never sees plaintext.
 *
 * <p>Login answers an unknown email and a wrong password identically, and verifies against a
 * throwaway hash when the email is unknown so both paths cost one BCrypt comparison.
 */
@Service
public class AccountService {

    static final String METRIC_AUTH_ATTEMPTS = "quill.auth.attempts";
    static final String METRIC_HASH_DURATION = "quill.auth.hash.duration";

    static final String INVALID_CREDENTIALS = "Invalid email or password";
    static final String EMAIL_TAKEN = "Email already registered";
    static final String USER_NOT_FOUND = "User not found";
    static final String PASSWORD_TOO_LONG =
            "password: must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes";

    private static final String METRIC_DESCRIPTION = "Register, login and profile update attempts";
    private static final String HASH_DESCRIPTION = "Time spent hashing and verifying passwords";

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserStore users;
    private final PasswordHasher hasher;
    private final TokenService tokens;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;
    private final HashRecord timingDecoy;

    public AccountService(
            UserStore users,
            PasswordHasher hasher,
            TokenService tokens,
            MetricFactory metrics,
            SensitiveDataRedactor redactor) {
        this.users = users;
        this.hasher = hasher;
        this.tokens = tokens;
        this.metrics = metrics;
        this.redactor = redactor;
        this.timingDecoy = hasher.hash("timing-decoy-" + System.nanoTime());
    }

    /**
     * Creates an account and logs it in.
     *
     * @throws ContentException {@code CONFLICT} if the email is already registered,
     *     {@code INVALID_INPUT} if the password is too long to hash in full
     */
    public AuthResult register(String name, String email, String password) {
        log.info("Registration attempt {}", redactor.fields("email", email, "password", password));
        requireHashable(password);
        WriteResult<User> result = users.create(new NewUser(name, email, timedHash(password)));
        if (!result.isOk()) {
            record("register", "conflict");
            throw ContentException.conflict(EMAIL_TAKEN);
        }
        User user = result.value();
        record("register", "success");
        log.info("User registered: userId={}", user.id());
        return new AuthResult(user, tokens.issue(user.id()));
    }

    /**
     * Verifies credentials and issues a token.
     *
     * @throws ContentException {@code UNAUTHENTICATED} for an unknown email or a wrong password
     */
    public AuthResult login(String email, String password) {
        User user = users.findByEmail(email).orElse(null);
        if (user == null) {
            timedVerify(password, timingDecoy);
            record("login", "failure");
            log.info("Login rejected: unknown email");
            throw ContentException.unauthenticated(INVALID_CREDENTIALS);
        }
        if (!timedVerify(password, user.passwordHash())) {
            record("login", "failure");
            log.info("Login rejected: bad password for userId={}", user.id());
            throw ContentException.unauthenticated(INVALID_CREDENTIALS);
        }
        if (hasher.needsRehash(user.passwordHash())) {
            user = rehash(user, password);
        }
        record("login", "success");
        log.info("Login succeeded: userId={}", user.id());
        return new AuthResult(user, tokens.issue(user.id()));
    }

    /**
     * Returns the caller's own account, read fresh from the store.
     */
    public User profile(CallerIdentity caller) {
        return users.findById(caller.userId())
                .orElseThrow(() -> ContentException.notFound(USER_NOT_FOUND));
    }

    /**
     * Changes any of the caller's name, email and password. Null arguments are left unchanged.
     *
     * @throws ContentException {@code CONFLICT} if the new email belongs to someone else,
     *     {@code NOT_FOUND} if the caller's account no longer exists, {@code INVALID_INPUT} if the
     *     new password is too long to hash in full
     */
    public User updateProfile(CallerIdentity caller, String name, String email, String password) {
        requireHashable(password);
        UserPatch patch = new UserPatch(name, email, password == null ? null : timedHash(password));
        if (patch.isEmpty()) {
            return profile(caller);
        }
        WriteResult<User> result = users.update(caller.userId(), patch);
        switch (result.status()) {
            case OK -> {
                record("update_profile", "success");
                log.info("Profile updated: userId={}, fields={}", caller.userId(),
                        redactor.fields("name", name, "email", email, "password", password));
                return result.value();
            }
            case CONFLICT -> {
                record("update_profile", "conflict");
                throw ContentException.conflict(EMAIL_TAKEN);
            }
            default -> throw ContentException.notFound(USER_NOT_FOUND);
        }
    }

    private User rehash(User user, String password) {
        WriteResult<User> result = users.update(user.id(), UserPatch.password(timedHash(password)));
        if (result.isOk()) {
            log.info("Upgraded password hash: userId={}, cost {} -> {}",
                    user.id(), user.passwordHash().cost(), hasher.strength());
            return result.value();
        }
        log.warn("Could not upgrade password hash: userId={}, status={}", user.id(), result.status());
        return user;
    }

    private static void requireHashable(String password) {
        if (password != null && !PasswordHasher.withinLength(password)) {
            throw ContentException.invalidInput(PASSWORD_TOO_LONG);
        }
    }

    private HashRecord timedHash(String password) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return hasher.hash(password);
        } finally {
            sample.stop(hashTimer("hash"));
        }
    }

    private boolean timedVerify(String password, HashRecord record) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            return hasher.verify(password, record);
        } finally {
            sample.stop(hashTimer("verify"));
        }
    }

    private Timer hashTimer(String operation) {
        return metrics.timer(
                METRIC_HASH_DURATION, HASH_DESCRIPTION, MetricFactory.TAG_OPERATION, operation);
    }

    private void record(String operation, String outcome) {
        metrics.recordOutcome(METRIC_AUTH_ATTEMPTS, METRIC_DESCRIPTION, operation, outcome);
    }
}
