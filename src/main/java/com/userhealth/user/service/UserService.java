package com.userhealth.user.service;

import com.userhealth.metrics.UserMetrics;
import com.userhealth.user.domain.User;
import com.userhealth.user.repository.UserRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * User operations on top of a {@link UserRepository}.
 *
 * <p>Validates create input before the store is touched so a rejected request never consumes an id.
 * <br>Name and email are trimmed; blank values are rejected. No format or uniqueness checks are applied.
 */
public class UserService {
    private static final Logger log = LogManager.getLogger(UserService.class);

    private final UserRepository repository;

    /**
     * Constructs a new UserService.
     *
     * @param repository Backing store.
     */
    public UserService(@NotNull UserRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /**
     * Creates a user.
     *
     * @param name  User name.
     * @param email User email.
     * @return Stored user.
     * @throws ValidationException If name or email is missing or blank.
     */
    public User create(String name, String email) throws ValidationException {
        String cleanName = name != null ? name.trim() : "";
        String cleanEmail = email != null ? email.trim() : "";

        if (cleanName.isEmpty() || cleanEmail.isEmpty()) {
            UserMetrics.incrementRejected();
            log.warn("Rejected user create: nameMissing={}, emailMissing={}", cleanName.isEmpty(), cleanEmail.isEmpty());
            throw new ValidationException("Provide valid 'name' and 'email'.");
        }

        User user = repository.create(cleanName, cleanEmail);
        UserMetrics.incrementCreated();
        log.info("Created user: id={}", user.getId());
        return user;
    }

    /**
     * Gets a user by id.
     *
     * @param id User id.
     * @return User.
     * @throws NotFoundException If no user has that id.
     */
    public User get(long id) throws NotFoundException {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException(id));
    }

    /**
     * Lists users in insertion order.
     *
     * @return List of users.
     */
    public List<User> list() {
        return repository.findAll();
    }

    /**
     * Deletes a user by id.
     *
     * @param id User id.
     * @throws NotFoundException If no user has that id.
     */
    public void delete(long id) throws NotFoundException {
        if (!repository.delete(id)) {
            throw new NotFoundException(id);
        }
        UserMetrics.incrementDeleted();
        log.info("Deleted user: id={}", id);
    }

    /**
     * Create request rejected due to missing or empty required fields.
     */
    public static class ValidationException extends Exception {

        /**
         * Constructs a new ValidationException.
         *
         * @param message Error message.
         */
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Operation referenced a user id absent from the store.
     */
    public static class NotFoundException extends Exception {
        private final long id;

        /**
         * Constructs a new NotFoundException.
         *
         * @param id Missing user id.
         */
        public NotFoundException(long id) {
            super("User not found");
            this.id = id;
        }

        /**
         * Gets the missing id.
         *
         * @return User id.
         */
        public long getId() {
            return id;
        }
    }
}
