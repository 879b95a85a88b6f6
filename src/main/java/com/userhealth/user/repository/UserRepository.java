package com.userhealth.user.repository;

import com.userhealth.user.domain.User;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for user records.
 * <p>Ids are assigned by the repository and are never reused.
 */
public interface UserRepository {

    /**
     * Stores a new user under the next sequential id.
     *
     * @param name  User name.
     * @param email User email.
     * @return The stored user.
     */
    User create(String name, String email);

    /**
     * Finds a user by id.
     *
     * @param id User id.
     * @return Optional of User.
     */
    Optional<User> findById(long id);

    /**
     * Lists all users in insertion order.
     *
     * @return Snapshot list, empty if none.
     */
    List<User> findAll();

    /**
     * Removes a user by id.
     *
     * @param id User id.
     * @return true if a user was removed.
     */
    boolean delete(long id);

    /**
     * Gets the number of stored users.
     *
     * @return Count.
     */
    int size();
}
