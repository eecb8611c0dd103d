package com.attest.security.store;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Lookup and update of user accounts.
 *
 * <p>Implementations throw {@link StoreUnavailableException} when the backing store is down.
 */
public interface UserStore {

    /** Case-insensitive lookup by login email. */
    Optional<User> findUserByEmail(String email);

    Optional<User> findUserById(String userId);

    /** Stores the user, replacing any existing user with the same id. */
    User save(User user);

    /**
     * Applies {@code change} to the user's current stored version in one atomic step, so fields the
     * change leaves alone keep any value committed since the caller last read the user.
     *
     * <p>Exceptions thrown by {@code change} abort the update and propagate.
     *
     * @return the stored result, or empty when no user has the id
     */
    Optional<User> update(String userId, UnaryOperator<User> change);
}
