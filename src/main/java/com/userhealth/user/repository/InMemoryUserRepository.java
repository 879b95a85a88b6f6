package com.userhealth.user.repository;

import com.userhealth.user.domain.User;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of UserRepository.
 * <p>This implementation does not persist data and is lost on application restart.
 * <p>Uses a {@link LinkedHashMap} guarded by a {@link ReentrantLock} so listing keeps insertion order
 * and concurrent creates never share an id.
 */
public class InMemoryUserRepository implements UserRepository {
    private static final Logger log = LogManager.getLogger(InMemoryUserRepository.class);

    private final Map<Long, User> users = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Last issued id. Only grows, deletions do not rewind it.
     */
    private long lastId = 0;

    @Override
    public User create(String name, String email) {
        lock.lock();
        try {
            User user = new User(lastId + 1, name, email);
            users.put(user.getId(), user);
            lastId = user.getId();
            log.debug("Stored user: id={}, total={}", user.getId(), users.size());
            return user;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<User> findById(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(users.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<User> findAll() {
        lock.lock();
        try {
            return new ArrayList<>(users.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(long id) {
        lock.lock();
        try {
            boolean removed = users.remove(id) != null;
            if (removed) {
                log.debug("Removed user: id={}, total={}", id, users.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return users.size();
        } finally {
            lock.unlock();
        }
    }
}
