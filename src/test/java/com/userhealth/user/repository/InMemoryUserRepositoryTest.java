package com.userhealth.user.repository;

import com.userhealth.user.domain.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryUserRepositoryTest {

    private InMemoryUserRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUserRepository();
    }

    @Test
    void createAssignsSequentialIdsFromOne() {
        User ann = repository.create("Ann", "ann@x.com");
        User bob = repository.create("Bob", "bob@x.com");

        assertEquals(1, ann.getId());
        assertEquals(2, bob.getId());
        assertEquals("Ann", ann.getName());
        assertEquals("ann@x.com", ann.getEmail());
    }

    @Test
    void findById() {
        User ann = repository.create("Ann", "ann@x.com");

        assertEquals(ann, repository.findById(ann.getId()).orElseThrow());
        assertTrue(repository.findById(42).isEmpty());
    }

    @Test
    void findAllKeepsInsertionOrder() {
        assertTrue(repository.findAll().isEmpty());

        repository.create("Carol", "carol@x.com");
        repository.create("Ann", "ann@x.com");
        repository.create("Bob", "bob@x.com");

        List<String> names = repository.findAll().stream().map(User::getName).toList();
        assertEquals(List.of("Carol", "Ann", "Bob"), names);
    }

    @Test
    void findAllReturnsSnapshot() {
        repository.create("Ann", "ann@x.com");
        List<User> snapshot = repository.findAll();

        repository.create("Bob", "bob@x.com");

        assertEquals(1, snapshot.size());
        assertEquals(2, repository.size());
    }

    @Test
    void deleteRemovesOnce() {
        User ann = repository.create("Ann", "ann@x.com");

        assertTrue(repository.delete(ann.getId()));
        assertFalse(repository.delete(ann.getId()));
        assertTrue(repository.findById(ann.getId()).isEmpty());
        assertEquals(0, repository.size());
    }

    @Test
    void deleteUnknownId() {
        assertFalse(repository.delete(7));
    }

    @Test
    void idsAreNotReusedAfterDelete() {
        User first = repository.create("Ann", "ann@x.com");
        User second = repository.create("Bob", "bob@x.com");
        repository.delete(second.getId());
        repository.delete(first.getId());

        User third = repository.create("Carol", "carol@x.com");

        assertEquals(3, third.getId());
    }

    @Test
    void duplicateEmailsAreAllowed() {
        repository.create("Ann", "same@x.com");
        repository.create("Ann", "same@x.com");

        assertEquals(2, repository.size());
    }

    @Test
    void concurrentCreatesGetDistinctIds() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<List<Long>>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                tasks.add(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(repository.create("u" + worker + "-" + i, "u@x.com").getId());
                    }
                    return ids;
                });
            }

            Set<Long> ids = new HashSet<>();
            for (Future<List<Long>> future : pool.invokeAll(tasks)) {
                ids.addAll(future.get());
            }

            assertEquals(threads * perThread, ids.size());
            assertEquals(threads * perThread, repository.size());
            assertTrue(ids.contains(1L));
            assertTrue(ids.contains((long) threads * perThread));
        } finally {
            pool.shutdownNow();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
    }
}
