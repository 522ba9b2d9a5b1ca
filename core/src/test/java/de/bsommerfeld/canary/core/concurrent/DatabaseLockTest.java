package de.bsommerfeld.canary.core.concurrent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseLockTest {

    @TempDir
    Path tempDir;

    @Test
    void acquire_shouldBeReentrantForOwningThread() throws IOException {
        DatabaseLock lock = new DatabaseLock(tempDir.resolve("canary.db"), 500);

        try (DatabaseLock.Handle outer = lock.acquire("outer")) {
            try (DatabaseLock.Handle inner = lock.acquire("inner")) {
                assertTrue(lock.isHeldByCurrentThread());
            }
            assertTrue(lock.isHeldByCurrentThread());
        }
        assertFalse(lock.isHeldByCurrentThread());
    }

    @Test
    void acquire_shouldTimeOutWhileAnotherThreadHoldsIt() throws Exception {
        DatabaseLock lock = new DatabaseLock(tempDir.resolve("canary.db"), 200);

        try (DatabaseLock.Handle ignored = lock.acquire("holder")) {
            CompletableFuture<Void> contender = CompletableFuture.runAsync(() -> {
                try (DatabaseLock.Handle h = lock.acquire("contender")) {
                    fail("Lock should not have been granted");
                } catch (IOException expected) {
                    assertTrue(expected.getMessage().contains("contender"));
                }
            });
            contender.get();
        }
    }

    @Test
    void close_shouldBeIdempotent() throws IOException, ExecutionException, InterruptedException {
        DatabaseLock lock = new DatabaseLock(tempDir.resolve("canary.db"), 200);
        DatabaseLock.Handle handle = lock.acquire("once");
        handle.close();
        handle.close();

        boolean acquired = CompletableFuture.supplyAsync(() -> {
            try (DatabaseLock.Handle h = lock.acquire("after release")) {
                return true;
            } catch (IOException e) {
                return false;
            }
        }).get();
        assertTrue(acquired);
    }
}
