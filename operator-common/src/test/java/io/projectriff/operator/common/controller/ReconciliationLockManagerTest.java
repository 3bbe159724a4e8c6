/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.test.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class ReconciliationLockManagerTest {
    // Same key, one after another
    @Test
    public void testLockUnlockLockUnlock() throws InterruptedException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        assertThat(lockMan.tryLock("Deployer(ns/my-deployer)", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));
        lockMan.unlock("Deployer(ns/my-deployer)");
        assertThat(lockMan.tryLock("Deployer(ns/my-deployer)", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));
        lockMan.unlock("Deployer(ns/my-deployer)");

        assertThat(lockMan.locks.size(), is(0)); // Should be empty at the end
    }

    // Parallel lock with different keys
    @Test
    public void testLockLockUnlockUnlock() throws InterruptedException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        assertThat(lockMan.tryLock("Deployer(ns/my-deployer)", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.tryLock("Processor(ns/my-processor)", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(2));
        lockMan.unlock("Deployer(ns/my-deployer)");
        lockMan.unlock("Processor(ns/my-processor)");

        assertThat(lockMan.locks.size(), is(0)); // Should be empty at the end
    }

    // Same key, waiting for lock
    @Test
    public void testLockLockUnlock() throws InterruptedException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();

        CountDownLatch locked = new CountDownLatch(1); // Used by the async process to indicate it obtained the lock
        CountDownLatch unlock = new CountDownLatch(1); // Used to tell the async process to unlock the lock
        CountDownLatch unlocked = new CountDownLatch(1); // used by the async process to indicate that the lock was unlocked

        assertThat(lockMan.tryLock("Deployer(ns/my-deployer)", 10, TimeUnit.MILLISECONDS), is(true));
        assertThat(lockMan.locks.size(), is(1));

        // Async process to test competing for the lock
        CompletableFuture.runAsync(() -> {
            try {
                // Wait for the lock
                lockMan.tryLock("Deployer(ns/my-deployer)", 1_000, TimeUnit.MILLISECONDS);

                // Indicate we got the lock
                locked.countDown();

                // Wait until we are told to unlock
                unlock.await();

                // Unlock
                lockMan.unlock("Deployer(ns/my-deployer)");

                // Indicate we unlocked
                unlocked.countDown();

            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        // Wait for the async process to be queued
        TestUtils.waitFor(
                "Wait for the second party to queue for the lock",
                10,
                1_000,
                () -> lockMan.locks.get("Deployer(ns/my-deployer)").lockQueue.get() == 2,
                () -> {
                    throw new RuntimeException("The async is not waiting yet");
                });

        // Unlock our lock
        lockMan.unlock("Deployer(ns/my-deployer)");

        // Wait until the async process gets the lock
        locked.await();

        // Tell the async process to unlock
        unlock.countDown();

        // Wait for the async process to actually unlock
        unlocked.await();

        assertThat(lockMan.locks.size(), is(0)); // Should be empty at the end
    }

    @Test
    public void testTryLockTimesOut() throws InterruptedException, ExecutionException {
        ReconciliationLockManager lockMan = new ReconciliationLockManager();
        assertThat(lockMan.tryLock("Deployer(ns/my-deployer)", 10, TimeUnit.MILLISECONDS), is(true));

        boolean lockedByOther = CompletableFuture.supplyAsync(() -> {
            try {
                return lockMan.tryLock("Deployer(ns/my-deployer)", 50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }).get();

        assertThat(lockedByOther, is(false));
        assertThat(lockMan.locks.get("Deployer(ns/my-deployer)").lockQueue.get(), is(1));

        lockMan.unlock("Deployer(ns/my-deployer)");
        assertThat(lockMan.locks.size(), is(0));
    }
}
