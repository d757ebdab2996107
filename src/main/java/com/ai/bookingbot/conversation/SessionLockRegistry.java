package com.ai.bookingbot.conversation;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes turns of one (provider, phone) pair in arrival order; distinct pairs never wait
 * on each other. Fair locks hand over in request order. A pair's entry is dropped once no
 * thread holds or waits for it.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentHashMap<String, PairLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long providerId, String clientPhone, Supplier<T> work) {
        String key = key(providerId, clientPhone);
        // users is only touched inside compute, which is atomic per key
        PairLock pairLock = locks.compute(key, (k, existing) -> {
            PairLock current = existing != null ? existing : new PairLock();
            current.users++;
            return current;
        });
        pairLock.lock.lock();
        try {
            return work.get();
        } finally {
            pairLock.lock.unlock();
            locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    int trackedPairs() {
        return locks.size();
    }

    private static String key(Long providerId, String clientPhone) {
        return providerId + ":" + clientPhone;
    }

    private static final class PairLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
