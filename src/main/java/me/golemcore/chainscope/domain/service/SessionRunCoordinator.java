package me.golemcore.chainscope.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes research runs per session.
 *
 * <p>
 * Two requests for the same session never run at the same time, so the user
 * and assistant messages of one run are appended before the next run starts.
 * Requests for different sessions run in parallel unless their ids hash to the
 * same lock stripe. A fixed number of fair stripes keeps memory bounded
 * regardless of how many sessions come and go.
 */
@Service
public class SessionRunCoordinator {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public SessionRunCoordinator() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock(true);
        }
    }

    public <T> T runExclusive(String sessionId, Supplier<T> run) {
        ReentrantLock lock = locks[Math.floorMod(sessionId.hashCode(), STRIPES)];
        lock.lock();
        try {
            return run.get();
        } finally {
            lock.unlock();
        }
    }
}
