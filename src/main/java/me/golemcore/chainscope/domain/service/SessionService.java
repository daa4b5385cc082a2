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

import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchSession;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.port.outbound.SessionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store for research sessions with bounded capacity and idle expiry.
 *
 * <p>
 * Sessions are kept in recency order: every touch moves a session to the end
 * of the table, so among sessions with equal last activity the one touched
 * earliest is evicted first. All access goes through one manager lock; load is
 * request-scoped, not high-frequency. Sessions live only as long as the
 * process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private static final String ELLIPSIS = "...";

    private final ChainscopeProperties properties;
    private final Clock clock;

    private final Map<String, ResearchSession> sessions = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public ResearchSession getOrCreate(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        Instant now = clock.instant();
        lock.lock();
        try {
            purgeExpired(now);
            ResearchSession session = sessions.get(id);
            if (session == null) {
                session = create(id, now);
            } else {
                touch(session, now);
            }
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ResearchSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return live(sessionId, clock.instant()).map(ResearchSession::snapshot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendMessage(String sessionId, Message message) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ResearchSession session = liveOrRecreate(sessionId, now);
            session.addMessage(message);
            touch(session, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateContext(String sessionId, Map<String, Object> patch) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ResearchSession session = liveOrRecreate(sessionId, now);
            session.getResearchContext().putAll(patch);
            touch(session, now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String summarize(String sessionId, int maxMessages) {
        if (sessionId == null || maxMessages <= 0) {
            return "";
        }
        lock.lock();
        try {
            Optional<ResearchSession> session = live(sessionId, clock.instant());
            if (session.isEmpty() || session.get().getMessageCount() == 0) {
                return "";
            }
            List<Message> messages = session.get().getMessages();
            List<Message> recent = messages.subList(Math.max(0, messages.size() - maxMessages), messages.size());
            StringBuilder sb = new StringBuilder();
            for (Message message : recent) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(message.isUserMessage() ? "User asked: " : "Assistant responded about: ");
                sb.append(preview(message.getContent()));
            }
            return sb.toString();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ResearchSession> listAll() {
        lock.lock();
        try {
            purgeExpired(clock.instant());
            return sessions.values().stream()
                    .map(ResearchSession::snapshot)
                    .sorted(Comparator.comparing(ResearchSession::getLastActivity).reversed())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    // ==================== internals (lock held) ====================

    private ResearchSession create(String id, Instant now) {
        int maxSessions = Math.max(1, properties.getSessions().getMaxSessions());
        while (sessions.size() >= maxSessions) {
            evictLeastRecentlyActive();
        }
        ResearchSession session = ResearchSession.builder()
                .id(id)
                .createdAt(now)
                .lastActivity(now)
                .build();
        sessions.put(id, session);
        log.info("Created new session: {}", id);
        return session;
    }

    private void touch(ResearchSession session, Instant now) {
        session.setLastActivity(now);
        sessions.remove(session.getId());
        sessions.put(session.getId(), session);
    }

    private Optional<ResearchSession> live(String sessionId, Instant now) {
        ResearchSession session = sessions.get(sessionId);
        if (session != null && isExpired(session, now)) {
            sessions.remove(sessionId);
            log.info("Expired session: {}", sessionId);
            return Optional.empty();
        }
        return Optional.ofNullable(session);
    }

    private ResearchSession liveOrRecreate(String sessionId, Instant now) {
        Optional<ResearchSession> session = live(sessionId, now);
        if (session.isPresent()) {
            return session.get();
        }
        log.info("Session {} no longer present, recreating", sessionId);
        return create(sessionId, now);
    }

    private void purgeExpired(Instant now) {
        Iterator<Map.Entry<String, ResearchSession>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ResearchSession> entry = it.next();
            if (isExpired(entry.getValue(), now)) {
                it.remove();
                log.info("Expired session: {}", entry.getKey());
            }
        }
    }

    private void evictLeastRecentlyActive() {
        ResearchSession oldest = null;
        for (ResearchSession session : sessions.values()) {
            if (oldest == null || session.getLastActivity().isBefore(oldest.getLastActivity())) {
                oldest = session;
            }
        }
        if (oldest != null) {
            sessions.remove(oldest.getId());
            log.info("Evicted session due to capacity limit: {}", oldest.getId());
        }
    }

    private boolean isExpired(ResearchSession session, Instant now) {
        Duration idle = Duration.between(session.getLastActivity(), now);
        return idle.compareTo(properties.getSessions().getIdleTimeout()) > 0;
    }

    private String preview(String content) {
        if (content == null) {
            return "";
        }
        int limit = properties.getSessions().getPreviewLength();
        return content.length() > limit ? content.substring(0, limit) + ELLIPSIS : content;
    }
}
