package me.golemcore.chainscope.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.chainscope.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.chainscope.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchSession;
import me.golemcore.chainscope.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Session browser endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SessionPort sessionPort;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = sessionPort.listAll().stream()
                .map(SessionsController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDetailDto>> getSession(@PathVariable String id) {
        ResearchSession session = sessionPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
        return Mono.just(ResponseEntity.ok(toDetail(session)));
    }

    private static SessionSummaryDto toSummary(ResearchSession session) {
        Object lastQuery = session.getResearchContext().get(ResearchSession.CONTEXT_LAST_QUERY);
        return SessionSummaryDto.builder()
                .id(session.getId())
                .createdAt(format(session.getCreatedAt()))
                .lastActivity(format(session.getLastActivity()))
                .messageCount(session.getMessageCount())
                .lastQuery(lastQuery != null ? lastQuery.toString() : null)
                .build();
    }

    private static SessionDetailDto toDetail(ResearchSession session) {
        List<SessionDetailDto.MessageDto> messages = session.getMessages().stream()
                .map(SessionsController::toMessage)
                .toList();
        return SessionDetailDto.builder()
                .id(session.getId())
                .createdAt(format(session.getCreatedAt()))
                .lastActivity(format(session.getLastActivity()))
                .messages(messages)
                .researchContext(session.getResearchContext())
                .build();
    }

    private static SessionDetailDto.MessageDto toMessage(Message message) {
        return SessionDetailDto.MessageDto.builder()
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(format(message.getTimestamp()))
                .metadata(message.getMetadata())
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
