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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chainscope.adapter.inbound.web.dto.CitationDto;
import me.golemcore.chainscope.adapter.inbound.web.dto.ResearchRequestDto;
import me.golemcore.chainscope.adapter.inbound.web.dto.ResearchResponseDto;
import me.golemcore.chainscope.domain.model.Citation;
import me.golemcore.chainscope.domain.model.ResearchRequest;
import me.golemcore.chainscope.domain.model.ResearchResponse;
import me.golemcore.chainscope.domain.model.TimeRange;
import me.golemcore.chainscope.domain.service.ResearchOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Research endpoint. The orchestrator blocks on provider I/O, so each request
 * runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/research")
@RequiredArgsConstructor
@Slf4j
public class ResearchController {

    private final ResearchOrchestrator orchestrator;

    @PostMapping
    public Mono<ResponseEntity<ResearchResponseDto>> research(@RequestBody ResearchRequestDto body) {
        ResearchRequest request = toRequest(body);
        log.info("[API] Research request (session: {})", request.getSessionId());
        return Mono.fromCallable(() -> orchestrator.research(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(response -> ResponseEntity
                        .status(response.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY)
                        .body(toDto(response)));
    }

    private static ResearchRequest toRequest(ResearchRequestDto body) {
        if (body == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return ResearchRequest.builder()
                .query(body.getQuery())
                .address(body.getAddress())
                .timeRange(TimeRange.fromValue(body.getTimeRange()))
                .sessionId(body.getSessionId())
                .build();
    }

    private static ResearchResponseDto toDto(ResearchResponse response) {
        return ResearchResponseDto.builder()
                .success(response.isSuccess())
                .result(response.getResult())
                .error(response.getError())
                .reasoningSteps(response.getReasoningSteps())
                .citations(response.getCitations().stream().map(ResearchController::toDto).toList())
                .dataSourcesUsed(response.getDataSourcesUsed())
                .executionTime(response.getExecutionTime())
                .queryIntent(response.getQueryIntent() != null ? response.getQueryIntent().getWireName() : null)
                .completenessScore(response.getCompletenessScore())
                .sessionId(response.getSessionId())
                .metadata(response.getMetadata())
                .build();
    }

    private static CitationDto toDto(Citation citation) {
        return CitationDto.builder()
                .source(citation.getSource())
                .timestamp(citation.getTimestamp() != null ? citation.getTimestamp().toString() : null)
                .queryContext(citation.getQueryContext())
                .build();
    }
}
