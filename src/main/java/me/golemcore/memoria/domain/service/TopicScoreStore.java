package me.golemcore.memoria.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memoria.domain.model.TopicScore;
import me.golemcore.memoria.infrastructure.config.MemoriaProperties;
import me.golemcore.memoria.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Persisted mapping from topic name to {@link TopicScore}.
 *
 * <p>
 * The whole mapping lives in one JSON document. {@link #load()} never fails:
 * an absent or unreadable document is an empty mapping. {@link #save(Map)}
 * overwrites the document atomically and reports failure through its return
 * value.
 *
 * <p>
 * Concurrent consolidations must go through {@link #update(String,
 * UnaryOperator)}, which serializes the load-mutate-save cycle so that updates
 * of different topics never overwrite each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopicScoreStore {

    private static final TypeReference<LinkedHashMap<String, TopicScore>> SCORES_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final MemoriaProperties properties;
    private final ObjectMapper objectMapper;

    private final ReentrantLock writeLock = new ReentrantLock();

    public Map<String, TopicScore> load() {
        String directory = properties.getStorage().getDirectories().getIndex();
        String file = properties.getStorage().getScoreFile();
        try {
            String content = storagePort.getText(directory, file).join();
            if (content == null || content.isBlank()) {
                return new LinkedHashMap<>();
            }
            LinkedHashMap<String, TopicScore> scores = objectMapper.readValue(content, SCORES_TYPE);
            if (scores == null) {
                return new LinkedHashMap<>();
            }
            scores.values().removeIf(Objects::isNull);
            return scores;
        } catch (JsonProcessingException e) {
            log.warn("[ScoreStore] Unreadable score file {}/{}, starting empty: {}", directory, file,
                    e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("[ScoreStore] Failed to read score file {}/{}: {}", directory, file, e.getMessage());
        }
        return new LinkedHashMap<>();
    }

    /**
     * Overwrites the persisted mapping.
     *
     * @return {@code true} when the write succeeded
     */
    public boolean save(Map<String, TopicScore> scores) {
        String directory = properties.getStorage().getDirectories().getIndex();
        String file = properties.getStorage().getScoreFile();
        try {
            String payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(scores);
            storagePort.putTextAtomic(directory, file, payload, true).join();
            log.debug("[ScoreStore] Saved {} topic score(s)", scores.size());
            return true;
        } catch (JsonProcessingException e) {
            log.warn("[ScoreStore] Failed to serialize topic scores: {}", e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("[ScoreStore] Failed to write score file {}/{}: {}", directory, file, e.getMessage());
        }
        return false;
    }

    /**
     * Applies {@code mutator} to one topic's record as a single serialized
     * read-modify-write transaction. The mutator receives {@code null} for an
     * unseen topic.
     *
     * @return the stored record after the update
     */
    public TopicScore update(String topic, UnaryOperator<TopicScore> mutator) {
        writeLock.lock();
        try {
            Map<String, TopicScore> scores = load();
            TopicScore current = scores.get(topic);
            TopicScore updated = mutator.apply(current != null ? current.copy() : null);
            if (updated == null) {
                return current;
            }
            updated.setBaseImportance(TopicScore.clampImportance(updated.getBaseImportance()));
            scores.put(topic, updated);
            if (!save(scores)) {
                log.warn("[ScoreStore] Score update for '{}' was not persisted", topic);
            }
            return updated.copy();
        } finally {
            writeLock.unlock();
        }
    }
}
