package me.golemcore.council.domain.advisor;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.AdvisorId;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Every council seat, indexed by its fixed identifier.
 */
@Component
@Slf4j
public class AdvisorRegistry {

    private final Map<AdvisorId, Advisor> advisors;

    public AdvisorRegistry(List<Advisor> advisors) {
        Map<AdvisorId, Advisor> byId = new EnumMap<>(AdvisorId.class);
        for (Advisor advisor : advisors) {
            Advisor previous = byId.putIfAbsent(advisor.id(), advisor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate advisor registered for " + advisor.id().key());
            }
        }
        this.advisors = Collections.unmodifiableMap(byId);
        log.info("[Advisors] Registered {} advisors ({} voting, {} judges)", byId.size(),
                AdvisorId.voting().stream().filter(byId::containsKey).count(),
                AdvisorId.judges().stream().filter(byId::containsKey).count());
    }

    public Optional<Advisor> find(AdvisorId id) {
        return Optional.ofNullable(advisors.get(id));
    }

    public Set<AdvisorId> registered() {
        return advisors.keySet();
    }

    public List<Advisor> voting() {
        return AdvisorId.voting().stream().map(advisors::get).filter(Objects::nonNull).toList();
    }

    public List<Advisor> judges() {
        return AdvisorId.judges().stream().map(advisors::get).filter(Objects::nonNull).toList();
    }
}
