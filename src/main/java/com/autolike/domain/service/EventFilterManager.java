package com.autolike.domain.service;

import com.autolike.domain.exception.RuleSyncException;
import com.autolike.domain.model.FilterRule;
import com.autolike.infrastructure.twitter.TwitterRulesClient;
import com.autolike.infrastructure.twitter.TwitterRulesClient.RulesResponse;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Leaves exactly one rule installed on the filtered stream.
 *
 * Every existing rule is deleted, whoever installed it, then the desired rule
 * is added. Must finish before the stream is opened. Connection failures are
 * retried; a rejection by upstream is a {@link RuleSyncException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventFilterManager {

    private final TwitterRulesClient rulesClient;

    @Retry(name = "ruleSync")
    public void synchronize(FilterRule desiredRule) {
        try {
            List<FilterRule> installed = rulesClient.listRules();

            if (!installed.isEmpty()) {
                List<String> ids = installed.stream()
                        .map(FilterRule::getId)
                        .collect(Collectors.toList());
                RulesResponse deleted = rulesClient.deleteRules(ids);

                if (deleted.hasErrors() || deleted.summary().getNotDeleted() > 0) {
                    throw new RuleSyncException("Upstream refused to delete rules " + ids + ": " + deleted.getErrors());
                }
                log.info("Deleted {} stale stream rules: {}", ids.size(), ids);
            }

            RulesResponse added = rulesClient.addRules(List.of(desiredRule));
            if (added.hasErrors() || added.summary().getCreated() != 1) {
                throw new RuleSyncException("Upstream refused rule '" + desiredRule.getValue() + "': " + added.getErrors());
            }

            log.info("Installed stream rule '{}' (tag: {})", desiredRule.getValue(), desiredRule.getTag());

        } catch (WebClientResponseException e) {
            throw new RuleSyncException("Rule synchronization rejected with status " + e.getStatusCode().value(), e);
        }
    }
}
