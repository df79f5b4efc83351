package com.carelog.concern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.carelog.core.error.ConcernNotMatchedException;
import com.carelog.core.error.InvalidCommandException;
import com.carelog.core.match.FuzzyMatcher;
import com.carelog.core.model.Concern;
import com.carelog.core.model.ConcernCommand;

import reactor.core.publisher.Mono;

/**
 * Runs user-issued merge, delete and rename commands.
 *
 * Every target name is resolved against the user's open concerns before
 * anything is written; one unresolved name fails the whole command with
 * {@link ConcernNotMatchedException}. Each operation emits the matched titles
 * for the confirmation message.
 */
@Service
public class ConcernCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ConcernCommandExecutor.class);

    private final ConcernLifecycleService concerns;
    private final FuzzyMatcher matcher;

    public ConcernCommandExecutor(ConcernLifecycleService concerns, FuzzyMatcher matcher) {
        this.concerns = concerns;
        this.matcher = matcher;
    }

    public Mono<List<String>> execute(String userId, ConcernCommand command) {
        return Mono.defer(() -> switch (command.type()) {
            case MERGE -> executeMerge(userId, command.targets());
            case DELETE -> executeDelete(userId, single(command));
            case RENAME -> executeRename(userId, single(command), command.newName());
        });
    }

    /**
     * Folds every named concern into the first one. Content is concatenated in
     * input order with a blank line between non-empty parts.
     */
    public Mono<List<String>> executeMerge(String userId, List<String> targetNames) {
        if (targetNames == null || targetNames.size() < 2) {
            return Mono.error(new InvalidCommandException("Merge requires at least two concerns"));
        }
        return openConcerns(userId).flatMap(open -> {
            Map<UUID, Concern> resolved = new LinkedHashMap<>();
            for (String name : targetNames) {
                Concern c = resolve(name, open);
                resolved.putIfAbsent(c.id(), c);
            }
            if (resolved.size() < 2) {
                return Mono.error(new InvalidCommandException("Merge requires at least two different concerns"));
            }

            List<Concern> ordered = new ArrayList<>(resolved.values());
            Concern primary = ordered.get(0);
            List<Concern> secondaries = ordered.subList(1, ordered.size());
            List<String> matchedNames = ordered.stream().map(Concern::title).toList();

            return concerns.absorbConcerns(primary, List.copyOf(secondaries), combine(ordered))
                    .doOnNext(c -> log.info("Merge command done userId={} primaryId={} matched={}",
                            userId, primary.id(), matchedNames))
                    .thenReturn(matchedNames);
        });
    }

    public Mono<List<String>> executeDelete(String userId, String targetName) {
        return openConcerns(userId)
                .map(open -> resolve(targetName, open))
                .flatMap(target -> concerns.deleteConcern(target.id()))
                .map(deleted -> List.of(deleted.title()));
    }

    /**
     * Emits {@code [oldTitle, newTitle]}.
     */
    public Mono<List<String>> executeRename(String userId, String targetName, String newName) {
        if (newName == null || newName.isBlank()) {
            return Mono.error(new InvalidCommandException("Rename requires a new name"));
        }
        return openConcerns(userId)
                .map(open -> resolve(targetName, open))
                .flatMap(target -> concerns.renameConcern(target.id(), newName)
                        .map(renamed -> List.of(target.title(), renamed.title())));
    }

    static String combine(List<Concern> ordered) {
        return ordered.stream()
                .filter(Concern::hasContent)
                .map(c -> c.summaryContent().strip())
                .collect(Collectors.joining("\n\n"));
    }

    private Mono<List<Concern>> openConcerns(String userId) {
        return concerns.getActiveConcerns(userId).collectList();
    }

    private Concern resolve(String name, List<Concern> open) {
        if (name == null || name.isBlank()) {
            throw new InvalidCommandException("Concern name must not be blank");
        }
        return matcher.best(name, open, Concern::title)
                .orElseThrow(() -> new ConcernNotMatchedException(name));
    }

    private static String single(ConcernCommand command) {
        if (command.targets().size() != 1) {
            throw new InvalidCommandException(command.type() + " takes exactly one concern name");
        }
        return command.targets().get(0);
    }
}
