package de.bsommerfeld.forum.service;

import de.bsommerfeld.forum.core.error.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of cascading mutations the {@link SubtreeMutationEngine} can
 * apply to an anchor message and its replies.
 */
public sealed interface SubtreeOperation {

    String NO_ANSWER = "no-answer";
    String NO_ANSWER_ADMIN = "no-answer-admin";
    Set<String> NO_ANSWER_TYPES = Set.of(NO_ANSWER, NO_ANSWER_ADMIN);

    /** Soft-deletes the subtree; only the anchor keeps {@code reason}. */
    record Delete(String reason) implements SubtreeOperation {
    }

    /** Clears the deleted marker and every {@code reason} in the subtree. */
    record Restore() implements SubtreeOperation {
    }

    record SetFlag(String key, String value) implements SubtreeOperation {
    }

    record ClearFlag(String key) implements SubtreeOperation {
    }

    /**
     * Replaces the anchor's tags; with {@code cascade} every reply receives
     * the same tags, each as a non-cascading retag.
     */
    record Retag(List<String> tags, boolean cascade) implements SubtreeOperation {
        public Retag {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    /**
     * Marks the subtree as "needs no answer". The anchor records
     * {@code reason}, replies only carry the type flag.
     */
    record FlagNoAnswer(String reason, String type) implements SubtreeOperation {
        public FlagNoAnswer {
            if (!NO_ANSWER_TYPES.contains(type)) {
                throw new ValidationException("type", "unknown no-answer type: " + type);
            }
        }
    }

    record UnflagNoAnswer(Set<String> types) implements SubtreeOperation {
        public UnflagNoAnswer {
            types = types == null || types.isEmpty() ? NO_ANSWER_TYPES : Set.copyOf(types);
        }
    }

    /**
     * Maps the external string form {@code (operation, params)} to a typed
     * operation.
     *
     * <p>
     * Parameters: {@code reason} for delete and flagNoAnswer, {@code key} and
     * {@code value} for the flag operations, {@code tags} (comma separated)
     * and {@code cascade} ({@code true}/{@code yes}) for retag, {@code type}
     * for flagNoAnswer and {@code types} (comma separated) for
     * unflagNoAnswer.
     *
     * @throws ValidationException for unknown names or missing parameters
     */
    static SubtreeOperation parse(String name, Map<String, String> params) {
        Map<String, String> p = params == null ? Map.of() : params;
        if (name == null) {
            throw new ValidationException("operation", "operation must not be null");
        }
        switch (name) {
            case "delete":
                return new Delete(p.get("reason"));
            case "restore":
                return new Restore();
            case "setFlag":
                return new SetFlag(required(p, "key"), required(p, "value"));
            case "clearFlag":
                return new ClearFlag(required(p, "key"));
            case "retag":
                return new Retag(split(required(p, "tags")), isTrue(p.get("cascade")));
            case "flagNoAnswer":
                return new FlagNoAnswer(p.get("reason"), p.getOrDefault("type", NO_ANSWER_ADMIN));
            case "unflagNoAnswer":
                String types = p.get("types");
                return new UnflagNoAnswer(types == null ? null : Set.copyOf(split(types)));
            default:
                throw new ValidationException("operation", "unknown operation: " + name);
        }
    }

    private static String required(Map<String, String> params, String key) {
        String value = params.get(key);
        if (value == null) {
            throw new ValidationException(key, "parameter is required");
        }
        return value;
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value) || "yes".equalsIgnoreCase(value);
    }
}
