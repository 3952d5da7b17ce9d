package de.bsommerfeld.forum.db;

import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.error.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field changes applied uniformly to every row matched by a
 * {@link MessageSelector}. Patches are immutable; each builder method returns
 * a new patch.
 *
 * <p>
 * Application order per row: deleted flag, flag removals, flag sets, tag
 * replacement, vote deltas. A key both removed and set therefore ends up set.
 *
 * @param deleted       new deleted state, {@code null} to leave untouched
 * @param setFlags      flags to put (key → value)
 * @param removeFlags   flag keys to drop
 * @param tags          replacement tag list, {@code null} to leave tags untouched
 * @param upvoteDelta   added to the upvote counter, may be negative
 * @param downvoteDelta added to the downvote counter, may be negative
 */
public record MessagePatch(
        Boolean deleted,
        Map<String, String> setFlags,
        Set<String> removeFlags,
        List<String> tags,
        int upvoteDelta,
        int downvoteDelta) {

    public MessagePatch {
        setFlags = setFlags == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(setFlags));
        removeFlags = removeFlags == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(removeFlags));
        tags = tags == null ? null : List.copyOf(new LinkedHashSet<>(tags));
        setFlags.keySet().forEach(MessagePatch::checkFlagKey);
        removeFlags.forEach(MessagePatch::checkFlagKey);
    }

    public static MessagePatch empty() {
        return new MessagePatch(null, null, null, null, 0, 0);
    }

    public MessagePatch deleted(boolean value) {
        return new MessagePatch(value, setFlags, removeFlags, tags, upvoteDelta, downvoteDelta);
    }

    public MessagePatch setFlag(String key, String value) {
        if (value == null) {
            throw new ValidationException("flag", "value of '" + key + "' must not be null");
        }
        Map<String, String> flags = new LinkedHashMap<>(setFlags);
        flags.put(key, value);
        return new MessagePatch(deleted, flags, removeFlags, tags, upvoteDelta, downvoteDelta);
    }

    public MessagePatch removeFlag(String key) {
        Set<String> keys = new LinkedHashSet<>(removeFlags);
        keys.add(key);
        return new MessagePatch(deleted, setFlags, keys, tags, upvoteDelta, downvoteDelta);
    }

    /** Replaces the whole tag list of every matched row, order preserved. */
    public MessagePatch tags(List<String> replacement) {
        if (replacement == null) {
            throw new ValidationException("tags", "replacement tag list must not be null");
        }
        return new MessagePatch(deleted, setFlags, removeFlags, replacement, upvoteDelta, downvoteDelta);
    }

    public MessagePatch votes(int upDelta, int downDelta) {
        return new MessagePatch(deleted, setFlags, removeFlags, tags, upvoteDelta + upDelta, downvoteDelta + downDelta);
    }

    public boolean isEmpty() {
        return deleted == null && setFlags.isEmpty() && removeFlags.isEmpty() && tags == null
                && upvoteDelta == 0 && downvoteDelta == 0;
    }

    /** Whether the patch changes content-relevant state (and thus {@code updated_utc}). */
    public boolean touchesContent() {
        return deleted != null || !setFlags.isEmpty() || !removeFlags.isEmpty() || tags != null;
    }

    /** In-memory application, used by stores that cannot express the patch natively. */
    public Message applyTo(Message message, long now) {
        Message result = message;
        if (touchesContent()) {
            Map<String, String> flags = new LinkedHashMap<>(message.flags());
            removeFlags.forEach(flags::remove);
            flags.putAll(setFlags);
            result = result.withDeleted(deleted != null ? deleted : message.deleted(), flags, now);
        }
        if (tags != null) {
            result = result.withTags(tags, now);
        }
        if (upvoteDelta != 0 || downvoteDelta != 0) {
            result = result.withVotes(result.upvotes() + upvoteDelta, result.downvotes() + downvoteDelta);
        }
        return result;
    }

    /**
     * Flag keys end up in JSON paths of the SQLite store, so they must be
     * non-blank and free of double quotes.
     */
    static void checkFlagKey(String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("flag", "flag key must not be blank");
        }
        if (key.indexOf('"') >= 0) {
            throw new ValidationException("flag", "flag key must not contain quotes: " + key);
        }
    }
}
