package de.bsommerfeld.forum.core.util;

import de.bsommerfeld.forum.core.domain.ForumThread;
import de.bsommerfeld.forum.core.domain.Message;
import de.bsommerfeld.forum.core.domain.ThreadSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates plausible forum threads for TEST mode and for tree tests.
 *
 * <p>
 * Every thread has exactly one root. Replies pick a random parent from an
 * ever-growing pool; with 50% probability a new reply joins the pool itself,
 * which yields varying nesting depths without an artificial limit. About 10%
 * of the generated messages carry a tag pair, creation times grow
 * monotonically with the id but siblings may share a timestamp.
 *
 * <p>
 * Output is fully determined by the seed.
 */
public final class ForumDataGenerator {

    private static final String[] AUTHORS = { "ckruse", "Rolf B", "Gunnar Bittersmann", "Matthias Apsel",
            "Der Martin", "Auge", "1unitedpower" };

    private static final String[] SUBJECTS = { "Flexbox und Abstände", "PHP Session verliert Werte",
            "Unicode in URLs", "CSS Grid im IE", "JavaScript Closures", "Barrierefreie Formulare" };

    private static final String[] TAGS = { "css", "html", "javascript", "php", "barrierefreiheit", "http" };

    private final Random random;

    public ForumDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Generates {@code threads} threads for one forum. Thread ids start at
     * {@code firstThreadId}, message ids at {@code firstMessageId}, both
     * consecutive.
     */
    public List<ThreadSnapshot> generateForum(long forumId, long firstThreadId, long firstMessageId,
            int threads, int messagesPerThread) {
        List<ThreadSnapshot> result = new ArrayList<>(threads);
        long nextMessageId = firstMessageId;
        for (int i = 0; i < threads; i++) {
            ThreadSnapshot snapshot = generateThread(firstThreadId + i, forumId, nextMessageId, messagesPerThread);
            nextMessageId += snapshot.messages().size();
            result.add(snapshot);
        }
        return result;
    }

    /**
     * Generates one thread with {@code count} messages (at least the root).
     */
    public ThreadSnapshot generateThread(long threadId, long forumId, long firstMessageId, int count) {
        long now = System.currentTimeMillis() / 1000;
        long time = now - 86_400L - random.nextInt(86_400);
        String subject = pick(SUBJECTS);

        List<Message> messages = new ArrayList<>();
        Message root = message(firstMessageId, threadId, forumId, null, subject, time);
        messages.add(root);

        List<Long> pool = new ArrayList<>();
        pool.add(root.id());
        for (int i = 1; i < Math.max(1, count); i++) {
            long parent = pool.get(random.nextInt(pool.size()));
            time += random.nextInt(3) * 60L;
            Message reply = message(firstMessageId + i, threadId, forumId, parent, subject, time);
            messages.add(reply);
            if (random.nextBoolean()) {
                pool.add(reply.id());
            }
        }

        ForumThread thread = new ForumThread(threadId, forumId, "t" + threadId, false, time);
        return new ThreadSnapshot(thread, messages);
    }

    private Message message(long id, long threadId, long forumId, Long parentId, String subject, long created) {
        String author = pick(AUTHORS);
        List<String> tags = random.nextInt(10) == 0 ? List.of(pick(TAGS), pick(TAGS)).stream().distinct().toList()
                : List.of();
        return new Message(id, threadId, forumId, parentId, null, author,
                parentId == null ? subject : "Re: " + subject,
                "Beitrag " + id + " von " + author,
                false, false, Map.of(), tags, random.nextInt(5), random.nextInt(2), created, created);
    }

    private <T> T pick(T[] values) {
        return values[random.nextInt(values.length)];
    }
}
