/**
 * Persistence layer of the forum core: SQLite-backed in production, in-memory
 * in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [ThreadRepository / engines]
 *        │
 *        ▼
 *   RecordStore        ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlRS   InMemoryRS
 * </pre>
 *
 * Nothing in this package caches. Caching and invalidation live one layer up
 * in the service module.
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ forum_threads                                                    │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ thread_id (PK)   │ Thread identifier                             │
 * │ forum_id         │ Owning forum                                  │
 * │ archived         │ 0/1, archived threads are never unread        │
 * │ latest_message_utc│ MAX over message creation times              │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ messages                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ message_id (PK)  │ AUTOINCREMENT, never reused                   │
 * │ thread_id        │ Owning thread                                 │
 * │ forum_id         │ Denormalized for unread counting              │
 * │ parent_id        │ NULL for the root, else the replied-to message│
 * │ deleted, draft   │ 0/1 markers                                   │
 * │ flags            │ JSON object, patched with json_set/json_remove│
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 *   message_tags      (message_id, tag_name, position)
 *   read_messages     (user_id, message_id)
 *   invisible_threads (user_id, thread_id)
 *   settings          (scope, owner_id, name, value), global rows use owner 0
 * </pre>
 *
 * <h2>Bulk Updates</h2>
 * Subtree mutations pass the full id set as one JSON array parameter:
 *
 * <pre>
 * UPDATE messages SET deleted = ?
 * WHERE message_id IN (SELECT value FROM json_each(?))
 * </pre>
 *
 * so a subtree of any size costs one statement per patched column.
 *
 * <h2>SQL Files</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link de.bsommerfeld.forum.db.SqlLoader}.
 */
package de.bsommerfeld.forum.db;
