package de.bsommerfeld.forum.core.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Compiled-in fallback for every known forum option, consulted after the
 * user, forum and global scopes came up empty. Values are raw strings like
 * stored options; a {@code null} default means "no value".
 */
public final class ConfigDefaults {

    private static final Map<String, String> DEFAULTS;

    static {
        Map<String, String> d = new HashMap<>();
        d.put("pagination", "50");
        d.put("pagination_users", "50");
        d.put("pagination_search", "50");
        d.put("locked", "no");
        d.put("css_ressource", null);
        d.put("js_ressource", null);
        d.put("sort_threads", "newest-first");
        d.put("sort_messages", "ascending");
        d.put("standard_view", "nested-view");
        d.put("max_tags_per_message", "3");
        d.put("min_tags_per_message", "1");
        d.put("close_vote_votes", "5");
        d.put("close_vote_action_off-topic", "close");
        d.put("close_vote_action_not-constructive", "close");
        d.put("close_vote_action_illegal", "hide");
        d.put("close_vote_action_spam", "hide");
        d.put("close_vote_action_duplicate", "close");
        d.put("close_vote_action_custom", "close");
        d.put("header_start_index", "2");
        d.put("editing_enabled", "yes");
        d.put("edit_until_has_answer", "yes");
        d.put("max_editable_age", "10");
        d.put("hide_subjects_unchanged", "yes");
        d.put("hide_repeating_tags", "yes");
        d.put("max_threads", "150");
        d.put("max_messages_per_thread", "50");
        d.put("cites_min_age_to_archive", "2");
        d.put("accept_value", "15");
        d.put("accept_self_value", "15");
        d.put("vote_down_value", "-1");
        d.put("vote_up_value", "10");
        d.put("date_format_index", "%d.%m.%Y %H:%M");
        d.put("date_format_index_sameday", "%H:%M");
        d.put("date_format_post", "%d.%m.%Y %H:%M");
        d.put("date_format_search", "%d.%m.%Y");
        d.put("date_format_default", "%d.%m.%Y %H:%M");
        d.put("date_format_date", "%d.%m.%Y");
        d.put("mail_thread_sort", "ascending");
        d.put("subject_black_list", "");
        d.put("content_black_list", "");
        d.put("search_forum_relevance", "1");
        d.put("search_cites_relevance", "0.9");

        // user settings
        d.put("email", null);
        d.put("url", null);
        d.put("greeting", null);
        d.put("farewell", null);
        d.put("signature", null);
        d.put("autorefresh", "0");
        d.put("quote_signature", "no");
        d.put("show_unread_notifications_in_title", "no");
        d.put("show_unread_pms_in_title", "no");
        d.put("show_new_messages_since_last_visit_in_title", "no");
        d.put("use_javascript_notifications", "yes");
        d.put("notify_on_new_mail", "no");
        d.put("notify_on_abonement_activity", "no");
        d.put("autosubscribe_on_post", "yes");
        d.put("notify_on_flagged", "no");
        d.put("notify_on_open_close_vote", "no");
        d.put("notify_on_move", "no");
        d.put("notify_on_new_thread", "no");
        d.put("notify_on_mention", "yes");
        d.put("highlighted_users", "");
        d.put("highlight_self", "yes");
        d.put("inline_answer", "yes");
        d.put("quote_by_default", "no");
        d.put("delete_read_notifications_on_abonements", "yes");
        d.put("delete_read_notifications_on_mention", "yes");
        d.put("open_close_default", "open");
        d.put("open_close_close_when_read", "no");
        d.put("own_css_file", null);
        d.put("own_js_file", null);
        d.put("own_css", null);
        d.put("own_js", null);
        d.put("mark_suspicious", "yes");
        d.put("page_messages", "yes");
        d.put("fold_quotes", "no");
        d.put("live_preview", "yes");
        d.put("load_messages_via_js", "yes");
        d.put("hide_read_threads", "no");
        d.put("links_white_list", "");
        d.put("notify_on_cite", "yes");
        d.put("delete_read_notifications_on_cite", "no");
        d.put("max_image_filesize", "2");
        d.put("diff_context_lines", null);
        DEFAULTS = Collections.unmodifiableMap(d);
    }

    private ConfigDefaults() {
    }

    /** Default value of {@code name}; {@code null} for unknown or nil options. */
    public static String get(String name) {
        return DEFAULTS.get(name);
    }

    public static boolean isKnown(String name) {
        return DEFAULTS.containsKey(name);
    }

    public static Map<String, String> all() {
        return DEFAULTS;
    }
}
