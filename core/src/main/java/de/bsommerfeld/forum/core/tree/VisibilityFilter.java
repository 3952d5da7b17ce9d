package de.bsommerfeld.forum.core.tree;

import de.bsommerfeld.forum.core.domain.Message;

import java.util.function.Predicate;

/**
 * Caller-supplied decision which messages take part in a tree. The tree
 * builder itself never hides anything.
 */
@FunctionalInterface
public interface VisibilityFilter extends Predicate<Message> {

    VisibilityFilter ALL = m -> true;

    VisibilityFilter HIDE_DELETED = m -> !m.deleted();

    VisibilityFilter HIDE_DELETED_AND_DRAFTS = m -> !m.deleted() && !m.draft();

    /**
     * Regular readers see neither deleted messages nor drafts; moderators
     * with "view all" see everything.
     */
    static VisibilityFilter forViewer(boolean viewAll) {
        return viewAll ? ALL : HIDE_DELETED_AND_DRAFTS;
    }
}
