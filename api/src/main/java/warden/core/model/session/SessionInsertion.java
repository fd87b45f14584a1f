package warden.core.model.session;

import java.util.List;

/**
 * Result of inserting a session under the per-user concurrency cap.
 *
 * @param created  the stored session
 * @param evicted  sessions ended to make room, oldest first
 */
public record SessionInsertion(Session created, List<Session> evicted) {

    public SessionInsertion {
        evicted = evicted != null ? List.copyOf(evicted) : List.of();
    }
}
