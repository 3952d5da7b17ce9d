package de.bsommerfeld.forum.core.event;

import java.util.Map;

/**
 * Outgoing notification seam. Delivery reliability is the implementation's
 * concern; callers never wait for or depend on delivery.
 */
public interface Broadcaster {

    void broadcast(String channel, String event, Map<String, Object> payload);
}
