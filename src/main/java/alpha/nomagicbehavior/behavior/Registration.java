package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.event.Handler;

import static java.util.Objects.requireNonNull;

/**
 * A handler subscribed by a {@link Behavior} to an event of its owner.
 *
 * @param eventName name of event
 * @param handler the exact handler object given to the owner
 */
public record Registration(String eventName, Handler handler) {
    /**
     * Constructs this object.
     *
     * @param eventName name of event
     * @param handler the exact handler object given to the owner
     * @throws NullPointerException if any arg is {@code null}
     */
    public Registration {
        requireNonNull(eventName);
        requireNonNull(handler);
    }
}
