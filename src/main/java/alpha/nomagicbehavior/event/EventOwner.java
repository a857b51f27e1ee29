package alpha.nomagicbehavior.event;

/**
 * Triggers named events, to which handlers may come and go.<p>
 *
 * Which events are triggered should be documented by the owner. The event
 * name is an arbitrary string and the owner is free to accept subscriptions
 * to names it never triggers.<p>
 *
 * <strong>The remaining JavaDoc</strong> is a contract that a {@link
 * alpha.nomagicbehavior.behavior.Behavior Behavior} relies on when it is
 * attached to the owner. An owner which breaks it may leak handlers or fail
 * to invoke them in the expected order.<p>
 *
 * Handlers of the same event are invoked in the order they subscribed.<p>
 *
 * Duplicates are allowed. Subscribing the same handler twice to the same
 * event will have it invoked twice, and it will need to be unsubscribed twice.
 * <p>
 *
 * Unsubscribing matches the handler using object equality. For lambdas and
 * method references this is identity, see {@link Handler}.<p>
 *
 * Unsubscribing a handler that is not subscribed is a no-op.
 *
 * @see AbstractEventOwner
 */
public interface EventOwner {
    /**
     * Subscribe a handler to the given event.
     *
     * @param eventName name of event
     * @param handler receiver of the event
     *
     * @return {@code true} if subscribed, otherwise {@code false}
     *
     * @throws NullPointerException
     *             if any arg is {@code null}
     */
    boolean on(String eventName, Handler handler);

    /**
     * Unsubscribe a handler from the given event.<p>
     *
     * Only the earliest subscription equal to the given handler is removed.
     *
     * @param eventName name of event
     * @param handler to unsubscribe
     *
     * @return {@code true} if removed, otherwise {@code false}
     *
     * @throws NullPointerException
     *             if any arg is {@code null}
     */
    boolean off(String eventName, Handler handler);
}
