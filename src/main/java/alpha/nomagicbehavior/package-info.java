/**
 * Home of the library {@code Config}.<p>
 *
 * <strong>Architectural Overview</strong>. An {@link
 * alpha.nomagicbehavior.event.EventOwner EventOwner} is any object that lets
 * others subscribe {@link alpha.nomagicbehavior.event.Handler Handler}s to its
 * named events. A {@link alpha.nomagicbehavior.behavior.Behavior Behavior}
 * extends such an owner at runtime, without touching the owner's type, by
 * declaring which of its own methods (or any other handler) should be
 * subscribed to which event. Attaching the behavior subscribes them all,
 * detaching unsubscribes exactly what was subscribed.
 */
package alpha.nomagicbehavior;
