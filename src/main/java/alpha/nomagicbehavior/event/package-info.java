/**
 * Events are named by a string, triggered by an {@link
 * alpha.nomagicbehavior.event.EventOwner EventOwner} and observed by a {@link
 * alpha.nomagicbehavior.event.Handler Handler}.<p>
 *
 * The {@code EventOwner} interface is all that a behavior needs from the
 * object it extends. {@link alpha.nomagicbehavior.event.AbstractEventOwner}
 * is a ready-made implementation that keeps the handlers of each event in
 * subscription order.
 */
package alpha.nomagicbehavior.event;
