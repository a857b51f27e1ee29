/**
 * Behaviors, and the handler descriptors with which they declare what to
 * subscribe to their owner's events.<p>
 *
 * A {@link alpha.nomagicbehavior.behavior.Behavior Behavior} remembers each
 * handler it gave to the owner as a {@link
 * alpha.nomagicbehavior.behavior.Registration Registration} and uses exactly
 * those objects when detaching. Re-resolving a descriptor would produce a
 * handler the owner does not recognize.
 */
package alpha.nomagicbehavior.behavior;
