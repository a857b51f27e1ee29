package alpha.nomagicbehavior.behavior;

/**
 * Thrown by {@link Behavior#attach(alpha.nomagicbehavior.event.EventOwner)
 * Behavior.attach()} if the behavior is already attached to an owner.<p>
 *
 * The behavior and its current owner are left untouched. The application may
 * {@link Behavior#detach() detach} the behavior and try again.
 */
public class AlreadyAttachedException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param behavior the behavior
     * @param currentOwner the owner the behavior is attached to
     */
    public AlreadyAttachedException(Behavior<?> behavior, Object currentOwner) {
        super(behavior + " is already attached to " + currentOwner + ".");
    }
}
