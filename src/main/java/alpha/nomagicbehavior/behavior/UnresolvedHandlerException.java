package alpha.nomagicbehavior.behavior;

/**
 * Thrown by {@link Behavior#attach(alpha.nomagicbehavior.event.EventOwner)
 * Behavior.attach()} if a {@link HandlerDescriptor} names a method that does
 * not exist, does not qualify, or can not be made accessible.
 */
public class UnresolvedHandlerException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public UnresolvedHandlerException(String message) {
        super(message);
    }
}
