package alpha.nomagicbehavior.behavior;

/**
 * Thrown by a handler bound to a named method, if the method throws a checked
 * exception or can not be invoked.<p>
 *
 * Unchecked exceptions thrown by the method propagate as-is.
 *
 * @see HandlerDescriptor#method(String)
 */
public class HandlerInvocationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public HandlerInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
