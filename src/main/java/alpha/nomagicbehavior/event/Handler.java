package alpha.nomagicbehavior.event;

/**
 * Receiver of events triggered by an {@link EventOwner}.<p>
 *
 * The handler is stored by the owner and later found again for removal using
 * {@code equals()}. Lambdas and method references create a new instance each
 * time the expression is evaluated, so the same instance must be kept and
 * passed to {@link EventOwner#off(String, Handler) off}:
 * <pre>
 *   Handler h = this::onSave;
 *   owner.on("save", h);
 *   owner.off("save", h);
 * </pre>
 */
@FunctionalInterface
public interface Handler {
    /**
     * Handle an event.
     *
     * @param event the event (never {@code null})
     */
    void handle(Event event);
}
