package alpha.nomagicbehavior.event;

/**
 * An event, as passed to a {@link Handler}.<p>
 *
 * The owner populates the {@link #name() name} and {@link #sender() sender}
 * when the event is triggered. Whoever triggers the event may pass along
 * arbitrary {@link #data() data}.<p>
 *
 * A handler may {@linkplain #setHandled(boolean) mark} the event as handled,
 * in which case the remaining handlers will not be invoked (if the owner is an
 * {@link AbstractEventOwner}).<p>
 *
 * This class is not thread-safe. An event object is meant to be created and
 * triggered by one thread.
 */
public class Event
{
    private String name;
    private Object sender;
    private Object data;
    private boolean handled;

    /**
     * Constructs an event without data.
     */
    public Event() {
        this(null);
    }

    /**
     * Constructs an event.
     *
     * @param data passed to handlers (may be {@code null})
     */
    public Event(Object data) {
        this.data = data;
    }

    /**
     * Returns the event name.
     *
     * @return the event name ({@code null} if not yet triggered)
     */
    public String name() {
        return name;
    }

    /**
     * Returns the owner that triggered this event.
     *
     * @return the sender ({@code null} if not yet triggered)
     */
    public Object sender() {
        return sender;
    }

    /**
     * Returns the data passed along with the event.
     *
     * @return the data (may be {@code null})
     */
    public Object data() {
        return data;
    }

    /**
     * Returns whether a handler has marked this event as handled.
     *
     * @return {@code true} if handled, otherwise {@code false}
     */
    public boolean isHandled() {
        return handled;
    }

    /**
     * Mark this event as handled, or not.
     *
     * @param handled new value
     */
    public void setHandled(boolean handled) {
        this.handled = handled;
    }

    void prepare(String name, Object sender) {
        this.name = name;
        this.sender = sender;
        this.handled = false;
    }

    @Override
    public String toString() {
        return Event.class.getSimpleName() + "{" +
                "name=" + name +
                ", data=" + data +
                ", handled=" + handled + "}";
    }
}
