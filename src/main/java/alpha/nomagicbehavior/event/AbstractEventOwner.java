package alpha.nomagicbehavior.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A synchronous implementation of {@link EventOwner} servicing the subclass
 * with a protected {@link #trigger(String, Event)} method.<p>
 *
 * The implementation is backed by a {@code Map} of event names to a {@code
 * List} of handlers. Handlers are appended on subscription and invoked in list
 * order, which is the subscription order.<p>
 *
 * By default, the owner will be backed by concurrent data structures; a
 * {@link CopyOnWriteArrayList} per event name. Subscribing and unsubscribing
 * is thread-safe and a trigger iterates a snapshot that is not affected by
 * handlers coming or going while it is running. But this can be customized.
 * For example, here's how to create an owner which is not thread-safe:
 * <pre>
 *   class UnsafeLocalOwner extends AbstractEventOwner {
 *       UnsafeLocalOwner() {
 *           super(new HashMap{@literal <}{@literal >}(), ArrayList::new);
 *       }
 *   }
 * </pre>
 *
 * A non-concurrent list will throw a {@code ConcurrentModificationException}
 * if a handler subscribes or unsubscribes to the same event while the event is
 * being triggered.
 */
public abstract class AbstractEventOwner implements EventOwner
{
    private final Map<String, List<Handler>> handlers;
    private final Supplier<? extends List<Handler>> listImpl;

    /**
     * Constructs a thread-safe owner backed by a {@link ConcurrentHashMap}
     * and value-lists of type {@link CopyOnWriteArrayList}.
     */
    protected AbstractEventOwner() {
        // Subscriptions are rare, triggers are not
        this(new ConcurrentHashMap<>(), CopyOnWriteArrayList::new);
    }

    /**
     * Constructs an owner.
     *
     * @param mapImpl to use as handlers' map
     * @param listImpl to use as handlers' container (map value)
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractEventOwner(
            Map<String, List<Handler>> mapImpl,
            Supplier<? extends List<Handler>> listImpl)
    {
        this.handlers = requireNonNull(mapImpl);
        this.listImpl = requireNonNull(listImpl);
    }

    @Override
    public boolean on(String eventName, Handler handler) {
        requireNonNull(eventName);
        requireNonNull(handler);
        return handlers.computeIfAbsent(eventName, k -> listImpl.get())
                       .add(handler);
    }

    @Override
    public boolean off(String eventName, Handler handler) {
        requireNonNull(eventName);
        requireNonNull(handler);
        var list = handlers.get(eventName);
        return list != null && list.remove(handler);
    }

    /**
     * Returns {@code true} if at least one handler is subscribed to the given
     * event, otherwise {@code false}.
     *
     * @param eventName name of event
     * @return see JavaDoc
     * @throws NullPointerException if {@code eventName} is {@code null}
     */
    public boolean hasHandlers(String eventName) {
        return handlerCount(eventName) > 0;
    }

    /**
     * Returns the number of subscriptions to the given event.<p>
     *
     * A handler subscribed twice counts twice.
     *
     * @param eventName name of event
     * @return number of subscriptions
     * @throws NullPointerException if {@code eventName} is {@code null}
     */
    public int handlerCount(String eventName) {
        var list = handlers.get(requireNonNull(eventName));
        return list == null ? 0 : list.size();
    }

    /**
     * Synchronously trigger an event without data.<p>
     *
     * This is equivalent to {@code trigger(eventName, new Event())}.
     *
     * @param eventName name of event
     * @return a count of handlers invoked
     * @throws NullPointerException if {@code eventName} is {@code null}
     */
    protected int trigger(String eventName) {
        return trigger(eventName, new Event());
    }

    /**
     * Synchronously trigger an event.<p>
     *
     * The event's name and sender is set to the given name and this owner, and
     * the handled flag is reset. Then subscribed handlers are invoked in the
     * order they subscribed until one of them marks the event as handled.<p>
     *
     * An exception thrown by a handler propagates to the caller and the
     * remaining handlers will miss out on the event.
     *
     * @param eventName name of event
     * @param event to pass to handlers
     * @return a count of handlers invoked
     * @throws NullPointerException if any arg is {@code null}
     */
    protected int trigger(String eventName, Event event) {
        requireNonNull(event);
        var list = handlers.getOrDefault(requireNonNull(eventName), List.of());
        event.prepare(eventName, this);
        int n = 0;
        for (Handler h : list) {
            h.handle(event);
            ++n;
            if (event.isHandled()) {
                break;
            }
        }
        return n;
    }
}
