package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.Config;
import alpha.nomagicbehavior.event.EventOwner;
import alpha.nomagicbehavior.event.Handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Extends an {@link EventOwner} with additional behavior, without modifying
 * the owner's code.<p>
 *
 * A behavior declares which handler should be subscribed to which of the
 * owner's events, by overriding {@link #events()}. When the behavior is
 * {@linkplain #attach(EventOwner) attached} to an owner, the handlers are
 * subscribed, and when the behavior is {@linkplain #detach() detached}, the
 * very same handler objects are unsubscribed again.
 *
 * <pre>
 *   class AuditTrail extends Behavior{@literal <}Document{@literal >} {
 *       {@literal @}Override
 *       public Map{@literal <}String, HandlerDescriptor{@literal >} events() {
 *           return Map.of(Document.BEFORE_SAVE, HandlerDescriptor.method("onBeforeSave"));
 *       }
 *
 *       void onBeforeSave(Event ev) {
 *           owner().orElseThrow().setModifiedBy(currentUser());
 *       }
 *   }
 *
 *   Document doc = ...
 *   AuditTrail trail = new AuditTrail();
 *   trail.attach(doc);
 *   doc.save(); // invokes onBeforeSave
 *   trail.detach();
 *   doc.save(); // does not
 * </pre>
 *
 * A behavior has at most one owner at a time. The owner is only borrowed; its
 * lifetime is managed elsewhere.<p>
 *
 * Subclasses may override {@code attach} and {@code detach}, but must call the
 * super implementation.<p>
 *
 * This class is not thread-safe. {@code attach} and {@code detach} must not
 * be invoked concurrently on the same behavior.
 *
 * @param <O> type of owner
 */
public abstract class Behavior<O extends EventOwner>
{
    private static final System.Logger LOG
            = System.getLogger(Behavior.class.getPackageName());

    private final Config config;
    private final List<Registration> registrations;
    private O owner;

    /**
     * Constructs this object using {@link Config#DEFAULT}.
     */
    protected Behavior() {
        this(Config.DEFAULT);
    }

    /**
     * Constructs this object.
     *
     * @param config of behavior
     * @throws NullPointerException if {@code config} is {@code null}
     */
    protected Behavior(Config config) {
        this.config = requireNonNull(config);
        this.registrations = new ArrayList<>();
    }

    /**
     * Declares handlers for the owner's events.<p>
     *
     * Keys are event names and values describe the handler to subscribe to
     * that event. Handlers are subscribed in the iteration order of the
     * returned map. Use a {@link java.util.LinkedHashMap LinkedHashMap} when
     * order matters and more than one handler is declared.<p>
     *
     * This method is called once by each invocation of {@code attach}. The
     * result is not cached.<p>
     *
     * The default implementation returns an empty map.
     *
     * @return event names mapped to handler descriptors
     */
    public Map<String, HandlerDescriptor> events() {
        return Map.of();
    }

    /**
     * Attach this behavior to the given owner.<p>
     *
     * All handlers {@linkplain #events() declared} are resolved and
     * subscribed to the owner, in declaration order. No handler is invoked.<p>
     *
     * If a handler fails to resolve or the owner fails to subscribe it, then
     * what happens depends on {@link Config#rollbackFailedAttach()}. Either
     * all handlers subscribed so far are unsubscribed and this behavior is
     * left detached, or they remain subscribed and this behavior remains
     * attached. In both cases, the exception propagates.
     *
     * @param owner to attach to
     *
     * @throws NullPointerException
     *             if {@code owner} is {@code null}
     * @throws AlreadyAttachedException
     *             if this behavior is already attached
     * @throws UnresolvedHandlerException
     *             if a handler descriptor can not be resolved
     */
    public void attach(O owner) {
        requireNonNull(owner);
        if (this.owner != null) {
            throw new AlreadyAttachedException(this, this.owner);
        }
        this.owner = owner;
        try {
            for (var e : events().entrySet()) {
                final String name = e.getKey();
                final Handler h = requireNonNull(e.getValue(),
                        () -> "Descriptor is null for event: " + name)
                        .resolve(this, name, config);
                owner.on(name, h);
                registrations.add(new Registration(name, h));
            }
        } catch (RuntimeException | Error e) {
            if (config.rollbackFailedAttach()) {
                rollback(e);
            }
            throw e;
        }
        LOG.log(DEBUG, () -> "Attached " + this + " to " + owner +
                " with " + registrations.size() + " handler(s).");
    }

    /**
     * Detach this behavior from its owner.<p>
     *
     * All handlers subscribed by {@code attach} are unsubscribed, in the
     * order they were subscribed, using the same handler objects.<p>
     *
     * If this behavior is not attached, this method is a no-op.<p>
     *
     * An exception thrown by the owner does not stop the remaining handlers
     * from being unsubscribed, and this behavior is detached regardless.
     * The first exception is then rethrown with any subsequent ones added as
     * suppressed.
     */
    public void detach() {
        final O o = owner;
        if (o == null) {
            return;
        }
        RuntimeException thr = null;
        for (var r : registrations) {
            try {
                o.off(r.eventName(), r.handler());
            } catch (RuntimeException e) {
                if (thr == null) {
                    thr = e;
                } else {
                    thr.addSuppressed(e);
                }
            }
        }
        final int n = registrations.size();
        registrations.clear();
        owner = null;
        if (thr != null) {
            throw thr;
        }
        LOG.log(DEBUG, () -> "Detached " + this + " from " + o +
                ", removed " + n + " handler(s).");
    }

    /**
     * Returns the owner.
     *
     * @return the owner, or empty if not attached
     */
    public final Optional<O> owner() {
        return Optional.ofNullable(owner);
    }

    /**
     * Returns {@code true} if attached, otherwise {@code false}.
     *
     * @return see JavaDoc
     */
    public final boolean isAttached() {
        return owner != null;
    }

    /**
     * Returns a snapshot of the handlers subscribed to the current owner.
     *
     * @return registrations in subscription order (unmodifiable, never
     *         {@code null})
     */
    public final List<Registration> registrations() {
        return List.copyOf(registrations);
    }

    /**
     * Returns the configuration of this behavior.
     *
     * @return the configuration of this behavior
     */
    protected final Config config() {
        return config;
    }

    private void rollback(Throwable cause) {
        final O o = owner;
        final int n = registrations.size();
        for (int i = n - 1; i >= 0; --i) {
            var r = registrations.get(i);
            try {
                o.off(r.eventName(), r.handler());
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        registrations.clear();
        owner = null;
        LOG.log(WARNING, () -> "Failed to attach " + this + " to " + o +
                ", rolled back " + n + " handler(s).", cause);
    }
}
