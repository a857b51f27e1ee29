package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.event.EventOwner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Named behaviors attached to one owner.<p>
 *
 * Attaching a behavior under a name already in use detaches and replaces the
 * previous behavior. A behavior may also be attached anonymously, in which
 * case it is given the next free integer key ("0", "1", ...).<p>
 *
 * Names are kept in insertion order and {@link #detachAll()} detaches in that
 * order.<p>
 *
 * This class is not thread-safe.
 *
 * @param <O> type of owner
 */
public final class BehaviorSet<O extends EventOwner>
{
    private final O owner;
    private final Map<String, Behavior<? super O>> behaviors;
    private int nextKey;

    /**
     * Constructs this object.
     *
     * @param owner to attach behaviors to
     * @throws NullPointerException if {@code owner} is {@code null}
     */
    public BehaviorSet(O owner) {
        this.owner = requireNonNull(owner);
        this.behaviors = new LinkedHashMap<>();
    }

    /**
     * Returns the owner.
     *
     * @return the owner (never {@code null})
     */
    public O owner() {
        return owner;
    }

    /**
     * Attach a behavior under the given name.<p>
     *
     * If a behavior is already attached under the same name, it is detached
     * first. If the given behavior then fails to attach, the name will be
     * unbound and the behavior is detached, even if it was configured not to
     * roll back a failed attach. An exception from that detach is added as
     * suppressed to the attach failure.
     *
     * @param name of behavior
     * @param behavior to attach
     * @return the replaced behavior, or {@code null} if none
     *
     * @throws NullPointerException
     *             if any arg is {@code null}
     * @throws AlreadyAttachedException
     *             if the behavior is already attached
     *             (the set is not modified)
     * @throws UnresolvedHandlerException
     *             if a handler descriptor can not be resolved
     */
    public Behavior<? super O> attach(String name, Behavior<? super O> behavior) {
        requireNonNull(name);
        requireNonNull(behavior);
        if (behavior.isAttached()) {
            throw new AlreadyAttachedException(behavior, behavior.owner().get());
        }
        var old = behaviors.remove(name);
        if (old != null) {
            old.detach();
        }
        try {
            behavior.attach(owner);
        } catch (RuntimeException | Error e) {
            try {
                behavior.detach();
            } catch (RuntimeException next) {
                e.addSuppressed(next);
            }
            throw e;
        }
        behaviors.put(name, behavior);
        return old;
    }

    /**
     * Attach a behavior anonymously.
     *
     * @param behavior to attach
     * @return the generated name
     *
     * @throws NullPointerException
     *             if {@code behavior} is {@code null}
     * @throws AlreadyAttachedException
     *             if the behavior is already attached
     * @throws UnresolvedHandlerException
     *             if a handler descriptor can not be resolved
     */
    public String attach(Behavior<? super O> behavior) {
        requireNonNull(behavior);
        String name;
        do {
            name = Integer.toString(nextKey++);
        } while (behaviors.containsKey(name));
        attach(name, behavior);
        return name;
    }

    /**
     * Detach and remove the behavior of the given name.
     *
     * @param name of behavior
     * @return the detached behavior, or {@code null} if none
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Behavior<? super O> detach(String name) {
        var b = behaviors.remove(requireNonNull(name));
        if (b != null) {
            b.detach();
        }
        return b;
    }

    /**
     * Detach and remove all behaviors.
     */
    public void detachAll() {
        for (String name : new ArrayList<>(behaviors.keySet())) {
            detach(name);
        }
    }

    /**
     * Returns the behavior of the given name.
     *
     * @param name of behavior
     * @return the behavior, or {@code null} if none
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Behavior<? super O> get(String name) {
        return behaviors.get(requireNonNull(name));
    }

    /**
     * Returns the names of all behaviors, in insertion order.
     *
     * @return the names of all behaviors (unmodifiable snapshot)
     */
    public Set<String> names() {
        return unmodifiableSet(new LinkedHashSet<>(behaviors.keySet()));
    }

    /**
     * Returns the number of behaviors.
     *
     * @return the number of behaviors
     */
    public int size() {
        return behaviors.size();
    }
}
