package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.Config;
import alpha.nomagicbehavior.event.Handler;

import static java.util.Objects.requireNonNull;

/**
 * A declared, not yet resolved, reference to the code that should run when an
 * event is triggered.<p>
 *
 * A descriptor is one of three kinds, each created by a static factory:
 *
 * <ul>
 *   <li>{@link #method(String)}: the name of a method on the behavior itself</li>
 *   <li>{@link #method(Object, String)}: the name of a method on some other
 *       object, or a static method if the object is a {@code Class}</li>
 *   <li>{@link #of(Handler)}: a ready-made handler, used as-is</li>
 * </ul>
 *
 * A named method qualifies if it accepts exactly one parameter to which an
 * {@link alpha.nomagicbehavior.event.Event Event} can be assigned, or if it
 * accepts no parameters at all. If both exist, the one-parameter method wins.
 * Methods declared in a subclass shadow methods of the same name declared in a
 * superclass. Whether non-public methods qualify is decided by {@link
 * Config#resolveNonPublicMethods()}.<p>
 *
 * Each resolution of a named method produces a new handler object, which is
 * not equal to a handler produced by any other resolution. This is why a
 * {@link Behavior} remembers the exact handlers it subscribed.<p>
 *
 * Descriptors are immutable.
 */
public abstract class HandlerDescriptor
{
    /**
     * Returns a descriptor of a method declared by the behavior.
     *
     * @param name of method
     * @return a descriptor
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static HandlerDescriptor method(String name) {
        return new OwnMethod(name);
    }

    /**
     * Returns a descriptor of a method declared by the given target.<p>
     *
     * If the target is a {@code Class}, the name refers to a static method of
     * that class. Otherwise, the name refers to an instance method of the
     * target's runtime class.
     *
     * @param target receiver of the method, or class declaring a static method
     * @param name of method
     * @return a descriptor
     * @throws NullPointerException if any arg is {@code null}
     */
    public static HandlerDescriptor method(Object target, String name) {
        return new TargetMethod(target, name);
    }

    /**
     * Returns a descriptor of the given handler.<p>
     *
     * The handler will be subscribed as-is; resolution is the identity
     * function.
     *
     * @param handler to subscribe
     * @return a descriptor
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public static HandlerDescriptor of(Handler handler) {
        return new Direct(handler);
    }

    HandlerDescriptor() {
        // Only this package
    }

    /**
     * Resolve this descriptor into a handler.
     *
     * @param behavior being attached
     * @param eventName the descriptor is declared for
     * @param config of behavior
     * @return a handler
     * @throws UnresolvedHandlerException if no handler can be resolved
     */
    abstract Handler resolve(Behavior<?> behavior, String eventName, Config config);

    private static final class OwnMethod extends HandlerDescriptor {
        private final String name;

        OwnMethod(String name) {
            this.name = requireNonNull(name);
        }

        @Override
        Handler resolve(Behavior<?> behavior, String eventName, Config config) {
            return MethodHandlers.bind(behavior, name, eventName, config.resolveNonPublicMethods());
        }

        @Override
        public String toString() {
            return "method(" + name + ")";
        }
    }

    private static final class TargetMethod extends HandlerDescriptor {
        private final Object target;
        private final String name;

        TargetMethod(Object target, String name) {
            this.target = requireNonNull(target);
            this.name = requireNonNull(name);
        }

        @Override
        Handler resolve(Behavior<?> behavior, String eventName, Config config) {
            return MethodHandlers.bind(target, name, eventName, config.resolveNonPublicMethods());
        }

        @Override
        public String toString() {
            return "method(" + target + ", " + name + ")";
        }
    }

    private static final class Direct extends HandlerDescriptor {
        private final Handler handler;

        Direct(Handler handler) {
            this.handler = requireNonNull(handler);
        }

        @Override
        Handler resolve(Behavior<?> behavior, String eventName, Config config) {
            return handler;
        }

        @Override
        public String toString() {
            return "of(" + handler + ")";
        }
    }
}
