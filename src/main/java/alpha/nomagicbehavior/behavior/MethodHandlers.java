package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.event.Event;
import alpha.nomagicbehavior.event.Handler;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Binds named methods into handlers.
 *
 * @see HandlerDescriptor
 */
final class MethodHandlers
{
    private MethodHandlers() {
        // Empty
    }

    /**
     * Bind a named method of the target.<p>
     *
     * If the target is a {@code Class}, a static method of that class is
     * looked up, otherwise an instance method of the target's runtime class.
     *
     * @param target receiver, or class of a static method
     * @param name of method
     * @param eventName for the error message
     * @param nonPublic whether non-public methods qualify
     *
     * @return a new handler
     *
     * @throws UnresolvedHandlerException
     *             if no qualifying method is found, or it can not be made
     *             accessible
     */
    static Handler bind(Object target, String name, String eventName, boolean nonPublic) {
        final boolean isStatic = target instanceof Class;
        final Class<?> type = isStatic ? (Class<?>) target : target.getClass();

        Method m = find(type, name, isStatic, nonPublic);
        if (m == null) {
            throw new UnresolvedHandlerException(
                    "No " + (isStatic ? "static" : "instance") + " method \"" + name +
                    "\" accepting an Event or nothing found in " + type.getName() +
                    " (event \"" + eventName + "\").");
        }
        if (!m.trySetAccessible()) {
            throw new UnresolvedHandlerException(
                    "Method not accessible: " + m + " (event \"" + eventName + "\").");
        }
        return new BoundMethod(isStatic ? null : target, m);
    }

    /**
     * Superclasses are searched first, up to but excluding {@code Object}.
     * For an instance target, default methods of all superinterfaces are
     * searched thereafter, in declaration order.
     */
    private static Method find(Class<?> type, String name, boolean isStatic, boolean nonPublic) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Method m = findDeclared(c, name, isStatic, nonPublic, false);
            if (m != null) {
                return m;
            }
        }
        if (isStatic) {
            return null;
        }
        for (Class<?> i : superInterfaces(type)) {
            Method m = findDeclared(i, name, false, nonPublic, true);
            if (m != null) {
                return m;
            }
        }
        return null;
    }

    private static Method findDeclared(
            Class<?> c, String name, boolean isStatic, boolean nonPublic, boolean onlyDefault) {
        Method noArg = null;
        for (Method m : c.getDeclaredMethods()) {
            if (!m.getName().equals(name) ||
                m.isSynthetic() ||
                (onlyDefault && !m.isDefault()) ||
                Modifier.isStatic(m.getModifiers()) != isStatic ||
                (!nonPublic && !Modifier.isPublic(m.getModifiers()))) {
                continue;
            }
            if (m.getParameterCount() == 1 &&
                m.getParameterTypes()[0].isAssignableFrom(Event.class)) {
                return m;
            }
            if (m.getParameterCount() == 0) {
                noArg = m;
            }
        }
        return noArg;
    }

    private static Set<Class<?>> superInterfaces(Class<?> type) {
        Set<Class<?>> found = new LinkedHashSet<>();
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            addInterfaces(c, found);
        }
        return found;
    }

    private static void addInterfaces(Class<?> c, Set<Class<?>> found) {
        for (Class<?> i : c.getInterfaces()) {
            if (found.add(i)) {
                addInterfaces(i, found);
            }
        }
    }

    /**
     * Uses identity equality. Two bindings of the same method are different
     * handlers.
     */
    private static final class BoundMethod implements Handler {
        private final Object receiver;
        private final Method method;
        private final boolean takesEvent;

        BoundMethod(Object receiver, Method method) {
            this.receiver = receiver;
            this.method = method;
            this.takesEvent = method.getParameterCount() == 1;
        }

        @Override
        public void handle(Event event) {
            try {
                if (takesEvent) {
                    method.invoke(receiver, event);
                } else {
                    method.invoke(receiver);
                }
            } catch (IllegalAccessException e) {
                throw new HandlerInvocationException("Failed to invoke " + this, e);
            } catch (InvocationTargetException e) {
                Throwable c = e.getCause();
                if (c instanceof RuntimeException) {
                    throw (RuntimeException) c;
                }
                if (c instanceof Error) {
                    throw (Error) c;
                }
                throw new HandlerInvocationException(this + " threw a checked exception.", c);
            }
        }

        @Override
        public String toString() {
            return method.getDeclaringClass().getSimpleName() + "::" + method.getName();
        }
    }
}
