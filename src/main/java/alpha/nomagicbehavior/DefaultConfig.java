package alpha.nomagicbehavior;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final boolean rollbackFailedAttach,
                          resolveNonPublicMethods;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                 = b;
        rollbackFailedAttach    = s.rollbackFailedAttach;
        resolveNonPublicMethods = s.resolveNonPublicMethods;
    }

    @Override
    public boolean rollbackFailedAttach() {
        return rollbackFailedAttach;
    }

    @Override
    public boolean resolveNonPublicMethods() {
        return resolveNonPublicMethods;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "rollbackFailedAttach=" + rollbackFailedAttach +
                ", resolveNonPublicMethods=" + resolveNonPublicMethods + "}";
    }

    /**
     * Builders are backwards-linked in a chain and the only state each of them
     * stores is a modifying action. The actions are replayed, oldest first,
     * against a fresh state container when the configuration is built.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder(null, null);

        static class MutableState {
            boolean rollbackFailedAttach    = true,
                    resolveNonPublicMethods = true;
        }

        private final DefaultBuilder prev;
        private final Consumer<MutableState> modifier;

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            this.prev = prev;
            this.modifier = modifier;
        }

        private DefaultBuilder then(Consumer<MutableState> modifier) {
            return new DefaultBuilder(this, requireNonNull(modifier));
        }

        @Override
        public Builder rollbackFailedAttach(boolean newVal) {
            return then(s -> s.rollbackFailedAttach = newVal);
        }

        @Override
        public Builder resolveNonPublicMethods(boolean newVal) {
            return then(s -> s.resolveNonPublicMethods = newVal);
        }

        @Override
        public Config build() {
            Deque<Consumer<MutableState>> mods = new ArrayDeque<>();
            for (var b = this; b.modifier != null; b = b.prev) {
                mods.addFirst(b.modifier);
            }
            var s = new MutableState();
            mods.forEach(m -> m.accept(s));
            return new DefaultConfig(this, s);
        }
    }
}
