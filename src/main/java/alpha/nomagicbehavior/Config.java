package alpha.nomagicbehavior;

import alpha.nomagicbehavior.behavior.Behavior;
import alpha.nomagicbehavior.behavior.HandlerDescriptor;

/**
 * Behavior configuration.<p>
 *
 * The implementation is immutable and thread-safe.<p>
 *
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 *
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * <pre>
 *   Config strict = Config.configuration()
 *           .resolveNonPublicMethods(false)
 *           .build();
 * </pre>
 */
public interface Config
{
    /**
     * Values used:<p>
     *
     * Rollback failed attach = true <br>
     * Resolve non-public methods = true
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns a builder of the default configuration.
     *
     * @return {@code DEFAULT.toBuilder()}
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Undo the registrations made so far if {@link Behavior#attach attach}
     * fails half-way through, yes or no.<p>
     *
     * If {@code true}, an exception from resolving or subscribing a handler
     * causes all handlers already subscribed by the same attach call to be
     * unsubscribed again, in reverse order, and the behavior is left detached.
     * The exception is then rethrown.<p>
     *
     * If {@code false}, the handlers already subscribed stay subscribed and the
     * behavior stays attached to the owner. The application must call {@link
     * Behavior#detach()} to get rid of them.<p>
     *
     * The default implementation returns {@code true}.
     *
     * @return whether a failed attach is rolled back
     */
    boolean rollbackFailedAttach();

    /**
     * Allow a {@linkplain HandlerDescriptor#method(String) method name} to
     * resolve into a non-public method, yes or no.<p>
     *
     * If {@code false}, only public methods qualify and a non-public method
     * named in a descriptor fails resolution as if it did not exist.<p>
     *
     * The default implementation returns {@code true}.
     *
     * @return whether non-public methods are resolvable
     */
    boolean resolveNonPublicMethods();

    /**
     * Returns the builder instance that built this configuration.<p>
     *
     * The builder may be used for further customization of a new
     * configuration.
     *
     * @return the builder instance that built this configuration
     */
    Builder toBuilder();

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setter methods return a new builder
     * instance.
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#rollbackFailedAttach()
         */
        Builder rollbackFailedAttach(boolean newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#resolveNonPublicMethods()
         */
        Builder resolveNonPublicMethods(boolean newVal);

        /**
         * Builds the configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
