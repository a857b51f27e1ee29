package alpha.nomagicbehavior.event;

/**
 * Thread-safe implementation of {@link EventOwner} that anyone may trigger
 * events on.<p>
 *
 * The class can be used as-is, as a central place for handlers to meet, or be
 * subclassed by a component that wishes to be extended with behaviors but
 * also wants to trigger its events publicly.
 *
 * @see AbstractEventOwner
 */
public class DefaultEventOwner extends AbstractEventOwner
{
    @Override
    public int trigger(String eventName) {
        return super.trigger(eventName);
    }

    @Override
    public int trigger(String eventName, Event event) {
        return super.trigger(eventName, event);
    }
}
