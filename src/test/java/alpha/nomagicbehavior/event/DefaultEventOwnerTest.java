package alpha.nomagicbehavior.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Small tests of {@code DefaultEventOwner}.
 */
class DefaultEventOwnerTest {
    private final List<String> events = new ArrayList<>();
    private final Handler collector
            = ev -> events.add(ev.name() + ":" + ev.data());

    @Test
    void oneHandlerCycle() {
        var owner = new DefaultEventOwner();
        assertTrue(owner.on("save", collector));
        assertThat(owner.trigger("save", new Event(123))).isOne();
        assertThat(events).containsExactly("save:123");
        events.clear();
        assertTrue(owner.off("save", collector));
        assertThat(owner.trigger("save")).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void senderIsOwner() {
        var owner = new DefaultEventOwner();
        var ev = new Event();
        owner.on("x", e -> {});
        owner.trigger("x", ev);
        assertThat(ev.sender()).isSameAs(owner);
        assertThat(ev.name()).isEqualTo("x");
    }

    @Test
    void registrationOrderPreserved() {
        var owner = new DefaultEventOwner();
        owner.on("x", ev -> events.add("first"));
        owner.on("x", ev -> events.add("second"));
        owner.on("x", ev -> events.add("third"));
        owner.trigger("x");
        assertThat(events).containsExactly("first", "second", "third");
    }

    @Test
    void duplicatesAllowed() {
        var owner = new DefaultEventOwner();
        assertTrue(owner.on("x", collector));
        assertTrue(owner.on("x", collector));
        assertThat(owner.handlerCount("x")).isEqualTo(2);
        assertThat(owner.trigger("x")).isEqualTo(2);
        // Each off removes one
        assertTrue(owner.off("x", collector));
        assertThat(owner.handlerCount("x")).isOne();
        assertTrue(owner.off("x", collector));
        assertFalse(owner.hasHandlers("x"));
    }

    @Test
    void offUnknownIsNoop() {
        var owner = new DefaultEventOwner();
        assertFalse(owner.off("never", collector));
        owner.on("x", ev -> {});
        assertFalse(owner.off("x", collector));
        assertThat(owner.handlerCount("x")).isOne();
    }

    @Test
    void lambdaIdentity() {
        var owner = new DefaultEventOwner();
        owner.on("x", this::collect);
        // A new method reference is a new object
        assertFalse(owner.off("x", this::collect));
        assertThat(owner.handlerCount("x")).isOne();
    }

    @Test
    void handledStopsPropagation() {
        var owner = new DefaultEventOwner();
        AtomicInteger n = new AtomicInteger();
        owner.on("x", ev -> n.incrementAndGet());
        owner.on("x", ev -> ev.setHandled(true));
        owner.on("x", ev -> n.incrementAndGet());
        var ev = new Event();
        assertThat(owner.trigger("x", ev)).isEqualTo(2);
        assertThat(n).hasValue(1);
        assertTrue(ev.isHandled());
        // Flag is reset by the next trigger
        assertThat(owner.trigger("x", ev)).isEqualTo(2);
    }

    @Test
    void handlerMayUnsubscribeItselfDuringTrigger() {
        var owner = new DefaultEventOwner();
        Handler once = new Handler() {
            @Override
            public void handle(Event ev) {
                events.add("once");
                owner.off("x", this);
            }
        };
        owner.on("x", once);
        owner.on("x", collector);
        owner.trigger("x");
        owner.trigger("x");
        assertThat(events).containsExactly("once", "x:null", "x:null");
    }

    @Test
    void handlerExceptionPropagates() {
        var owner = new DefaultEventOwner();
        owner.on("x", ev -> { throw new IllegalStateException("boom"); });
        owner.on("x", collector);
        assertThatThrownBy(() -> owner.trigger("x"))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertThat(events).isEmpty();
    }

    @Test
    void nullArgs() {
        var owner = new DefaultEventOwner();
        assertThatThrownBy(() -> owner.on(null, collector))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> owner.on("x", null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> owner.off("x", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void customBackingStore() {
        class UnsafeLocalOwner extends AbstractEventOwner {
            UnsafeLocalOwner() {
                super(new HashMap<>(), ArrayList::new);
            }
        }
        var owner = new UnsafeLocalOwner();
        owner.on("x", collector);
        assertThat(owner.trigger("x")).isOne();
        assertThat(events).containsExactly("x:null");
    }

    private void collect(Event ev) {
        events.add(ev.name());
    }
}
