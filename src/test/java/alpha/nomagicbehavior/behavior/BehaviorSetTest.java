package alpha.nomagicbehavior.behavior;

import alpha.nomagicbehavior.Config;
import alpha.nomagicbehavior.event.DefaultEventOwner;
import alpha.nomagicbehavior.event.EventOwner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link BehaviorSet}.
 */
class BehaviorSetTest
{
    private final List<String> log = new ArrayList<>();
    private final DefaultEventOwner owner = new DefaultEventOwner();
    private final BehaviorSet<DefaultEventOwner> testee = new BehaviorSet<>(owner);

    /**
     * Logs its tag on "x".
     */
    final class Tagging extends Behavior<EventOwner> {
        private final String tag;

        Tagging(String tag) {
            this.tag = tag;
        }

        @Override
        public Map<String, HandlerDescriptor> events() {
            return Map.of("x", HandlerDescriptor.of(ev -> log.add(tag)));
        }

        @Override
        public String toString() {
            return tag;
        }
    }

    @Test
    void attachAndGet() {
        var b = new Tagging("b");
        assertThat(testee.attach("named", b)).isNull();
        assertThat(testee.get("named")).isSameAs(b);
        assertThat(b.owner()).containsSame(owner);
        owner.trigger("x");
        assertThat(log).containsExactly("b");
    }

    @Test
    void sameNameReplaces() {
        var first = new Tagging("first");
        var second = new Tagging("second");
        testee.attach("n", first);
        assertThat(testee.attach("n", second)).isSameAs(first);

        assertThat(first.isAttached()).isFalse();
        assertThat(testee.size()).isOne();
        owner.trigger("x");
        assertThat(log).containsExactly("second");
    }

    @Test
    void anonymousKeys() {
        assertThat(testee.attach(new Tagging("a"))).isEqualTo("0");
        testee.attach("1", new Tagging("taken"));
        assertThat(testee.attach(new Tagging("b"))).isEqualTo("2");
        assertThat(testee.names()).containsExactly("0", "1", "2");
    }

    @Test
    void detachByName() {
        var b = new Tagging("b");
        testee.attach("n", b);
        assertThat(testee.detach("n")).isSameAs(b);
        assertThat(testee.detach("n")).isNull();
        assertThat(b.isAttached()).isFalse();
        assertThat(owner.hasHandlers("x")).isFalse();
        assertThat(testee.get("n")).isNull();
    }

    @Test
    void detachAll() {
        var a = new Tagging("a");
        var b = new Tagging("b");
        testee.attach("a", a);
        testee.attach("b", b);
        testee.detachAll();
        assertThat(testee.size()).isZero();
        assertThat(a.isAttached()).isFalse();
        assertThat(b.isAttached()).isFalse();
        assertThat(owner.trigger("x")).isZero();
    }

    @Test
    void alreadyAttachedElsewhere() {
        var old = new Tagging("old");
        var busy = new Tagging("busy");
        testee.attach("n", old);
        busy.attach(new DefaultEventOwner());

        assertThatThrownBy(() -> testee.attach("n", busy))
                .isExactlyInstanceOf(AlreadyAttachedException.class);
        // Set untouched
        assertThat(testee.get("n")).isSameAs(old);
        assertThat(old.isAttached()).isTrue();
    }

    @Test
    void failedAttachLeavesNothingBehind() {
        var broken = new Behavior<EventOwner>(
                Config.configuration().rollbackFailedAttach(false).build()) {
            @Override
            public Map<String, HandlerDescriptor> events() {
                var m = new LinkedHashMap<String, HandlerDescriptor>();
                m.put("A", HandlerDescriptor.of(ev -> log.add("A")));
                m.put("B", HandlerDescriptor.method("doesNotExist"));
                return m;
            }
        };
        assertThatThrownBy(() -> testee.attach("n", broken))
                .isExactlyInstanceOf(UnresolvedHandlerException.class);

        assertThat(broken.isAttached()).isFalse();
        assertThat(owner.hasHandlers("A")).isFalse();
        assertThat(testee.get("n")).isNull();
        testee.detachAll();
        assertThat(owner.trigger("A")).isZero();
        assertThat(log).isEmpty();
    }

    @Test
    void namesAreUnmodifiable() {
        testee.attach("n", new Tagging("t"));
        assertThatThrownBy(() -> testee.names().clear())
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
