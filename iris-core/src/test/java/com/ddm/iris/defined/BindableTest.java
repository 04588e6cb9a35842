package com.ddm.iris.defined;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link Bindable} 类的单元测试。
 *
 * @author liyifei
 */
class BindableTest {

    @Test
    void testHoldsExplicitNull() {
        Bindable<String> b = Bindable.of(null);
        assertNull(b.get());
        assertNull(b.getValue());
    }

    @Test
    void testSetValueNotifiesListeners() {
        Bindable<Integer> b = new Bindable<>(1);
        List<Bindable.ValueChanged<Integer>> events = new ArrayList<>();
        b.bindValueChanged(events::add);

        b.setValue(2);
        b.setValue(2); // 相同值不通知
        b.setValue(null);

        assertEquals(List.of(new Bindable.ValueChanged<>(1, 2), new Bindable.ValueChanged<>(2, null)), events);
        assertNull(b.get());
    }

    @Test
    void testRunOnceImmediately() {
        Bindable<String> b = Bindable.of("x");
        List<Bindable.ValueChanged<String>> events = new ArrayList<>();
        b.bindValueChanged(events::add, true);
        assertEquals(1, events.size());
        assertEquals("x", events.get(0).newValue());
    }

    @Test
    void testUnbindAll() {
        Bindable<String> b = Bindable.of("x");
        List<Bindable.ValueChanged<String>> events = new ArrayList<>();
        b.bindValueChanged(events::add);
        b.unbindAll();
        b.setValue("y");
        assertTrue(events.isEmpty());
        assertEquals("y", b.get());
    }

    @Test
    void testIdentityEquality() {
        assertNotEquals(Bindable.of("x"), Bindable.of("x"));
    }
}
