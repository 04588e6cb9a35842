package com.ddm.iris.store;

import com.ddm.iris.defined.Colour4;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link SkinConfiguration} 类的单元测试。
 *
 * @author liyifei
 */
class SkinConfigurationTest {

    @Test
    void testExplicitNullIsDistinctFromMissing() {
        SkinConfiguration config = new SkinConfiguration();
        config.setSetting("Present", null);

        SkinConfiguration.SettingValue value = config.findSetting("Present");
        assertNotNull(value);
        assertNull(value.raw());
        assertTrue(config.hasSetting("Present"));

        assertNull(config.findSetting("Missing"));
        assertFalse(config.hasSetting("Missing"));

        config.removeSetting("Present");
        assertNull(config.findSetting("Present"));
    }

    @Test
    void testComboColoursAreImmutableSnapshots() {
        SkinConfiguration config = new SkinConfiguration();
        assertTrue(config.getComboColours().isEmpty());

        config.addComboColours(Colour4.RED);
        List<Colour4> snapshot = config.getComboColours();
        config.addComboColours(Colour4.WHITE, Colour4.BLACK);

        assertEquals(List.of(Colour4.RED), snapshot);
        assertEquals(List.of(Colour4.RED, Colour4.WHITE, Colour4.BLACK), config.getComboColours());
        assertThrows(UnsupportedOperationException.class, () -> config.getComboColours().add(Colour4.RED));

        config.clearComboColours();
        assertTrue(config.getComboColours().isEmpty());
    }

    @Test
    void testDefaults() {
        SkinConfiguration config = new SkinConfiguration();
        assertTrue(config.isAllowDefaultComboColoursFallback());
        assertNull(config.getLegacyVersion());
        assertEquals(4, SkinConfiguration.DEFAULT_COMBO_COLOURS.size());
        assertEquals(new BigDecimal("2.7"), SkinConfiguration.LATEST_VERSION);
    }

    @Test
    void testCustomColours() {
        SkinConfiguration config = new SkinConfiguration();
        config.setCustomColour("SliderBorder", Colour4.WHITE);
        assertEquals(Colour4.WHITE, config.findCustomColour("SliderBorder"));
        assertEquals(1, config.customColours().size());
        config.removeCustomColour("SliderBorder");
        assertNull(config.findCustomColour("SliderBorder"));
    }
}
