package com.ddm.iris.store;

import com.ddm.iris.defined.Colour4;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link LegacySkinDecoder} 类的单元测试。
 *
 * @author liyifei
 */
class LegacySkinDecoderTest {

    private final LegacySkinDecoder decoder = new LegacySkinDecoder();

    @Test
    void testEmptyContentUsesBaselineVersion() {
        SkinConfiguration config = decoder.decode("");
        assertEquals(SkinConfiguration.BASELINE_VERSION, config.getLegacyVersion());
        assertTrue(config.getComboColours().isEmpty());
        assertTrue(config.settingNames().isEmpty());
    }

    @Test
    void testGeneralAndColours() {
        String ini = """
                \uFEFF// exported skin
                [General]
                Name: Test Skin
                Version: 2.5
                CursorRotate: 1 // trailing comment

                [Colours]
                Combo2: 0,202,0
                Combo1: 255,192,0
                SliderBorder: 255,255,255
                MenuGlow: 0,78,155
                """;
        SkinConfiguration config = decoder.decode(ini);

        assertEquals(new BigDecimal("2.5"), config.getLegacyVersion());
        assertEquals("Test Skin", config.findSetting("Name").raw());
        assertEquals("1", config.findSetting("CursorRotate").raw());
        assertFalse(config.hasSetting("Version"));

        assertEquals(List.of(new Colour4(255, 192, 0), new Colour4(0, 202, 0)), config.getComboColours());
        assertEquals(Colour4.WHITE, config.findCustomColour("SliderBorder"));
        assertEquals(new Colour4(0, 78, 155), config.findCustomColour("MenuGlow"));
    }

    @Test
    void testVersionVariants() {
        assertEquals(SkinConfiguration.LATEST_VERSION, decoder.decode("Version: latest").getLegacyVersion());
        assertNull(decoder.decode("Version:").getLegacyVersion());
        assertNull(decoder.decode("Version: two").getLegacyVersion());
    }

    @Test
    void testInvalidLinesAreSkipped() {
        SkinConfiguration config = decoder.decode("""
                no separator here
                [Colours]
                Combo1: not,a,colour
                Combo2: 1,2,3
                """);
        assertEquals(List.of(new Colour4(1, 2, 3)), config.getComboColours());
        assertTrue(config.settingNames().isEmpty());
    }

    @Test
    void testSettingsInOtherSections() {
        SkinConfiguration config = decoder.decode("""
                [Mania]
                Keys: 4
                Version: 9
                """);
        assertEquals("4", config.findSetting("Keys").raw());
        assertEquals("9", config.findSetting("Version").raw());
        assertEquals(SkinConfiguration.BASELINE_VERSION, config.getLegacyVersion());
    }

    @Test
    void testDecodeFile(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("skin.ini");
        Files.writeString(ini, "[General]\nVersion: 2.0\n", StandardCharsets.UTF_8);
        assertEquals(new BigDecimal("2.0"), decoder.decode(ini).getLegacyVersion());
    }

    @Test
    void testDecodeLatin1File(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("skin.ini");
        Files.write(ini, "[General]\nName: Caf\u00e9\nVersion: 2.5\n".getBytes(StandardCharsets.ISO_8859_1));

        SkinConfiguration config = decoder.decode(ini);
        assertEquals(new BigDecimal("2.5"), config.getLegacyVersion());
        assertEquals("Caf\uFFFD", config.findSetting("Name").raw());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(UncheckedIOException.class, () -> decoder.decode(dir.resolve("missing.ini")));
    }
}
