package com.ddm.iris.source;

import com.ddm.iris.LookupContractException;
import com.ddm.iris.defined.Colour4;
import com.ddm.iris.defined.GlobalSkinColour;
import com.ddm.iris.defined.SkinAsset;
import com.ddm.iris.defined.SkinLookups;
import com.ddm.iris.store.SkinConfiguration;
import com.ddm.iris.utils.CoercionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link SkinSource} 类的单元测试。
 *
 * @author liyifei
 */
class SkinSourceTest {

    enum Setting {
        CursorExpand
    }

    private SkinConfiguration config;
    private SkinSource source;

    @BeforeEach
    void setUp() {
        config = new SkinConfiguration();
        source = new SkinSource("user", config);
    }

    @Test
    void testMissingSettingIsEmpty() {
        assertTrue(source.tryGetLocal(SkinLookups.setting("Missing")).isEmpty());
    }

    @Test
    void testSettingIsCoerced() {
        config.setSetting("CursorScale", "1.5");
        Optional<CoercionResult<Float>> result = source.tryGetLocal(SkinLookups.setting("CursorScale", Float.class));
        assertTrue(result.isPresent());
        assertEquals(CoercionResult.success(1.5f), result.get());
    }

    @Test
    void testUncoercibleSettingIsFailure() {
        config.setSetting("CursorScale", "big");
        Optional<CoercionResult<Float>> result = source.tryGetLocal(SkinLookups.setting("CursorScale", Float.class));
        assertTrue(result.isPresent());
        assertFalse(result.get().isSuccess());
    }

    @Test
    void testEnumKeyUsesConstantName() {
        config.setSetting("CursorExpand", "0");
        Optional<CoercionResult<Boolean>> result = source.tryGetLocal(SkinLookups.setting(Setting.CursorExpand, Boolean.class));
        assertEquals(Optional.of(CoercionResult.success(false)), result);
    }

    @Test
    void testColourSlots() {
        config.setCustomColour("SliderBorder", Colour4.RED);
        config.setCustomColour("MenuGlow", Colour4.WHITE);

        assertEquals(Optional.of(CoercionResult.success(Colour4.RED)),
                source.tryGetLocal(SkinLookups.customColour("SliderBorder")));
        assertEquals(Optional.of(CoercionResult.success(Colour4.WHITE)),
                source.tryGetLocal(SkinLookups.globalColour(GlobalSkinColour.MENU_GLOW)));
        assertTrue(source.tryGetLocal(SkinLookups.globalColour(GlobalSkinColour.STAR_BREAK_ADDITIVE)).isEmpty());
        assertTrue(source.tryGetLocal(SkinLookups.customColour("Other")).isEmpty());
    }

    @Test
    void testEmptyComboPaletteIsNotDefined() {
        assertTrue(source.tryGetLocal(SkinLookups.comboColours()).isEmpty());
        config.addComboColours(Colour4.RED);
        assertEquals(Optional.of(CoercionResult.success(List.of(Colour4.RED))),
                source.tryGetLocal(SkinLookups.comboColours()));
    }

    @Test
    void testVersionOnlyWhenSet() {
        assertTrue(source.tryGetLocal(SkinLookups.legacyVersion()).isEmpty());
        config.setLegacyVersion(new BigDecimal("2.3"));
        assertEquals(Optional.of(CoercionResult.success(new BigDecimal("2.3"))),
                source.tryGetLocal(SkinLookups.legacyVersion()));
    }

    @Test
    void testContractViolationThrowsEvenWhenUndefined() {
        assertThrows(LookupContractException.class,
                () -> source.tryGetLocal(SkinLookups.customColour("SliderBorder", Integer.class)));
    }

    // ==================== 资源定位 ====================

    @Test
    void testLocateAssets(@TempDir Path dir) throws IOException {
        Files.createFile(dir.resolve("cursor.png"));
        Files.createFile(dir.resolve("cursor@2x.png"));
        Files.createFile(dir.resolve("hitnormal.ogg"));
        SkinSource withAssets = new SkinSource("user", config, dir);

        SkinAsset texture = withAssets.getTexture("cursor");
        assertNotNull(texture);
        assertEquals(SkinAsset.Kind.TEXTURE, texture.kind());
        assertEquals(dir.toAbsolutePath().normalize().resolve("cursor@2x.png"), texture.location());
        assertEquals("user", texture.source());

        SkinAsset sample = withAssets.getSample("hitnormal");
        assertNotNull(sample);
        assertEquals(SkinAsset.Kind.SAMPLE, sample.kind());

        assertNull(withAssets.getTexture("missing"));
        assertNull(withAssets.getSample("cursor"));
    }

    @Test
    void testAssetsOutsideRootAreRejected(@TempDir Path dir) throws IOException {
        Path root = Files.createDirectory(dir.resolve("skin"));
        Files.createFile(dir.resolve("secret.png"));
        SkinSource withAssets = new SkinSource("user", config, root);

        assertNull(withAssets.getTexture("../secret"));
        assertNull(withAssets.getTexture(""));
    }

    @Test
    void testNoAssetRoot() {
        assertNull(source.getTexture("cursor"));
        assertNull(source.getSample("hitnormal"));
    }
}
