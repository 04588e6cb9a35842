package com.ddm.iris;

import com.ddm.iris.chain.ResolutionChain;
import com.ddm.iris.defined.SkinLookups;
import com.ddm.iris.source.SkinSource;
import com.ddm.iris.store.SkinConfiguration;
import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * {@link SkinRequester} 类的单元测试。
 *
 * @author liyifei
 */
class SkinRequesterTest {

    private static ResolutionChain chainWith(String name, String value) {
        SkinConfiguration config = new SkinConfiguration();
        config.setSetting("Test", value);
        return ResolutionChain.of(new SkinSource(name, config));
    }

    @Test
    void testDelegatesToChain() {
        SkinRequester requester = SkinRequester.of(chainWith("user", "hello"));
        assertEquals("hello", requester.getConfig(SkinLookups.setting("Test")).getValue());
        assertNull(requester.getConfig(SkinLookups.setting("Missing")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testPicksUpRebuiltChainBetweenCalls() {
        Supplier<ResolutionChain> supplier = mock(Supplier.class);
        when(supplier.get()).thenReturn(chainWith("first", "1"), chainWith("second", "2"));

        SkinRequester requester = new SkinRequester(supplier);
        assertEquals(1, requester.getConfig(SkinLookups.setting("Test", Integer.class)).getValue());
        assertEquals(2, requester.getConfig(SkinLookups.setting("Test", Integer.class)).getValue());
        verify(supplier, times(2)).get();
    }

    @Test
    void testMissingChainResolvesAsEmpty() {
        SkinRequester requester = new SkinRequester(() -> null);
        assertNull(requester.getConfig(SkinLookups.setting("Test")));
        assertEquals(SkinConfiguration.LATEST_VERSION, requester.getConfig(SkinLookups.legacyVersion()).getValue());
        assertNull(requester.getTexture("cursor"));
    }

    @Test
    void testContractViolationPropagates() {
        SkinRequester requester = SkinRequester.of(ResolutionChain.empty());
        assertThrows(LookupContractException.class,
                () -> requester.getConfig(SkinLookups.customColour("Colour1", Integer.class)));
    }
}
