package model.bo;

import common.config.YardTopologyProperties;
import common.consts.SizeClassEnum;
import common.exception.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("拓扑配置校验")
class TopologySettingsTest {

    @Test
    @DisplayName("缺省号段推导出参考堆场的首号")
    void testDerivedFirstNumbers() {
        TopologySettings settings = TopologySettings.defaults();
        assertEquals(Arrays.asList(3, 7, 11, 15, 19, 23, 27), settings.getBands().get(0).getFirstNumbers());
        assertEquals(Arrays.asList(33, 37, 41, 45, 49, 53), settings.getBands().get(1).getFirstNumbers());
        assertEquals(Arrays.asList(61, 65, 69, 73, 77, 81, 85, 89, 93, 97), settings.getBands().get(2).getFirstNumbers());
        assertNull(settings.bandOf(31));
        assertSame(settings.getBands().get(1), settings.bandOf(40));
    }

    @Test
    @DisplayName("重叠号段被拒绝")
    void testOverlappingBands() {
        List<PairingBand> bands = Arrays.asList(new PairingBand(3, 29), new PairingBand(29, 41));
        assertThrows(BusinessException.class,
                () -> new TopologySettings(Collections.emptySet(), bands, Collections.emptyMap(), 2));
    }

    @Test
    @DisplayName("首号越界或搭档同为首号被拒绝")
    void testInvalidFirstNumbers() {
        assertThrows(BusinessException.class, () -> new PairingBand(3, 29, Arrays.asList(29)));
        assertThrows(BusinessException.class, () -> new PairingBand(3, 29, Arrays.asList(3, 5)));
        assertThrows(BusinessException.class, () -> new PairingBand(10, 5));
    }

    @Test
    @DisplayName("Spring 配置对象转换为不可变配置")
    void testPropertiesConversion() {
        YardTopologyProperties properties = new YardTopologyProperties();
        properties.getSizeOverrides().put(61, "20ft");
        properties.getSizeOverrides().put(63, "bogus");
        properties.setSpecialStacks(Arrays.asList(1, 31));

        TopologySettings settings = properties.toSettings();
        assertEquals(3, settings.getBands().size());
        assertEquals(SizeClassEnum.SIZE_20, settings.getSizeOverrides().get(61));
        assertFalse(settings.getSizeOverrides().containsKey(63));
        assertTrue(settings.isSpecial(31));
        assertFalse(settings.isSpecial(101));
    }
}
