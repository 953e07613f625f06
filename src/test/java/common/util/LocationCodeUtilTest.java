package common.util;

import common.exception.BusinessException;
import model.bo.LocationCoordinate;
import model.bo.LocationParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("箱位编码解析与格式化")
class LocationCodeUtilTest {

    @Test
    @DisplayName("带分隔符的编码解析为 (7,2,3)")
    void testParseHyphenated() {
        LocationParseResult result = LocationCodeUtil.parse("S07-R2-H3");
        assertTrue(result.isSuccess());
        assertEquals(new LocationCoordinate(7, 2, 3), result.getCoordinate());
        assertNull(result.getError());
    }

    @Test
    @DisplayName("小写与层号别名 T 等价")
    void testParseLowercaseTierAlias() {
        LocationParseResult result = LocationCodeUtil.parse("s07r2t3");
        assertTrue(result.isSuccess());
        assertEquals(new LocationCoordinate(7, 2, 3), result.getCoordinate());
    }

    @Test
    @DisplayName("补零与不补零的堆栈号等价")
    void testParsePaddingInsensitive() {
        assertEquals(LocationCodeUtil.parse("S1R1H1").getCoordinate(), LocationCodeUtil.parse("S01R1H1").getCoordinate());
        assertEquals(LocationCodeUtil.parse("S1R1H1").getCoordinate(), LocationCodeUtil.parse("S001R1H1").getCoordinate());
    }

    @Test
    @DisplayName("首尾分隔符与空白被忽略")
    void testParseIgnoresEdgeSeparators() {
        LocationParseResult result = LocationCodeUtil.parse("  -S101-R4-H2- ");
        assertTrue(result.isSuccess());
        assertEquals(new LocationCoordinate(101, 4, 2), result.getCoordinate());
    }

    @Test
    @DisplayName("非数字排号返回失败结果而不是抛异常")
    void testParseNonNumericRow() {
        LocationParseResult result = LocationCodeUtil.parse("S99-RX-H1");
        assertFalse(result.isSuccess());
        assertNull(result.getCoordinate());
        assertNotNull(result.getError());
        assertEquals("S99-RX-H1", result.getRawCode());
    }

    @Test
    @DisplayName("缺少分量、零值、空串、null 都解析失败")
    void testParseInvalidInputs() {
        assertFalse(LocationCodeUtil.parse("S07R2").isSuccess());
        assertFalse(LocationCodeUtil.parse("R2H3").isSuccess());
        assertFalse(LocationCodeUtil.parse("S07H3").isSuccess());
        assertFalse(LocationCodeUtil.parse("S00R1H1").isSuccess());
        assertFalse(LocationCodeUtil.parse("S07R0H1").isSuccess());
        assertFalse(LocationCodeUtil.parse("S07R1H0").isSuccess());
        assertFalse(LocationCodeUtil.parse("S07R1X1").isSuccess());
        assertFalse(LocationCodeUtil.parse("S07--R1H1").isSuccess());
        assertFalse(LocationCodeUtil.parse("S99999999999R1H1").isSuccess());
        assertFalse(LocationCodeUtil.parse("").isSuccess());
        assertFalse(LocationCodeUtil.parse(null).isSuccess());
    }

    @Test
    @DisplayName("格式化补零到两位")
    void testFormat() {
        assertEquals("S07R2H3", LocationCodeUtil.format(7, 2, 3));
        assertEquals("S101R1H1", LocationCodeUtil.format(101, 1, 1));
        assertEquals("S007R2H3", LocationCodeUtil.format(7, 2, 3, 3));
    }

    @Test
    @DisplayName("格式化拒绝非正数")
    void testFormatRejectsNonPositive() {
        assertThrows(BusinessException.class, () -> LocationCodeUtil.format(0, 1, 1));
        assertThrows(BusinessException.class, () -> LocationCodeUtil.format(3, -1, 1));
    }

    @Test
    @DisplayName("parse(format(s,r,t)) == (s,r,t)")
    void testRoundTrip() {
        for (int stack = 1; stack <= 120; stack += 7) {
            for (int row = 1; row <= 12; row += 3) {
                for (int tier = 1; tier <= 6; tier++) {
                    LocationParseResult result = LocationCodeUtil.parse(LocationCodeUtil.format(stack, row, tier));
                    assertTrue(result.isSuccess());
                    assertEquals(new LocationCoordinate(stack, row, tier), result.getCoordinate());
                }
            }
        }
    }
}
