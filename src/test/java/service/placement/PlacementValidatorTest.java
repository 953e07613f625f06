package service.placement;

import common.consts.PlacementCheckEnum;
import engine.YardResolutionEngine;
import model.bo.PlacementCheckResult;
import model.bo.TopologySettings;
import model.bo.YardResolution;
import model.entity.Container;
import model.entity.PhysicalStack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static testutil.YardFixtures.*;

@DisplayName("放箱校验")
class PlacementValidatorTest {

    private YardResolutionEngine engine;
    private PlacementValidator validator;
    private Map<Integer, PhysicalStack> stacksByNumber;
    private YardResolution resolution;

    @BeforeEach
    void setUp() {
        engine = new YardResolutionEngine(TopologySettings.defaults());
        validator = new PlacementValidator(engine.getTopology(), engine.getCapacityCalculator());

        PhysicalStack inactive = stack20(9);
        inactive.setActive(false);
        PhysicalStack full = stack(11, "20ft", 1, 1);
        PhysicalStack shaped = stack20(15);
        shaped.setRowTierOverrides(listOf(rowTier(1, 2)));
        List<PhysicalStack> stacks = listOf(special(1, "40ft"), stack40(3), stack40(5), stack20(7), inactive, full, shaped);

        stacksByNumber = new LinkedHashMap<>();
        for (PhysicalStack stack : stacks) {
            stacksByNumber.put(stack.getStackNumber(), stack);
        }
        List<Container> containers = listOf(
                container("C1", "40ft", "S03R1H1"),
                container("C2", "20ft", "S11R1H1"));
        resolution = engine.resolve(stacks, containers);
    }

    private PlacementCheckEnum check(String code, String size) {
        PlacementCheckResult result = validator.validate(resolution, stacksByNumber, code, size);
        assertEquals(result.getCode() == PlacementCheckEnum.VALID, result.isValid());
        return result.getCode();
    }

    @Test
    @DisplayName("空闲箱位可放")
    void testValid() {
        assertEquals(PlacementCheckEnum.VALID, check("S05R2H1", "40ft"));
        assertEquals(PlacementCheckEnum.VALID, check("S04R2H1", "40ft"));
        assertEquals(PlacementCheckEnum.VALID, check("S07R6H4", "20ft"));
    }

    @Test
    @DisplayName("配对单元内同一排层已被占用")
    void testSlotOccupiedAcrossPair() {
        assertEquals(PlacementCheckEnum.SLOT_OCCUPIED, check("S05R1H1", "40ft"));
        assertEquals(PlacementCheckEnum.SLOT_OCCUPIED, check("S04R1H1", "40ft"));
    }

    @Test
    @DisplayName("编码错误或堆栈不存在")
    void testInvalidCodes() {
        assertEquals(PlacementCheckEnum.INVALID_FORMAT, check("S99-RX-H1", "20ft"));
        assertEquals(PlacementCheckEnum.STACK_NOT_FOUND, check("S50R1H1", "20ft"));
    }

    @Test
    @DisplayName("箱型、特殊堆栈、启用状态")
    void testStackRules() {
        assertEquals(PlacementCheckEnum.SIZE_MISMATCH, check("S07R1H1", "40ft"));
        assertEquals(PlacementCheckEnum.SPECIAL_STACK, check("S01R1H1", "40ft"));
        assertEquals(PlacementCheckEnum.VALID, check("S01R1H1", "20ft"));
        assertEquals(PlacementCheckEnum.STACK_INACTIVE, check("S09R1H1", "20ft"));
    }

    @Test
    @DisplayName("排层越界与单元已满")
    void testRangeAndCapacity() {
        assertEquals(PlacementCheckEnum.ROW_OUT_OF_RANGE, check("S07R7H1", "20ft"));
        assertEquals(PlacementCheckEnum.TIER_OUT_OF_RANGE, check("S07R1H5", "20ft"));
        assertEquals(PlacementCheckEnum.TIER_OUT_OF_RANGE, check("S15R1H3", "20ft"));
        assertEquals(PlacementCheckEnum.VALID, check("S15R2H4", "20ft"));
        assertEquals(PlacementCheckEnum.UNIT_FULL, check("S11R1H1", "20ft"));
    }
}
