package service.classify;

import lombok.Getter;
import model.bo.ContainerSlot;
import model.bo.UnlocatedContainer;

/**
 * 单个集装箱的归类结果：要么归属某个单元，要么无法定位
 */
@Getter
public class Classification {

    private final Integer unitNumber;
    private final boolean virtualUnit;
    private final ContainerSlot slot;
    private final UnlocatedContainer unlocated;

    private Classification(Integer unitNumber, boolean virtualUnit, ContainerSlot slot, UnlocatedContainer unlocated) {
        this.unitNumber = unitNumber;
        this.virtualUnit = virtualUnit;
        this.slot = slot;
        this.unlocated = unlocated;
    }

    public static Classification located(int unitNumber, boolean virtualUnit, ContainerSlot slot) {
        return new Classification(unitNumber, virtualUnit, slot, null);
    }

    public static Classification unlocated(UnlocatedContainer unlocated) {
        return new Classification(null, false, null, unlocated);
    }

    public boolean isLocated() {
        return slot != null;
    }
}
