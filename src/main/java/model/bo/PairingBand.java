package model.bo;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 配对号段
 * 号段内只有 "首号" 与 "首号+2" 能组成40尺配对，中间跳过的号码作为虚拟堆栈号
 */
@Getter
public class PairingBand {

    private final int start;
    private final int end;
    private final List<Integer> firstNumbers;

    /**
     * @param start        号段起始堆栈号 (含)
     * @param end          号段结束堆栈号 (含)
     * @param firstNumbers 配对首号列表，为空时按 start, start+4, ... 推导
     */
    public PairingBand(int start, int end, List<Integer> firstNumbers) {
        if (start <= 0 || end < start) {
            throw new BusinessException(ErrorCodes.INVALID_BAND + ": [" + start + ", " + end + "]");
        }
        this.start = start;
        this.end = end;
        this.firstNumbers = Collections.unmodifiableList(
                firstNumbers == null || firstNumbers.isEmpty() ? deriveFirstNumbers(start, end) : new ArrayList<>(firstNumbers));
        validate();
    }

    public PairingBand(int start, int end) {
        this(start, end, null);
    }

    private static List<Integer> deriveFirstNumbers(int start, int end) {
        List<Integer> result = new ArrayList<>();
        for (int first = start; first + 2 <= end; first += 4) {
            result.add(first);
        }
        return result;
    }

    // 首号与搭档都必须落在号段内，且搭档本身不能又是首号，否则 adjacentOf 不再是对合
    private void validate() {
        for (Integer first : firstNumbers) {
            if (first == null || first < start || first + 2 > end) {
                throw new BusinessException(ErrorCodes.INVALID_BAND + ": 首号 " + first + " 超出号段 [" + start + ", " + end + "]");
            }
            if (firstNumbers.contains(first + 2)) {
                throw new BusinessException(ErrorCodes.INVALID_BAND + ": 首号 " + first + " 的搭档 " + (first + 2) + " 同时也是首号");
            }
        }
    }

    public boolean contains(int stackNumber) {
        return stackNumber >= start && stackNumber <= end;
    }

    public boolean overlaps(PairingBand other) {
        return start <= other.end && other.start <= end;
    }

    /**
     * 号段内的搭档号，不是有效配对参与者时返回 null
     */
    public Integer partnerOf(int stackNumber) {
        if (!contains(stackNumber)) {
            return null;
        }
        if (firstNumbers.contains(stackNumber)) {
            return stackNumber + 2;
        }
        if (firstNumbers.contains(stackNumber - 2)) {
            return stackNumber - 2;
        }
        return null;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "] " + firstNumbers;
    }
}
