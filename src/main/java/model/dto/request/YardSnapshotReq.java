package model.dto.request;

import lombok.Data;
import model.entity.Container;
import model.entity.PhysicalStack;

import java.util.List;

/**
 * 堆场快照请求：堆栈 + 集装箱
 * 直接复用 Entity，依靠 JacksonConfig 忽略多余字段
 */
@Data
public class YardSnapshotReq {

    private String reqId;       // 请求ID

    private List<PhysicalStack> stacks;
    private List<Container> containers;
}
