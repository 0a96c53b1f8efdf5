package model.bo;

import common.consts.RingEnum;
import lombok.Value;
import model.entity.Point;

/**
 * 节点布设位置
 */
@Value
public class NodePlacement {
    String nodeId;
    RingEnum ring;
    Point position;
}
