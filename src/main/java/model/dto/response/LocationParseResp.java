package model.dto.response;

import lombok.Data;

/**
 * 箱位编码解析响应
 */
@Data
public class LocationParseResp {
    private String code;
    private boolean valid;

    private Integer stackNumber;
    private Integer row;
    private Integer tier;
    private String canonicalCode;   // 规范化后的编码

    private String error;
}
