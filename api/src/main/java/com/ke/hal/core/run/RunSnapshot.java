package com.ke.hal.core.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ke.hal.common.Tool;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 创建 run 时 assistant 配置的不可变副本，执行期间 assistant 的修改不影响该 run
 */
@Data
public class RunSnapshot {
    private String model;
    private String instructions;
    private List<Tool> tools = new ArrayList<>();
    @JsonProperty("file_ids")
    private List<String> fileIds = new ArrayList<>();
}
