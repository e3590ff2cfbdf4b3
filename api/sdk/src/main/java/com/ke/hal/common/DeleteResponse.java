package com.ke.hal.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 删除接口的响应，object 为 "{资源}.deleted"
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DeleteResponse {
    private String id;
    private String object;
    private boolean deleted;
}
