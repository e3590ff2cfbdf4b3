package com.ke.hal.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Run 失败原因
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LastError {
    private String code;
    private String message;
}
