package com.ke.hal.collaborator.action;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionResponse {
    private int status;
    private String body;

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
