package com.ke.hal.core.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelResponse {
    private String text;
    private List<ToolInvocation> toolInvocations = new ArrayList<>();

    public static ModelResponse text(String text) {
        return new ModelResponse(text, new ArrayList<>());
    }

    public static ModelResponse toolCalls(List<ToolInvocation> invocations) {
        return new ModelResponse(null, invocations);
    }

    public boolean hasToolInvocations() {
        return CollectionUtils.isNotEmpty(toolInvocations);
    }
}
