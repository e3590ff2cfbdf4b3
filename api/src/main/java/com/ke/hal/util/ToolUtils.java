package com.ke.hal.util;

import com.google.common.collect.ImmutableSet;
import com.ke.hal.common.Tool;
import com.ke.hal.exception.BadRequestException;
import org.apache.commons.collections4.CollectionUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * assistant 工具配置校验
 */
public class ToolUtils {

    private static final Pattern FUNCTION_NAME = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
    private static final Set<String> PARAMETER_LOCATIONS = ImmutableSet.of("path", "query", "header", "body");
    private static final Set<String> HTTP_METHODS = ImmutableSet.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD");

    private ToolUtils() {
    }

    /**
     * 校验工具列表，暴露给模型的函数名必须合法且不重复
     */
    public static void checkTools(List<Tool> tools) {
        if(CollectionUtils.isEmpty(tools)) {
            return;
        }
        Set<String> names = new HashSet<>();
        boolean retrieval = false;
        boolean codeInterpreter = false;
        for (Tool tool : tools) {
            if(tool == null) {
                throw new BadRequestException("tool must not be null");
            }
            if(tool instanceof Tool.ToolFunction) {
                checkName(names, ((Tool.ToolFunction) tool).getFunction().getName());
            } else if(tool instanceof Tool.ToolRetrieval) {
                if(retrieval) {
                    throw new BadRequestException("only one retrieval tool is allowed");
                }
                retrieval = true;
                checkName(names, Tool.RETRIEVAL);
            } else if(tool instanceof Tool.ToolCodeInterpreter) {
                if(codeInterpreter) {
                    throw new BadRequestException("only one code_interpreter tool is allowed");
                }
                codeInterpreter = true;
                checkName(names, Tool.CODE_INTERPRETER);
            } else if(tool instanceof Tool.ToolAction) {
                checkAction(names, ((Tool.ToolAction) tool).getAction());
            }
        }
    }

    private static void checkAction(Set<String> names, Tool.ActionDefinition action) {
        for (Tool.ActionOperation operation : action.getOperations()) {
            checkName(names, operation.getOperationId());
            if(!HTTP_METHODS.contains(operation.getMethod().toUpperCase())) {
                throw new BadRequestException("unsupported http method of operation " + operation.getOperationId()
                        + ": " + operation.getMethod());
            }
            for (Tool.ActionParameter parameter : operation.getParameters()) {
                if(!PARAMETER_LOCATIONS.contains(parameter.getIn())) {
                    throw new BadRequestException("parameter " + parameter.getName() + " of operation "
                            + operation.getOperationId() + " has unsupported location: " + parameter.getIn());
                }
                if("path".equals(parameter.getIn()) && !operation.getPath().contains("{" + parameter.getName() + "}")) {
                    throw new BadRequestException("path parameter " + parameter.getName() + " is not in path "
                            + operation.getPath());
                }
            }
        }
    }

    private static void checkName(Set<String> names, String name) {
        if(name == null || !FUNCTION_NAME.matcher(name).matches()) {
            throw new BadRequestException("invalid tool name: " + name);
        }
        if(!names.add(name)) {
            throw new BadRequestException("duplicate tool name: " + name);
        }
    }
}
