package com.ke.hal.controller;

import com.ke.hal.common.CommonPage;
import com.ke.hal.context.UserContext;
import com.ke.hal.function.FunctionInfo;
import com.ke.hal.function.FunctionOps;
import com.ke.hal.service.FunctionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;

/**
 * Function 注册表
 */
@RestController
@RequestMapping("/v1/functions")
public class FunctionController {

    @Autowired
    private FunctionService functionService;

    @PostMapping
    public FunctionInfo registerFunction(@Valid @RequestBody FunctionOps.CreateFunctionOp request) {
        return functionService.registerFunction(UserContext.getUserId(), request);
    }

    @GetMapping
    public CommonPage<FunctionInfo> listFunctions() {
        return PageUtils.toPage(functionService.listFunctions(UserContext.getUserId()), Integer.MAX_VALUE, FunctionInfo::getId);
    }
}
