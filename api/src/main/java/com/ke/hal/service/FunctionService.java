package com.ke.hal.service;

import com.ke.hal.db.entity.FunctionDb;
import com.ke.hal.db.repo.FunctionRepo;
import com.ke.hal.function.FunctionInfo;
import com.ke.hal.function.FunctionOps;
import com.ke.hal.util.JacksonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Function 注册表，function 工具只给出名字时由此补全定义
 */
@Service
@Slf4j
public class FunctionService {

    @Autowired
    private FunctionRepo functionRepo;

    /**
     * 注册 function，同名时覆盖描述与参数
     */
    @Transactional
    public FunctionInfo registerFunction(String userId, FunctionOps.CreateFunctionOp op) {
        String parameters = JacksonUtils.serialize(op.getParameters() == null ? new LinkedHashMap<>() : op.getParameters());
        FunctionDb existing = functionRepo.findByName(userId, op.getName());
        if(existing != null) {
            existing.setDescription(op.getDescription());
            existing.setParameters(parameters);
            functionRepo.update(existing);
            log.info("Function {} of {} updated", op.getName(), userId);
            return convertToInfo(existing);
        }

        FunctionDb function = new FunctionDb();
        function.setUserId(userId);
        function.setName(op.getName());
        function.setDescription(op.getDescription());
        function.setParameters(parameters);
        functionRepo.insert(function);
        log.info("Function {} of {} registered", op.getName(), userId);
        return convertToInfo(function);
    }

    public List<FunctionInfo> listFunctions(String userId) {
        return functionRepo.findByUserId(userId).stream()
                .map(this::convertToInfo)
                .collect(Collectors.toList());
    }

    public FunctionInfo convertToInfo(FunctionDb db) {
        FunctionInfo info = new FunctionInfo();
        info.setId(db.getId());
        info.setName(db.getName());
        info.setDescription(db.getDescription());
        info.setParameters(JacksonUtils.deserialize(db.getParameters(), AssistantService.METADATA_TYPE));
        info.setCreatedAt(db.getCreatedAt());
        return info;
    }
}
