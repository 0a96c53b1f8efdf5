package service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.SimulationConfig;
import model.dto.request.SimulationConfigReq;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从分段式 JSON 装载仿真配置，缺失字段保持缺省值
 * 只负责解析，合法性由 SimulationConfigValidator 判断
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationConfigLoader {

    private final ObjectMapper objectMapper;

    public SimulationConfig fromJson(String json) {
        try {
            SimulationConfigReq req = objectMapper.readValue(json, SimulationConfigReq.class);
            if (req == null) {
                return SimulationConfig.defaults();
            }
            return req.toConfig();
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCodes.CONFIG_FILE_INVALID + ": " + e.getOriginalMessage(), e);
        }
    }

    public SimulationConfig fromFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BusinessException(ErrorCodes.CONFIG_FILE_NOT_FOUND + ": " + path);
        }
        try {
            log.info("读取仿真配置: {}", path);
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new BusinessException(ErrorCodes.CONFIG_FILE_INVALID + ": " + path, e);
        }
    }

    public String toJson(SimulationConfig config) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(SimulationConfigReq.from(config));
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCodes.SYSTEM_ERROR + ": " + e.getOriginalMessage(), e);
        }
    }
}
