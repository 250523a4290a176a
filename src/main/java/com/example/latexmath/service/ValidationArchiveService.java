package com.example.latexmath.service;

import com.example.latexmath.config.LatexFsmProperties;
import com.example.latexmath.model.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 校验结果归档（JSONL），一行一次校验。
 * 写文件失败只记日志并返回 status=1，不影响校验结论。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidationArchiveService {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LatexFsmProperties props;
    private final ObjectMapper objectMapper;

    public Map<String, Object> archive(ValidationResult result) {
        File file = props.archiveFilePath().toFile();
        ensureArchiveDirExists(file);

        try (FileWriter writer = new FileWriter(file, StandardCharsets.UTF_8, true)) {
            writer.write(objectMapper.writeValueAsString(toRecord(result)));
            writer.write("\n");
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize validation result. input={}", result.getInput(), e);
            return Map.of("status", 1, "msg", e.getMessage());
        } catch (IOException e) {
            log.error("Failed to archive validation result. file={}", file.getAbsolutePath(), e);
            return Map.of("status", 1, "msg", e.getMessage());
        }

        return Map.of("status", 0, "file", file.getAbsolutePath());
    }

    /** 归档只保留摘要，不带完整轨迹 */
    Map<String, Object> toRecord(ValidationResult result) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("archivedAt", LocalDateTime.now().format(FORMATTER));
        record.put("input", result.getInput());
        record.put("valid", result.isValid());
        record.put("tokenCount", result.getTokenCount());
        record.put("finalState", result.getFinalState().getCode());
        record.put("failingIndex", result.getFailingIndex());
        record.put("failingToken", result.getFailingToken() == null ? null : result.getFailingToken().literal());
        record.put("error", result.getError() == null ? null : result.getError().name());
        record.put("expectedCount", result.getExpected().size());
        return record;
    }

    private void ensureArchiveDirExists(File file) {
        File parent = file.getParentFile();
        if (parent != null && !parent.exists()) {
            boolean ok = parent.mkdirs();
            if (!ok) {
                log.warn("Failed to create archive directory: {}", parent.getAbsolutePath());
            }
        }
    }
}
