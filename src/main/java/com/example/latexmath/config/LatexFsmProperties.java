package com.example.latexmath.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "latex.fsm")
public class LatexFsmProperties {

    /** 工厂创建的校验器是否记录逐步轨迹 */
    private boolean recordTrace = true;

    /** 是否把每次校验结果追加到 archiveFile（JSONL） */
    private boolean archiveEnabled = false;

    /** e.g. data/validation_history.jsonl */
    private String archiveFile = "data/validation_history.jsonl";

    /** 转移表导出位置，给画图工具用 */
    private String exportFile = "data/transition_table.json";

    /** 受约束生成：最多接受多少个词法单元 */
    private int maxGenerationSteps = 256;

    /** 受约束生成：同一步连续被拒绝的上限 */
    private int maxRetriesPerStep = 3;

    public Path archiveFilePath() {
        return Paths.get(archiveFile).toAbsolutePath().normalize();
    }

    public Path exportFilePath() {
        return Paths.get(exportFile).toAbsolutePath().normalize();
    }
}
