package com.jz.langid.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "langid.classify")
public class ClassifyProperties {

    /** 只取前 N 个字符参与识别，0 表示不截断 */
    private int maxChars = 100_000;

    /** 批量接口单次最多条数 */
    private int batchMaxSize = 64;
}
