package com.jz.langid.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "langid.model")
public class ModelProperties {

    /** 模型文件位置，Spring Resource 写法（classpath:/file:） */
    private String location = "classpath:model/language-model.json";

    /** 启动时就加载；模型坏了直接启动失败。关掉则首次调用时再加载 */
    private boolean eagerLoad = true;
}
