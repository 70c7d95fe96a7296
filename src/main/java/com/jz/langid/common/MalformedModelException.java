package com.jz.langid.common;

/** 模型文件读不出来、解析失败或不满足结构约束。致命错误，不能带着坏模型继续服务。 */
public class MalformedModelException extends LanguageDetectionException {

    public MalformedModelException(String message) {
        super(message);
    }

    public MalformedModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
