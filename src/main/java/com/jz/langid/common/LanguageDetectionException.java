package com.jz.langid.common;

/** 语言识别相关异常的公共父类，全部为非受检异常 */
public class LanguageDetectionException extends RuntimeException {

    public LanguageDetectionException(String message) {
        super(message);
    }

    public LanguageDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
