package com.jz.langid.common;

/**
 * 输入切不出任何记号（空串、纯空白）。
 * 此时词频增量 1000/T 没有定义，直接拒绝，不返回任何语言。
 */
public class EmptyInputException extends LanguageDetectionException {

    public EmptyInputException(String message) {
        super(message);
    }
}
