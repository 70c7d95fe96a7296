package com.jz.langid.common;

import lombok.Getter;

/** 标签表里查不到的 label id；模型校验通过后不应出现，属于数据缺陷 */
@Getter
public class UnknownLabelException extends LanguageDetectionException {

    private final int labelId;

    public UnknownLabelException(int labelId) {
        super("unknown label id: " + labelId);
        this.labelId = labelId;
    }
}
