package com.jz.langid.model;

/** 加载完成的只读模型句柄，分类时显式传入 */
public record LanguageModel(Vocabulary vocabulary, Forest forest, LabelTable labels, String source) {
}
