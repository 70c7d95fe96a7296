package com.jz.langid.service;

import com.jz.langid.classify.ClassificationResult;

import java.io.Reader;
import java.util.List;

/**
 * 对外的识别入口（编辑器插件、命令行、HTTP 接口都走这里）。
 * 空输入抛 EmptyInputException，不会悄悄返回一个语言。
 * <p>
 * 所有识别方法只看前 {@code langid.classify.max-chars} 个字符（默认 100000，0 表示不截断），
 * 超长文本的结果因此取决于该配置。截断不会切开代理对。
 */
public interface LanguageDetectService {

    /** 文本 -> 语言名；只识别前 max-chars 个字符 */
    String classifyText(String text);

    /** 读完整个缓冲区再识别；不关闭传入的 Reader */
    String classifyBuffer(Reader source);

    /** 带投票明细的识别结果 */
    ClassificationResult detect(String text);

    /** 并行识别多段文本，结果顺序与输入一致；任一条为空则整批失败 */
    List<ClassificationResult> detectBatch(List<String> texts);

    /** 模型可能输出的全部语言名，按 label id 升序 */
    List<String> labels();
}
