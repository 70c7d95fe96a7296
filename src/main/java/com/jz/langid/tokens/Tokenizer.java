package com.jz.langid.tokens;


import java.util.ArrayList;
import java.util.List;

public interface Tokenizer {

    /** 单个记号（single），按原文从左到右 */
    List<String> singles(String text);

    /**
     * 完整记号序列：先全部 single，再全部相邻二元组（两个 single 用一个空格连接）。
     * 没有 single 时两组都为空。
     */
    default List<String> tokenize(String text) {
        List<String> singles = singles(text);
        if (singles.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(singles.size() * 2 - 1);
        out.addAll(singles);
        for (int i = 1; i < singles.size(); i++) {
            out.add(singles.get(i - 1) + ' ' + singles.get(i));
        }
        return out;
    }
}
