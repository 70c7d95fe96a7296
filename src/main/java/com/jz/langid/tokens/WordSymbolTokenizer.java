package com.jz.langid.tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单词串：ASCII 字母/数字/下划线的最长连续段；
 * 符号串：既不是上述字符也不是空白的最长连续段（非 ASCII 字母也算符号）。
 * 空白只做分隔，不产出记号。
 */
public class WordSymbolTokenizer implements Tokenizer {
    private static final Pattern SINGLE = Pattern.compile("[A-Za-z0-9_]+|[^A-Za-z0-9_\\s]+");

    @Override
    public List<String> singles(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        Matcher m = SINGLE.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }
}
