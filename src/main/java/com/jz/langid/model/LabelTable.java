package com.jz.langid.model;

import com.jz.langid.common.MalformedModelException;
import com.jz.langid.common.UnknownLabelException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** label id <-> 语言名，一一对应。按 id 直接下标访问 */
public final class LabelTable {
    /** id 直接当数组下标，上限防止坏模型撑爆内存 */
    static final int MAX_LABEL_ID = 65_535;

    private final String[] byId;
    private final int size;

    private LabelTable(String[] byId, int size) {
        this.byId = byId;
        this.size = size;
    }

    public static LabelTable of(Map<Integer, String> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new MalformedModelException("label table is empty");
        }
        int maxId = -1;
        for (Integer id : entries.keySet()) {
            if (id == null || id < 0) throw new MalformedModelException("negative label id: " + id);
            if (id > MAX_LABEL_ID) throw new MalformedModelException("label id too large: " + id + " > " + MAX_LABEL_ID);
            maxId = Math.max(maxId, id);
        }
        String[] byId = new String[maxId + 1];
        Set<String> symbols = new HashSet<>();
        for (Map.Entry<Integer, String> e : entries.entrySet()) {
            String symbol = e.getValue();
            if (symbol == null || symbol.isBlank()) {
                throw new MalformedModelException("label " + e.getKey() + " has no symbol");
            }
            if (!symbols.add(symbol)) {
                throw new MalformedModelException("label symbol used twice: " + symbol);
            }
            byId[e.getKey()] = symbol;
        }
        return new LabelTable(byId, entries.size());
    }

    public boolean contains(int labelId) {
        return labelId >= 0 && labelId < byId.length && byId[labelId] != null;
    }

    public String resolve(int labelId) {
        if (!contains(labelId)) throw new UnknownLabelException(labelId);
        return byId[labelId];
    }

    /** 数组下标上限（maxId + 1），用于按 id 开稠密数组 */
    public int capacity() {
        return byId.length;
    }

    public int size() {
        return size;
    }

    /** 按 id 升序的全部语言名 */
    public List<String> symbols() {
        List<String> out = new ArrayList<>(size);
        for (String s : byId) if (s != null) out.add(s);
        return out;
    }
}
