package com.jz.langid.model;

import com.jz.langid.common.MalformedModelException;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/** 记号 -> 特征 id 的静态表；id 唯一且稠密覆盖 0..size-1，加载后只读 */
public final class Vocabulary {
    private final Map<String, Integer> ids;
    private final String[] tokens;

    private Vocabulary(Map<String, Integer> ids, String[] tokens) {
        this.ids = ids;
        this.tokens = tokens;
    }

    public static Vocabulary of(Map<String, Integer> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new MalformedModelException("vocabulary is empty");
        }
        String[] tokens = new String[entries.size()];
        Map<String, Integer> ids = new HashMap<>(entries.size() * 2);
        for (Map.Entry<String, Integer> e : entries.entrySet()) {
            String token = e.getKey();
            Integer id = e.getValue();
            if (token == null || token.isEmpty()) {
                throw new MalformedModelException("vocabulary contains an empty token");
            }
            if (id == null || id < 0 || id >= tokens.length) {
                throw new MalformedModelException("vocabulary id out of range 0.." + (tokens.length - 1) + ": " + token + "=" + id);
            }
            if (tokens[id] != null) {
                throw new MalformedModelException("vocabulary id " + id + " used by both '" + tokens[id] + "' and '" + token + "'");
            }
            tokens[id] = token;
            ids.put(token, id);
        }
        return new Vocabulary(Map.copyOf(ids), tokens);
    }

    public OptionalInt lookup(String token) {
        Integer id = ids.get(token);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public String token(int id) {
        return tokens[id];
    }

    public int size() {
        return tokens.length;
    }
}
