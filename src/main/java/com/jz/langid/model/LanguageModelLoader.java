package com.jz.langid.model;


import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.langid.common.MalformedModelException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析离线训练产出的模型 JSON：
 * <pre>
 * {
 *   "vocabulary": [["def", 0], ...],
 *   "forest":     [node, ...],
 *   "labels":     [[0, "ada"], ...]
 * }
 * node = [featureId, threshold, left, right]  内部节点
 *      | [labelId, weight]                     叶子
 * </pre>
 * 任何一处不满足约束都抛 {@link MalformedModelException}，不做部分加载。
 */
@Slf4j
@Component
public class LanguageModelLoader {
    private final ObjectMapper om = new ObjectMapper();

    public LanguageModel load(Resource resource) {
        String source = resource.getDescription();
        if (!resource.exists()) {
            throw new MalformedModelException("model resource not found: " + source);
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(om.readTree(in), source);
        } catch (IOException e) {
            throw new MalformedModelException("cannot read model " + source + ": " + e.getMessage(), e);
        }
    }

    public LanguageModel parse(String json, String source) {
        try {
            return parse(om.readTree(json), source);
        } catch (IOException e) {
            throw new MalformedModelException("cannot parse model " + source + ": " + e.getMessage(), e);
        }
    }

    private LanguageModel parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new MalformedModelException("model root must be an object: " + source);
        }
        Vocabulary vocabulary = Vocabulary.of(readVocabulary(section(root, "vocabulary")));
        LabelTable labels = LabelTable.of(readLabels(section(root, "labels")));

        JsonNode forestNode = section(root, "forest");
        if (forestNode.isEmpty()) throw new MalformedModelException("forest has no trees");
        List<DecisionTree> trees = new ArrayList<>(forestNode.size());
        for (int i = 0; i < forestNode.size(); i++) {
            trees.add(new DecisionTree(readNode(forestNode.get(i), vocabulary, labels, "forest[" + i + "]")));
        }
        log.debug("parsed model {}: vocabulary={}, trees={}, labels={}",
                source, vocabulary.size(), trees.size(), labels.size());
        return new LanguageModel(vocabulary, new Forest(trees), labels, source);
    }

    private static JsonNode section(JsonNode root, String name) {
        JsonNode n = root.get(name);
        if (n == null || !n.isArray()) {
            throw new MalformedModelException("model section '" + name + "' missing or not an array");
        }
        return n;
    }

    private static Map<String, Integer> readVocabulary(JsonNode arr) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (int i = 0; i < arr.size(); i++) {
            JsonNode e = pair(arr.get(i), "vocabulary[" + i + "]");
            if (!e.get(0).isTextual() || !e.get(1).isIntegralNumber()) {
                throw new MalformedModelException("vocabulary[" + i + "] must be [token, id]");
            }
            String token = e.get(0).textValue();
            if (out.put(token, e.get(1).intValue()) != null) {
                throw new MalformedModelException("duplicate vocabulary token: " + token);
            }
        }
        return out;
    }

    private static Map<Integer, String> readLabels(JsonNode arr) {
        Map<Integer, String> out = new LinkedHashMap<>();
        for (int i = 0; i < arr.size(); i++) {
            JsonNode e = pair(arr.get(i), "labels[" + i + "]");
            if (!e.get(0).isIntegralNumber() || !e.get(1).isTextual()) {
                throw new MalformedModelException("labels[" + i + "] must be [id, symbol]");
            }
            int id = e.get(0).intValue();
            if (out.put(id, e.get(1).textValue()) != null) {
                throw new MalformedModelException("duplicate label id: " + id);
            }
        }
        return out;
    }

    private static JsonNode pair(JsonNode e, String path) {
        if (e == null || !e.isArray() || e.size() != 2) {
            throw new MalformedModelException(path + " must be a 2-element array");
        }
        return e;
    }

    private static TreeNode readNode(JsonNode n, Vocabulary vocabulary, LabelTable labels, String path) {
        if (n == null || !n.isArray()) {
            throw new MalformedModelException(path + " is not an array");
        }
        return switch (n.size()) {
            case 4 -> {
                JsonNode f = n.get(0), t = n.get(1);
                if (!f.isIntegralNumber() || !t.isNumber()) {
                    throw new MalformedModelException(path + " internal node must be [featureId, threshold, left, right]");
                }
                int featureId = f.intValue();
                if (featureId < 0 || featureId >= vocabulary.size()) {
                    throw new MalformedModelException(path + " feature id out of range: " + featureId);
                }
                yield new TreeNode.Internal(featureId, t.doubleValue(),
                        readNode(n.get(2), vocabulary, labels, path + ".L"),
                        readNode(n.get(3), vocabulary, labels, path + ".R"));
            }
            case 2 -> {
                JsonNode l = n.get(0), w = n.get(1);
                if (!l.isIntegralNumber() || !w.isNumber()) {
                    throw new MalformedModelException(path + " leaf must be [labelId, weight]");
                }
                int labelId = l.intValue();
                if (!labels.contains(labelId)) {
                    throw new MalformedModelException(path + " leaf references unknown label id " + labelId);
                }
                double weight = w.doubleValue();
                if (!Double.isFinite(weight)) {
                    throw new MalformedModelException(path + " leaf weight is not finite");
                }
                yield new TreeNode.Leaf(labelId, weight);
            }
            default -> throw new MalformedModelException(path + " has " + n.size() + " fields, expected 4 (internal) or 2 (leaf)");
        };
    }
}
