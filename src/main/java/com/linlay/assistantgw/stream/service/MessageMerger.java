package com.linlay.assistantgw.stream.service;

import com.linlay.assistantgw.stream.model.RunMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges a token delta onto the accumulated value of a message.
 * <p>
 * Text fragments concatenate; maps merge key by key with the same rule; lists append.
 * Values of any other shape are replaced by the delta unless they are equal.
 */
public final class MessageMerger {

    private MessageMerger() {
    }

    public static RunMessage merge(RunMessage current, RunMessage delta) {
        if (!Objects.equals(current.id(), delta.id())) {
            throw new IllegalArgumentException("cannot merge message " + delta.id() + " onto " + current.id());
        }
        return current.withContent(mergeValue(current.content(), delta.content()));
    }

    @SuppressWarnings("unchecked")
    static Object mergeValue(Object current, Object delta) {
        if (current == null) {
            return delta;
        }
        if (delta == null) {
            return current;
        }
        if (current instanceof String left && delta instanceof String right) {
            return left + right;
        }
        if (current instanceof Map<?, ?> left && delta instanceof Map<?, ?> right) {
            return mergeMaps((Map<String, Object>) left, (Map<String, Object>) right);
        }
        if (current instanceof List<?> left && delta instanceof List<?> right) {
            List<Object> merged = new ArrayList<>(left.size() + right.size());
            merged.addAll(left);
            merged.addAll(right);
            return List.copyOf(merged);
        }
        return delta;
    }

    private static Map<String, Object> mergeMaps(Map<String, Object> current, Map<String, Object> delta) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            Object existing = merged.get(entry.getKey());
            if (existing == null) {
                merged.put(entry.getKey(), entry.getValue());
            } else if (!existing.equals(entry.getValue()) || existing instanceof String) {
                merged.put(entry.getKey(), mergeValue(existing, entry.getValue()));
            }
        }
        return merged;
    }
}
