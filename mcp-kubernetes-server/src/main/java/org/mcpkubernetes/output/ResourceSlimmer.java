package org.mcpkubernetes.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drops verbose fields from resources.
 * <p>
 * Paths are dot-separated. {@code [*]} after a segment addresses every element of a list and
 * {@code [key]} addresses a map entry whose key may itself contain dots, e.g.
 * {@code metadata.annotations[kubectl.kubernetes.io/last-applied-configuration]}.
 */
public final class ResourceSlimmer {

    private final List<List<String>> paths;

    public ResourceSlimmer(List<String> excludedFields) {
        this.paths = excludedFields.stream().map(ResourceSlimmer::tokenize).toList();
    }

    public Map<String, Object> slim(Map<String, Object> resource) {
        Map<String, Object> copy = JsonMaps.deepCopy(resource);
        paths.forEach(path -> remove(copy, path, 0));
        return copy;
    }

    private static void remove(Object node, List<String> path, int index) {
        String segment = path.get(index);
        boolean last = index == path.size() - 1;
        if ("*".equals(segment)) {
            if (node instanceof List<?> list) {
                list.forEach(element -> {
                    if (!last) {
                        remove(element, path, index + 1);
                    }
                });
            }
            return;
        }
        JsonMaps.map(node).ifPresent(map -> {
            if (last) {
                map.remove(segment);
            } else if (map.containsKey(segment)) {
                remove(map.get(segment), path, index + 1);
            }
        });
    }

    static List<String> tokenize(String path) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                flush(tokens, current);
                i++;
            } else if (c == '[') {
                flush(tokens, current);
                int end = path.indexOf(']', i);
                if (end < 0) {
                    throw new IllegalArgumentException("unterminated '[' in field path " + path);
                }
                tokens.add(path.substring(i + 1, end));
                i = end + 1;
            } else {
                current.append(c);
                i++;
            }
        }
        flush(tokens, current);
        return List.copyOf(tokens);
    }

    private static void flush(List<String> tokens, StringBuilder current) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
