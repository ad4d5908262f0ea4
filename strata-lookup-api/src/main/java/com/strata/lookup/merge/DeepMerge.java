package com.strata.lookup.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Recursive merge of a higher-priority {@code source} into a lower-priority {@code dest}.
 * <ul>
 *   <li>map + map: entries merged key by key, source wins on conflicts</li>
 *   <li>list + list: union, dest elements first</li>
 *   <li>anything else: source replaces dest</li>
 * </ul>
 * With a knockout prefix, a string map value starting with the prefix removes the key, and a list
 * element {@code prefix + x} removes {@code x} from the destination list.
 */
final class DeepMerge {

    private static final Logger log = LoggerFactory.getLogger(DeepMerge.class);

    private final String knockoutPrefix;
    private final boolean mergeHashArrays;
    private final boolean sortMergeArrays;
    private final boolean debug;

    DeepMerge(String knockoutPrefix, boolean mergeHashArrays, boolean sortMergeArrays, boolean debug) {
        this.knockoutPrefix = knockoutPrefix != null && !knockoutPrefix.isEmpty() ? knockoutPrefix : null;
        this.mergeHashArrays = mergeHashArrays;
        this.sortMergeArrays = sortMergeArrays;
        this.debug = debug;
    }

    /**
     * @param source higher priority value (not modified)
     * @param dest   lower priority value; modified in place when it is a map or list
     * @return merged value
     */
    @SuppressWarnings("unchecked")
    Object merge(Object source, Object dest) {
        if (debug) {
            log.debug("deep merge source={} dest={}", source, dest);
        }
        if (source == null) {
            return dest;
        }
        if (source instanceof Map && dest instanceof Map) {
            return mergeMaps((Map<Object, Object>) source, (Map<Object, Object>) dest);
        }
        if (source instanceof List && dest instanceof List) {
            return mergeLists((List<Object>) source, (List<Object>) dest);
        }
        return stripKnockouts(deepCopy(source));
    }

    private Map<Object, Object> mergeMaps(Map<Object, Object> source, Map<Object, Object> dest) {
        for (Map.Entry<Object, Object> e : source.entrySet()) {
            Object key = e.getKey();
            Object value = e.getValue();
            if (isKnockout(value)) {
                dest.remove(key);
                continue;
            }
            if (dest.containsKey(key)) {
                dest.put(key, merge(value, dest.get(key)));
            } else {
                dest.put(key, stripKnockouts(deepCopy(value)));
            }
        }
        return dest;
    }

    private List<Object> mergeLists(List<Object> source, List<Object> dest) {
        List<Object> additions = new ArrayList<>(source.size());
        List<Object> result = new ArrayList<>(dest);
        for (Object element : source) {
            if (knockoutPrefix != null && element instanceof String && ((String) element).startsWith(knockoutPrefix)) {
                String knocked = ((String) element).substring(knockoutPrefix.length());
                if (knocked.isEmpty()) {
                    result.clear();
                } else {
                    result.removeIf(knocked::equals);
                }
            } else {
                additions.add(element);
            }
        }
        if (mergeHashArrays && allMaps(result) && allMaps(additions)) {
            result = mergeIndexWise(additions, result);
        } else {
            LinkedHashSet<Object> union = new LinkedHashSet<>(result);
            for (Object element : additions) {
                union.add(stripKnockouts(deepCopy(element)));
            }
            result = new ArrayList<>(union);
        }
        if (sortMergeArrays) {
            result.sort(ORDER);
        }
        return result;
    }

    private List<Object> mergeIndexWise(List<Object> source, List<Object> dest) {
        List<Object> result = new ArrayList<>(Math.max(source.size(), dest.size()));
        Iterator<Object> d = dest.iterator();
        for (Object s : source) {
            result.add(d.hasNext() ? merge(s, d.next()) : stripKnockouts(deepCopy(s)));
        }
        while (d.hasNext()) {
            result.add(d.next());
        }
        return result;
    }

    private static boolean allMaps(List<Object> list) {
        for (Object o : list) {
            if (!(o instanceof Map)) return false;
        }
        return true;
    }

    private boolean isKnockout(Object value) {
        return knockoutPrefix != null && value instanceof String && ((String) value).startsWith(knockoutPrefix);
    }

    @SuppressWarnings("unchecked")
    private Object stripKnockouts(Object value) {
        if (knockoutPrefix == null) {
            return value;
        }
        if (value instanceof Map) {
            ((Map<Object, Object>) value).values().removeIf(this::isKnockout);
            for (Map.Entry<Object, Object> e : ((Map<Object, Object>) value).entrySet()) {
                e.setValue(stripKnockouts(e.getValue()));
            }
        } else if (value instanceof List) {
            ((List<Object>) value).removeIf(o -> o instanceof String && ((String) o).startsWith(knockoutPrefix));
        }
        return value;
    }

    /** Copies nested maps and lists so merging never mutates data held by a provider cache. */
    static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                copy.put(e.getKey(), deepCopy(e.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>(((List<?>) value).size());
            for (Object element : (List<?>) value) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static final Comparator<Object> ORDER = (a, b) -> {
        if (a instanceof Comparable && b != null && a.getClass() == b.getClass()) {
            return ((Comparable) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    };
}
