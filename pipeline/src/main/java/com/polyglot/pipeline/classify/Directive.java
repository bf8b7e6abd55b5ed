package com.polyglot.pipeline.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code polyglot:} or {@code kyozo:} instruction carried by an HTML comment.
 *
 * <pre>
 *   &lt;!-- polyglot:type=manifest --&gt;            name=type, value=manifest
 *   &lt;!-- polyglot:executable --&gt;               name=executable, value=null (flag)
 *   &lt;!-- kyozo:deploy environment=prod --&gt;     name=deploy, params={environment=prod}
 *   &lt;!-- kyozo:{"executable": true} --&gt;        name=json, params={executable=true}
 * </pre>
 *
 * @param line    first line of the comment
 * @param endLine last line of the comment
 */
public record Directive(
        String              namespace,
        String              name,
        String              value,
        Map<String, Object> params,
        int                 line,
        int                 endLine) {

    public static final String POLYGLOT = "polyglot";
    public static final String KYOZO    = "kyozo";

    public Directive {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /** The value, or {@code true} for a bare flag. */
    public Object valueOrTrue() {
        return value == null ? Boolean.TRUE : value;
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("namespace", namespace);
        map.put("name", name);
        if (value != null) {
            map.put("value", value);
        }
        if (!params.isEmpty()) {
            map.put("params", params);
        }
        map.put("line", line);
        return map;
    }
}
